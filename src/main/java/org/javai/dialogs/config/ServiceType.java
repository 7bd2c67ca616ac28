package org.javai.dialogs.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;

/**
 * Kinds of connected service a bot configuration can describe.
 */
public enum ServiceType {
	LUIS("luis"),
	ENDPOINT("endpoint"),
	GENERIC("generic");

	private final String value;

	ServiceType(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	@JsonCreator
	public static ServiceType fromValue(String value) {
		return Arrays.stream(values())
				.filter(type -> type.value.equalsIgnoreCase(value))
				.findFirst()
				.orElseThrow(() -> new IllegalArgumentException("Unknown service type: " + value));
	}
}
