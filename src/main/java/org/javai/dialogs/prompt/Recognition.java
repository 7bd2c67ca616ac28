package org.javai.dialogs.prompt;

import java.util.Optional;

/**
 * Result of reading a typed value out of the raw turn text.
 *
 * @param value the recognized value, {@code null} when nothing was recognized
 * @param <T> the value type
 */
public record Recognition<T>(T value) {

	private static final Recognition<?> NOT_RECOGNIZED = new Recognition<>(null);

	public static <T> Recognition<T> recognized(T value) {
		if (value == null) {
			throw new IllegalArgumentException("recognized value must not be null");
		}
		return new Recognition<>(value);
	}

	@SuppressWarnings("unchecked")
	public static <T> Recognition<T> notRecognized() {
		return (Recognition<T>) NOT_RECOGNIZED;
	}

	public boolean isRecognized() {
		return value != null;
	}

	public Optional<T> asOptional() {
		return Optional.ofNullable(value);
	}
}
