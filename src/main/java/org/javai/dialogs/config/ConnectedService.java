package org.javai.dialogs.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A service the bot is connected to, as stored in the bot configuration.
 *
 * <p>Subclasses holding secrets override {@link #encrypt(String)} and
 * {@link #decrypt(String)} to transform exactly those fields in place.</p>
 */
public abstract class ConnectedService {

	@JsonProperty(value = "type", access = JsonProperty.Access.READ_ONLY)
	private final ServiceType type;

	@JsonProperty("name")
	private String name;

	@JsonProperty("id")
	private String id;

	protected ConnectedService(ServiceType type) {
		if (type == null) {
			throw new IllegalArgumentException("type must not be null");
		}
		this.type = type;
	}

	public ServiceType getType() {
		return type;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getId() {
		return id;
	}

	public void setId(String id) {
		this.id = id;
	}

	/**
	 * Encrypts the secret fields of this service with the given key.
	 */
	public void encrypt(String secret) {
	}

	/**
	 * Reverses {@link #encrypt(String)}.
	 */
	public void decrypt(String secret) {
	}
}
