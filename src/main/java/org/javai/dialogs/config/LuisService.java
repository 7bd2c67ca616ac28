package org.javai.dialogs.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection settings of a LUIS-style intent recognition service.
 *
 * <p>The authoring and subscription keys are secrets; {@link #encrypt(String)} and
 * {@link #decrypt(String)} transform them with {@link SecretCipher} and leave empty
 * keys untouched.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class LuisService extends ConnectedService {

	@JsonProperty("appId")
	private String appId;

	@JsonProperty("authoringKey")
	private String authoringKey;

	@JsonProperty("subscriptionKey")
	private String subscriptionKey;

	@JsonProperty("version")
	private String version;

	@JsonProperty("region")
	private String region;

	public LuisService() {
		super(ServiceType.LUIS);
	}

	public String getAppId() {
		return appId;
	}

	public void setAppId(String appId) {
		this.appId = appId;
	}

	public String getAuthoringKey() {
		return authoringKey;
	}

	public void setAuthoringKey(String authoringKey) {
		this.authoringKey = authoringKey;
	}

	public String getSubscriptionKey() {
		return subscriptionKey;
	}

	public void setSubscriptionKey(String subscriptionKey) {
		this.subscriptionKey = subscriptionKey;
	}

	public String getVersion() {
		return version;
	}

	public void setVersion(String version) {
		this.version = version;
	}

	public String getRegion() {
		return region;
	}

	public void setRegion(String region) {
		this.region = region;
	}

	/**
	 * Base URL of the regional prediction endpoint.
	 *
	 * @throws IllegalStateException if no region is set
	 */
	@JsonIgnore
	public String getEndpoint() {
		if (region == null || region.isBlank()) {
			throw new IllegalStateException("LUIS service '" + getName() + "' has no region");
		}
		return "https://" + region + ".api.cognitive.microsoft.com";
	}

	@Override
	public void encrypt(String secret) {
		super.encrypt(secret);
		if (authoringKey != null && !authoringKey.isEmpty()) {
			authoringKey = SecretCipher.encrypt(authoringKey, secret);
		}
		if (subscriptionKey != null && !subscriptionKey.isEmpty()) {
			subscriptionKey = SecretCipher.encrypt(subscriptionKey, secret);
		}
	}

	@Override
	public void decrypt(String secret) {
		super.decrypt(secret);
		if (authoringKey != null && !authoringKey.isEmpty()) {
			authoringKey = SecretCipher.decrypt(authoringKey, secret);
		}
		if (subscriptionKey != null && !subscriptionKey.isEmpty()) {
			subscriptionKey = SecretCipher.decrypt(subscriptionKey, secret);
		}
	}
}
