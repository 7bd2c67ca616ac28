package org.javai.dialogs.token;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A user token issued by the token service.
 *
 * @param channelId channel the token was issued for
 * @param connectionName the OAuth connection
 * @param token the access token
 * @param expiration expiration as reported by the service (ISO-8601 text)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenResponse(
		@JsonProperty("channelId") String channelId,
		@JsonProperty("connectionName") String connectionName,
		@JsonProperty("token") String token,
		@JsonProperty("expiration") String expiration
) {
}
