package org.javai.dialogs.token;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Whether a user holds a token for one connection.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TokenStatus(
		@JsonProperty("channelId") String channelId,
		@JsonProperty("connectionName") String connectionName,
		@JsonProperty("hasToken") boolean hasToken,
		@JsonProperty("serviceProviderDisplayName") String serviceProviderDisplayName
) {
}
