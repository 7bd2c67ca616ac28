package org.javai.dialogs.token;

/**
 * Supplies the bearer token the bot authenticates to the token service with.
 */
@FunctionalInterface
public interface AppCredentials {

	/**
	 * The current access token; {@code null} or blank sends the request unauthenticated.
	 */
	String accessToken();
}
