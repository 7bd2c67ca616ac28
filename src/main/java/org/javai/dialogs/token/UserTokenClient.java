package org.javai.dialogs.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Client of the user token service that stores OAuth tokens on behalf of a bot's users.
 *
 * <p>Only HTTPS endpoints are accepted. Non-OK responses are not errors here: they
 * map to {@code null}, {@code false} or an empty string depending on the call.
 * Transport failures propagate as {@link org.springframework.web.client.ResourceAccessException}.</p>
 */
public class UserTokenClient {

	private static final Logger logger = LoggerFactory.getLogger(UserTokenClient.class);

	private final String baseUri;
	private final RestTemplate restTemplate;
	private final AppCredentials credentials;
	private final ObjectMapper objectMapper;

	public UserTokenClient(String baseUri, RestTemplate restTemplate) {
		this(baseUri, restTemplate, null);
	}

	/**
	 * @param baseUri root of the token service, must be an https URI
	 * @param restTemplate transport
	 * @param credentials optional bearer token supplier
	 * @throws IllegalArgumentException if {@code baseUri} is not an https URI
	 */
	public UserTokenClient(String baseUri, RestTemplate restTemplate, AppCredentials credentials) {
		if (!isHttps(baseUri)) {
			throw new IllegalArgumentException("Please supply a valid https uri");
		}
		this.baseUri = baseUri;
		this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate must not be null");
		this.credentials = credentials;
		this.objectMapper = new ObjectMapper()
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
	}

	/**
	 * Fetches the user's token for a connection, redeeming {@code magicCode} if given.
	 *
	 * @return the token, or {@code null} if the service has none or answered unexpectedly
	 */
	public TokenResponse getUserToken(String userId, String connectionName, String magicCode) {
		requireText(userId, "userId");
		requireText(connectionName, "connectionName");
		Map<String, String> query = new LinkedHashMap<>();
		query.put("userId", userId);
		query.put("connectionName", connectionName);
		if (hasText(magicCode)) {
			query.put("code", magicCode);
		}
		ResponseEntity<String> response = exchange(HttpMethod.GET, uri(query, "api", "usertoken", "GetToken"));
		if (response == null || !isOk(response)) {
			return null;
		}
		return read(response.getBody(), new TypeReference<TokenResponse>() {});
	}

	/**
	 * Signs the user out of one connection, or of all connections when
	 * {@code connectionName} is null.
	 *
	 * @return true only if the service answered OK
	 */
	public boolean signOutUser(String userId, String connectionName) {
		requireText(userId, "userId");
		Map<String, String> query = new LinkedHashMap<>();
		query.put("userId", userId);
		if (hasText(connectionName)) {
			query.put("connectionName", connectionName);
		}
		ResponseEntity<String> response = exchange(HttpMethod.DELETE, uri(query, "api", "usertoken", "SignOut"));
		return response != null && isOk(response);
	}

	/**
	 * @return the sign-in URL, or an empty string if the service did not answer OK
	 */
	public String getSignInLink(String state, String finalRedirect) {
		requireText(state, "state");
		Map<String, String> query = new LinkedHashMap<>();
		query.put("state", state);
		if (hasText(finalRedirect)) {
			query.put("finalRedirect", finalRedirect);
		}
		ResponseEntity<String> response = exchange(HttpMethod.GET, uri(query, "api", "botsignin", "getsigninurl"));
		if (response == null || !isOk(response) || response.getBody() == null) {
			return "";
		}
		return response.getBody();
	}

	/**
	 * Token status of every connection of the user, optionally filtered.
	 *
	 * @param includeFilter comma-separated connection names, or null for all
	 * @return the statuses, or {@code null} if the service did not answer OK
	 */
	public List<TokenStatus> getTokenStatus(String userId, String includeFilter) {
		requireText(userId, "userId");
		Map<String, String> query = new LinkedHashMap<>();
		query.put("userId", userId);
		if (hasText(includeFilter)) {
			query.put("include", includeFilter);
		}
		ResponseEntity<String> response = exchange(HttpMethod.GET, uri(query, "api", "usertoken", "gettokenstatus"));
		if (response == null || !isOk(response)) {
			return null;
		}
		return read(response.getBody(), new TypeReference<List<TokenStatus>>() {});
	}

	/**
	 * Tells the service whether to emulate OAuth cards for this bot.
	 */
	public void sendEmulateOAuthCards(boolean emulate) {
		Map<String, String> query = new LinkedHashMap<>();
		query.put("emulate", Boolean.toString(emulate));
		exchange(HttpMethod.POST, uri(query, "api", "usertoken", "emulateOAuthCards"));
	}

	private ResponseEntity<String> exchange(HttpMethod method, URI uri) {
		HttpHeaders headers = new HttpHeaders();
		if (credentials != null) {
			String token = credentials.accessToken();
			if (hasText(token)) {
				headers.setBearerAuth(token);
			}
		}
		try {
			return restTemplate.exchange(uri, method, new HttpEntity<>(headers), String.class);
		}
		catch (HttpStatusCodeException e) {
			logger.warn("Token service {} {} answered {}", method, uri.getPath(), e.getStatusCode().value());
			return null;
		}
	}

	private URI uri(Map<String, String> query, String... pathSegments) {
		UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUri).pathSegment(pathSegments);
		query.keySet().forEach(name -> builder.queryParam(name, "{" + name + "}"));
		return builder.encode().buildAndExpand(query).toUri();
	}

	private <T> T read(String body, TypeReference<T> type) {
		if (body == null || body.isBlank()) {
			return null;
		}
		try {
			return objectMapper.readValue(body, type);
		}
		catch (JsonProcessingException e) {
			logger.warn("Token service returned an unreadable body: {}", e.getOriginalMessage());
			return null;
		}
	}

	private static boolean isOk(ResponseEntity<?> response) {
		if (response.getStatusCode().value() == HttpStatus.OK.value()) {
			return true;
		}
		logger.warn("Token service answered {}", response.getStatusCode().value());
		return false;
	}

	private static boolean isHttps(String uri) {
		if (uri == null || uri.isBlank()) {
			return false;
		}
		try {
			URI parsed = URI.create(uri);
			return "https".equalsIgnoreCase(parsed.getScheme()) && parsed.getHost() != null;
		}
		catch (IllegalArgumentException e) {
			return false;
		}
	}

	private static boolean hasText(String value) {
		return value != null && !value.isBlank();
	}

	private static void requireText(String value, String name) {
		if (!hasText(value)) {
			throw new IllegalArgumentException(name + " must not be blank");
		}
	}
}
