package org.javai.dialogs.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads a {@link DialogEngineConfig} from YAML.
 *
 * <p>Settings live under a top-level {@code dialogs} mapping; missing settings keep
 * their defaults:</p>
 * <pre>
 * dialogs:
 *   cancel-keyword: cancel
 *   intent-threshold: 0.2
 *   fallback-intent: None
 *   messages:
 *     welcome: Hi!
 *     cancelled: Ok... Cancelled
 *     nothing-to-cancel: Nothing to cancel.
 * </pre>
 */
public class DialogEngineConfigLoader {

	private final Yaml yaml = new Yaml();

	public DialogEngineConfig load(InputStream inputStream) {
		try {
			Object data = yaml.load(inputStream);
			return build(data);
		} catch (ConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new ConfigurationException("Failed to read dialog engine configuration", e);
		}
	}

	public DialogEngineConfig loadString(String yamlContent) {
		try {
			Object data = yaml.load(yamlContent);
			return build(data);
		} catch (ConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new ConfigurationException("Failed to read dialog engine configuration", e);
		}
	}

	/**
	 * Loads a classpath resource, e.g. {@code dialogs.yaml}.
	 *
	 * @throws ConfigurationException if the resource does not exist or cannot be parsed
	 */
	public DialogEngineConfig loadResource(String resource) {
		ClassLoader classLoader = DialogEngineConfigLoader.class.getClassLoader();
		try (InputStream in = classLoader.getResourceAsStream(resource)) {
			if (in == null) {
				throw new ConfigurationException("Configuration resource not found: " + resource);
			}
			return load(in);
		} catch (IOException e) {
			throw new ConfigurationException("Failed to read configuration resource: " + resource, e);
		}
	}

	private DialogEngineConfig build(Object data) {
		DialogEngineConfig.Builder builder = DialogEngineConfig.builder();
		if (data == null) {
			return builder.build();
		}
		Map<String, Object> root = asMap(data, "root");
		Object section = root.get("dialogs");
		if (section == null) {
			return builder.build();
		}
		Map<String, Object> dialogs = asMap(section, "dialogs");

		String cancelKeyword = string(dialogs, "cancel-keyword");
		if (cancelKeyword != null) {
			builder.cancelKeyword(cancelKeyword);
		}
		Object threshold = dialogs.get("intent-threshold");
		if (threshold != null) {
			if (!(threshold instanceof Number number)) {
				throw new ConfigurationException("intent-threshold must be a number, got: " + threshold);
			}
			builder.intentThreshold(number.doubleValue());
		}
		String fallbackIntent = string(dialogs, "fallback-intent");
		if (fallbackIntent != null) {
			builder.fallbackIntent(fallbackIntent);
		}

		Object messagesSection = dialogs.get("messages");
		if (messagesSection != null) {
			Map<String, Object> messages = asMap(messagesSection, "messages");
			String welcome = string(messages, "welcome");
			if (welcome != null) {
				builder.welcomeMessage(welcome);
			}
			String cancelled = string(messages, "cancelled");
			if (cancelled != null) {
				builder.cancelledMessage(cancelled);
			}
			String nothingToCancel = string(messages, "nothing-to-cancel");
			if (nothingToCancel != null) {
				builder.nothingToCancelMessage(nothingToCancel);
			}
		}

		try {
			return builder.build();
		} catch (IllegalArgumentException e) {
			throw new ConfigurationException("Invalid dialog engine configuration: " + e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object value, String name) {
		if (!(value instanceof Map)) {
			throw new ConfigurationException("'" + name + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private static String string(Map<String, Object> map, String key) {
		Object value = map.get(key);
		return value == null ? null : value.toString();
	}
}
