package org.javai.dialogs.dialog;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.javai.dialogs.prompt.Prompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name to definition mapping, populated at startup and read on every turn.
 */
public class DialogRegistry {

	private static final Logger logger = LoggerFactory.getLogger(DialogRegistry.class);

	private final Map<String, DialogDefinition> definitions = new ConcurrentHashMap<>();

	/**
	 * Registers a definition under a unique name.
	 *
	 * @throws DuplicateDialogException if the name is taken
	 */
	public DialogRegistry register(String name, DialogDefinition definition) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("name must not be blank");
		}
		Objects.requireNonNull(definition, "definition must not be null");
		if (definitions.putIfAbsent(name, definition) != null) {
			throw new DuplicateDialogException(name);
		}
		logger.debug("Registered dialog '{}' ({})", name, definition.getClass().getSimpleName());
		return this;
	}

	public DialogRegistry waterfall(String name, DialogStep... steps) {
		return register(name, DialogDefinition.waterfall(steps));
	}

	public DialogRegistry prompt(String name, Prompt<?> prompt) {
		return register(name, DialogDefinition.prompt(prompt));
	}

	/**
	 * @throws UnknownDialogException if nothing is registered under {@code name}
	 */
	public DialogDefinition lookup(String name) {
		DialogDefinition definition = name != null ? definitions.get(name) : null;
		if (definition == null) {
			throw new UnknownDialogException(name);
		}
		return definition;
	}

	public boolean contains(String name) {
		return name != null && definitions.containsKey(name);
	}

	public Set<String> names() {
		return Set.copyOf(definitions.keySet());
	}
}
