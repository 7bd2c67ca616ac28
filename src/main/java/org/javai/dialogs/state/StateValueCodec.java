package org.javai.dialogs.state;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Converts state values to and from JSON trees.
 *
 * <p>Stores keep values as trees so that every read hands out an independent
 * instance; callers must {@code set} a mutated value for the change to persist.</p>
 */
public final class StateValueCodec {

	private final ObjectMapper mapper;

	public StateValueCodec() {
		this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
	}

	public StateValueCodec(ObjectMapper mapper) {
		this.mapper = mapper;
	}

	public JsonNode toTree(StateKey<?> key, Object value) {
		try {
			return mapper.valueToTree(value);
		}
		catch (IllegalArgumentException e) {
			throw new StateSerializationException("Failed to serialize value for " + key, e);
		}
	}

	public <T> T fromTree(StateKey<T> key, JsonNode node) {
		try {
			return mapper.convertValue(node, key.type());
		}
		catch (IllegalArgumentException e) {
			throw new StateSerializationException("Failed to deserialize value for " + key, e);
		}
	}
}
