package org.javai.dialogs.state;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * One buffered write of a turn, together with the stored tree it was based on.
 *
 * @param expected the tree the key held when the turn first touched it, {@code null} if absent
 * @param replacement the tree to store, {@code null} to delete the key
 */
public record StateChange(Principal principal, StateKey<?> key, JsonNode expected, JsonNode replacement) {

	public StateChange {
		Objects.requireNonNull(principal, "principal must not be null");
		Objects.requireNonNull(key, "key must not be null");
	}

	public boolean isDelete() {
		return replacement == null;
	}
}
