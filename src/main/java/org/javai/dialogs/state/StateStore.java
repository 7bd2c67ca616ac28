package org.javai.dialogs.state;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Per-principal key/value persistence with typed accessors.
 *
 * <p>{@link #get} never fails for a valid principal: an absent value resolves to the
 * key's default, which is stored together with the read. Implementations must keep
 * principals isolated from each other.</p>
 */
public interface StateStore {

	<T> T get(Principal principal, StateKey<T> key);

	<T> void set(Principal principal, StateKey<T> key, T value);

	void delete(Principal principal, StateKey<?> key);

	/**
	 * Stored JSON form of a key, or {@code null} when the key is absent. Unlike
	 * {@link #get} this does not materialize the default.
	 */
	JsonNode getTree(Principal principal, StateKey<?> key);

	/**
	 * Applies all changes as one unit.
	 *
	 * <p>Every change names the tree its key is expected to hold. If any key holds
	 * something else, nothing is applied.</p>
	 *
	 * @throws StateConflictException if a key no longer holds its expected tree
	 */
	void apply(List<StateChange> changes);
}
