package org.javai.dialogs.state;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Write buffer over a {@link StateStore} for the duration of one turn.
 *
 * <p>Reads see this scope's pending writes first and fall through to the backing
 * store otherwise. Writes and deletes reach the store only on {@link #commit()};
 * {@link #discard()} drops them. A scope is single-use and not thread-safe.</p>
 *
 * <p>The scope remembers the tree each key held when the turn first touched it.
 * {@link #commit()} hands the writes to the store as one {@link StateChange} batch
 * based on those trees, so a turn whose reads went stale fails with
 * {@link StateConflictException} instead of overwriting the newer value.</p>
 */
public class StateScope implements StateStore {

	private final StateStore store;
	private final StateValueCodec codec;
	private final Map<Principal, Map<String, Entry>> entries = new LinkedHashMap<>();
	private boolean closed;

	public StateScope(StateStore store) {
		this(store, new StateValueCodec());
	}

	public StateScope(StateStore store, StateValueCodec codec) {
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.codec = Objects.requireNonNull(codec, "codec must not be null");
	}

	@Override
	public <T> T get(Principal principal, StateKey<T> key) {
		ensureOpen();
		Entry entry = entriesOf(principal).get(key.name());
		if (entry == null) {
			// the store materializes an absent default, so first reads are not writes of this turn
			store.get(principal, key);
			entry = load(principal, key);
		}
		if (entry.current == null) {
			entry.write(codec.toTree(key, key.newDefault()));
		}
		return codec.fromTree(key, entry.current);
	}

	@Override
	public <T> void set(Principal principal, StateKey<T> key, T value) {
		ensureOpen();
		Objects.requireNonNull(value, "value must not be null; use delete to remove a key");
		entryOf(principal, key).write(codec.toTree(key, value));
	}

	@Override
	public void delete(Principal principal, StateKey<?> key) {
		ensureOpen();
		entryOf(principal, key).write(null);
	}

	@Override
	public JsonNode getTree(Principal principal, StateKey<?> key) {
		ensureOpen();
		JsonNode current = entryOf(principal, key).current;
		return current == null ? null : current.deepCopy();
	}

	/**
	 * Buffers the changes after checking them against this scope's own view.
	 */
	@Override
	public void apply(List<StateChange> changes) {
		ensureOpen();
		for (StateChange change : changes) {
			if (!Objects.equals(entryOf(change.principal(), change.key()).current, change.expected())) {
				throw new StateConflictException(change.principal(), change.key());
			}
		}
		for (StateChange change : changes) {
			entryOf(change.principal(), change.key()).write(change.replacement());
		}
	}

	public boolean hasPendingWrites() {
		return entries.values().stream().flatMap(m -> m.values().stream()).anyMatch(e -> e.dirty);
	}

	/**
	 * Applies all buffered writes to the backing store as one batch and closes the scope.
	 *
	 * @throws StateConflictException if another writer changed a key this turn wrote
	 * after the turn first touched it; nothing is applied then
	 */
	public void commit() {
		ensureOpen();
		closed = true;
		List<StateChange> changes = new ArrayList<>();
		entries.forEach((principal, byName) -> byName.values().stream()
				.filter(entry -> entry.dirty)
				.forEach(entry -> changes.add(new StateChange(principal, entry.key, entry.original, entry.current))));
		entries.clear();
		if (!changes.isEmpty()) {
			store.apply(changes);
		}
	}

	/**
	 * Drops all buffered writes and closes the scope.
	 */
	public void discard() {
		closed = true;
		entries.clear();
	}

	private Entry entryOf(Principal principal, StateKey<?> key) {
		Entry entry = entriesOf(principal).get(key.name());
		return entry != null ? entry : load(principal, key);
	}

	private Entry load(Principal principal, StateKey<?> key) {
		JsonNode stored = store.getTree(principal, key);
		Entry entry = new Entry(key, stored);
		entriesOf(principal).put(key.name(), entry);
		return entry;
	}

	private Map<String, Entry> entriesOf(Principal principal) {
		Objects.requireNonNull(principal, "principal must not be null");
		return entries.computeIfAbsent(principal, p -> new LinkedHashMap<>());
	}

	private void ensureOpen() {
		if (closed) {
			throw new IllegalStateException("State scope has already been committed or discarded");
		}
	}

	private static final class Entry {

		private final StateKey<?> key;
		private final JsonNode original;
		private JsonNode current;
		private boolean dirty;

		Entry(StateKey<?> key, JsonNode original) {
			this.key = key;
			this.original = original;
			this.current = original;
		}

		void write(JsonNode node) {
			current = node;
			dirty = true;
		}
	}
}
