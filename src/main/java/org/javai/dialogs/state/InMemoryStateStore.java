package org.javai.dialogs.state;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple in-memory state store, intended for tests and single-process hosts.
 *
 * <p>Default materialization uses {@link Map#computeIfAbsent}, so concurrent first
 * reads of the same key store exactly one default. Writes, including
 * {@link #apply(List)} batches, are serialized on the store.</p>
 */
public class InMemoryStateStore implements StateStore {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryStateStore.class);

	private final Map<Principal, Map<String, JsonNode>> records = new ConcurrentHashMap<>();
	private final StateValueCodec codec;

	public InMemoryStateStore() {
		this(new StateValueCodec());
	}

	public InMemoryStateStore(StateValueCodec codec) {
		this.codec = Objects.requireNonNull(codec, "codec must not be null");
	}

	@Override
	public <T> T get(Principal principal, StateKey<T> key) {
		Objects.requireNonNull(principal, "principal must not be null");
		Objects.requireNonNull(key, "key must not be null");
		JsonNode node = recordOf(principal).computeIfAbsent(key.name(), name -> {
			logger.debug("Materializing default for {} on {}", key.name(), principal);
			return codec.toTree(key, key.newDefault());
		});
		return codec.fromTree(key, node);
	}

	@Override
	public synchronized <T> void set(Principal principal, StateKey<T> key, T value) {
		Objects.requireNonNull(principal, "principal must not be null");
		Objects.requireNonNull(key, "key must not be null");
		Objects.requireNonNull(value, "value must not be null; use delete to remove a key");
		recordOf(principal).put(key.name(), codec.toTree(key, value));
	}

	@Override
	public synchronized void delete(Principal principal, StateKey<?> key) {
		Objects.requireNonNull(principal, "principal must not be null");
		Objects.requireNonNull(key, "key must not be null");
		Map<String, JsonNode> record = records.get(principal);
		if (record != null) {
			record.remove(key.name());
		}
	}

	@Override
	public JsonNode getTree(Principal principal, StateKey<?> key) {
		Objects.requireNonNull(principal, "principal must not be null");
		Objects.requireNonNull(key, "key must not be null");
		Map<String, JsonNode> record = records.get(principal);
		JsonNode node = record == null ? null : record.get(key.name());
		return node == null ? null : node.deepCopy();
	}

	@Override
	public synchronized void apply(List<StateChange> changes) {
		Objects.requireNonNull(changes, "changes must not be null");
		for (StateChange change : changes) {
			JsonNode current = getTree(change.principal(), change.key());
			if (!Objects.equals(current, change.expected())) {
				logger.debug("Rejecting {} change(s): {} on {} was changed concurrently",
						changes.size(), change.key().name(), change.principal());
				throw new StateConflictException(change.principal(), change.key());
			}
		}
		for (StateChange change : changes) {
			if (change.isDelete()) {
				recordOf(change.principal()).remove(change.key().name());
			}
			else {
				recordOf(change.principal()).put(change.key().name(), change.replacement().deepCopy());
			}
		}
	}

	/**
	 * Names of the keys currently stored for a principal.
	 */
	public Set<String> keys(Principal principal) {
		Map<String, JsonNode> record = records.get(principal);
		return record == null ? Set.of() : Set.copyOf(record.keySet());
	}

	private Map<String, JsonNode> recordOf(Principal principal) {
		return records.computeIfAbsent(principal, p -> new ConcurrentHashMap<>());
	}
}
