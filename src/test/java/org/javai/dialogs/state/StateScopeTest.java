package org.javai.dialogs.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import org.junit.jupiter.api.Test;

class StateScopeTest {

	private static final StateKey<Integer> COUNT = StateKey.of("count", Integer.class, () -> 0);

	private final InMemoryStateStore store = new InMemoryStateStore();
	private final Principal user = Principal.user("u1");

	@Test
	void writesAreVisibleInsideScopeBeforeCommit() {
		StateScope scope = new StateScope(store);

		scope.set(user, COUNT, 3);

		assertThat(scope.get(user, COUNT)).isEqualTo(3);
		assertThat(scope.hasPendingWrites()).isTrue();
		assertThat(store.keys(user)).isEmpty();
	}

	@Test
	void commitAppliesWrites() {
		StateScope scope = new StateScope(store);
		scope.set(user, COUNT, 3);

		scope.commit();

		assertThat(store.get(user, COUNT)).isEqualTo(3);
	}

	@Test
	void discardDropsWrites() {
		store.set(user, COUNT, 1);
		StateScope scope = new StateScope(store);
		scope.set(user, COUNT, 5);

		scope.discard();

		assertThat(store.get(user, COUNT)).isEqualTo(1);
	}

	@Test
	void deleteInScopeReachesStoreOnCommit() {
		store.set(user, COUNT, 4);
		StateScope scope = new StateScope(store);

		scope.delete(user, COUNT);
		assertThat(scope.get(user, COUNT)).isZero();
		scope.commit();

		assertThat(store.get(user, COUNT)).isZero();
	}

	@Test
	void staleCommitIsRejectedAndKeepsNewerValue() {
		store.set(user, COUNT, 1);
		StateScope first = new StateScope(store);
		StateScope second = new StateScope(store);
		first.set(user, COUNT, first.get(user, COUNT) + 1);
		second.set(user, COUNT, second.get(user, COUNT) + 10);

		first.commit();

		assertThatThrownBy(second::commit)
				.isInstanceOf(StateConflictException.class)
				.hasMessageContaining("count");
		assertThat(store.get(user, COUNT)).isEqualTo(2);
	}

	@Test
	void conflictOnOneKeyAppliesNoneOfTheTurnsWrites() {
		Principal conversation = Principal.conversation("c1");
		StateScope scope = new StateScope(store);
		scope.set(conversation, COUNT, 7);
		scope.set(user, COUNT, scope.get(user, COUNT) + 1);

		store.set(user, COUNT, 5);

		assertThatThrownBy(scope::commit).isInstanceOf(StateConflictException.class);
		assertThat(store.keys(conversation)).isEmpty();
		assertThat(store.get(user, COUNT)).isEqualTo(5);
	}

	@Test
	void firstReadOfAbsentKeyDoesNotConflictWithOtherReaders() {
		StateScope first = new StateScope(store);
		StateScope second = new StateScope(store);
		assertThat(first.get(user, COUNT)).isZero();
		assertThat(second.get(user, COUNT)).isZero();
		assertThat(first.hasPendingWrites()).isFalse();

		first.commit();
		second.commit();

		assertThat(store.get(user, COUNT)).isZero();
	}

	@Test
	void closedScopeRejectsFurtherUse() {
		StateScope scope = new StateScope(store);
		scope.commit();

		assertThatThrownBy(() -> scope.get(user, COUNT)).isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(scope::commit).isInstanceOf(IllegalStateException.class);
	}
}
