package org.javai.dialogs.turn;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import org.javai.dialogs.state.StateConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs turns of the same conversation one after another, in submission order, while
 * turns of different conversations run in parallel on the given executor.
 *
 * <p>Turns of different conversations can still share user state. A turn whose
 * commit conflicts with another turn's is run again from scratch, up to
 * {@code maxAttempts} times in all.</p>
 */
public class SerializedTurnExecutor {

	private static final Logger logger = LoggerFactory.getLogger(SerializedTurnExecutor.class);

	public static final int DEFAULT_MAX_ATTEMPTS = 3;

	private final TurnDispatcher dispatcher;
	private final Executor executor;
	private final int maxAttempts;
	private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

	public SerializedTurnExecutor(TurnDispatcher dispatcher, Executor executor) {
		this(dispatcher, executor, DEFAULT_MAX_ATTEMPTS);
	}

	public SerializedTurnExecutor(TurnDispatcher dispatcher, Executor executor, int maxAttempts) {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1");
		}
		this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
		this.executor = Objects.requireNonNull(executor, "executor must not be null");
		this.maxAttempts = maxAttempts;
	}

	/**
	 * Queues a turn behind any unfinished turn of the same conversation.
	 *
	 * <p>The returned future completes when this turn has been handled, exceptionally
	 * if the dispatcher threw. A failed turn does not block later turns.</p>
	 */
	public CompletableFuture<Void> submit(Activity activity) {
		Objects.requireNonNull(activity, "activity must not be null");
		String conversationId = activity.conversationId();
		CompletableFuture<Void> turn = new CompletableFuture<>();
		CompletableFuture<Void> previous = tails.put(conversationId, turn);
		CompletableFuture<Void> after = previous == null ? CompletableFuture.completedFuture(null) : previous;

		after.handle((ignored, error) -> null)
				.thenRunAsync(() -> run(activity, turn), executor)
				.exceptionally(e -> {
					turn.completeExceptionally(e);
					return null;
				});

		turn.whenComplete((ignored, error) -> tails.remove(conversationId, turn));
		return turn;
	}

	private void run(Activity activity, CompletableFuture<Void> turn) {
		try {
			dispatch(activity);
			turn.complete(null);
		}
		catch (RuntimeException e) {
			logger.warn("Turn failed for conversation {}", activity.conversationId(), e);
			turn.completeExceptionally(e);
		}
	}

	private void dispatch(Activity activity) {
		for (int attempt = 1; ; attempt++) {
			try {
				dispatcher.onTurn(activity);
				return;
			}
			catch (StateConflictException e) {
				if (attempt >= maxAttempts) {
					throw e;
				}
				logger.debug("Retrying turn for conversation {} after state conflict (attempt {} of {})",
						activity.conversationId(), attempt, maxAttempts);
			}
		}
	}
}
