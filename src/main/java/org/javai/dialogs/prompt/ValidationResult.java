package org.javai.dialogs.prompt;

/**
 * Outcome of validating a recognized prompt value.
 *
 * <p>Rejection is ordinary control flow: the engine re-issues the prompt and keeps
 * waiting on the same frame.</p>
 *
 * @param <T> the recognized value type
 */
public sealed interface ValidationResult<T> permits ValidationResult.Accepted, ValidationResult.Rejected {

	/**
	 * @param value the accepted value handed to the next step
	 */
	record Accepted<T>(T value) implements ValidationResult<T> {
	}

	/**
	 * @param retryMessage message to show instead of the prompt, or {@code null} to repeat the prompt
	 */
	record Rejected<T>(String retryMessage) implements ValidationResult<T> {
	}

	static <T> ValidationResult<T> accepted(T value) {
		return new Accepted<>(value);
	}

	static <T> ValidationResult<T> rejected(String retryMessage) {
		return new Rejected<>(retryMessage);
	}

	static <T> ValidationResult<T> rejected() {
		return new Rejected<>(null);
	}

	default boolean isAccepted() {
		return this instanceof Accepted<?>;
	}
}
