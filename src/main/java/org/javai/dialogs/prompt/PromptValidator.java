package org.javai.dialogs.prompt;

/**
 * Pure check applied to a recognized prompt value.
 *
 * <p>Implementations must not touch external state or send messages; retry
 * delivery belongs to the engine.</p>
 *
 * @param <T> the recognized value type
 */
@FunctionalInterface
public interface PromptValidator<T> {

	ValidationResult<T> validate(T value);

	static <T> PromptValidator<T> acceptAll() {
		return ValidationResult::accepted;
	}
}
