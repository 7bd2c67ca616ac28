package org.javai.dialogs.prompt;

import org.javai.dialogs.turn.OutboundMessage;

/**
 * Behaviour of a registered prompt dialog: how it asks, what it recognizes, and
 * whether the recognized value is acceptable.
 *
 * @param <T> the value type handed to the resumed parent step
 */
public interface Prompt<T> {

	/**
	 * Renders the message that asks (or re-asks) for input.
	 */
	OutboundMessage render(String text, PromptOptions options);

	/**
	 * Reads a value out of the raw turn text.
	 */
	Recognition<T> recognize(String text, PromptOptions options);

	/**
	 * Applies this prompt's validator to a recognized value.
	 */
	ValidationResult<T> validate(T value);
}
