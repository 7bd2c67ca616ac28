package org.javai.dialogs.prompt;

import java.util.Objects;
import org.javai.dialogs.turn.OutboundMessage;

/**
 * Prompt that accepts any message text, subject to an optional validator.
 */
public class TextPrompt implements Prompt<String> {

	private final PromptValidator<String> validator;

	public TextPrompt() {
		this(PromptValidator.acceptAll());
	}

	public TextPrompt(PromptValidator<String> validator) {
		this.validator = Objects.requireNonNull(validator, "validator must not be null");
	}

	@Override
	public OutboundMessage render(String text, PromptOptions options) {
		return OutboundMessage.text(text);
	}

	@Override
	public Recognition<String> recognize(String text, PromptOptions options) {
		return text == null ? Recognition.notRecognized() : Recognition.recognized(text);
	}

	@Override
	public ValidationResult<String> validate(String value) {
		return validator.validate(value);
	}
}
