package org.javai.dialogs.samples.reminders;

import org.javai.dialogs.prompt.PromptValidator;
import org.javai.dialogs.prompt.ValidationResult;

/**
 * Reminder titles must have at least three characters.
 */
public class TitleValidator implements PromptValidator<String> {

	public static final int MIN_LENGTH = 3;
	public static final String RETRY_MESSAGE = "Title should be at least 3 characters long.";

	@Override
	public ValidationResult<String> validate(String value) {
		if (!isValid(value)) {
			return ValidationResult.rejected(RETRY_MESSAGE);
		}
		return ValidationResult.accepted(value);
	}

	static boolean isValid(String value) {
		return value != null && !value.isBlank() && value.length() >= MIN_LENGTH;
	}
}
