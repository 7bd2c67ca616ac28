package org.javai.dialogs.prompt;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.javai.dialogs.turn.OutboundMessage;

/**
 * Prompt that asks the user to pick one of {@link PromptOptions#choices()}.
 *
 * <p>Input is matched, in order, as a 1-based ordinal ("2"), as a case-insensitive
 * exact choice, or as a prefix of exactly one choice. Ambiguous prefixes are not
 * recognized.</p>
 */
public class ChoicePrompt implements Prompt<FoundChoice> {

	private static final String ELLIPSIS = "...";

	private final PromptValidator<FoundChoice> validator;

	public ChoicePrompt() {
		this(PromptValidator.acceptAll());
	}

	public ChoicePrompt(PromptValidator<FoundChoice> validator) {
		this.validator = Objects.requireNonNull(validator, "validator must not be null");
	}

	@Override
	public OutboundMessage render(String text, PromptOptions options) {
		return OutboundMessage.choices(text, options.choices());
	}

	@Override
	public Recognition<FoundChoice> recognize(String text, PromptOptions options) {
		List<String> choices = options.choices();
		if (text == null || text.isBlank() || choices.isEmpty()) {
			return Recognition.notRecognized();
		}
		String utterance = text.trim().toLowerCase(Locale.ROOT);

		Integer ordinal = parseOrdinal(utterance);
		if (ordinal != null && ordinal >= 1 && ordinal <= choices.size()) {
			return Recognition.recognized(new FoundChoice(ordinal - 1, choices.get(ordinal - 1)));
		}

		for (int i = 0; i < choices.size(); i++) {
			if (choices.get(i).trim().toLowerCase(Locale.ROOT).equals(utterance)) {
				return Recognition.recognized(new FoundChoice(i, choices.get(i)));
			}
		}

		String prefix = stripEllipsis(utterance);
		if (prefix.isEmpty()) {
			return Recognition.notRecognized();
		}
		List<Integer> prefixMatches = new ArrayList<>();
		for (int i = 0; i < choices.size(); i++) {
			if (stripEllipsis(choices.get(i)).toLowerCase(Locale.ROOT).startsWith(prefix)) {
				prefixMatches.add(i);
			}
		}
		if (prefixMatches.size() == 1) {
			int index = prefixMatches.get(0);
			return Recognition.recognized(new FoundChoice(index, choices.get(index)));
		}
		return Recognition.notRecognized();
	}

	@Override
	public ValidationResult<FoundChoice> validate(FoundChoice value) {
		return validator.validate(value);
	}

	private static Integer parseOrdinal(String utterance) {
		try {
			return Integer.valueOf(utterance);
		}
		catch (NumberFormatException e) {
			return null;
		}
	}

	private static String stripEllipsis(String value) {
		String trimmed = value.trim();
		return trimmed.endsWith(ELLIPSIS) ? trimmed.substring(0, trimmed.length() - ELLIPSIS.length()) : trimmed;
	}
}
