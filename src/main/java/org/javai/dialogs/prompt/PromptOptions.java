package org.javai.dialogs.prompt;

import java.util.List;

/**
 * What a prompt says and, for choice prompts, what it offers.
 *
 * <p>Stored on the prompt's dialog frame so the prompt can be re-issued on later turns.</p>
 *
 * @param prompt the initial prompt text
 * @param retryPrompt text used when input is not recognized (may be null)
 * @param choices choices offered by a choice prompt (empty otherwise)
 */
public record PromptOptions(String prompt, String retryPrompt, List<String> choices) {

	public PromptOptions {
		if (prompt == null || prompt.isBlank()) {
			throw new IllegalArgumentException("prompt must not be blank");
		}
		choices = choices != null ? List.copyOf(choices) : List.of();
	}

	public static PromptOptions of(String prompt) {
		return new PromptOptions(prompt, null, List.of());
	}

	public static PromptOptions withChoices(String prompt, List<String> choices) {
		return new PromptOptions(prompt, null, choices);
	}

	public PromptOptions withRetryPrompt(String retryPrompt) {
		return new PromptOptions(prompt, retryPrompt, choices);
	}
}
