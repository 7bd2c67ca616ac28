package org.javai.dialogs.dialog;

import java.util.Objects;
import org.javai.dialogs.prompt.PromptOptions;

/**
 * What a step asks the engine to do once it returns.
 */
public sealed interface StepResult permits StepResult.Advance, StepResult.PromptFor, StepResult.BeginDialog,
		StepResult.WaitForInput, StepResult.End {

	/**
	 * Run the next step of the same frame now, without input.
	 */
	record Advance() implements StepResult {
	}

	/**
	 * Start the registered prompt dialog and wait for the user's answer.
	 */
	record PromptFor(String promptName, PromptOptions options) implements StepResult {

		public PromptFor {
			Objects.requireNonNull(promptName, "promptName must not be null");
			Objects.requireNonNull(options, "options must not be null");
		}
	}

	/**
	 * Push a child dialog; its result resumes this frame's next step.
	 */
	record BeginDialog(String dialogName, Object args) implements StepResult {

		public BeginDialog {
			Objects.requireNonNull(dialogName, "dialogName must not be null");
		}
	}

	/**
	 * Suspend this frame until the next turn; that turn's text resumes the next step.
	 */
	record WaitForInput() implements StepResult {
	}

	/**
	 * Pop this frame, handing {@code result} to the parent.
	 */
	record End(Object result) implements StepResult {
	}

	static StepResult advance() {
		return new Advance();
	}

	static StepResult prompt(String promptName, PromptOptions options) {
		return new PromptFor(promptName, options);
	}

	static StepResult prompt(String promptName, String text) {
		return new PromptFor(promptName, PromptOptions.of(text));
	}

	static StepResult beginDialog(String dialogName, Object args) {
		return new BeginDialog(dialogName, args);
	}

	static StepResult waitForInput() {
		return new WaitForInput();
	}

	static StepResult end() {
		return new End(null);
	}

	static StepResult end(Object result) {
		return new End(result);
	}
}
