package org.javai.dialogs.dialog;

import java.util.List;
import java.util.Objects;
import org.javai.dialogs.prompt.Prompt;

/**
 * What runs when a dialog is begun: an ordered list of steps, or a single prompt.
 */
public sealed interface DialogDefinition permits DialogDefinition.Waterfall, DialogDefinition.PromptDialog {

	/**
	 * Steps executed one after another, each on its own turn-resumption.
	 *
	 * @param steps the steps in execution order (at least one)
	 */
	record Waterfall(List<DialogStep> steps) implements DialogDefinition {

		public Waterfall {
			if (steps == null || steps.isEmpty()) {
				throw new IllegalArgumentException("A waterfall needs at least one step");
			}
			steps = List.copyOf(steps);
		}
	}

	/**
	 * A prompt that asks, waits for input, and ends with the accepted value.
	 *
	 * @param prompt the prompt behaviour
	 */
	record PromptDialog(Prompt<?> prompt) implements DialogDefinition {

		public PromptDialog {
			Objects.requireNonNull(prompt, "prompt must not be null");
		}
	}

	static DialogDefinition waterfall(DialogStep... steps) {
		return new Waterfall(List.of(steps));
	}

	static DialogDefinition prompt(Prompt<?> prompt) {
		return new PromptDialog(prompt);
	}
}
