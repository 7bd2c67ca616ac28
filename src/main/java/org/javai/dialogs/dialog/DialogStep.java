package org.javai.dialogs.dialog;

/**
 * A single unit of waterfall logic.
 */
@FunctionalInterface
public interface DialogStep {

	/**
	 * Runs the step.
	 *
	 * @param context access to the turn, state and this frame's local values
	 * @param input nothing, or the value handed over by a prompt, child dialog or begin call
	 * @return what the engine should do next
	 */
	StepResult run(StepContext context, StepInput input);
}
