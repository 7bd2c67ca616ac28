package org.javai.dialogs.dialog;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.dialogs.dialog.DialogDefinition.PromptDialog;
import org.javai.dialogs.dialog.DialogDefinition.Waterfall;
import org.javai.dialogs.prompt.Prompt;
import org.javai.dialogs.prompt.PromptOptions;
import org.javai.dialogs.prompt.Recognition;
import org.javai.dialogs.prompt.ValidationResult;
import org.javai.dialogs.turn.TurnContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the dialog stack of one conversation for the duration of one turn.
 *
 * <p>Beginning a dialog pushes a frame and runs its first step immediately. Steps
 * keep running until one prompts, waits or the stack empties. Ending a frame resumes
 * its parent at the parent's recorded next step, passing the child's result.</p>
 *
 * <p>A context is bound to one turn and is not thread-safe; hosts serialize turns of
 * the same conversation.</p>
 */
public class DialogContext {

	private static final Logger logger = LoggerFactory.getLogger(DialogContext.class);

	private final DialogRegistry registry;
	private final DialogStack stack;
	private final TurnContext turn;

	public DialogContext(DialogRegistry registry, DialogStack stack, TurnContext turn) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
		this.stack = Objects.requireNonNull(stack, "stack must not be null");
		this.turn = Objects.requireNonNull(turn, "turn must not be null");
	}

	public DialogState state() {
		return stack.top()
				.map(frame -> frame.isPrompt() ? DialogState.AWAITING_INPUT : DialogState.ACTIVE)
				.orElse(DialogState.IDLE);
	}

	public Optional<DialogFrame> activeFrame() {
		return stack.top();
	}

	public DialogStack stack() {
		return stack;
	}

	public TurnContext turn() {
		return turn;
	}

	/**
	 * Pushes a new frame for {@code dialogName} and starts it.
	 *
	 * <p>For a waterfall, the first step receives {@code args} as its resume value (or no
	 * input when {@code args} is null). For a prompt, {@code args} are its
	 * {@link PromptOptions} (a plain string is taken as the prompt text).</p>
	 *
	 * @throws UnknownDialogException if the name is not registered
	 */
	public DialogTurnResult begin(String dialogName, Object args) {
		DialogDefinition definition = registry.lookup(dialogName);
		DialogFrame frame = new DialogFrame(dialogName);

		if (definition instanceof PromptDialog promptDialog) {
			PromptOptions options = promptOptions(dialogName, args);
			frame.promptOptions(options);
			stack.push(frame);
			logger.debug("Prompt '{}' started at depth {}", dialogName, stack.depth());
			turn.send(promptDialog.prompt().render(options.prompt(), options));
			return DialogTurnResult.waiting();
		}

		stack.push(frame);
		logger.debug("Dialog '{}' started at depth {}", dialogName, stack.depth());
		return runSteps(frame, (Waterfall) definition, args == null ? StepInput.none() : StepInput.resume(args));
	}

	/**
	 * Resumes the active frame with this turn's text.
	 *
	 * <p>A waiting prompt recognizes and validates the text; on rejection it asks again
	 * and stays on the stack. A waiting waterfall runs its next step with the text as
	 * resume value. With an empty stack nothing happens.</p>
	 */
	public DialogTurnResult continueDialog(String text) {
		Optional<DialogFrame> top = stack.top();
		if (top.isEmpty()) {
			return DialogTurnResult.empty();
		}
		DialogFrame frame = top.get();
		DialogDefinition definition = registry.lookup(frame.dialogName());
		if (definition instanceof PromptDialog promptDialog) {
			return continuePrompt(frame, promptDialog.prompt(), text);
		}
		return runSteps(frame, (Waterfall) definition, StepInput.resume(text));
	}

	/**
	 * Clears the whole stack, whatever state it is in.
	 */
	public void cancelAll() {
		int depth = stack.depth();
		stack.clear();
		logger.debug("Cancelled {} dialog frame(s)", depth);
	}

	private <T> DialogTurnResult continuePrompt(DialogFrame frame, Prompt<T> prompt, String text) {
		PromptOptions options = frame.promptOptions();
		Recognition<T> recognition = prompt.recognize(text, options);
		if (!recognition.isRecognized()) {
			logger.debug("Prompt '{}' did not recognize input", frame.dialogName());
			return reprompt(prompt, options, null);
		}
		ValidationResult<T> validation = prompt.validate(recognition.value());
		if (validation instanceof ValidationResult.Rejected<T> rejected) {
			logger.debug("Prompt '{}' rejected input", frame.dialogName());
			return reprompt(prompt, options, rejected.retryMessage());
		}
		return endActive(((ValidationResult.Accepted<T>) validation).value());
	}

	private DialogTurnResult reprompt(Prompt<?> prompt, PromptOptions options, String retryMessage) {
		String text = retryMessage != null ? retryMessage
				: options.retryPrompt() != null ? options.retryPrompt()
				: options.prompt();
		turn.send(prompt.render(text, options));
		return DialogTurnResult.waiting();
	}

	private DialogTurnResult runSteps(DialogFrame frame, Waterfall waterfall, StepInput input) {
		List<DialogStep> steps = waterfall.steps();
		StepInput next = input;
		while (true) {
			int index = frame.stepIndex();
			if (index >= steps.size()) {
				logger.debug("Dialog '{}' ran out of steps", frame.dialogName());
				return endActive(null);
			}
			frame.stepIndex(index + 1);
			StepResult result = steps.get(index).run(new StepContext(this, frame), next);
			if (result == null) {
				throw new IllegalStateException(
						"Step " + index + " of dialog '" + frame.dialogName() + "' returned no result");
			}

			if (result instanceof StepResult.Advance) {
				next = StepInput.none();
			}
			else if (result instanceof StepResult.PromptFor promptFor) {
				if (!(registry.lookup(promptFor.promptName()) instanceof PromptDialog)) {
					throw new IllegalArgumentException("'" + promptFor.promptName() + "' is not a prompt dialog");
				}
				return begin(promptFor.promptName(), promptFor.options());
			}
			else if (result instanceof StepResult.BeginDialog beginDialog) {
				return begin(beginDialog.dialogName(), beginDialog.args());
			}
			else if (result instanceof StepResult.WaitForInput) {
				return DialogTurnResult.waiting();
			}
			else if (result instanceof StepResult.End end) {
				return endActive(end.result());
			}
		}
	}

	private DialogTurnResult endActive(Object result) {
		DialogFrame ended = stack.pop();
		logger.debug("Dialog '{}' ended", ended.dialogName());
		Optional<DialogFrame> parent = stack.top();
		if (parent.isEmpty()) {
			return DialogTurnResult.complete(result);
		}
		DialogFrame parentFrame = parent.get();
		DialogDefinition definition = registry.lookup(parentFrame.dialogName());
		if (!(definition instanceof Waterfall waterfall)) {
			throw new IllegalStateException("Prompt '" + parentFrame.dialogName() + "' cannot resume a child dialog");
		}
		return runSteps(parentFrame, waterfall, StepInput.resume(result));
	}

	private static PromptOptions promptOptions(String dialogName, Object args) {
		if (args instanceof PromptOptions options) {
			return options;
		}
		if (args instanceof String text) {
			return PromptOptions.of(text);
		}
		throw new IllegalArgumentException("Prompt '" + dialogName + "' must be started with PromptOptions");
	}
}
