package org.javai.dialogs.dialog;

/**
 * Where the stack ended up after {@link DialogContext#begin} or
 * {@link DialogContext#continueDialog}.
 *
 * @param status the outcome
 * @param result the value the outermost dialog ended with (only for {@link Status#COMPLETE})
 */
public record DialogTurnResult(Status status, Object result) {

	public enum Status {
		/** There was nothing to run. */
		EMPTY,
		/** A dialog is waiting for the next turn. */
		WAITING,
		/** The last frame ended and the stack is empty. */
		COMPLETE
	}

	static DialogTurnResult empty() {
		return new DialogTurnResult(Status.EMPTY, null);
	}

	static DialogTurnResult waiting() {
		return new DialogTurnResult(Status.WAITING, null);
	}

	static DialogTurnResult complete(Object result) {
		return new DialogTurnResult(Status.COMPLETE, result);
	}
}
