package org.javai.dialogs.dialog;

/**
 * Coarse state of a conversation's dialog stack.
 */
public enum DialogState {
	/** Nothing on the stack. */
	IDLE,
	/** The top frame is a waterfall waiting for its next turn. */
	ACTIVE,
	/** The top frame is a prompt waiting for an answer. */
	AWAITING_INPUT
}
