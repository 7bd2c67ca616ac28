package org.javai.dialogs.dialog;

/**
 * Base type for dialog registry and lookup failures.
 */
public class DialogException extends RuntimeException {

	private final String dialogName;

	public DialogException(String message, String dialogName) {
		super(message);
		this.dialogName = dialogName;
	}

	public String dialogName() {
		return dialogName;
	}
}
