package org.javai.dialogs.dialog;

/**
 * Thrown when a dialog name has no registered definition.
 */
public class UnknownDialogException extends DialogException {

	public UnknownDialogException(String dialogName) {
		super("Unknown dialog: " + dialogName, dialogName);
	}
}
