package org.javai.dialogs.dialog;

/**
 * Thrown when a dialog name is registered twice.
 */
public class DuplicateDialogException extends DialogException {

	public DuplicateDialogException(String dialogName) {
		super("Dialog already registered: " + dialogName, dialogName);
	}
}
