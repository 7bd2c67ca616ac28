package org.javai.dialogs.state;

/**
 * Thrown when a state value cannot be converted to or from its stored JSON form.
 */
public class StateSerializationException extends RuntimeException {

	public StateSerializationException(String message, Throwable cause) {
		super(message, cause);
	}
}
