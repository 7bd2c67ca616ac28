package org.javai.dialogs.state;

/**
 * Thrown when a batch of changes is applied to a key that another writer changed
 * after the batch read it. None of the batch's changes are applied.
 */
public class StateConflictException extends RuntimeException {

	private final Principal principal;
	private final String keyName;

	public StateConflictException(Principal principal, StateKey<?> key) {
		super("State of " + key.name() + " on " + principal + " was changed concurrently");
		this.principal = principal;
		this.keyName = key.name();
	}

	public Principal principal() {
		return principal;
	}

	public String keyName() {
		return keyName;
	}
}
