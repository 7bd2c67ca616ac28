package org.javai.dialogs.state;

/**
 * Identity that owns state records: either a user or a conversation.
 *
 * <p>Two principals with the same id but a different {@link Kind} are distinct
 * owners and never see each other's state.</p>
 *
 * @param kind whether this principal is a user or a conversation
 * @param id the channel-assigned identifier
 */
public record Principal(Kind kind, String id) {

	public enum Kind {
		USER,
		CONVERSATION
	}

	public Principal {
		if (kind == null) {
			throw new IllegalArgumentException("kind must not be null");
		}
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("id must not be blank");
		}
	}

	public static Principal user(String id) {
		return new Principal(Kind.USER, id);
	}

	public static Principal conversation(String id) {
		return new Principal(Kind.CONVERSATION, id);
	}

	@Override
	public String toString() {
		return kind.name().toLowerCase() + ":" + id;
	}
}
