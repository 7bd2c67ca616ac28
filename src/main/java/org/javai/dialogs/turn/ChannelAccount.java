package org.javai.dialogs.turn;

/**
 * A participant on a channel: a user or the bot itself.
 *
 * @param id channel-assigned id
 * @param name display name (may be null)
 */
public record ChannelAccount(String id, String name) {

	public ChannelAccount {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("id must not be blank");
		}
	}

	public static ChannelAccount of(String id) {
		return new ChannelAccount(id, null);
	}
}
