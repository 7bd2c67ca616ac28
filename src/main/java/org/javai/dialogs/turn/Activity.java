package org.javai.dialogs.turn;

import java.util.List;

/**
 * One inbound event from the messaging transport.
 *
 * @param type what kind of event this is
 * @param text the message text (null for non-message activities)
 * @param from the sender
 * @param recipient the receiving bot
 * @param conversationId the conversation the activity belongs to
 * @param membersAdded participants that joined (conversation updates only)
 */
public record Activity(
		ActivityType type,
		String text,
		ChannelAccount from,
		ChannelAccount recipient,
		String conversationId,
		List<ChannelAccount> membersAdded
) {

	public Activity {
		if (type == null) {
			throw new IllegalArgumentException("type must not be null");
		}
		if (recipient == null) {
			throw new IllegalArgumentException("recipient must not be null");
		}
		if (conversationId == null || conversationId.isBlank()) {
			throw new IllegalArgumentException("conversationId must not be blank");
		}
		membersAdded = membersAdded != null ? List.copyOf(membersAdded) : List.of();
	}

	public static Activity message(String conversationId, ChannelAccount from, ChannelAccount recipient, String text) {
		if (from == null) {
			throw new IllegalArgumentException("from must not be null for a message");
		}
		return new Activity(ActivityType.MESSAGE, text, from, recipient, conversationId, List.of());
	}

	public static Activity conversationUpdate(String conversationId, ChannelAccount recipient,
			List<ChannelAccount> membersAdded) {
		return new Activity(ActivityType.CONVERSATION_UPDATE, null, null, recipient, conversationId, membersAdded);
	}

	/**
	 * True when this is a conversation update whose first joining member is the bot.
	 */
	public boolean isBotJoining() {
		return type == ActivityType.CONVERSATION_UPDATE
				&& !membersAdded.isEmpty()
				&& membersAdded.get(0).id().equals(recipient.id());
	}
}
