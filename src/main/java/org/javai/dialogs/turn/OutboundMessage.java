package org.javai.dialogs.turn;

import java.util.List;

/**
 * A reply handed to the messaging transport: plain text, optionally with a list of
 * choices the channel may render as buttons.
 *
 * @param text the message text
 * @param choices offered choices (empty for plain text)
 */
public record OutboundMessage(String text, List<String> choices) {

	public OutboundMessage {
		if (text == null) {
			throw new IllegalArgumentException("text must not be null");
		}
		choices = choices != null ? List.copyOf(choices) : List.of();
	}

	public static OutboundMessage text(String text) {
		return new OutboundMessage(text, List.of());
	}

	public static OutboundMessage choices(String text, List<String> choices) {
		return new OutboundMessage(text, choices);
	}

	public boolean hasChoices() {
		return !choices.isEmpty();
	}
}
