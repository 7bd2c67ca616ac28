package org.javai.dialogs.turn;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds a turn's outbound messages until the turn's state has been committed.
 */
final class OutboundBuffer implements MessageSender {

	private record Pending(String conversationId, OutboundMessage message) {
	}

	private final List<Pending> pending = new ArrayList<>();

	@Override
	public void send(String conversationId, OutboundMessage message) {
		pending.add(new Pending(conversationId, message));
	}

	void deliverTo(MessageSender sender) {
		pending.forEach(p -> sender.send(p.conversationId(), p.message()));
		pending.clear();
	}
}
