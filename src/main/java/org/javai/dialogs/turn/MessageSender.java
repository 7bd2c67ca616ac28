package org.javai.dialogs.turn;

/**
 * Outbound side of the messaging transport, supplied by the host.
 *
 * <p>Failures are the transport's own unchecked exceptions and propagate to the
 * caller of the turn unchanged.</p>
 */
@FunctionalInterface
public interface MessageSender {

	void send(String conversationId, OutboundMessage message);
}
