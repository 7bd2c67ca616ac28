package org.javai.dialogs.turn;

import java.util.Objects;
import org.javai.dialogs.state.Principal;
import org.javai.dialogs.state.StateStore;

/**
 * Everything a dialog step can reach during one turn: the inbound activity, the
 * outbound transport and the turn's state view.
 */
public class TurnContext {

	private final Activity activity;
	private final MessageSender sender;
	private final StateStore state;
	private int sentCount;

	public TurnContext(Activity activity, MessageSender sender, StateStore state) {
		this.activity = Objects.requireNonNull(activity, "activity must not be null");
		this.sender = Objects.requireNonNull(sender, "sender must not be null");
		this.state = Objects.requireNonNull(state, "state must not be null");
	}

	public Activity activity() {
		return activity;
	}

	public StateStore state() {
		return state;
	}

	public Principal conversation() {
		return Principal.conversation(activity.conversationId());
	}

	/**
	 * The user who sent this turn's activity.
	 *
	 * @throws IllegalStateException for activities without a sender
	 */
	public Principal user() {
		if (activity.from() == null) {
			throw new IllegalStateException("Activity has no sender");
		}
		return Principal.user(activity.from().id());
	}

	public void send(String text) {
		send(OutboundMessage.text(text));
	}

	public void send(OutboundMessage message) {
		sender.send(activity.conversationId(), message);
		sentCount++;
	}

	/**
	 * Whether anything has been sent during this turn.
	 */
	public boolean responded() {
		return sentCount > 0;
	}
}
