package org.javai.dialogs.dialog;

import java.util.Map;
import org.javai.dialogs.state.StateKey;
import org.javai.dialogs.turn.OutboundMessage;
import org.javai.dialogs.turn.TurnContext;

/**
 * View of the running frame handed to a {@link DialogStep}.
 */
public final class StepContext {

	private final DialogContext dialogContext;
	private final DialogFrame frame;

	StepContext(DialogContext dialogContext, DialogFrame frame) {
		this.dialogContext = dialogContext;
		this.frame = frame;
	}

	public TurnContext turn() {
		return dialogContext.turn();
	}

	public String dialogName() {
		return frame.dialogName();
	}

	/**
	 * Dialog-local values of this frame; they live until the frame ends.
	 */
	public Map<String, Object> values() {
		return frame.values();
	}

	public void send(String text) {
		turn().send(text);
	}

	public void send(OutboundMessage message) {
		turn().send(message);
	}

	public <T> T userState(StateKey<T> key) {
		return turn().state().get(turn().user(), key);
	}

	public <T> void setUserState(StateKey<T> key, T value) {
		turn().state().set(turn().user(), key, value);
	}

	public <T> T conversationState(StateKey<T> key) {
		return turn().state().get(turn().conversation(), key);
	}

	public <T> void setConversationState(StateKey<T> key, T value) {
		turn().state().set(turn().conversation(), key, value);
	}
}
