package org.javai.dialogs.turn;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.javai.dialogs.config.DialogEngineConfig;
import org.javai.dialogs.dialog.DialogContext;
import org.javai.dialogs.dialog.DialogRegistry;
import org.javai.dialogs.dialog.DialogStack;
import org.javai.dialogs.dialog.DialogState;
import org.javai.dialogs.intent.IntentRecognizer;
import org.javai.dialogs.intent.IntentScore;
import org.javai.dialogs.state.StateScope;
import org.javai.dialogs.state.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for inbound activities.
 *
 * <p>For a message the dispatcher tries, in order, the cancel keyword, the active
 * dialog and finally intent recognition, stopping as soon as something has been
 * said to the user. State written during a turn is committed only when the turn
 * completes, and the turn's messages are delivered only after that commit; if
 * anything throws, nothing is persisted or sent and the exception propagates. A
 * {@link org.javai.dialogs.state.StateConflictException} means another turn changed
 * state this turn was based on, and the turn can be run again from scratch.</p>
 *
 * <p>Turns of the same conversation must not run concurrently; see
 * {@link SerializedTurnExecutor}.</p>
 */
public class TurnDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(TurnDispatcher.class);

	private final DialogRegistry registry;
	private final StateStore store;
	private final IntentRecognizer recognizer;
	private final MessageSender sender;
	private final DialogEngineConfig config;

	public TurnDispatcher(DialogRegistry registry, StateStore store, IntentRecognizer recognizer,
			MessageSender sender) {
		this(registry, store, recognizer, sender, DialogEngineConfig.defaults());
	}

	public TurnDispatcher(DialogRegistry registry, StateStore store, IntentRecognizer recognizer,
			MessageSender sender, DialogEngineConfig config) {
		this.registry = Objects.requireNonNull(registry, "registry must not be null");
		this.store = Objects.requireNonNull(store, "store must not be null");
		this.recognizer = Objects.requireNonNull(recognizer, "recognizer must not be null");
		this.sender = Objects.requireNonNull(sender, "sender must not be null");
		this.config = Objects.requireNonNull(config, "config must not be null");
	}

	public void onTurn(Activity activity) {
		Objects.requireNonNull(activity, "activity must not be null");
		switch (activity.type()) {
			case CONVERSATION_UPDATE -> onConversationUpdate(activity);
			case MESSAGE -> onMessage(activity);
		}
	}

	private void onConversationUpdate(Activity activity) {
		if (activity.isBotJoining()) {
			logger.debug("Bot joined conversation {}", activity.conversationId());
			sender.send(activity.conversationId(), OutboundMessage.text(config.welcomeMessage()));
		}
	}

	private void onMessage(Activity activity) {
		StateScope scope = new StateScope(store);
		OutboundBuffer outbound = new OutboundBuffer();
		try {
			TurnContext turn = new TurnContext(activity, outbound, scope);
			DialogStack stack = scope.get(turn.conversation(), DialogStack.STATE_KEY);
			DialogContext dialogs = new DialogContext(registry, stack, turn);

			handleMessage(turn, dialogs);

			scope.set(turn.conversation(), DialogStack.STATE_KEY, stack);
			scope.commit();
		}
		catch (RuntimeException e) {
			scope.discard();
			throw e;
		}
		outbound.deliverTo(sender);
	}

	private void handleMessage(TurnContext turn, DialogContext dialogs) {
		String text = turn.activity().text();

		if (isCancel(text)) {
			if (dialogs.state() != DialogState.IDLE) {
				turn.send(config.cancelledMessage());
				dialogs.cancelAll();
			}
			else {
				turn.send(config.nothingToCancelMessage());
			}
		}

		if (!turn.responded()) {
			dialogs.continueDialog(text);
		}

		if (!turn.responded()) {
			String intent = selectIntent(turn.activity().conversationId(), text);
			dialogs.begin(intent, null);
		}
	}

	private String selectIntent(String conversationId, String text) {
		Optional<IntentScore> top = recognizer.recognize(conversationId, text).topIntent();
		if (top.isPresent() && top.get().score() > config.intentThreshold()) {
			logger.info("Conversation {}: intent '{}' ({})", conversationId, top.get().intent(), top.get().score());
			return top.get().intent();
		}
		logger.info("Conversation {}: no intent above {}, using '{}'", conversationId,
				config.intentThreshold(), config.fallbackIntent());
		return config.fallbackIntent();
	}

	private boolean isCancel(String text) {
		return text != null && text.trim().toLowerCase(Locale.ROOT).equals(config.cancelKeyword().toLowerCase(Locale.ROOT));
	}
}
