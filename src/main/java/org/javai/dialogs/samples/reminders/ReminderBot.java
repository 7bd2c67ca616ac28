package org.javai.dialogs.samples.reminders;

import java.util.Objects;
import org.javai.dialogs.config.DialogEngineConfig;
import org.javai.dialogs.config.DialogEngineConfigLoader;
import org.javai.dialogs.dialog.DialogRegistry;
import org.javai.dialogs.intent.ChatClientIntentRecognizer;
import org.javai.dialogs.intent.IntentRecognizer;
import org.javai.dialogs.state.StateStore;
import org.javai.dialogs.turn.MessageSender;
import org.javai.dialogs.turn.TurnDispatcher;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Wires the reminder dialogs into a {@link TurnDispatcher}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * TurnDispatcher bot = ReminderBot.create(chatClient, new InMemoryStateStore(), sender);
 * bot.onTurn(activity);
 * }</pre>
 */
public final class ReminderBot {

	/**
	 * Classpath resource with the reminder bot's engine settings.
	 */
	public static final String CONFIG_RESOURCE = "reminder-bot.yaml";

	private ReminderBot() {
	}

	/**
	 * Creates the bot with intents recognized by the given chat model.
	 */
	public static TurnDispatcher create(ChatClient chatClient, StateStore store, MessageSender sender) {
		Objects.requireNonNull(chatClient, "chatClient must not be null");
		return create(new ChatClientIntentRecognizer(chatClient, ReminderDialogs.INTENTS), store, sender,
				new DialogEngineConfigLoader().loadResource(CONFIG_RESOURCE));
	}

	public static TurnDispatcher create(IntentRecognizer recognizer, StateStore store, MessageSender sender,
			DialogEngineConfig config) {
		DialogRegistry registry = new ReminderDialogs(config).register(new DialogRegistry());
		return new TurnDispatcher(registry, store, recognizer, sender, config);
	}
}
