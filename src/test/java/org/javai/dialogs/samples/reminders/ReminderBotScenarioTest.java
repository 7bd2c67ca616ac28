package org.javai.dialogs.samples.reminders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.javai.dialogs.config.DialogEngineConfig;
import org.javai.dialogs.dialog.DialogStack;
import org.javai.dialogs.intent.IntentRecognition;
import org.javai.dialogs.intent.IntentRecognizer;
import org.javai.dialogs.intent.IntentScore;
import org.javai.dialogs.state.InMemoryStateStore;
import org.javai.dialogs.state.Principal;
import org.javai.dialogs.state.StateChange;
import org.javai.dialogs.testsupport.RecordingMessageSender;
import org.javai.dialogs.turn.Activity;
import org.javai.dialogs.turn.ChannelAccount;
import org.javai.dialogs.turn.SerializedTurnExecutor;
import org.javai.dialogs.turn.TurnDispatcher;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.chat.client.ChatClient;

/**
 * End-to-end conversations with the reminder bot, turn by turn.
 */
class ReminderBotScenarioTest {

	private static final ChannelAccount USER = ChannelAccount.of("user-1");
	private static final ChannelAccount BOT = ChannelAccount.of("reminder-bot");
	private static final String WELCOME = "Hi! I'm a simple reminder bot. I can add reminders and show them.";

	private final IntentRecognizer recognizer = mock(IntentRecognizer.class);
	private final InMemoryStateStore store = new InMemoryStateStore();
	private final RecordingMessageSender sender = new RecordingMessageSender();
	private final TurnDispatcher bot = ReminderBot.create(recognizer, store, sender, DialogEngineConfig.defaults());

	ReminderBotScenarioTest() {
		when(recognizer.recognize(anyString(), anyString())).thenReturn(IntentRecognition.empty());
		intent("add a reminder", "Calendar_Add", 0.91);
		intent("show my reminders", "Calendar_Find", 0.84);
		intent("find something", "Calendar_Find", 0.15);
	}

	private void intent(String utterance, String intent, double score) {
		when(recognizer.recognize(anyString(), eq(utterance)))
				.thenReturn(IntentRecognition.of(new IntentScore(intent, score), new IntentScore("None", 0.05)));
	}

	private void say(String text) {
		bot.onTurn(Activity.message("conv-1", USER, BOT, text));
	}

	private void addReminder(String title) {
		say("add a reminder");
		say(title);
	}

	@Test
	void greetsWhenAddedToConversation() {
		bot.onTurn(Activity.conversationUpdate("conv-1", BOT, List.of(BOT, USER)));

		assertThat(sender.texts()).containsExactly(WELCOME);
	}

	@Test
	void addsReminderAfterRejectingShortTitle() {
		say("add a reminder");
		say("Hi");
		say("Morning Standup");

		assertThat(sender.texts()).containsExactly(
				"What would you like to call your reminder?",
				"Title should be at least 3 characters long.",
				"Your reminder named 'Morning Standup' is set.");
		assertThat(store.get(Principal.user("user-1"), ReminderDialogs.REMINDER_TITLES))
				.containsExactly("Morning Standup");
	}

	@Test
	void showsChosenReminderInFull() {
		addReminder("Morning Standup");
		addReminder("Dentist");
		sender.clear();

		say("show my reminders");

		assertThat(sender.last().text()).isEqualTo("Select the reminder to show: ");
		assertThat(sender.last().choices()).containsExactly("Morning Standup...", "Dentist");

		say("1");
		assertThat(sender.last().text()).isEqualTo("Reminder: Morning Standup");

		say("show my reminders");
		say("dent");
		assertThat(sender.last().text()).isEqualTo("Reminder: Dentist");
	}

	@Test
	void unrecognizedChoiceRepeatsPrompt() {
		addReminder("Dentist");
		sender.clear();

		say("show my reminders");
		say("7");

		assertThat(sender.texts()).containsExactly("Select the reminder to show: ", "Select the reminder to show: ");
		assertThat(sender.last().choices()).containsExactly("Dentist");
	}

	@Test
	void showWithoutRemindersSaysSo() {
		say("show my reminders");

		assertThat(sender.texts()).containsExactly(ReminderDialogs.NO_REMINDERS);
	}

	@Test
	void lowScoringIntentGetsGreeting() {
		say("find something");

		assertThat(sender.texts()).containsExactly(WELCOME);
	}

	@Test
	void cancelAbandonsReminderInProgress() {
		say("add a reminder");
		say("cancel");
		say("cancel");

		assertThat(sender.texts()).containsExactly(
				"What would you like to call your reminder?",
				"Ok... Cancelled",
				"Nothing to cancel.");
		assertThat(store.get(Principal.user("user-1"), ReminderDialogs.REMINDER_TITLES)).isEmpty();
	}

	@Test
	void usersKeepTheirOwnReminders() {
		addReminder("Morning Standup");
		bot.onTurn(Activity.message("conv-2", ChannelAccount.of("user-2"), BOT, "add a reminder"));
		bot.onTurn(Activity.message("conv-2", ChannelAccount.of("user-2"), BOT, "Yoga class"));

		assertThat(store.get(Principal.user("user-1"), ReminderDialogs.REMINDER_TITLES)).containsExactly("Morning Standup");
		assertThat(store.get(Principal.user("user-2"), ReminderDialogs.REMINDER_TITLES)).containsExactly("Yoga class");
	}

	@Test
	void concurrentConversationsDoNotInterfere() throws Exception {
		ChannelAccount alice = ChannelAccount.of("alice");
		ChannelAccount bob = ChannelAccount.of("bob");
		ExecutorService pool = Executors.newFixedThreadPool(2);
		try {
			SerializedTurnExecutor executor = new SerializedTurnExecutor(bot, pool);
			List<CompletableFuture<Void>> turns = List.of(
					executor.submit(Activity.message("conv-a", alice, BOT, "add a reminder")),
					executor.submit(Activity.message("conv-b", bob, BOT, "add a reminder")),
					executor.submit(Activity.message("conv-a", alice, BOT, "Alice standup")),
					executor.submit(Activity.message("conv-b", bob, BOT, "Bob dentist")));
			CompletableFuture.allOf(turns.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
		}
		finally {
			pool.shutdownNow();
		}

		assertThat(store.get(Principal.user("alice"), ReminderDialogs.REMINDER_TITLES)).containsExactly("Alice standup");
		assertThat(store.get(Principal.user("bob"), ReminderDialogs.REMINDER_TITLES)).containsExactly("Bob dentist");
		assertThat(sender.texts("conv-a")).containsExactly(
				"What would you like to call your reminder?", "Your reminder named 'Alice standup' is set.");
		assertThat(sender.texts("conv-b")).containsExactly(
				"What would you like to call your reminder?", "Your reminder named 'Bob dentist' is set.");
		assertThat(store.get(Principal.conversation("conv-a"), DialogStack.STATE_KEY).isEmpty()).isTrue();
		assertThat(store.get(Principal.conversation("conv-b"), DialogStack.STATE_KEY).isEmpty()).isTrue();
	}

	@Test
	void sameUserAddingInTwoConversationsKeepsBothReminders() throws Exception {
		AtomicBoolean racing = new AtomicBoolean();
		CountDownLatch bothRead = new CountDownLatch(2);
		InMemoryStateStore racingStore = new InMemoryStateStore() {
			@Override
			public void apply(List<StateChange> changes) {
				if (racing.get()) {
					// hold each commit until both turns have read the user's titles
					bothRead.countDown();
					try {
						bothRead.await(5, TimeUnit.SECONDS);
					}
					catch (InterruptedException e) {
						Thread.currentThread().interrupt();
						throw new IllegalStateException(e);
					}
				}
				super.apply(changes);
			}
		};
		RecordingMessageSender racingSender = new RecordingMessageSender();
		TurnDispatcher racingBot = ReminderBot.create(recognizer, racingStore, racingSender, DialogEngineConfig.defaults());
		racingBot.onTurn(Activity.message("conv-1", USER, BOT, "add a reminder"));
		racingBot.onTurn(Activity.message("conv-2", USER, BOT, "add a reminder"));
		racing.set(true);

		ExecutorService pool = Executors.newFixedThreadPool(2);
		try {
			SerializedTurnExecutor executor = new SerializedTurnExecutor(racingBot, pool);
			CompletableFuture.allOf(
					executor.submit(Activity.message("conv-1", USER, BOT, "Title one")),
					executor.submit(Activity.message("conv-2", USER, BOT, "Title two"))).get(10, TimeUnit.SECONDS);
		}
		finally {
			pool.shutdownNow();
		}

		assertThat(racingStore.get(Principal.user("user-1"), ReminderDialogs.REMINDER_TITLES))
				.containsExactlyInAnyOrder("Title one", "Title two");
		assertThat(racingSender.texts("conv-1")).containsExactly(
				"What would you like to call your reminder?", "Your reminder named 'Title one' is set.");
		assertThat(racingSender.texts("conv-2")).containsExactly(
				"What would you like to call your reminder?", "Your reminder named 'Title two' is set.");
	}

	@Test
	void chatModelDrivesIntentSelection() {
		ChatClient chatClient = mock(ChatClient.class, Mockito.RETURNS_DEEP_STUBS);
		when(chatClient.prompt().call().content())
				.thenReturn("{\"intents\":[{\"intent\":\"Calendar_Add\",\"score\":0.9}]}");
		TurnDispatcher llmBot = ReminderBot.create(chatClient, store, sender);

		llmBot.onTurn(Activity.message("conv-3", USER, BOT, "remind me about the dentist"));

		assertThat(sender.texts()).containsExactly("What would you like to call your reminder?");
	}
}
