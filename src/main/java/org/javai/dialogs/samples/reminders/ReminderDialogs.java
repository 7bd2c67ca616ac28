package org.javai.dialogs.samples.reminders;

import com.fasterxml.jackson.core.type.TypeReference;
import java.util.ArrayList;
import java.util.List;
import org.javai.dialogs.config.DialogEngineConfig;
import org.javai.dialogs.dialog.DialogRegistry;
import org.javai.dialogs.dialog.StepContext;
import org.javai.dialogs.dialog.StepInput;
import org.javai.dialogs.dialog.StepResult;
import org.javai.dialogs.prompt.ChoicePrompt;
import org.javai.dialogs.prompt.FoundChoice;
import org.javai.dialogs.prompt.PromptOptions;
import org.javai.dialogs.prompt.TextPrompt;
import org.javai.dialogs.state.StateKey;

/**
 * Dialogs of the reminder bot: a greeting, adding a reminder and showing one.
 *
 * <p>Dialog names match the intents the recognizer is asked to produce.</p>
 */
public final class ReminderDialogs {

	public static final String NONE = "None";
	public static final String CALENDAR_ADD = "Calendar_Add";
	public static final String CALENDAR_FIND = "Calendar_Find";
	public static final String TITLE_PROMPT = "TitlePrompt";
	public static final String SHOW_REMINDER_PROMPT = "ShowReminderPrompt";

	/**
	 * Intents the reminder bot understands.
	 */
	public static final List<String> INTENTS = List.of(NONE, CALENDAR_ADD, CALENDAR_FIND);

	/**
	 * The user's reminder titles, oldest first.
	 */
	public static final StateKey<List<String>> REMINDER_TITLES =
			StateKey.of("reminderTitles", new TypeReference<List<String>>() {}, ArrayList::new);

	static final String ASK_TITLE = "What would you like to call your reminder?";
	static final String SELECT_REMINDER = "Select the reminder to show: ";
	static final String NO_REMINDERS = "You have no reminders.";
	static final int MAX_CHOICE_LENGTH = 15;

	private static final String TITLE = "title";

	private final String greeting;

	public ReminderDialogs(DialogEngineConfig config) {
		this.greeting = config.welcomeMessage();
	}

	public DialogRegistry register(DialogRegistry registry) {
		return registry
				.waterfall(NONE, this::greet)
				.waterfall(CALENDAR_ADD, this::askReminderTitle, this::saveReminder)
				.waterfall(CALENDAR_FIND, this::showReminders, this::confirmShow)
				.prompt(TITLE_PROMPT, new TextPrompt(new TitleValidator()))
				.prompt(SHOW_REMINDER_PROMPT, new ChoicePrompt());
	}

	private StepResult greet(StepContext context, StepInput input) {
		context.send(greeting);
		return StepResult.end();
	}

	private StepResult askReminderTitle(StepContext context, StepInput input) {
		String title = input.valueAs(String.class).orElse(null);
		if (TitleValidator.isValid(title)) {
			context.values().put(TITLE, title);
			return StepResult.advance();
		}
		return StepResult.prompt(TITLE_PROMPT, ASK_TITLE);
	}

	private StepResult saveReminder(StepContext context, StepInput input) {
		String title = input.valueAs(String.class).orElse((String) context.values().get(TITLE));

		List<String> titles = context.userState(REMINDER_TITLES);
		titles.add(title);
		context.setUserState(REMINDER_TITLES, titles);

		context.send("Your reminder named '" + title + "' is set.");
		return StepResult.end(title);
	}

	private StepResult showReminders(StepContext context, StepInput input) {
		List<String> titles = context.userState(REMINDER_TITLES);
		if (titles.isEmpty()) {
			context.send(NO_REMINDERS);
			return StepResult.end();
		}
		List<String> choices = titles.stream().map(ReminderDialogs::shorten).toList();
		return StepResult.prompt(SHOW_REMINDER_PROMPT, PromptOptions.withChoices(SELECT_REMINDER, choices));
	}

	private StepResult confirmShow(StepContext context, StepInput input) {
		FoundChoice choice = input.valueAs(FoundChoice.class).orElse(null);
		if (choice != null) {
			List<String> titles = context.userState(REMINDER_TITLES);
			if (choice.index() < titles.size()) {
				String reminder = titles.get(choice.index());
				context.send("Reminder: " + reminder);
				return StepResult.end(reminder);
			}
		}
		return StepResult.end();
	}

	static String shorten(String title) {
		return title.length() < MAX_CHOICE_LENGTH ? title : title.substring(0, MAX_CHOICE_LENGTH) + "...";
	}
}
