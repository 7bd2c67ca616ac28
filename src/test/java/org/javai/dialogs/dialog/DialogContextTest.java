package org.javai.dialogs.dialog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.ArrayList;
import java.util.List;
import org.javai.dialogs.prompt.PromptOptions;
import org.javai.dialogs.prompt.TextPrompt;
import org.javai.dialogs.prompt.ValidationResult;
import org.javai.dialogs.state.InMemoryStateStore;
import org.javai.dialogs.state.Principal;
import org.javai.dialogs.testsupport.RecordingMessageSender;
import org.javai.dialogs.turn.Activity;
import org.javai.dialogs.turn.ChannelAccount;
import org.javai.dialogs.turn.TurnContext;
import org.junit.jupiter.api.Test;

class DialogContextTest {

	private static final ChannelAccount USER = ChannelAccount.of("user-1");
	private static final ChannelAccount BOT = ChannelAccount.of("bot");

	private final DialogRegistry registry = new DialogRegistry();
	private final InMemoryStateStore store = new InMemoryStateStore();
	private final RecordingMessageSender sender = new RecordingMessageSender();
	private final List<Object> received = new ArrayList<>();

	private DialogContext contextFor(String text) {
		TurnContext turn = new TurnContext(Activity.message("conv-1", USER, BOT, text), sender, store);
		DialogStack stack = store.get(Principal.conversation("conv-1"), DialogStack.STATE_KEY);
		return new DialogContext(registry, stack, turn);
	}

	private void save(DialogContext context) {
		store.set(Principal.conversation("conv-1"), DialogStack.STATE_KEY, context.stack());
	}

	@Test
	void beginRunsStepsUntilExhausted() {
		registry.waterfall("steps",
				(context, input) -> {
					context.send("one");
					return StepResult.advance();
				},
				(context, input) -> {
					context.send("two");
					return StepResult.advance();
				});

		DialogContext dialogs = contextFor("hi");
		DialogTurnResult result = dialogs.begin("steps", null);

		assertThat(result.status()).isEqualTo(DialogTurnResult.Status.COMPLETE);
		assertThat(result.result()).isNull();
		assertThat(dialogs.state()).isEqualTo(DialogState.IDLE);
		assertThat(sender.texts()).containsExactly("one", "two");
	}

	@Test
	void beginArgsArriveAsResumeValueOfFirstStep() {
		registry.waterfall("echo", (context, input) -> StepResult.end(input.valueAs(String.class).orElse("none")));

		DialogTurnResult result = contextFor("hi").begin("echo", "payload");

		assertThat(result.result()).isEqualTo("payload");
	}

	@Test
	void promptResultResumesParentOnLaterTurn() {
		registry.prompt("askName", new TextPrompt())
				.waterfall("greet",
						(context, input) -> StepResult.prompt("askName", "What is your name?"),
						(context, input) -> {
							received.add(input.valueAs(String.class).orElseThrow());
							return StepResult.end();
						});

		DialogContext first = contextFor("hi");
		DialogTurnResult waiting = first.begin("greet", null);
		save(first);

		assertThat(waiting.status()).isEqualTo(DialogTurnResult.Status.WAITING);
		assertThat(first.state()).isEqualTo(DialogState.AWAITING_INPUT);
		assertThat(sender.texts()).containsExactly("What is your name?");

		DialogContext second = contextFor("Ada");
		DialogTurnResult done = second.continueDialog("Ada");

		assertThat(done.status()).isEqualTo(DialogTurnResult.Status.COMPLETE);
		assertThat(received).containsExactly("Ada");
		assertThat(second.state()).isEqualTo(DialogState.IDLE);
	}

	@Test
	void rejectedInputRepromptsWithRetryMessage() {
		registry.prompt("askCode", new TextPrompt(value -> value.length() == 4
						? ValidationResult.accepted(value)
						: ValidationResult.rejected("Four characters please.")))
				.waterfall("code",
						(context, input) -> StepResult.prompt("askCode", "Code?"),
						(context, input) -> StepResult.end(input.valueAs(String.class).orElseThrow()));

		DialogContext dialogs = contextFor("hi");
		dialogs.begin("code", null);
		DialogTurnResult rejected = dialogs.continueDialog("12");

		assertThat(rejected.status()).isEqualTo(DialogTurnResult.Status.WAITING);
		assertThat(dialogs.state()).isEqualTo(DialogState.AWAITING_INPUT);
		assertThat(dialogs.stack().depth()).isEqualTo(2);
		assertThat(sender.texts()).containsExactly("Code?", "Four characters please.");

		DialogTurnResult accepted = dialogs.continueDialog("1234");
		assertThat(accepted.result()).isEqualTo("1234");
	}

	@Test
	void rejectionWithoutMessageUsesRetryPrompt() {
		registry.prompt("askCode", new TextPrompt(value -> ValidationResult.rejected()))
				.waterfall("code", (context, input) ->
						StepResult.prompt("askCode", PromptOptions.of("Code?").withRetryPrompt("Try again.")));

		DialogContext dialogs = contextFor("hi");
		dialogs.begin("code", null);
		dialogs.continueDialog("x");

		assertThat(sender.texts()).containsExactly("Code?", "Try again.");
	}

	@Test
	void childResultResumesParentAtNextStep() {
		registry.waterfall("child", (context, input) -> StepResult.end("from child"))
				.waterfall("parent",
						(context, input) -> StepResult.beginDialog("child", null),
						(context, input) -> StepResult.end("parent got " + input.valueAs(String.class).orElseThrow()));

		DialogTurnResult result = contextFor("hi").begin("parent", null);

		assertThat(result.result()).isEqualTo("parent got from child");
	}

	@Test
	void nestedBeginPushesChildOnTopOfParent() {
		registry.waterfall("B",
						(context, input) -> StepResult.waitForInput(),
						(context, input) -> StepResult.end("B done"))
				.waterfall("A",
						(context, input) -> StepResult.beginDialog("B", null),
						(context, input) -> {
							received.add(input.valueAs(String.class).orElseThrow());
							return StepResult.waitForInput();
						});

		DialogContext dialogs = contextFor("hi");
		dialogs.begin("A", null);

		assertThat(dialogs.stack().depth()).isEqualTo(2);
		assertThat(dialogs.activeFrame()).map(DialogFrame::dialogName).contains("B");

		dialogs.continueDialog("anything");

		assertThat(received).containsExactly("B done");
		assertThat(dialogs.stack().depth()).isEqualTo(1);
		assertThat(dialogs.activeFrame()).map(DialogFrame::stepIndex).contains(2);
	}

	@Test
	void waitForInputHandsNextTextToFollowingStep() {
		registry.waterfall("wait",
				(context, input) -> StepResult.waitForInput(),
				(context, input) -> StepResult.end(input.valueAs(String.class).orElseThrow()));

		DialogContext dialogs = contextFor("hi");
		dialogs.begin("wait", null);
		assertThat(dialogs.state()).isEqualTo(DialogState.ACTIVE);

		assertThat(dialogs.continueDialog("next").result()).isEqualTo("next");
	}

	@Test
	void continueOnIdleStackDoesNothing() {
		DialogTurnResult result = contextFor("hi").continueDialog("hi");

		assertThat(result.status()).isEqualTo(DialogTurnResult.Status.EMPTY);
		assertThat(sender.sent()).isEmpty();
	}

	@Test
	void cancelAllClearsNestedStack() {
		registry.prompt("ask", new TextPrompt())
				.waterfall("inner", (context, input) -> StepResult.prompt("ask", "Inner?"))
				.waterfall("outer", (context, input) -> StepResult.beginDialog("inner", null));

		DialogContext dialogs = contextFor("hi");
		dialogs.begin("outer", null);
		assertThat(dialogs.stack().depth()).isEqualTo(3);

		dialogs.cancelAll();

		assertThat(dialogs.state()).isEqualTo(DialogState.IDLE);
		assertThat(dialogs.activeFrame()).isEmpty();
	}

	@Test
	void beginOfUnknownDialogLeavesStackUntouched() {
		DialogContext dialogs = contextFor("hi");

		assertThatThrownBy(() -> dialogs.begin("Weather_Check", null))
				.isInstanceOf(UnknownDialogException.class);
		assertThat(dialogs.stack().isEmpty()).isTrue();
	}

	@Test
	void promptNeedsPromptOptions() {
		registry.prompt("ask", new TextPrompt());

		assertThatThrownBy(() -> contextFor("hi").begin("ask", 42))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void promptStepMustNameAPrompt() {
		registry.waterfall("other", (context, input) -> StepResult.end())
				.waterfall("broken", (context, input) -> StepResult.prompt("other", "?"));

		assertThatThrownBy(() -> contextFor("hi").begin("broken", null))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("other");
	}

	@Test
	void frameValuesSurviveAcrossTurns() {
		registry.prompt("ask", new TextPrompt())
				.waterfall("remember",
						(context, input) -> {
							context.values().put("first", "kept");
							return StepResult.prompt("ask", "Anything?");
						},
						(context, input) -> StepResult.end(context.values().get("first")));

		DialogContext first = contextFor("hi");
		first.begin("remember", null);
		save(first);

		assertThat(contextFor("ok").continueDialog("ok").result()).isEqualTo("kept");
	}
}
