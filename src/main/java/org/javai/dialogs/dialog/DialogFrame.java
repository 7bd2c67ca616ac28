package org.javai.dialogs.dialog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.Map;
import org.javai.dialogs.prompt.PromptOptions;

/**
 * One activation of a dialog definition on the stack.
 *
 * <p>Frames are persisted with the conversation, so the values a step stores here
 * must be JSON-friendly (strings, numbers, booleans, lists and maps of those).</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DialogFrame {

	private final String dialogName;
	private int stepIndex;
	private final Map<String, Object> values;
	private PromptOptions promptOptions;

	public DialogFrame(String dialogName) {
		this(dialogName, 0, new LinkedHashMap<>(), null);
	}

	@JsonCreator
	DialogFrame(
			@JsonProperty("dialogName") String dialogName,
			@JsonProperty("stepIndex") int stepIndex,
			@JsonProperty("values") Map<String, Object> values,
			@JsonProperty("promptOptions") PromptOptions promptOptions) {
		if (dialogName == null || dialogName.isBlank()) {
			throw new IllegalArgumentException("dialogName must not be blank");
		}
		this.dialogName = dialogName;
		this.stepIndex = stepIndex;
		this.values = values != null ? new LinkedHashMap<>(values) : new LinkedHashMap<>();
		this.promptOptions = promptOptions;
	}

	@JsonProperty("dialogName")
	public String dialogName() {
		return dialogName;
	}

	/**
	 * Index of the next step to run in this frame.
	 */
	@JsonProperty("stepIndex")
	public int stepIndex() {
		return stepIndex;
	}

	void stepIndex(int stepIndex) {
		this.stepIndex = stepIndex;
	}

	/**
	 * Dialog-local values steps use to pass data forward.
	 */
	@JsonProperty("values")
	public Map<String, Object> values() {
		return values;
	}

	@JsonProperty("promptOptions")
	public PromptOptions promptOptions() {
		return promptOptions;
	}

	void promptOptions(PromptOptions promptOptions) {
		this.promptOptions = promptOptions;
	}

	@JsonIgnore
	public boolean isPrompt() {
		return promptOptions != null;
	}

	@Override
	public String toString() {
		return "DialogFrame[" + dialogName + "@" + stepIndex + (isPrompt() ? ", prompt" : "") + "]";
	}
}
