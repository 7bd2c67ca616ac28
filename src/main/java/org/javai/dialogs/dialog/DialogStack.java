package org.javai.dialogs.dialog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.javai.dialogs.state.StateKey;

/**
 * Ordered dialog frames of one conversation; the last frame is the active one.
 */
public class DialogStack {

	/**
	 * Conversation-scoped key under which the stack is persisted.
	 */
	public static final StateKey<DialogStack> STATE_KEY = StateKey.of("dialogStack", DialogStack.class, DialogStack::new);

	private final List<DialogFrame> frames;

	public DialogStack() {
		this(new ArrayList<>());
	}

	@JsonCreator
	DialogStack(@JsonProperty("frames") List<DialogFrame> frames) {
		this.frames = frames != null ? new ArrayList<>(frames) : new ArrayList<>();
	}

	@JsonProperty("frames")
	public List<DialogFrame> frames() {
		return List.copyOf(frames);
	}

	void push(DialogFrame frame) {
		frames.add(frame);
	}

	DialogFrame pop() {
		if (frames.isEmpty()) {
			throw new IllegalStateException("Dialog stack is empty");
		}
		return frames.remove(frames.size() - 1);
	}

	public Optional<DialogFrame> top() {
		return frames.isEmpty() ? Optional.empty() : Optional.of(frames.get(frames.size() - 1));
	}

	void clear() {
		frames.clear();
	}

	@JsonIgnore
	public boolean isEmpty() {
		return frames.isEmpty();
	}

	public int depth() {
		return frames.size();
	}

	@Override
	public String toString() {
		return "DialogStack" + frames;
	}
}
