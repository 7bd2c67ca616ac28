package org.javai.dialogs.dialog;

import java.util.Optional;

/**
 * Input handed to a step.
 */
public sealed interface StepInput permits StepInput.NoInput, StepInput.ResumeResult {

	record NoInput() implements StepInput {
	}

	/**
	 * @param value the resumed value; {@code null} when a child dialog ended without a result
	 */
	record ResumeResult(Object value) implements StepInput {
	}

	static StepInput none() {
		return new NoInput();
	}

	static StepInput resume(Object value) {
		return new ResumeResult(value);
	}

	/**
	 * The resumed value if present and of the requested type.
	 */
	default <T> Optional<T> valueAs(Class<T> type) {
		if (this instanceof ResumeResult resume && type.isInstance(resume.value())) {
			return Optional.of(type.cast(resume.value()));
		}
		return Optional.empty();
	}
}
