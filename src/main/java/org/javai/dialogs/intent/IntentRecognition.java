package org.javai.dialogs.intent;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ranked intents for one utterance, highest score first.
 */
public record IntentRecognition(List<IntentScore> intents) {

	public IntentRecognition {
		intents = intents == null ? List.of()
				: intents.stream()
						.sorted(Comparator.comparingDouble(IntentScore::score).reversed())
						.toList();
	}

	public static IntentRecognition empty() {
		return new IntentRecognition(List.of());
	}

	public static IntentRecognition of(IntentScore... intents) {
		return new IntentRecognition(List.of(intents));
	}

	public Optional<IntentScore> topIntent() {
		return intents.isEmpty() ? Optional.empty() : Optional.of(intents.get(0));
	}
}
