package org.javai.dialogs.intent;

/**
 * One candidate intent and its confidence.
 *
 * @param intent the intent name
 * @param score confidence in [0, 1]
 */
public record IntentScore(String intent, double score) {

	public IntentScore {
		if (intent == null || intent.isBlank()) {
			throw new IllegalArgumentException("intent must not be blank");
		}
		if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
			throw new IllegalArgumentException("score must be between 0 and 1, got " + score);
		}
	}
}
