package org.javai.dialogs.intent;

/**
 * Classifies an utterance into scored intents.
 *
 * <p>Implementations may call remote services; their exceptions propagate to the
 * caller and fail the turn.</p>
 */
@FunctionalInterface
public interface IntentRecognizer {

	IntentRecognition recognize(String conversationId, String text);
}
