package org.javai.dialogs.config;

/**
 * Settings of the turn dispatcher.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * DialogEngineConfig config = DialogEngineConfig.defaults();
 *
 * DialogEngineConfig config = DialogEngineConfig.builder()
 *         .intentThreshold(0.5)
 *         .welcomeMessage("Hello there")
 *         .build();
 * }</pre>
 *
 * @param cancelKeyword text that cancels all active dialogs (compared trimmed, case-insensitively)
 * @param intentThreshold minimum score, exclusive, for the top intent to be used
 * @param fallbackIntent dialog begun when no intent clears the threshold
 * @param welcomeMessage sent when the bot joins a conversation
 * @param cancelledMessage acknowledgement of a cancellation
 * @param nothingToCancelMessage reply to the cancel keyword with no active dialog
 */
public record DialogEngineConfig(
		String cancelKeyword,
		double intentThreshold,
		String fallbackIntent,
		String welcomeMessage,
		String cancelledMessage,
		String nothingToCancelMessage
) {

	public static final String DEFAULT_CANCEL_KEYWORD = "cancel";
	public static final double DEFAULT_INTENT_THRESHOLD = 0.2;
	public static final String DEFAULT_FALLBACK_INTENT = "None";
	public static final String DEFAULT_WELCOME_MESSAGE = "Hi! I'm a simple reminder bot. I can add reminders and show them.";
	public static final String DEFAULT_CANCELLED_MESSAGE = "Ok... Cancelled";
	public static final String DEFAULT_NOTHING_TO_CANCEL_MESSAGE = "Nothing to cancel.";

	public DialogEngineConfig {
		requireText(cancelKeyword, "cancelKeyword");
		requireText(fallbackIntent, "fallbackIntent");
		requireText(welcomeMessage, "welcomeMessage");
		requireText(cancelledMessage, "cancelledMessage");
		requireText(nothingToCancelMessage, "nothingToCancelMessage");
		if (intentThreshold < 0.0 || intentThreshold > 1.0) {
			throw new IllegalArgumentException("intentThreshold must be between 0 and 1");
		}
		cancelKeyword = cancelKeyword.trim();
	}

	public static DialogEngineConfig defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	private static void requireText(String value, String name) {
		if (value == null || value.isBlank()) {
			throw new IllegalArgumentException(name + " must not be blank");
		}
	}

	/**
	 * Builder for {@link DialogEngineConfig}.
	 */
	public static class Builder {
		private String cancelKeyword = DEFAULT_CANCEL_KEYWORD;
		private double intentThreshold = DEFAULT_INTENT_THRESHOLD;
		private String fallbackIntent = DEFAULT_FALLBACK_INTENT;
		private String welcomeMessage = DEFAULT_WELCOME_MESSAGE;
		private String cancelledMessage = DEFAULT_CANCELLED_MESSAGE;
		private String nothingToCancelMessage = DEFAULT_NOTHING_TO_CANCEL_MESSAGE;

		private Builder() {}

		public Builder cancelKeyword(String cancelKeyword) {
			this.cancelKeyword = cancelKeyword;
			return this;
		}

		/**
		 * Sets the score the top intent must exceed to be used.
		 *
		 * @param intentThreshold a value in [0, 1]
		 * @return this builder
		 */
		public Builder intentThreshold(double intentThreshold) {
			this.intentThreshold = intentThreshold;
			return this;
		}

		public Builder fallbackIntent(String fallbackIntent) {
			this.fallbackIntent = fallbackIntent;
			return this;
		}

		public Builder welcomeMessage(String welcomeMessage) {
			this.welcomeMessage = welcomeMessage;
			return this;
		}

		public Builder cancelledMessage(String cancelledMessage) {
			this.cancelledMessage = cancelledMessage;
			return this;
		}

		public Builder nothingToCancelMessage(String nothingToCancelMessage) {
			this.nothingToCancelMessage = nothingToCancelMessage;
			return this;
		}

		public DialogEngineConfig build() {
			return new DialogEngineConfig(cancelKeyword, intentThreshold, fallbackIntent,
					welcomeMessage, cancelledMessage, nothingToCancelMessage);
		}
	}
}
