package org.javai.dialogs.intent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Intent recognizer that asks a chat model to score a fixed set of intent names.
 *
 * <p>The model is instructed to answer with JSON of the form
 * {@code {"intents":[{"intent":"Calendar_Add","score":0.92}]}}. Scores outside
 * [0, 1] are clamped, names outside the known set are dropped, and a reply that is
 * not such a document yields an empty recognition.</p>
 */
public class ChatClientIntentRecognizer implements IntentRecognizer {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientIntentRecognizer.class);

	private static final Pattern JSON_BLOCK_PATTERN = Pattern.compile("```(?:json)?\\s*\\n?(\\{.*?\\})\\s*```", Pattern.DOTALL);

	private final ChatClient chatClient;
	private final Set<String> intents;
	private final ObjectMapper objectMapper;

	public ChatClientIntentRecognizer(ChatClient chatClient, List<String> intents) {
		this(chatClient, intents, new ObjectMapper());
	}

	public ChatClientIntentRecognizer(ChatClient chatClient, List<String> intents, ObjectMapper objectMapper) {
		this.chatClient = Objects.requireNonNull(chatClient, "chatClient must not be null");
		if (intents == null || intents.isEmpty()) {
			throw new IllegalArgumentException("intents must not be empty");
		}
		this.intents = new LinkedHashSet<>(intents);
		this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
	}

	@Override
	public IntentRecognition recognize(String conversationId, String text) {
		if (text == null || text.isBlank()) {
			return IntentRecognition.empty();
		}
		ChatClient.ChatClientRequestSpec request = chatClient.prompt();
		request.system(systemPrompt());
		request.user(text);
		String content = request.call().content();
		logger.debug("Intent model reply for conversation {}: {}", conversationId, content);
		return parse(content);
	}

	String systemPrompt() {
		return """
				You classify a user's message into intents.
				Known intents: %s
				Reply with JSON ONLY, in this form:
				{"intents":[{"intent":"<one of the known intents>","score":<number between 0 and 1>}]}
				Include every known intent that could apply, with your confidence as score.
				""".formatted(String.join(", ", intents));
	}

	private IntentRecognition parse(String content) {
		if (content == null || content.isBlank()) {
			logger.warn("Intent model returned an empty reply");
			return IntentRecognition.empty();
		}
		String json = extractJson(content.trim());
		JsonNode root;
		try {
			root = objectMapper.readTree(json);
		}
		catch (JsonProcessingException e) {
			logger.warn("Intent model reply is not valid JSON: {}", e.getOriginalMessage());
			return IntentRecognition.empty();
		}
		JsonNode array = root == null ? null : root.get("intents");
		if (array == null || !array.isArray()) {
			logger.warn("Intent model reply has no 'intents' array");
			return IntentRecognition.empty();
		}

		List<IntentScore> scores = new ArrayList<>();
		for (JsonNode entry : array) {
			JsonNode name = entry.get("intent");
			JsonNode score = entry.get("score");
			if (name == null || !name.isTextual() || score == null || !score.isNumber()) {
				logger.warn("Skipping malformed intent entry: {}", entry);
				continue;
			}
			if (!intents.contains(name.asText())) {
				logger.debug("Ignoring unknown intent '{}'", name.asText());
				continue;
			}
			scores.add(new IntentScore(name.asText(), clamp(score.asDouble())));
		}
		return new IntentRecognition(scores);
	}

	private static String extractJson(String content) {
		Matcher matcher = JSON_BLOCK_PATTERN.matcher(content);
		return matcher.find() ? matcher.group(1).trim() : content;
	}

	private static double clamp(double score) {
		if (Double.isNaN(score)) {
			return 0.0;
		}
		return Math.max(0.0, Math.min(1.0, score));
	}
}
