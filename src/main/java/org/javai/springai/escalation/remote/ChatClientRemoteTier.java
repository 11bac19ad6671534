package org.javai.springai.escalation.remote;

import java.time.Instant;
import java.util.Objects;
import org.javai.springai.escalation.action.CandidateAction;
import org.javai.springai.escalation.remote.CandidateActionParser.MalformedResponseException;
import org.javai.springai.escalation.snapshot.SnapshotJson;
import org.javai.springai.escalation.snapshot.StateSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Remote tier backed by a Spring AI {@link ChatClient}.
 *
 * <p>The snapshot goes out as JSON in the user message; the model is expected to reply with a
 * single action object. Transport problems, empty replies and unparseable replies all come
 * back as {@link TierResult.Failed}; a {@code none} reply comes back as {@link TierResult.Empty}.</p>
 */
public abstract class ChatClientRemoteTier implements RemoteTier {

	private static final Logger logger = LoggerFactory.getLogger(ChatClientRemoteTier.class);

	static final String RESPONSE_FORMAT = """
			Reply with exactly one JSON object and nothing else:
			{"kind": "<action kind>", "parameters": {<name>: <value>}, "confidence": <0..1>, "rationale": "<short reason>"}
			Use "kind": "none" when no action is advisable.""";

	private final ChatClient chatClient;
	private final String modelId;
	private final String dependencyName;
	private final CandidateActionParser parser;

	protected ChatClientRemoteTier(ChatClient chatClient, String modelId, String dependencyName,
			double defaultConfidence) {
		if (chatClient == null) {
			throw new IllegalArgumentException("chatClient must not be null");
		}
		if (dependencyName == null || dependencyName.isBlank()) {
			throw new IllegalArgumentException("dependencyName must not be blank");
		}
		this.chatClient = chatClient;
		this.modelId = modelId == null ? "" : modelId;
		this.dependencyName = dependencyName;
		this.parser = new CandidateActionParser(defaultConfidence);
	}

	/**
	 * Instruction describing the tier's role to the model.
	 */
	protected abstract String systemInstruction();

	@Override
	public String dependencyName() {
		return dependencyName;
	}

	public String modelId() {
		return modelId;
	}

	@Override
	public TierResult decide(StateSnapshot snapshot, Instant deadline) {
		Objects.requireNonNull(snapshot, "snapshot must not be null");
		String response;
		try {
			response = invokeModel(SnapshotJson.toJson(snapshot));
		}
		catch (RuntimeException ex) {
			logger.warn("{} tier call to '{}' failed: {}", tier().wireName(), dependencyName, ex.getMessage());
			return TierResult.failed(TierError.transport(describe(ex)));
		}
		try {
			CandidateAction action = parser.parse(response);
			if (action.isNone()) {
				return TierResult.empty(action.rationale());
			}
			return TierResult.proposed(action, modelId);
		}
		catch (MalformedResponseException ex) {
			logger.warn("{} tier reply from '{}' was malformed: {}", tier().wireName(), dependencyName, ex.getMessage());
			return TierResult.failed(TierError.malformed(ex.getMessage()));
		}
	}

	private String invokeModel(String snapshotJson) {
		ChatClient.ChatClientRequestSpec request = chatClient.prompt();
		request.system(systemInstruction() + "\n\n" + RESPONSE_FORMAT);
		request.user(snapshotJson);
		String content = request.call().content();
		logger.debug("{} tier response:\n{}", tier().wireName(), content);
		return content;
	}

	private static String describe(Throwable ex) {
		String message = ex.getMessage();
		return ex.getClass().getSimpleName() + (message == null ? "" : ": " + message);
	}
}
