package org.javai.springai.escalation.remote;

import java.util.Objects;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;

/**
 * Builds {@link ChatClient}s for remote tiers served behind an OpenAI-compatible endpoint.
 */
public final class RemoteTierClients {

	private RemoteTierClients() {
	}

	/**
	 * A chat client for an OpenAI-compatible endpoint.
	 *
	 * @param baseUrl endpoint base URL, e.g. {@code http://localhost:8000}
	 * @param apiKey API key, any non-blank value for services that do not check it
	 * @param model model name sent with every request
	 * @param temperature sampling temperature
	 */
	public static ChatClient openAiCompatible(String baseUrl, String apiKey, String model, double temperature) {
		Objects.requireNonNull(baseUrl, "baseUrl must not be null");
		Objects.requireNonNull(apiKey, "apiKey must not be null");
		Objects.requireNonNull(model, "model must not be null");
		OpenAiApi openAiApi = OpenAiApi.builder()
				.baseUrl(baseUrl)
				.apiKey(apiKey)
				.build();
		OpenAiChatModel chatModel = OpenAiChatModel.builder()
				.openAiApi(openAiApi)
				.build();
		OpenAiChatOptions options = OpenAiChatOptions.builder()
				.model(model)
				.temperature(temperature)
				.build();
		return ChatClient.builder(Objects.requireNonNull(chatModel))
				.defaultOptions(options)
				.build();
	}

	public static PatternTierClient pattern(String baseUrl, String apiKey, String model) {
		return new PatternTierClient(openAiCompatible(baseUrl, apiKey, model, 0.0), model);
	}

	public static PlannerTierClient planner(String baseUrl, String apiKey, String model) {
		return new PlannerTierClient(openAiCompatible(baseUrl, apiKey, model, 0.2), model);
	}
}
