package ch.so.arp.assistant.llm;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@link LlmClient} calling the {@code generateContent} endpoint of the Gemini
 * API. Failures of any kind are reported as {@link LlmException}; no retry is
 * attempted.
 */
public class GeminiLlmClient implements LlmClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiLlmClient.class);

    private final GeminiClientProperties properties;
    private final RestClient restClient;

    public GeminiLlmClient(GeminiClientProperties properties, RestClient.Builder restClientBuilder) {
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new IllegalArgumentException(
                    "Property 'assistant.llm.gemini.api-key' must be provided when the mock client is disabled");
        }
        this.properties = properties;
        this.restClient = restClientBuilder.baseUrl(properties.getBaseUrl()).build();
    }

    @Override
    public String generate(String prompt, ImageAttachment image) {
        LOGGER.debug("Generating with model {} via base URL {} (image attached: {})", properties.getModel(),
                properties.getBaseUrl(), image != null);
        JsonNode response;
        try {
            response = restClient.post()
                    .uri("/models/{model}:generateContent?key={key}", properties.getModel(), properties.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(requestBody(prompt, image))
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException ex) {
            throw new LlmException("Generation failed: " + ex.getMessage(), ex);
        }
        JsonNode text = response == null ? null
                : response.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (text == null || !text.isTextual()) {
            throw new LlmException("Generation failed: response did not contain any text");
        }
        return text.asText();
    }

    private Map<String, Object> requestBody(String prompt, ImageAttachment image) {
        List<Map<String, Object>> parts = new ArrayList<>();
        parts.add(Map.of("text", prompt));
        if (image != null) {
            parts.add(Map.of("inline_data", Map.of("mime_type", image.mimeType(), "data", image.base64Data())));
        }
        return Map.of("contents", List.of(Map.of("parts", parts)));
    }
}
