package ch.so.arp.assistant.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.EnvironmentAware;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Configuration properties describing how to reach the hosted Gemini model.
 */
@ConfigurationProperties(prefix = "assistant.llm.gemini")
public class GeminiClientProperties implements EnvironmentAware {

    /**
     * API key appended to every generateContent request.
     */
    private String apiKey;

    /**
     * Base URL of the generative language API.
     */
    private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";

    /**
     * Name of the generative model.
     */
    private String model = "gemini-2.5-flash";

    private Environment environment;

    public String getApiKey() {
        if (StringUtils.hasText(apiKey)) {
            return apiKey;
        }
        return environment != null ? environment.getProperty("GEMINI_API_KEY") : null;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getModel() {
        return model;
    }

    public void setModel(String model) {
        this.model = model;
    }

    @Override
    public void setEnvironment(Environment environment) {
        this.environment = environment;
    }
}
