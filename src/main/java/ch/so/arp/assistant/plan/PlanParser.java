package ch.so.arp.assistant.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Two stage parser for planner responses: the content of a fenced
 * {@code json} block is tried first, then the complete response. Neither stage
 * throws; an unusable response yields an empty result.
 */
public class PlanParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(PlanParser.class);

    private static final Pattern FENCED_JSON = Pattern.compile("```json[ \\t]*\\r?\\n(.*?)\\r?\\n[ \\t]*```",
            Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public PlanParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public Optional<Plan> parse(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        Optional<Plan> fenced = extractFencedBlock(response).flatMap(this::readPlan);
        if (fenced.isPresent()) {
            return fenced;
        }
        return readPlan(response.strip());
    }

    Optional<String> extractFencedBlock(String response) {
        Matcher matcher = FENCED_JSON.matcher(response);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    private Optional<Plan> readPlan(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException ex) {
            LOGGER.debug("Planner response is not valid JSON: {}", ex.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.isArray() || root.isEmpty()) {
            LOGGER.debug("Planner response is not a non-empty JSON array");
            return Optional.empty();
        }
        List<PlanStep> steps = new ArrayList<>(root.size());
        for (JsonNode element : root) {
            JsonNode prompt = element.path("prompt");
            if (!element.isObject() || !prompt.isTextual()) {
                LOGGER.debug("Planner step without textual prompt: {}", element);
                return Optional.empty();
            }
            steps.add(new PlanStep(agentName(element.path("agent")), prompt.asText()));
        }
        return Optional.of(new Plan(steps));
    }

    private String agentName(JsonNode agent) {
        if (agent.isMissingNode() || agent.isNull()) {
            return "";
        }
        return agent.isTextual() ? agent.asText() : agent.toString();
    }
}
