package dev.pagegraph.capability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pagegraph.config.CapabilityProperties;
import dev.pagegraph.exception.SummarizeException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;

import java.util.ArrayList;
import java.util.List;

/**
 * Summarizes through whatever Spring AI {@link ChatModel} is configured (Ollama by default).
 * The model is asked for strict JSON; fenced or chatty replies are tolerated.
 */
public class SpringAiSummarizationAdapter implements SummarizationAdapter {

    private static final Logger log = LoggerFactory.getLogger(SpringAiSummarizationAdapter.class);

    private static final String PROMPT = """
            You summarize web pages for a personal knowledge base.
            Respond ONLY with JSON: {"summary":"2-4 sentences","concepts":["topic", "..."]}
            concepts: up to 8 short noun phrases naming what the page is about, most central first.
            Page text:
            %s""";

    private final ChatModel chatModel;
    private final ObjectMapper objectMapper;
    private final CapabilityProperties properties;

    public SpringAiSummarizationAdapter(ChatModel chatModel, ObjectMapper objectMapper,
                                        CapabilityProperties properties) {
        this.chatModel = chatModel;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    @CircuitBreaker(name = "summarizer")
    public SummaryResult summarize(String text) {
        String input = text.length() > properties.maxSummaryInputChars()
                ? text.substring(0, properties.maxSummaryInputChars())
                : text;
        ChatOptions options = ChatOptions.builder()
                .temperature(0.1)
                .maxTokens(properties.maxOutputTokens())
                .build();
        String reply;
        try {
            ChatResponse response = chatModel.call(new Prompt(PROMPT.formatted(input), options));
            reply = response.getResult().getOutput().getText();
        } catch (RuntimeException e) {
            throw new SummarizeException("Chat model call failed: " + e.getMessage(), e);
        }
        return parse(reply);
    }

    SummaryResult parse(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new SummarizeException("Chat model returned an empty reply");
        }
        JsonNode payload = readJson(reply);
        String summary = textOrNull(payload.get("summary"));
        if (summary == null) {
            throw new SummarizeException("Summary missing from model reply");
        }
        JsonNode conceptsNode = payload.has("concepts") ? payload.get("concepts") : payload.get("topics");
        List<String> concepts = new ArrayList<>();
        if (conceptsNode != null && conceptsNode.isArray()) {
            for (JsonNode node : conceptsNode) {
                String label = textOrNull(node);
                if (label != null) concepts.add(label);
            }
        }
        return new SummaryResult(summary, concepts);
    }

    private JsonNode readJson(String reply) {
        String cleaned = reply.replace("```json", "").replace("```", "").trim();
        try {
            return objectMapper.readTree(cleaned);
        } catch (JsonProcessingException first) {
            int open = cleaned.indexOf('{');
            int close = cleaned.lastIndexOf('}');
            if (open < 0 || close <= open) {
                throw new SummarizeException("Model reply contained no JSON object");
            }
            log.debug("Model reply needed brace extraction: {}", first.getOriginalMessage());
            try {
                return objectMapper.readTree(cleaned.substring(open, close + 1));
            } catch (JsonProcessingException e) {
                throw new SummarizeException("Model reply JSON could not be parsed", e);
            }
        }
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || !node.isValueNode()) return null;
        String value = node.asText().strip();
        return value.isEmpty() ? null : value;
    }
}
