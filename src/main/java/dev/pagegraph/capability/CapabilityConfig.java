package dev.pagegraph.capability;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pagegraph.config.CapabilityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Picks the summarization and embedding back ends from {@code pagegraph.capabilities}.
 * Swapping a local heuristic for a model is configuration only.
 */
@Configuration
public class CapabilityConfig {

    private static final Logger log = LoggerFactory.getLogger(CapabilityConfig.class);

    @Bean
    public SummarizationAdapter summarizationAdapter(CapabilityProperties properties,
                                                     ObjectProvider<ChatModel> chatModel,
                                                     ObjectMapper objectMapper) {
        if ("spring-ai".equalsIgnoreCase(properties.summarizer())) {
            ChatModel model = chatModel.getIfAvailable();
            if (model == null) {
                throw new IllegalStateException(
                        "pagegraph.capabilities.summarizer=spring-ai but no ChatModel is configured");
            }
            log.info("Summarizer: Spring AI chat model {}", model.getClass().getSimpleName());
            return new SpringAiSummarizationAdapter(model, objectMapper, properties);
        }
        log.info("Summarizer: heuristic");
        return new HeuristicSummarizationAdapter();
    }

    @Bean
    public EmbeddingAdapter embeddingAdapter(CapabilityProperties properties,
                                             ObjectProvider<EmbeddingModel> embeddingModel) {
        if ("spring-ai".equalsIgnoreCase(properties.embedder())) {
            EmbeddingModel model = embeddingModel.getIfAvailable();
            if (model == null) {
                throw new IllegalStateException(
                        "pagegraph.capabilities.embedder=spring-ai but no EmbeddingModel is configured");
            }
            log.info("Embedder: Spring AI embedding model {}", model.getClass().getSimpleName());
            return new SpringAiEmbeddingAdapter(model);
        }
        log.info("Embedder: hashing ({} dimensions)", properties.hashingDimensions());
        return new HashingEmbeddingAdapter(properties.hashingDimensions());
    }
}
