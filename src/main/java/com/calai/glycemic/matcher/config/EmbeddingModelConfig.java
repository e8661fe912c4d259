package com.calai.glycemic.matcher.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2.AllMiniLmL6V2EmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/**
 * 預設 embedding provider：in-process all-MiniLM-L6-v2（ONNX，不需要網路）。
 * 其他 EmbeddingModel bean 會取代它。
 */
@Slf4j
@Configuration
public class EmbeddingModelConfig {

    @Bean
    @Lazy
    @ConditionalOnMissingBean(EmbeddingModel.class)
    @ConditionalOnProperty(name = "glycemic.matcher.embeddings-enabled", havingValue = "true", matchIfMissing = true)
    public EmbeddingModel foodNameEmbeddingModel() {
        log.info("[FoodMatcher] loading embedding model: all-MiniLM-L6-v2");
        return new AllMiniLmL6V2EmbeddingModel();
    }
}
