package com.calai.glycemic.matcher.config;

import com.calai.glycemic.knowledge.service.NutritionKnowledgeBase;
import com.calai.glycemic.matcher.FoodNameMatcher;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeansException;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(FoodMatcherProperties.class)
public class FoodMatcherConfig {

    @Bean
    public FoodNameMatcher foodNameMatcher(NutritionKnowledgeBase knowledgeBase,
                                           ObjectProvider<EmbeddingModel> embeddingModels,
                                           FoodMatcherProperties props) {
        EmbeddingModel model = props.isEmbeddingsEnabled() ? resolveEmbeddingModel(embeddingModels) : null;
        FoodNameMatcher matcher = new FoodNameMatcher(knowledgeBase.listNames(), model, props.getBatchSize());
        log.info("[FoodMatcher] ready: corpus={}, mode={}",
                matcher.corpusSize(), matcher.embeddingsEnabled() ? "embedding" : "substring");
        return matcher;
    }

    /** provider 建不起來（ONNX runtime 缺 native lib 等）→ null，matcher 走子字串 */
    static EmbeddingModel resolveEmbeddingModel(ObjectProvider<EmbeddingModel> embeddingModels) {
        try {
            return embeddingModels.getIfAvailable();
        } catch (BeansException | LinkageError e) {
            log.warn("[FoodMatcher] embedding provider unavailable: {}", e.toString());
            return null;
        }
    }
}
