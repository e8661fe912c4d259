package com.calai.glycemic.knowledge.config;

import com.calai.glycemic.knowledge.service.NutritionKnowledgeBase;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

@Configuration
@EnableConfigurationProperties(KnowledgeBaseProperties.class)
public class KnowledgeBaseConfig {

    static final String DEFAULT_SOURCE = "nutrition_data.csv";

    /** 啟動時讀檔；來源打不開直接讓 context 起不來（SOURCE_UNAVAILABLE） */
    @Bean
    public NutritionKnowledgeBase nutritionKnowledgeBase(KnowledgeBaseProperties props) {
        Resource source = props.getSource() != null ? props.getSource() : new ClassPathResource(DEFAULT_SOURCE);
        return NutritionKnowledgeBase.load(source, props.getDuplicatePolicy());
    }
}
