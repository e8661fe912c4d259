package com.calai.glycemic.knowledge.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;

/**
 * application.yml:
 * glycemic.knowledge.*
 */
@ConfigurationProperties(prefix = "glycemic.knowledge")
public class KnowledgeBaseProperties {

    /** CSV 位置（classpath: 或 file:） */
    private Resource source;

    /** 正規化後同名：LAST_WINS（預設）/ REJECT */
    private DuplicatePolicy duplicatePolicy = DuplicatePolicy.LAST_WINS;

    // ===== getters/setters =====
    public Resource getSource() { return source; }
    public void setSource(Resource source) { this.source = source; }

    public DuplicatePolicy getDuplicatePolicy() { return duplicatePolicy; }
    public void setDuplicatePolicy(DuplicatePolicy duplicatePolicy) { this.duplicatePolicy = duplicatePolicy; }
}
