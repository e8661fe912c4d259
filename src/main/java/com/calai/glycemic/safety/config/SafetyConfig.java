package com.calai.glycemic.safety.config;

import com.calai.glycemic.safety.rules.SafetyRules;
import com.calai.glycemic.safety.rules.SafetyThresholds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@EnableConfigurationProperties(SafetyThresholdsProperties.class)
public class SafetyConfig {

    @Bean
    public SafetyRules safetyRules(SafetyThresholdsProperties props) {
        SafetyThresholds t = props.toThresholds();
        log.info("[SafetyRules] thresholds GL safe<={} caution<={}, GI safe<={} caution<={}",
                t.safeGl(), t.cautionGl(), t.safeGi(), t.cautionGi());
        return new SafetyRules(t);
    }
}
