package com.colorcorrection.config;

import com.colorcorrection.pipeline.CorrectionPipelineFactory;
import com.colorcorrection.pipeline.UnavailablePipelineFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Falls back to an unavailable pipeline when no correction library
 * contributes a {@link CorrectionPipelineFactory} bean.
 */
@Configuration
@Slf4j
public class CorrectionPipelineConfig {

    @Bean
    @ConditionalOnMissingBean(CorrectionPipelineFactory.class)
    public CorrectionPipelineFactory correctionPipelineFactory() {
        log.warn("No correction pipeline library registered - correction endpoints will answer 503");
        return new UnavailablePipelineFactory();
    }
}
