package com.delta.autoapply.run.tailor;

import com.delta.autoapply.config.AutoApplyProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
public class TailoringConfig {

    @Bean
    @ConditionalOnProperty(name = "autoapply.tailoring.provider", havingValue = "openai")
    public ResumeTailoringClient openAiCompatibleTailoringClient(
        AutoApplyProperties properties,
        RestClient.Builder builder,
        ObjectMapper objectMapper,
        TailoredResumeExtractor extractor
    ) {
        return new OpenAiCompatibleTailoringClient(properties.getTailoring(), builder, objectMapper, extractor);
    }

    @Bean
    @ConditionalOnMissingBean(ResumeTailoringClient.class)
    public ResumeTailoringClient noopTailoringClient() {
        return new NoopTailoringClient();
    }
}
