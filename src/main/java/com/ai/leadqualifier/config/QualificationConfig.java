package com.ai.leadqualifier.config;

import com.ai.leadqualifier.conversation.BusinessType;
import com.ai.leadqualifier.conversation.QualificationCriteria;
import com.ai.leadqualifier.provider.ProviderSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

@Configuration
@EnableScheduling
public class QualificationConfig {

    private static final Logger log = LoggerFactory.getLogger(QualificationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public QualificationKeywords qualificationKeywords() {
        return QualificationKeywords.defaults();
    }

    @Bean
    public QualificationCriteria qualificationCriteria(
            @Value("${qualification.required-fields:name,phone,interest}") List<String> requiredFields,
            @Value("${qualification.min-score:50}") int minScore,
            @Value("${qualification.max-attempts:5}") int maxAttempts,
            @Value("${qualification.timeout-minutes:30}") int timeoutMinutes,
            @Value("${qualification.business-type:services}") String businessType) {
        QualificationCriteria criteria = new QualificationCriteria(requiredFields, minScore, maxAttempts,
                timeoutMinutes, BusinessType.fromKey(businessType));
        log.info("Qualification criteria: {}", criteria);
        return criteria;
    }

    @Bean
    public ProviderSettings providerSettings(
            @Value("${ai.call-timeout:15s}") Duration callTimeout,
            @Value("${ai.connect-timeout:5s}") Duration connectTimeout,
            @Value("${ai.retry-delay:500ms}") Duration retryDelay,
            @Value("${ai.max-concurrent-calls:8}") int maxConcurrentCalls,
            @Value("${ai.max-response-chars:10000}") int maxResponseChars) {
        return ProviderSettings.builder()
                .callTimeout(callTimeout)
                .connectTimeout(connectTimeout)
                .retryDelay(retryDelay)
                .maxConcurrentCalls(maxConcurrentCalls)
                .maxResponseChars(maxResponseChars)
                .build();
    }
}
