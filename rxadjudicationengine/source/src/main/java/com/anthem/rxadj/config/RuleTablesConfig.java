package com.anthem.rxadj.config;

import com.anthem.rxadj.rules.RuleTables;
import com.anthem.rxadj.rules.RuleTablesDefinition;
import com.anthem.rxadj.rules.RuleTablesLoader;
import com.anthem.rxadj.rules.RuleTablesRepository;
import com.anthem.rxadj.rules.RuleTablesValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;

/**
 * Rule tables are loaded and validated once at startup. A malformed table fails the context.
 */
@Configuration
public class RuleTablesConfig {

    private static final Logger log = LoggerFactory.getLogger(RuleTablesConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RuleTablesValidator ruleTablesValidator(RxAdjudicationProperties properties) {
        return new RuleTablesValidator(properties.getRules().isStrictValidation());
    }

    @Bean
    public RuleTablesLoader ruleTablesLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        return new RuleTablesLoader(objectMapper, resourceLoader);
    }

    @Bean
    public RuleTablesRepository ruleTablesRepository(RxAdjudicationProperties properties,
                                                     RuleTablesLoader loader,
                                                     RuleTablesValidator validator) {
        RuleTablesDefinition definition = loader.load(properties.getRules().getLocation());
        RuleTables tables = validator.validateAndBuild(definition);
        log.info("Rule tables active: version={}, strictValidation={}",
                tables.getVersion(), properties.getRules().isStrictValidation());
        return new RuleTablesRepository(tables, validator);
    }
}
