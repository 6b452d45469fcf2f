package com.anthem.rxadj.rules;

import com.anthem.rxadj.exception.RuleConfigurationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads rule tables JSON from a Spring resource location.
 */
public class RuleTablesLoader {

    private static final Logger log = LoggerFactory.getLogger(RuleTablesLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public RuleTablesLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    public RuleTablesDefinition load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new RuleConfigurationException("Rule tables not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            RuleTablesDefinition definition = objectMapper.readValue(in, RuleTablesDefinition.class);
            log.info("Loaded rule tables: location={}, version={}", location, definition.getVersion());
            return definition;
        } catch (IOException e) {
            throw new RuleConfigurationException("Failed to read rule tables from " + location, e);
        }
    }

    public RuleTablesDefinition parse(String json) {
        try {
            return objectMapper.readValue(json, RuleTablesDefinition.class);
        } catch (IOException e) {
            throw new RuleConfigurationException("Failed to parse rule tables", e);
        }
    }
}
