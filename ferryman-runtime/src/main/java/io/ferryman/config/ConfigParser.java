/*
 * Copyright Ferryman Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.ferryman.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Reads {@link GatewayConfiguration} from YAML.
 */
public class ConfigParser {

    private final ObjectMapper mapper;

    public ConfigParser() {
        this.mapper = createObjectMapper();
    }

    public static ObjectMapper createObjectMapper() {
        return new ObjectMapper(new YAMLFactory())
                .registerModule(new JavaTimeModule())
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public GatewayConfiguration parseConfiguration(String yaml) {
        try {
            return mapper.readValue(yaml, GatewayConfiguration.class);
        }
        catch (JsonProcessingException e) {
            throw translate(e);
        }
    }

    public GatewayConfiguration parseConfiguration(InputStream yaml) {
        try {
            return mapper.readValue(yaml, GatewayConfiguration.class);
        }
        catch (JsonProcessingException e) {
            throw translate(e);
        }
        catch (IOException e) {
            throw new ConfigurationException("Couldn't read configuration: " + e.getMessage(), e);
        }
    }

    public GatewayConfiguration parseConfiguration(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return parseConfiguration(in);
        }
        catch (IOException e) {
            throw new ConfigurationException("Couldn't read configuration file " + file + ": " + e.getMessage(), e);
        }
    }

    private static ConfigurationException translate(JsonProcessingException e) {
        // validation failures in record constructors arrive wrapped
        if (e instanceof ValueInstantiationException vie && vie.getCause() instanceof ConfigurationException ce) {
            return ce;
        }
        return new ConfigurationException("Couldn't parse configuration: " + e.getOriginalMessage(), e);
    }
}
