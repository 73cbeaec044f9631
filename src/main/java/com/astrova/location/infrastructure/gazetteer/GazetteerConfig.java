package com.astrova.location.infrastructure.gazetteer;

import com.astrova.location.application.mapper.CandidateNormalizer;
import com.astrova.location.domain.model.GazetteerEntry;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Loads the curated gazetteer once at startup.
 * A missing or malformed table fails application startup.
 */
@Configuration
public class GazetteerConfig {

    private static final Logger logger = LoggerFactory.getLogger(GazetteerConfig.class);

    @Bean
    public InMemoryGazetteer localGazetteer(
        ObjectMapper objectMapper,
        CandidateNormalizer candidateNormalizer,
        @Value("${app.gazetteer.resource:classpath:gazetteer/localities.json}") Resource resource
    ) {
        List<GazetteerEntry> entries = readEntries(objectMapper, resource);
        InMemoryGazetteer gazetteer = new InMemoryGazetteer(entries, candidateNormalizer);
        logger.info("Loaded {} gazetteer entries from {}", gazetteer.size(), resource.getDescription());
        return gazetteer;
    }

    static List<GazetteerEntry> readEntries(ObjectMapper objectMapper, Resource resource) {
        try (InputStream inputStream = resource.getInputStream()) {
            return objectMapper.readValue(inputStream, new TypeReference<List<GazetteerEntry>>() { });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load gazetteer from " + resource.getDescription(), e);
        }
    }
}
