package com.cloudscheduler.engine.config;

import com.cloudscheduler.common.forecast.EnsembleRegressionForecaster;
import com.cloudscheduler.common.forecast.LstmSequenceModel;
import com.cloudscheduler.common.forecast.LstmWeights;
import com.cloudscheduler.common.forecast.SequenceForecaster;
import com.cloudscheduler.common.forecast.SequenceModel;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;

@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Value("${engine.sequence.weights-path:}")
    private String weightsPath;

    @Value("${engine.sequence.init-seed:7}")
    private long initSeed;

    @Value("${engine.ensemble.num-trees:100}")
    private int numTrees;

    @Value("${engine.ensemble.seed:42}")
    private int ensembleSeed;

    /**
     * Loads the trained LSTM artifact from {@code engine.sequence.weights-path} (any Spring
     * resource location). With no path configured, seeded stand-in weights are used.
     */
    @Bean
    public LstmWeights lstmWeights(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        if (weightsPath == null || weightsPath.isBlank()) {
            log.warn("[EngineConfig] No engine.sequence.weights-path configured, using seeded weights (seed={})",
                initSeed);
            return LstmWeights.seeded(initSeed);
        }
        Resource resource = resourceLoader.getResource(weightsPath);
        try (InputStream in = resource.getInputStream()) {
            LstmWeights weights = LstmWeights.fromJson(in, objectMapper);
            log.info("[EngineConfig] Loaded LSTM weights from {} (layers={}, hidden={})",
                weightsPath, weights.numLayers(), weights.hiddenSize());
            return weights;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read LSTM weights from " + weightsPath, e);
        }
    }

    @Bean
    public SequenceModel sequenceModel(LstmWeights lstmWeights) {
        return new LstmSequenceModel(lstmWeights);
    }

    @Bean
    public SequenceForecaster sequenceForecaster(SequenceModel sequenceModel) {
        return new SequenceForecaster(sequenceModel);
    }

    @Bean
    public EnsembleRegressionForecaster ensembleRegressionForecaster() {
        return new EnsembleRegressionForecaster(numTrees, ensembleSeed);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        // registered after JavaTimeModule so it wins for Instant
        mapper.registerModule(new SimpleModule("utc-instant").addDeserializer(Instant.class, new UtcInstantDeserializer()));
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
