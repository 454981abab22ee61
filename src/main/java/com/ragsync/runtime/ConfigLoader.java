package com.ragsync.runtime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public AppConfig load(Path configPath) {
        AppConfig config;
        if (configPath == null || !Files.exists(configPath)) {
            log.warn("Config file {} not found, using defaults", configPath);
            config = new AppConfig();
        } else {
            try {
                config = mapper.readValue(configPath.toFile(), AppConfig.class);
            } catch (IOException e) {
                throw new ConfigurationException("Unable to read config file " + configPath + ": " + e.getMessage(), e);
            }
            if (config == null) {
                config = new AppConfig();
            }
        }
        validate(config);
        return config;
    }

    public void validate(AppConfig config) {
        AppConfig.ChunkingConfig chunking = config.getChunking();
        if (chunking.getMaxChars() <= 0) {
            throw new ConfigurationException("chunking.maxChars must be positive");
        }
        if (chunking.getOverlapChars() < 0 || chunking.getOverlapChars() >= chunking.getMaxChars()) {
            throw new ConfigurationException("chunking.overlapChars must be >= 0 and < chunking.maxChars");
        }
        if (config.getEmbedding().getBatchSize() <= 0) {
            throw new ConfigurationException("embedding.batchSize must be positive");
        }
        if (config.getSync().getWriteBatchSize() <= 0) {
            throw new ConfigurationException("sync.writeBatchSize must be positive");
        }
        if (config.getNormalization().getMinContentChars() < 0) {
            throw new ConfigurationException("normalization.minContentChars must not be negative");
        }
        if (config.getCollectors().getParallelism() <= 0) {
            throw new ConfigurationException("collectors.parallelism must be positive");
        }
    }
}
