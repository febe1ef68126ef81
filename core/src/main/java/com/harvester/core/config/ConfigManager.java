package com.harvester.core.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Loads and stores the JSON configuration file.
 * A missing file is created with defaults, a broken one is replaced by defaults in memory.
 */
public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);
    public static final String DEFAULT_CONFIG_FILE = "config/harvester.json";

    private final File configFile;
    private final Gson gson;
    private Configuration configuration;

    public ConfigManager(File configFile) {
        this.configFile = configFile;
        this.gson = new GsonBuilder().setPrettyPrinting().create();
        load();
    }

    public Configuration getConfig() {
        return configuration;
    }

    public synchronized void saveConfig() {
        File parent = configFile.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists()) parent.mkdirs();

        try (Writer writer = Files.newBufferedWriter(configFile.toPath(), StandardCharsets.UTF_8)) {
            gson.toJson(this.configuration, writer);
            logger.info("Configuration saved to {}", configFile);
        } catch (IOException e) {
            logger.error("Failed to save config", e);
        }
    }

    private void load() {
        if (!configFile.exists()) {
            configuration = new Configuration();
            logger.info("No config file found at {}. Created default configuration.", configFile);
            saveConfig();
            return;
        }

        try (Reader r = Files.newBufferedReader(configFile.toPath(), StandardCharsets.UTF_8)) {
            configuration = gson.fromJson(r, Configuration.class);
            if (configuration == null) configuration = new Configuration();
            logger.info("Configuration loaded from {}", configFile);
        } catch (Exception e) {
            logger.error("Failed to load configuration, using defaults", e);
            configuration = new Configuration();
        }
    }
}
