package com.harvester.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates configuration on startup so that a bad setting fails the run
 * before the first fetch instead of halfway through.
 */
public class ConfigValidator {
    private static final Logger logger = LoggerFactory.getLogger(ConfigValidator.class);

    public static class ValidationError {
        public final String message;
        public final String severity; // ERROR, WARNING

        public ValidationError(String message, String severity) {
            this.message = message;
            this.severity = severity;
        }

        public boolean isError() {
            return "ERROR".equals(severity);
        }

        @Override
        public String toString() {
            return "[" + severity + "] " + message;
        }
    }

    public List<ValidationError> validate(Configuration config) {
        List<ValidationError> errors = new ArrayList<>();

        validateBudgets(config, errors);
        validateTimeouts(config, errors);
        validateDirectories(config, errors);
        validatePlatform(config, errors);

        return errors;
    }

    private void validateBudgets(Configuration config, List<ValidationError> errors) {
        if (config.linkConcurrency < 1) {
            errors.add(new ValidationError(
                    "linkConcurrency must be at least 1 (was " + config.linkConcurrency + ")", "ERROR"));
        }
        if (config.imageConcurrency < 1) {
            errors.add(new ValidationError(
                    "imageConcurrency must be at least 1 (was " + config.imageConcurrency + ")", "ERROR"));
        }
        if (config.imageConcurrency > 64) {
            errors.add(new ValidationError(
                    "imageConcurrency " + config.imageConcurrency + " is very high - remote hosts may throttle",
                    "WARNING"));
        }
    }

    private void validateTimeouts(Configuration config, List<ValidationError> errors) {
        if (config.connectTimeoutMs <= 0 || config.readTimeoutMs <= 0) {
            errors.add(new ValidationError(
                    "connectTimeoutMs and readTimeoutMs must be positive",
                    "ERROR"));
        }
    }

    private void validateDirectories(Configuration config, List<ValidationError> errors) {
        if (config.downloadPath == null || config.downloadPath.isBlank()) {
            errors.add(new ValidationError("downloadPath is empty", "ERROR"));
        } else {
            File dlPath = new File(config.downloadPath);
            if (!dlPath.exists()) {
                if (!dlPath.mkdirs()) {
                    errors.add(new ValidationError(
                            "Cannot create download directory: " + config.downloadPath, "ERROR"));
                } else {
                    logger.info("📁 Created download directory: {}", config.downloadPath);
                }
            } else if (!dlPath.isDirectory()) {
                errors.add(new ValidationError(
                        "downloadPath is not a directory: " + config.downloadPath, "ERROR"));
            }
        }

        if (config.ledgerPath == null || config.ledgerPath.isBlank()) {
            errors.add(new ValidationError("ledgerPath is empty", "ERROR"));
        }
    }

    private void validatePlatform(Configuration config, List<ValidationError> errors) {
        if (config.platform == null || config.platform.isBlank()) {
            errors.add(new ValidationError(
                    "No messaging platform configured - channel entries and post links will be skipped",
                    "WARNING"));
            return;
        }
        if (!config.isPluginEnabled(config.platform)) {
            errors.add(new ValidationError(
                    "Platform '" + config.platform + "' is disabled in plugins - channel entries will be skipped",
                    "WARNING"));
        }
    }

    /**
     * Validate and report errors to the log.
     *
     * @throws IllegalStateException if critical errors were found
     */
    public void validateAndReport(Configuration config) {
        List<ValidationError> errors = validate(config);

        int errorCount = 0;
        int warningCount = 0;

        for (ValidationError error : errors) {
            if (error.isError()) {
                logger.error("❌ Config Error: {}", error.message);
                errorCount++;
            } else {
                logger.warn("⚠️ Config Warning: {}", error.message);
                warningCount++;
            }
        }

        if (errorCount > 0 || warningCount > 0) {
            logger.warn("📋 Configuration validation: {} errors, {} warnings", errorCount, warningCount);
        } else {
            logger.info("✅ Configuration validation passed");
        }

        if (errorCount > 0) {
            throw new IllegalStateException(
                    String.format("Configuration validation failed with %d error(s). Fix config and restart.",
                            errorCount));
        }
    }
}
