package com.harvester.api;

/**
 * Media attached to a message. The locator is opaque and only meaningful
 * to the platform that produced it.
 */
public record MediaRef(
        String fileName,
        String mimeType,
        String locator
) {}
