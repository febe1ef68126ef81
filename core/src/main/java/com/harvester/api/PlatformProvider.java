package com.harvester.api;

import com.harvester.core.config.Configuration;

/**
 * Service provider for {@link MessagingPlatform} implementations.
 * Registered in META-INF/services and picked up by the PlatformLoader.
 */
public interface PlatformProvider {
    // Name used in the "platform" config key (e.g. "telegram-export")
    String getName();

    String getVersion();

    MessagingPlatform open(Configuration config) throws PlatformException;
}
