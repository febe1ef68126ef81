package com.harvester.core.plugin;

import com.harvester.api.MessagingPlatform;
import com.harvester.api.PlatformException;
import com.harvester.api.PlatformProvider;
import com.harvester.core.config.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Finds {@link PlatformProvider}s on the class path and in plugin jars, and opens the configured one.
 */
public class PlatformLoader {
    private static final Logger logger = LoggerFactory.getLogger(PlatformLoader.class);

    private final File pluginDir;
    private final ClassLoader parent;

    public PlatformLoader() {
        this(new File("plugins"), PlatformLoader.class.getClassLoader());
    }

    public PlatformLoader(File pluginDir, ClassLoader parent) {
        this.pluginDir = pluginDir;
        this.parent = parent;
    }

    /**
     * All providers found, by name. Class path providers win over jar providers of the same name.
     */
    public Map<String, PlatformProvider> discover() {
        Map<String, PlatformProvider> providers = new LinkedHashMap<>();
        collect(ServiceLoader.load(PlatformProvider.class, parent), providers, "class path");

        File[] jars = pluginDir.listFiles((dir, name) -> name.endsWith(".jar"));
        if (jars != null && jars.length > 0) {
            Arrays.sort(jars, Comparator.comparing(File::getName));
            List<URL> urls = new ArrayList<>();
            for (File jar : jars) {
                try {
                    urls.add(jar.toURI().toURL());
                } catch (MalformedURLException e) {
                    logger.error("Failed to load plugin jar: " + jar.getName(), e);
                }
            }
            // stays open for the lifetime of the process, the loaded platform needs it
            URLClassLoader ucl = new URLClassLoader(urls.toArray(new URL[0]), parent);
            collect(ServiceLoader.load(PlatformProvider.class, ucl), providers, pluginDir.getPath());
        }
        return providers;
    }

    private void collect(ServiceLoader<PlatformProvider> loader, Map<String, PlatformProvider> providers,
                         String origin) {
        try {
            for (PlatformProvider provider : loader) {
                if (providers.putIfAbsent(provider.getName(), provider) == null) {
                    logger.debug("Platform provider {} found in {}", provider.getName(), origin);
                }
            }
        } catch (ServiceConfigurationError e) {
            logger.error("Broken platform plugin registration in " + origin, e);
        }
    }

    /**
     * Open the platform named in the configuration.
     *
     * @return the platform, or null if it is not configured, disabled, missing or fails to open
     */
    public MessagingPlatform load(Configuration config) {
        String wanted = config.platform;
        if (wanted == null || wanted.isBlank()) {
            logger.info("No messaging platform configured.");
            return null;
        }
        if (!config.isPluginEnabled(wanted)) {
            logger.info("Platform {} is disabled in config.", wanted);
            return null;
        }

        PlatformProvider provider = discover().get(wanted);
        if (provider == null) {
            logger.warn("⚠️ Platform '{}' not found. Channel entries will be skipped.", wanted);
            return null;
        }

        try {
            MessagingPlatform platform = provider.open(config);
            logger.info("✅ Platform loaded: {} v{}", provider.getName(), provider.getVersion());
            return platform;
        } catch (PlatformException e) {
            logger.error("Failed to open platform {} - {}", provider.getName(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Platform " + provider.getName() + " crashed while opening", e);
        }
        return null;
    }
}
