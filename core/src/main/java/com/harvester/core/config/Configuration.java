package com.harvester.core.config;

import java.util.HashMap;
import java.util.Map;

public class Configuration {
    // --- Storage ---
    public String downloadPath = "telegraph_images";
    public String ledgerPath = "data/processed_links";
    public boolean saveRawDocument = true;

    // --- Concurrency budgets ---
    public int linkConcurrency = 4;   // simultaneous page/post fetches
    public int imageConcurrency = 10; // simultaneous image downloads, shared by all pages

    // --- HTTP ---
    public int connectTimeoutMs = 15000;
    public int readTimeoutMs = 30000;
    public String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) TelegraphHarvester/1.0";

    // --- Crawl ---
    public boolean fullCrawl = false; // false = only the newest message with links per channel

    // --- Messaging platform ---
    public String platform = "telegram-export";

    // Key = provider name, Value = enabled
    public Map<String, Boolean> plugins = new HashMap<>();

    // Key = provider name, Value = settings (e.g. "exports_dir" -> "exports")
    public Map<String, Map<String, String>> pluginConfigs = new HashMap<>();

    public Configuration() {
        plugins.put("telegram-export", true);
        setPluginSetting("telegram-export", "exports_dir", "exports");
    }

    public String getPluginSetting(String pluginName, String key, String defaultValue) {
        if (!pluginConfigs.containsKey(pluginName))
            return defaultValue;
        return pluginConfigs.get(pluginName).getOrDefault(key, defaultValue);
    }

    public void setPluginSetting(String pluginName, String key, String value) {
        pluginConfigs.computeIfAbsent(pluginName, k -> new HashMap<>()).put(key, value);
    }

    public boolean isPluginEnabled(String pluginName) {
        return plugins.getOrDefault(pluginName, true);
    }
}
