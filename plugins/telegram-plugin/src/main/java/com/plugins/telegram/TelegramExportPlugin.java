package com.plugins.telegram;

import com.harvester.api.MessagingPlatform;
import com.harvester.api.PlatformException;
import com.harvester.api.PlatformProvider;
import com.harvester.core.config.Configuration;
import com.plugins.telegram.internal.TelegramExportPlatform;

import java.nio.file.Path;

public class TelegramExportPlugin implements PlatformProvider {
    public static final String NAME = "telegram-export";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getVersion() {
        return "1.0.0";
    }

    @Override
    public MessagingPlatform open(Configuration config) throws PlatformException {
        String exportsDir = config.getPluginSetting(NAME, "exports_dir", "exports");
        return TelegramExportPlatform.open(Path.of(exportsDir));
    }
}
