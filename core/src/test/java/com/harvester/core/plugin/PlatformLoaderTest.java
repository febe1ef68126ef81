package com.harvester.core.plugin;

import com.harvester.api.MessagingPlatform;
import com.harvester.api.PlatformException;
import com.harvester.core.config.Configuration;
import com.harvester.test.TestBase;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlatformLoaderTest extends TestBase {

    private PlatformLoader loader() {
        return new PlatformLoader(tempDir.resolve("plugins").toFile(), getClass().getClassLoader());
    }

    private Configuration config(String platform) {
        Configuration config = new Configuration();
        config.platform = platform;
        return config;
    }

    @Test
    void testDiscoversRegisteredProviders() {
        assertTrue(loader().discover().containsKey("fake"));
    }

    @Test
    void testLoadsConfiguredPlatform() throws PlatformException {
        MessagingPlatform platform = loader().load(config("fake"));

        assertNotNull(platform);
        assertEquals("fake", platform.getName());
        assertEquals(42, platform.resolveChannel("@fake").id());
    }

    @Test
    void testNoPlatformWhenMissingDisabledOrBroken() {
        assertNull(loader().load(config("does-not-exist")));
        assertNull(loader().load(config("")));

        Configuration disabled = config("fake");
        disabled.plugins.put("fake", false);
        assertNull(loader().load(disabled));

        Configuration failing = config("fake");
        failing.setPluginSetting("fake", "fail", "true");
        assertNull(loader().load(failing));
    }
}
