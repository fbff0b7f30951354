package edu.yu.idxcheck.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import edu.yu.idxcheck.harness.HarnessParameters;

public class HarnessConfigurationTest {

    @AfterEach
    public void teardown() {
        HarnessConfiguration.INSTANCE.reset();
    }

    @Test
    @DisplayName("Defaults are loaded from idxcheck.properties on the classpath")
    public void defaultsComeFromClasspath() {
        HarnessConfiguration config = HarnessConfiguration.INSTANCE;
        assertEquals(8, config.threadNum());
        assertEquals(1000, config.execNum());
        assertEquals(20L, config.randomSeed());
        assertEquals(100L, config.settleMillis());
        assertEquals(1000L, config.epochIntervalMicros());
        assertEquals(5, config.repeatNum());
    }

    @Test
    @DisplayName("setConfiguration() overlays overrides onto the defaults")
    public void overridesMergeWithDefaults() {
        Properties props = new Properties();
        props.setProperty(HarnessConfiguration.THREAD_NUM, "4");
        props.setProperty(HarnessConfiguration.EPOCH_INTERVAL_MICROS, "0");
        HarnessConfiguration.INSTANCE.setConfiguration(props);

        assertEquals(4, HarnessConfiguration.INSTANCE.threadNum());
        assertEquals(0L, HarnessConfiguration.INSTANCE.epochIntervalMicros());
        assertEquals(1000, HarnessConfiguration.INSTANCE.execNum());

        HarnessParameters params = HarnessParameters.fromConfiguration();
        assertEquals(4, params.threadNum());
        assertEquals((1000 + 2) * 4, params.keyNum());
    }

    @Test
    @DisplayName("reset() discards earlier overrides")
    public void resetRestoresDefaults() {
        Properties props = new Properties();
        props.setProperty(HarnessConfiguration.REPEAT_NUM, "2");
        HarnessConfiguration.INSTANCE.setConfiguration(props);
        assertEquals(2, HarnessConfiguration.INSTANCE.repeatNum());

        HarnessConfiguration.INSTANCE.reset();
        assertEquals(5, HarnessConfiguration.INSTANCE.repeatNum());
    }

    @Test
    @DisplayName("Malformed values fail with a message naming the key")
    public void badValuesNameTheKey() {
        Properties props = new Properties();
        props.setProperty(HarnessConfiguration.THREAD_NUM, "eight");
        props.setProperty(HarnessConfiguration.SETTLE_MILLIS, "-5");
        props.setProperty(HarnessConfiguration.EXEC_NUM, "0");
        HarnessConfiguration.INSTANCE.setConfiguration(props);

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> HarnessConfiguration.INSTANCE.threadNum());
        assertTrue(e.getMessage().contains(HarnessConfiguration.THREAD_NUM));
        assertThrows(IllegalStateException.class, () -> HarnessConfiguration.INSTANCE.settleMillis());
        assertThrows(IllegalStateException.class, () -> HarnessConfiguration.INSTANCE.execNum());
    }

    @Test
    @DisplayName("setConfiguration(null) is rejected")
    public void nullPropertiesRejected() {
        assertThrows(IllegalArgumentException.class, () -> HarnessConfiguration.INSTANCE.setConfiguration(null));
    }
}
