package org.swarmsim.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.swarmsim.junit.extensions.logging.LogWatchExtension;

import java.io.File;
import java.net.URISyntaxException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Verifies the configuration precedence: system properties, then the file, then reference.conf.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ConfigLoaderTest {

    private File testConfigFile;

    @BeforeEach
    void setUp() throws URISyntaxException {
        ConfigFactory.invalidateCaches();
        testConfigFile = new File(ConfigLoaderTest.class.getResource("test-config.conf").toURI());
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("test.nested.setting");
        System.clearProperty("node.processes.httpServer.options.network.port");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("File values are loaded on top of reference.conf")
    void load_readsFileAndDefaults() {
        Config config = ConfigLoader.load(testConfigFile);

        assertThat(config.getString("test.value")).isEqualTo("file-value");
        assertThat(config.getString("test.priority")).isEqualTo("file-priority");
        assertThat(config.getString("test.nested.setting")).isEqualTo("file-nested");
        assertThat(config.getInt("node.processes.httpServer.options.network.port")).isEqualTo(8000);
        assertThat(config.getString("node.processes.simulations.className"))
            .isEqualTo("org.swarmsim.node.processes.simulation.SimulationRegistryProcess");
    }

    @Test
    void systemProperty_overridesFile() {
        System.setProperty("test.value", "system-value");
        System.setProperty("test.nested.setting", "system-nested");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(testConfigFile);

        assertThat(config.getString("test.value")).isEqualTo("system-value");
        assertThat(config.getString("test.nested.setting")).isEqualTo("system-nested");
        assertThat(config.getString("test.priority")).isEqualTo("file-priority");
    }

    @Test
    void systemProperty_overridesReferenceDefaults() {
        System.setProperty("node.processes.httpServer.options.network.port", "9123");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(null);

        assertThat(config.getInt("node.processes.httpServer.options.network.port")).isEqualTo(9123);
    }

    @Test
    void missingExplicitFile_isRejected() {
        File missing = new File("does-not-exist-" + System.nanoTime() + ".conf");

        assertThatThrownBy(() -> ConfigLoader.load(missing))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining(missing.getName());
    }
}
