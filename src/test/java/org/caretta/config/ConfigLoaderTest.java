package org.caretta.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
public class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void explicitFileOverridesDefaults() throws IOException {
        Path file = Files.writeString(tempDir.resolve("custom.conf"),
                "caretta.diagnostics.program-name = \"custom\"\n");

        Config config = ConfigLoader.load(file.toFile());

        assertThat(config.getString("caretta.diagnostics.program-name")).isEqualTo("custom");
        assertThat(config.getString("caretta.diagnostics.show-colors")).isEqualTo("auto");
    }

    @Test
    void systemPropertiesWinOverFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("custom.conf"),
                "caretta.diagnostics.show-kind-label = true\n");
        System.setProperty("caretta.diagnostics.show-kind-label", "false");
        ConfigFactory.invalidateCaches();
        try {
            Config config = ConfigLoader.load(file.toFile());

            assertThat(config.getBoolean("caretta.diagnostics.show-kind-label")).isFalse();
        } finally {
            System.clearProperty("caretta.diagnostics.show-kind-label");
            ConfigFactory.invalidateCaches();
        }
    }

    @Test
    void missingExplicitFileIsRejected() {
        assertThatThrownBy(() -> ConfigLoader.load(tempDir.resolve("missing.conf").toFile()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("missing.conf");
    }
}
