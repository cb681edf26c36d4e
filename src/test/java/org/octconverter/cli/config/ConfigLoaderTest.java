package org.octconverter.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.octconverter.formats.ReadOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks the layering of system properties over the user file over {@code reference.conf}.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("octconverter.read.zeiss.rows");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("A user file is layered over reference.conf")
    void load_userFileOverDefaults() {
        Config config = ConfigLoader.load(Optional.of(testResource("config/test-config.conf")));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals(2.4, config.getDouble("octconverter.read.e2e.gamma"));
    }

    @Test
    @DisplayName("System properties override the user file")
    void load_systemPropertyOverridesFile() {
        System.setProperty("test.value", "system-value");
        System.setProperty("octconverter.read.zeiss.rows", "16");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.load(Optional.of(testResource("config/test-config.conf")));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals(16, ReadOptions.fromConfig(config).zeissRows());
    }

    @Test
    @DisplayName("File values reach the read options")
    void load_fileValuesReachReadOptions() {
        ReadOptions options = ReadOptions.fromConfig(
                ConfigLoader.load(Optional.of(testResource("config/test-config.conf"))));

        assertTrue(options.deinterlace());
        assertEquals(8, options.zeissRows());
        assertEquals(4, options.zeissCols());
    }

    @Test
    @DisplayName("Out-of-range read options in a user file are rejected")
    void load_invalidReadOptions() {
        Config config = ConfigLoader.load(Optional.of(testResource("config/invalid-options.conf")));

        assertThrows(IllegalArgumentException.class, () -> ReadOptions.fromConfig(config));
    }

    @Test
    @DisplayName("Without a user file only reference.conf applies")
    void load_defaultsOnly() {
        Config config = ConfigLoader.load(Optional.empty());

        assertFalse(config.getBoolean("octconverter.read.deinterlace"));
        assertEquals(1024, config.getInt("octconverter.read.zeiss.rows"));
        assertEquals("WARN", config.getString("octconverter.logging.level"));
        assertFalse(config.hasPath("test.value"));
    }

    @Test
    @DisplayName("An explicit file wins over the default location")
    void userFile_explicitWins(@TempDir Path dir) throws Exception {
        File explicit = testResource("config/test-config.conf");
        File fallback = Files.writeString(dir.resolve("octconverter.conf"), "a = 1").toFile();

        assertEquals(Optional.of(explicit), ConfigLoader.userFile(explicit, fallback));
        assertEquals(Optional.of(fallback), ConfigLoader.userFile(null, fallback));
    }

    @Test
    @DisplayName("A missing default file falls back to the built-in defaults")
    void userFile_missingDefaultIsOptional(@TempDir Path dir) {
        assertEquals(Optional.empty(), ConfigLoader.userFile(null, dir.resolve("absent.conf").toFile()));
    }

    @Test
    @DisplayName("A missing explicit file is rejected")
    void resolve_missingExplicitFile() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(new File("does/not/exist.conf")));
        assertTrue(e.getMessage().startsWith("Configuration file not found"));
    }

    @Test
    @DisplayName("resolve reads the explicit file")
    void resolve_explicitFile() {
        Config config = ConfigLoader.resolve(testResource("config/test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
    }

    private static File testResource(String name) {
        URL url = ConfigLoaderTest.class.getClassLoader().getResource(name);
        assertNotNull(url, "Missing test resource " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }
}
