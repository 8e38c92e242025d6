package com.keystone.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads {@link KeystoneSettings} in order: {@code <configDir>/keystone.json} → bundled
 * {@code keystone-default.json} on the classpath. A local file that exists but cannot be parsed
 * is reported and skipped; a missing or broken bundled default is a {@link ConfigurationException}.
 */
public final class ConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    public static final String SETTINGS_FILE = "keystone.json";
    public static final String DEFAULT_RESOURCE = "/keystone-default.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final Path configDir;

    /**
     * @param configDir directory holding {@code keystone.json}; null = classpath default only
     */
    public ConfigurationLoader(Path configDir) {
        this.configDir = configDir;
    }

    /**
     * Loads and validates settings. Never returns null.
     *
     * @throws ConfigurationException when no source yields valid settings or the routing values are invalid
     */
    public KeystoneSettings load() {
        Optional<KeystoneSettings> settings = tryLoadFromLocalFile();
        if (settings.isEmpty()) {
            settings = tryLoadFromClasspath();
        }
        KeystoneSettings loaded = settings.orElseThrow(() -> new ConfigurationException(
                "No Keystone settings found (" + describeLocalFile() + ", classpath:" + DEFAULT_RESOURCE + ")", (Throwable) null));
        loaded.getRouting().validate();
        return loaded;
    }

    /** Parses a settings document. */
    public static KeystoneSettings fromJson(String json) {
        try {
            return MAPPER.readValue(json, KeystoneSettings.class);
        } catch (IOException e) {
            throw new ConfigurationException("Invalid Keystone settings JSON: " + e.getMessage(), e);
        }
    }

    private Optional<KeystoneSettings> tryLoadFromLocalFile() {
        if (configDir == null) {
            return Optional.empty();
        }
        Path file = configDir.resolve(SETTINGS_FILE);
        if (!Files.isRegularFile(file)) {
            log.debug("No settings file at {}", file.toAbsolutePath());
            return Optional.empty();
        }
        try {
            KeystoneSettings settings = fromJson(Files.readString(file, StandardCharsets.UTF_8));
            log.info("Keystone settings loaded from file: {} (version={})", file, settings.getVersion());
            return Optional.of(settings);
        } catch (IOException | ConfigurationException e) {
            log.warn("Failed to load settings file {}: {}; falling back to bundled defaults", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<KeystoneSettings> tryLoadFromClasspath() {
        try (InputStream in = ConfigurationLoader.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return Optional.empty();
            }
            KeystoneSettings settings = fromJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            log.info("Keystone settings loaded from classpath:{} (version={})", DEFAULT_RESOURCE, settings.getVersion());
            return Optional.of(settings);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read classpath:" + DEFAULT_RESOURCE, e);
        }
    }

    private String describeLocalFile() {
        return configDir != null ? configDir.resolve(SETTINGS_FILE).toString() : "no config dir";
    }
}
