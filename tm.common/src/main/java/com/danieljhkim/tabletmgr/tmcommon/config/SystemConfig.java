package com.danieljhkim.tabletmgr.tmcommon.config;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.Properties;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Layered properties configuration for one agent process.
 *
 * <p>
 * Lookup order for a key: system property {@code tabletmgr.<key>}, environment variable
 * {@code TABLETMGR_<KEY>} (dots become underscores), the env-specific file
 * {@code application-<env>.properties} (env from {@code -Dtabletmgr.env}), then {@code application.properties}.
 * Files are read from {@code resourcePath} on the filesystem first and the classpath second.
 *
 * <p>
 * Instances are created once by the entry point and handed to whoever needs them.
 */
public class SystemConfig {

    private static final Logger logger = LoggerFactory.getLogger(SystemConfig.class);
    private static final String DEFAULT_CONFIG_FILE = "application.properties";
    private static final String PREFIX = "tabletmgr.";

    private final Properties properties;
    private final String resourcePath;

    private SystemConfig(String resourcePath, Properties properties) {
        this.resourcePath = resourcePath == null ? "" : resourcePath;
        this.properties = properties;
    }

    /**
     * Loads {@code application.properties} (plus the env overlay) from the given directory or classpath prefix.
     */
    public static SystemConfig load(String resourcePath) {
        SystemConfig config = new SystemConfig(resourcePath, new Properties());
        config.loadDefaultConfigFile();
        config.loadEnvSpecificConfigFile();
        return config;
    }

    public static SystemConfig load() {
        return load("");
    }

    /**
     * Builds a config straight from the given properties. Overrides from system properties and the environment
     * still apply.
     */
    public static SystemConfig of(Properties properties) {
        Properties copy = new Properties();
        copy.putAll(properties);
        return new SystemConfig("", copy);
    }

    private String fileName(String name) {
        return resourcePath.isEmpty() ? name : resourcePath + "/" + name;
    }

    private void loadDefaultConfigFile() {
        Path path = Paths.get(resourcePath, DEFAULT_CONFIG_FILE);
        if (Files.exists(path)) {
            try (InputStream input = new FileInputStream(path.toFile())) {
                properties.load(input);
                logger.info("Loaded default configuration from filesystem: {}", path);
                return;
            } catch (IOException e) {
                logger.warn("Failed to load default configuration from filesystem", e);
            }
        }
        String classpathName = fileName(DEFAULT_CONFIG_FILE);
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(classpathName)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded default configuration from classpath: {}", classpathName);
            } else {
                logger.warn("Default configuration file not found in classpath: {}", classpathName);
            }
        } catch (IOException e) {
            logger.warn("Failed to load default configuration from classpath", e);
        }
    }

    private void loadEnvSpecificConfigFile() {
        String env = System.getProperty(PREFIX + "env");
        if (env == null || env.isEmpty()) {
            return;
        }
        String envConfigFile = fileName("application-" + env + ".properties");
        Path envPath = Paths.get(envConfigFile);
        if (Files.exists(envPath)) {
            try (InputStream input = new FileInputStream(envPath.toFile())) {
                properties.load(input);
                logger.info("Loaded environment-specific configuration from: {}", envConfigFile);
                return;
            } catch (IOException e) {
                logger.warn("Failed to load environment-specific configuration file: {}", envConfigFile, e);
            }
        }
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(envConfigFile)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded env configuration from classpath: {}", envConfigFile);
            } else {
                logger.warn("Environment-specific configuration file not found: {}", envConfigFile);
            }
        } catch (IOException e) {
            logger.warn("Failed to load env configuration from classpath", e);
        }
    }

    public String getProperty(String key, String defaultValue) {
        String value = System.getProperty(PREFIX + key);
        if (value != null && !value.isEmpty()) {
            return value;
        }
        String envKey = "TABLETMGR_" + key.toUpperCase().replace('.', '_');
        value = System.getenv(envKey);
        if (value != null && !value.isEmpty()) {
            return value;
        }
        return properties.getProperty(key, defaultValue);
    }

    public String getProperty(String key) {
        return getProperty(key, null);
    }

    public int getInt(String key, int defaultValue) {
        String value = getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not an integer: " + value, e);
        }
    }

    public Duration getMillis(String key, long defaultMillis) {
        String value = getProperty(key);
        if (value == null || value.isBlank()) {
            return Duration.ofMillis(defaultMillis);
        }
        try {
            return Duration.ofMillis(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " is not a millisecond count: " + value, e);
        }
    }

    public Set<String> getAllPropertyNames(String prefix) {
        Set<String> filtered = new HashSet<>();
        for (Object key : properties.keySet()) {
            String name = key.toString();
            if (prefix == null || prefix.isEmpty() || name.startsWith(prefix)) {
                filtered.add(name);
            }
        }
        return Collections.unmodifiableSet(filtered);
    }

    public Set<String> getAllPropertyNames() {
        return getAllPropertyNames(null);
    }
}
