package org.fireup.config;

import java.io.File;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.CodeSource;
import java.util.Optional;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Loads the HOCON configuration of the ingestion stage.
 * <p>
 * Layers, highest priority first:
 * <ol>
 *   <li>Java system properties ({@code -Dfireup.parser.blockSize=...})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * The reference configuration is loaded unresolved so that substitutions in it see user overrides.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "fireup.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a message emitted while locating the configuration file.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives messages about which configuration file was chosen.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Locates the user configuration file and loads the layered configuration.
     * <p>
     * The file is looked up in this order: the explicit file, {@code -Dconfig.file},
     * {@code config/fireup.conf} in the working directory, {@code config/fireup.conf} in the
     * installation directory next to the application JAR. Without any of these only the
     * classpath defaults are used.
     *
     * @param explicitConfigFile file chosen by the caller, or {@code null} for discovery
     * @param handler            receives progress messages
     * @return the resolved configuration
     * @throws IllegalArgumentException if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExists(explicitConfigFile, "Configuration file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        String propertyPath = System.getProperty("config.file");
        if (propertyPath != null && !propertyPath.isBlank()) {
            File propertyFile = new File(propertyPath).getAbsoluteFile();
            requireExists(propertyFile, "Configuration file given by -Dconfig.file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: " + propertyFile);
            return loadFromFile(propertyFile);
        }

        File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.isFile()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        Optional<File> installed = installationConfigFile();
        if (installed.isPresent()) {
            handler.log(MessageLevel.INFO, "Using installation configuration file " + installed.get());
            return loadFromFile(installed.get());
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
            + " found, using classpath defaults");
        return loadDefaults();
    }

    /**
     * Loads configuration from a file layered over the classpath defaults.
     *
     * @param configFile the user configuration file
     * @return the resolved configuration
     */
    public static Config loadFromFile(File configFile) {
        return overrides()
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads the classpath defaults with system property and environment overrides.
     *
     * @return the resolved configuration
     */
    public static Config loadDefaults() {
        return overrides()
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static Config overrides() {
        return ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
    }

    private static void requireExists(File file, String messagePrefix) {
        if (!file.exists()) {
            throw new IllegalArgumentException(messagePrefix + file.getAbsolutePath());
        }
    }

    /**
     * Looks for {@code APP_HOME/config/fireup.conf}, where the application JAR lives in
     * {@code APP_HOME/lib}.
     */
    private static Optional<File> installationConfigFile() {
        CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return Optional.empty();
        }
        Path location;
        try {
            location = Path.of(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return Optional.empty();
        }
        if (!Files.isRegularFile(location) || location.getParent() == null
                || location.getParent().getParent() == null) {
            return Optional.empty();
        }
        Path candidate = location.getParent().getParent().resolve(CONFIG_DIR).resolve(CONFIG_FILE_NAME);
        return Files.isRegularFile(candidate) ? Optional.of(candidate.toFile()) : Optional.empty();
    }
}
