package org.fireup.ingest.services;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

import org.fireup.config.ConfigLoader;
import org.fireup.ingest.api.IBackupParser;
import org.fireup.ingest.api.ParseResult;
import org.fireup.ingest.api.monitoring.IOperationMonitor;
import org.fireup.ingest.monitoring.InMemoryOperationMonitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Entry point of the ingestion stage: resolves a backup location and parses it.
 * <p>
 * Wires the parser, path resolver, validator and monitor from the {@code fireup} configuration
 * block (see {@code reference.conf}).
 */
public class BackupIngestion {

    private static final Logger log = LoggerFactory.getLogger(BackupIngestion.class);

    private final BackupPathResolver pathResolver;
    private final IBackupParser parser;
    private final BackupValidator validator;
    private final IOperationMonitor monitor;

    public BackupIngestion(BackupPathResolver pathResolver, IBackupParser parser,
                           BackupValidator validator, IOperationMonitor monitor) {
        this.pathResolver = pathResolver;
        this.parser = parser;
        this.validator = validator;
        this.monitor = monitor;
    }

    /**
     * Builds an ingestion stage, locating the configuration with {@link ConfigLoader}.
     *
     * @param explicitConfigFile configuration file to use, or {@code null} for discovery
     * @return the wired ingestion stage
     */
    public static BackupIngestion create(File explicitConfigFile) {
        Config config = ConfigLoader.resolve(explicitConfigFile, (level, message) -> {
            if (level == ConfigLoader.MessageLevel.WARN) {
                log.warn(message);
            } else {
                log.info(message);
            }
        });
        return fromConfig(config);
    }

    /**
     * Builds an ingestion stage from resolved application configuration.
     *
     * @param config the root configuration, holding a {@code fireup} block
     * @return the wired ingestion stage
     */
    public static BackupIngestion fromConfig(Config config) {
        Config fireup = config.getConfig("fireup");
        ParserOptions options = ParserOptions.fromConfig(fireup.getConfig("parser"));
        IOperationMonitor monitor = InMemoryOperationMonitor.fromConfig(fireup.getConfig("monitoring"));
        return new BackupIngestion(
            new BackupPathResolver(fireup.getString("backup.preferredFileName")),
            new FirestoreBackupParser(options, monitor),
            new BackupValidator(options),
            monitor);
    }

    /**
     * Resolves a backup file or export directory and parses the backup.
     *
     * @param location backup file or export directory
     * @return the parse result
     * @throws IOException if the location cannot be resolved or the parse fails fatally
     */
    public ParseResult ingest(Path location) throws IOException {
        return parser.parse(pathResolver.resolve(location));
    }

    /**
     * Resolves a backup file or export directory and validates it without importing.
     *
     * @param location backup file or export directory
     * @return the validation result
     * @throws IOException if the location cannot be resolved
     */
    public ValidationResult validate(Path location) throws IOException {
        return validator.validate(pathResolver.resolve(location));
    }

    public IOperationMonitor getMonitor() {
        return monitor;
    }
}
