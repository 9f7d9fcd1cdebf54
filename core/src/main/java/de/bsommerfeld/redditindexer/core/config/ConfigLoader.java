package de.bsommerfeld.redditindexer.core.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Reads {@code config.json} into an {@link IndexerConfig} and validates it.
 *
 * <p>
 * Every key is optional; absent keys keep the defaults declared on the config
 * classes. Unknown keys are rejected so that typos surface at startup instead
 * of silently falling back to a default.
 *
 * <p>
 * The file location is resolved in this order: explicit path argument,
 * system property {@value #CONFIG_PROPERTY}, {@code ./config.json}.
 * A non-blank {@value ApplicationMode#MODE_PROPERTY} system property replaces
 * the {@code mode} read from the file.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_PROPERTY = "indexer.config";
    public static final String DEFAULT_FILE = "config.json";

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .enable(JsonParser.Feature.ALLOW_COMMENTS)
            .build();

    private ConfigLoader() {
    }

    /**
     * Resolves the config path from the program arguments, falling back to
     * the system property and finally the working directory.
     */
    public static Path resolvePath(String[] args) {
        if (args != null && args.length > 0 && !args[0].isBlank()) {
            return Paths.get(args[0]);
        }
        String property = System.getProperty(CONFIG_PROPERTY);
        if (property != null && !property.isBlank()) {
            return Paths.get(property);
        }
        return Paths.get(DEFAULT_FILE);
    }

    public static IndexerConfig load(Path path) throws ConfigurationException {
        LOG.info("Loading Configuration from: {}", path.toAbsolutePath());
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Configuration file not found: " + path.toAbsolutePath());
        }

        IndexerConfig config;
        try {
            config = MAPPER.readValue(path.toFile(), IndexerConfig.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed configuration in " + path + ": "
                    + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration " + path, e);
        }
        if (config == null) {
            throw new ConfigurationException("Configuration file is empty: " + path);
        }

        applyModeOverride(config);
        validate(config);
        LOG.info("Application mode: {}", config.getMode());
        return config;
    }

    static void applyModeOverride(IndexerConfig config) throws ConfigurationException {
        String override = System.getProperty(ApplicationMode.MODE_PROPERTY);
        if (override != null && !override.isBlank()) {
            config.setMode(ApplicationMode.parse(override));
        }
    }

    /**
     * Checks value ranges that Jackson cannot express. Runs before any worker
     * starts, so a bad value never reaches the pipeline.
     */
    static void validate(IndexerConfig config) throws ConfigurationException {
        if (config.getMode() == null) {
            throw new ConfigurationException("mode must be prod or test");
        }
        if (config.getMongo() == null || config.getReddit() == null
                || config.getIngestion() == null || config.getApi() == null) {
            throw new ConfigurationException("Configuration sections must not be null");
        }

        MongoConfig mongo = config.getMongo();
        require(mongo.getHost() != null && !mongo.getHost().isBlank(), "mongo.host must not be blank");
        requirePort(mongo.getPort(), "mongo.port");
        require(mongo.getDatabase() != null && !mongo.getDatabase().isBlank(),
                "mongo.database must not be blank");

        List<String> subreddits = config.getReddit().getSubreddits();
        require(subreddits != null && !subreddits.isEmpty(), "reddit.subreddits must not be empty");
        for (String subreddit : subreddits) {
            require(subreddit != null && !subreddit.isBlank(), "reddit.subreddits contains a blank entry");
        }

        IngestionConfig ingestion = config.getIngestion();
        require(ingestion.getSubmissionLimit() > 0, "ingestion.submission-limit must be positive");
        require(ingestion.getCommentLimit() > 0, "ingestion.comment-limit must be positive");
        require(ingestion.getUpdateIntervalMillis() >= 0, "ingestion.update-interval-millis must not be negative");
        require(ingestion.getWorkerCount() >= 0, "ingestion.worker-count must not be negative");
        require(ingestion.getStartTimestamp() >= 0, "ingestion.start-timestamp must not be negative");
        require(ingestion.getShutdownPollMillis() > 0, "ingestion.shutdown-poll-millis must be positive");

        requirePort(config.getApi().getPort(), "api.port");
    }

    private static void requirePort(int port, String key) throws ConfigurationException {
        require(port > 0 && port <= 65535, key + " must be between 1 and 65535");
    }

    private static void require(boolean condition, String message) throws ConfigurationException {
        if (!condition) {
            throw new ConfigurationException(message);
        }
    }
}
