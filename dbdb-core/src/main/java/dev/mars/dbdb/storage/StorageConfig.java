/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.dbdb.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * Configuration for a DBDB store file.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Ddbdb.file=/path/store.dbdb})</li>
 *   <li>Environment variables (e.g., {@code DBDB_FILE})</li>
 *   <li>Properties file ({@code dbdb.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>file</td><td>dbdb.file</td><td>DBDB_FILE</td><td>~/.dbdb/store.dbdb</td></tr>
 *   <tr><td>syncEnabled</td><td>dbdb.syncEnabled</td><td>DBDB_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>verifyWrites</td><td>dbdb.verifyWrites</td><td>DBDB_VERIFY_WRITES</td><td>false</td></tr>
 *   <tr><td>maxRecordSizeMb</td><td>dbdb.maxRecordSizeMb</td><td>DBDB_MAX_RECORD_SIZE_MB</td><td>16</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>dbdb.minFreeSpaceMb</td><td>DBDB_MIN_FREE_SPACE_MB</td><td>64</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # dbdb.properties
 * dbdb.file=/var/lib/dbdb/store.dbdb
 * dbdb.syncEnabled=true
 * dbdb.verifyWrites=false
 * dbdb.maxRecordSizeMb=16
 * dbdb.minFreeSpaceMb=64
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * StorageConfig config = StorageConfig.builder()
 *     .file(Path.of("/var/lib/dbdb/store.dbdb"))
 *     .syncEnabled(true)
 *     .build();
 *
 * try (Database&lt;String&gt; db = Database.connect(config.file(), KeyType.STRING, config)) {
 *     ...
 * }
 * </pre>
 */
public final class StorageConfig {

    private static final Logger LOG = LoggerFactory.getLogger(StorageConfig.class);

    private static final String PROPERTIES_FILE = "dbdb.properties";

    // Property keys
    private static final String PROP_FILE = "dbdb.file";
    private static final String PROP_SYNC_ENABLED = "dbdb.syncEnabled";
    private static final String PROP_VERIFY_WRITES = "dbdb.verifyWrites";
    private static final String PROP_MAX_RECORD_SIZE_MB = "dbdb.maxRecordSizeMb";
    private static final String PROP_MIN_FREE_SPACE_MB = "dbdb.minFreeSpaceMb";

    // Environment variable keys
    private static final String ENV_FILE = "DBDB_FILE";
    private static final String ENV_SYNC_ENABLED = "DBDB_SYNC_ENABLED";
    private static final String ENV_VERIFY_WRITES = "DBDB_VERIFY_WRITES";
    private static final String ENV_MAX_RECORD_SIZE_MB = "DBDB_MAX_RECORD_SIZE_MB";
    private static final String ENV_MIN_FREE_SPACE_MB = "DBDB_MIN_FREE_SPACE_MB";

    // Defaults
    private static final Path DEFAULT_FILE = Path.of(System.getProperty("user.home"), ".dbdb", "store.dbdb");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final boolean DEFAULT_VERIFY_WRITES = false;
    private static final int DEFAULT_MAX_RECORD_SIZE_MB = 16;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 64;

    private final Path file;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int maxRecordSizeMb;
    private final int minFreeSpaceMb;

    private StorageConfig(Builder builder) {
        this.file = builder.file;
        this.syncEnabled = builder.syncEnabled;
        this.verifyWrites = builder.verifyWrites;
        this.maxRecordSizeMb = builder.maxRecordSizeMb;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
    }

    /** Store file used when no explicit path is given. */
    public Path file() {
        return file;
    }

    /** Whether commits force data to the device (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** Whether the root address is read back and compared after each commit. */
    public boolean verifyWrites() {
        return verifyWrites;
    }

    /** Maximum record payload size in MB. */
    public int maxRecordSizeMb() {
        return maxRecordSizeMb;
    }

    /** Minimum free disk space in MB required before large writes. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Maximum record payload size in bytes. */
    public int maxRecordSizeBytes() {
        return maxRecordSizeMb * 1024 * 1024;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    @Override
    public String toString() {
        return "StorageConfig{" +
                "file=" + file +
                ", syncEnabled=" + syncEnabled +
                ", verifyWrites=" + verifyWrites +
                ", maxRecordSizeMb=" + maxRecordSizeMb +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code StorageConfig.builder().build()}.
     */
    public static StorageConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link StorageConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path file;
        private Boolean syncEnabled;
        private Boolean verifyWrites;
        private Integer maxRecordSizeMb;
        private Integer minFreeSpaceMb;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the store file. */
        public Builder file(Path file) {
            this.file = file;
            return this;
        }

        /** Sets the store file from a string path. */
        public Builder file(String file) {
            this.file = Path.of(file);
            return this;
        }

        /** Enables or disables forcing commits to the device (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Enables or disables root address read-back (default: false). */
        public Builder verifyWrites(boolean verifyWrites) {
            this.verifyWrites = verifyWrites;
            return this;
        }

        /** Sets maximum record payload size in MB (default: 16). */
        public Builder maxRecordSizeMb(int maxRecordSizeMb) {
            this.maxRecordSizeMb = maxRecordSizeMb;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 64). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         */
        public StorageConfig build() {
            // programmatic > sysprop > env > file > default
            if (file == null) {
                String value = resolve(PROP_FILE, ENV_FILE);
                file = value != null ? Path.of(value) : DEFAULT_FILE;
            }
            if (syncEnabled == null) {
                syncEnabled = resolveBoolean(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, DEFAULT_SYNC_ENABLED);
            }
            if (verifyWrites == null) {
                verifyWrites = resolveBoolean(PROP_VERIFY_WRITES, ENV_VERIFY_WRITES, DEFAULT_VERIFY_WRITES);
            }
            if (maxRecordSizeMb == null) {
                maxRecordSizeMb = resolveInt(PROP_MAX_RECORD_SIZE_MB, ENV_MAX_RECORD_SIZE_MB, DEFAULT_MAX_RECORD_SIZE_MB);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolveInt(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB, DEFAULT_MIN_FREE_SPACE_MB);
            }
            if (maxRecordSizeMb <= 0) {
                throw new IllegalArgumentException("maxRecordSizeMb must be positive: " + maxRecordSizeMb);
            }
            if (minFreeSpaceMb < 0) {
                throw new IllegalArgumentException("minFreeSpaceMb must not be negative: " + minFreeSpaceMb);
            }

            return new StorageConfig(this);
        }

        /**
         * Returns the first non-blank value from system property, environment
         * variable, then properties file, or null if none is set.
         */
        private String resolve(String sysProp, String envVar) {
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
            return null;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = resolve(sysProp, envVar);
            return value != null ? Boolean.parseBoolean(value) : defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            String value = resolve(sysProp, envVar);
            if (value == null) {
                return defaultValue;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                LOG.warn("Ignoring non-numeric value for {}: '{}', using default {}", sysProp, value, defaultValue);
                return defaultValue;
            }
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = StorageConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
