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
package dev.mars.dbdb.demo;

import dev.mars.dbdb.Database;
import dev.mars.dbdb.storage.StorageConfig;
import dev.mars.dbdb.tree.Entry;
import dev.mars.dbdb.tree.KeyNotFoundException;
import dev.mars.dbdb.tree.KeyType;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Demo entry point for DBDB.
 * <p>
 * This demonstrates:
 * <ul>
 *   <li>Building the textbook nine-key binary search tree and committing it</li>
 *   <li>Reading it back after reopening the file</li>
 *   <li>Child lookups and {@code chop} range queries</li>
 *   <li>An uncommitted write being discarded on close</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link StorageConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (store file only)</li>
 *   <li>System properties: {@code -Ddbdb.file=/path -Ddbdb.syncEnabled=true ...}</li>
 *   <li>Environment variables: {@code DBDB_FILE, DBDB_SYNC_ENABLED, ...}</li>
 *   <li>Properties file: {@code dbdb.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl dbdb-demo -am
 *
 * # Run with a throwaway file
 * java -cp "dbdb-demo/target/dbdb-demo-1.0-SNAPSHOT.jar:..." dev.mars.dbdb.demo.DbdbDemo /tmp/demo.dbdb
 *
 * # Run with system properties
 * java -Ddbdb.file=/tmp/demo.dbdb -Ddbdb.verifyWrites=true ... dev.mars.dbdb.demo.DbdbDemo
 * </pre>
 * The file is recreated on every run.
 *
 * @see StorageConfig
 */
public class DbdbDemo {

    private static final List<Entry<Long>> TEXTBOOK_TREE = List.of(
            new Entry<>(8L, "eight"),
            new Entry<>(3L, "three"),
            new Entry<>(10L, "ten"),
            new Entry<>(1L, "one"),
            new Entry<>(6L, "six"),
            new Entry<>(14L, "fourteen"),
            new Entry<>(4L, "four"),
            new Entry<>(7L, "seven"),
            new Entry<>(13L, "thirteen"));

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|              DBDB Demo                |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        StorageConfig config = args.length > 0 && !args[0].isBlank()
                ? StorageConfig.builder().file(args[0]).build()
                : StorageConfig.load();
        Path file = config.file();

        System.out.println("Configuration: " + config);
        System.out.println();

        Files.deleteIfExists(file);

        try (Database<Long> db = Database.connect(file, KeyType.LONG, config)) {
            for (Entry<Long> entry : TEXTBOOK_TREE) {
                db.set(entry.key(), entry.value());
            }
            db.commit();
            System.out.println("[OK] Inserted and committed " + TEXTBOOK_TREE.size() + " keys into " +
                    file.toAbsolutePath());
        }

        try (Database<Long> db = Database.connect(file, KeyType.LONG, config)) {
            System.out.println("[OK] Reopened store");
            System.out.println("     min = " + db.getMin() + ", max = " + db.getMax());

            System.out.println("\n  Children:");
            for (Entry<Long> entry : TEXTBOOK_TREE) {
                System.out.printf("    %2d  left=%-18s right=%s%n", entry.key(),
                        describe(() -> db.getLeft(entry.key())),
                        describe(() -> db.getRight(entry.key())));
            }

            System.out.println("\n  chop(6)  -> " + db.chop(6L));
            System.out.println("  chop(0)  -> " + db.chop(0L));
            System.out.println("  in order -> " + db.entries());

            db.set(8L, "EIGHT (uncommitted)");
            System.out.println("\n[OK] Uncommitted set(8): get(8) = " + db.get(8L));
        }

        try (Database<Long> db = Database.connect(file, KeyType.LONG, config)) {
            System.out.println("[OK] After reopen without commit: get(8) = " + db.get(8L));
        }

        System.out.println("\n+---------------------------------------+");
        System.out.println("|  DBDB demo complete!                  |");
        System.out.println("+---------------------------------------+");
    }

    private static String describe(ChildLookup lookup) {
        try {
            Entry<Long> child = lookup.find();
            return "(" + child.key() + ", " + child.value() + ")";
        } catch (KeyNotFoundException e) {
            return "-";
        }
    }

    @FunctionalInterface
    private interface ChildLookup {
        Entry<Long> find();
    }
}
