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
package dev.mars.dbdb;

import dev.mars.dbdb.storage.StorageFile.StorageException;
import dev.mars.dbdb.tree.Entry;
import dev.mars.dbdb.tree.KeyNotFoundException;
import dev.mars.dbdb.tree.KeyType;

import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Command-line access to a database with string keys.
 * <pre>
 * java -jar dbdb-core.jar &lt;file&gt; get &lt;key&gt;
 * java -jar dbdb-core.jar &lt;file&gt; set &lt;key&gt; &lt;value&gt;
 * java -jar dbdb-core.jar &lt;file&gt; min | max | dump
 * java -jar dbdb-core.jar &lt;file&gt; left &lt;key&gt; | right &lt;key&gt; | chop &lt;key&gt;
 * </pre>
 * {@code set} commits immediately. Exit status is 0 on success, 1 when a key
 * is not found, 2 on a usage error and 3 when the file cannot be read or
 * written, for example when it was written with a different key type.
 */
public class Main {

    static final int OK = 0;
    static final int NOT_FOUND = 1;
    static final int BAD_ARGS = 2;
    static final int STORAGE_ERROR = 3;

    private static final String USAGE =
            "Usage: dbdb <file> get <key> | set <key> <value> | min | max | left <key> | right <key> | chop <key> | dump";

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length < 2) {
            err.println(USAGE);
            return BAD_ARGS;
        }
        String command = args[1];
        int expectedArgs = switch (command) {
            case "min", "max", "dump" -> 2;
            case "get", "left", "right", "chop" -> 3;
            case "set" -> 4;
            default -> -1;
        };
        if (args.length != expectedArgs) {
            err.println(USAGE);
            return BAD_ARGS;
        }

        try (Database<String> db = Database.connect(Path.of(args[0]), KeyType.STRING)) {
            switch (command) {
                case "get" -> out.println(db.get(args[2]));
                case "set" -> {
                    db.set(args[2], args[3]);
                    db.commit();
                }
                case "min" -> out.println(db.getMin());
                case "max" -> out.println(db.getMax());
                case "left" -> print(out, db.getLeft(args[2]));
                case "right" -> print(out, db.getRight(args[2]));
                case "chop" -> print(out, db.chop(args[2]));
                case "dump" -> print(out, db.entries());
                default -> throw new IllegalStateException("Unhandled command: " + command);
            }
            return OK;
        } catch (KeyNotFoundException e) {
            out.println("(not found)");
            return NOT_FOUND;
        } catch (StorageException e) {
            err.println("Error: " + e.getMessage());
            return STORAGE_ERROR;
        }
    }

    private static void print(PrintStream out, List<Entry<String>> entries) {
        for (Entry<String> entry : entries) {
            print(out, entry);
        }
    }

    private static void print(PrintStream out, Entry<String> entry) {
        out.println(entry.key() + "\t" + entry.value());
    }
}
