/*
 * Copyright 2024 mdzhigarov
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

package io.github.mdzhigarov.jzipbuilder;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Example usage of the jZipBuilder library.
 * Archives a directory tree into a ZIP file, configured through environment variables.
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final String SOURCE_DIR = "ZIP_SOURCE_DIR";
    static final String OUTPUT_FILE = "ZIP_OUTPUT_FILE";
    static final String THREADS = "ZIP_THREADS";
    static final String COMPRESSION_LEVEL = "ZIP_COMPRESSION_LEVEL";

    public static void main(String[] args) throws Exception {
        String sourceDir = System.getenv(SOURCE_DIR);
        String outputFile = System.getenv(OUTPUT_FILE);

        if (sourceDir == null || outputFile == null) {
            System.err.println("Missing required environment variables:");
            System.err.println("  " + SOURCE_DIR + ": " + (sourceDir != null ? "✓" : "✗"));
            System.err.println("  " + OUTPUT_FILE + ": " + (outputFile != null ? "✓" : "✗"));
            System.err.println();
            System.err.println("Example usage:");
            System.err.println("  export " + SOURCE_DIR + "=/path/to/directory");
            System.err.println("  export " + OUTPUT_FILE + "=/path/to/archive.zip");
            System.err.println("  export " + THREADS + "=4                # optional");
            System.err.println("  export " + COMPRESSION_LEVEL + "=6      # optional, 0-9");
            System.err.println("  java -jar jzipbuilder.jar");
            System.exit(1);
        }

        run(System.getenv());
    }

    /**
     * Archives the configured directory.
     *
     * @param env The configuration, keyed by environment variable name
     * @return The number of entries written
     */
    static int run(Map<String, String> env) throws IOException {
        Path source = Paths.get(env.get(SOURCE_DIR));
        Path output = Paths.get(env.get(OUTPUT_FILE));
        int threads = env.containsKey(THREADS) ? Integer.parseInt(env.get(THREADS)) : ZipArchive.defaultThreadCount();
        EntryOptions options = env.containsKey(COMPRESSION_LEVEL)
                ? EntryOptions.builder().compressionLevel(Integer.parseInt(env.get(COMPRESSION_LEVEL))).build()
                : EntryOptions.defaults();

        if (!Files.isDirectory(source)) {
            throw new IllegalArgumentException("Not a directory: " + source);
        }

        logger.info("Archiving {} into {} using {} threads", source, output, threads);
        ZipArchive archive = ZipArchive.newArchive();

        List<Path> paths;
        try (Stream<Path> walk = Files.walk(source)) {
            paths = walk.filter(path -> !path.equals(source))
                    .filter(path -> !path.toAbsolutePath().equals(output.toAbsolutePath()))
                    .sorted()
                    .collect(Collectors.toList());
        }
        for (Path path : paths) {
            String name = toArchiveName(source.relativize(path));
            if (Files.isDirectory(path)) {
                archive.addDirectoryFromFilesystem(path, name);
            } else {
                archive.addFile(path, name, options);
            }
        }

        try (FileChannel channel = FileChannel.open(output, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            archive.write(channel, threads);
        }
        logger.info("Wrote {} entries to {} ({} bytes)", archive.recordCount(), output, Files.size(output));
        return archive.recordCount();
    }

    /**
     * Joins path elements with '/', whatever the platform separator.
     */
    static String toArchiveName(Path relative) {
        StringBuilder name = new StringBuilder();
        for (Path element : relative) {
            if (name.length() > 0) {
                name.append('/');
            }
            name.append(element.toString());
        }
        return name.toString();
    }
}
