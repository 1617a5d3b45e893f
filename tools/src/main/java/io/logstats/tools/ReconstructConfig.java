// file: tools/src/main/java/io/logstats/tools/ReconstructConfig.java
package io.logstats.tools;

import io.logstats.storage.reconstruct.ReconstructionPipeline;

import java.nio.file.Path;

/**
 * Options of the reconstruction tool, parsed from CLI args.
 *
 * Supports:
 *  - sourcePath: deduplicated stat file to expand (made absolute)
 *  - chunkBytes: read chunk size of the pipeline's reader stage
 *  - help:       print usage and exit
 */
public record ReconstructConfig(
        Path sourcePath,
        int chunkBytes,
        boolean help
) {

    static final String USAGE = """
            Usage: logstats-reconstruct [options]

            Options:
              --reconstruct-stat-file, -f   Path to the source stat file (required)
              --chunk-bytes                 Read chunk size in bytes (default: 65536)
              --help,                  -h   Show this help message

            The expanded file is written next to the source as <name>_duped.log.
            """;

    /**
     * Very small CLI parser.
     *
     * @throws UsageException on unknown flags, missing values or a missing source path
     */
    public static ReconstructConfig fromArgs(String[] args) {
        String source = null;
        int chunkBytes = ReconstructionPipeline.DEFAULT_CHUNK_BYTES;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    return new ReconstructConfig(null, chunkBytes, true);
                }

                case "--reconstruct-stat-file", "-f" -> {
                    ensureValue(args, i);
                    source = args[++i];
                }

                case "--chunk-bytes" -> {
                    ensureValue(args, i);
                    try {
                        chunkBytes = Integer.parseInt(args[++i]);
                    } catch (NumberFormatException e) {
                        throw new UsageException("Invalid chunk-bytes: " + args[i]);
                    }
                    if (chunkBytes <= 0) {
                        throw new UsageException("chunk-bytes must be > 0, got " + chunkBytes);
                    }
                }

                default -> throw new UsageException("Unknown option: " + args[i]);
            }
        }

        if (source == null || source.isBlank()) {
            throw new UsageException("invalid value of parameter `reconstruct-stat-file`. please retry with a valid value");
        }
        return new ReconstructConfig(Path.of(source).toAbsolutePath(), chunkBytes, false);
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new UsageException("Missing value for option: " + args[i]);
        }
    }

    static final class UsageException extends RuntimeException {
        UsageException(String msg) {
            super(msg);
        }
    }
}
