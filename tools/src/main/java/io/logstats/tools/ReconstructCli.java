// file: tools/src/main/java/io/logstats/tools/ReconstructCli.java
package io.logstats.tools;

import io.logstats.storage.reconstruct.ReconstructionListener;
import io.logstats.storage.reconstruct.ReconstructionPipeline;
import io.logstats.storage.reconstruct.ReconstructionResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line tool expanding a deduplicated stat file.
 *
 * Usage:
 *   logstats-reconstruct --reconstruct-stat-file /var/log/app/stats.00.log
 *
 * Exit codes:
 *   0  reconstructed (or help printed)
 *   1  usage error
 *   2  source could not be read or output could not be written
 */
public final class ReconstructCli {
    private static final Logger log = Logger.getLogger(ReconstructCli.class.getName());

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_IO = 2;

    private ReconstructCli() {
        // no-op
    }

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    /** Runs the tool and returns its exit code instead of exiting. */
    static int run(String[] args, PrintStream out, PrintStream err) {
        ReconstructConfig cfg;
        try {
            cfg = ReconstructConfig.fromArgs(args);
        } catch (ReconstructConfig.UsageException e) {
            err.println("error: " + e.getMessage());
            err.print(ReconstructConfig.USAGE);
            return EXIT_USAGE;
        }
        if (cfg.help()) {
            out.print(ReconstructConfig.USAGE);
            return EXIT_OK;
        }

        Path source = cfg.sourcePath();
        if (!Files.isRegularFile(source)) {
            err.printf("Unable to open source stat file %s%n", source);
            return EXIT_IO;
        }

        Path output = ReconstructionPipeline.outputPathFor(source);
        var pipeline = new ReconstructionPipeline(cfg.chunkBytes(), ReconstructionListener.logging());
        try {
            ReconstructionResult result = pipeline.run(source, output);
            out.printf("Stats file reconstructed and saved at %s (%d lines, %d filled)%n",
                    output, result.linesWritten(), result.linesFilled());
            return EXIT_OK;
        } catch (IOException e) {
            log.log(Level.SEVERE, "Reconstruction of " + source + " failed", e);
            err.printf("Reconstruction of %s failed: %s%n", source, e.getMessage());
            return EXIT_IO;
        }
    }
}
