// file: src/main/java/io/logstats/storage/reconstruct/ReconstructionPipeline.java
package io.logstats.storage.reconstruct;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardOpenOption.*;

/**
 * Replays a deduplicated stat file into a fully expanded one.
 * <p>
 * Three stages run concurrently, connected by two bounded FIFO queues:
 * <p>
 *   reader ──lines──▶ transformer ──lines──▶ writer
 * <p>
 *  - reader:      reads the source in fixed-size chunks at increasing offsets and
 *                 cuts them into newline-delimited lines (newline stripped).
 *  - transformer: runs {@link StatLineReconstructor} on each line.
 *  - writer:      appends each line plus newline to the output, flushing every
 *                 {@link #FLUSH_EVERY_LINES} lines.
 * <p>
 * A full queue blocks its producer, an empty one its consumer. Each queue is closed
 * by an end marker. Single producer, single consumer per queue, so output order
 * equals input order.
 * <p>
 * Errors:
 *  - malformed lines never fail the run; they are passed through.
 *  - the first failure of any stage (an I/O error, or a runtime exception such as
 *    one thrown by the listener) aborts the run. The reader stops early, the
 *    transformer and the writer keep draining their queue without working so no
 *    stage blocks, and the failure is rethrown from {@link #run(Path, Path)} once
 *    all stages finished.
 */
public final class ReconstructionPipeline {
    private static final Logger log = Logger.getLogger(ReconstructionPipeline.class.getName());

    public static final int QUEUE_CAPACITY = 10_000;
    public static final int FLUSH_EVERY_LINES = 10_000;
    public static final int DEFAULT_CHUNK_BYTES = 64 * 1024;
    public static final String OUTPUT_SUFFIX = "_duped.log";

    // Compared by identity: an empty line read from the file is a different array.
    private static final byte[] END = new byte[0];

    private final int chunkBytes;
    private final ReconstructionListener listener;

    public ReconstructionPipeline() {
        this(DEFAULT_CHUNK_BYTES, ReconstructionListener.logging());
    }

    public ReconstructionPipeline(int chunkBytes, ReconstructionListener listener) {
        if (chunkBytes <= 0) throw new IllegalArgumentException("chunkBytes must be > 0");
        this.chunkBytes = chunkBytes;
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Sibling of {@code source} named after it with the extension replaced:
     * "dir/stats.00.log" -> "dir/stats.00_duped.log".
     */
    public static Path outputPathFor(Path source) {
        String name = source.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return source.resolveSibling(stem + OUTPUT_SUFFIX);
    }

    /**
     * Reconstruct {@code source} into {@code dest} (created or truncated).
     *
     * @throws IOException the first read/open failure on the source or write/open
     *                     failure on the destination
     */
    public ReconstructionResult run(Path source, Path dest) throws IOException {
        BlockingQueue<byte[]> lines = new ArrayBlockingQueue<>(QUEUE_CAPACITY);
        BlockingQueue<byte[]> output = new ArrayBlockingQueue<>(QUEUE_CAPACITY);
        AtomicReference<Exception> failure = new AtomicReference<>();
        StatLineReconstructor reconstructor = new StatLineReconstructor(listener);

        ExecutorService pool = Executors.newFixedThreadPool(3, stageThreads());
        long read;
        long written;
        try {
            Future<Long> reader = pool.submit(() -> readLines(source, lines, failure));
            Future<?> transformer = pool.submit(() -> {
                transform(lines, output, reconstructor, failure);
                return null;
            });
            Future<Long> writer = pool.submit(() -> writeLines(dest, output, failure));

            read = await(reader);
            await(transformer);
            written = await(writer);
        } finally {
            pool.shutdownNow();
        }

        Exception err = failure.get();
        if (err instanceof IOException io) {
            throw io;
        }
        if (err instanceof RuntimeException re) {
            throw re;
        }
        var result = new ReconstructionResult(read, written, reconstructor.filled(), reconstructor.passedThrough());
        listener.onFinished(result);
        return result;
    }

    // ---------- stages ----------

    private long readLines(Path source, BlockingQueue<byte[]> lines, AtomicReference<Exception> failure)
            throws InterruptedException {
        long count = 0;
        try (FileChannel ch = FileChannel.open(source, READ)) {
            ByteBuffer chunk = ByteBuffer.allocate(chunkBytes);
            ByteArrayOutputStream pending = new ByteArrayOutputStream(1024);
            long offset = 0;

            while (failure.get() == null) {
                chunk.clear();
                int n = ch.read(chunk, offset);
                if (n < 0) {
                    break;
                }
                offset += n;

                byte[] buf = chunk.array();
                int from = 0;
                for (int i = 0; i < n; i++) {
                    if (buf[i] == '\n') {
                        pending.write(buf, from, i - from);
                        lines.put(pending.toByteArray());
                        pending.reset();
                        count++;
                        from = i + 1;
                    }
                }
                pending.write(buf, from, n - from);
            }

            // Last line without a trailing newline.
            if (pending.size() > 0 && failure.get() == null) {
                lines.put(pending.toByteArray());
                count++;
            }
        } catch (IOException e) {
            log.log(Level.WARNING, "Failed to read stat file " + source, e);
            failure.compareAndSet(null, e);
        } finally {
            lines.put(END);
        }
        return count;
    }

    private void transform(BlockingQueue<byte[]> lines, BlockingQueue<byte[]> output,
                           StatLineReconstructor reconstructor, AtomicReference<Exception> failure)
            throws InterruptedException {
        try {
            for (byte[] line = lines.take(); line != END; line = lines.take()) {
                if (failure.get() != null) {
                    continue;
                }
                byte[] out;
                try {
                    out = reconstructor.reconstruct(line);
                } catch (RuntimeException e) {
                    log.log(Level.WARNING, "Reconstruction stage failed", e);
                    failure.compareAndSet(null, e);
                    continue;
                }
                output.put(out);
            }
        } finally {
            output.put(END);
        }
    }

    private long writeLines(Path dest, BlockingQueue<byte[]> output, AtomicReference<Exception> failure)
            throws InterruptedException {
        long written = 0;
        boolean sawEnd = false;
        try (OutputStream out = new BufferedOutputStream(
                Files.newOutputStream(dest, CREATE, TRUNCATE_EXISTING, WRITE), 64 * 1024)) {
            for (byte[] line = output.take(); line != END; line = output.take()) {
                if (failure.get() != null) {
                    continue;
                }
                out.write(line);
                out.write('\n');
                written++;
                if (written % FLUSH_EVERY_LINES == 0) {
                    out.flush();
                    listener.onProgress(written);
                }
            }
            sawEnd = true;
        } catch (IOException | RuntimeException e) {
            log.log(Level.WARNING, "Failed to write reconstructed file " + dest, e);
            failure.compareAndSet(null, e);
        }

        if (!sawEnd) {
            // Keep upstream stages moving until they close the queue.
            long dropped = 0;
            while (output.take() != END) {
                dropped++;
            }
            long total = dropped;
            log.warning(() -> "Dropped " + total + " lines after failure on " + dest);
        }
        return written;
    }

    // ---------- helpers ----------

    private static <T> T await(Future<T> f) throws IOException {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Reconstruction interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Reconstruction stage failed", cause);
        }
    }

    private static ThreadFactory stageThreads() {
        AtomicInteger n = new AtomicInteger();
        String[] names = {"reconstruct-reader", "reconstruct-transformer", "reconstruct-writer"};
        return r -> {
            int i = n.getAndIncrement();
            Thread t = new Thread(r, i < names.length ? names[i] : "reconstruct-" + i);
            t.setDaemon(true);
            return t;
        };
    }
}
