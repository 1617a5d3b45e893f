// file: src/main/java/io/logstats/storage/SegmentFiles.java
package io.logstats.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Naming and discovery of numbered log segments.
 * <p>
 * Layout for a configured name "dir/stats.log":
 *   dir/stats.00.log       active segment (never compressed)
 *   dir/stats.01.log[.gz]  newest sealed segment
 *   dir/stats.NN.log[.gz]  older sealed segments, higher index = older
 * <p>
 * The index is zero-padded to the digit count of {@link #MAX_NUM_FILES}, so
 * lexicographic order of names equals numeric order of indices.
 */
public final class SegmentFiles {

    public static final int MAX_NUM_FILES = 99;

    static final int INDEX_WIDTH = Integer.toString(MAX_NUM_FILES).length();

    private static final String LOG_SUFFIX = ".log";
    private static final String GZ_SUFFIX = ".gz";

    private final Path dir;
    private final String baseName;
    private final Pattern segmentPattern;

    /** One numbered segment found on disk. */
    public record Segment(int index, boolean compressed, Path path) {}

    private SegmentFiles(Path dir, String baseName) {
        this.dir = dir;
        this.baseName = baseName;
        this.segmentPattern = Pattern.compile(
                Pattern.quote(baseName) + "\\.(\\d{" + INDEX_WIDTH + "})\\.log(\\.gz)?");
    }

    /**
     * Resolve the segment family for a configured log file name.
     * A missing ".log" extension is appended, then stripped to obtain the base name.
     *
     * @throws IllegalArgumentException if the name is blank or names a directory
     */
    public static SegmentFiles forLogFile(String fileName) {
        if (fileName == null || fileName.isBlank()) {
            throw new IllegalArgumentException("log file name must not be blank");
        }
        String withExt = fileName.endsWith(LOG_SUFFIX) ? fileName : fileName + LOG_SUFFIX;
        String base = withExt.substring(0, withExt.length() - LOG_SUFFIX.length());
        if (base.isEmpty() || base.endsWith("/") || base.endsWith(java.io.File.separator)) {
            throw new IllegalArgumentException("log file name must name a file, got: " + fileName);
        }

        Path basePath;
        try {
            basePath = Path.of(base).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("invalid log file name: " + fileName, e);
        }
        Path name = basePath.getFileName();
        if (name == null || basePath.getParent() == null) {
            throw new IllegalArgumentException("log file name must name a file, got: " + fileName);
        }
        return new SegmentFiles(basePath.getParent(), name.toString());
    }

    public Path dir() { return dir; }

    public String baseName() { return baseName; }

    /** Path of segment {@code index}; the ".gz" suffix is only ever used for index > 0. */
    public Path path(int index, boolean compressed) {
        if (index < 0 || index > MAX_NUM_FILES) {
            throw new IllegalArgumentException("segment index out of range: " + index);
        }
        String padded = String.format("%0" + INDEX_WIDTH + "d", index);
        String name = baseName + "." + padded + LOG_SUFFIX;
        if (compressed && index > 0) {
            name += GZ_SUFFIX;
        }
        return dir.resolve(name);
    }

    /** The active (index 0) segment. */
    public Path active() { return path(0, false); }

    /** Parse a file name of this family, or return null if it is not one of our segments. */
    Segment parse(Path file) {
        Matcher m = segmentPattern.matcher(file.getFileName().toString());
        if (!m.matches()) {
            return null;
        }
        return new Segment(Integer.parseInt(m.group(1)), m.group(2) != null, file);
    }

    /** Every segment on disk, sorted by index ascending (newest first). */
    public List<Segment> list() throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<Segment> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.filter(Files::isRegularFile).forEach(p -> {
                Segment s = parse(p);
                if (s != null) out.add(s);
            });
        }
        out.sort(Comparator.comparingInt(Segment::index));
        return out;
    }

    /** Sealed segments (index >= 1), highest index first, i.e. the order a rename cascade must run in. */
    public List<Segment> listSealedDescending() throws IOException {
        List<Segment> sealed = new ArrayList<>();
        for (Segment s : list()) {
            if (s.index() > 0) sealed.add(s);
        }
        sealed.sort(Comparator.comparingInt(Segment::index).reversed());
        return sealed;
    }
}
