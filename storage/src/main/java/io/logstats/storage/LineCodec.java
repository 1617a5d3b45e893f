// file: src/main/java/io/logstats/storage/LineCodec.java
package io.logstats.storage;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Objects;

/**
 * Text framing for stat log lines.
 * <p>
 * Wire layout (one record per line):
 * <p>
 *   [timestamp] SP [type] SP [json payload] LF
 * <p>
 * No escaping is done. A type containing a space cannot be decoded again.
 * <p>
 * Decoding locates the payload by scanning backward from the end of the line
 * and balancing brackets ({}, [], ()), so any prefix before the type is tolerated.
 * "[" may be closed by "]" or ")" and "(" by ")" or "]", because histogram
 * buckets are rendered as "[a, b)".
 */
public final class LineCodec {

    /** Java rendering of the default "2006-01-02T15:04:05.000-07:00" layout. */
    public static final String DEFAULT_TIMESTAMP_FORMAT = "yyyy-MM-dd'T'HH:mm:ss.SSSXXX";

    private final DateTimeFormatter formatter;
    private final Clock clock;

    /** Where the payload of a decoded stat line starts, and which type it belongs to. */
    public record DecodedLine(String type, int payloadStart) {}

    public LineCodec(DateTimeFormatter formatter, Clock clock) {
        this.formatter = Objects.requireNonNull(formatter, "formatter");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Encode a line stamped with the current time of this codec's clock. */
    public byte[] encode(String type, byte[] payload) {
        return encode(formatter.format(ZonedDateTime.now(clock)), type, payload);
    }

    public static byte[] encode(String timestamp, String type, byte[] payload) {
        byte[] prefix = (timestamp + " " + type + " ").getBytes(StandardCharsets.UTF_8);
        byte[] out = Arrays.copyOf(prefix, prefix.length + payload.length + 1);
        System.arraycopy(payload, 0, out, prefix.length, payload.length);
        out[out.length - 1] = '\n';
        return out;
    }

    /**
     * Locate the stat type and payload of a line (without its trailing newline).
     *
     * @return null if the line does not start with a digit and so is not a stat line
     * @throws LineFormatException if it looks like a stat line but cannot be split
     */
    public static DecodedLine decode(byte[] line) {
        if (line.length == 0 || !isDigit(line[0])) {
            return null;
        }

        int start = payloadStart(line);
        if (start < 1 || line[start - 1] != ' ') {
            throw new LineFormatException("no space separator before payload");
        }

        int typeEnd = start - 1;
        int typeStart = typeEnd;
        while (typeStart > 0 && line[typeStart - 1] != ' ') {
            typeStart--;
        }
        if (typeStart == typeEnd) {
            throw new LineFormatException("empty stat type");
        }
        return new DecodedLine(new String(line, typeStart, typeEnd - typeStart, StandardCharsets.UTF_8), start);
    }

    // ----------------- helpers -----------------

    /** Index of the bracket that opens the trailing payload. */
    static int payloadStart(byte[] line) {
        byte[] stack = new byte[16];
        int depth = 0;

        for (int i = line.length - 1; i >= 0; i--) {
            byte c = line[i];
            switch (c) {
                case '}', ']', ')' -> {
                    if (depth == stack.length) {
                        stack = Arrays.copyOf(stack, depth * 2);
                    }
                    stack[depth++] = c;
                }
                case '{' -> {
                    expectCloser(stack, depth, c, '}', '}');
                    depth--;
                }
                case '[' -> {
                    expectCloser(stack, depth, c, ']', ')');
                    depth--;
                }
                case '(' -> {
                    expectCloser(stack, depth, c, ')', ']');
                    depth--;
                }
                default -> {
                    if (depth == 0) {
                        throw new LineFormatException("line does not end with a closing bracket");
                    }
                }
            }
            if (depth == 0) {
                return i;
            }
        }
        throw new LineFormatException("unbalanced brackets: " + depth + " left open");
    }

    private static void expectCloser(byte[] stack, int depth, byte opener, char closer, char altCloser) {
        if (depth == 0) {
            throw new LineFormatException("unexpected '" + (char) opener + "' with nothing to close");
        }
        byte top = stack[depth - 1];
        if (top != closer && top != altCloser) {
            throw new LineFormatException(
                    "bracket mismatch: '" + (char) opener + "' cannot close '" + (char) top + "'");
        }
    }

    private static boolean isDigit(byte b) {
        return b >= '0' && b <= '9';
    }
}
