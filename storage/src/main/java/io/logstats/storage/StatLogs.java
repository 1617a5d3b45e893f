// file: src/main/java/io/logstats/storage/StatLogs.java
package io.logstats.storage;

/**
 * Factory selecting the writer variant from {@link StatLogConfig#dedupe()}.
 */
public final class StatLogs {

    private StatLogs() {
        // utility
    }

    public static StatLog open(StatLogConfig cfg) {
        return open(cfg, new StatLogMetrics());
    }

    public static StatLog open(StatLogConfig cfg, StatLogMetrics metrics) {
        return cfg.dedupe() ? new DedupStatLog(cfg, metrics) : new PlainStatLog(cfg, metrics);
    }
}
