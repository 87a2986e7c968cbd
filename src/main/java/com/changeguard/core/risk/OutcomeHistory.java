package com.changeguard.core.risk;

import com.changeguard.core.indexer.SourceLanguages;
import com.changeguard.core.model.ChangeKind;
import com.changeguard.core.model.ChangeRecord;
import com.changeguard.core.model.ChangeStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Success / failure tallies of past changes, grouped by change kind and file extension.
 */
@Component
public class OutcomeHistory {

    private static final Logger log = LoggerFactory.getLogger(OutcomeHistory.class);

    private final Map<String, Tally> tallies = new ConcurrentHashMap<>();

    public void recordSuccess(ChangeKind kind, String filePath) {
        tally(kind, filePath).successes.incrementAndGet();
    }

    public void recordFailure(ChangeKind kind, String filePath) {
        tally(kind, filePath).failures.incrementAndGet();
    }

    /** Turns a previously recorded success into a failure. */
    public void recordRollback(ChangeKind kind, String filePath) {
        Tally t = tally(kind, filePath);
        t.successes.updateAndGet(n -> Math.max(0, n - 1));
        t.failures.incrementAndGet();
    }

    /** Success rate of similar changes, empty when fewer than {@code minSamples} are known. */
    public OptionalDouble successRate(ChangeKind kind, String filePath, int minSamples) {
        Tally t = tallies.get(key(kind, filePath));
        if (t == null) {
            return OptionalDouble.empty();
        }
        int ok = t.successes.get();
        int total = ok + t.failures.get();
        if (total == 0 || total < minSamples) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) ok / total);
    }

    public int samples(ChangeKind kind, String filePath) {
        Tally t = tallies.get(key(kind, filePath));
        return t == null ? 0 : t.successes.get() + t.failures.get();
    }

    /**
     * Replaces the tallies with ones derived from an audit trail: applied changes count as
     * successes; failed and rolled-back ones as failures.
     */
    public void rebuild(Collection<ChangeRecord> records) {
        tallies.clear();
        for (ChangeRecord record : records) {
            if (record.status() == ChangeStatus.APPLIED) {
                recordSuccess(record.kind(), record.filePath());
            } else if (record.status() == ChangeStatus.FAILED
                    || (record.status() == ChangeStatus.REJECTED && record.backup() != null)) {
                recordFailure(record.kind(), record.filePath());
            }
        }
        log.info("Outcome history rebuilt from {} records ({} groups)", records.size(), tallies.size());
    }

    private Tally tally(ChangeKind kind, String filePath) {
        return tallies.computeIfAbsent(key(kind, filePath), k -> new Tally());
    }

    static String key(ChangeKind kind, String filePath) {
        Path fileName = Path.of(filePath).getFileName();
        String extension = fileName == null ? "" : SourceLanguages.extension(fileName.toString());
        return kind + ":" + extension;
    }

    private static final class Tally {
        final AtomicInteger successes = new AtomicInteger();
        final AtomicInteger failures = new AtomicInteger();
    }
}
