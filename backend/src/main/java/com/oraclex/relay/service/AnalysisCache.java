package com.oraclex.relay.service;

import com.oraclex.relay.exception.MalformedInputException;
import com.oraclex.relay.model.AnalysisReport;
import com.oraclex.relay.model.AnalysisSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Latest analysis per symbol. Each report replaces the previous one for its symbol
 * outright; missing sections fall back to the defaults in {@link AnalysisSnapshot}.
 */
@Service
@Slf4j
public class AnalysisCache {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, AnalysisSnapshot> snapshots = new HashMap<>();
    private final Clock clock;
    private final RelayMetrics metrics;

    public AnalysisCache(Clock clock, RelayMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * @return number of reports in the batch that were cached
     * @throws MalformedInputException if {@code batch} is {@code null}
     */
    public int put(List<AnalysisReport> batch) {
        if (batch == null) {
            throw new MalformedInputException("Invalid market_data format");
        }
        long nowMillis = clock.millis();
        int cached = 0;
        lock.writeLock().lock();
        try {
            for (AnalysisReport report : batch) {
                if (report == null || !report.hasSymbol()) {
                    continue;
                }
                snapshots.put(report.getSymbol(), AnalysisSnapshot.from(report, nowMillis));
                cached++;
            }
        } finally {
            lock.writeLock().unlock();
        }
        metrics.recordAnalysisBatch();
        if (!batch.isEmpty() && batch.get(0) != null) {
            AnalysisReport first = batch.get(0);
            log.info("Analysis cached for {} symbols, first {}: {} green, confidence {}%",
                    cached, first.getSymbol(), first.greenIndicatorCount(), first.getConfidence());
        }
        return cached;
    }

    public Optional<AnalysisSnapshot> get(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        lock.readLock().lock();
        try {
            return Optional.ofNullable(snapshots.get(symbol));
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return snapshots.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
