package com.oraclex.relay.service;

import com.oraclex.relay.exception.MalformedInputException;
import com.oraclex.relay.model.SymbolSnapshot;
import com.oraclex.relay.model.SymbolUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Latest price feed state per symbol. Updates are merged field by field into the
 * stored snapshot, so a producer may send only what changed.
 */
@Service
@Slf4j
public class SymbolStore {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, SymbolSnapshot> snapshots = new LinkedHashMap<>();
    private final Clock clock;
    private final RelayMetrics metrics;

    private Instant lastBatchTime;

    public SymbolStore(Clock clock, RelayMetrics metrics) {
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Merges a batch of partial records. Elements without a symbol are skipped.
     *
     * @return number of symbols held after the merge
     * @throws MalformedInputException if {@code batch} is {@code null}
     */
    public int upsert(List<SymbolUpdate> batch) {
        if (batch == null) {
            throw new MalformedInputException("Invalid market_data format");
        }
        Instant now = clock.instant();
        long nowMillis = now.toEpochMilli();
        int inserted = 0;
        int merged = 0;
        int skipped = 0;
        int total;
        lock.writeLock().lock();
        try {
            for (SymbolUpdate update : batch) {
                if (update == null || !update.hasSymbol()) {
                    skipped++;
                    continue;
                }
                SymbolSnapshot existing = snapshots.get(update.getSymbol());
                if (existing == null) {
                    snapshots.put(update.getSymbol(), SymbolSnapshot.create(update, nowMillis));
                    inserted++;
                } else {
                    existing.merge(update, nowMillis);
                    merged++;
                }
            }
            lastBatchTime = now;
            total = snapshots.size();
        } finally {
            lock.writeLock().unlock();
        }
        metrics.recordPriceBatch();
        if (skipped > 0) {
            log.debug("Skipped {} price records without a symbol", skipped);
        }
        log.info("Price batch merged: {} new, {} updated, {} symbols held", inserted, merged, total);
        return total;
    }

    public List<SymbolSnapshot> allSnapshots() {
        lock.readLock().lock();
        try {
            List<SymbolSnapshot> copies = new ArrayList<>(snapshots.size());
            for (SymbolSnapshot snapshot : snapshots.values()) {
                copies.add(snapshot.copy());
            }
            return copies;
        } finally {
            lock.readLock().unlock();
        }
    }

    Optional<SymbolSnapshot> find(String symbol) {
        lock.readLock().lock();
        try {
            SymbolSnapshot snapshot = snapshots.get(symbol);
            return snapshot == null ? Optional.empty() : Optional.of(snapshot.copy());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<Instant> lastBatchTime() {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(lastBatchTime);
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
