package com.oraclex.relay.service;

import com.oraclex.relay.config.RelayProperties;
import com.oraclex.relay.dto.PendingSignalSummary;
import com.oraclex.relay.dto.SubmitSignalResponse;
import com.oraclex.relay.exception.ConflictException;
import com.oraclex.relay.exception.NotFoundException;
import com.oraclex.relay.exception.ValidationException;
import com.oraclex.relay.model.PendingSignal;
import com.oraclex.relay.model.QueuedCommand;
import com.oraclex.relay.model.TradeSignal;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds submitted signals until an operator approves them. Approval converts the
 * signal into a {@link QueuedCommand}; the pending entry is retired later, when the
 * execution receipt for it arrives.
 */
@Service
@Slf4j
public class ApprovalWorkflow {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, PendingSignal> signals = new LinkedHashMap<>();
    private final CommandQueue commandQueue;
    private final RelayProperties properties;
    private final Clock clock;
    private final SignalNotifier notifier;
    private final RelayMetrics metrics;

    private long lastGeneratedMillis;

    public ApprovalWorkflow(CommandQueue commandQueue,
                            RelayProperties properties,
                            Clock clock,
                            SignalNotifier notifier,
                            RelayMetrics metrics) {
        this.commandQueue = commandQueue;
        this.properties = properties;
        this.clock = clock;
        this.notifier = notifier;
        this.metrics = metrics;
        metrics.gauge("relay_tracked_signals", this::size);
    }

    public SubmitSignalResponse submit(TradeSignal signal) {
        List<String> missing = new ArrayList<>();
        if (signal == null || isBlank(signal.getSymbol())) {
            missing.add("symbol");
        }
        if (signal == null || isBlank(signal.getAction())) {
            missing.add("action");
        }
        if (!missing.isEmpty()) {
            throw new ValidationException("Missing symbol or action", missing);
        }

        Instant now = clock.instant();
        PendingSignal pending;
        lock.writeLock().lock();
        try {
            String cmdId = isBlank(signal.getCmdId()) ? nextCommandId(now) : signal.getCmdId();
            PendingSignal existing = signals.get(cmdId);
            if (existing != null && existing.isApproved()) {
                throw new ConflictException("Signal already approved: " + cmdId);
            }
            pending = new PendingSignal(cmdId, signal.toBuilder().cmdId(cmdId).build(), now);
            signals.put(cmdId, pending);
        } finally {
            lock.writeLock().unlock();
        }

        metrics.recordSignalSubmitted();
        long window = properties.getApproval().getWindowSeconds();
        try {
            notifier.signalPending(pending, window);
        } catch (RuntimeException ex) {
            log.warn("Pending-signal notification failed for {}: {}", pending.getCmdId(), ex.getMessage());
        }
        return SubmitSignalResponse.builder()
                .status(SubmitSignalResponse.PENDING_APPROVAL)
                .cmdId(pending.getCmdId())
                .autoApproveInSec(window)
                .build();
    }

    /**
     * Approves a pending signal and enqueues the resulting command.
     *
     * @param lotOverride lot to use instead of the signal's own; ignored unless positive
     * @throws NotFoundException if no signal is tracked under {@code cmdId}
     * @throws ConflictException if the signal was already approved
     */
    public QueuedCommand approve(String cmdId, Double lotOverride) {
        if (isBlank(cmdId)) {
            throw new ValidationException("cmd_id is required", List.of("cmd_id"));
        }
        QueuedCommand command;
        lock.writeLock().lock();
        try {
            PendingSignal pending = signals.get(cmdId);
            if (pending == null) {
                throw new NotFoundException("Signal not found: " + cmdId);
            }
            if (pending.isApproved()) {
                throw new ConflictException("Signal already approved: " + cmdId);
            }
            TradeSignal signal = pending.getSignal();
            command = QueuedCommand.builder()
                    .cmdId(cmdId)
                    .symbol(signal.getSymbol())
                    .action(signal.getAction())
                    .lot(resolveLot(lotOverride, signal.getLot()))
                    .sl(signal.getSl())
                    .tp(signal.getTp())
                    .price(signal.getPrice())
                    .comment(isBlank(signal.getComment())
                            ? properties.getApproval().getDefaultComment()
                            : signal.getComment())
                    .build();
            pending.approve(clock.instant());
            commandQueue.push(command);
        } finally {
            lock.writeLock().unlock();
        }
        metrics.recordSignalApproved();
        log.info("Signal {} approved: {} {} lot {}", cmdId, command.getAction(), command.getSymbol(), command.getLot());
        return command;
    }

    public List<PendingSignalSummary> listPending() {
        Instant now = clock.instant();
        long window = properties.getApproval().getWindowSeconds();
        lock.readLock().lock();
        try {
            List<PendingSignalSummary> items = new ArrayList<>();
            for (PendingSignal pending : signals.values()) {
                long elapsed = now.getEpochSecond() - pending.getCreatedAt().getEpochSecond();
                items.add(PendingSignalSummary.builder()
                        .cmdId(pending.getCmdId())
                        .symbol(pending.getSignal().getSymbol())
                        .action(pending.getSignal().getAction())
                        .status(pending.getStatus())
                        .createdAt(pending.getCreatedAt().getEpochSecond())
                        .autoApproveInSec(Math.max(0L, window - elapsed))
                        .build());
            }
            return items;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Drops the signal once its execution has been reported.
     *
     * @return {@code true} if a signal was tracked under {@code cmdId}
     */
    public boolean retire(String cmdId) {
        if (cmdId == null) {
            return false;
        }
        PendingSignal removed;
        lock.writeLock().lock();
        try {
            removed = signals.remove(cmdId);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            log.debug("Signal {} retired in status {}", cmdId, removed.getStatus());
        }
        return removed != null;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return signals.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private double resolveLot(Double override, Double signalLot) {
        if (override != null && override > 0) {
            return override;
        }
        if (signalLot != null && signalLot > 0) {
            return signalLot;
        }
        return properties.getApproval().getDefaultLot();
    }

    // Caller holds the write lock
    private String nextCommandId(Instant now) {
        long millis = Math.max(now.toEpochMilli(), lastGeneratedMillis + 1);
        String prefix = properties.getApproval().getCommandIdPrefix();
        while (signals.containsKey(prefix + millis)) {
            millis++;
        }
        lastGeneratedMillis = millis;
        return prefix + millis;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
