package com.oraclex.relay.service;

import com.oraclex.relay.config.RelayProperties;
import com.oraclex.relay.dto.ReceiptAckResponse;
import com.oraclex.relay.exception.MalformedInputException;
import com.oraclex.relay.model.ExecutionReceipt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only record of execution receipts, bounded by
 * {@code oraclex.relay.receipts.max-retained}. Recording a receipt retires the
 * matching signal from the approval workflow.
 */
@Service
@Slf4j
public class ReceiptLog {

    private static final String RECEIPT_ID_PREFIX = "RCPT_";

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Deque<ExecutionReceipt> receipts = new ArrayDeque<>();
    private final ApprovalWorkflow approvalWorkflow;
    private final RelayProperties properties;
    private final Clock clock;
    private final RelayMetrics metrics;

    private long totalRecorded;

    public ReceiptLog(ApprovalWorkflow approvalWorkflow,
                      RelayProperties properties,
                      Clock clock,
                      RelayMetrics metrics) {
        this.approvalWorkflow = approvalWorkflow;
        this.properties = properties;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Appends the receipt whether or not it references a known command.
     */
    public ReceiptAckResponse record(ExecutionReceipt receipt) {
        if (receipt == null) {
            throw new MalformedInputException("Receipt body is required");
        }
        int maxRetained = properties.getReceipts().getMaxRetained();
        ExecutionReceipt stamped;
        lock.writeLock().lock();
        try {
            totalRecorded++;
            stamped = receipt.toBuilder()
                    .receiptId(RECEIPT_ID_PREFIX + totalRecorded)
                    .receivedAt(clock.instant())
                    .build();
            receipts.addLast(stamped);
            while (receipts.size() > maxRetained) {
                receipts.pollFirst();
            }
        } finally {
            lock.writeLock().unlock();
        }
        metrics.recordReceipt();
        boolean retired = stamped.hasCmdId() && approvalWorkflow.retire(stamped.getCmdId());
        log.info("Execution receipt {}: {} {} retcode={}{}", stamped.getReceiptId(), stamped.getSymbol(),
                stamped.getAction(), stamped.getRetcode(), describeContext(stamped.getDashboardContext()));
        return ReceiptAckResponse.builder()
                .ok(true)
                .receiptId(stamped.getReceiptId())
                .retiredSignal(retired)
                .build();
    }

    /**
     * Most recent receipts first.
     */
    public List<ExecutionReceipt> recent(int limit) {
        lock.readLock().lock();
        try {
            List<ExecutionReceipt> result = new ArrayList<>();
            Iterator<ExecutionReceipt> it = receipts.descendingIterator();
            while (it.hasNext() && result.size() < limit) {
                result.add(it.next());
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Receipts recorded since startup, including those evicted by the retention cap.
     */
    public long totalRecorded() {
        lock.readLock().lock();
        try {
            return totalRecorded;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Receipts currently retained.
     */
    public int size() {
        lock.readLock().lock();
        try {
            return receipts.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private static String describeContext(Map<String, Object> context) {
        if (context == null) {
            return "";
        }
        return " [" + context.get("market_regime_trend") + " " + context.get("current_session") + "]";
    }
}
