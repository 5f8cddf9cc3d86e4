package com.oraclex.relay.service;

import com.oraclex.relay.config.RelayProperties;
import com.oraclex.relay.dto.HealthResponse;
import com.oraclex.relay.dto.RelayStatusResponse;
import com.oraclex.relay.model.SymbolSnapshot;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Service
public class RelayStatusService {

    static final List<String> FEATURES = List.of(
            "sticky-price-merge",
            "analysis-cache",
            "merged-dashboard-state",
            "signal-approval",
            "command-queue",
            "execution-receipts"
    );

    private final SymbolStore symbolStore;
    private final AnalysisCache analysisCache;
    private final ApprovalWorkflow approvalWorkflow;
    private final CommandQueue commandQueue;
    private final ReceiptLog receiptLog;
    private final RelayProperties properties;
    private final Clock clock;
    private final Instant startedAt;

    public RelayStatusService(SymbolStore symbolStore,
                              AnalysisCache analysisCache,
                              ApprovalWorkflow approvalWorkflow,
                              CommandQueue commandQueue,
                              ReceiptLog receiptLog,
                              RelayProperties properties,
                              Clock clock) {
        this.symbolStore = symbolStore;
        this.analysisCache = analysisCache;
        this.approvalWorkflow = approvalWorkflow;
        this.commandQueue = commandQueue;
        this.receiptLog = receiptLog;
        this.properties = properties;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public HealthResponse health() {
        return HealthResponse.builder()
                .status("OK")
                .name(properties.getName())
                .version(properties.getVersion())
                .uptime(Duration.between(startedAt, clock.instant()).getSeconds())
                .features(FEATURES)
                .build();
    }

    public RelayStatusResponse status() {
        Instant now = clock.instant();
        Optional<Instant> lastBatch = symbolStore.lastBatchTime();
        int tradesOpen = symbolStore.allSnapshots().stream()
                .mapToInt(SymbolSnapshot::openTradeCount)
                .sum();
        return RelayStatusResponse.builder()
                .status("running")
                .relayActive(true)
                .symbolsCount(symbolStore.size())
                .dashboardCacheSize(analysisCache.size())
                .tradesOpen(tradesOpen)
                .pendingApprovals(approvalWorkflow.size())
                .queueSize(commandQueue.size())
                .receiptsRecorded(receiptLog.totalRecorded())
                .receiptsRetained(receiptLog.size())
                .lastUpdate(lastBatch.map(Instant::toEpochMilli).orElse(null))
                .dataAgeSec(lastBatch.map(batch -> Math.max(0L, Duration.between(batch, now).getSeconds())).orElse(null))
                .timestamp(now)
                .build();
    }
}
