package com.oraclex.relay.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

@Service
public class RelayMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter priceBatches;
    private final Counter analysisBatches;
    private final Counter signalsSubmitted;
    private final Counter signalsApproved;
    private final Counter commandsDispatched;
    private final Counter receiptsRecorded;

    public RelayMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.priceBatches = Counter.builder("relay_price_batches_total").register(meterRegistry);
        this.analysisBatches = Counter.builder("relay_analysis_batches_total").register(meterRegistry);
        this.signalsSubmitted = Counter.builder("relay_signals_submitted_total").register(meterRegistry);
        this.signalsApproved = Counter.builder("relay_signals_approved_total").register(meterRegistry);
        this.commandsDispatched = Counter.builder("relay_commands_dispatched_total").register(meterRegistry);
        this.receiptsRecorded = Counter.builder("relay_receipts_recorded_total").register(meterRegistry);
    }

    public void gauge(String name, Supplier<Number> value) {
        Gauge.builder(name, value).register(meterRegistry);
    }

    public void recordPriceBatch() {
        priceBatches.increment();
    }

    public void recordAnalysisBatch() {
        analysisBatches.increment();
    }

    public void recordSignalSubmitted() {
        signalsSubmitted.increment();
    }

    public void recordSignalApproved() {
        signalsApproved.increment();
    }

    public void recordCommandDispatched() {
        commandsDispatched.increment();
    }

    public void recordReceipt() {
        receiptsRecorded.increment();
    }
}
