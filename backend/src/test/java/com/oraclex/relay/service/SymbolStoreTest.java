package com.oraclex.relay.service;

import com.oraclex.relay.exception.MalformedInputException;
import com.oraclex.relay.model.IndicatorReading;
import com.oraclex.relay.model.SymbolSnapshot;
import com.oraclex.relay.model.SymbolUpdate;
import com.oraclex.relay.util.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SymbolStoreTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private SymbolStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        registry = new SimpleMeterRegistry();
        store = new SymbolStore(clock, new RelayMetrics(registry));
    }

    @Test
    void fieldsMissingFromLaterUpdateAreKept() {
        store.upsert(List.of(SymbolUpdate.builder().symbol("EURUSD").price(1.1).bid(1.0999).build()));
        store.upsert(List.of(SymbolUpdate.builder().symbol("EURUSD").ask(1.1002).build()));

        SymbolSnapshot snapshot = store.find("EURUSD").orElseThrow();
        assertThat(snapshot.getPrice()).isEqualTo(1.1);
        assertThat(snapshot.getBid()).isEqualTo(1.0999);
        assertThat(snapshot.getAsk()).isEqualTo(1.1002);
    }

    @Test
    void sentFieldOverwritesStoredValue() {
        store.upsert(List.of(SymbolUpdate.builder().symbol("EURUSD").price(1.1).build()));
        store.upsert(List.of(SymbolUpdate.builder().symbol("EURUSD").price(1.2).build()));

        assertThat(store.find("EURUSD").orElseThrow().getPrice()).isEqualTo(1.2);
    }

    @Test
    void indicatorsAreReplacedAsAWhole() {
        store.upsert(List.of(SymbolUpdate.builder().symbol("EURUSD")
                .indicators(Map.of("rsi", new IndicatorReading("🟢", 61.2, "RSI"),
                        "macd", new IndicatorReading("🔴", -0.1, "MACD")))
                .build()));
        store.upsert(List.of(SymbolUpdate.builder().symbol("EURUSD")
                .indicators(Map.of("rsi", new IndicatorReading("⚪", 50.0, "RSI")))
                .build()));

        assertThat(store.find("EURUSD").orElseThrow().getIndicators())
                .containsOnlyKeys("rsi");
    }

    @Test
    void returnsHeldCountAndSkipsRecordsWithoutSymbol() {
        int held = store.upsert(Arrays.asList(
                SymbolUpdate.builder().symbol("EURUSD").price(1.1).build(),
                SymbolUpdate.builder().price(2.0).build(),
                null,
                SymbolUpdate.builder().symbol("GBPUSD").price(1.27).build()));

        assertThat(held).isEqualTo(2);
        assertThat(store.upsert(List.of(SymbolUpdate.builder().symbol("EURUSD").build()))).isEqualTo(2);
    }

    @Test
    void symbolsAreNeverRemovedByLaterBatches() {
        store.upsert(List.of(SymbolUpdate.builder().symbol("EURUSD").build(),
                SymbolUpdate.builder().symbol("GBPUSD").build()));
        store.upsert(List.of(SymbolUpdate.builder().symbol("XAUUSD").build()));
        store.upsert(List.of());

        assertThat(store.allSnapshots())
                .extracting(SymbolSnapshot::getSymbol)
                .containsExactly("EURUSD", "GBPUSD", "XAUUSD");
    }

    @Test
    void emptyBatchStillRefreshesBatchTime() {
        store.upsert(List.of(SymbolUpdate.builder().symbol("EURUSD").build()));
        clock.advance(Duration.ofSeconds(20));

        store.upsert(List.of());

        assertThat(store.lastBatchTime()).contains(START.plusSeconds(20));
    }

    @Test
    void stampsReceiveTimeWhenProducerSendsNone() {
        store.upsert(List.of(SymbolUpdate.builder().symbol("EURUSD").build()));
        assertThat(store.find("EURUSD").orElseThrow().getLastUpdate()).isEqualTo(START.toEpochMilli());

        store.upsert(List.of(SymbolUpdate.builder().symbol("EURUSD").lastUpdate(123L).build()));
        assertThat(store.find("EURUSD").orElseThrow().getLastUpdate()).isEqualTo(123L);
    }

    @Test
    void rejectsMissingBatch() {
        assertThatThrownBy(() -> store.upsert(null))
                .isInstanceOf(MalformedInputException.class)
                .hasMessage("Invalid market_data format");
        assertThat(store.lastBatchTime()).isEmpty();
    }

    @Test
    void snapshotsHandedOutAreDetachedFromTheStore() {
        store.upsert(List.of(SymbolUpdate.builder().symbol("EURUSD").price(1.1).build()));
        SymbolSnapshot before = store.allSnapshots().get(0);

        store.upsert(List.of(SymbolUpdate.builder().symbol("EURUSD").price(1.3).build()));

        assertThat(before.getPrice()).isEqualTo(1.1);
    }

    @Test
    void countsBatches() {
        store.upsert(List.of());
        store.upsert(List.of());

        assertThat(registry.get("relay_price_batches_total").counter().count()).isEqualTo(2.0);
    }

    @Test
    void concurrentPartialUpdatesAllLand() throws Exception {
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < writers; i++) {
            String symbol = "SYM" + i;
            futures.add(executor.submit(() -> {
                start.await();
                for (int n = 0; n < 200; n++) {
                    store.upsert(List.of(
                            SymbolUpdate.builder().symbol(symbol).price((double) n).build(),
                            SymbolUpdate.builder().symbol("SHARED").bid((double) n).build()));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get();
        }
        executor.shutdown();

        assertThat(store.size()).isEqualTo(writers + 1);
        assertThat(store.allSnapshots())
                .filteredOn(snapshot -> snapshot.getSymbol().startsWith("SYM"))
                .allSatisfy(snapshot -> assertThat(snapshot.getPrice()).isEqualTo(199.0));
        assertThat(store.find("SHARED").orElseThrow().getBid()).isEqualTo(199.0);
    }
}
