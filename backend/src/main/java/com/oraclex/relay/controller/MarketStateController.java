package com.oraclex.relay.controller;

import com.oraclex.relay.dto.AckResponse;
import com.oraclex.relay.dto.AnalysisBatchRequest;
import com.oraclex.relay.dto.AnalysisUpdateResponse;
import com.oraclex.relay.dto.MarketStateView;
import com.oraclex.relay.dto.MarketUpdateResponse;
import com.oraclex.relay.dto.PriceBatchRequest;
import com.oraclex.relay.service.AnalysisCache;
import com.oraclex.relay.service.StateMerger;
import com.oraclex.relay.service.SymbolStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "Market State")
public class MarketStateController {

    private final SymbolStore symbolStore;
    private final AnalysisCache analysisCache;
    private final StateMerger stateMerger;

    @PostMapping("/update-market-state")
    @Operation(summary = "Merge a batch of price feed updates")
    public ResponseEntity<MarketUpdateResponse> updateMarketState(@RequestBody PriceBatchRequest request) {
        int held = symbolStore.upsert(request.getMarketData());
        return ResponseEntity.ok(MarketUpdateResponse.builder()
                .success(true)
                .message("Market state updated")
                .symbolsMerged(held)
                .dashboardReady(held > 0)
                .build());
    }

    @PostMapping("/data-update")
    @Operation(summary = "Legacy price feed endpoint", deprecated = true)
    public ResponseEntity<AckResponse> legacyDataUpdate(@RequestBody PriceBatchRequest request) {
        symbolStore.upsert(request.getMarketData());
        return ResponseEntity.ok(AckResponse.builder()
                .ok(true)
                .message("Data received (legacy)")
                .build());
    }

    @PostMapping("/market-analysis")
    @Operation(summary = "Cache a batch of analysis reports")
    public ResponseEntity<AnalysisUpdateResponse> marketAnalysis(@RequestBody AnalysisBatchRequest request) {
        int cached = analysisCache.put(request.getMarketData());
        return ResponseEntity.ok(AnalysisUpdateResponse.builder()
                .success(true)
                .message("Dashboard features cached")
                .symbolsCached(cached)
                .build());
    }

    @GetMapping("/get-market-state")
    @Operation(summary = "Merged price and analysis state for every known symbol")
    public ResponseEntity<MarketStateView> getMarketState() {
        return ResponseEntity.ok(stateMerger.buildView());
    }
}
