package com.oraclex.relay.controller;

import com.oraclex.relay.dto.HealthResponse;
import com.oraclex.relay.dto.RelayStatusResponse;
import com.oraclex.relay.service.RelayStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@Tag(name = "System")
public class SystemController {

    private final RelayStatusService relayStatusService;

    @GetMapping("/")
    @Operation(summary = "Relay descriptor and uptime")
    public ResponseEntity<HealthResponse> root() {
        return ResponseEntity.ok(relayStatusService.health());
    }

    @GetMapping("/status")
    @Operation(summary = "Store sizes and price feed freshness")
    public ResponseEntity<RelayStatusResponse> status() {
        return ResponseEntity.ok(relayStatusService.status());
    }
}
