package com.oraclex.relay.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class SystemControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void rootDescribesRelay() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("OK"))
                .andExpect(jsonPath("$.name").value("OracleX Trading Relay"))
                .andExpect(jsonPath("$.version").value("3.0"))
                .andExpect(jsonPath("$.uptime").isNumber())
                .andExpect(jsonPath("$.features").isArray());
    }

    @Test
    void statusReportsStoreSizes() throws Exception {
        mockMvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.relay_active").value(true))
                .andExpect(jsonPath("$.symbols_count").isNumber())
                .andExpect(jsonPath("$.dashboard_cache_size").isNumber())
                .andExpect(jsonPath("$.queue_size").isNumber())
                .andExpect(jsonPath("$.pending_approvals").isNumber())
                .andExpect(jsonPath("$.timestamp").isString());
    }

    @Test
    void echoesCallerRequestIdAndUsesItForCorrelation() throws Exception {
        mockMvc.perform(get("/status").header("X-Request-Id", "req-123"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "req-123"))
                .andExpect(header().string("X-Correlation-Id", "req-123"));
    }

    @Test
    void keepsCallerCorrelationId() throws Exception {
        mockMvc.perform(get("/status")
                        .header("X-Request-Id", "req-456")
                        .header("X-Correlation-Id", "dash-session-9"))
                .andExpect(header().string("X-Request-Id", "req-456"))
                .andExpect(header().string("X-Correlation-Id", "dash-session-9"));
    }
}
