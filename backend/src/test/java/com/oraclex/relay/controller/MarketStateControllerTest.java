package com.oraclex.relay.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class MarketStateControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void partialUpdatesAccumulateInMergedState() throws Exception {
        mockMvc.perform(post("/update-market-state")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"market_data":[{"symbol":"MSC_EURUSD","price":1.1,"bid":1.0999,
                                  "price_change_1h":0.12,"h1_high":1.105,"h1_low":1.095,
                                  "m5_high":1.1012,"m5_low":1.0991,"spread_points":12,"digits":5,
                                  "indicators":{"rsi":["🟢",61.5,"RSI"]}}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Market state updated"))
                .andExpect(jsonPath("$.symbols_merged").value(greaterThanOrEqualTo(1)))
                .andExpect(jsonPath("$.dashboard_ready").value(true));

        mockMvc.perform(post("/update-market-state")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"market_data":[{"symbol":"MSC_EURUSD","ask":1.1003}]}
                                """))
                .andExpect(status().isOk());

        mockMvc.perform(get("/get-market-state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_EURUSD')].price").value(1.1))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_EURUSD')].bid").value(1.0999))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_EURUSD')].ask").value(1.1003))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_EURUSD')].price_change_1h").value(0.12))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_EURUSD')].h1_high").value(1.105))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_EURUSD')].h1_low").value(1.095))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_EURUSD')].m5_high").value(1.1012))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_EURUSD')].m5_low").value(1.0991))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_EURUSD')].spread_points").value(12.0))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_EURUSD')].digits").value(5))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_EURUSD')].indicators.rsi[1]").value(61.5))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_EURUSD')].data_source").value("merged"))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_EURUSD')].bias").value("NEUTRAL"))
                .andExpect(jsonPath("$.timestamp").isNumber())
                .andExpect(jsonPath("$.data_age_sec").isNumber())
                .andExpect(jsonPath("$.last_update").isString());
    }

    @Test
    void analysisIsJoinedOntoPriceRow() throws Exception {
        mockMvc.perform(post("/update-market-state")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"market_data":[{"symbol":"MSC_GBPUSD","price":1.27}]}
                                """))
                .andExpect(status().isOk());

        mockMvc.perform(post("/market-analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"market_data":[{"symbol":"MSC_GBPUSD","bias":"bullish","green_count":5,
                                  "confidence":72.5,"insight":"Momentum building",
                                  "market_regime":{"trend":"Up","volatility":"High","structure":"Trending"},
                                  "current_session":"London"},
                                  {"symbol":"MSC_UNTRACKED","bias":"BEARISH"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.message").value("Dashboard features cached"))
                .andExpect(jsonPath("$.symbols_cached").value(2));

        mockMvc.perform(get("/get-market-state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_GBPUSD')].bias").value("BULLISH"))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_GBPUSD')].green_count").value(5))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_GBPUSD')].insight").value("Momentum building"))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_GBPUSD')].market_regime.trend").value("Up"))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_GBPUSD')].current_session").value("London"))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_UNTRACKED')]").isEmpty());
    }

    @Test
    void analysisSectionsKeepKeysBeyondTheTypedOnes() throws Exception {
        mockMvc.perform(post("/update-market-state")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"market_data":[{"symbol":"MSC_AUDUSD","price":0.66}]}
                                """))
                .andExpect(status().isOk());

        mockMvc.perform(post("/market-analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"market_data":[{"symbol":"MSC_AUDUSD",
                                  "market_regime":{"trend":"Up","volatility":"High","structure":"Trending","adx":31.5},
                                  "state_statistics":{"continuation":61,"reversal":22,"consolidation":17,
                                    "best_session":"London","sample_size":118},
                                  "session_intelligence":{"volatility":"High","best_setup":"Breakout","avg_range_pips":42},
                                  "bias_stability":{"active_since_minutes":35,"last_flip_minutes_ago":90,"flips_today":2},
                                  "confluence":{"total":72.5,"consensus":"3/4","weights_version":"v2"},
                                  "confluence_breakdown":{"ema_trend":{"active":1,"weight":40,"name":"EMA Trend","detail":"20>50"}}}]}
                                """))
                .andExpect(status().isOk());

        mockMvc.perform(get("/get-market-state"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_AUDUSD')].market_regime.trend").value("Up"))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_AUDUSD')].market_regime.adx").value(31.5))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_AUDUSD')].state_statistics.best_session").value("London"))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_AUDUSD')].state_statistics.sample_size").value(118))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_AUDUSD')].session_intelligence.avg_range_pips").value(42))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_AUDUSD')].bias_stability.flips_today").value(2))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_AUDUSD')].confluence.weights_version").value("v2"))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_AUDUSD')].confluence_breakdown.ema_trend.detail").value("20>50"));
    }

    @Test
    void priceFeedIndicatorsShowUntilAnalysisArrives() throws Exception {
        mockMvc.perform(post("/update-market-state")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"market_data":[{"symbol":"MSC_NZDUSD","indicators":{"rsi":["🔴",28.4,"RSI"]}}]}
                                """))
                .andExpect(status().isOk());

        mockMvc.perform(get("/get-market-state"))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_NZDUSD')].indicators.rsi[0]").value("🔴"));

        mockMvc.perform(post("/market-analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"market_data":[{"symbol":"MSC_NZDUSD","indicators":{"macd":["🟢",0.4,"MACD"]}}]}
                                """))
                .andExpect(status().isOk());

        mockMvc.perform(get("/get-market-state"))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_NZDUSD')].indicators.macd[0]").value("🟢"))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_NZDUSD')].indicators.rsi").doesNotExist());
    }

    @Test
    void legacyEndpointMergesInsteadOfReplacing() throws Exception {
        mockMvc.perform(post("/update-market-state")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"market_data":[{"symbol":"MSC_XAUUSD","price":2300.5}]}
                                """))
                .andExpect(status().isOk());

        mockMvc.perform(post("/data-update")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"market_data":[{"symbol":"MSC_USDJPY","price":151.2}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.message").value("Data received (legacy)"));

        mockMvc.perform(get("/get-market-state"))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_XAUUSD')].price").value(2300.5))
                .andExpect(jsonPath("$.market_data[?(@.symbol=='MSC_USDJPY')].price").value(151.2));
    }

    @Test
    void missingMarketDataIsRejected() throws Exception {
        mockMvc.perform(post("/update-market-state")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid market_data format"))
                .andExpect(jsonPath("$.request_id").exists());

        mockMvc.perform(post("/market-analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"market_data\":\"not-a-list\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void unknownEndpointIsNotFound() throws Exception {
        mockMvc.perform(get("/no-such-endpoint"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Endpoint not found"));
    }
}
