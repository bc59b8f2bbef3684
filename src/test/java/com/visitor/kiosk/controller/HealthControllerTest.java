package com.visitor.kiosk.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void healthCheck() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Healthy"));
    }

    @Test
    void websocketUsageNoteSaysHttpIsUsed() throws Exception {
        mockMvc.perform(get("/api/docs/websocket-usage"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.websocket_url").value("/ws/{purpose}"))
                .andExpect(jsonPath("$.note").value(
                        "This backend delivers real-time validation/query via HTTP endpoints, not by WebSocket."));
    }
}
