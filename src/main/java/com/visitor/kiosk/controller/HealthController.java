package com.visitor.kiosk.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@Tag(name = "admin")
public class HealthController {

    @Operation(summary = "Health check")
    @GetMapping("/")
    public Map<String, String> health() {
        return Map.of("message", "Healthy");
    }

    /**
     * Real-time features go over plain HTTP; this only documents that for frontend devs.
     */
    @GetMapping("/api/docs/websocket-usage")
    public Map<String, String> websocketUsage() {
        return Map.of(
                "websocket_url", "/ws/{purpose}",
                "note", "This backend delivers real-time validation/query via HTTP endpoints, not by WebSocket.");
    }
}
