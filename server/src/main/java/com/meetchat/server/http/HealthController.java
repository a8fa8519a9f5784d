package com.meetchat.server.http;

import com.meetchat.server.store.ChatStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final ChatStore store;
    private final Clock clock;

    public HealthController(ChatStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    @GetMapping("/api/health")
    public ResponseEntity<Map<String, Object>> health() {
        boolean up = store.ping();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", up ? "healthy" : "unhealthy");
        body.put("timestamp", clock.instant().toString());
        body.put("checks", Map.of("database", up ? "connected" : "error"));
        return ResponseEntity.status(up ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
