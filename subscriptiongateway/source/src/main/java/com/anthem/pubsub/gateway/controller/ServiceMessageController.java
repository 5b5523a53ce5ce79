package com.anthem.pubsub.gateway.controller;

import com.anthem.pubsub.gateway.registry.SubscriptionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller through which backend services push messages to
 * subscribed sessions.
 */
@RestController
@RequestMapping("/api/v1/messages")
public class ServiceMessageController {

    private static final Logger log = LoggerFactory.getLogger(ServiceMessageController.class);

    private final SubscriptionRegistry registry;

    public ServiceMessageController(SubscriptionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Publish a message to a subscription.
     * POST /api/v1/messages
     * 
     * Body: {@code {"subscription": "service.topic", "data": ..., "_order": ..., "_order_key": ...}}
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> publish(@RequestBody Map<String, Object> message) {
        Object subscription = message.get("subscription");
        if (!(subscription instanceof String name) || name.isEmpty()) {
            log.warn("Rejected service message without subscription");
            return ResponseEntity.badRequest().body(Map.of(
                    "status", "error",
                    "message", "Missing subscription"
            ));
        }

        int sessions = registry.publish(name, message);
        log.info("Service message published: subscription={}, sessions={}", name, sessions);

        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "subscription", name,
                "sessions", sessions
        ));
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }
}
