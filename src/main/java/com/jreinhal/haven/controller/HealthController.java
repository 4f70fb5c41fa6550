package com.jreinhal.haven.controller;

import com.jreinhal.haven.anonymizer.VoiceAnonymizerClient;
import com.jreinhal.haven.security.PublicEndpoint;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value = {"/api/health"})
@Tag(name = "Health")
public class HealthController {

    private final VoiceAnonymizerClient voiceAnonymizer;

    public HealthController(VoiceAnonymizerClient voiceAnonymizer) {
        this.voiceAnonymizer = voiceAnonymizer;
    }

    @PublicEndpoint
    @GetMapping
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "UP");
        body.put("voiceAnonymizer", !voiceAnonymizer.isEnabled() ? "DISABLED" : voiceAnonymizer.isHealthy() ? "UP" : "DOWN");
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
