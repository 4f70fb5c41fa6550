package com.jreinhal.haven.anonymizer;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.net.HttpURLConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the voice anonymizer sidecar.
 *
 * Unlike optional sidecars, failures here are never degraded: a caller that asks for
 * anonymization gets anonymized bytes or a {@link VoiceAnonymizationException}.
 *
 * Configuration:
 *   app.anonymizer.enabled: true/false
 *   app.anonymizer.service-url: http://localhost:5002
 *   app.anonymizer.timeout-seconds: 30
 */
@Component
public class VoiceAnonymizerClient {
    private static final Logger log = LoggerFactory.getLogger(VoiceAnonymizerClient.class);
    public static final String OUTPUT_FILENAME = "anonymized_voice.wav";
    public static final String OUTPUT_CONTENT_TYPE = "audio/wav";
    static final int MAX_RESPONSE_BYTES = 20 * 1024 * 1024;
    private static final int HEALTH_TIMEOUT_SECONDS = 3;

    private RestTemplate restTemplate;
    private RestTemplate healthTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Value("${app.anonymizer.enabled:true}")
    private boolean enabled;

    @Value("${app.anonymizer.service-url:http://localhost:5002}")
    private String serviceUrl;

    @Value("${app.anonymizer.timeout-seconds:30}")
    private int timeoutSeconds;

    @PostConstruct
    void init() {
        this.restTemplate = createNoRedirectRestTemplate(timeoutSeconds);
        this.healthTemplate = createNoRedirectRestTemplate(HEALTH_TIMEOUT_SECONDS);
        if (!enabled) {
            log.warn("=================================================================");
            log.warn("  Voice anonymizer DISABLED. Anonymous reports with audio");
            log.warn("  attachments will be refused until it is enabled.");
            log.warn("=================================================================");
        }
        log.info("Voice anonymizer client initialised (enabled={}, url={}, timeout={}s)", enabled, serviceUrl, timeoutSeconds);
    }

    private static RestTemplate createNoRedirectRestTemplate(int timeoutSecs) {
        int timeoutMs = timeoutSecs * 1000;
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory() {
            @Override
            protected void prepareConnection(HttpURLConnection connection, String httpMethod) throws IOException {
                super.prepareConnection(connection, httpMethod);
                connection.setInstanceFollowRedirects(false);
            }
        };
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Liveness of the sidecar. Never throws.
     */
    public boolean isHealthy() {
        if (!enabled) {
            return false;
        }
        try {
            ResponseEntity<String> response = healthTemplate.getForEntity(serviceUrl + "/health", String.class);
            if (response.getStatusCode().is2xxSuccessful() && response.getBody() != null) {
                HealthResponse health = objectMapper.readValue(response.getBody(), HealthResponse.class);
                return "ok".equalsIgnoreCase(health.status);
            }
            return false;
        } catch (Exception e) {
            log.debug("Voice anonymizer not available: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Send raw audio to the sidecar and return the anonymized WAV bytes.
     *
     * @throws VoiceAnonymizationException when disabled, unreachable, timed out or answering with no audio
     */
    public byte[] anonymize(byte[] audio, String filename, String contentType) {
        if (!enabled) {
            throw new VoiceAnonymizationException("Voice anonymizer is disabled");
        }
        if (audio == null || audio.length == 0) {
            throw new VoiceAnonymizationException("No audio to anonymize");
        }
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        HttpHeaders partHeaders = new HttpHeaders();
        partHeaders.setContentType(contentType != null ? MediaType.parseMediaType(contentType) : MediaType.APPLICATION_OCTET_STREAM);
        body.add("audio", new HttpEntity<>(new NamedByteArrayResource(audio, filename != null ? filename : "audio"), partHeaders));
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        try {
            ResponseEntity<byte[]> response = restTemplate.postForEntity(serviceUrl + "/anonymize", new HttpEntity<>(body, headers), byte[].class);
            if (response.getStatusCode().is3xxRedirection()) {
                throw new VoiceAnonymizationException("Voice anonymizer returned a redirect");
            }
            byte[] anonymized = response.getBody();
            if (!response.getStatusCode().is2xxSuccessful() || anonymized == null || anonymized.length == 0) {
                throw new VoiceAnonymizationException("Voice anonymizer returned no audio (status " + response.getStatusCode().value() + ")");
            }
            if (anonymized.length > MAX_RESPONSE_BYTES) {
                throw new VoiceAnonymizationException("Voice anonymizer response exceeds " + MAX_RESPONSE_BYTES + " bytes");
            }
            log.info("Voice anonymized: {} -> {} bytes", audio.length, anonymized.length);
            return anonymized;
        } catch (RestClientException e) {
            log.error("Voice anonymization request failed: {}", e.getMessage());
            throw new VoiceAnonymizationException("Voice anonymizer unreachable", e);
        }
    }

    private static final class NamedByteArrayResource extends ByteArrayResource {
        private final String filename;

        private NamedByteArrayResource(byte[] byteArray, String filename) {
            super(byteArray);
            this.filename = filename;
        }

        @Override
        public String getFilename() {
            return this.filename;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static class HealthResponse {
        @JsonProperty("status")
        public String status;
    }
}
