package com.jreinhal.haven.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Sign-in throttling. Counts failures per email and client IP, and per email alone,
 * and locks the key out once a threshold is hit inside the window.
 */
@Service
public class LoginAttemptService {
    @Value("${app.auth.lockout.enabled:true}")
    private boolean enabled;
    @Value("${app.auth.lockout.max-attempts:5}")
    private int maxAttempts;
    @Value("${app.auth.lockout.window-minutes:15}")
    private int windowMinutes;
    @Value("${app.auth.lockout.duration-minutes:15}")
    private int lockoutMinutes;
    @Value("${app.auth.lockout.global-max-attempts:20}")
    private int globalMaxAttempts;

    private Cache<String, AttemptRecord> attempts;
    private Cache<String, Instant> lockouts;
    private Cache<String, AttemptRecord> emailAttempts;
    private Cache<String, Instant> emailLockouts;

    @PostConstruct
    public void init() {
        this.attempts = Caffeine.newBuilder().expireAfterWrite(Duration.ofMinutes(this.windowMinutes)).build();
        this.lockouts = Caffeine.newBuilder().expireAfterWrite(Duration.ofMinutes(this.lockoutMinutes)).build();
        this.emailAttempts = Caffeine.newBuilder().expireAfterWrite(Duration.ofMinutes(this.windowMinutes)).build();
        this.emailLockouts = Caffeine.newBuilder().expireAfterWrite(Duration.ofMinutes(this.lockoutMinutes)).build();
    }

    public boolean isLockedOut(String key) {
        if (!this.enabled) {
            return false;
        }
        return this.lockouts.getIfPresent(key) != null || this.emailLockouts.getIfPresent(emailOf(key)) != null;
    }

    public void recordFailure(String key) {
        if (!this.enabled) {
            return;
        }
        if (increment(this.attempts, key) >= this.maxAttempts) {
            this.lockouts.put(key, Instant.now());
            this.attempts.invalidate(key);
        }
        String email = emailOf(key);
        if (increment(this.emailAttempts, email) >= this.globalMaxAttempts) {
            this.emailLockouts.put(email, Instant.now());
            this.emailAttempts.invalidate(email);
        }
    }

    public void recordSuccess(String key) {
        if (!this.enabled) {
            return;
        }
        this.attempts.invalidate(key);
        this.lockouts.invalidate(key);
        String email = emailOf(key);
        this.emailAttempts.invalidate(email);
        this.emailLockouts.invalidate(email);
    }

    public String buildKey(String email, String clientIp) {
        String safeEmail = email == null ? "unknown" : email.trim().toLowerCase(Locale.ROOT);
        String safeIp = clientIp == null ? "unknown" : clientIp.trim();
        return safeEmail + "|" + safeIp;
    }

    private static int increment(Cache<String, AttemptRecord> cache, String key) {
        AttemptRecord current = cache.get(key, k -> new AttemptRecord(0, Instant.now()));
        int next = current.count() + 1;
        cache.put(key, new AttemptRecord(next, current.firstAttempt()));
        return next;
    }

    private static String emailOf(String compositeKey) {
        int pipe = compositeKey.indexOf('|');
        return pipe >= 0 ? compositeKey.substring(0, pipe) : compositeKey;
    }

    private record AttemptRecord(int count, Instant firstAttempt) {
    }
}
