package io.github.drompincen.vibehub.runtime.permission;

import io.github.drompincen.vibehub.persistence.store.GlobalSettings;
import io.github.drompincen.vibehub.persistence.store.SessionStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The process-wide allow-list shared by every session. Readers get an immutable snapshot;
 * writers copy, modify and publish under a single lock and persist immediately.
 */
@Component
public class GlobalAllowlist {

    private static final Logger log = LoggerFactory.getLogger(GlobalAllowlist.class);

    private final SessionStore sessionStore;
    private final Object writeLock = new Object();
    private volatile Set<String> patterns = Set.of();

    public GlobalAllowlist(SessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @PostConstruct
    public void load() {
        try {
            List<String> stored = sessionStore.getGlobalSettings().allowedTools();
            patterns = Collections.unmodifiableSet(new LinkedHashSet<>(stored));
            log.info("Loaded {} global allowed tool patterns", patterns.size());
        } catch (RuntimeException e) {
            log.error("Failed to load global allowed tools", e);
        }
    }

    public Set<String> snapshot() {
        return patterns;
    }

    public List<String> list() {
        return List.copyOf(patterns);
    }

    /**
     * @return false when the pattern was already present
     */
    public boolean add(String pattern) {
        synchronized (writeLock) {
            if (patterns.contains(pattern)) {
                return false;
            }
            Set<String> next = new LinkedHashSet<>(patterns);
            next.add(pattern);
            publish(next);
        }
        log.info("Added {} to global allowlist", pattern);
        return true;
    }

    public void replace(Collection<String> newPatterns) {
        synchronized (writeLock) {
            publish(new LinkedHashSet<>(newPatterns));
        }
        log.info("Global allowlist replaced ({} patterns)", newPatterns.size());
    }

    private void publish(Set<String> next) {
        patterns = Collections.unmodifiableSet(next);
        try {
            sessionStore.setGlobalSettings(new GlobalSettings(List.copyOf(next)));
        } catch (RuntimeException e) {
            log.error("Failed to persist global allowed tools", e);
        }
    }
}
