package com.portfolioanalysis.optimizer.infrastructure;

import com.portfolioanalysis.optimizer.domain.SimulationSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local session store. Sessions older than the configured TTL are evicted on access.
 */
@Service
@ConditionalOnProperty(name = "portfolio.simulation.store", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemorySimulationStore implements SimulationStore {

    private final Map<String, SimulationSession> sessions = new ConcurrentHashMap<>();
    private final Duration ttl;

    public InMemorySimulationStore(@Value("${portfolio.simulation.ttl-minutes:60}") long ttlMinutes) {
        this.ttl = Duration.ofMinutes(ttlMinutes);
    }

    @Override
    public void save(SimulationSession session) {
        if (session == null || session.getId() == null) {
            throw new IllegalArgumentException("Session and session ID cannot be null");
        }
        evictExpired();
        sessions.put(session.getId(), session);
        log.debug("Stored simulation {} in memory ({} sessions)", session.getId(), sessions.size());
    }

    @Override
    public Optional<SimulationSession> findById(String simulationId) {
        evictExpired();
        return Optional.ofNullable(sessions.get(simulationId));
    }

    private void evictExpired() {
        LocalDateTime cutoff = LocalDateTime.now().minus(ttl);
        sessions.values().removeIf(session -> session.getCreatedAt() != null
                && session.getCreatedAt().isBefore(cutoff));
    }
}
