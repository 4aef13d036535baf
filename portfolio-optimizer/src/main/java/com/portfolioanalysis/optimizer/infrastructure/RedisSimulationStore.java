package com.portfolioanalysis.optimizer.infrastructure;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.portfolioanalysis.optimizer.domain.SimulationSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed session store. Sessions are written as JSON under
 * {@code simulation:<id>} and expire after the configured TTL.
 */
@Service
@ConditionalOnProperty(name = "portfolio.simulation.store", havingValue = "redis")
@Slf4j
public class RedisSimulationStore implements SimulationStore {

    private static final String KEY_PREFIX = "simulation:";

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;
    private final long ttlMinutes;

    public RedisSimulationStore(@Qualifier("simulationRedisTemplate") RedisTemplate<String, String> redisTemplate,
                                ObjectMapper objectMapper,
                                @Value("${portfolio.simulation.ttl-minutes:60}") long ttlMinutes) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttlMinutes = ttlMinutes;
    }

    @Override
    public void save(SimulationSession session) {
        if (session == null || session.getId() == null) {
            log.error("Cannot store a simulation without an ID");
            throw new IllegalArgumentException("Session and session ID cannot be null");
        }

        try {
            String json = objectMapper.writeValueAsString(session);
            redisTemplate.opsForValue().set(KEY_PREFIX + session.getId(), json, ttlMinutes, TimeUnit.MINUTES);
            log.debug("Stored simulation {} in Redis ({} bytes)", session.getId(), json.length());
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize simulation {}: {}", session.getId(), e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize simulation session", e);
        } catch (DataAccessException e) {
            log.error("Redis error while storing simulation {}: {}", session.getId(), e.getMessage(), e);
            throw new IllegalStateException("Failed to store simulation session due to Redis error", e);
        }
    }

    @Override
    public Optional<SimulationSession> findById(String simulationId) {
        try {
            String json = redisTemplate.opsForValue().get(KEY_PREFIX + simulationId);
            if (json == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(json, SimulationSession.class));
        } catch (JsonProcessingException e) {
            log.error("Corrupt simulation {} in Redis: {}", simulationId, e.getMessage(), e);
            throw new IllegalStateException("Failed to deserialize simulation session", e);
        } catch (DataAccessException e) {
            log.error("Redis error while loading simulation {}: {}", simulationId, e.getMessage(), e);
            throw new IllegalStateException("Failed to load simulation session due to Redis error", e);
        }
    }
}
