package com.portfolioanalysis.optimizer.infrastructure;

import com.portfolioanalysis.optimizer.domain.SimulationSession;

import java.util.Optional;

/**
 * Storage for simulation sessions, keyed by simulation id.
 */
public interface SimulationStore {

    /**
     * Save or replace a session.
     *
     * @param session the session to save
     */
    void save(SimulationSession session);

    /**
     * Find a session by id.
     *
     * @return the session, or empty if it is unknown or expired
     */
    Optional<SimulationSession> findById(String simulationId);
}
