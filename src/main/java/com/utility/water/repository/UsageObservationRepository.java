package com.utility.water.repository;

import com.utility.water.model.Observation;

import java.util.List;

/**
 * Persistent table of usage observations keyed by timestamp.
 */
public interface UsageObservationRepository {

    /**
     * All persisted rows in storage order. May contain repeated timestamps
     * (later rows are later writes) and missing usage values (NaN).
     * Returns an empty list when nothing has been persisted yet.
     */
    List<Observation> findAll();

    /**
     * Persists the full series so that a later {@link #findAll()} reproduces it.
     * Rows are keyed by timestamp; writing the same snapshot twice is a no-op.
     */
    void saveAll(List<Observation> snapshot);
}
