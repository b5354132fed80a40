package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.dto.CrimeEvent;

import java.util.List;

/**
 * Durable events, unique by link.
 */
public interface EventStore {

    /**
     * Store the event unless its link is already present. Writing an existing
     * link, including a concurrent racing write, is a no-op.
     *
     * @return true if a new event was written
     */
    boolean insertIfNew(CrimeEvent event);

    List<CrimeEvent> findAll();

    long count();
}
