package com.testflow.persistence;

import com.testflow.flow.Flow;

import java.util.List;
import java.util.Optional;

/**
 * Stores flows by id. Implementations decide the format; the core only sees
 * {@link Flow} objects going in and coming out.
 */
public interface FlowRepository {

    /** Saves the flow, replacing any earlier version with the same id. */
    void save(Flow flow);

    /** The flow with this id in READY state, or empty when none is stored. */
    Optional<Flow> load(String id);

    /** Ids of all stored flows, sorted. */
    List<String> list();

    /** @return true when a flow was removed */
    boolean delete(String id);
}
