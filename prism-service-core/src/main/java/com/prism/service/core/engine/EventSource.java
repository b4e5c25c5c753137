package com.prism.service.core.engine;

/**
 * Where the engine gets its answers from. An implementation either hands back candidate events for the engine
 * to filter and bucket ({@link CandidateEventSource}) or executes the whole plan itself
 * ({@link PushdownEventSource}).
 */
public interface EventSource {

    /** Short label used in logs. */
    String name();
}
