package com.shadowdeploy.orchestrator.service;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the environments with a deployment in flight. Deployments to
 * different environments proceed in parallel; a second deployment to a busy
 * environment is rejected rather than queued.
 *
 * Holds are not reentrant: a thread that holds an environment cannot
 * acquire it again. Only environments currently held are kept.
 */
@Component
public class EnvironmentLockRegistry {

    private final Set<String> held = ConcurrentHashMap.newKeySet();

    /** @return true if the caller now holds the environment and must {@link #release} it */
    public boolean tryAcquire(String environment) {
        return held.add(environment);
    }

    /** Only called by a holder after a successful {@link #tryAcquire}. */
    public void release(String environment) {
        held.remove(environment);
    }

    public boolean isLocked(String environment) {
        return held.contains(environment);
    }

    int heldCount() {
        return held.size();
    }
}
