package com.example.truingup.engine;

import com.example.truingup.engine.exception.RuleSetNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Every registered constants version, plus which one is active.
 *
 * <p>{@link #active()} hands out an immutable instance; callers pass that instance into the engine
 * and keep it for the whole computation. Activating another version later only changes what the
 * next caller receives.
 */
@Slf4j
public class RuleSetRegistry {

    private final Map<String, RegulatoryConstants> versions = new ConcurrentHashMap<>();
    private volatile RegulatoryConstants active;

    public RuleSetRegistry(List<RegulatoryConstants> ruleSets, String activeVersion) {
        ruleSets.forEach(this::register);
        activate(activeVersion);
    }

    public void register(RegulatoryConstants constants) {
        RegulatoryConstants previous = versions.putIfAbsent(constants.getVersion(), constants);
        if (previous != null) {
            throw new IllegalStateException("Rule set " + constants.getVersion() + " is already registered");
        }
        log.info("rule set registered: {} (order {})", constants.getVersion(), constants.getOrderDate());
    }

    public RegulatoryConstants get(String version) {
        RegulatoryConstants constants = versions.get(version);
        if (constants == null) {
            throw new RuleSetNotFoundException(version, versions());
        }
        return constants;
    }

    public RegulatoryConstants active() {
        return active;
    }

    public synchronized void activate(String version) {
        RegulatoryConstants next = get(version);
        RegulatoryConstants previous = this.active;
        this.active = next;
        log.info("active rule set: {} -> {}", previous == null ? "none" : previous.getVersion(), next.getVersion());
    }

    /** {@code version} when given, the active set otherwise. */
    public RegulatoryConstants resolve(String version) {
        return (version == null || version.isBlank()) ? active() : get(version);
    }

    public List<String> versions() {
        return versions.keySet().stream().sorted().toList();
    }
}
