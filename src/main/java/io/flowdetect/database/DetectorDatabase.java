package io.flowdetect.database;

import io.flowdetect.compile.Detector;
import io.flowdetect.exceptions.FrozenDatabaseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Detectors already computed for a situation, keyed by situation content.
 * <p>
 * Safe for concurrent use. A frozen database rejects every mutation, so a run against a
 * frozen database only ever uses reviewed entries.
 */
public final class DetectorDatabase {

    private static final Logger LOGGER = LoggerFactory.getLogger(DetectorDatabase.class);

    private final ConcurrentMap<DetectorDatabaseKey, Set<Detector>> detectors = new ConcurrentHashMap<>();
    private final ConcurrentMap<DetectorDatabaseKey, Object> locks = new ConcurrentHashMap<>();
    private volatile boolean frozen;

    public Optional<Set<Detector>> get(DetectorDatabaseKey key) {
        return Optional.ofNullable(detectors.get(key));
    }

    /**
     * Stores the detectors of a situation, replacing any previous entry.
     *
     * @throws FrozenDatabaseException if the database is frozen
     */
    public void add(DetectorDatabaseKey key, Collection<Detector> situationDetectors) {
        if (frozen) {
            throw new FrozenDatabaseException("Cannot add a situation to a frozen database.");
        }
        detectors.put(key, Collections.unmodifiableSet(new LinkedHashSet<>(situationDetectors)));
    }

    /**
     * @throws FrozenDatabaseException if the database is frozen
     */
    public void remove(DetectorDatabaseKey key) {
        if (frozen) {
            throw new FrozenDatabaseException("Cannot remove a situation from a frozen database.");
        }
        detectors.remove(key);
    }

    /**
     * Returns the stored detectors of {@code key}, computing and storing them on a miss.
     * Concurrent callers asking for the same key compute it once.
     *
     * @throws FrozenDatabaseException if the key is missing and the database is frozen
     */
    public Set<Detector> getOrCompute(DetectorDatabaseKey key, Supplier<? extends Collection<Detector>> computation) {
        Set<Detector> cached = detectors.get(key);
        if (cached != null) {
            LOGGER.debug("Database hit for {}", key);
            return cached;
        }
        synchronized (locks.computeIfAbsent(key, k -> new Object())) {
            cached = detectors.get(key);
            if (cached != null) {
                return cached;
            }
            if (frozen) {
                throw new FrozenDatabaseException("Cannot add a situation to a frozen database.");
            }
            LOGGER.debug("Database miss for {}, computing", key);
            add(key, computation.get());
            return detectors.get(key);
        }
    }

    public void freeze() {
        frozen = true;
    }

    public void unfreeze() {
        frozen = false;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public int size() {
        return detectors.size();
    }

    /**
     * Snapshot of every entry.
     */
    public Map<DetectorDatabaseKey, Set<Detector>> entries() {
        return Map.copyOf(detectors);
    }
}
