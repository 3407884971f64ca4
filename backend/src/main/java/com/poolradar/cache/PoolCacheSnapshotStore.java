package com.poolradar.cache;

import java.io.IOException;
import java.util.Optional;

/**
 * Key-value blob store holding the cache snapshot between process restarts.
 */
public interface PoolCacheSnapshotStore {

    /**
     * @return the last saved snapshot, or empty when none exists yet
     */
    Optional<PoolCacheSnapshot> load() throws IOException;

    void save(PoolCacheSnapshot snapshot) throws IOException;

    /** Store used when persistence is disabled: never returns data, discards saves. */
    PoolCacheSnapshotStore NONE = new PoolCacheSnapshotStore() {
        @Override
        public Optional<PoolCacheSnapshot> load() {
            return Optional.empty();
        }

        @Override
        public void save(PoolCacheSnapshot snapshot) {
            // persistence disabled
        }
    };
}
