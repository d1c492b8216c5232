package com.tickwork.scheduler.kv;

import java.util.Optional;

/**
 * Read-only view of runtime settings. Secret storage and persistence live
 * behind this interface.
 */
public interface KeyValueStore {

    Optional<String> get(String key);
}
