package com.streamfirst.sheetgrid.ports;

import java.util.Optional;

/**
 * Port for a small durable key/value store. Used to keep values across restarts so they can serve
 * as a fallback when the remote store is unreachable. Backends may be local files, an embedded KV
 * store or browser storage.
 */
public interface KeyValueStorePort {

    /**
     * Reads a value.
     *
     * @param key the entry key
     * @return the stored bytes, or empty if nothing is stored under the key
     * @throws java.io.UncheckedIOException if the backend cannot be read
     */
    Optional<byte[]> get(String key);

    /**
     * Stores a value, replacing any previous value under the key.
     *
     * @param key the entry key
     * @param value the bytes to store
     * @throws java.io.UncheckedIOException if the backend cannot be written
     */
    void put(String key, byte[] value);

    /**
     * Removes a value.
     *
     * @param key the entry key
     * @return true if an entry existed and was removed
     */
    boolean delete(String key);
}
