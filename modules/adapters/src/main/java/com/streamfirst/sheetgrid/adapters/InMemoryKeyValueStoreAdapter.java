package com.streamfirst.sheetgrid.adapters;

import com.streamfirst.sheetgrid.ports.KeyValueStorePort;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of KeyValueStorePort for testing and development. Values are copied on
 * the way in and out. Data is lost when the application stops.
 */
@Slf4j
public class InMemoryKeyValueStoreAdapter implements KeyValueStorePort {

    private final Map<String, byte[]> entries = new ConcurrentHashMap<>();

    @Override
    public Optional<byte[]> get(String key) {
        byte[] value = entries.get(key);
        log.debug("Read key {}: {}", key, value == null ? "absent" : value.length + " bytes");
        return Optional.ofNullable(value).map(bytes -> Arrays.copyOf(bytes, bytes.length));
    }

    @Override
    public void put(String key, byte[] value) {
        entries.put(key, Arrays.copyOf(value, value.length));
        log.debug("Wrote key {} ({} bytes)", key, value.length);
    }

    @Override
    public boolean delete(String key) {
        return entries.remove(key) != null;
    }

    public int size() {
        return entries.size();
    }
}
