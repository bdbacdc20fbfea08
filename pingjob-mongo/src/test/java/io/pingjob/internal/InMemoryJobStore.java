package io.pingjob.internal;

import io.pingjob.JobStore;
import io.pingjob.core.BackingStoreException;
import io.pingjob.core.JobNotFoundException;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed store with switchable failures.
 */
class InMemoryJobStore implements JobStore {

    final Map<String, String> records = new ConcurrentHashMap<>();
    final Map<String, Set<String>> sets = new ConcurrentHashMap<>();

    volatile boolean failInsert;
    volatile boolean failGet;
    volatile boolean failDelete;
    volatile boolean failGetSet;
    volatile boolean failAddToSet;
    volatile boolean failRemoveFromSet;

    @Override
    public void insert(String key, String value) {
        if (failInsert) {
            throw new BackingStoreException("insert failed", key, null);
        }
        records.put(key, value);
    }

    @Override
    public String get(String key) {
        if (failGet) {
            throw new BackingStoreException("get failed", key, null);
        }
        String value = records.get(key);
        if (value == null) {
            throw new JobNotFoundException(key);
        }
        return value;
    }

    @Override
    public void delete(String key) {
        if (failDelete) {
            throw new BackingStoreException("delete failed", key, null);
        }
        records.remove(key);
    }

    @Override
    public Set<String> getSet(String setName) {
        if (failGetSet) {
            throw new BackingStoreException("get set failed", setName, null);
        }
        Set<String> members = sets.get(setName);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    @Override
    public void addToSet(String setName, String... keys) {
        if (failAddToSet) {
            throw new BackingStoreException("add to set failed", setName, null);
        }
        sets.computeIfAbsent(setName, k -> ConcurrentHashMap.newKeySet()).addAll(Arrays.asList(keys));
    }

    @Override
    public void removeFromSet(String setName, String... keys) {
        if (failRemoveFromSet) {
            throw new BackingStoreException("remove from set failed", setName, null);
        }
        Set<String> members = sets.get(setName);
        if (members != null) {
            Arrays.asList(keys).forEach(members::remove);
        }
    }

    @Override
    public void deleteSet(String setName) {
        sets.remove(setName);
    }
}
