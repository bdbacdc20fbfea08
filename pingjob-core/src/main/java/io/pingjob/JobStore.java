package io.pingjob;

import java.util.Set;

/**
 * Durable key/value and keyed-set storage for job records.
 *
 * <p>Implementations throw {@link io.pingjob.core.BackingStoreException} when the store fails.
 */
public interface JobStore {

    void insert(String key, String value);

    /**
     * @throws io.pingjob.core.JobNotFoundException when no value is stored under {@code key}
     */
    String get(String key);

    void delete(String key);

    /**
     * Members of the set, empty when the set does not exist.
     */
    Set<String> getSet(String setName);

    void addToSet(String setName, String... keys);

    void removeFromSet(String setName, String... keys);

    void deleteSet(String setName);
}
