package io.pingjob.internal.mongo;

import io.pingjob.JobStore;
import io.pingjob.core.BackingStoreException;
import io.pingjob.core.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * MongoDB persistence layer for encrypted job records and key sets.
 *
 * <p>Collections:
 * <ul>
 *   <li>{@code job_records}: {@code { _id: key, value: ciphertext }}</li>
 *   <li>{@code job_sets}: {@code { _id: setName, members: [key, ...] }}, maintained with
 *       {@code $addToSet} / {@code $pullAll} so concurrent updates do not overwrite each other</li>
 * </ul>
 *
 * <p>Every driver failure surfaces as {@link BackingStoreException}.
 */
public class MongoJobStore implements JobStore {
    private static final Logger log = LoggerFactory.getLogger(MongoJobStore.class);

    private final MongoTemplate mongoTemplate;

    public MongoJobStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Insert or overwrite the value stored under {@code key}.
     */
    @Override
    public void insert(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        run("error inserting data", key, () -> mongoTemplate.save(new JobRecordDocument(key, value)));
    }

    @Override
    public String get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        JobRecordDocument doc = run("error retrieving data", key,
                () -> mongoTemplate.findById(key, JobRecordDocument.class));
        if (doc == null || doc.getValue() == null) {
            throw new JobNotFoundException(key);
        }
        return doc.getValue();
    }

    @Override
    public void delete(String key) {
        Objects.requireNonNull(key, "key must not be null");
        run("error deleting data", key,
                () -> mongoTemplate.remove(byId(key), JobRecordDocument.class));
    }

    @Override
    public Set<String> getSet(String setName) {
        Objects.requireNonNull(setName, "setName must not be null");
        JobSetDocument doc = run("error retrieving set", setName,
                () -> mongoTemplate.findById(setName, JobSetDocument.class));
        if (doc == null || doc.getMembers() == null) {
            return Set.of();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(doc.getMembers()));
    }

    @Override
    public void addToSet(String setName, String... keys) {
        Objects.requireNonNull(setName, "setName must not be null");
        if (keys == null || keys.length == 0) {
            return;
        }
        Update u = new Update().addToSet("members").each((Object[]) keys);
        run("error updating set", setName,
                () -> mongoTemplate.upsert(byId(setName), u, JobSetDocument.class));
    }

    @Override
    public void removeFromSet(String setName, String... keys) {
        Objects.requireNonNull(setName, "setName must not be null");
        if (keys == null || keys.length == 0) {
            return;
        }
        Update u = new Update().pullAll("members", keys);
        run("error removing from set", setName,
                () -> mongoTemplate.updateFirst(byId(setName), u, JobSetDocument.class));
    }

    @Override
    public void deleteSet(String setName) {
        Objects.requireNonNull(setName, "setName must not be null");
        run("error deleting set", setName,
                () -> mongoTemplate.remove(byId(setName), JobSetDocument.class));
    }

    private static Query byId(String id) {
        return new Query(Criteria.where("_id").is(id));
    }

    private <T> T run(String message, String key, Supplier<T> op) {
        try {
            return op.get();
        } catch (DataAccessException e) {
            log.error("{} key={} msg={}", message, key, e.getMessage());
            throw new BackingStoreException(message + " key=" + key, e);
        }
    }
}
