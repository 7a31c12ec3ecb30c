package agentauth.mongo;

import agentauth.model.Expirable;
import agentauth.repository.KeyValueStore;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Date;
import java.util.Optional;

/**
 * One collection per entity type. {@link #getAndDelete(String)} relies on the server side atomicity of
 * findAndRemove.
 */
public class MongoKeyValueStore<T extends Expirable> implements KeyValueStore<T> {

    private final MongoTemplate mongoTemplate;
    private final Class<T> entityType;

    public MongoKeyValueStore(MongoTemplate mongoTemplate, Class<T> entityType) {
        this.mongoTemplate = mongoTemplate;
        this.entityType = entityType;
    }

    @Override
    public Class<T> getEntityType() {
        return entityType;
    }

    @Override
    public void put(T value) {
        mongoTemplate.save(value);
    }

    @Override
    public Optional<T> find(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(mongoTemplate.findById(key, entityType));
    }

    @Override
    public Optional<T> getAndDelete(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(mongoTemplate.findAndRemove(byId(key), entityType));
    }

    @Override
    public boolean delete(String key) {
        return key != null && mongoTemplate.remove(byId(key), entityType).getDeletedCount() > 0;
    }

    @Override
    public long deleteByExpiresInBefore(Date date) {
        Query query = Query.query(Criteria.where("expiresIn").lt(date));
        return mongoTemplate.remove(query, entityType).getDeletedCount();
    }

    @Override
    public void deleteAll() {
        mongoTemplate.remove(new Query(), entityType);
    }

    @Override
    public long count() {
        return mongoTemplate.count(new Query(), entityType);
    }

    private Query byId(String key) {
        return Query.query(Criteria.where("_id").is(key));
    }
}
