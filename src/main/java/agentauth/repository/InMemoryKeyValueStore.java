package agentauth.repository;

import agentauth.model.Expirable;

import java.util.Date;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryKeyValueStore<T extends Expirable> implements KeyValueStore<T> {

    private final Map<String, T> entries = new ConcurrentHashMap<>();
    private final Class<T> entityType;

    public InMemoryKeyValueStore(Class<T> entityType) {
        this.entityType = entityType;
    }

    @Override
    public Class<T> getEntityType() {
        return entityType;
    }

    @Override
    public void put(T value) {
        entries.put(value.getId(), value);
    }

    @Override
    public Optional<T> find(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(entries.get(key));
    }

    @Override
    public Optional<T> getAndDelete(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(entries.remove(key));
    }

    @Override
    public boolean delete(String key) {
        return key != null && entries.remove(key) != null;
    }

    @Override
    public long deleteByExpiresInBefore(Date date) {
        long count = 0;
        for (Map.Entry<String, T> entry : entries.entrySet()) {
            Date expiresIn = entry.getValue().getExpiresIn();
            if (expiresIn != null && expiresIn.before(date) && entries.remove(entry.getKey(), entry.getValue())) {
                count++;
            }
        }
        return count;
    }

    @Override
    public void deleteAll() {
        entries.clear();
    }

    @Override
    public long count() {
        return entries.size();
    }
}
