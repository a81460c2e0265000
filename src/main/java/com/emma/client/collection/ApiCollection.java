package com.emma.client.collection;

import com.emma.client.api.Account;
import com.emma.client.core.model.ApiModel;
import com.emma.client.core.wire.WireValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lazily loaded, memoized set of entities for one relation.
 *
 * <p>The first {@link #fetchAll()} issues a single GET against the relation's
 * path and caches every returned entity under its relation-specific key. Later
 * reads are served from the cache; it is never invalidated here. Callers that
 * need fresh data call {@link #refresh()} (or drop the collection) and read again.</p>
 *
 * <p>The cache is plain per-instance state without synchronization; a
 * collection must not be shared across threads without external locking.</p>
 *
 * @param <K> key type of the relation
 * @param <T> entity type
 */
public abstract class ApiCollection<K, T extends ApiModel> {
    private static final Logger log = LoggerFactory.getLogger(ApiCollection.class);

    protected final Account account;
    private final Map<K, T> items = new LinkedHashMap<>();
    private boolean loaded;

    protected ApiCollection(Account account) {
        this.account = Objects.requireNonNull(account, "account is required");
    }

    /**
     * Path of the relation, relative to the account. Implementations fail here
     * when a precondition for the request does not hold.
     */
    protected abstract String collectionPath();

    /**
     * Builds an entity from one raw record of the relation.
     */
    protected abstract T create(Map<String, Object> raw);

    /**
     * Key the entity is cached under.
     */
    protected abstract K keyOf(T item);

    /**
     * Returns every entity of the relation, loading them on first use. If any
     * record fails to hydrate, the cache is left as it was and stays unloaded.
     *
     * @return unmodifiable view of the cache
     */
    public Map<K, T> fetchAll() {
        String path = collectionPath();
        if (!loaded) {
            Object response = account.getAdapter().get(path, Map.of());
            Map<K, T> fetched = new LinkedHashMap<>();
            for (Object row : WireValues.asList(response)) {
                T item = create(WireValues.asMap(row));
                fetched.put(keyOf(item), item);
            }
            items.putAll(fetched);
            loaded = true;
            log.debug("collection.loaded path={} size={}", path, items.size());
        }
        return Collections.unmodifiableMap(items);
    }

    /**
     * Reads a single entity, serving it from the cache when present.
     *
     * @param key  cache key of the entity
     * @param path path of the entity, relative to the account
     * @return the entity, or empty if the API does not know it
     */
    protected Optional<T> fetchOne(K key, String path) {
        T cachedItem = items.get(key);
        if (cachedItem != null) {
            return Optional.of(cachedItem);
        }
        Object response = account.getAdapter().get(path, Map.of());
        if (response == null) {
            log.debug("collection.miss path={}", path);
            return Optional.empty();
        }
        T item = create(WireValues.asMap(response));
        items.put(keyOf(item), item);
        return Optional.of(item);
    }

    /**
     * Puts an entity into the cache without any request.
     */
    protected void stage(T item) {
        items.put(keyOf(item), item);
    }

    /**
     * Entities currently cached, without triggering a load.
     */
    public Map<K, T> cached() {
        return Collections.unmodifiableMap(items);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public boolean isLoaded() {
        return loaded;
    }

    /**
     * Drops the cache so the next {@link #fetchAll()} asks the API again.
     */
    public void refresh() {
        items.clear();
        loaded = false;
    }

    public Account getAccount() {
        return account;
    }
}
