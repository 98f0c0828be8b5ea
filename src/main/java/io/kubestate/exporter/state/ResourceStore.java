package io.kubestate.exporter.state;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.kubestate.exporter.model.StoreStatus;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Stores the latest known object of one resource kind, keyed by its unique identifier.
 * <p>
 * The store has exactly one writer (the synchronization loop of its kind) and any number of
 * readers (scrapes). Every mutation and every snapshot runs under a read/write lock, so a
 * reader always sees the state before or after a complete event, never in between.
 * <p>
 * The watermark is the resource version of the last applied list or event.
 */
@Slf4j
public class ResourceStore<T extends HasMetadata> {

    private final String resource;
    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // guarded by lock
    private Map<String, T> objects = new HashMap<>();
    private String resourceVersion;
    private boolean synced;
    private Instant lastListedAt;

    public ResourceStore(String resource) {
        this(resource, Clock.systemUTC());
    }

    public ResourceStore(String resource, Clock clock) {
        this.resource = resource;
        this.clock = clock;
    }

    public String resource() {
        return resource;
    }

    /**
     * Replace the entire content with a fresh listing.
     *
     * @param items           all objects currently known to the cluster
     * @param resourceVersion the version the listing was taken at
     */
    public void replace(Collection<? extends T> items, String resourceVersion) {
        Map<String, T> fresh = new HashMap<>(Math.max(16, items.size() * 2));
        for (T item : items) {
            fresh.put(keyOf(item), item);
        }
        lock.writeLock().lock();
        try {
            this.objects = fresh;
            this.resourceVersion = resourceVersion;
            this.synced = true;
            this.lastListedAt = clock.instant();
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Replaced {} store with {} objects at version {}", resource, fresh.size(), resourceVersion);
    }

    /**
     * Insert or overwrite an object.
     * <p>
     * An update carrying an older resource version than the cached copy is ignored.
     *
     * @return true if the object was stored
     */
    public boolean upsert(T object) {
        String key = keyOf(object);
        String incoming = versionOf(object);
        lock.writeLock().lock();
        try {
            T existing = objects.get(key);
            if (existing != null && ResourceVersions.isOlder(incoming, versionOf(existing))) {
                log.debug("Ignoring stale {} {} at version {} (cached {})",
                        resource, key, incoming, versionOf(existing));
                return false;
            }
            objects.put(key, object);
            advance(incoming);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Remove an object after a confirmed deletion.
     *
     * @return true if the object was present
     */
    public boolean delete(T object) {
        String key = keyOf(object);
        lock.writeLock().lock();
        try {
            boolean removed = objects.remove(key) != null;
            advance(versionOf(object));
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Move the watermark without touching any object, used for bookmark events.
     */
    public void advanceWatermark(String version) {
        lock.writeLock().lock();
        try {
            advance(version);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Point-in-time copy of all cached objects.
     */
    public List<T> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(objects.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public T get(String key) {
        lock.readLock().lock();
        try {
            return objects.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return objects.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public String resourceVersion() {
        lock.readLock().lock();
        try {
            return resourceVersion;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return true once the first full listing has been applied
     */
    public boolean hasSynced() {
        lock.readLock().lock();
        try {
            return synced;
        } finally {
            lock.readLock().unlock();
        }
    }

    public StoreStatus status() {
        lock.readLock().lock();
        try {
            return new StoreStatus(resource, objects.size(), resourceVersion, synced, lastListedAt);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Unique key of an object: its uid, or namespace/name when the uid is not set.
     */
    public static String keyOf(HasMetadata object) {
        ObjectMeta meta = object.getMetadata();
        if (meta == null) {
            throw new IllegalArgumentException("Object of kind " + object.getKind() + " has no metadata");
        }
        if (meta.getUid() != null && !meta.getUid().isEmpty()) {
            return meta.getUid();
        }
        String namespace = meta.getNamespace();
        return namespace == null || namespace.isEmpty() ? meta.getName() : namespace + "/" + meta.getName();
    }

    private static String versionOf(HasMetadata object) {
        return object.getMetadata() != null ? object.getMetadata().getResourceVersion() : null;
    }

    private void advance(String version) {
        if (version == null || version.isEmpty()) {
            return;
        }
        if (resourceVersion == null || !ResourceVersions.isOlder(version, resourceVersion)) {
            resourceVersion = version;
        }
    }
}
