package dk.cloudcreate.aggregatestore.common.cache;

import dk.cloudcreate.aggregatestore.common.transaction.*;
import org.slf4j.*;

import java.util.*;
import java.util.function.Supplier;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Cache of dependencies (e.g. repositories) that share the lifetime of a single {@link UnitOfWorkContext}.<br>
 * The cache is disposed exactly once, by the owning {@link UnitOfWorkScope}, at which point every cached value
 * that implements {@link AutoCloseable} is closed in the reverse order of registration.
 */
public final class DependencyCache {
    private static final Logger log = LoggerFactory.getLogger(DependencyCache.class);

    private final String                      unitOfWorkContextId;
    private final LinkedHashMap<Object, Object> dependencies;
    private       boolean                     disposed;

    public DependencyCache(String unitOfWorkContextId) {
        this.unitOfWorkContextId = requireNonNull(unitOfWorkContextId, "No unitOfWorkContextId provided");
        this.dependencies = new LinkedHashMap<>();
    }

    /**
     * Get the value cached under <code>key</code> or create, cache and return a new value using the <code>factory</code>
     *
     * @param key     the cache key
     * @param factory the factory used if no value is cached under the key
     * @param <T>     the value type
     * @return the cached value
     * @throws UnitOfWorkException if the cache has been disposed
     */
    @SuppressWarnings("unchecked")
    public <T> T getOrAdd(Object key, Supplier<T> factory) {
        requireNonNull(key, "No key provided");
        requireNonNull(factory, "No factory provided");
        requireNotDisposed();
        var value = dependencies.get(key);
        if (value == null) {
            value = requireNonNull(factory.get(), msg("Factory for key '{}' returned null", key));
            log.trace("[{}] Caching dependency '{}' under key '{}'", unitOfWorkContextId, value.getClass().getName(), key);
            dependencies.put(key, value);
        }
        return (T) value;
    }

    /**
     * Get the value cached under <code>key</code>
     *
     * @param key       the cache key
     * @param valueType the expected value type
     * @return the cached value or {@link Optional#empty()}
     */
    public <T> Optional<T> get(Object key, Class<T> valueType) {
        requireNonNull(key, "No key provided");
        requireNonNull(valueType, "No valueType provided");
        requireNotDisposed();
        return Optional.ofNullable(dependencies.get(key))
                       .filter(valueType::isInstance)
                       .map(valueType::cast);
    }

    public int size() {
        return dependencies.size();
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * Close every cached {@link AutoCloseable} in reverse registration order. Subsequent calls are ignored.
     *
     * @throws UnitOfWorkException after all values have been closed, if one or more of them failed to close
     */
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        var values = new ArrayList<>(dependencies.values());
        dependencies.clear();
        Collections.reverse(values);

        UnitOfWorkException failure = null;
        for (var value : values) {
            if (value instanceof AutoCloseable) {
                try {
                    log.trace("[{}] Closing dependency '{}'", unitOfWorkContextId, value.getClass().getName());
                    ((AutoCloseable) value).close();
                } catch (Exception e) {
                    log.error(msg("[{}] Failed to close dependency '{}'", unitOfWorkContextId, value.getClass().getName()), e);
                    if (failure == null) {
                        failure = new UnitOfWorkException(msg("[{}] Failed to dispose one or more dependencies", unitOfWorkContextId));
                    }
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private void requireNotDisposed() {
        if (disposed) {
            throw new UnitOfWorkException(msg("The DependencyCache of UnitOfWork '{}' has been disposed", unitOfWorkContextId));
        }
    }
}
