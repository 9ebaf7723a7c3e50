package com.raditha.lazygraph.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Serializes access to a {@link GraphCache} and defines its commit boundaries.
 * <p>
 * A unit of work started while another one is active on the same thread joins it. Only the
 * outermost unit commits, and only when something was written through {@link #markDirty()}.
 * A failure anywhere inside rolls the outermost unit back.
 */
public final class CacheUnitOfWork {

    private static final Logger logger = LoggerFactory.getLogger(CacheUnitOfWork.class);

    private final GraphCache cache;
    private final ReentrantLock lock = new ReentrantLock();
    private boolean dirty;

    public CacheUnitOfWork(GraphCache cache) {
        this.cache = cache;
    }

    public GraphCache cache() {
        return cache;
    }

    /**
     * Run a read-only query against the cache.
     */
    public <T> T read(Function<GraphCache, T> query) {
        lock.lock();
        try {
            return query.apply(cache);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run work that may write to the cache.
     * Writers must call {@link #markDirty()} before writing.
     */
    public <T> T write(Function<GraphCache, T> work) {
        lock.lock();
        boolean outermost = lock.getHoldCount() == 1;
        try {
            T result = work.apply(cache);
            if (outermost && dirty) {
                cache.commit();
            }
            return result;
        } catch (RuntimeException e) {
            if (outermost) {
                rollbackAfter(e);
            }
            throw e;
        } finally {
            if (outermost) {
                dirty = false;
            }
            lock.unlock();
        }
    }

    /**
     * Record that the current unit of work writes to the cache.
     *
     * @throws IllegalStateException if called outside {@link #write(Function)}
     */
    public void markDirty() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Cache writes must happen inside a unit of work");
        }
        dirty = true;
    }

    private void rollbackAfter(RuntimeException failure) {
        try {
            cache.rollback();
        } catch (RuntimeException rollbackFailure) {
            logger.warn("Rollback failed after cache error", rollbackFailure);
            failure.addSuppressed(rollbackFailure);
        }
    }
}
