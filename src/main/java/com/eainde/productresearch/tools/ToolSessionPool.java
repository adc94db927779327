package com.eainde.productresearch.tools;

import lombok.extern.log4j.Log4j2;

import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Holds the tool session shared by concurrent runs.
 *
 * <p>Readers share the cached session under the read lock. Opening, replacing and
 * invalidating happen under the write lock. Invalidation only clears the cache when the
 * broken session is still the current one, so a sibling run that already replaced it is
 * not disturbed.</p>
 */
@Log4j2
public class ToolSessionPool {

    private final ToolSessionFactory factory;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private ToolSession current;

    public ToolSessionPool(ToolSessionFactory factory) {
        this.factory = factory;
    }

    /**
     * Returns the cached session, opening one if none is cached.
     *
     * @throws ToolException when a new session cannot be opened
     */
    public ToolSession acquire() {
        lock.readLock().lock();
        try {
            if (current != null) {
                return current;
            }
        } finally {
            lock.readLock().unlock();
        }

        lock.writeLock().lock();
        try {
            if (current == null) {
                log.info("Opening tool session");
                current = factory.open();
            }
            return current;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops {@code broken} from the cache if it is still current and closes it.
     *
     * @return true if this call cleared the cache
     */
    public boolean invalidate(ToolSession broken) {
        lock.writeLock().lock();
        try {
            if (current == null || current != broken) {
                log.debug("Tool session already replaced, nothing to invalidate");
                return false;
            }
            current = null;
        } finally {
            lock.writeLock().unlock();
        }
        closeQuietly(broken);
        log.warn("Tool session invalidated after a dropped connection");
        return true;
    }

    /** Replaces the cached session wholesale. */
    public void replace(ToolSession fresh) {
        ToolSession previous;
        lock.writeLock().lock();
        try {
            previous = current;
            current = fresh;
        } finally {
            lock.writeLock().unlock();
        }
        if (previous != null && previous != fresh) {
            closeQuietly(previous);
        }
    }

    private void closeQuietly(ToolSession session) {
        try {
            session.close();
        } catch (Exception e) {
            log.warn("Failed to close tool session", e);
        }
    }
}
