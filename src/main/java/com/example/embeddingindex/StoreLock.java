package com.example.embeddingindex;

import org.springframework.stereotype.Component;

import java.util.concurrent.locks.ReentrantLock;

/**
 * The single exclusive lock that linearizes every read and write against the
 * store. Held only for in-process and on-disk work, never across an embedding
 * or network call.
 */
@Component
public class StoreLock {

    private final ReentrantLock lock = new ReentrantLock(true);

    /**
     * Blocks until the lock is held; close the returned guard to release it.
     */
    public Guard acquire() {
        lock.lock();
        return new Guard();
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public void requireHeld() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("store lock must be held by the calling thread");
        }
    }

    public final class Guard implements AutoCloseable {
        private boolean released;

        private Guard() {}

        @Override
        public void close() {
            if (!released) {
                released = true;
                lock.unlock();
            }
        }
    }
}
