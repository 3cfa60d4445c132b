package com.memoryvault.application;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One read/write lock per unordered principal pair. Both sides of a pair get
 * the same lock whichever of them asks, so two principals matching each
 * other concurrently cannot deadlock.
 *
 * <p>Locks are weakly held and disappear once no thread references them.
 * The read and write views handed out keep their pair lock reachable, so a
 * lock is never collected while a caller holds one of its views.
 */
@Component
public class PairLockRegistry {

    private final Cache<PrincipalPair, PairLock> locks = Caffeine.newBuilder()
        .weakValues()
        .build();

    public ReadWriteLock lockFor(PrincipalPair pair) {
        return locks.get(pair, key -> new PairLock());
    }

    static final class PairLock implements ReadWriteLock {

        private final ReentrantReadWriteLock delegate = new ReentrantReadWriteLock();
        private final Lock readView = new PinnedLock(delegate.readLock(), this);
        private final Lock writeView = new PinnedLock(delegate.writeLock(), this);

        @Override
        public Lock readLock() {
            return readView;
        }

        @Override
        public Lock writeLock() {
            return writeView;
        }
    }

    /**
     * Forwards to a lock view while pinning its owning {@link PairLock}.
     */
    private static final class PinnedLock implements Lock {

        private final Lock delegate;

        @SuppressWarnings("unused")
        private final PairLock owner;

        PinnedLock(Lock delegate, PairLock owner) {
            this.delegate = delegate;
            this.owner = owner;
        }

        @Override
        public void lock() {
            delegate.lock();
        }

        @Override
        public void lockInterruptibly() throws InterruptedException {
            delegate.lockInterruptibly();
        }

        @Override
        public boolean tryLock() {
            return delegate.tryLock();
        }

        @Override
        public boolean tryLock(long time, TimeUnit unit) throws InterruptedException {
            return delegate.tryLock(time, unit);
        }

        @Override
        public void unlock() {
            delegate.unlock();
        }

        @Override
        public Condition newCondition() {
            return delegate.newCondition();
        }
    }
}
