package com.memoryvault.application;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

import static org.junit.jupiter.api.Assertions.*;

class PairLockRegistryTest {

    private final PairLockRegistry registry = new PairLockRegistry();

    @Test
    void bothOrderingsShareOneLock() {
        assertSame(registry.lockFor(PrincipalPair.of("alice", "bob")),
            registry.lockFor(PrincipalPair.of("bob", "alice")));
    }

    @Test
    void heldWriteLockSurvivesGarbageCollection() throws Exception {
        PrincipalPair pair = PrincipalPair.of("alice", "bob");
        Lock held = registry.lockFor(pair).writeLock();
        held.lock();
        try {
            for (int i = 0; i < 5; i++) {
                System.gc();
                Thread.sleep(20);
            }

            boolean acquired = CompletableFuture.supplyAsync(() -> {
                Lock other = registry.lockFor(PrincipalPair.of("bob", "alice")).writeLock();
                if (other.tryLock()) {
                    other.unlock();
                    return true;
                }
                return false;
            }).get(5, TimeUnit.SECONDS);

            assertFalse(acquired);
        } finally {
            held.unlock();
        }
    }

    @Test
    void readersShareTheLockButExcludeWriters() throws Exception {
        PrincipalPair pair = PrincipalPair.of("carol", "dave");
        Lock read = registry.lockFor(pair).readLock();
        read.lock();
        try {
            boolean secondReader = CompletableFuture.supplyAsync(() -> {
                Lock other = registry.lockFor(pair).readLock();
                boolean locked = other.tryLock();
                if (locked) {
                    other.unlock();
                }
                return locked;
            }).get(5, TimeUnit.SECONDS);
            boolean writer = CompletableFuture.supplyAsync(() -> registry.lockFor(pair).writeLock().tryLock())
                .get(5, TimeUnit.SECONDS);

            assertTrue(secondReader);
            assertFalse(writer);
        } finally {
            read.unlock();
        }
    }
}
