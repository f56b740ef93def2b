package com.snuffles.lotledger.service;

import com.snuffles.lotledger.config.LedgerProperties;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Fixed set of fair lock stripes keyed by account and symbol. Work on the same pair always maps
 * to the same stripe and is serialized in arrival order; unrelated pairs may share a stripe.
 * Memory stays bounded however many pairs are seen.
 */
@Component
public class LedgerLockRegistry {

    private final ReentrantLock[] stripes;

    public LedgerLockRegistry(LedgerProperties ledgerProperties) {
        int count = ledgerProperties.getLocking().getStripes();
        this.stripes = new ReentrantLock[count];
        for (int i = 0; i < count; i++) {
            stripes[i] = new ReentrantLock(true);
        }
    }

    public <T> T withLock(String accountId, String symbol, Supplier<T> work) {
        ReentrantLock lock = stripeFor(accountId, symbol);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock stripeFor(String accountId, String symbol) {
        return stripes[Math.floorMod(Objects.hash(accountId, symbol), stripes.length)];
    }

    int size() {
        return stripes.length;
    }
}
