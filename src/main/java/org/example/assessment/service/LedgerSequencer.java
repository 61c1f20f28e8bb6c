package org.example.assessment.service;

import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Runs every state-mutating ledger operation one at a time, each inside its own transaction.
 * Nested calls from the same thread re-enter the lock and join the outer transaction.
 */
@Component
public class LedgerSequencer {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionOperations transactions;

    public LedgerSequencer(TransactionOperations transactions) {
        this.transactions = transactions;
    }

    public <T> T execute(Supplier<T> operation) {
        lock.lock();
        try {
            return transactions.execute(status -> operation.get());
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable operation) {
        execute(() -> {
            operation.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
