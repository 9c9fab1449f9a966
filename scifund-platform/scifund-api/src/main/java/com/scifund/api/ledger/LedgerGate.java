package com.scifund.api.ledger;

import com.scifund.api.error.InvalidStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-wide serialization point for mutating ledger operations.
 *
 * Each operation runs alone, in its own transaction. A thread that is already
 * inside an operation (for example a transfer callback) cannot enter again.
 */
@Component
public class LedgerGate {

    private static final Logger log = LoggerFactory.getLogger(LedgerGate.class);

    private final ReentrantLock lock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;

    public LedgerGate(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public <T> T execute(String operation, Supplier<T> work) {
        if (lock.isHeldByCurrentThread()) {
            log.debug("Rejected reentrant call to {}", operation);
            throw new InvalidStateException("Reentrant ledger call rejected: " + operation);
        }
        lock.lock();
        try {
            return transactionTemplate.execute(status -> work.get());
        } finally {
            lock.unlock();
        }
    }

    public void run(String operation, Runnable work) {
        execute(operation, () -> {
            work.run();
            return null;
        });
    }

    public boolean isBusy() {
        return lock.isLocked();
    }
}
