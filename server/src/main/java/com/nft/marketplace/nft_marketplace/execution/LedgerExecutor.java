package com.nft.marketplace.nft_marketplace.execution;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;

import com.nft.marketplace.nft_marketplace.cache.LedgerLog;
import com.nft.marketplace.nft_marketplace.exception.LedgerException;

import lombok.extern.slf4j.Slf4j;

/**
 * Single writer for all registry, marketplace and funds state.
 *
 * Every operation runs alone on one thread, in submission order, so no operation
 * sees another's partial effects. Records staged in the {@link LedgerLog} are
 * committed when the operation returns and discarded when it throws. A call made
 * from inside a running operation joins that operation instead of queueing.
 */
@Slf4j
public class LedgerExecutor implements AutoCloseable {
    private final ExecutorService executor;
    private final LedgerLog ledgerLog;
    private volatile Thread worker;

    public LedgerExecutor(LedgerLog ledgerLog) {
        this.ledgerLog = ledgerLog;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "ledger-executor");
            thread.setDaemon(true);
            worker = thread;
            return thread;
        });
    }

    public <T> T submit(String operation, Supplier<T> work) {
        if (Thread.currentThread() == worker) {
            return work.get();
        }

        Future<T> future = executor.submit(() -> runAtomically(operation, work));
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Operation failed: " + operation, cause);
        }
    }

    public void run(String operation, Runnable work) {
        submit(operation, () -> {
            work.run();
            return null;
        });
    }

    private <T> T runAtomically(String operation, Supplier<T> work) {
        try {
            T result = work.get();
            ledgerLog.commit();
            return result;
        } catch (LedgerException e) {
            ledgerLog.discard();
            log.warn("Operation rejected: op={}, code={}, reason={}", operation, e.getErrorCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            ledgerLog.discard();
            log.error("Operation failed: op={}", operation, e);
            throw e;
        }
    }

    @Override
    public void close() {
        executor.shutdown();
    }
}
