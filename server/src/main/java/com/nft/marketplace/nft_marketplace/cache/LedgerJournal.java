package com.nft.marketplace.nft_marketplace.cache;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingDeque;

import org.springframework.data.repository.CrudRepository;
import org.springframework.scheduling.annotation.Scheduled;

import com.nft.marketplace.nft_marketplace.entity.LedgerEvent;
import com.nft.marketplace.nft_marketplace.entity.Transaction;
import com.nft.marketplace.nft_marketplace.repositories.LedgerEventRepository;
import com.nft.marketplace.nft_marketplace.repositories.TransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Write-behind journal of committed events and fund movements to MongoDB.
 *
 * Committed records are queued in commit order and flushed on a fixed delay.
 * A failed flush puts the batch back at the head of its queue, so the next tick
 * retries it before anything committed later.
 */
@Slf4j
@RequiredArgsConstructor
public class LedgerJournal {
    private final LedgerEventRepository eventRepository;
    private final TransactionRepository transactionRepository;

    private final LinkedBlockingDeque<LedgerEvent> pendingEvents = new LinkedBlockingDeque<>();
    private final LinkedBlockingDeque<Transaction> pendingTransactions = new LinkedBlockingDeque<>();

    public void append(List<LedgerEvent> events, List<Transaction> transactions) {
        pendingEvents.addAll(events);
        pendingTransactions.addAll(transactions);
    }

    @Scheduled(fixedDelayString = "${marketplace.journal.flush-interval-ms:1000}")
    public void flush() {
        drain(pendingEvents, eventRepository, "events");
        drain(pendingTransactions, transactionRepository, "transactions");
    }

    public int pendingCount() {
        return pendingEvents.size() + pendingTransactions.size();
    }

    private <T> void drain(LinkedBlockingDeque<T> queue, CrudRepository<T, String> repository, String label) {
        List<T> batch = new ArrayList<>();
        queue.drainTo(batch);
        if (batch.isEmpty()) {
            return;
        }
        try {
            repository.saveAll(batch);
            log.debug("Journaled {} {}", batch.size(), label);
        } catch (RuntimeException e) {
            log.error("Failed to journal {} {}, will retry", batch.size(), label, e);
            for (int i = batch.size() - 1; i >= 0; i--) {
                queue.addFirst(batch.get(i));
            }
        }
    }
}
