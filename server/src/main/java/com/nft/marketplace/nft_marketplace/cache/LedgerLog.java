package com.nft.marketplace.nft_marketplace.cache;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import com.nft.marketplace.nft_marketplace.entity.LedgerEvent;
import com.nft.marketplace.nft_marketplace.entity.Transaction;

/**
 * Ordered log of events and fund movements.
 *
 * Engines stage records while an operation runs; the executor commits them when the
 * operation returns and discards them when it throws. Sequence numbers and the commit
 * timestamp are assigned at commit, so a rejected operation consumes no sequence.
 */
public class LedgerLog {
    private final Clock clock;
    private final LedgerJournal journal;

    private final AtomicLong eventSequence = new AtomicLong();
    private final AtomicLong transactionSequence = new AtomicLong();

    private final List<LedgerEvent> events = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, List<Transaction>> transactionsByAccount = new ConcurrentHashMap<>();

    private final List<LedgerEvent.LedgerEventBuilder> stagedEvents = new ArrayList<>();
    private final List<Transaction.TransactionBuilder> stagedTransactions = new ArrayList<>();

    public LedgerLog(Clock clock, LedgerJournal journal) {
        this.clock = clock;
        this.journal = journal;
    }

    public void emit(LedgerEvent.LedgerEventBuilder event) {
        stagedEvents.add(event);
    }

    public void record(Transaction.TransactionBuilder transaction) {
        stagedTransactions.add(transaction);
    }

    public void commit() {
        if (stagedEvents.isEmpty() && stagedTransactions.isEmpty()) {
            return;
        }
        long now = clock.millis();

        List<LedgerEvent> committedEvents = new ArrayList<>(stagedEvents.size());
        for (LedgerEvent.LedgerEventBuilder staged : stagedEvents) {
            committedEvents.add(staged.sequence(eventSequence.incrementAndGet()).timestamp(now).build());
        }
        List<Transaction> committedTransactions = new ArrayList<>(stagedTransactions.size());
        for (Transaction.TransactionBuilder staged : stagedTransactions) {
            Transaction tx = staged.sequence(transactionSequence.incrementAndGet()).timestamp(now).build();
            committedTransactions.add(tx);
            transactionsByAccount.computeIfAbsent(tx.getAccount(), id -> new CopyOnWriteArrayList<>()).add(tx);
        }
        events.addAll(committedEvents);
        discard();

        journal.append(committedEvents, committedTransactions);
    }

    public void discard() {
        stagedEvents.clear();
        stagedTransactions.clear();
    }

    public List<LedgerEvent> events() {
        return Collections.unmodifiableList(new ArrayList<>(events));
    }

    /**
     * Events with a sequence greater than {@code sequence}.
     */
    public List<LedgerEvent> eventsSince(long sequence) {
        List<LedgerEvent> result = new ArrayList<>();
        for (LedgerEvent event : events) {
            if (event.getSequence() > sequence) {
                result.add(event);
            }
        }
        return result;
    }

    public List<Transaction> transactionsOf(String account) {
        return List.copyOf(transactionsByAccount.getOrDefault(account, List.of()));
    }
}
