package com.nft.marketplace.nft_marketplace.cache;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.marketplace.nft_marketplace.entity.Money;

/**
 * Spendable balances, pending (withdrawable) credits and the marketplace escrow total.
 */
public class AccountStore {
    private final ConcurrentHashMap<String, Money> balances = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Money> pendingCredits = new ConcurrentHashMap<>();
    private final Set<String> refusing = ConcurrentHashMap.newKeySet();
    private volatile Money escrow = Money.ZERO;

    public Money getBalance(String account) {
        return balances.getOrDefault(account, Money.ZERO);
    }

    public Money credit(String account, Money amount) {
        return balances.merge(account, amount, Money::add);
    }

    public Money debit(String account, Money amount) {
        return balances.merge(account, amount.negate(), Money::add);
    }

    public Money getPendingCredit(String account) {
        return pendingCredits.getOrDefault(account, Money.ZERO);
    }

    public void addPendingCredit(String account, Money amount) {
        pendingCredits.merge(account, amount, Money::add);
    }

    public Money takePendingCredit(String account) {
        Money taken = pendingCredits.remove(account);
        return taken == null ? Money.ZERO : taken;
    }

    public boolean isReceiving(String account) {
        return !refusing.contains(account);
    }

    public void setReceiving(String account, boolean receiving) {
        if (receiving) {
            refusing.remove(account);
        } else {
            refusing.add(account);
        }
    }

    public Money getEscrow() {
        return escrow;
    }

    public void addEscrow(Money amount) {
        escrow = escrow.add(amount);
    }

    public void releaseEscrow(Money amount) {
        escrow = escrow.subtract(amount);
    }
}
