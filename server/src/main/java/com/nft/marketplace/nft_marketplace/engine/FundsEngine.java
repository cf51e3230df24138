package com.nft.marketplace.nft_marketplace.engine;

import com.nft.marketplace.nft_marketplace.cache.AccountStore;
import com.nft.marketplace.nft_marketplace.cache.LedgerLog;
import com.nft.marketplace.nft_marketplace.entity.EventType;
import com.nft.marketplace.nft_marketplace.entity.LedgerEvent;
import com.nft.marketplace.nft_marketplace.entity.Money;
import com.nft.marketplace.nft_marketplace.entity.Transaction;
import com.nft.marketplace.nft_marketplace.entity.TransactionType;
import com.nft.marketplace.nft_marketplace.exception.LedgerException;

import lombok.extern.slf4j.Slf4j;

/**
 * Balances, escrow and payouts.
 *
 * Outbound payments are pushes: if the recipient refuses funds the amount becomes a
 * pending credit the recipient claims later, and the calling operation still commits.
 * Callers validate with {@link #requireBalance} before mutating anything.
 */
@Slf4j
public class FundsEngine {
    private final AccountStore accounts;
    private final LedgerLog ledgerLog;

    public FundsEngine(AccountStore accounts, LedgerLog ledgerLog) {
        this.accounts = accounts;
        this.ledgerLog = ledgerLog;
    }

    public Money deposit(String account, Money amount) {
        requireAccount(account);
        requirePositive(amount);

        Money balance = accounts.credit(account, amount);
        record(account, null, TransactionType.DEPOSIT, amount, balance);
        ledgerLog.emit(LedgerEvent.builder()
                .type(EventType.FUNDS_DEPOSITED)
                .account(account)
                .amount(amount.toBigDecimal()));

        log.info("Deposit: account={}, amount={}, balance={}", account, amount, balance);
        return balance;
    }

    public Money withdraw(String account, Money amount) {
        requireAccount(account);
        requirePositive(amount);
        requireBalance(account, amount);

        Money balance = accounts.debit(account, amount);
        record(account, null, TransactionType.WITHDRAWAL, amount.negate(), balance);
        ledgerLog.emit(LedgerEvent.builder()
                .type(EventType.FUNDS_WITHDRAWN)
                .account(account)
                .amount(amount.toBigDecimal()));

        log.info("Withdrawal: account={}, amount={}, balance={}", account, amount, balance);
        return balance;
    }

    public void setReceiving(String account, boolean receiving) {
        requireAccount(account);
        accounts.setReceiving(account, receiving);
        log.info("Receiving funds: account={}, receiving={}", account, receiving);
    }

    /**
     * Moves the whole pending credit of {@code account} into its balance.
     */
    public Money claimPendingCredit(String account) {
        requireAccount(account);
        Money pending = accounts.getPendingCredit(account);
        if (pending.isZero()) {
            throw LedgerException.invalidState("No pending credit");
        }
        if (!accounts.isReceiving(account)) {
            throw LedgerException.invalidState("Account cannot receive funds");
        }

        accounts.takePendingCredit(account);
        Money balance = accounts.credit(account, pending);
        record(account, null, TransactionType.CREDIT_CLAIM, pending, balance);
        ledgerLog.emit(LedgerEvent.builder()
                .type(EventType.CREDIT_CLAIMED)
                .account(account)
                .amount(pending.toBigDecimal()));

        log.info("Pending credit claimed: account={}, amount={}", account, pending);
        return pending;
    }

    public void requireBalance(String account, Money amount) {
        if (accounts.getBalance(account).isLessThan(amount)) {
            throw LedgerException.invalidInput("Insufficient balance");
        }
    }

    /**
     * Debits {@code account}. The balance must have been checked by the caller.
     */
    public void charge(String account, Money amount, long tokenId, TransactionType type) {
        Money balance = accounts.debit(account, amount);
        record(account, tokenId, type, amount.negate(), balance);
    }

    public void escrow(String bidder, Money amount, long tokenId) {
        charge(bidder, amount, tokenId, TransactionType.ESCROW);
        accounts.addEscrow(amount);
    }

    public void releaseEscrow(Money amount) {
        accounts.releaseEscrow(amount);
    }

    /**
     * Pays {@code amount} to {@code account}.
     *
     * @return true if the balance was credited, false if the amount was parked as a
     *         pending credit because the account refuses funds
     */
    public boolean push(String account, Money amount, long tokenId, TransactionType type) {
        if (amount.isZero()) {
            return true;
        }
        if (!accounts.isReceiving(account)) {
            accounts.addPendingCredit(account, amount);
            record(account, tokenId, TransactionType.PENDING_CREDIT, amount, accounts.getBalance(account));
            ledgerLog.emit(LedgerEvent.builder()
                    .type(EventType.REFUND_DEFERRED)
                    .tokenId(tokenId)
                    .account(account)
                    .amount(amount.toBigDecimal()));
            log.warn("Payment deferred to pending credit: account={}, tokenId={}, amount={}, type={}",
                    account, tokenId, amount, type);
            return false;
        }

        Money balance = accounts.credit(account, amount);
        record(account, tokenId, type, amount, balance);
        return true;
    }

    public Money balanceOf(String account) {
        return accounts.getBalance(account);
    }

    public Money pendingCreditOf(String account) {
        return accounts.getPendingCredit(account);
    }

    public Money escrowBalance() {
        return accounts.getEscrow();
    }

    public boolean isReceiving(String account) {
        return accounts.isReceiving(account);
    }

    private void record(String account, Long tokenId, TransactionType type, Money amount, Money balanceAfter) {
        ledgerLog.record(Transaction.builder()
                .account(account)
                .tokenId(tokenId)
                .type(type)
                .amount(amount.toBigDecimal())
                .balanceAfter(balanceAfter.toBigDecimal()));
    }

    private static void requireAccount(String account) {
        if (account == null || account.isBlank()) {
            throw LedgerException.invalidInput("Account is required");
        }
    }

    private static void requirePositive(Money amount) {
        if (amount == null || !amount.isPositive()) {
            throw LedgerException.invalidInput("Amount must be greater than 0");
        }
    }
}
