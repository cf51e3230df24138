package com.nft.marketplace.nft_marketplace.service;

import java.util.List;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.nft.marketplace.nft_marketplace.cache.LedgerLog;
import com.nft.marketplace.nft_marketplace.engine.FundsEngine;
import com.nft.marketplace.nft_marketplace.engine.NftMarketplace;
import com.nft.marketplace.nft_marketplace.entity.Money;
import com.nft.marketplace.nft_marketplace.entity.Transaction;
import com.nft.marketplace.nft_marketplace.execution.LedgerExecutor;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Account balances, pending credits and escrow reconciliation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BalanceService {

    private final LedgerExecutor executor;
    private final FundsEngine funds;
    private final NftMarketplace marketplace;
    private final LedgerLog ledgerLog;

    public Money deposit(String account, Money amount) {
        return executor.submit("deposit", () -> funds.deposit(account, amount));
    }

    public Money withdraw(String account, Money amount) {
        return executor.submit("withdraw", () -> funds.withdraw(account, amount));
    }

    public void setReceiving(String account, boolean receiving) {
        executor.run("setReceiving", () -> funds.setReceiving(account, receiving));
    }

    public Money claimPendingCredit(String account) {
        return executor.submit("claimPendingCredit", () -> funds.claimPendingCredit(account));
    }

    public Money balanceOf(String account) {
        return executor.submit("balanceOf", () -> funds.balanceOf(account));
    }

    public Money pendingCreditOf(String account) {
        return executor.submit("pendingCreditOf", () -> funds.pendingCreditOf(account));
    }

    public boolean isReceiving(String account) {
        return executor.submit("isReceiving", () -> funds.isReceiving(account));
    }

    public Money escrowBalance() {
        return executor.submit("escrowBalance", funds::escrowBalance);
    }

    public List<Transaction> transactionsOf(String account) {
        return ledgerLog.transactionsOf(account);
    }

    /**
     * Periodic check that escrow holds exactly the highest bids of active auctions.
     * Drift is logged, never corrected automatically.
     *
     * @return true if escrow matches
     */
    @Scheduled(fixedDelay = 300000) // 5 minutes
    public boolean reconcileEscrow() {
        return executor.submit("reconcileEscrow", () -> {
            Money escrow = funds.escrowBalance();
            Money expected = marketplace.escrowedBids();
            if (!escrow.equals(expected)) {
                log.warn("Escrow drift detected: escrow={}, activeBids={}", escrow, expected);
                return false;
            }
            log.debug("Escrow reconciled: {}", escrow);
            return true;
        });
    }
}
