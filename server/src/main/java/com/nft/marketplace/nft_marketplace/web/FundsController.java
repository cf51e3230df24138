package com.nft.marketplace.nft_marketplace.web;

import java.security.Principal;
import java.util.List;
import java.util.Map;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.nft.marketplace.nft_marketplace.entity.Money;
import com.nft.marketplace.nft_marketplace.entity.Transaction;
import com.nft.marketplace.nft_marketplace.service.BalanceService;

import lombok.RequiredArgsConstructor;

/**
 * The caller's own account.
 */
@RestController
@RequestMapping("/api/funds")
@RequiredArgsConstructor
public class FundsController {

    private final BalanceService balanceService;

    @GetMapping
    public Map<String, Object> account(Principal caller) {
        String account = caller.getName();
        return Map.of(
                "account", account,
                "balance", balanceService.balanceOf(account),
                "pendingCredit", balanceService.pendingCreditOf(account),
                "receiving", balanceService.isReceiving(account));
    }

    @PostMapping("/deposit")
    public Map<String, Money> deposit(Principal caller, @RequestBody Requests.Amount request) {
        return Map.of("balance", balanceService.deposit(caller.getName(), request.getAmount()));
    }

    @PostMapping("/withdraw")
    public Map<String, Money> withdraw(Principal caller, @RequestBody Requests.Amount request) {
        return Map.of("balance", balanceService.withdraw(caller.getName(), request.getAmount()));
    }

    @PutMapping("/receiving")
    public Map<String, Boolean> setReceiving(Principal caller, @RequestBody Requests.Receiving request) {
        balanceService.setReceiving(caller.getName(), request.isReceiving());
        return Map.of("receiving", request.isReceiving());
    }

    @PostMapping("/claim")
    public Map<String, Money> claim(Principal caller) {
        return Map.of("claimed", balanceService.claimPendingCredit(caller.getName()));
    }

    @GetMapping("/transactions")
    public List<Transaction> transactions(Principal caller) {
        return balanceService.transactionsOf(caller.getName());
    }

    @GetMapping("/escrow")
    public Map<String, Money> escrow() {
        return Map.of("escrow", balanceService.escrowBalance());
    }
}
