package com.nft.marketplace.nft_marketplace.config;

import java.time.Clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.nft.marketplace.nft_marketplace.cache.AccountStore;
import com.nft.marketplace.nft_marketplace.cache.LedgerJournal;
import com.nft.marketplace.nft_marketplace.cache.LedgerLog;
import com.nft.marketplace.nft_marketplace.cache.MarketplaceStore;
import com.nft.marketplace.nft_marketplace.cache.RegistryStore;
import com.nft.marketplace.nft_marketplace.engine.FinalizePolicy;
import com.nft.marketplace.nft_marketplace.engine.FundsEngine;
import com.nft.marketplace.nft_marketplace.engine.NftMarketplace;
import com.nft.marketplace.nft_marketplace.engine.NftRegistry;
import com.nft.marketplace.nft_marketplace.execution.LedgerExecutor;
import com.nft.marketplace.nft_marketplace.repositories.LedgerEventRepository;
import com.nft.marketplace.nft_marketplace.repositories.TransactionRepository;

import lombok.extern.slf4j.Slf4j;

@Slf4j
@Configuration
public class MarketplaceConfig {

    @Value("${marketplace.collection.name-max-length:100}")
    private int collectionNameMaxLength;

    @Value("${marketplace.operator-id:marketplace}")
    private String operatorId;

    @Value("${marketplace.auction.finalize-policy:ANYONE}")
    private FinalizePolicy finalizePolicy;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RegistryStore registryStore() {
        return new RegistryStore();
    }

    @Bean
    public MarketplaceStore marketplaceStore() {
        return new MarketplaceStore();
    }

    @Bean
    public AccountStore accountStore() {
        return new AccountStore();
    }

    @Bean
    public LedgerJournal ledgerJournal(LedgerEventRepository eventRepository, TransactionRepository transactionRepository) {
        return new LedgerJournal(eventRepository, transactionRepository);
    }

    @Bean
    public LedgerLog ledgerLog(Clock clock, LedgerJournal ledgerJournal) {
        return new LedgerLog(clock, ledgerJournal);
    }

    @Bean(destroyMethod = "close")
    public LedgerExecutor ledgerExecutor(LedgerLog ledgerLog) {
        return new LedgerExecutor(ledgerLog);
    }

    @Bean
    public NftRegistry nftRegistry(RegistryStore registryStore, LedgerLog ledgerLog, Clock clock) {
        return new NftRegistry(registryStore, ledgerLog, clock, collectionNameMaxLength);
    }

    @Bean
    public FundsEngine fundsEngine(AccountStore accountStore, LedgerLog ledgerLog) {
        return new FundsEngine(accountStore, ledgerLog);
    }

    @Bean
    public NftMarketplace nftMarketplace(
            NftRegistry nftRegistry,
            MarketplaceStore marketplaceStore,
            FundsEngine fundsEngine,
            LedgerLog ledgerLog,
            Clock clock) {
        nftRegistry.registerOperator(operatorId);
        log.info("Marketplace operator={}, finalizePolicy={}", operatorId, finalizePolicy);
        return new NftMarketplace(nftRegistry, marketplaceStore, fundsEngine, ledgerLog, clock, operatorId, finalizePolicy);
    }
}
