package com.nft.marketplace.nft_marketplace.service;

import java.util.List;

import org.springframework.stereotype.Service;

import com.nft.marketplace.nft_marketplace.engine.NftRegistry;
import com.nft.marketplace.nft_marketplace.entity.Collection;
import com.nft.marketplace.nft_marketplace.entity.Money;
import com.nft.marketplace.nft_marketplace.entity.Nft;
import com.nft.marketplace.nft_marketplace.execution.LedgerExecutor;

import lombok.RequiredArgsConstructor;

/**
 * Entry point for collection and token operations. Every call, including reads,
 * runs on the ledger executor.
 */
@Service
@RequiredArgsConstructor
public class RegistryService {

    private final LedgerExecutor executor;
    private final NftRegistry registry;

    public long createCollection(String caller, String name) {
        return executor.submit("createCollection", () -> registry.createCollection(caller, name));
    }

    public long mintNFT(String caller, long collectionId, String name, Money price) {
        return executor.submit("mintNFT", () -> registry.mintNFT(caller, collectionId, name, price));
    }

    public void transferNFT(String caller, long tokenId, String to) {
        executor.run("transferNFT", () -> registry.transferNFT(caller, tokenId, to));
    }

    public Collection getCollection(long collectionId) {
        return executor.submit("getCollection", () -> registry.getCollection(collectionId));
    }

    public Nft getNFT(long tokenId) {
        return executor.submit("getNFT", () -> registry.getNFT(tokenId));
    }

    public String ownerOf(long tokenId) {
        return executor.submit("ownerOf", () -> registry.ownerOf(tokenId));
    }

    public boolean tokenExists(long tokenId) {
        return executor.submit("tokenExists", () -> registry.tokenExists(tokenId));
    }

    public List<Collection> getCreatorCollections(String creator) {
        return executor.submit("getCreatorCollections", () -> registry.getCreatorCollections(creator));
    }

    public List<Nft> getNFTsByOwner(String owner) {
        return executor.submit("getNFTsByOwner", () -> registry.getNFTsByOwner(owner));
    }

    public List<Nft> getNFTsByCollection(long collectionId) {
        return executor.submit("getNFTsByCollection", () -> registry.getNFTsByCollection(collectionId));
    }
}
