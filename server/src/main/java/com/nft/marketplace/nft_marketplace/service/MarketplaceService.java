package com.nft.marketplace.nft_marketplace.service;

import java.util.List;

import org.springframework.stereotype.Service;

import com.nft.marketplace.nft_marketplace.cache.LedgerLog;
import com.nft.marketplace.nft_marketplace.engine.NftMarketplace;
import com.nft.marketplace.nft_marketplace.entity.Auction;
import com.nft.marketplace.nft_marketplace.entity.AuctionStatus;
import com.nft.marketplace.nft_marketplace.entity.LedgerEvent;
import com.nft.marketplace.nft_marketplace.entity.Listing;
import com.nft.marketplace.nft_marketplace.entity.Money;
import com.nft.marketplace.nft_marketplace.entity.TokenState;
import com.nft.marketplace.nft_marketplace.execution.LedgerExecutor;

import lombok.RequiredArgsConstructor;

/**
 * Entry point for listings, purchases and auctions.
 */
@Service
@RequiredArgsConstructor
public class MarketplaceService {

    private final LedgerExecutor executor;
    private final NftMarketplace marketplace;
    private final LedgerLog ledgerLog;

    public Listing listNFT(String caller, long tokenId, Money price) {
        return executor.submit("listNFT", () -> marketplace.listNFT(caller, tokenId, price));
    }

    public void cancelListing(String caller, long tokenId) {
        executor.run("cancelListing", () -> marketplace.cancelListing(caller, tokenId));
    }

    public void buyNFT(String caller, long tokenId, Money payment) {
        executor.run("buyNFT", () -> marketplace.buyNFT(caller, tokenId, payment));
    }

    public Auction createAuction(String caller, long tokenId, Money startingBid, long durationSeconds) {
        return executor.submit("createAuction",
                () -> marketplace.createAuction(caller, tokenId, startingBid, durationSeconds));
    }

    public Auction placeBid(String caller, long tokenId, Money payment) {
        return executor.submit("placeBid", () -> marketplace.placeBid(caller, tokenId, payment));
    }

    public Auction finalizeAuction(String caller, long tokenId) {
        return executor.submit("finalizeAuction", () -> marketplace.finalizeAuction(caller, tokenId));
    }

    public AuctionStatus checkAuctionStatus(long tokenId) {
        return executor.submit("checkAuctionStatus", () -> marketplace.checkAuctionStatus(tokenId));
    }

    public boolean verifyNFTOwnership(long tokenId, String address) {
        return executor.submit("verifyNFTOwnership", () -> marketplace.verifyNFTOwnership(tokenId, address));
    }

    public Listing listings(long tokenId) {
        return executor.submit("listings", () -> marketplace.listings(tokenId));
    }

    public Auction auctions(long tokenId) {
        return executor.submit("auctions", () -> marketplace.auctions(tokenId));
    }

    public TokenState tokenState(long tokenId) {
        return executor.submit("tokenState", () -> marketplace.tokenState(tokenId));
    }

    public List<Listing> activeListings() {
        return executor.submit("activeListings", marketplace::activeListings);
    }

    public List<Auction> activeAuctions() {
        return executor.submit("activeAuctions", marketplace::activeAuctions);
    }

    /**
     * Committed events with a sequence greater than {@code sequence}; 0 returns all.
     */
    public List<LedgerEvent> eventsSince(long sequence) {
        return ledgerLog.eventsSince(sequence);
    }
}
