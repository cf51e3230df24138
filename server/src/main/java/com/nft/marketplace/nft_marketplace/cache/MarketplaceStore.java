package com.nft.marketplace.nft_marketplace.cache;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.marketplace.nft_marketplace.entity.Auction;
import com.nft.marketplace.nft_marketplace.entity.Listing;
import com.nft.marketplace.nft_marketplace.entity.TokenState;

/**
 * Per-token singleton records for listings and auctions.
 *
 * Cleared listings are removed and read back as {@link Listing#EMPTY}; finished
 * auctions stay as inactive records until replaced.
 */
public class MarketplaceStore {
    private final ConcurrentHashMap<Long, Listing> listings = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, Auction> auctions = new ConcurrentHashMap<>();

    public TokenState stateOf(long tokenId) {
        if (getListing(tokenId).isActive()) {
            return TokenState.LISTED;
        }
        if (getAuction(tokenId).isActive()) {
            return TokenState.AUCTIONED;
        }
        return TokenState.NONE;
    }

    public Listing getListing(long tokenId) {
        return listings.getOrDefault(tokenId, Listing.EMPTY);
    }

    public void putListing(Listing listing) {
        listings.put(listing.getTokenId(), listing);
    }

    public void clearListing(long tokenId) {
        listings.remove(tokenId);
    }

    public Auction getAuction(long tokenId) {
        return auctions.getOrDefault(tokenId, Auction.EMPTY);
    }

    public void putAuction(Auction auction) {
        auctions.put(auction.getTokenId(), auction);
    }

    public List<Listing> activeListings() {
        List<Listing> result = new ArrayList<>();
        for (Listing listing : listings.values()) {
            if (listing.isActive()) {
                result.add(listing);
            }
        }
        result.sort((a, b) -> Long.compare(a.getTokenId(), b.getTokenId()));
        return result;
    }

    public List<Auction> activeAuctions() {
        List<Auction> result = new ArrayList<>();
        for (Auction auction : auctions.values()) {
            if (auction.isActive()) {
                result.add(auction);
            }
        }
        result.sort((a, b) -> Long.compare(a.getTokenId(), b.getTokenId()));
        return result;
    }
}
