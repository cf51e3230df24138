package com.nft.marketplace.nft_marketplace.engine;

import com.nft.marketplace.nft_marketplace.entity.Auction;

/**
 * Who may finalize an auction once its end time has passed.
 * Configured with {@code marketplace.auction.finalize-policy}.
 */
public enum FinalizePolicy {

    /** Any caller. */
    ANYONE,

    /** Only the account that created the auction. */
    CREATOR,

    /** The creator, or the current highest bidder if there is one. */
    CREATOR_OR_HIGHEST_BIDDER;

    public boolean permits(String caller, Auction auction) {
        return switch (this) {
            case ANYONE -> true;
            case CREATOR -> caller.equals(auction.getCreator());
            case CREATOR_OR_HIGHEST_BIDDER -> caller.equals(auction.getCreator())
                    || caller.equals(auction.getHighestBidder());
        };
    }
}
