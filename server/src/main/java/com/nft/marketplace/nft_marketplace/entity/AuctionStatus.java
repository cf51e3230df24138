package com.nft.marketplace.nft_marketplace.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Read model returned by {@code checkAuctionStatus}.
 */
@Getter
@ToString
@AllArgsConstructor
public class AuctionStatus {
    private final boolean active;
    private final Money highestBid;
    private final String highestBidder;

    public static AuctionStatus of(Auction auction) {
        return new AuctionStatus(auction.isActive(), auction.getHighestBid(), auction.getHighestBidder());
    }
}
