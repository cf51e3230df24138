package com.nft.marketplace.nft_marketplace.entity;

import java.time.Instant;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Timed ascending-bid sale of one token.
 *
 * Lifecycle: created active with {@code highestBid = startingBid} and no bidder,
 * every accepted bid raises {@code highestBid}, finalization sets {@code active = false}.
 * The last auction of a token is kept (inactive) until a new one replaces it.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class Auction {

    public static final Auction EMPTY = Auction.builder()
            .startingBid(Money.ZERO)
            .highestBid(Money.ZERO)
            .endTime(Instant.EPOCH)
            .active(false)
            .build();

    private final long tokenId;
    private final String creator;
    private final Money startingBid;
    private final Money highestBid;

    /** Null until the first bid is accepted. */
    private final String highestBidder;

    private final Instant endTime;
    private final boolean active;

    public boolean hasBidder() {
        return highestBidder != null;
    }

    public boolean hasEndedAt(Instant now) {
        return !now.isBefore(endTime);
    }

    public Auction withBid(Money amount, String bidder) {
        return toBuilder().highestBid(amount).highestBidder(bidder).build();
    }

    public Auction closed() {
        return toBuilder().active(false).build();
    }
}
