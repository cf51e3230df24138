package com.nft.marketplace.nft_marketplace.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Fixed-price sale offer for one token. A token without an offer reads as
 * {@link #EMPTY}: zero price, no seller, inactive.
 */
@Getter
@ToString
@Builder
public class Listing {

    public static final Listing EMPTY = Listing.builder()
            .price(Money.ZERO)
            .active(false)
            .build();

    private final long tokenId;
    private final Money price;
    private final String seller;
    private final boolean active;
    private final long listedAt;
}
