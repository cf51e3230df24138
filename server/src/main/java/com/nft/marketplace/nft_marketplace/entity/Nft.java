package com.nft.marketplace.nft_marketplace.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * A minted item. {@code mintPrice} is fixed at mint time and is the floor for
 * every later listing or auction; {@code owner} changes only through the registry.
 *
 * Instances are immutable; an ownership change stores a new instance built with
 * {@link #withOwner(String)}.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class Nft {
    private final long tokenId;
    private final long collectionId;
    private final String name;
    private final Money mintPrice;
    private final String creator;
    private final String owner;
    private final long mintedAt;

    public Nft withOwner(String newOwner) {
        return toBuilder().owner(newOwner).build();
    }
}
