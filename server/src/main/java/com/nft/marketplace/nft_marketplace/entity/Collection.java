package com.nft.marketplace.nft_marketplace.entity;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Named grouping of minted items. Immutable once created, never deleted.
 */
@Getter
@ToString
@Builder
public class Collection {
    private final long id;
    private final String name;
    private final String creator;
    private final long createdAt;
}
