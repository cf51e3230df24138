package com.nft.marketplace.nft_marketplace.entity;

/**
 * Marketplace state of a single token. LISTED and AUCTIONED are mutually exclusive.
 *
 * NONE → LISTED     (listNFT)
 * NONE → AUCTIONED  (createAuction)
 * LISTED → NONE     (cancelListing, buyNFT)
 * AUCTIONED → NONE  (finalizeAuction)
 */
public enum TokenState {

    NONE,

    LISTED,

    AUCTIONED;

    public boolean canTransitionTo(TokenState to) {
        return switch (this) {
            case NONE -> to == LISTED || to == AUCTIONED;
            case LISTED, AUCTIONED -> to == NONE;
        };
    }
}
