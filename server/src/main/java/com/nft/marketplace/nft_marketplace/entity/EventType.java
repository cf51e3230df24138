package com.nft.marketplace.nft_marketplace.entity;

/**
 * Observable events, one or more per committed operation, in commit order.
 */
public enum EventType {
    COLLECTION_CREATED("CollectionCreated"),
    NFT_MINTED("NFTMinted"),
    NFT_TRANSFERRED("NFTTransferred"),
    NFT_LISTED("NFTListed"),
    NFT_LISTING_DELETED("NFTListingDeleted"),
    NFT_SOLD("NFTSold"),
    AUCTION_CREATED("AuctionCreated"),
    BID_PLACED("BidPlaced"),
    AUCTION_CANCELLED("AuctionCancelled"),
    REFUND_DEFERRED("RefundDeferred"),
    FUNDS_DEPOSITED("FundsDeposited"),
    FUNDS_WITHDRAWN("FundsWithdrawn"),
    CREDIT_CLAIMED("CreditClaimed");

    private final String eventName;

    EventType(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }
}
