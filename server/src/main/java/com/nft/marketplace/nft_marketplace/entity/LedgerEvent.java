package com.nft.marketplace.nft_marketplace.entity;

import java.math.BigDecimal;

import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Committed event. Unused fields stay null, e.g. {@code NFTListingDeleted} only
 * carries {@code tokenId}.
 *
 * Field mapping per type:
 * - CollectionCreated: collectionId, account = creator
 * - NFTMinted: tokenId, collectionId, account = owner, amount = mint price
 * - NFTTransferred: tokenId, account = new owner
 * - NFTListed: tokenId, amount = price, account = seller
 * - NFTSold: tokenId, amount = price, account = buyer
 * - AuctionCreated: tokenId, amount = starting bid, account = creator
 * - BidPlaced: tokenId, amount, account = bidder
 * - AuctionCancelled: tokenId, account = creator
 * - RefundDeferred: tokenId (may be null), account, amount
 */
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "events")
@CompoundIndex(name = "token_sequence_idx", def = "{'tokenId':1,'sequence':1}")
public class LedgerEvent {

    @MongoId
    private String id;

    /**
     * Global commit order, starting at 1.
     */
    @Indexed(unique = true)
    private long sequence;

    private EventType type;

    private Long collectionId;

    private Long tokenId;

    @Indexed
    private String account;

    private BigDecimal amount;

    private long timestamp;

    public Money amountAsMoney() {
        return amount == null ? null : Money.of(amount);
    }
}
