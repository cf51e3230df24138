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
 * One fund movement on an account.
 */
@Getter
@ToString
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "transactions")
@CompoundIndex(name = "account_sequence_idx", def = "{'account':1,'sequence':-1}")
public class Transaction {

    @MongoId
    private String id;

    @Indexed(unique = true)
    private long sequence;

    private String account;

    private Long tokenId;

    private TransactionType type;

    private BigDecimal amount; // positive for credit, negative for debit

    /**
     * Spendable balance after this movement. PENDING_CREDIT rows leave it unchanged.
     */
    private BigDecimal balanceAfter;

    private long timestamp;
}
