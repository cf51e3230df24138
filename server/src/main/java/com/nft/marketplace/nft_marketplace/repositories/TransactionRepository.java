package com.nft.marketplace.nft_marketplace.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.nft.marketplace.nft_marketplace.entity.Transaction;

@Repository
public interface TransactionRepository extends MongoRepository<Transaction, String> {
}
