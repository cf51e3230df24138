package com.nft.marketplace.nft_marketplace.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.nft.marketplace.nft_marketplace.entity.LedgerEvent;

@Repository
public interface LedgerEventRepository extends MongoRepository<LedgerEvent, String> {
}
