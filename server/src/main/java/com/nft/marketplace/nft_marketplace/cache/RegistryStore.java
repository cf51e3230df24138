package com.nft.marketplace.nft_marketplace.cache;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import com.nft.marketplace.nft_marketplace.entity.Collection;
import com.nft.marketplace.nft_marketplace.entity.Nft;

/**
 * Arena for collections and tokens: monotonically increasing ids, records by id,
 * and insertion-ordered secondary indices. Nothing is ever removed from the arena;
 * only the owner index moves when a token changes hands.
 *
 * Mutated only from the ledger executor thread.
 */
public class RegistryStore {

    private final AtomicLong collectionCounter = new AtomicLong();
    private final AtomicLong tokenCounter = new AtomicLong();

    private final ConcurrentHashMap<Long, Collection> collections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> collectionIdsByName = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Long>> collectionIdsByCreator = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<Long, Nft> nfts = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Long>> tokenIdsByOwner = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<Long, List<Long>> tokenIdsByCollection = new ConcurrentHashMap<>();

    public long nextCollectionId() {
        return collectionCounter.incrementAndGet();
    }

    public long nextTokenId() {
        return tokenCounter.incrementAndGet();
    }

    public boolean collectionNameTaken(String name) {
        return collectionIdsByName.containsKey(name);
    }

    public void addCollection(Collection collection) {
        collections.put(collection.getId(), collection);
        collectionIdsByName.put(collection.getName(), collection.getId());
        collectionIdsByCreator
                .computeIfAbsent(collection.getCreator(), id -> new ArrayList<>())
                .add(collection.getId());
    }

    public Optional<Collection> getCollection(long collectionId) {
        return Optional.ofNullable(collections.get(collectionId));
    }

    public List<Collection> getCollectionsByCreator(String creator) {
        List<Collection> result = new ArrayList<>();
        for (Long id : collectionIdsByCreator.getOrDefault(creator, List.of())) {
            result.add(collections.get(id));
        }
        return result;
    }

    public void addNft(Nft nft) {
        nfts.put(nft.getTokenId(), nft);
        tokenIdsByOwner.computeIfAbsent(nft.getOwner(), id -> new ArrayList<>()).add(nft.getTokenId());
        tokenIdsByCollection.computeIfAbsent(nft.getCollectionId(), id -> new ArrayList<>()).add(nft.getTokenId());
    }

    public Optional<Nft> getNft(long tokenId) {
        return Optional.ofNullable(nfts.get(tokenId));
    }

    /**
     * Replaces the token record with one owned by {@code newOwner} and moves the
     * token from the old owner's index to the end of the new owner's index.
     */
    public Nft reassign(long tokenId, String newOwner) {
        Nft current = nfts.get(tokenId);
        Nft updated = current.withOwner(newOwner);
        nfts.put(tokenId, updated);

        List<Long> previous = tokenIdsByOwner.get(current.getOwner());
        if (previous != null) {
            previous.remove(Long.valueOf(tokenId));
        }
        tokenIdsByOwner.computeIfAbsent(newOwner, id -> new ArrayList<>()).add(tokenId);
        return updated;
    }

    public List<Nft> getNftsByOwner(String owner) {
        return resolve(tokenIdsByOwner.getOrDefault(owner, List.of()));
    }

    public List<Nft> getNftsByCollection(long collectionId) {
        return resolve(tokenIdsByCollection.getOrDefault(collectionId, List.of()));
    }

    private List<Nft> resolve(List<Long> tokenIds) {
        List<Nft> result = new ArrayList<>(tokenIds.size());
        for (Long id : tokenIds) {
            result.add(nfts.get(id));
        }
        return result;
    }
}
