package com.nft.marketplace.nft_marketplace.engine;

import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.marketplace.nft_marketplace.cache.LedgerLog;
import com.nft.marketplace.nft_marketplace.cache.RegistryStore;
import com.nft.marketplace.nft_marketplace.entity.Collection;
import com.nft.marketplace.nft_marketplace.entity.EventType;
import com.nft.marketplace.nft_marketplace.entity.LedgerEvent;
import com.nft.marketplace.nft_marketplace.entity.Money;
import com.nft.marketplace.nft_marketplace.entity.Nft;
import com.nft.marketplace.nft_marketplace.exception.LedgerException;

import lombok.extern.slf4j.Slf4j;

/**
 * Minting registry: collections, tokens and the single source of truth for
 * token ownership.
 *
 * Every operation validates all preconditions before touching the store.
 * Not thread-safe; callers run it on the ledger executor.
 */
@Slf4j
public class NftRegistry {

    public static final int DEFAULT_NAME_MAX_LENGTH = 100;

    private final RegistryStore store;
    private final LedgerLog ledgerLog;
    private final Clock clock;
    private final int nameMaxLength;
    private final Set<String> operators = ConcurrentHashMap.newKeySet();

    public NftRegistry(RegistryStore store, LedgerLog ledgerLog, Clock clock, int nameMaxLength) {
        this.store = store;
        this.ledgerLog = ledgerLog;
        this.clock = clock;
        this.nameMaxLength = nameMaxLength;
    }

    public long createCollection(String caller, String name) {
        requireCaller(caller);
        if (name == null || name.isEmpty()) {
            throw LedgerException.invalidInput("Name cannot be empty");
        }
        if (name.codePointCount(0, name.length()) > nameMaxLength) {
            throw LedgerException.invalidInput("Name is too long");
        }
        if (store.collectionNameTaken(name)) {
            throw LedgerException.conflict("Collection already exists");
        }

        Collection collection = Collection.builder()
                .id(store.nextCollectionId())
                .name(name)
                .creator(caller)
                .createdAt(clock.millis())
                .build();
        store.addCollection(collection);

        ledgerLog.emit(LedgerEvent.builder()
                .type(EventType.COLLECTION_CREATED)
                .collectionId(collection.getId())
                .account(caller));

        log.info("Collection created: collectionId={}, name={}, creator={}", collection.getId(), name, caller);
        return collection.getId();
    }

    public long mintNFT(String caller, long collectionId, String name, Money price) {
        requireCaller(caller);
        if (store.getCollection(collectionId).isEmpty()) {
            throw LedgerException.notFound("Invalid collection ID");
        }
        if (name == null || name.isEmpty()) {
            throw LedgerException.invalidInput("Name cannot be empty");
        }
        if (price == null || !price.isPositive()) {
            throw LedgerException.invalidInput("Price must be greater than 0");
        }

        Nft nft = Nft.builder()
                .tokenId(store.nextTokenId())
                .collectionId(collectionId)
                .name(name)
                .mintPrice(price)
                .creator(caller)
                .owner(caller)
                .mintedAt(clock.millis())
                .build();
        store.addNft(nft);

        ledgerLog.emit(LedgerEvent.builder()
                .type(EventType.NFT_MINTED)
                .tokenId(nft.getTokenId())
                .collectionId(collectionId)
                .account(caller)
                .amount(price.toBigDecimal()));

        log.info("NFT minted: tokenId={}, collectionId={}, owner={}, mintPrice={}",
                nft.getTokenId(), collectionId, caller, price);
        return nft.getTokenId();
    }

    public void transferNFT(String caller, long tokenId, String to) {
        requireCaller(caller);
        Nft nft = getNFT(tokenId);
        if (!nft.getOwner().equals(caller)) {
            throw LedgerException.unauthorized("Not token owner");
        }
        requireRecipient(to);

        move(nft, to);
    }

    /**
     * Transfer performed by a registered operator on behalf of {@code from}.
     * Fails unless {@code from} is still the owner.
     */
    public void transferFrom(String operator, long tokenId, String from, String to) {
        if (operator == null || !operators.contains(operator)) {
            throw LedgerException.unauthorized("Not an approved operator");
        }
        Nft nft = getNFT(tokenId);
        if (!nft.getOwner().equals(from)) {
            throw LedgerException.unauthorized("Not token owner");
        }
        requireRecipient(to);

        move(nft, to);
    }

    public void registerOperator(String operator) {
        operators.add(operator);
        log.info("Operator registered: {}", operator);
    }

    public boolean isOperator(String operator) {
        return operators.contains(operator);
    }

    public Collection getCollection(long collectionId) {
        return store.getCollection(collectionId)
                .orElseThrow(() -> LedgerException.notFound("Invalid collection ID"));
    }

    public Nft getNFT(long tokenId) {
        return store.getNft(tokenId)
                .orElseThrow(() -> LedgerException.notFound("NFT does not exist"));
    }

    public String ownerOf(long tokenId) {
        return getNFT(tokenId).getOwner();
    }

    public boolean tokenExists(long tokenId) {
        return store.getNft(tokenId).isPresent();
    }

    public List<Collection> getCreatorCollections(String creator) {
        return store.getCollectionsByCreator(creator);
    }

    public List<Nft> getNFTsByOwner(String owner) {
        return store.getNftsByOwner(owner);
    }

    public List<Nft> getNFTsByCollection(long collectionId) {
        return store.getNftsByCollection(collectionId);
    }

    private void move(Nft nft, String to) {
        store.reassign(nft.getTokenId(), to);
        ledgerLog.emit(LedgerEvent.builder()
                .type(EventType.NFT_TRANSFERRED)
                .tokenId(nft.getTokenId())
                .account(to));

        log.info("NFT transferred: tokenId={}, from={}, to={}", nft.getTokenId(), nft.getOwner(), to);
    }

    private static void requireRecipient(String to) {
        if (to == null || to.isBlank()) {
            throw LedgerException.invalidInput("Invalid recipient");
        }
    }

    static void requireCaller(String caller) {
        if (caller == null || caller.isBlank()) {
            throw LedgerException.unauthorized("Caller identity is required");
        }
    }
}
