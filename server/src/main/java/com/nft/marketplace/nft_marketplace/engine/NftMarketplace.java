package com.nft.marketplace.nft_marketplace.engine;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.List;

import com.nft.marketplace.nft_marketplace.cache.LedgerLog;
import com.nft.marketplace.nft_marketplace.cache.MarketplaceStore;
import com.nft.marketplace.nft_marketplace.entity.Auction;
import com.nft.marketplace.nft_marketplace.entity.AuctionStatus;
import com.nft.marketplace.nft_marketplace.entity.EventType;
import com.nft.marketplace.nft_marketplace.entity.LedgerEvent;
import com.nft.marketplace.nft_marketplace.entity.Listing;
import com.nft.marketplace.nft_marketplace.entity.Money;
import com.nft.marketplace.nft_marketplace.entity.Nft;
import com.nft.marketplace.nft_marketplace.entity.TokenState;
import com.nft.marketplace.nft_marketplace.entity.TransactionType;
import com.nft.marketplace.nft_marketplace.exception.LedgerException;

import lombok.extern.slf4j.Slf4j;

/**
 * Listing and auction state machine per token (NONE, LISTED, AUCTIONED).
 *
 * Ownership only moves through {@link NftRegistry#transferFrom}; funds only through
 * {@link FundsEngine}. Each operation checks every precondition first, then commits
 * its own state, then moves the token, then pays out.
 */
@Slf4j
public class NftMarketplace {
    private final NftRegistry registry;
    private final MarketplaceStore store;
    private final FundsEngine funds;
    private final LedgerLog ledgerLog;
    private final Clock clock;
    private final String operatorId;
    private final FinalizePolicy finalizePolicy;

    public NftMarketplace(
            NftRegistry registry,
            MarketplaceStore store,
            FundsEngine funds,
            LedgerLog ledgerLog,
            Clock clock,
            String operatorId,
            FinalizePolicy finalizePolicy) {
        this.registry = registry;
        this.store = store;
        this.funds = funds;
        this.ledgerLog = ledgerLog;
        this.clock = clock;
        this.operatorId = operatorId;
        this.finalizePolicy = finalizePolicy;
    }

    // ===== Fixed-price listings =====

    public Listing listNFT(String caller, long tokenId, Money price) {
        NftRegistry.requireCaller(caller);
        Nft nft = registry.getNFT(tokenId);
        if (!nft.getOwner().equals(caller)) {
            throw LedgerException.unauthorized("Not token owner");
        }
        requireNoSale(tokenId, caller);
        if (price == null) {
            throw LedgerException.invalidInput("Price is required");
        }
        if (price.isLessThan(nft.getMintPrice())) {
            throw LedgerException.invalidInput("Price cannot be less than mint price");
        }

        dropStaleListing(tokenId, caller);

        Listing listing = Listing.builder()
                .tokenId(tokenId)
                .price(price)
                .seller(caller)
                .active(true)
                .listedAt(clock.millis())
                .build();
        store.putListing(listing);

        ledgerLog.emit(LedgerEvent.builder()
                .type(EventType.NFT_LISTED)
                .tokenId(tokenId)
                .account(caller)
                .amount(price.toBigDecimal()));

        log.info("NFT listed: tokenId={}, price={}, seller={}", tokenId, price, caller);
        return listing;
    }

    public void cancelListing(String caller, long tokenId) {
        NftRegistry.requireCaller(caller);
        Listing listing = store.getListing(tokenId);
        if (!listing.isActive()) {
            throw LedgerException.invalidState("NFT not listed for sale");
        }
        if (!listing.getSeller().equals(caller)) {
            throw LedgerException.unauthorized("Not the seller");
        }

        store.clearListing(tokenId);
        ledgerLog.emit(LedgerEvent.builder()
                .type(EventType.NFT_LISTING_DELETED)
                .tokenId(tokenId));

        log.info("Listing cancelled: tokenId={}, seller={}", tokenId, caller);
    }

    /**
     * Buys a listed token. {@code payment} above the listing price is pushed back to
     * the buyer in the same operation.
     */
    public void buyNFT(String caller, long tokenId, Money payment) {
        NftRegistry.requireCaller(caller);
        Listing listing = store.getListing(tokenId);
        if (!listing.isActive()) {
            throw LedgerException.invalidState("NFT not listed for sale");
        }
        if (listing.getSeller().equals(caller)) {
            throw LedgerException.invalidInput("Seller cannot buy own NFT");
        }
        if (payment == null || payment.isLessThan(listing.getPrice())) {
            throw LedgerException.invalidInput("Insufficient payment");
        }
        funds.requireBalance(caller, payment);
        if (!registry.ownerOf(tokenId).equals(listing.getSeller())) {
            throw LedgerException.invalidState("Seller no longer owns NFT");
        }

        Money price = listing.getPrice();
        store.clearListing(tokenId);
        funds.charge(caller, payment, tokenId, TransactionType.PURCHASE);
        registry.transferFrom(operatorId, tokenId, listing.getSeller(), caller);

        ledgerLog.emit(LedgerEvent.builder()
                .type(EventType.NFT_SOLD)
                .tokenId(tokenId)
                .account(caller)
                .amount(price.toBigDecimal()));

        funds.push(listing.getSeller(), price, tokenId, TransactionType.SALE_PROCEEDS);
        funds.push(caller, payment.subtract(price), tokenId, TransactionType.EXCESS_REFUND);

        log.info("NFT sold: tokenId={}, price={}, seller={}, buyer={}", tokenId, price, listing.getSeller(), caller);
    }

    // ===== Auctions =====

    public Auction createAuction(String caller, long tokenId, Money startingBid, long durationSeconds) {
        NftRegistry.requireCaller(caller);
        Nft nft = registry.getNFT(tokenId);
        if (!nft.getOwner().equals(caller)) {
            throw LedgerException.unauthorized("Not token owner");
        }
        requireNoSale(tokenId, caller);
        if (startingBid == null || !startingBid.isPositive()) {
            throw LedgerException.invalidInput("Starting bid must be greater than 0");
        }
        if (startingBid.isLessThan(nft.getMintPrice())) {
            throw LedgerException.invalidInput("Starting bid cannot be less than mint price");
        }
        if (durationSeconds <= 0) {
            throw LedgerException.invalidInput("Duration must be greater than 0");
        }
        Instant endTime;
        try {
            endTime = clock.instant().plusSeconds(durationSeconds);
        } catch (ArithmeticException | DateTimeException e) {
            throw LedgerException.invalidInput("Duration is too long");
        }

        dropStaleListing(tokenId, caller);

        Auction auction = Auction.builder()
                .tokenId(tokenId)
                .creator(caller)
                .startingBid(startingBid)
                .highestBid(startingBid)
                .endTime(endTime)
                .active(true)
                .build();
        store.putAuction(auction);

        ledgerLog.emit(LedgerEvent.builder()
                .type(EventType.AUCTION_CREATED)
                .tokenId(tokenId)
                .account(caller)
                .amount(startingBid.toBigDecimal()));

        log.info("Auction created: tokenId={}, startingBid={}, creator={}, endTime={}",
                tokenId, startingBid, caller, auction.getEndTime());
        return auction;
    }

    /**
     * Escrows {@code payment} as the new highest bid and refunds the previous
     * highest bidder. A refused refund becomes that bidder's pending credit.
     */
    public Auction placeBid(String caller, long tokenId, Money payment) {
        NftRegistry.requireCaller(caller);
        Auction auction = store.getAuction(tokenId);
        if (!auction.isActive()) {
            throw LedgerException.invalidState("Auction is not active");
        }
        if (auction.hasEndedAt(clock.instant())) {
            throw LedgerException.invalidState("Auction has ended");
        }
        if (caller.equals(auction.getCreator())) {
            throw LedgerException.invalidInput("Creator cannot bid on own auction");
        }
        if (payment == null || !payment.isGreaterThan(auction.getHighestBid())) {
            throw LedgerException.invalidInput("Bid too low");
        }
        funds.requireBalance(caller, payment);

        Auction updated = auction.withBid(payment, caller);
        store.putAuction(updated);
        funds.escrow(caller, payment, tokenId);

        ledgerLog.emit(LedgerEvent.builder()
                .type(EventType.BID_PLACED)
                .tokenId(tokenId)
                .account(caller)
                .amount(payment.toBigDecimal()));

        if (auction.hasBidder()) {
            funds.releaseEscrow(auction.getHighestBid());
            funds.push(auction.getHighestBidder(), auction.getHighestBid(), tokenId, TransactionType.BID_REFUND);
        }

        log.info("Bid placed: tokenId={}, amount={}, bidder={}, outbid={}",
                tokenId, payment, caller, auction.getHighestBidder());
        return updated;
    }

    /**
     * Closes an auction whose end time has passed.
     *
     * With a bidder the token goes to the highest bidder and the escrowed bid to the
     * creator. Without one, or when the creator no longer owns the token, the auction
     * is cancelled and any escrowed bid goes back to its bidder.
     */
    public Auction finalizeAuction(String caller, long tokenId) {
        NftRegistry.requireCaller(caller);
        Auction auction = store.getAuction(tokenId);
        if (!auction.isActive()) {
            throw LedgerException.invalidState("Auction is not active");
        }
        if (!auction.hasEndedAt(clock.instant())) {
            throw LedgerException.invalidState("Auction is still active");
        }
        if (!finalizePolicy.permits(caller, auction)) {
            throw LedgerException.unauthorized("Not authorized to finalize auction");
        }

        Auction closed = auction.closed();
        store.putAuction(closed);

        if (!auction.hasBidder()) {
            emitCancelled(auction);
            log.info("Auction closed without bids: tokenId={}, creator={}", tokenId, auction.getCreator());
            return closed;
        }

        Money bid = auction.getHighestBid();
        String winner = auction.getHighestBidder();
        funds.releaseEscrow(bid);

        if (!registry.ownerOf(tokenId).equals(auction.getCreator())) {
            emitCancelled(auction);
            funds.push(winner, bid, tokenId, TransactionType.BID_REFUND);
            log.warn("Auction cancelled, creator no longer owns token: tokenId={}, creator={}, refunded={}",
                    tokenId, auction.getCreator(), winner);
            return closed;
        }

        registry.transferFrom(operatorId, tokenId, auction.getCreator(), winner);
        ledgerLog.emit(LedgerEvent.builder()
                .type(EventType.NFT_SOLD)
                .tokenId(tokenId)
                .account(winner)
                .amount(bid.toBigDecimal()));
        funds.push(auction.getCreator(), bid, tokenId, TransactionType.AUCTION_PROCEEDS);

        log.info("Auction finalized: tokenId={}, price={}, creator={}, winner={}",
                tokenId, bid, auction.getCreator(), winner);
        return closed;
    }

    // ===== Reads =====

    public Listing listings(long tokenId) {
        return store.getListing(tokenId);
    }

    public Auction auctions(long tokenId) {
        return store.getAuction(tokenId);
    }

    public AuctionStatus checkAuctionStatus(long tokenId) {
        return AuctionStatus.of(store.getAuction(tokenId));
    }

    public boolean verifyNFTOwnership(long tokenId, String address) {
        return registry.tokenExists(tokenId) && registry.ownerOf(tokenId).equals(address);
    }

    /**
     * A listing whose seller no longer owns the token reads as NONE.
     */
    public TokenState tokenState(long tokenId) {
        return effectiveState(tokenId, registry.tokenExists(tokenId) ? registry.ownerOf(tokenId) : null);
    }

    public List<Listing> activeListings() {
        return store.activeListings();
    }

    public List<Auction> activeAuctions() {
        return store.activeAuctions();
    }

    /**
     * Sum of the highest bids that are currently held in escrow.
     */
    public Money escrowedBids() {
        Money total = Money.ZERO;
        for (Auction auction : store.activeAuctions()) {
            if (auction.hasBidder()) {
                total = total.add(auction.getHighestBid());
            }
        }
        return total;
    }

    private TokenState effectiveState(long tokenId, String owner) {
        TokenState state = store.stateOf(tokenId);
        if (state == TokenState.LISTED && isStaleListing(tokenId, owner)) {
            return TokenState.NONE;
        }
        return state;
    }

    private boolean isStaleListing(long tokenId, String owner) {
        Listing listing = store.getListing(tokenId);
        return listing.isActive() && owner != null && !listing.getSeller().equals(owner);
    }

    /**
     * Clears a listing left behind when its seller transferred the token away.
     * Called only after every precondition of the owner's new sale has passed.
     */
    private void dropStaleListing(long tokenId, String owner) {
        if (!isStaleListing(tokenId, owner)) {
            return;
        }
        String previousSeller = store.getListing(tokenId).getSeller();
        store.clearListing(tokenId);
        ledgerLog.emit(LedgerEvent.builder()
                .type(EventType.NFT_LISTING_DELETED)
                .tokenId(tokenId));
        log.info("Stale listing cleared: tokenId={}, previousSeller={}, owner={}", tokenId, previousSeller, owner);
    }

    private void requireNoSale(long tokenId, String owner) {
        TokenState state = effectiveState(tokenId, owner);
        if (!state.canTransitionTo(TokenState.LISTED)) {
            throw LedgerException.conflict(state == TokenState.LISTED
                    ? "NFT already listed"
                    : "NFT already in auction");
        }
    }

    private void emitCancelled(Auction auction) {
        ledgerLog.emit(LedgerEvent.builder()
                .type(EventType.AUCTION_CANCELLED)
                .tokenId(auction.getTokenId())
                .account(auction.getCreator()));
    }
}
