package com.nft.marketplace.nft_marketplace.engine;

import static com.nft.marketplace.nft_marketplace.LedgerFixture.assertRejected;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.nft.marketplace.nft_marketplace.LedgerFixture;
import com.nft.marketplace.nft_marketplace.entity.Auction;
import com.nft.marketplace.nft_marketplace.entity.AuctionStatus;
import com.nft.marketplace.nft_marketplace.entity.EventType;
import com.nft.marketplace.nft_marketplace.entity.Listing;
import com.nft.marketplace.nft_marketplace.entity.Money;
import com.nft.marketplace.nft_marketplace.entity.TokenState;
import com.nft.marketplace.nft_marketplace.exception.ErrorCode;

class NftMarketplaceTest {

    private static final long HOUR = 3600;

    private LedgerFixture fx;
    private NftMarketplace marketplace;
    private FundsEngine funds;
    private long tokenId;

    @BeforeEach
    void setUp() {
        fx = new LedgerFixture();
        marketplace = fx.marketplace;
        funds = fx.funds;

        long collectionId = fx.registry.createCollection("alice", "Apes");
        tokenId = fx.registry.mintNFT("alice", collectionId, "Ape #1", Money.of(10));
        funds.deposit("bob", Money.of(100));
        funds.deposit("carol", Money.of(100));
        fx.ledgerLog.commit();
    }

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Nested
    class Listings {

        @Test
        void ownerListsAtOrAboveMintPrice() {
            assertRejected(() -> marketplace.listNFT("alice", tokenId, Money.of("9.99")),
                    ErrorCode.INVALID_INPUT, "Price cannot be less than mint price");

            Listing listing = marketplace.listNFT("alice", tokenId, Money.of(10));

            assertThat(listing.isActive()).isTrue();
            assertThat(listing.getSeller()).isEqualTo("alice");
            assertThat(marketplace.listings(tokenId).getPrice()).isEqualTo(Money.of(10));
            assertThat(marketplace.tokenState(tokenId)).isEqualTo(TokenState.LISTED);
        }

        @Test
        void onlyOwnerOfExistingTokenMayList() {
            assertRejected(() -> marketplace.listNFT("bob", tokenId, Money.of(20)),
                    ErrorCode.UNAUTHORIZED, "Not token owner");
            assertRejected(() -> marketplace.listNFT("alice", 99, Money.of(20)),
                    ErrorCode.NOT_FOUND, "NFT does not exist");
        }

        @Test
        void listingAndAuctionAreMutuallyExclusive() {
            marketplace.listNFT("alice", tokenId, Money.of(20));

            assertRejected(() -> marketplace.listNFT("alice", tokenId, Money.of(30)),
                    ErrorCode.CONFLICT, "NFT already listed");
            assertRejected(() -> marketplace.createAuction("alice", tokenId, Money.of(20), HOUR),
                    ErrorCode.CONFLICT, "NFT already listed");

            marketplace.cancelListing("alice", tokenId);
            marketplace.createAuction("alice", tokenId, Money.of(20), HOUR);

            assertRejected(() -> marketplace.listNFT("alice", tokenId, Money.of(30)),
                    ErrorCode.CONFLICT, "NFT already in auction");
        }

        @Test
        void cancelListingRequiresActiveListingAndSeller() {
            assertRejected(() -> marketplace.cancelListing("alice", tokenId),
                    ErrorCode.INVALID_STATE, "NFT not listed for sale");

            marketplace.listNFT("alice", tokenId, Money.of(20));
            assertRejected(() -> marketplace.cancelListing("bob", tokenId), ErrorCode.UNAUTHORIZED, "Not the seller");

            marketplace.cancelListing("alice", tokenId);
            fx.ledgerLog.commit();

            assertThat(marketplace.listings(tokenId).isActive()).isFalse();
            assertThat(marketplace.listings(tokenId).getPrice()).isEqualTo(Money.ZERO);
            assertThat(marketplace.tokenState(tokenId)).isEqualTo(TokenState.NONE);
            assertThat(fx.committedEventTypes()).endsWith(EventType.NFT_LISTED, EventType.NFT_LISTING_DELETED);
        }

        @Test
        void secondCancelFails() {
            marketplace.listNFT("alice", tokenId, Money.of(20));
            marketplace.cancelListing("alice", tokenId);

            assertRejected(() -> marketplace.cancelListing("alice", tokenId),
                    ErrorCode.INVALID_STATE, "NFT not listed for sale");
        }

        @Test
        void activeListingsAreOrderedByToken() {
            long second = fx.registry.mintNFT("alice", 1, "Ape #2", Money.of(1));
            marketplace.listNFT("alice", second, Money.of(5));
            marketplace.listNFT("alice", tokenId, Money.of(15));

            assertThat(marketplace.activeListings()).extracting(Listing::getTokenId).containsExactly(tokenId, second);
        }
    }

    @Nested
    class Purchases {

        @BeforeEach
        void list() {
            marketplace.listNFT("alice", tokenId, Money.of(20));
        }

        @Test
        void buyMovesTokenAndPaysSeller() {
            marketplace.buyNFT("bob", tokenId, Money.of(20));
            fx.ledgerLog.commit();

            assertThat(fx.registry.ownerOf(tokenId)).isEqualTo("bob");
            assertThat(funds.balanceOf("bob")).isEqualTo(Money.of(80));
            assertThat(funds.balanceOf("alice")).isEqualTo(Money.of(20));
            assertThat(marketplace.listings(tokenId).isActive()).isFalse();
            assertThat(marketplace.tokenState(tokenId)).isEqualTo(TokenState.NONE);
            assertThat(fx.committedEventTypes()).endsWith(EventType.NFT_TRANSFERRED, EventType.NFT_SOLD);
        }

        @Test
        void overpaymentIsRefundedToBuyer() {
            marketplace.buyNFT("bob", tokenId, Money.of(25));

            assertThat(funds.balanceOf("bob")).isEqualTo(Money.of(80));
            assertThat(funds.balanceOf("alice")).isEqualTo(Money.of(20));
        }

        @Test
        void rejectsUnderpaymentSellerAndShortBalance() {
            assertRejected(() -> marketplace.buyNFT("bob", tokenId, Money.of("19.5")),
                    ErrorCode.INVALID_INPUT, "Insufficient payment");
            assertRejected(() -> marketplace.buyNFT("alice", tokenId, Money.of(20)),
                    ErrorCode.INVALID_INPUT, "Seller cannot buy own NFT");
            assertRejected(() -> marketplace.buyNFT("dave", tokenId, Money.of(20)),
                    ErrorCode.INVALID_INPUT, "Insufficient balance");

            assertThat(marketplace.listings(tokenId).isActive()).isTrue();
            assertThat(fx.registry.ownerOf(tokenId)).isEqualTo("alice");
        }

        @Test
        void secondBuyerFindsTokenNoLongerListed() {
            marketplace.buyNFT("bob", tokenId, Money.of(20));

            assertRejected(() -> marketplace.buyNFT("carol", tokenId, Money.of(20)),
                    ErrorCode.INVALID_STATE, "NFT not listed for sale");
            assertThat(funds.balanceOf("carol")).isEqualTo(Money.of(100));
        }

        @Test
        void staleListingFailsWithoutMovingFunds() {
            fx.registry.transferNFT("alice", tokenId, "dave");

            assertRejected(() -> marketplace.buyNFT("bob", tokenId, Money.of(20)),
                    ErrorCode.INVALID_STATE, "Seller no longer owns NFT");
            assertThat(funds.balanceOf("bob")).isEqualTo(Money.of(100));
            assertThat(fx.registry.ownerOf(tokenId)).isEqualTo("dave");
        }

        @Test
        void newOwnerReplacesListingLeftByPreviousSeller() {
            fx.registry.transferNFT("alice", tokenId, "dave");
            assertThat(marketplace.tokenState(tokenId)).isEqualTo(TokenState.NONE);

            assertRejected(() -> marketplace.listNFT("dave", tokenId, Money.of(5)),
                    ErrorCode.INVALID_INPUT, "Price cannot be less than mint price");
            assertThat(marketplace.listings(tokenId).getSeller()).isEqualTo("alice");

            Listing relisted = marketplace.listNFT("dave", tokenId, Money.of(40));
            fx.ledgerLog.commit();

            assertThat(relisted.getSeller()).isEqualTo("dave");
            assertThat(marketplace.listings(tokenId).getPrice()).isEqualTo(Money.of(40));
            assertThat(fx.committedEventTypes()).endsWith(
                    EventType.NFT_TRANSFERRED, EventType.NFT_LISTING_DELETED, EventType.NFT_LISTED);

            marketplace.buyNFT("bob", tokenId, Money.of(40));
            assertThat(fx.registry.ownerOf(tokenId)).isEqualTo("bob");
            assertThat(funds.balanceOf("dave")).isEqualTo(Money.of(40));
        }

        @Test
        void newOwnerMayAuctionTokenWithStaleListing() {
            fx.registry.transferNFT("alice", tokenId, "dave");

            marketplace.createAuction("dave", tokenId, Money.of(10), HOUR);

            assertThat(marketplace.listings(tokenId).isActive()).isFalse();
            assertThat(marketplace.tokenState(tokenId)).isEqualTo(TokenState.AUCTIONED);
        }

        @Test
        void proceedsForRefusingSellerBecomePendingCredit() {
            funds.setReceiving("alice", false);

            marketplace.buyNFT("bob", tokenId, Money.of(20));

            assertThat(fx.registry.ownerOf(tokenId)).isEqualTo("bob");
            assertThat(funds.balanceOf("alice")).isEqualTo(Money.ZERO);
            assertThat(funds.pendingCreditOf("alice")).isEqualTo(Money.of(20));

            funds.setReceiving("alice", true);
            assertThat(funds.claimPendingCredit("alice")).isEqualTo(Money.of(20));
            assertThat(funds.balanceOf("alice")).isEqualTo(Money.of(20));
        }

        @Test
        void excessForRefusingBuyerBecomesPendingCredit() {
            funds.setReceiving("bob", false);

            marketplace.buyNFT("bob", tokenId, Money.of(30));

            assertThat(fx.registry.ownerOf(tokenId)).isEqualTo("bob");
            assertThat(funds.balanceOf("bob")).isEqualTo(Money.of(70));
            assertThat(funds.pendingCreditOf("bob")).isEqualTo(Money.of(10));
        }

        @Test
        void newOwnerCanRelist() {
            marketplace.buyNFT("bob", tokenId, Money.of(20));

            Listing relisted = marketplace.listNFT("bob", tokenId, Money.of(50));

            assertThat(relisted.getSeller()).isEqualTo("bob");
            assertRejected(() -> marketplace.listNFT("alice", tokenId, Money.of(50)),
                    ErrorCode.UNAUTHORIZED, "Not token owner");
        }
    }

    @Nested
    class Auctions {

        @Test
        void createAuctionValidatesBidAndDuration() {
            assertRejected(() -> marketplace.createAuction("bob", tokenId, Money.of(10), HOUR),
                    ErrorCode.UNAUTHORIZED, "Not token owner");
            assertRejected(() -> marketplace.createAuction("alice", tokenId, Money.ZERO, HOUR),
                    ErrorCode.INVALID_INPUT, "Starting bid must be greater than 0");
            assertRejected(() -> marketplace.createAuction("alice", tokenId, Money.of(5), HOUR),
                    ErrorCode.INVALID_INPUT, "Starting bid cannot be less than mint price");
            assertRejected(() -> marketplace.createAuction("alice", tokenId, Money.of(10), 0),
                    ErrorCode.INVALID_INPUT, "Duration must be greater than 0");
            assertRejected(() -> marketplace.createAuction("alice", tokenId, Money.of(10), Long.MAX_VALUE),
                    ErrorCode.INVALID_INPUT, "Duration is too long");
            assertThat(marketplace.tokenState(tokenId)).isEqualTo(TokenState.NONE);

            Auction auction = marketplace.createAuction("alice", tokenId, Money.of(10), HOUR);

            assertThat(auction.isActive()).isTrue();
            assertThat(auction.getHighestBid()).isEqualTo(Money.of(10));
            assertThat(auction.hasBidder()).isFalse();
            assertThat(auction.getEndTime()).isEqualTo(LedgerFixture.START.plusSeconds(HOUR));
            assertThat(marketplace.tokenState(tokenId)).isEqualTo(TokenState.AUCTIONED);
        }

        @Test
        void bidMustBeatHighestBid() {
            marketplace.createAuction("alice", tokenId, Money.of(10), HOUR);

            assertRejected(() -> marketplace.placeBid("bob", tokenId, Money.of(10)), ErrorCode.INVALID_INPUT, "Bid too low");

            marketplace.placeBid("bob", tokenId, Money.of(15));
            assertRejected(() -> marketplace.placeBid("carol", tokenId, Money.of(15)),
                    ErrorCode.INVALID_INPUT, "Bid too low");
        }

        @Test
        void bidsRejectedForCreatorMissingAuctionAndShortBalance() {
            assertRejected(() -> marketplace.placeBid("bob", tokenId, Money.of(15)),
                    ErrorCode.INVALID_STATE, "Auction is not active");

            marketplace.createAuction("alice", tokenId, Money.of(10), HOUR);

            assertRejected(() -> marketplace.placeBid("alice", tokenId, Money.of(15)),
                    ErrorCode.INVALID_INPUT, "Creator cannot bid on own auction");
            assertRejected(() -> marketplace.placeBid("bob", tokenId, Money.of(150)),
                    ErrorCode.INVALID_INPUT, "Insufficient balance");
        }

        @Test
        void auctionEndsExactlyAtEndTime() {
            marketplace.createAuction("alice", tokenId, Money.of(10), HOUR);
            fx.clock.advance(Duration.ofSeconds(HOUR - 1));
            marketplace.placeBid("bob", tokenId, Money.of(15));

            fx.clock.advance(Duration.ofSeconds(1));

            assertRejected(() -> marketplace.placeBid("carol", tokenId, Money.of(20)),
                    ErrorCode.INVALID_STATE, "Auction has ended");
        }

        @Test
        void outbidBidderIsRefundedAndEscrowHoldsOnlyHighestBid() {
            marketplace.createAuction("alice", tokenId, Money.of(10), HOUR);

            marketplace.placeBid("bob", tokenId, Money.of(20));
            assertThat(funds.balanceOf("bob")).isEqualTo(Money.of(80));
            assertThat(funds.escrowBalance()).isEqualTo(Money.of(20));

            marketplace.placeBid("carol", tokenId, Money.of(25));

            assertThat(funds.balanceOf("bob")).isEqualTo(Money.of(100));
            assertThat(funds.balanceOf("carol")).isEqualTo(Money.of(75));
            assertThat(funds.escrowBalance()).isEqualTo(Money.of(25));
            assertThat(marketplace.escrowedBids()).isEqualTo(funds.escrowBalance());

            AuctionStatus status = marketplace.checkAuctionStatus(tokenId);
            assertThat(status.isActive()).isTrue();
            assertThat(status.getHighestBid()).isEqualTo(Money.of(25));
            assertThat(status.getHighestBidder()).isEqualTo("carol");
        }

        @Test
        void refusedRefundDoesNotBlockNewBid() {
            marketplace.createAuction("alice", tokenId, Money.of(10), HOUR);
            marketplace.placeBid("bob", tokenId, Money.of(20));
            funds.setReceiving("bob", false);

            marketplace.placeBid("carol", tokenId, Money.of(25));
            fx.ledgerLog.commit();

            assertThat(marketplace.checkAuctionStatus(tokenId).getHighestBidder()).isEqualTo("carol");
            assertThat(funds.balanceOf("bob")).isEqualTo(Money.of(80));
            assertThat(funds.pendingCreditOf("bob")).isEqualTo(Money.of(20));
            assertThat(funds.escrowBalance()).isEqualTo(Money.of(25));
            assertThat(fx.committedEventTypes()).endsWith(EventType.BID_PLACED, EventType.REFUND_DEFERRED);
        }

        @Test
        void finalizeTransfersTokenAndPaysCreator() {
            marketplace.createAuction("alice", tokenId, Money.of(10), HOUR);
            marketplace.placeBid("bob", tokenId, Money.of(20));
            marketplace.placeBid("carol", tokenId, Money.of(30));

            assertRejected(() -> marketplace.finalizeAuction("bob", tokenId),
                    ErrorCode.INVALID_STATE, "Auction is still active");

            fx.clock.advance(Duration.ofSeconds(HOUR));
            Auction closed = marketplace.finalizeAuction("bob", tokenId);
            fx.ledgerLog.commit();

            assertThat(closed.isActive()).isFalse();
            assertThat(fx.registry.ownerOf(tokenId)).isEqualTo("carol");
            assertThat(funds.balanceOf("alice")).isEqualTo(Money.of(30));
            assertThat(funds.balanceOf("carol")).isEqualTo(Money.of(70));
            assertThat(funds.escrowBalance()).isEqualTo(Money.ZERO);
            assertThat(marketplace.tokenState(tokenId)).isEqualTo(TokenState.NONE);
            assertThat(marketplace.checkAuctionStatus(tokenId).isActive()).isFalse();
            assertThat(fx.committedEventTypes()).endsWith(EventType.NFT_TRANSFERRED, EventType.NFT_SOLD);

            assertRejected(() -> marketplace.finalizeAuction("bob", tokenId),
                    ErrorCode.INVALID_STATE, "Auction is not active");
        }

        @Test
        void finalizeWithoutBidsCancelsAndKeepsOwner() {
            marketplace.createAuction("alice", tokenId, Money.of(10), HOUR);
            fx.clock.advance(Duration.ofHours(2));

            marketplace.finalizeAuction("alice", tokenId);
            fx.ledgerLog.commit();

            assertThat(fx.registry.ownerOf(tokenId)).isEqualTo("alice");
            assertThat(marketplace.tokenState(tokenId)).isEqualTo(TokenState.NONE);
            assertThat(fx.committedEventTypes()).endsWith(EventType.AUCTION_CANCELLED);

            marketplace.createAuction("alice", tokenId, Money.of(12), HOUR);
            assertThat(marketplace.auctions(tokenId).getStartingBid()).isEqualTo(Money.of(12));
        }

        @Test
        void finalizeRefundsWinnerWhenCreatorNoLongerOwnsToken() {
            marketplace.createAuction("alice", tokenId, Money.of(10), HOUR);
            marketplace.placeBid("bob", tokenId, Money.of(20));
            fx.registry.transferNFT("alice", tokenId, "dave");
            fx.clock.advance(Duration.ofSeconds(HOUR));

            marketplace.finalizeAuction("carol", tokenId);
            fx.ledgerLog.commit();

            assertThat(fx.registry.ownerOf(tokenId)).isEqualTo("dave");
            assertThat(funds.balanceOf("bob")).isEqualTo(Money.of(100));
            assertThat(funds.balanceOf("alice")).isEqualTo(Money.ZERO);
            assertThat(funds.escrowBalance()).isEqualTo(Money.ZERO);
            assertThat(fx.committedEventTypes()).endsWith(EventType.AUCTION_CANCELLED);
        }

        @Test
        void creatorPolicyRestrictsFinalization() {
            fx.close();
            fx = new LedgerFixture(FinalizePolicy.CREATOR);
            marketplace = fx.marketplace;
            fx.registry.createCollection("alice", "Apes");
            long id = fx.registry.mintNFT("alice", 1, "Ape", Money.of(1));
            marketplace.createAuction("alice", id, Money.of(1), HOUR);
            fx.clock.advance(Duration.ofSeconds(HOUR));

            assertRejected(() -> marketplace.finalizeAuction("bob", id),
                    ErrorCode.UNAUTHORIZED, "Not authorized to finalize auction");
            assertThat(marketplace.finalizeAuction("alice", id).isActive()).isFalse();
        }
    }

    @Test
    void verifyOwnershipIsFalseForUnknownToken() {
        assertThat(marketplace.verifyNFTOwnership(tokenId, "alice")).isTrue();
        assertThat(marketplace.verifyNFTOwnership(tokenId, "bob")).isFalse();
        assertThat(marketplace.verifyNFTOwnership(99, "alice")).isFalse();
    }

    @Test
    void unknownTokenReadsAsEmptyListingAndAuction() {
        assertThat(marketplace.listings(99)).isSameAs(Listing.EMPTY);
        assertThat(marketplace.auctions(99)).isSameAs(Auction.EMPTY);
        assertThat(marketplace.checkAuctionStatus(99).isActive()).isFalse();
        assertThat(marketplace.checkAuctionStatus(99).getHighestBid()).isEqualTo(Money.ZERO);
        assertThat(marketplace.checkAuctionStatus(99).getHighestBidder()).isNull();
    }
}
