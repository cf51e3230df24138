package com.nft.marketplace.nft_marketplace.web;

import java.security.Principal;
import java.util.List;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.nft.marketplace.nft_marketplace.entity.Auction;
import com.nft.marketplace.nft_marketplace.entity.AuctionStatus;
import com.nft.marketplace.nft_marketplace.entity.LedgerEvent;
import com.nft.marketplace.nft_marketplace.entity.Listing;
import com.nft.marketplace.nft_marketplace.service.MarketplaceService;

import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/api/marketplace")
@RequiredArgsConstructor
public class MarketplaceController {

    private final MarketplaceService marketplaceService;

    @PostMapping("/listings/{tokenId}")
    @ResponseStatus(HttpStatus.CREATED)
    public Listing list(Principal caller, @PathVariable long tokenId, @RequestBody Requests.ListForSale request) {
        return marketplaceService.listNFT(caller.getName(), tokenId, request.getPrice());
    }

    @DeleteMapping("/listings/{tokenId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void cancelListing(Principal caller, @PathVariable long tokenId) {
        marketplaceService.cancelListing(caller.getName(), tokenId);
    }

    @GetMapping("/listings/{tokenId}")
    public Listing listing(@PathVariable long tokenId) {
        return marketplaceService.listings(tokenId);
    }

    @GetMapping("/listings")
    public List<Listing> activeListings() {
        return marketplaceService.activeListings();
    }

    @PostMapping("/listings/{tokenId}/buy")
    public Map<String, Object> buy(Principal caller, @PathVariable long tokenId, @RequestBody Requests.Payment request) {
        marketplaceService.buyNFT(caller.getName(), tokenId, request.getPayment());
        return Map.of("tokenId", tokenId, "owner", caller.getName());
    }

    @PostMapping("/auctions/{tokenId}")
    @ResponseStatus(HttpStatus.CREATED)
    public Auction createAuction(Principal caller, @PathVariable long tokenId, @RequestBody Requests.CreateAuction request) {
        return marketplaceService.createAuction(
                caller.getName(), tokenId, request.getStartingBid(), request.getDurationSeconds());
    }

    @PostMapping("/auctions/{tokenId}/bids")
    public AuctionStatus placeBid(Principal caller, @PathVariable long tokenId, @RequestBody Requests.Payment request) {
        return AuctionStatus.of(marketplaceService.placeBid(caller.getName(), tokenId, request.getPayment()));
    }

    @PostMapping("/auctions/{tokenId}/finalize")
    public Auction finalizeAuction(Principal caller, @PathVariable long tokenId) {
        return marketplaceService.finalizeAuction(caller.getName(), tokenId);
    }

    @GetMapping("/auctions/{tokenId}")
    public Auction auction(@PathVariable long tokenId) {
        return marketplaceService.auctions(tokenId);
    }

    @GetMapping("/auctions/{tokenId}/status")
    public AuctionStatus auctionStatus(@PathVariable long tokenId) {
        return marketplaceService.checkAuctionStatus(tokenId);
    }

    @GetMapping("/auctions")
    public List<Auction> activeAuctions() {
        return marketplaceService.activeAuctions();
    }

    @GetMapping("/nfts/{tokenId}/owned-by/{address}")
    public Map<String, Boolean> verifyOwnership(@PathVariable long tokenId, @PathVariable String address) {
        return Map.of("owner", marketplaceService.verifyNFTOwnership(tokenId, address));
    }

    @GetMapping("/nfts/{tokenId}/state")
    public Map<String, Object> tokenState(@PathVariable long tokenId) {
        return Map.of("tokenId", tokenId, "state", marketplaceService.tokenState(tokenId));
    }

    @GetMapping("/events")
    public List<LedgerEvent> events(@RequestParam(defaultValue = "0") long since) {
        return marketplaceService.eventsSince(since);
    }
}
