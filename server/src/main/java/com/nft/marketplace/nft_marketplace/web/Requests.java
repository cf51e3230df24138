package com.nft.marketplace.nft_marketplace.web;

import com.nft.marketplace.nft_marketplace.entity.Money;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Request bodies of the HTTP API.
 */
public final class Requests {

    private Requests() {
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class CreateCollection {
        private String name;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Mint {
        private String name;
        private Money price;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Transfer {
        private String to;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class ListForSale {
        private Money price;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Payment {
        private Money payment;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class CreateAuction {
        private Money startingBid;
        private long durationSeconds;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Amount {
        private Money amount;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Receiving {
        private boolean receiving;
    }
}
