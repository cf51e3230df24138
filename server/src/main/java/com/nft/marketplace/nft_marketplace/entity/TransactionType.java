package com.nft.marketplace.nft_marketplace.entity;

public enum TransactionType {
    DEPOSIT,
    WITHDRAWAL,
    PURCHASE,        // buyer pays into custody
    SALE_PROCEEDS,   // listing price to seller
    EXCESS_REFUND,   // overpayment back to buyer
    ESCROW,          // bid moved into escrow
    BID_REFUND,      // outbid amount back to bidder
    AUCTION_PROCEEDS,
    PENDING_CREDIT,  // push refused, held as withdrawable credit
    CREDIT_CLAIM
}
