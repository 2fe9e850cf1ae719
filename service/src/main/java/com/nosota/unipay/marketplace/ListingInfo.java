package com.nosota.unipay.marketplace;

/**
 * Listing data the escrow needs from the marketplace catalog.
 *
 * @param listingId       Listing identifier
 * @param sellerOwnerId   Owner id of the seller
 * @param sellerAccountId Wallet receiving the money on release
 * @param available       Whether the listing can still be bought
 */
public record ListingInfo(
        String listingId,
        Long sellerOwnerId,
        Long sellerAccountId,
        boolean available
) {
}
