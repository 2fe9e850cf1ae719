package com.nosota.unipay.marketplace;

import java.util.Optional;

/**
 * Marketplace catalog consulted when a buyer commits to a listing.
 */
public interface ListingCatalog {

    /**
     * @return the listing, empty if it does not exist or cannot be looked up right now
     */
    Optional<ListingInfo> findListing(String listingId);
}
