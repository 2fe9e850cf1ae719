package com.nosota.unipay.marketplace;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.Optional;

/**
 * Listing catalog backed by the marketplace listing service over HTTP.
 * <p>
 * Lookups that fail (service down, timeout, 5xx) are reported as an unknown listing, so an order
 * is never created against a listing whose availability could not be confirmed.
 * </p>
 */
@Component
@Slf4j
public class HttpListingCatalog implements ListingCatalog {

    private final WebClient webClient;
    private final Duration timeout;

    public HttpListingCatalog(WebClient.Builder webClientBuilder,
                              @Value("${marketplace.listing-service.url}") String baseUrl,
                              @Value("${marketplace.listing-service.timeout:PT3S}") Duration timeout) {
        this.webClient = webClientBuilder.baseUrl(baseUrl).build();
        this.timeout = timeout;
    }

    @Override
    public Optional<ListingInfo> findListing(String listingId) {
        log.debug("Looking up listing: listingId={}", listingId);
        try {
            ListingInfo listing = webClient.get()
                    .uri("/api/v1/listings/{listingId}", listingId)
                    .retrieve()
                    .bodyToMono(ListingInfo.class)
                    .block(timeout);
            return Optional.ofNullable(listing);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
                log.info("Listing not found: listingId={}", listingId);
            } else {
                log.warn("Listing lookup failed: listingId={}, status={}", listingId, e.getStatusCode());
            }
            return Optional.empty();
        } catch (WebClientRequestException | IllegalStateException e) {
            // IllegalStateException: block() timed out
            log.warn("Listing service unreachable: listingId={}, cause={}", listingId, e.getMessage());
            return Optional.empty();
        }
    }
}
