package com.tradeguard.execution;

import com.tradeguard.venue.VenueClient;
import com.tradeguard.venue.VenueOrderStatus;
import io.github.resilience4j.retry.Retry;
import java.util.List;
import java.util.Optional;

/**
 * The idempotent subset of {@link VenueClient}, wrapped in a Resilience4j {@link Retry} that backs off
 * exponentially with jitter on transient venue failures. Placement is deliberately absent: it is
 * never retried.
 */
public class RetryingVenueOperations {

    private final VenueClient venueClient;
    private final Retry retry;

    public RetryingVenueOperations(VenueClient venueClient, Retry retry) {
        this.venueClient = venueClient;
        this.retry = retry;
    }

    public Optional<VenueOrderStatus> getOrderStatus(String clientId) {
        return retry.executeSupplier(() -> venueClient.getOrderStatus(clientId));
    }

    public void cancelOrder(String venueId) {
        retry.executeRunnable(() -> venueClient.cancelOrder(venueId));
    }

    public List<VenueOrderStatus> openOrders() {
        return retry.executeSupplier(venueClient::openOrders);
    }
}
