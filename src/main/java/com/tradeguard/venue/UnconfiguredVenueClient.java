package com.tradeguard.venue;

import com.tradeguard.exception.VenueException;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stand-in used when no venue adapter bean is present. DRY_RUN and PAPER work normally; every
 * LIVE request fails with a {@link VenueException}, which the dispatcher reports as {@code venue_error}.
 */
public class UnconfiguredVenueClient implements VenueClient {

    private static final Logger log = LoggerFactory.getLogger(UnconfiguredVenueClient.class);

    @Override
    public VenueAck placeOrder(OrderPlacement placement) {
        throw new VenueException("No venue adapter configured; cannot place " + placement.getClientId());
    }

    @Override
    public void cancelOrder(String venueId) {
        throw new VenueException("No venue adapter configured; cannot cancel " + venueId);
    }

    @Override
    public Optional<VenueOrderStatus> getOrderStatus(String clientId) {
        throw new VenueException("No venue adapter configured; cannot query " + clientId);
    }

    @Override
    public List<VenueOrderStatus> openOrders() {
        return List.of();
    }

    @Override
    public void reconnect() {
        log.debug("Reconnect requested but no venue adapter is configured");
    }
}
