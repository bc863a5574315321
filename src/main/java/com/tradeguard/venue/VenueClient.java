package com.tradeguard.venue;

import com.tradeguard.exception.VenueException;
import com.tradeguard.exception.VenueTransientException;
import java.util.List;
import java.util.Optional;

/**
 * Request side of a venue connection. The asynchronous side (acknowledgements, fills, cancels,
 * connection state) is delivered by the adapter as {@link VenueEvent}s into the {@link VenueEventChannel}.
 *
 * <p>All methods throw {@link VenueTransientException} for network-class failures (timeouts, rate
 * limits, 5xx) and {@link VenueException} for definitive refusals.
 */
public interface VenueClient {

    /** Not idempotent. Never re-sent blindly after an ambiguous failure. */
    VenueAck placeOrder(OrderPlacement placement);

    /** Idempotent. Requests cancellation; confirmation arrives as a CANCELLED event. */
    void cancelOrder(String venueId);

    /** Idempotent. Empty if the venue has no order with this client id. */
    Optional<VenueOrderStatus> getOrderStatus(String clientId);

    /** Idempotent. Every order the venue still considers working. */
    List<VenueOrderStatus> openOrders();

    /** Asks the adapter to re-establish the event stream. */
    void reconnect();
}
