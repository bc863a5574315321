package com.tradeguard.venue;

import java.time.Instant;

/**
 * Venue acknowledgement of a placed order.
 */
public record VenueAck(String clientId, String venueId, Instant acceptedAt) {}
