package com.tradeguard.venue;

import com.tradeguard.domain.model.Fill;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * One message from the venue stream. Order events identify the order by client id, venue id or both.
 */
@Value
@Builder
public class VenueEvent {

    VenueEventType type;
    String clientId;
    String venueId;

    /** Present on FILLED events only. */
    Fill fill;

    String reason;

    /** When the venue produced the event, if it says. Used for latency telemetry. */
    Instant venueTimestamp;

    public static VenueEvent acknowledged(String clientId, String venueId) {
        return VenueEvent.builder().type(VenueEventType.ACKNOWLEDGED).clientId(clientId).venueId(venueId).build();
    }

    public static VenueEvent filled(String clientId, String venueId, Fill fill) {
        return VenueEvent.builder()
                .type(VenueEventType.FILLED)
                .clientId(clientId)
                .venueId(venueId)
                .fill(fill)
                .venueTimestamp(fill.getTimestamp())
                .build();
    }

    public static VenueEvent cancelled(String clientId, String venueId) {
        return VenueEvent.builder().type(VenueEventType.CANCELLED).clientId(clientId).venueId(venueId).build();
    }

    public static VenueEvent rejected(String clientId, String venueId, String reason) {
        return VenueEvent.builder()
                .type(VenueEventType.REJECTED)
                .clientId(clientId)
                .venueId(venueId)
                .reason(reason)
                .build();
    }

    public static VenueEvent expired(String clientId, String venueId) {
        return VenueEvent.builder().type(VenueEventType.EXPIRED).clientId(clientId).venueId(venueId).build();
    }

    public static VenueEvent connectionUp() {
        return VenueEvent.builder().type(VenueEventType.CONNECTION_UP).build();
    }

    public static VenueEvent connectionDown(String reason) {
        return VenueEvent.builder().type(VenueEventType.CONNECTION_DOWN).reason(reason).build();
    }

    public static VenueEvent error(String reason) {
        return VenueEvent.builder().type(VenueEventType.ERROR).reason(reason).build();
    }
}
