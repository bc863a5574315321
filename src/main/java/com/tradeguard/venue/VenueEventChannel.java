package com.tradeguard.venue;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded hand-off from the venue adapter's threads to the single writer that applies events.
 *
 * <p>When the writer falls behind, {@link #publish} blocks the adapter thread rather than dropping
 * events: a dropped fill would desynchronise the tracker.
 */
public class VenueEventChannel {

    private static final Logger log = LoggerFactory.getLogger(VenueEventChannel.class);

    private final BlockingQueue<VenueEvent> queue;
    private final int capacity;

    public VenueEventChannel(int capacity) {
        this.capacity = capacity;
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    /** Enqueues an event, waiting for space if the channel is full. */
    public void publish(VenueEvent event) throws InterruptedException {
        if (!queue.offer(event)) {
            log.warn("Venue event channel full ({}); adapter thread waiting", capacity);
            queue.put(event);
        }
    }

    /** Waits up to the timeout for the next event; null on timeout. */
    public VenueEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /** Next event if one is already queued, without waiting. */
    public VenueEvent pollNow() {
        return queue.poll();
    }

    public int size() {
        return queue.size();
    }

    public int getCapacity() {
        return capacity;
    }
}
