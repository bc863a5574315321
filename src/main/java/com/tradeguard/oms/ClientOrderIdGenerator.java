package com.tradeguard.oms;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Generates client order ids of the form {@code tg-<SYMBOL>-<epochMillis>-<seq>}.
 *
 * <p>The millisecond timestamp keeps ids unique across restarts and the process-wide sequence
 * keeps them unique within one millisecond. Symbols are upper-cased with non-alphanumerics
 * stripped so the id is safe for venues with restrictive id alphabets.
 */
@Component
public class ClientOrderIdGenerator {

    private static final Logger log = LoggerFactory.getLogger(ClientOrderIdGenerator.class);

    private static final String PREFIX = "tg";

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public ClientOrderIdGenerator(Clock clock) {
        this.clock = clock;
    }

    public String next(String symbol) {
        String id = String.format("%s-%s-%d-%d", PREFIX, sanitize(symbol), clock.millis(), sequence.incrementAndGet());
        log.debug("Generated client order id: {}", id);
        return id;
    }

    private static String sanitize(String symbol) {
        if (symbol == null || symbol.isEmpty()) {
            return "GEN";
        }
        return symbol.replaceAll("[^A-Za-z0-9]", "").toUpperCase();
    }
}
