package com.tradeguard.execution;

import com.tradeguard.domain.model.OrderIntent;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * LIVE placements whose acknowledgement timed out, keyed by client id. The intent is kept so the
 * order can be registered if the venue later turns out to have it.
 */
@Component
public class IndeterminateOrders {

    private final Map<String, OrderIntent> pending = new ConcurrentHashMap<>();

    void add(String clientId, OrderIntent intent) {
        pending.put(clientId, intent);
    }

    public Optional<OrderIntent> get(String clientId) {
        return Optional.ofNullable(pending.get(clientId));
    }

    public Optional<OrderIntent> remove(String clientId) {
        return Optional.ofNullable(pending.remove(clientId));
    }

    public boolean contains(String clientId) {
        return pending.containsKey(clientId);
    }

    /** Notional of every pending intent. The venue may hold any of them, so each counts as exposure. */
    public BigDecimal pendingNotional() {
        return pending.values().stream()
                .map(OrderIntent::getNotional)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public Set<String> clientIds() {
        return Set.copyOf(pending.keySet());
    }
}
