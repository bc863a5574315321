package com.tradeguard.account;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory {@link MarkPriceSource}. The market data feed pushes prices with {@link #update}.
 */
public class MarkPriceBook implements MarkPriceSource {

    private final Map<String, BigDecimal> prices = new ConcurrentHashMap<>();

    public void update(String symbol, BigDecimal price) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Mark price must be positive for " + symbol + ", got " + price);
        }
        prices.put(symbol, price);
    }

    @Override
    public Optional<BigDecimal> lastPrice(String symbol) {
        return Optional.ofNullable(prices.get(symbol));
    }
}
