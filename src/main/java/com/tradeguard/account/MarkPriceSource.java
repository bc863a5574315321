package com.tradeguard.account;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Last known mark price per symbol, fed by the market data collaborator.
 */
public interface MarkPriceSource {

    Optional<BigDecimal> lastPrice(String symbol);
}
