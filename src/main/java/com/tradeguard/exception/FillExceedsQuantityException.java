package com.tradeguard.exception;

import java.math.BigDecimal;

public class FillExceedsQuantityException extends OrderTrackingException {

    public FillExceedsQuantityException(String clientId, BigDecimal filled, BigDecimal fillQty, BigDecimal requested) {
        super(
                ErrorCode.FILL_EXCEEDS_QUANTITY,
                clientId,
                "Fill of " + fillQty.toPlainString() + " on order " + clientId + " would take filled quantity "
                        + filled.add(fillQty).toPlainString() + " past requested " + requested.toPlainString());
    }
}
