package com.tradeguard.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manual circuit breaker engagement or release. A blank or {@code *} scope means every symbol.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircuitBreakerRequest {

    private String scope;

    @NotBlank
    private String operator;

    /** Required on engage. On release, lifts only this reason; blank lifts every breaker on the scope. */
    private String reason;
}
