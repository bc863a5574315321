package com.tradeguard.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manual kill switch activation. {@code confirm} must be the literal {@code CONFIRM} to guard against
 * accidental calls.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KillSwitchActivateRequest {

    @NotBlank
    @Pattern(regexp = "CONFIRM", message = "must be CONFIRM")
    private String confirm;

    @NotBlank
    private String operator;

    private String reason;
}
