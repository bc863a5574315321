package com.tradeguard.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Manual kill switch clear. Both fields end up in the audit trail.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KillSwitchClearRequest {

    @NotBlank
    private String operator;

    /** Why trading is safe to resume. */
    @NotBlank
    private String note;
}
