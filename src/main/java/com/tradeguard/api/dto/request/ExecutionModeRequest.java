package com.tradeguard.api.dto.request;

import com.tradeguard.domain.enums.ExecutionMode;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionModeRequest {

    @NotNull
    private ExecutionMode mode;
}
