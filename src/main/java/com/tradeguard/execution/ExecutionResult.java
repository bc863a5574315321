package com.tradeguard.execution;

import com.tradeguard.domain.enums.ExecutionMode;
import com.tradeguard.domain.enums.ExecutionStatus;
import com.tradeguard.domain.model.Order;
import com.tradeguard.risk.RiskViolation;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * What {@code ExecutionDispatcher.execute} did with one decision.
 *
 * <p>{@code order} is a snapshot taken when the call returned; later venue events do not change it.
 * It is null for DRY_RUN, for rejections that never reached the venue and for indeterminate placements.
 */
@Getter
@Builder
public class ExecutionResult {

    private final ExecutionStatus status;
    private final ExecutionMode mode;

    /** Generated client id. Null when rejected before an id was assigned. */
    private final String clientOrderId;

    private final Order order;

    @Builder.Default
    private final List<RiskViolation> rejectionReasons = List.of();

    private final String message;

    public static ExecutionResult rejected(ExecutionMode mode, String clientOrderId, List<RiskViolation> reasons) {
        return ExecutionResult.builder()
                .status(ExecutionStatus.REJECTED)
                .mode(mode)
                .clientOrderId(clientOrderId)
                .rejectionReasons(List.copyOf(reasons))
                .message(reasons.toString())
                .build();
    }

    public static ExecutionResult venueError(ExecutionMode mode, String clientOrderId, String message) {
        return rejected(mode, clientOrderId, List.of(RiskViolation.of(RiskViolation.VENUE_ERROR, message)));
    }

    public static ExecutionResult indeterminate(String clientOrderId, String message) {
        return ExecutionResult.builder()
                .status(ExecutionStatus.INDETERMINATE)
                .mode(ExecutionMode.LIVE)
                .clientOrderId(clientOrderId)
                .message(message)
                .build();
    }

    public boolean isRejected() {
        return status == ExecutionStatus.REJECTED;
    }

    public List<String> reasonCodes() {
        return rejectionReasons.stream().map(RiskViolation::getCode).toList();
    }
}
