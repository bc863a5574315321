package com.tradeguard.api.controller;

import com.tradeguard.api.dto.request.ExecutionModeRequest;
import com.tradeguard.domain.enums.ExecutionMode;
import com.tradeguard.domain.model.Order;
import com.tradeguard.execution.ExecutionDispatcher;
import com.tradeguard.execution.IndeterminateOrders;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for the dispatcher: execution mode and indeterminate placements.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/execution/mode</li>
 *   <li>PUT /api/execution/mode -- applies to new decisions only</li>
 *   <li>GET /api/execution/indeterminate -- LIVE placements awaiting resolution</li>
 *   <li>POST /api/execution/indeterminate/{clientId}/resolve -- status query against the venue</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/execution")
public class ExecutionController {

    private static final Logger log = LoggerFactory.getLogger(ExecutionController.class);

    private final ExecutionDispatcher executionDispatcher;
    private final IndeterminateOrders indeterminateOrders;

    public ExecutionController(ExecutionDispatcher executionDispatcher, IndeterminateOrders indeterminateOrders) {
        this.executionDispatcher = executionDispatcher;
        this.indeterminateOrders = indeterminateOrders;
    }

    @GetMapping("/mode")
    public ResponseEntity<Map<String, ExecutionMode>> getMode() {
        return ResponseEntity.ok(Map.of("mode", executionDispatcher.getMode()));
    }

    @PutMapping("/mode")
    public ResponseEntity<Map<String, ExecutionMode>> setMode(@Valid @RequestBody ExecutionModeRequest request) {
        log.warn("Execution mode change requested via API: {}", request.getMode());
        executionDispatcher.setMode(request.getMode());
        return ResponseEntity.ok(Map.of("mode", executionDispatcher.getMode()));
    }

    @GetMapping("/indeterminate")
    public ResponseEntity<Set<String>> getIndeterminate() {
        return ResponseEntity.ok(indeterminateOrders.clientIds());
    }

    @PostMapping("/indeterminate/{clientId}/resolve")
    public ResponseEntity<Map<String, Object>> resolve(@PathVariable String clientId) {
        Optional<Order> order = executionDispatcher.resolveIndeterminate(clientId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("clientId", clientId);
        body.put("placed", order.isPresent());
        order.ifPresent(o -> body.put("order", o));
        return ResponseEntity.ok(body);
    }
}
