package com.tradeguard.api.controller;

import com.tradeguard.domain.model.Fill;
import com.tradeguard.domain.model.Order;
import com.tradeguard.exception.ResourceNotFoundException;
import com.tradeguard.execution.ExecutionDispatcher;
import com.tradeguard.oms.OrderStats;
import com.tradeguard.oms.OrderTracker;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST endpoints for tracked orders.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/orders/open -- working orders in submission order</li>
 *   <li>GET /api/orders/stats -- counts by state, filled notional, commission</li>
 *   <li>GET /api/orders/{clientId} -- one order</li>
 *   <li>GET /api/orders/{clientId}/fills -- fills in delivery order</li>
 *   <li>DELETE /api/orders/{clientId} -- request cancellation</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/orders")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final OrderTracker orderTracker;
    private final ExecutionDispatcher executionDispatcher;

    public OrderController(OrderTracker orderTracker, ExecutionDispatcher executionDispatcher) {
        this.orderTracker = orderTracker;
        this.executionDispatcher = executionDispatcher;
    }

    @GetMapping("/open")
    public ResponseEntity<List<Order>> getOpenOrders() {
        return ResponseEntity.ok(orderTracker.openOrders());
    }

    @GetMapping("/stats")
    public ResponseEntity<OrderStats> getStats() {
        return ResponseEntity.ok(orderTracker.stats());
    }

    @GetMapping("/{clientId}")
    public ResponseEntity<Order> getOrder(@PathVariable String clientId) {
        return ResponseEntity.ok(
                orderTracker.get(clientId).orElseThrow(() -> ResourceNotFoundException.order(clientId)));
    }

    @GetMapping("/{clientId}/fills")
    public ResponseEntity<List<Fill>> getFills(@PathVariable String clientId) {
        if (orderTracker.get(clientId).isEmpty()) {
            throw ResourceNotFoundException.order(clientId);
        }
        return ResponseEntity.ok(orderTracker.fills(clientId));
    }

    /**
     * Requests cancellation. LIVE orders are returned unchanged; the CANCELLED state arrives with the
     * venue's confirmation.
     */
    @DeleteMapping("/{clientId}")
    public ResponseEntity<Order> cancelOrder(@PathVariable String clientId) {
        log.info("Cancel requested via API: {}", clientId);
        return ResponseEntity.ok(executionDispatcher.cancel(clientId));
    }
}
