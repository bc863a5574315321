package com.tradeguard.config;

import com.tradeguard.account.AccountStateProvider;
import com.tradeguard.account.LedgerAccountStateProvider;
import com.tradeguard.account.MarkPriceBook;
import com.tradeguard.domain.enums.ExecutionMode;
import com.tradeguard.exception.VenueTransientException;
import com.tradeguard.execution.ExecutionSettings;
import com.tradeguard.execution.FixedBpsSlippageModel;
import com.tradeguard.execution.RetryingVenueOperations;
import com.tradeguard.execution.SlippageModel;
import com.tradeguard.oms.PositionLedger;
import com.tradeguard.venue.UnconfiguredVenueClient;
import com.tradeguard.venue.VenueClient;
import com.tradeguard.venue.VenueEventChannel;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.math.BigDecimal;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Dispatcher settings, the retry policy for idempotent venue calls and the default collaborators
 * (venue client, mark prices, account view) used when nothing more specific is configured.
 *
 * <p>Properties prefix: {@code tradeguard.execution.*}
 */
@Configuration
public class ExecutionConfig {

    private static final Logger log = LoggerFactory.getLogger(ExecutionConfig.class);

    @Bean
    public ExecutionSettings executionSettings(
            @Value("${tradeguard.execution.default-mode:DRY_RUN}") ExecutionMode defaultMode,
            @Value("${tradeguard.execution.ack-timeout:5s}") Duration ackTimeout,
            @Value("${tradeguard.execution.leverage:1}") BigDecimal leverage,
            @Value("${tradeguard.execution.quantity-scale:8}") int quantityScale,
            @Value("${tradeguard.execution.placement-failure-threshold:3}") int placementFailureThreshold,
            @Value("${tradeguard.execution.retry.max-attempts:4}") int retryMaxAttempts,
            @Value("${tradeguard.execution.retry.base-delay:200ms}") Duration retryBaseDelay,
            @Value("${tradeguard.execution.retry.multiplier:2.0}") double retryMultiplier,
            @Value("${tradeguard.execution.retry.jitter:0.2}") double retryJitter,
            @Value("${tradeguard.execution.paper.slippage-bps:5}") BigDecimal paperSlippageBps,
            @Value("${tradeguard.execution.paper.commission-bps:10}") BigDecimal paperCommissionBps,
            @Value("${tradeguard.execution.paper.fill-ratio:1}") BigDecimal paperFillRatio,
            @Value("${tradeguard.execution.paper.commission-asset:USD}") String commissionAsset) {
        return ExecutionSettings.builder()
                .defaultMode(defaultMode)
                .ackTimeout(ackTimeout)
                .leverage(leverage)
                .quantityScale(quantityScale)
                .placementFailureThreshold(placementFailureThreshold)
                .retryMaxAttempts(retryMaxAttempts)
                .retryBaseDelay(retryBaseDelay)
                .retryMultiplier(retryMultiplier)
                .retryJitter(retryJitter)
                .paperSlippageBps(paperSlippageBps)
                .paperCommissionBps(paperCommissionBps)
                .paperFillRatio(paperFillRatio)
                .commissionAsset(commissionAsset)
                .build();
    }

    /**
     * Exponential backoff with jitter for status, cancel and open-order queries. Only transient venue
     * failures are retried; definitive refusals surface at once.
     */
    @Bean
    public Retry venueRetry(ExecutionSettings settings) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getRetryMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        settings.getRetryBaseDelay(), settings.getRetryMultiplier(), settings.getRetryJitter()))
                .retryExceptions(VenueTransientException.class)
                .build();
        Retry retry = Retry.of("venue", config);
        retry.getEventPublisher()
                .onRetry(event -> log.warn(
                        "Venue call retry {} in {}ms: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "-"));
        return retry;
    }

    @Bean
    @ConditionalOnMissingBean(VenueClient.class)
    public VenueClient venueClient() {
        return new UnconfiguredVenueClient();
    }

    @Bean
    public RetryingVenueOperations retryingVenueOperations(VenueClient venueClient, Retry venueRetry) {
        return new RetryingVenueOperations(venueClient, venueRetry);
    }

    @Bean
    public VenueEventChannel venueEventChannel(
            @Value("${tradeguard.execution.event-channel-capacity:10000}") int capacity) {
        return new VenueEventChannel(capacity);
    }

    @Bean
    public MarkPriceBook markPriceBook() {
        return new MarkPriceBook();
    }

    @Bean
    @ConditionalOnMissingBean(AccountStateProvider.class)
    public AccountStateProvider accountStateProvider(
            @Value("${tradeguard.account.starting-equity:10000}") BigDecimal startingEquity,
            PositionLedger positionLedger,
            MarkPriceBook markPriceBook) {
        return new LedgerAccountStateProvider(startingEquity, positionLedger, markPriceBook);
    }

    @Bean
    public SlippageModel slippageModel(ExecutionSettings settings) {
        return new FixedBpsSlippageModel(settings.getPaperSlippageBps());
    }
}
