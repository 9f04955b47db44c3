package com.fintech.permits.service;

import com.fintech.permits.exception.GatewayException;
import com.fintech.permits.exception.TransientGatewayException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs outbound calls under a named Resilience4j {@link TimeLimiter}.
 * <p>
 * A call past its deadline is abandoned and reported as a {@link TransientGatewayException},
 * as is any non-gateway failure. Gateway exceptions pass through unchanged.
 */
@Component
@Slf4j
public class OutboundCallGuard {

    private final TimeLimiterRegistry timeLimiterRegistry;
    private final Executor outboundCallExecutor;

    public OutboundCallGuard(TimeLimiterRegistry timeLimiterRegistry,
                             @Qualifier("outboundCallExecutor") Executor outboundCallExecutor) {
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.outboundCallExecutor = outboundCallExecutor;
    }

    public <T> T call(String limiterName, String backendName, String reference, Supplier<T> call) {
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(limiterName);
        try {
            return timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(call, outboundCallExecutor));
        } catch (GatewayException e) {
            throw e;
        } catch (TimeoutException e) {
            log.warn("{} call for {} timed out after {}", backendName, reference,
                    timeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            throw new TransientGatewayException(backendName + " did not respond in time", backendName, reference, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientGatewayException(backendName + " call interrupted", backendName, reference, e);
        } catch (Exception e) {
            throw new TransientGatewayException(backendName + " call failed: " + e.getMessage(),
                    backendName, reference, e);
        }
    }
}
