package com.company.errorbudget.service;

import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.exception.StaleEvaluationException;
import com.company.errorbudget.exception.StorageUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

/**
 * Runs evaluation ticks with at most one in flight per service.
 *
 * <p>A tick requested while one is running is coalesced into a single queued rerun.
 * When the running tick has exceeded its timeout it is abandoned instead, and the
 * new tick starts right away; the abandoned tick's results are discarded before
 * anything is written. A tick that is already committing cannot be abandoned, so
 * the request queues behind it instead. Different services run in parallel on the
 * evaluation executor and share no state.
 */
@Component
@Slf4j
public class EvaluationScheduler {

    private final SloEvaluationService evaluationService;
    private final AlertManagerService alertManager;
    private final Executor evaluationExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Duration tickTimeout;
    private final int failureAlertThreshold;

    private final Map<Long, ServiceSlot> slots = new ConcurrentHashMap<>();

    public EvaluationScheduler(SloEvaluationService evaluationService,
                               AlertManagerService alertManager,
                               @Qualifier("evaluationExecutor") Executor evaluationExecutor,
                               MeterRegistry meterRegistry,
                               Clock clock,
                               @Value("${errorbudget.evaluation.tick-timeout-ms:30000}") long tickTimeoutMs,
                               @Value("${errorbudget.evaluation.failure-alert-threshold:3}") int failureAlertThreshold) {
        this.evaluationService = evaluationService;
        this.alertManager = alertManager;
        this.evaluationExecutor = evaluationExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.tickTimeout = Duration.ofMillis(tickTimeoutMs);
        this.failureAlertThreshold = failureAlertThreshold;
    }

    /**
     * Requests a tick for the service. The returned future completes with the
     * snapshots of the tick that actually ran on behalf of this request.
     */
    public CompletableFuture<List<BurnRateSnapshot>> submit(MonitoredService service) {
        ServiceSlot slot = slots.computeIfAbsent(service.getServiceId(), id -> new ServiceSlot());

        synchronized (slot) {
            slot.service = service;

            if (slot.inFlight == null) {
                return start(slot);
            }

            Instant now = Instant.now(clock);
            Duration running = Duration.between(slot.inFlight.getStartedAt(), now);

            if (running.compareTo(tickTimeout) > 0) {
                if (!slot.inFlight.abandon()) {
                    log.debug("Tick {} for {} is past its timeout but committing, queueing behind it",
                            slot.inFlight.getGeneration(), service.getName());
                    return queue(slot, service);
                }
                log.warn("Tick {} for {} exceeded timeout ({} ms), abandoned it",
                        slot.inFlight.getGeneration(), service.getName(), running.toMillis());
                slot.inFlight = null;
                meterRegistry.counter("errorbudget.evaluation.abandoned").increment();

                CompletableFuture<List<BurnRateSnapshot>> started = start(slot);
                if (slot.queued != null) {
                    propagate(started, slot.queued);
                    slot.queued = null;
                }
                return started;
            }

            return queue(slot, service);
        }
    }

    /**
     * Submits a tick and waits for it, bounded by the tick timeout.
     */
    public List<BurnRateSnapshot> submitAndWait(MonitoredService service) {
        CompletableFuture<List<BurnRateSnapshot>> future = submit(service);
        try {
            // Long enough to cover a coalesced rerun behind the current tick
            return future.get(tickTimeout.toMillis() * 2, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new StorageUnavailableException(
                    "Evaluation of " + service.getName() + " did not finish within " + tickTimeout.toMillis() * 2 + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("Interrupted waiting for evaluation of " + service.getName(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new StorageUnavailableException("Evaluation of " + service.getName() + " failed", cause);
        }
    }

    public boolean isInFlight(Long serviceId) {
        ServiceSlot slot = slots.get(serviceId);
        if (slot == null) {
            return false;
        }
        synchronized (slot) {
            return slot.inFlight != null;
        }
    }

    public int getConsecutiveFailures(Long serviceId) {
        ServiceSlot slot = slots.get(serviceId);
        if (slot == null) {
            return 0;
        }
        synchronized (slot) {
            return slot.consecutiveFailures;
        }
    }

    // Caller holds the slot monitor
    private CompletableFuture<List<BurnRateSnapshot>> queue(ServiceSlot slot, MonitoredService service) {
        if (slot.queued == null) {
            slot.queued = new CompletableFuture<>();
        }
        meterRegistry.counter("errorbudget.evaluation.coalesced").increment();
        log.debug("Tick for {} already in flight, queued a rerun", service.getName());
        return slot.queued;
    }

    // Caller holds the slot monitor
    private CompletableFuture<List<BurnRateSnapshot>> start(ServiceSlot slot) {
        MonitoredService service = slot.service;
        EvaluationTick tick = new EvaluationTick(service.getServiceId(), ++slot.generation, Instant.now(clock));
        slot.inFlight = tick;

        Timer.Sample sample = Timer.start(meterRegistry);
        CompletableFuture<List<BurnRateSnapshot>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> evaluationService.evaluateService(service, tick), evaluationExecutor);
        } catch (RejectedExecutionException e) {
            slot.inFlight = null;
            log.warn("Evaluation executor rejected tick for {}: {}", service.getName(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }

        return future.whenComplete((snapshots, error) -> {
            sample.stop(meterRegistry.timer("errorbudget.evaluation.duration"));
            onComplete(slot, tick, error);
        });
    }

    private void onComplete(ServiceSlot slot, EvaluationTick tick, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;

        MonitoredService alertFor = null;
        int failures = 0;
        String lastError = null;

        synchronized (slot) {
            boolean current = slot.inFlight == tick;

            if (cause instanceof StaleEvaluationException) {
                log.warn("Discarded result of abandoned tick {} for {}", tick.getGeneration(), slot.service.getName());
                meterRegistry.counter("errorbudget.evaluation.ticks", "outcome", "stale").increment();
            } else if (cause != null) {
                slot.consecutiveFailures++;
                failures = slot.consecutiveFailures;
                lastError = cause.getMessage();
                log.error("Evaluation tick {} for {} failed ({} consecutive), will retry on next tick",
                        tick.getGeneration(), slot.service.getName(), failures, cause);
                meterRegistry.counter("errorbudget.evaluation.ticks", "outcome", "failure").increment();
                if (failureAlertThreshold > 0 && failures % failureAlertThreshold == 0) {
                    alertFor = slot.service;
                }
            } else {
                slot.consecutiveFailures = 0;
                meterRegistry.counter("errorbudget.evaluation.ticks", "outcome", "success").increment();
            }

            if (current) {
                slot.inFlight = null;
                if (slot.queued != null) {
                    CompletableFuture<List<BurnRateSnapshot>> waiting = slot.queued;
                    slot.queued = null;
                    propagate(start(slot), waiting);
                }
            }
        }

        if (alertFor != null) {
            try {
                alertManager.raiseOperationalAlert(alertFor, failures, lastError);
            } catch (RuntimeException e) {
                log.error("Could not record operational alert for {}", alertFor.getName(), e);
            }
        }
    }

    private static <T> void propagate(CompletableFuture<T> source, CompletableFuture<T> target) {
        source.whenComplete((value, error) -> {
            if (error != null) {
                target.completeExceptionally(error);
            } else {
                target.complete(value);
            }
        });
    }

    private static final class ServiceSlot {
        private MonitoredService service;
        private EvaluationTick inFlight;
        private CompletableFuture<List<BurnRateSnapshot>> queued;
        private long generation;
        private int consecutiveFailures;
    }
}
