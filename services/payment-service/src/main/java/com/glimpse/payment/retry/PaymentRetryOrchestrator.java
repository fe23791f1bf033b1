package com.glimpse.payment.retry;

import com.glimpse.common.redis.CacheOptions;
import com.glimpse.common.redis.KeyValueStore;
import com.glimpse.payment.domain.PaymentFailureRecord;
import com.glimpse.payment.domain.PaymentStatus;
import com.glimpse.payment.domain.PaymentStatusRecord;
import com.glimpse.payment.infrastructure.PaymentFailureLog;
import com.glimpse.payment.infrastructure.PaymentStatusRepository;
import com.glimpse.payment.processor.PaymentProcessor;
import com.glimpse.payment.processor.PaymentResult;
import com.glimpse.payment.retry.exception.CircuitOpenException;
import com.glimpse.payment.retry.exception.PaymentClientException;
import com.glimpse.payment.retry.exception.RetryExhaustedException;
import com.glimpse.payment.retry.exception.RetryInProgressException;
import com.glimpse.payment.retry.exception.RetryScheduledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs payment operations with persisted retry state, exponential backoff and a per-provider
 * circuit breaker.
 *
 * <p>A transient failure with attempts left persists {@code nextRetryAt}, arms an in-process timer
 * and surfaces {@link RetryScheduledException}. The timer is lost on restart; the periodic sweep
 * ({@link #processPendingRetries()}) picks up any state whose {@code nextRetryAt} has passed.</p>
 */
public class PaymentRetryOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PaymentRetryOrchestrator.class);

    static final String STATE_PREFIX = "payment:retry";

    private final KeyValueStore store;
    private final PaymentProcessor processor;
    private final PaymentStatusRepository statusRepository;
    private final PaymentFailureLog failureLog;
    private final ProviderCircuitBreaker circuitBreaker;
    private final PaymentErrorClassifier classifier;
    private final ExponentialBackoff backoff;
    private final TaskScheduler taskScheduler;
    private final PaymentRetryMetrics metrics;
    private final Clock clock;
    private final RetryConfig defaultConfig;
    private final CacheOptions stateOptions;

    // operation ids with an attempt running in this process
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public PaymentRetryOrchestrator(KeyValueStore store,
                                    PaymentProcessor processor,
                                    PaymentStatusRepository statusRepository,
                                    PaymentFailureLog failureLog,
                                    ProviderCircuitBreaker circuitBreaker,
                                    PaymentErrorClassifier classifier,
                                    ExponentialBackoff backoff,
                                    TaskScheduler taskScheduler,
                                    PaymentRetryMetrics metrics,
                                    Clock clock,
                                    RetryConfig defaultConfig,
                                    Duration stateTtl) {
        this.store = store;
        this.processor = processor;
        this.statusRepository = statusRepository;
        this.failureLog = failureLog;
        this.circuitBreaker = circuitBreaker;
        this.classifier = classifier;
        this.backoff = backoff;
        this.taskScheduler = taskScheduler;
        this.metrics = metrics;
        this.clock = clock;
        this.defaultConfig = defaultConfig;
        this.stateOptions = new CacheOptions(stateTtl, STATE_PREFIX);
    }

    public PaymentResult runWithRetry(String operationId, PaymentContext context) {
        return runWithRetry(operationId, context, defaultConfig);
    }

    /**
     * @throws RetryInProgressException if an attempt for {@code operationId} is already running in
     *                                   this process
     */
    public PaymentResult runWithRetry(String operationId, PaymentContext context, RetryConfig config) {
        if (!inFlight.add(operationId)) {
            log.warn("Payment attempt already running, rejecting operationId={}", operationId);
            throw new RetryInProgressException(operationId);
        }
        try {
            return attempt(operationId, context, config);
        } finally {
            inFlight.remove(operationId);
        }
    }

    private PaymentResult attempt(String operationId, PaymentContext context, RetryConfig config) {
        RetryState state = loadState(operationId).orElseGet(() -> RetryState.initial(context));
        String provider = context.provider();

        Optional<PaymentStatusRecord> current = statusRepository.find(operationId);
        if (current.filter(r -> r.status() == PaymentStatus.COMPLETED).isPresent()) {
            log.info("Payment already completed, not contacting provider operationId={}", operationId);
            deleteState(operationId);
            return new PaymentResult(operationId, current.get().transactionId(), PaymentStatus.COMPLETED.name(),
                    Map.of("alreadyCompleted", true));
        }

        boolean alreadyFailed = current.filter(r -> r.status() == PaymentStatus.FAILED).isPresent();
        if (alreadyFailed || state.exhaustedFor(config)) {
            log.warn("Payment retries exhausted, not contacting provider operationId={} attempts={}",
                    operationId, state.attempts());
            if (!alreadyFailed) {
                failTerminally(operationId, state.failTerminally(null), "Max retries exceeded");
            }
            metrics.incExhausted();
            throw new RetryExhaustedException(operationId, state.attempts(), null);
        }

        if (circuitBreaker.isOpen(provider)) {
            log.warn("Circuit open, rejecting payment operationId={} provider={}", operationId, provider);
            metrics.incCircuitRejected();
            throw new CircuitOpenException(provider);
        }

        Instant startedAt = clock.instant();
        RetryState running = state.startAttempt(startedAt, context);
        saveState(operationId, running);
        statusRepository.markPendingIfAbsent(operationId);
        metrics.incAttempts();

        PaymentResult result;
        try {
            result = processor.process(operationId, context.userId(), context.data());
        } catch (RuntimeException e) {
            return handleFailure(operationId, running, config, e);
        }

        deleteState(operationId);
        circuitBreaker.recordSuccess(provider);
        statusRepository.markCompleted(operationId, result == null ? null : result.transactionId());
        metrics.incSucceeded();
        log.info("Payment processed operationId={} provider={} attempts={}", operationId, provider, running.attempts());
        return result;
    }

    private PaymentResult handleFailure(String operationId, RetryState running, RetryConfig config, RuntimeException error) {
        String provider = running.context().provider();
        RetryError retryError = new RetryError(clock.instant(), describe(error), provider);
        FailureClass failureClass = classifier.classify(error);

        if (!failureClass.retryable()) {
            failTerminally(operationId, running.failTerminally(retryError), retryError.error());
            metrics.incClientFailures();
            log.warn("Payment failed with non-retryable error operationId={} provider={} error={}",
                    operationId, provider, retryError.error());
            throw new PaymentClientException(operationId, retryError.error(), error);
        }

        circuitBreaker.recordFailure(provider);

        if (running.attempts() < config.maxRetries()) {
            Duration delay = backoff.delay(running.attempts(), config);
            Instant nextRetryAt = clock.instant().plus(delay);
            saveState(operationId, running.scheduleNext(retryError, nextRetryAt));
            scheduleTimer(operationId, running.context(), config, nextRetryAt);
            metrics.incScheduled();
            log.info("Payment scheduled for retry operationId={} attempt={} delayMs={}",
                    operationId, running.attempts(), delay.toMillis());
            throw new RetryScheduledException(operationId, running.attempts(), delay, nextRetryAt, error);
        }

        failTerminally(operationId, running.failTerminally(retryError), "Max retries exceeded after failures");
        metrics.incExhausted();
        log.error("Payment retries exhausted operationId={} provider={} attempts={}",
                operationId, provider, running.attempts(), error);
        throw new RetryExhaustedException(operationId, running.attempts(), error);
    }

    /**
     * Resumes every operation whose retry is due and whose payment is still pending.
     *
     * @return number of operations resumed
     */
    public int processPendingRetries() {
        List<PendingRetry> pending = getPendingRetries();
        if (!pending.isEmpty()) {
            log.info("Processing pending payment retries count={}", pending.size());
        }
        int resumed = 0;
        for (PendingRetry retry : pending) {
            if (retry.state().context() == null) {
                log.warn("Retry state without context, skipping operationId={}", retry.operationId());
                continue;
            }
            if (resume(retry.operationId(), retry.state().context(), defaultConfig)) {
                resumed++;
                metrics.incSweepResumed();
            }
        }
        return resumed;
    }

    public List<PendingRetry> getPendingRetries() {
        Instant now = clock.instant();
        String keyPrefix = STATE_PREFIX + ":";
        List<PendingRetry> due = new ArrayList<>();
        for (String key : store.keys(keyPrefix + "*")) {
            String operationId = key.substring(keyPrefix.length());
            Optional<RetryState> state = loadState(operationId);
            if (state.isEmpty() || !state.get().dueAt(now)) {
                continue;
            }
            if (statusRepository.status(operationId).filter(PaymentStatus.PENDING::equals).isPresent()) {
                due.add(new PendingRetry(operationId, state.get()));
            }
        }
        due.sort(Comparator.comparing(p -> p.state().nextRetryAt()));
        return due;
    }

    public Optional<RetryState> retryState(String operationId) {
        return loadState(operationId);
    }

    public CircuitBreakerState circuitState(String provider) {
        return circuitBreaker.snapshot(provider);
    }

    private boolean resume(String operationId, PaymentContext context, RetryConfig config) {
        if (statusRepository.status(operationId).filter(PaymentStatus.PENDING::equals).isEmpty()) {
            log.debug("Payment no longer pending, skipping retry operationId={}", operationId);
            return false;
        }
        if (!inFlight.add(operationId)) {
            log.debug("Payment attempt already running locally, skipping operationId={}", operationId);
            return false;
        }
        try {
            attempt(operationId, context, config);
        } catch (RetryScheduledException e) {
            log.debug("Retry rescheduled operationId={} nextRetryAt={}", operationId, e.getNextRetryAt());
        } catch (RuntimeException e) {
            log.error("Scheduled retry failed operationId={}", operationId, e);
        } finally {
            inFlight.remove(operationId);
        }
        return true;
    }

    private void scheduleTimer(String operationId, PaymentContext context, RetryConfig config, Instant at) {
        try {
            taskScheduler.schedule(() -> resume(operationId, context, config), at);
        } catch (RuntimeException e) {
            log.warn("Retry timer not armed, relying on sweep operationId={}", operationId, e);
        }
    }

    private void failTerminally(String operationId, RetryState state, String reason) {
        saveState(operationId, state);
        statusRepository.markFailed(operationId, reason);
        failureLog.record(new PaymentFailureRecord(operationId, state.attempts(), reason, clock.instant()));
    }

    private Optional<RetryState> loadState(String operationId) {
        return store.get(operationId, RetryState.class, stateOptions);
    }

    private void saveState(String operationId, RetryState state) {
        store.set(operationId, state, stateOptions);
    }

    private void deleteState(String operationId) {
        store.delete(operationId, stateOptions);
    }

    private static String describe(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }
}
