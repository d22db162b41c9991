package com.ryuqq.fleetflow.adapter.inmemory.timeout;

import com.ryuqq.fleetflow.adapter.inmemory.concurrent.NamedThreadFactory;
import com.ryuqq.fleetflow.core.model.MessageId;
import com.ryuqq.fleetflow.core.spi.DeadlineManager;
import com.ryuqq.fleetflow.core.spi.DeadlineResolution;
import com.ryuqq.fleetflow.core.spi.ExpiryCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link DeadlineManager} backed by a {@link ScheduledThreadPoolExecutor}.
 *
 * <p>Each registration lives in a {@link ConcurrentHashMap} until either the timer task or
 * {@link #acknowledge} removes it. Removal is the single point of arbitration: whoever removes
 * the entry wins, so acknowledge and expiry can never both take effect.</p>
 *
 * <p>Expiry callbacks run on a separate callback pool, so a slow callback does not delay other
 * timers.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public class ScheduledDeadlineManager implements DeadlineManager {

    private static final Logger log = LoggerFactory.getLogger(ScheduledDeadlineManager.class);

    private static final long SHUTDOWN_TIMEOUT_MS = 2_000L;

    private final ScheduledThreadPoolExecutor timer;
    private final ExecutorService callbackExecutor;
    private final Map<MessageId, Registration> pending = new ConcurrentHashMap<>();
    private volatile boolean shutdown;

    /**
     * 기본 설정으로 생성 (콜백 스레드 2개).
     */
    public ScheduledDeadlineManager() {
        this(2);
    }

    /**
     * 콜백 스레드 수 지정 생성.
     *
     * @param callbackThreads 만료 콜백 실행 스레드 수 (1 이상)
     * @throws IllegalArgumentException callbackThreads가 양수가 아닌 경우
     */
    public ScheduledDeadlineManager(int callbackThreads) {
        if (callbackThreads <= 0) {
            throw new IllegalArgumentException("callbackThreads must be positive (current: " + callbackThreads + ")");
        }
        this.timer = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("fleetflow-deadline-timer"));
        this.timer.setRemoveOnCancelPolicy(true);
        this.callbackExecutor = Executors.newFixedThreadPool(callbackThreads,
            new NamedThreadFactory("fleetflow-deadline-callback"));
    }

    @Override
    public CompletableFuture<DeadlineResolution> register(MessageId messageId, long deadlineAtMillis,
                                                         ExpiryCallback onExpire) {
        if (messageId == null) {
            throw new IllegalArgumentException("messageId cannot be null");
        }
        if (onExpire == null) {
            throw new IllegalArgumentException("onExpire cannot be null");
        }
        if (shutdown) {
            throw new IllegalStateException("Deadline manager is shut down");
        }

        Registration registration = new Registration(messageId, onExpire);
        if (pending.putIfAbsent(messageId, registration) != null) {
            throw new IllegalStateException("Deadline already pending for " + messageId);
        }

        long delayMs = Math.max(0L, deadlineAtMillis - System.currentTimeMillis());
        try {
            registration.timerTask = timer.schedule(() -> expire(registration), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            pending.remove(messageId, registration);
            throw new IllegalStateException("Deadline manager is shut down", e);
        }
        log.debug("Deadline registered for {} in {}ms", messageId, delayMs);
        return registration.resolution;
    }

    @Override
    public boolean acknowledge(MessageId messageId) {
        if (messageId == null) {
            return false;
        }
        Registration registration = pending.remove(messageId);
        if (registration == null) {
            return false;
        }
        ScheduledFuture<?> task = registration.timerTask;
        if (task != null) {
            task.cancel(false);
        }
        registration.resolution.complete(DeadlineResolution.ACKNOWLEDGED);
        log.debug("Deadline acknowledged for {}", messageId);
        return true;
    }

    @Override
    public int pendingCount() {
        return pending.size();
    }

    @Override
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        for (MessageId messageId : pending.keySet()) {
            Registration registration = pending.remove(messageId);
            if (registration != null) {
                ScheduledFuture<?> task = registration.timerTask;
                if (task != null) {
                    task.cancel(false);
                }
                registration.resolution.cancel(false);
            }
        }
        timer.shutdownNow();
        callbackExecutor.shutdown();
        try {
            if (!callbackExecutor.awaitTermination(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                callbackExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            callbackExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Deadline manager shut down");
    }

    private void expire(Registration registration) {
        if (!pending.remove(registration.messageId, registration)) {
            return;
        }
        registration.resolution.complete(DeadlineResolution.EXPIRED);
        log.debug("Deadline expired for {}", registration.messageId);
        try {
            callbackExecutor.execute(() -> runCallback(registration));
        } catch (RejectedExecutionException e) {
            log.warn("Expiry callback for {} skipped, manager shutting down", registration.messageId);
        }
    }

    private void runCallback(Registration registration) {
        try {
            registration.onExpire.onExpired(registration.messageId);
        } catch (RuntimeException e) {
            log.error("Expiry callback failed for {}", registration.messageId, e);
        }
    }

    private static final class Registration {

        private final MessageId messageId;
        private final ExpiryCallback onExpire;
        private final CompletableFuture<DeadlineResolution> resolution = new CompletableFuture<>();
        private volatile ScheduledFuture<?> timerTask;

        private Registration(MessageId messageId, ExpiryCallback onExpire) {
            this.messageId = messageId;
            this.onExpire = onExpire;
        }
    }
}
