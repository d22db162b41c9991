package com.ryuqq.fleetflow.adapter.inmemory.bus;

import com.ryuqq.fleetflow.adapter.inmemory.concurrent.NamedThreadFactory;
import com.ryuqq.fleetflow.core.contract.Channel;
import com.ryuqq.fleetflow.core.contract.Message;
import com.ryuqq.fleetflow.core.spi.AuditSink;
import com.ryuqq.fleetflow.core.spi.BusAction;
import com.ryuqq.fleetflow.core.spi.BusLogEntry;
import com.ryuqq.fleetflow.core.spi.BusStats;
import com.ryuqq.fleetflow.core.spi.MessageBus;
import com.ryuqq.fleetflow.core.spi.MessageHandler;
import com.ryuqq.fleetflow.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link MessageBus}.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Mailbox per subscriber:</strong> PriorityQueue ordered by priority rank (desc), then
 *       publish sequence (asc)</li>
 *   <li><strong>Dispatch pool:</strong> a mailbox with buffered messages has at most one drain task
 *       scheduled; each task delivers one message and reschedules itself, so subscribers share the
 *       pool fairly and a handler never runs concurrently with itself</li>
 *   <li><strong>Audit log:</strong> bounded ArrayDeque; when it exceeds its capacity the oldest
 *       half is discarded</li>
 * </ul>
 *
 * <p><strong>Priority semantics:</strong> the next message is chosen when the previous delivery
 * returns, so a CRITICAL message overtakes buffered NORMAL/LOW work but never interrupts a
 * delivery in progress.</p>
 *
 * <p><strong>Overflow:</strong> when a mailbox holds {@code maxQueueDepth} messages, the
 * lowest-priority, oldest buffered message is dropped (or the incoming one, if it ranks lower
 * than everything buffered).</p>
 *
 * <p><strong>Lifecycle:</strong> publishes are rejected until {@link #start()} and after
 * {@link #stop()}. Stopping waits up to {@code stopTimeoutMs} for buffered deliveries.</p>
 *
 * @author Fleetflow Team
 * @since 1.0.0
 */
public class InMemoryMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private static final long STOP_POLL_INTERVAL_MS = 5L;

    private enum Lifecycle { NEW, RUNNING, STOPPED }

    private static final Comparator<Queued> DISPATCH_ORDER =
        Comparator.comparingInt((Queued q) -> q.message().priority().rank()).reversed()
            .thenComparingLong(Queued::sequence);

    private final InMemoryBusConfig config;
    private final ExecutorService dispatcher;

    private final Map<Channel, List<Mailbox>> subscribers = new ConcurrentHashMap<>();
    private final Map<String, Mailbox> mailboxes = new ConcurrentHashMap<>();
    private final AtomicReference<Lifecycle> lifecycle = new AtomicReference<>(Lifecycle.NEW);
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong subscriptionSequence = new AtomicLong();

    /**
     * Messages buffered or being delivered, across all mailboxes.
     */
    private final AtomicInteger undelivered = new AtomicInteger();

    private final Object auditLock = new Object();
    private final Deque<BusLogEntry> auditEntries = new ArrayDeque<>();
    private final AtomicLong messagesLogged = new AtomicLong();
    private final List<AuditSink> auditSinks = new CopyOnWriteArrayList<>();

    /**
     * Creates a bus with default settings.
     */
    public InMemoryMessageBus() {
        this(new InMemoryBusConfig());
    }

    /**
     * Creates a bus with custom settings.
     *
     * @param config bus settings
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryMessageBus(InMemoryBusConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.dispatcher = Executors.newFixedThreadPool(config.dispatchThreads(), new NamedThreadFactory("fleetflow-bus"));
    }

    @Override
    public void start() {
        if (lifecycle.compareAndSet(Lifecycle.NEW, Lifecycle.RUNNING)) {
            log.info("Message bus started with {} dispatch threads", config.dispatchThreads());
        } else if (lifecycle.get() == Lifecycle.STOPPED) {
            throw new IllegalStateException("Message bus cannot be restarted after stop");
        }
    }

    @Override
    public void stop() {
        Lifecycle previous = lifecycle.getAndSet(Lifecycle.STOPPED);
        if (previous == Lifecycle.STOPPED) {
            return;
        }

        long deadline = System.currentTimeMillis() + config.stopTimeoutMs();
        while (undelivered.get() > 0 && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(STOP_POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        int abandoned = undelivered.get();
        if (abandoned > 0) {
            log.warn("Message bus stop timed out with {} undelivered messages", abandoned);
        }

        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(config.stopTimeoutMs(), TimeUnit.MILLISECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Message bus stopped ({} messages logged)", messagesLogged.get());
    }

    /**
     * {@inheritDoc}
     *
     * <p>The message is copied into each subscriber's mailbox; the method never blocks on
     * delivery.</p>
     */
    @Override
    public boolean publish(Channel channel, Message message) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (lifecycle.get() != Lifecycle.RUNNING) {
            log.warn("Publish rejected on {} (bus {}): {}", channel, lifecycle.get(), message.messageId());
            return false;
        }

        audit(channel, BusAction.PUBLISHED, message);
        long seq = sequence.incrementAndGet();
        List<Mailbox> targets = subscribers.getOrDefault(channel, List.of());
        for (Mailbox mailbox : targets) {
            mailbox.offer(new Queued(channel, message, seq));
        }
        log.debug("Published {} {} on {} to {} subscribers",
            message.type(), message.messageId(), channel, targets.size());
        return true;
    }

    @Override
    public Subscription subscribe(Channel channel, MessageHandler handler) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        Subscription subscription = new Subscription(
            "sub-" + subscriptionSequence.incrementAndGet(), channel);
        Mailbox mailbox = new Mailbox(subscription, handler);
        mailboxes.put(subscription.id(), mailbox);
        subscribers.computeIfAbsent(channel, key -> new CopyOnWriteArrayList<>()).add(mailbox);
        log.debug("Subscribed {} to {}", subscription.id(), channel);
        return subscription;
    }

    @Override
    public void unsubscribe(Subscription subscription) {
        if (subscription == null) {
            return;
        }
        Mailbox mailbox = mailboxes.remove(subscription.id());
        if (mailbox == null) {
            return;
        }
        List<Mailbox> channelSubscribers = subscribers.get(subscription.channel());
        if (channelSubscribers != null) {
            channelSubscribers.remove(mailbox);
        }
        log.debug("Unsubscribed {} from {} ({} messages still buffered)",
            subscription.id(), subscription.channel(), mailbox.depth());
    }

    @Override
    public BusStats stats() {
        Map<String, Integer> subscriberCounts = new HashMap<>();
        Map<String, Integer> queueDepths = new HashMap<>();
        for (Map.Entry<Channel, List<Mailbox>> entry : subscribers.entrySet()) {
            String name = entry.getKey().getName();
            subscriberCounts.put(name, entry.getValue().size());
            int depth = 0;
            for (Mailbox mailbox : entry.getValue()) {
                depth += mailbox.depth();
            }
            queueDepths.put(name, depth);
        }
        return new BusStats(subscriberCounts, messagesLogged.get(), queueDepths);
    }

    @Override
    public List<BusLogEntry> auditLog(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        synchronized (auditLock) {
            int skip = Math.max(0, auditEntries.size() - limit);
            List<BusLogEntry> recent = new ArrayList<>(Math.min(limit, auditEntries.size()));
            Iterator<BusLogEntry> iterator = auditEntries.iterator();
            for (int i = 0; iterator.hasNext(); i++) {
                BusLogEntry entry = iterator.next();
                if (i >= skip) {
                    recent.add(entry);
                }
            }
            return recent;
        }
    }

    @Override
    public void registerAuditSink(AuditSink sink) {
        if (sink == null) {
            throw new IllegalArgumentException("sink cannot be null");
        }
        auditSinks.add(sink);
    }

    /**
     * Whether the bus currently accepts publishes.
     */
    public boolean isRunning() {
        return lifecycle.get() == Lifecycle.RUNNING;
    }

    private void audit(Channel channel, BusAction action, Message message) {
        BusLogEntry entry = BusLogEntry.of(System.currentTimeMillis(), channel, action, message);
        synchronized (auditLock) {
            auditEntries.addLast(entry);
            if (auditEntries.size() > config.auditLogCapacity()) {
                int keep = config.auditLogCapacity() / 2;
                while (auditEntries.size() > keep) {
                    auditEntries.pollFirst();
                }
            }
        }
        messagesLogged.incrementAndGet();

        for (AuditSink sink : auditSinks) {
            try {
                sink.accept(entry);
            } catch (RuntimeException e) {
                log.warn("Audit sink {} failed on {} {}", sink, action, message.messageId(), e);
            }
        }
    }

    private void deliver(Mailbox mailbox, Queued queued) {
        Message message = queued.message();
        try {
            if (message.isExpired(System.currentTimeMillis())) {
                audit(queued.channel(), BusAction.DROPPED, message);
                log.debug("Dropped expired {} on {} for {}", message.messageId(), queued.channel(),
                    mailbox.subscription.id());
                return;
            }
            audit(queued.channel(), BusAction.DELIVERED, message);
            mailbox.handler.onMessage(message);
        } catch (RuntimeException e) {
            log.error("Handler of {} failed on {} {}", mailbox.subscription.id(), message.type(),
                message.messageId(), e);
        } finally {
            undelivered.decrementAndGet();
        }
    }

    private void dispatch(Mailbox mailbox) {
        try {
            dispatcher.execute(mailbox::drainOne);
        } catch (RejectedExecutionException e) {
            int abandoned = mailbox.abandon();
            log.warn("Dispatcher shut down, {} messages abandoned for {}", abandoned, mailbox.subscription.id());
        }
    }

    private record Queued(Channel channel, Message message, long sequence) {
    }

    /**
     * Per-subscriber buffer with a single drain task at a time.
     */
    private final class Mailbox {

        private final Subscription subscription;
        private final MessageHandler handler;
        private final PriorityQueue<Queued> queue = new PriorityQueue<>(DISPATCH_ORDER);
        private boolean draining;

        private Mailbox(Subscription subscription, MessageHandler handler) {
            this.subscription = subscription;
            this.handler = handler;
        }

        void offer(Queued incoming) {
            boolean schedule = false;
            Queued dropped = null;
            synchronized (this) {
                if (queue.size() >= config.maxQueueDepth()) {
                    Queued worst = worstBuffered();
                    if (incoming.message().priority().rank() < worst.message().priority().rank()) {
                        dropped = incoming;
                    } else {
                        queue.remove(worst);
                        dropped = worst;
                    }
                }
                if (dropped != incoming) {
                    queue.add(incoming);
                    undelivered.incrementAndGet();
                    if (dropped != null) {
                        undelivered.decrementAndGet();
                    }
                    if (!draining) {
                        draining = true;
                        schedule = true;
                    }
                }
            }
            if (dropped != null) {
                log.warn("Mailbox {} full ({}), dropping {} {}", subscription.id(), config.maxQueueDepth(),
                    dropped.message().priority(), dropped.message().messageId());
                audit(dropped.channel(), BusAction.DROPPED, dropped.message());
            }
            if (schedule) {
                dispatch(this);
            }
        }

        private Queued worstBuffered() {
            Queued worst = null;
            for (Queued candidate : queue) {
                if (worst == null) {
                    worst = candidate;
                    continue;
                }
                int candidateRank = candidate.message().priority().rank();
                int worstRank = worst.message().priority().rank();
                if (candidateRank < worstRank
                    || (candidateRank == worstRank && candidate.sequence() < worst.sequence())) {
                    worst = candidate;
                }
            }
            return worst;
        }

        private void drainOne() {
            Queued next;
            synchronized (this) {
                next = queue.poll();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            deliver(this, next);
            synchronized (this) {
                if (queue.isEmpty()) {
                    draining = false;
                    return;
                }
            }
            dispatch(this);
        }

        synchronized int abandon() {
            int abandoned = queue.size();
            queue.clear();
            draining = false;
            undelivered.addAndGet(-abandoned);
            return abandoned;
        }

        synchronized int depth() {
            return queue.size();
        }
    }
}
