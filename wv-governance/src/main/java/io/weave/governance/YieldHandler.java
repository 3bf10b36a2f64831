package io.weave.governance;

import io.weave.core.EventId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Holds yields until approvers settle them.
 * <p>
 * Each request moves {@code PENDING -> APPROVED | REJECTED | TIMEOUT} exactly once and
 * leaves the live table when it does. Every request has its own lock and condition,
 * so unrelated requests never contend; concurrent approvals of one request are
 * serialized on its lock.
 */
public final class YieldHandler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(YieldHandler.class);

    private final ConcurrentMap<EventId, PendingApproval<?>> pending = new ConcurrentHashMap<>();
    private final List<GovernanceListener> listeners = new CopyOnWriteArrayList<>();
    private final Duration defaultTimeout;
    private final ApprovalStrategy defaultStrategy;
    private final ExecutorService waiters;

    private static final class PendingApproval<T> {
        final ReentrantLock lock = new ReentrantLock();
        final Condition settled = lock.newCondition();
        final ApprovalStrategy strategy;
        volatile YieldTurn<T> turn;
        volatile ApprovalStatus status = ApprovalStatus.PENDING;
        String rejectedBy;
        String detail;

        PendingApproval(YieldTurn<T> turn, ApprovalStrategy strategy) {
            this.turn = turn;
            this.strategy = strategy;
        }
    }

    /** No default deadline, {@link ApprovalStrategy#ALL}. */
    public YieldHandler() {
        this(null, ApprovalStrategy.ALL);
    }

    /**
     * @param defaultTimeout deadline used when a request names none; {@code null} waits indefinitely
     */
    public YieldHandler(Duration defaultTimeout, ApprovalStrategy defaultStrategy) {
        this.defaultTimeout = defaultTimeout;
        this.defaultStrategy = Objects.requireNonNull(defaultStrategy);
        var n = new AtomicInteger();
        this.waiters = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "yield-waiter-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(GovernanceListener listener) { listeners.add(Objects.requireNonNull(listener)); }

    public void removeListener(GovernanceListener listener) { listeners.remove(listener); }

    /* ---------- Requesters ---------- */

    public <T> ApprovalResult<T> requestApproval(YieldTurn<T> turn) {
        return requestApproval(turn, defaultTimeout, defaultStrategy);
    }

    /**
     * Register {@code turn} and block until it is approved under {@code strategy},
     * rejected, or {@code timeout} elapses.
     *
     * @param timeout {@code null} waits indefinitely
     * @throws IllegalStateException if a request with the same id is already pending
     */
    public <T> ApprovalResult<T> requestApproval(YieldTurn<T> turn, Duration timeout, ApprovalStrategy strategy) {
        return await(register(turn, strategy), timeout);
    }

    /**
     * Register now, wait on a handler thread. Approvals may arrive as soon as this
     * method returns.
     */
    public <T> CompletableFuture<ApprovalResult<T>> requestApprovalAsync(YieldTurn<T> turn, Duration timeout,
                                                                         ApprovalStrategy strategy) {
        var request = register(turn, strategy);
        try {
            return CompletableFuture.supplyAsync(() -> await(request, timeout), waiters);
        } catch (RejectedExecutionException e) {
            pending.remove(turn.id(), request);
            log.warn("Handler closed; withdrew approval request {}", turn.id());
            throw e;
        }
    }

    private <T> PendingApproval<T> register(YieldTurn<T> turn, ApprovalStrategy strategy) {
        Objects.requireNonNull(turn, "turn");
        var request = new PendingApproval<>(turn, strategy == null ? defaultStrategy : strategy);
        if (pending.putIfAbsent(turn.id(), request) != null) {
            throw new IllegalStateException("Yield " + turn.id() + " is already pending");
        }
        log.info("Approval requested for {} from {} ({}, required {})",
                turn.id(), turn.source(), request.strategy, turn.requiredApprovers());
        notifyListeners(l -> l.onRequested(turn));
        return request;
    }

    private <T> ApprovalResult<T> await(PendingApproval<T> request, Duration timeout) {
        long started = System.nanoTime();
        request.lock.lock();
        try {
            if (request.status == ApprovalStatus.PENDING && request.strategy.isSatisfied(request.turn)) {
                request.status = ApprovalStatus.APPROVED;
            }
            long remaining = timeout == null ? Long.MAX_VALUE : Math.max(0L, TimeUnit.NANOSECONDS.convert(timeout));
            while (request.status == ApprovalStatus.PENDING) {
                if (timeout == null) {
                    request.settled.await();
                } else if (remaining <= 0) {
                    request.status = ApprovalStatus.TIMEOUT;
                    request.detail = "No decision within " + timeout;
                } else {
                    remaining = request.settled.awaitNanos(remaining);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (request.status == ApprovalStatus.PENDING) {
                request.status = ApprovalStatus.TIMEOUT;
                request.detail = "interrupted";
            }
        } finally {
            pending.remove(request.turn.id(), request);
            request.lock.unlock();
        }

        var result = new ApprovalResult<>(request.status, request.turn, request.rejectedBy, request.detail,
                Duration.ofNanos(System.nanoTime() - started));
        log.info("Yield {} resolved {} after {} ms", result.turn().id(), result.status(), result.waited().toMillis());
        switch (result.status()) {
            case APPROVED -> notifyListeners(l -> l.onApproval(result.turn()));
            case REJECTED -> notifyListeners(l -> l.onRejection(result.turn(), result.rejectedBy(), result.detail()));
            case TIMEOUT -> notifyListeners(l -> l.onTimeout(result.turn()));
            case PENDING -> throw new IllegalStateException("unreachable");
        }
        return result;
    }

    /* ---------- Approvers ---------- */

    /**
     * Fold {@code approver} into the pending yield {@code id}.
     *
     * @return false if no such request is pending
     * @throws InvalidApproverException if {@code approver} is not required by the yield
     */
    public boolean approve(EventId id, String approver) {
        var request = pending.get(id);
        return request != null && fold(request, approver);
    }

    private <T> boolean fold(PendingApproval<T> request, String approver) {
        request.lock.lock();
        try {
            if (request.status != ApprovalStatus.PENDING) return false;
            request.turn = request.turn.approve(approver);
            log.debug("Yield {} approved by {} ({}/{})", request.turn.id(), approver,
                    request.turn.approvedBy().size(), request.turn.requiredApprovers().size());
            if (request.strategy.isSatisfied(request.turn)) {
                request.status = ApprovalStatus.APPROVED;
                request.settled.signalAll();
            }
            return true;
        } finally {
            request.lock.unlock();
        }
    }

    /**
     * Veto the pending yield {@code id}, whatever approvals it has gathered.
     *
     * @return false if no such request is pending
     */
    public boolean reject(EventId id, String rejector, String reason) {
        var request = pending.get(id);
        if (request == null) return false;
        request.lock.lock();
        try {
            if (request.status != ApprovalStatus.PENDING) return false;
            request.status = ApprovalStatus.REJECTED;
            request.rejectedBy = rejector;
            request.detail = reason == null ? "" : reason;
            request.settled.signalAll();
            log.debug("Yield {} rejected by {}: {}", id, rejector, reason);
            return true;
        } finally {
            request.lock.unlock();
        }
    }

    /* ---------- Inspection ---------- */

    /** Yields awaiting a decision, oldest first. */
    public List<YieldTurn<?>> listPending() {
        return pending.values().stream()
                .filter(p -> p.status == ApprovalStatus.PENDING)
                .<YieldTurn<?>>map(p -> p.turn)
                .sorted(Comparator.comparing((YieldTurn<?> t) -> t.timestamp()))
                .toList();
    }

    public boolean isPending(EventId id) {
        var request = pending.get(id);
        return request != null && request.status == ApprovalStatus.PENDING;
    }

    /** Current value of a pending yield, approvals so far included. */
    public Optional<YieldTurn<?>> pending(EventId id) {
        var request = pending.get(id);
        if (request == null || request.status != ApprovalStatus.PENDING) return Optional.empty();
        return Optional.of(request.turn);
    }

    public int pendingCount() { return listPending().size(); }

    private void notifyListeners(Consumer<GovernanceListener> call) {
        for (var listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Governance listener {} failed", listener, e);
            }
        }
    }

    /** Stops the threads behind {@link #requestApprovalAsync}; their waits end as interrupted. */
    @Override
    public void close() { waiters.shutdownNow(); }
}
