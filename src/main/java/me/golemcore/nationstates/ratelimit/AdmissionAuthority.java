package me.golemcore.nationstates.ratelimit;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.nationstates.domain.model.LimiterSignal;
import me.golemcore.nationstates.domain.model.ObservedResponse;
import me.golemcore.nationstates.domain.model.QuotaState;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The single place where admission decisions are made.
 *
 * <p>
 * Holds the FIFO queue of waiting callers together with the quota state, the
 * throttle override and the outstanding permit, all guarded by one lock.
 * Blocking and asynchronous callers enqueue the same kind of ticket, so
 * ordering and serialization do not depend on how a caller waits.
 *
 * <p>
 * Grants happen in {@link #pump()}, which runs on whichever thread changed
 * the state (enqueue, release, observe, cancel) or on the timer thread when
 * the head of the queue becomes admissible. Permits are handed out after the
 * lock is released.
 *
 * <p>
 * Several limiters may share one authority; they then share one quota and one
 * queue while each keeps its own pacing floor.
 */
@Slf4j
public final class AdmissionAuthority implements AutoCloseable {

    /** Longest wait any single observation can impose. */
    static final Duration MAX_WAIT = Duration.ofDays(365);

    private final String name;
    private final Duration fallbackDelay;
    private final QuotaExtractor extractor;
    private final LimiterSignalListener signalListener;
    private final MonotonicClock clock;
    private final ScheduledExecutorService timer;
    private final AtomicLong arrivals = new AtomicLong();

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<AdmissionTicket> queue = new ArrayDeque<>();
    private QuotaState quota;
    private boolean throttled;
    private long throttleUntilNanos;
    private Permit outstanding;
    private ScheduledFuture<?> wakeTask;
    private long wakeAtNanos;
    private long wakeGeneration;
    private boolean closed;

    public AdmissionAuthority(LimiterSettings settings, QuotaExtractor extractor,
            LimiterSignalListener signalListener, MonotonicClock clock) {
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        if (extractor == null) {
            throw new IllegalArgumentException("extractor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = settings.name();
        this.fallbackDelay = settings.fallbackDelay();
        this.extractor = extractor;
        this.signalListener = signalListener != null ? signalListener : LimiterSignalListener.NOOP;
        this.clock = clock;
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ratelimit-" + name);
            t.setDaemon(true);
            return t;
        });
    }

    public String name() {
        return name;
    }

    /**
     * Join the queue. The returned future completes with a permit once this
     * caller is at the head and admissible. Cancelling the future withdraws
     * the ticket without touching quota or pacing state.
     *
     * @param floor
     *            extra pacing rule of the calling limiter, may be {@code null}
     * @param delivery
     *            executor that completes the future
     */
    CompletableFuture<Permit> enqueue(PacingFloor floor, Executor delivery) {
        AdmissionTicket ticket = new AdmissionTicket(arrivals.incrementAndGet(), floor, delivery);
        ticket.future().whenComplete((permit, error) -> {
            if (error instanceof CancellationException) {
                withdraw(ticket);
            }
        });

        lock.lock();
        try {
            if (closed) {
                throw new IllegalStateException("Rate limiter '" + name + "' is closed");
            }
            queue.addLast(ticket);
        } finally {
            lock.unlock();
        }

        pump();
        return ticket.future();
    }

    /**
     * Apply the quota information of a response.
     */
    ResponseOutcome observe(ObservedResponse response) {
        QuotaObservation observation = extractor.extract(response);
        LimiterSignal signal = null;
        ResponseOutcome outcome;

        lock.lock();
        try {
            long now = clock.nanoTime();
            if (observation.throttled()) {
                Duration wait = observation.retryAfter();
                if (wait == null) {
                    wait = observation.resetAfter() != null && !observation.resetAfter().isZero()
                            ? observation.resetAfter()
                            : fallbackDelay;
                }
                wait = capped(wait);
                throttled = true;
                throttleUntilNanos = now + wait.toNanos();
                quota = new QuotaState(0, throttleUntilNanos, now);
                signal = new LimiterSignal.Throttled(name, wait, Instant.now().plus(wait));
                outcome = ResponseOutcome.THROTTLED;
            } else if (!observation.hasQuota()) {
                quota = new QuotaState(0, now + capped(fallbackDelay).toNanos(), now);
                signal = new LimiterSignal.MalformedQuotaData(name, response.status(),
                        observation.describeMissing());
                outcome = ResponseOutcome.MALFORMED_QUOTA;
            } else {
                quota = new QuotaState(observation.remaining(), now + capped(observation.resetAfter()).toNanos(),
                        now);
                outcome = ResponseOutcome.ACCEPTED;
            }
        } finally {
            lock.unlock();
        }

        if (signal instanceof LimiterSignal.Throttled t) {
            log.info("[RateLimiter] {}: throttled, holding requests for {}s", name, t.retryAfter().toSeconds());
        } else if (signal instanceof LimiterSignal.MalformedQuotaData m) {
            log.warn("[RateLimiter] {}: unusable quota data on HTTP {} ({}), pacing at {}ms",
                    name, m.status(), m.detail(), fallbackDelay.toMillis());
        } else {
            log.debug("[RateLimiter] {}: quota remaining={}", name, observation.remaining());
        }
        if (signal != null) {
            publish(signal);
        }

        pump();
        return outcome;
    }

    void publish(LimiterSignal signal) {
        try {
            signalListener.onSignal(signal);
        } catch (RuntimeException e) {
            log.warn("[RateLimiter] {}: signal listener failed on {}: {}", name,
                    signal.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    void release(Permit permit) {
        lock.lock();
        try {
            if (outstanding != permit) {
                return;
            }
            outstanding = null;
        } finally {
            lock.unlock();
        }
        pump();
    }

    /**
     * Wait a newly arriving request would face from quota, throttle and
     * {@code floor} alone. Ignores callers already queued.
     */
    Duration computeWait(PacingFloor floor) {
        lock.lock();
        try {
            long now = clock.nanoTime();
            return Duration.ofNanos(Math.max(0, admissionTime(now, floor) - now));
        } finally {
            lock.unlock();
        }
    }

    QuotaState quotaState() {
        lock.lock();
        try {
            return quota;
        } finally {
            lock.unlock();
        }
    }

    int pendingCount() {
        lock.lock();
        try {
            int waiting = 0;
            for (AdmissionTicket ticket : queue) {
                if (ticket.isWaiting()) {
                    waiting++;
                }
            }
            return waiting;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discard all state and cancel every waiting caller.
     */
    @Override
    public void close() {
        List<AdmissionTicket> abandoned;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            abandoned = new ArrayList<>(queue);
            queue.clear();
            quota = null;
            throttled = false;
            if (wakeTask != null) {
                wakeTask.cancel(false);
                wakeTask = null;
            }
        } finally {
            lock.unlock();
        }

        for (AdmissionTicket ticket : abandoned) {
            if (ticket.cancel()) {
                ticket.future().cancel(false);
            }
        }
        timer.shutdownNow();
        log.debug("[RateLimiter] {}: closed, {} waiter(s) cancelled", name, abandoned.size());
    }

    private void withdraw(AdmissionTicket ticket) {
        if (!ticket.cancel()) {
            return;
        }
        lock.lock();
        try {
            queue.remove(ticket);
        } finally {
            lock.unlock();
        }
        log.debug("[RateLimiter] {}: request #{} withdrawn", name, ticket.sequence());
        pump();
    }

    private void pump() {
        AdmissionTicket granted = null;
        Permit permit = null;

        lock.lock();
        try {
            if (closed) {
                return;
            }
            while (outstanding == null && !queue.isEmpty()) {
                AdmissionTicket head = queue.peekFirst();
                if (!head.isWaiting()) {
                    queue.pollFirst();
                    continue;
                }
                long now = clock.nanoTime();
                clearExpiredThrottle(now);
                long admitAt = admissionTime(now, head.floor());
                if (admitAt - now > 0) {
                    scheduleWake(admitAt, now);
                    break;
                }
                queue.pollFirst();
                if (!head.markGranted()) {
                    continue;
                }
                if (quota != null) {
                    quota = quota.isExpired(now) ? null : quota.consume();
                }
                if (head.floor() != null) {
                    head.floor().recordGrant(now);
                }
                permit = new Permit(this, head.sequence(), now);
                outstanding = permit;
                granted = head;
            }
        } finally {
            lock.unlock();
        }

        if (granted != null) {
            log.debug("[RateLimiter] {}: granted request #{}", name, granted.sequence());
            granted.deliver(permit);
        }
    }

    private long admissionTime(long now, PacingFloor floor) {
        long at = now;
        if (throttled) {
            at = later(at, throttleUntilNanos);
        }
        if (quota != null) {
            at = later(at, quota.admissionAt(now));
        }
        if (floor != null) {
            at = later(at, floor.earliestGrant(now));
        }
        return at;
    }

    private void clearExpiredThrottle(long now) {
        if (throttled && throttleUntilNanos - now <= 0) {
            throttled = false;
            log.debug("[RateLimiter] {}: throttle override expired", name);
        }
    }

    /**
     * Keep exactly one pending wake, aimed at the current head's admission
     * time. Called with the lock held.
     */
    private void scheduleWake(long atNanos, long now) {
        if (wakeTask != null && wakeAtNanos == atNanos) {
            return;
        }
        if (wakeTask != null) {
            wakeTask.cancel(false);
        }
        long generation = ++wakeGeneration;
        wakeAtNanos = atNanos;
        wakeTask = timer.schedule(() -> onWake(generation), atNanos - now, TimeUnit.NANOSECONDS);
    }

    private void onWake(long generation) {
        lock.lock();
        try {
            // a newer wake replaced this one after it started running
            if (generation != wakeGeneration) {
                return;
            }
            wakeTask = null;
        } finally {
            lock.unlock();
        }
        pump();
    }

    private static Duration capped(Duration wait) {
        return wait.compareTo(MAX_WAIT) > 0 ? MAX_WAIT : wait;
    }

    private static long later(long a, long b) {
        return a - b >= 0 ? a : b;
    }
}
