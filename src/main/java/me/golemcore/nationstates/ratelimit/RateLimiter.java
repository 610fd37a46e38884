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

import me.golemcore.nationstates.domain.model.Credential;
import me.golemcore.nationstates.domain.model.LimiterSignal;
import me.golemcore.nationstates.domain.model.ObservedResponse;
import me.golemcore.nationstates.domain.model.QuotaState;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Quota-aware admission control for requests to one remote API.
 *
 * <p>
 * Callers obtain a {@link Permit} before sending, feed the response back
 * through {@link #observe(ObservedResponse)}, then close the permit. Grants
 * are FIFO and strictly serialized: the next caller is admitted only after
 * the current permit is closed, and never before the advertised quota
 * allows it.
 *
 * <p>
 * Blocking ({@link #acquire()}), bounded ({@link #tryAcquire(Duration)}),
 * future-based ({@link #acquireAsync()}) and Reactor ({@link #acquireMono()})
 * callers share one queue.
 */
public class RateLimiter implements RequestAuthorizer, AutoCloseable {

    private static final Executor DIRECT = Runnable::run;

    private final AdmissionAuthority authority;
    private final Executor asyncExecutor;
    private final boolean ownsAuthority;

    public RateLimiter(LimiterSettings settings, QuotaExtractor extractor, LimiterSignalListener signalListener) {
        this(settings, extractor, signalListener, MonotonicClock.SYSTEM, ForkJoinPool.commonPool());
    }

    public RateLimiter(LimiterSettings settings, QuotaExtractor extractor, LimiterSignalListener signalListener,
            MonotonicClock clock, Executor asyncExecutor) {
        if (asyncExecutor == null) {
            throw new IllegalArgumentException("asyncExecutor cannot be null");
        }
        this.authority = new AdmissionAuthority(settings, extractor, signalListener, clock);
        this.asyncExecutor = asyncExecutor;
        this.ownsAuthority = true;
    }

    /**
     * Derive a limiter that shares quota, queue and serialization with
     * {@code parent}. Closing the derived limiter leaves the parent intact.
     */
    protected RateLimiter(RateLimiter parent) {
        if (parent == null) {
            throw new IllegalArgumentException("parent cannot be null");
        }
        this.authority = parent.authority;
        this.asyncExecutor = parent.asyncExecutor;
        this.ownsAuthority = false;
    }

    /**
     * Block until this caller is admitted.
     *
     * @throws InterruptedException
     *             if interrupted while waiting; the place in the queue is
     *             given up without affecting anyone else
     */
    public Permit acquire() throws InterruptedException {
        CompletableFuture<Permit> future = authority.enqueue(pacingFloor(), DIRECT);
        try {
            return future.get();
        } catch (InterruptedException e) {
            abandon(future);
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Admission failed on " + name(), e.getCause());
        }
    }

    /**
     * Block for at most {@code timeout}. An empty result means the caller
     * left the queue; quota and pacing are untouched.
     */
    public Optional<Permit> tryAcquire(Duration timeout) throws InterruptedException {
        CompletableFuture<Permit> future = authority.enqueue(pacingFloor(), DIRECT);
        try {
            return Optional.of(future.get(Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            abandon(future);
            return Optional.empty();
        } catch (InterruptedException e) {
            abandon(future);
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Admission failed on " + name(), e.getCause());
        }
    }

    public CompletableFuture<Permit> acquireAsync() {
        return acquireAsync(asyncExecutor);
    }

    /**
     * Non-blocking admission. The future completes on {@code executor};
     * cancelling it withdraws the request.
     */
    public CompletableFuture<Permit> acquireAsync(Executor executor) {
        return authority.enqueue(pacingFloor(), executor);
    }

    public Mono<Permit> acquireMono() {
        return Mono.fromFuture(() -> acquireAsync())
                .doOnDiscard(Permit.class, Permit::close);
    }

    /**
     * Run {@code work} while holding a permit; the permit is closed when the
     * inner publisher terminates or is cancelled.
     */
    public <T> Mono<T> withPermit(Function<Permit, Mono<T>> work) {
        return Mono.usingWhen(acquireMono(), work, permit -> Mono.fromRunnable(permit::close));
    }

    @Override
    public Map<String, String> prepareRequest() {
        return Map.of();
    }

    @Override
    public ResponseOutcome observe(ObservedResponse response) {
        return authority.observe(response);
    }

    /**
     * How long a request arriving now would wait for quota, throttle and this
     * limiter's pacing. Callers already in the queue are not counted.
     */
    public Duration computeWait() {
        return authority.computeWait(pacingFloor());
    }

    public QuotaState quotaState() {
        return authority.quotaState();
    }

    public int pendingCount() {
        return authority.pendingCount();
    }

    public String name() {
        return authority.name();
    }

    public AuthRateLimiter withCredential(Credential credential, AuthSettings authSettings) {
        return new AuthRateLimiter(this, credential, authSettings);
    }

    public TelegramRateLimiter forTelegrams(boolean recruitment, TelegramPacing pacing) {
        return new TelegramRateLimiter(this, recruitment, pacing);
    }

    /**
     * Extra spacing applied on top of the shared quota, {@code null} for none.
     */
    protected PacingFloor pacingFloor() {
        return null;
    }

    protected void publish(LimiterSignal signal) {
        authority.publish(signal);
    }

    @Override
    public void close() {
        if (ownsAuthority) {
            authority.close();
        }
    }

    private static void abandon(CompletableFuture<Permit> future) {
        // a failed cancel means the grant won the race, hand the permit back
        if (!future.cancel(false) && !future.isCompletedExceptionally()) {
            future.join().close();
        }
    }
}
