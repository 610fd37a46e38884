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

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A caller waiting in an {@link AdmissionAuthority} queue.
 *
 * <p>
 * The state moves from WAITING to exactly one of GRANTED or CANCELLED. The
 * authority only mutates shared state after winning the WAITING to GRANTED
 * transition, so a ticket cancelled first never touches quota or pacing.
 */
@Slf4j
final class AdmissionTicket {

    private enum State {
        WAITING, GRANTED, CANCELLED
    }

    private final long sequence;
    private final PacingFloor floor;
    private final Executor delivery;
    private final CompletableFuture<Permit> future = new CompletableFuture<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.WAITING);

    AdmissionTicket(long sequence, PacingFloor floor, Executor delivery) {
        this.sequence = sequence;
        this.floor = floor;
        this.delivery = delivery;
    }

    long sequence() {
        return sequence;
    }

    PacingFloor floor() {
        return floor;
    }

    CompletableFuture<Permit> future() {
        return future;
    }

    boolean isWaiting() {
        return state.get() == State.WAITING;
    }

    boolean markGranted() {
        return state.compareAndSet(State.WAITING, State.GRANTED);
    }

    boolean cancel() {
        return state.compareAndSet(State.WAITING, State.CANCELLED);
    }

    /**
     * Hand the permit to the waiter on its own executor. If the waiter gave up
     * in the meantime the permit goes straight back.
     */
    void deliver(Permit permit) {
        Runnable completion = () -> {
            if (!future.complete(permit)) {
                permit.close();
            }
        };
        try {
            delivery.execute(completion);
        } catch (RejectedExecutionException e) {
            log.warn("[RateLimiter] Delivery executor rejected permit #{}, completing inline", sequence);
            completion.run();
        }
    }
}
