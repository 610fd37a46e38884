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

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Permission to send one request.
 *
 * <p>
 * Only one permit per admission authority is outstanding at a time; the next
 * caller in line is admitted after this one is closed. Use it in
 * try-with-resources so it is released on every exit path. Closing twice is
 * harmless.
 */
public final class Permit implements AutoCloseable {

    private final AdmissionAuthority authority;
    private final long sequence;
    private final long grantedAtNanos;
    private final AtomicBoolean released = new AtomicBoolean(false);

    Permit(AdmissionAuthority authority, long sequence, long grantedAtNanos) {
        this.authority = authority;
        this.sequence = sequence;
        this.grantedAtNanos = grantedAtNanos;
    }

    /**
     * Arrival number of the request this permit was granted to.
     */
    public long sequence() {
        return sequence;
    }

    public long grantedAtNanos() {
        return grantedAtNanos;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            authority.release(this);
        }
    }

    @Override
    public String toString() {
        return "Permit[" + authority.name() + "#" + sequence + (released.get() ? ", released]" : "]");
    }
}
