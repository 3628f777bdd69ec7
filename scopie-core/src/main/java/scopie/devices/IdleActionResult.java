/* 
 * Copyright (C) 2025 Scopie developers
 *
 * This File is part of Scopie
 *
 * Scopie is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Scopie is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with Scopie.  If not, see <http://www.gnu.org/licenses/>.
 */
package scopie.devices;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * What the owner thread of a {@link HardwareCommandQueue} does after an idle action returned.
 */
public final class IdleActionResult {
    public enum Policy {
        /** service queued commands, then call the idle action again */
        LOOP_IMMEDIATELY,
        /** block until a command is submitted */
        WAIT_FOR_NEXT_EVENT,
        /** block until a command is submitted or the timeout expires */
        WAIT_WITH_TIMEOUT
    }
    private final static IdleActionResult LOOP = new IdleActionResult(Policy.LOOP_IMMEDIATELY, 0);
    private final static IdleActionResult WAIT = new IdleActionResult(Policy.WAIT_FOR_NEXT_EVENT, 0);
    private final Policy policy;
    private final long timeoutMillis;

    private IdleActionResult(Policy policy, long timeoutMillis) {
        this.policy = policy;
        this.timeoutMillis = timeoutMillis;
    }

    public static IdleActionResult loopImmediately() {
        return LOOP;
    }

    public static IdleActionResult waitForNextEvent() {
        return WAIT;
    }

    public static IdleActionResult waitFor(long duration, TimeUnit unit) {
        long millis = unit.toMillis(duration);
        if (millis<0) throw new IllegalArgumentException("Negative timeout: "+duration+" "+unit);
        return new IdleActionResult(Policy.WAIT_WITH_TIMEOUT, millis);
    }

    public static IdleActionResult waitFor(Duration duration) {
        return waitFor(duration.toMillis(), TimeUnit.MILLISECONDS);
    }

    public Policy getPolicy() {
        return policy;
    }

    /**
     * @return timeout in milliseconds, only relevant for {@link Policy#WAIT_WITH_TIMEOUT}
     */
    public long getTimeoutMillis() {
        return timeoutMillis;
    }

    @Override
    public String toString() {
        return policy==Policy.WAIT_WITH_TIMEOUT ? policy+"("+timeoutMillis+"ms)" : policy.toString();
    }
}
