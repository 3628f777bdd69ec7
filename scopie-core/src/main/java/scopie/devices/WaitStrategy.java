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

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Timed retrieval of the next command of a {@link HardwareCommandQueue}.
 */
@FunctionalInterface
public interface WaitStrategy {
    /**
     * @param timeoutMillis maximal waiting time
     * @return next command, or null if none arrived before the timeout
     */
    Runnable poll(BlockingQueue<Runnable> queue, long timeoutMillis) throws InterruptedException;

    WaitStrategy BLOCKING = (queue, timeoutMillis) -> queue.poll(timeoutMillis, TimeUnit.MILLISECONDS);
}
