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
package scopie.utils;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Broadcast of the most recent value plus change notifications.
 * Values are pushed synchronously to subscribers, in subscription order, from the publishing thread. Late subscribers can pull the last value with {@link #current()}.
 * @param <T> type of values
 */
public interface PushStream<T> {
    /**
     * @return last published value, empty if nothing was published yet
     */
    Optional<T> current();
    void subscribe(Consumer<? super T> listener);
    void unsubscribe(Consumer<? super T> listener);
}
