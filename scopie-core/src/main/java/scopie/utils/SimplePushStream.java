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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Push stream whose values are published with {@link #push(Object)}.
 * Pushes are serialized: subscribers observe values in the order they were pushed.
 * @param <T> type of values
 */
public class SimplePushStream<T> implements PushStream<T> {
    public final static Logger logger = LoggerFactory.getLogger(SimplePushStream.class);
    private volatile T current;
    private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();

    @Override
    public Optional<T> current() {
        return Optional.ofNullable(current);
    }

    @Override
    public void subscribe(Consumer<? super T> listener) {
        listeners.add(listener);
    }

    @Override
    public void unsubscribe(Consumer<? super T> listener) {
        listeners.remove(listener);
    }

    public int subscriberCount() {
        return listeners.size();
    }

    /**
     * Replaces the current value and calls every subscriber once. All subscribers are called even if one of them throws.
     * @param value non-null value
     * @throws MultipleException if subscribers threw exceptions
     */
    public synchronized void push(T value) {
        if (value==null) throw new IllegalArgumentException("Cannot push null value");
        current = value;
        MultipleException errors = null;
        for (Consumer<? super T> l : listeners) {
            try {
                l.accept(value);
            } catch (RuntimeException e) {
                if (errors==null) errors = new MultipleException();
                errors.addExceptions(new Pair<>(l.toString(), e));
            }
        }
        if (errors!=null) throw errors;
    }
}
