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
 * Push stream computed from the values of another push stream.
 * Subclasses call {@link #attach()} once they are fully initialized: it subscribes to the input and processes its current value, if any.
 * @param <I> input type
 * @param <O> output type
 */
public abstract class PushProcessor<I, O> implements PushStream<O>, AutoCloseable {
    protected final PushStream<I> input;
    private final SimplePushStream<O> output = new SimplePushStream<>();
    private final Consumer<I> inputListener = this::process;

    protected PushProcessor(PushStream<I> input) {
        this.input = input;
    }

    protected void attach() {
        input.subscribe(inputListener);
        input.current().ifPresent(this::process);
    }

    public PushStream<I> getInput() {
        return input;
    }

    /**
     * Called on the producer thread for each new input value
     */
    protected abstract void process(I item);

    protected void push(O value) {
        output.push(value);
    }

    @Override
    public Optional<O> current() {
        return output.current();
    }

    @Override
    public void subscribe(Consumer<? super O> listener) {
        output.subscribe(listener);
    }

    @Override
    public void unsubscribe(Consumer<? super O> listener) {
        output.unsubscribe(listener);
    }

    /**
     * Stops listening to the input
     */
    @Override
    public void close() {
        input.unsubscribe(inputListener);
    }
}
