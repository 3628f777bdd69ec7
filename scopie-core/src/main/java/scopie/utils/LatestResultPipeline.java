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
import scopie.core.ExceptionReporter;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Asynchronous transformation of a push stream that only publishes the newest result.
 * <p>
 * Each input value gets a version number. Work is run on an executor, at most {@code workers} transforms at a time.
 * An item is abandoned before its transform if a newer item was accepted meanwhile or if a newer result was already published.
 * A result is published only if its version is greater than the last published version, so subscribers observe results in strictly increasing version order.
 * A {@code null} result means "no result" and is not published. Exceptions thrown by the transform or by output subscribers are sent to the error reporter; the worker keeps running.
 * @param <I> input type
 * @param <O> output type
 */
public class LatestResultPipeline<I, O> extends PushProcessor<I, O> {
    public final static Logger logger = LoggerFactory.getLogger(LatestResultPipeline.class);
    private final Function<? super I, ? extends O> transform;
    private final Semaphore workers;
    private final Executor executor;
    private final Consumer<Throwable> errorReporter;
    private final AtomicLong inputVersion = new AtomicLong();
    private final Object lock = new Object();
    private long outputVersion = -1; // guarded by lock

    public LatestResultPipeline(PushStream<I> input, Function<? super I, ? extends O> transform, int workers) {
        this(input, transform, workers, ThreadRunner.sharedPool(), ExceptionReporter::report);
    }

    public LatestResultPipeline(PushStream<I> input, Function<? super I, ? extends O> transform, int workers, Executor executor, Consumer<Throwable> errorReporter) {
        super(input);
        if (workers<1) throw new IllegalArgumentException("At least one worker is required, got: "+workers);
        if (transform==null || executor==null || errorReporter==null) throw new IllegalArgumentException("transform, executor and error reporter are required");
        this.transform = transform;
        this.workers = new Semaphore(workers);
        this.executor = executor;
        this.errorReporter = errorReporter;
        attach();
    }

    @Override
    protected void process(I item) {
        final long version = inputVersion.getAndIncrement();
        try {
            executor.execute(() -> run(item, version));
        } catch (RejectedExecutionException e) {
            errorReporter.accept(e);
        }
    }

    private void run(I item, long version) {
        try {
            workers.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("interrupted while waiting for a worker, item {} dropped", version);
            return;
        }
        try {
            if (version + 1 < inputVersion.get()) {
                logger.trace("item {} superseded before processing", version);
                return;
            }
            synchronized (lock) {
                if (version <= outputVersion) {
                    logger.trace("item {} older than published result {}", version, outputVersion);
                    return;
                }
            }
            O result;
            try {
                result = transform.apply(item);
            } catch (RuntimeException e) {
                errorReporter.accept(e);
                return;
            }
            if (result == null) return;
            synchronized (lock) {
                if (version > outputVersion) {
                    outputVersion = version;
                    try {
                        push(result);
                    } catch (RuntimeException e) {
                        errorReporter.accept(e);
                    }
                } else logger.trace("result {} discarded: newer result {} already published", version, outputVersion);
            }
        } finally {
            workers.release();
        }
    }

    /**
     * @return number of accepted input items
     */
    public long getInputVersion() {
        return inputVersion.get();
    }

    /**
     * @return version of the last published result, -1 if none was published
     */
    public long getOutputVersion() {
        synchronized (lock) {
            return outputVersion;
        }
    }

    /**
     * Processes again the current value of the input, as a new item. Used when the transform parameters change.
     */
    public void resubmitCurrent() {
        input.current().ifPresent(this::process);
    }
}
