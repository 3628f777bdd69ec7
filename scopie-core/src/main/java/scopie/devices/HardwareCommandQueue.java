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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scopie.core.ExceptionReporter;
import scopie.utils.ThreadRunner;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Serializes every access to a hardware resource on a single dedicated thread.
 * <p>
 * Commands are executed in submission order. Between commands, the owner thread runs the idle action and follows the returned {@link IdleActionResult}:
 * call it again right after pending commands, block until the next command, or block until the next command or a timeout.
 * Changing the idle action is itself queued, so it takes effect after previously submitted commands.
 * A failing command only fails its own future. A failing idle action is reported and handled as {@link IdleActionResult#waitForNextEvent()}.
 */
public class HardwareCommandQueue implements AutoCloseable {
    public final static Logger logger = LoggerFactory.getLogger(HardwareCommandQueue.class);
    private final String name;
    private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
    private final WaitStrategy waitStrategy;
    private final Thread thread;
    private final Object lock = new Object();
    private boolean disposed; // guarded by lock
    private volatile boolean running = true;
    private volatile Consumer<Throwable> errorReporter = ExceptionReporter::report;
    private IdleAction idleAction; // owner thread only

    public HardwareCommandQueue(String name, IdleAction idleAction) {
        this(name, idleAction, WaitStrategy.BLOCKING);
    }

    /**
     * Starts the owner thread. The idle action (if any) is called once at start.
     * @param name name of the resource, used for the thread name
     * @param idleAction initial idle action, null means wait for next command
     * @param waitStrategy timed retrieval of commands
     */
    public HardwareCommandQueue(String name, IdleAction idleAction, WaitStrategy waitStrategy) {
        if (waitStrategy==null) throw new IllegalArgumentException("Wait strategy is required");
        this.name = name;
        this.idleAction = idleAction;
        this.waitStrategy = waitStrategy;
        this.thread = new ThreadRunner.PriorityThreadFactory("hw-"+name, Thread.NORM_PRIORITY, true).newThread(this::runLoop);
        thread.start();
    }

    public String getName() {
        return name;
    }

    public void setErrorReporter(Consumer<Throwable> errorReporter) {
        if (errorReporter==null) throw new IllegalArgumentException("Error reporter cannot be null");
        this.errorReporter = errorReporter;
    }

    /**
     * @return whether the owner thread is still servicing commands
     */
    public boolean isAlive() {
        return running && thread.isAlive();
    }

    public boolean isOwnerThread() {
        return Thread.currentThread() == thread;
    }

    /**
     * Runs {@param command} on the owner thread
     * @return future completed with the result of the command, or exceptionally with its exception. Fails with {@link IllegalStateException} if the queue is disposed
     */
    public <T> CompletableFuture<T> submit(Callable<T> command) {
        CompletableFuture<T> future = new CompletableFuture<>();
        enqueue(() -> {
            try {
                future.complete(command.call());
            } catch (Throwable t) {
                future.completeExceptionally(t);
            }
        }, future);
        return future;
    }

    public CompletableFuture<Void> execute(Runnable command) {
        return submit(() -> {
            command.run();
            return null;
        });
    }

    /**
     * Replaces the idle action, after all previously submitted commands
     * @param action new idle action, null means wait for next command
     */
    public CompletableFuture<Void> setIdleAction(IdleAction action) {
        return execute(() -> {
            logger.debug("{}: idle action changed", name);
            idleAction = action;
        });
    }

    /**
     * Queues the final command: {@param teardown} is run on the owner thread after all previously submitted commands, then the thread stops.
     * Commands submitted afterwards fail with {@link IllegalStateException}.
     * @param teardown release of the hardware resource, may be null
     * @return future completed when teardown has run
     */
    public CompletableFuture<Void> dispose(Runnable teardown) {
        CompletableFuture<Void> future = new CompletableFuture<>();
        synchronized (lock) {
            if (disposed) {
                future.completeExceptionally(new IllegalStateException(name+" is already disposed"));
                return future;
            }
            disposed = true;
            queue.add(() -> {
                running = false;
                try {
                    if (teardown!=null) teardown.run();
                    future.complete(null);
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
        }
        return future;
    }

    @Override
    public void close() {
        if (!isDisposed()) dispose(null);
    }

    public boolean isDisposed() {
        synchronized (lock) {
            return disposed;
        }
    }

    /**
     * @return true if the owner thread terminated within {@param timeoutMillis}
     */
    public boolean awaitTermination(long timeoutMillis) throws InterruptedException {
        thread.join(timeoutMillis);
        return !thread.isAlive();
    }

    private void enqueue(Runnable command, CompletableFuture<?> future) {
        synchronized (lock) {
            if (disposed) {
                future.completeExceptionally(new IllegalStateException(name+" is disposed"));
                return;
            }
            queue.add(command);
        }
    }

    private void runLoop() {
        logger.debug("{}: owner thread started", name);
        IdleActionResult last = IdleActionResult.loopImmediately();
        try {
            while (running) {
                Runnable command = nextCommand(last);
                while (command!=null) {
                    command.run();
                    if (!running) break;
                    command = queue.poll();
                }
                if (!running) break;
                last = runIdleAction();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("{}: owner thread interrupted", name);
        } finally {
            running = false;
            logger.debug("{}: owner thread stopped", name);
        }
    }

    private Runnable nextCommand(IdleActionResult last) throws InterruptedException {
        switch (last.getPolicy()) {
            case WAIT_FOR_NEXT_EVENT:
                return queue.take();
            case WAIT_WITH_TIMEOUT:
                return waitStrategy.poll(queue, last.getTimeoutMillis());
            case LOOP_IMMEDIATELY:
            default:
                return queue.poll();
        }
    }

    private IdleActionResult runIdleAction() {
        if (idleAction==null) return IdleActionResult.waitForNextEvent();
        try {
            IdleActionResult res = idleAction.run();
            return res == null ? IdleActionResult.waitForNextEvent() : res;
        } catch (Exception e) {
            logger.debug("{}: idle action failed", name, e);
            errorReporter.accept(e);
            return IdleActionResult.waitForNextEvent();
        }
    }

    @Override
    public String toString() {
        return "HardwareCommandQueue{" + name + "}";
    }
}
