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
package scopie.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Process-wide sink for errors that occur on background threads and cannot be returned to a caller.
 * Errors are logged and forwarded to registered listeners (e.g. a user interface).
 */
public class ExceptionReporter {
    public final static Logger logger = LoggerFactory.getLogger(ExceptionReporter.class);
    private final static List<Consumer<Throwable>> listeners = new CopyOnWriteArrayList<>();

    public static void report(Throwable t) {
        logger.error("background error: {}", t.toString(), t);
        for (Consumer<Throwable> l : listeners) {
            try {
                l.accept(t);
            } catch (RuntimeException e) {
                logger.error("error listener {} failed", l, e);
            }
        }
    }

    public static void addListener(Consumer<Throwable> listener) {
        listeners.add(listener);
    }

    public static void removeListener(Consumer<Throwable> listener) {
        listeners.remove(listener);
    }

    /**
     * Reports the failure of {@param future}, if it fails
     * @return {@param future}
     */
    public static <T> CompletableFuture<T> reportFailure(CompletableFuture<T> future) {
        future.whenComplete((r, t) -> {
            if (t!=null) report(t instanceof CompletionException && t.getCause()!=null ? t.getCause() : t);
        });
        return future;
    }
}
