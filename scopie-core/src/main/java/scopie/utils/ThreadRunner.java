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

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool and thread creation helpers.
 */
public class ThreadRunner {
    public final static Logger logger = LoggerFactory.getLogger(ThreadRunner.class);
    public static boolean leaveOneCPUFree = true;
    private static volatile ExecutorService sharedPool;
    private static final Object lock = new Object();

    public static int getMaxCPUs() {
        return Runtime.getRuntime().availableProcessors();
    }

    /**
     * @param cpulimit maximal number of workers, non-positive means no limit
     * @return number of workers for parallel computations: available processors, minus one reserved for interactive work if {@link #leaveOneCPUFree}
     */
    public static int getNbCpus(int cpulimit) {
        int nb = getMaxCPUs();
        if (leaveOneCPUFree && nb>1) nb--;
        if (cpulimit>0 && nb>cpulimit) nb = cpulimit;
        return Math.max(1, nb);
    }

    /**
     * Pool shared by all background computations of the application. Threads are daemon threads created on demand; the number of concurrent computations is bounded by each caller.
     * @return shared pool
     */
    public static ExecutorService sharedPool() {
        if (sharedPool==null) {
            synchronized(lock) {
                if (sharedPool==null) {
                    sharedPool = Executors.newCachedThreadPool(new PriorityThreadFactory("worker", Thread.NORM_PRIORITY, true));
                    logger.debug("shared worker pool created");
                }
            }
        }
        return sharedPool;
    }

    public static class PriorityThreadFactory implements ThreadFactory {
        private static final AtomicInteger poolNumber = new AtomicInteger(1);
        private final AtomicInteger threadNumber = new AtomicInteger(1);
        private final String namePrefix;
        private final int priority;
        private final boolean daemon;
        public PriorityThreadFactory(String name, int priority, boolean daemon) {
            if (priority<Thread.MIN_PRIORITY) priority=Thread.MIN_PRIORITY;
            if (priority>Thread.MAX_PRIORITY) priority=Thread.MAX_PRIORITY;
            this.priority=priority;
            this.daemon=daemon;
            namePrefix = name + "-" +
                          poolNumber.getAndIncrement() +
                         "-thread-";
        }
        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
            t.setDaemon(daemon);
            if (t.getPriority() != priority)
                t.setPriority(priority);
            return t;
        }
    }
}
