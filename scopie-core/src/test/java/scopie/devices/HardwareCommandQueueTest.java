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

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class HardwareCommandQueueTest {

    /**
     * Wait strategy that does not block: a timed wait without pending command advances the clock by the timeout
     */
    static class FakeClock implements WaitStrategy {
        final AtomicLong time = new AtomicLong();
        @Override
        public Runnable poll(BlockingQueue<Runnable> queue, long timeoutMillis) {
            Runnable r = queue.poll();
            if (r==null) time.addAndGet(timeoutMillis);
            return r;
        }
    }

    @Test
    public void testIdlePolicyTiming() throws Exception {
        FakeClock clock = new FakeClock();
        List<Long> times = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);
        IdleAction idle = () -> {
            times.add(clock.time.get());
            int call = times.size() - 1;
            if (call>=6) {
                done.countDown();
                return IdleActionResult.waitForNextEvent();
            }
            return call%2==0 ? IdleActionResult.loopImmediately() : IdleActionResult.waitFor(1000, TimeUnit.MILLISECONDS);
        };
        HardwareCommandQueue queue = new HardwareCommandQueue("timing", idle, clock);
        try {
            assertTrue("idle calls", done.await(10, TimeUnit.SECONDS));
            assertEquals("call times", Arrays.asList(0L, 0L, 1000L, 1000L, 2000L, 2000L, 3000L), times);
        } finally {
            queue.dispose(null).get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    public void testWaitForNextEvent() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        HardwareCommandQueue queue = new HardwareCommandQueue("wait", () -> {
            calls.incrementAndGet();
            return IdleActionResult.waitForNextEvent();
        });
        try {
            for (int i = 0; i<3; ++i) queue.execute(() -> {}).get(10, TimeUnit.SECONDS);
            Thread.sleep(50);
            assertTrue("at most one idle call per wake-up: "+calls.get(), calls.get()>=2 && calls.get()<=4);
            int before = calls.get();
            Thread.sleep(100);
            assertEquals("no idle call without event", before, calls.get());
        } finally {
            queue.dispose(null).get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    public void testCommandWakesTimedWait() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        HardwareCommandQueue queue = new HardwareCommandQueue("timed", () -> {
            calls.incrementAndGet();
            return IdleActionResult.waitFor(10, TimeUnit.MINUTES);
        });
        try {
            long start = System.currentTimeMillis();
            assertEquals("result", "done", queue.submit(() -> "done").get(10, TimeUnit.SECONDS));
            assertTrue("command not delayed by idle wait", System.currentTimeMillis() - start < 5000);
        } finally {
            queue.dispose(null).get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    public void testCommandOrder() throws Exception {
        HardwareCommandQueue queue = new HardwareCommandQueue("order", null);
        List<Integer> executed = new ArrayList<>(); // owner thread only
        List<Boolean> onOwnerThread = new CopyOnWriteArrayList<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        try {
            for (int i = 0; i<100; ++i) {
                final int idx = i;
                futures.add(queue.execute(() -> {
                    executed.add(idx);
                    onOwnerThread.add(queue.isOwnerThread());
                }));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);
            List<Integer> expected = new ArrayList<>();
            for (int i = 0; i<100; ++i) expected.add(i);
            assertEquals("FIFO", expected, queue.submit(() -> new ArrayList<>(executed)).get(10, TimeUnit.SECONDS));
            assertFalse("all on owner thread", onOwnerThread.contains(false));
            assertFalse("caller is not owner", queue.isOwnerThread());
        } finally {
            queue.dispose(null).get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    public void testFailureIsolatedToFuture() throws Exception {
        HardwareCommandQueue queue = new HardwareCommandQueue("failure", null);
        try {
            CompletableFuture<Integer> failing = queue.submit(() -> {throw new IllegalStateException("device error");});
            try {
                failing.get(10, TimeUnit.SECONDS);
                fail("command failure should be reported in its future");
            } catch (ExecutionException e) {
                assertTrue("cause", e.getCause() instanceof IllegalStateException);
            }
            assertEquals("queue keeps running", 3, (int)queue.submit(() -> 3).get(10, TimeUnit.SECONDS));
            assertTrue(queue.isAlive());
        } finally {
            queue.dispose(null).get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    public void testIdleActionSwapOrdering() throws Exception {
        List<String> events = new CopyOnWriteArrayList<>();
        CountDownLatch firstIdle = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch newIdle = new CountDownLatch(1);
        HardwareCommandQueue queue = new HardwareCommandQueue("swap", () -> {
            events.add("A");
            firstIdle.countDown();
            return IdleActionResult.waitForNextEvent();
        });
        try {
            assertTrue(firstIdle.await(10, TimeUnit.SECONDS));
            queue.execute(() -> {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            queue.execute(() -> events.add("c1"));
            queue.setIdleAction(() -> {
                events.add("B");
                newIdle.countDown();
                return IdleActionResult.waitForNextEvent();
            });
            queue.execute(() -> events.add("c2"));
            release.countDown();
            assertTrue(newIdle.await(10, TimeUnit.SECONDS));
            assertEquals("events", Arrays.asList("A", "c1", "c2", "B"), events);
        } finally {
            queue.dispose(null).get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    public void testIdleActionFailure() throws Exception {
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch reporterSet = new CountDownLatch(1);
        CountDownLatch secondCall = new CountDownLatch(1);
        HardwareCommandQueue queue = new HardwareCommandQueue("idle failure", () -> {
            if (calls.incrementAndGet()==1) {
                reporterSet.await(10, TimeUnit.SECONDS);
                throw new IllegalStateException("readout failed");
            }
            secondCall.countDown();
            return IdleActionResult.waitForNextEvent();
        });
        queue.setErrorReporter(errors::add);
        reporterSet.countDown();
        try {
            Thread.sleep(100);
            assertEquals("idle action not called again after failure", 1, calls.get());
            assertEquals("failure reported", 1, errors.size());
            assertEquals("readout failed", errors.get(0).getMessage());
            queue.execute(() -> {}).get(10, TimeUnit.SECONDS);
            assertTrue("idle action called after next command", secondCall.await(10, TimeUnit.SECONDS));
            assertTrue(queue.isAlive());
        } finally {
            queue.dispose(null).get(10, TimeUnit.SECONDS);
        }
    }

    @Test
    public void testDispose() throws Exception {
        HardwareCommandQueue queue = new HardwareCommandQueue("dispose", null);
        List<String> events = new CopyOnWriteArrayList<>();
        queue.execute(() -> events.add("command"));
        CompletableFuture<Void> disposed = queue.dispose(() -> events.add("teardown on owner: "+queue.isOwnerThread()));
        CompletableFuture<Integer> late = queue.submit(() -> 1);
        disposed.get(10, TimeUnit.SECONDS);
        assertEquals("events", Arrays.asList("command", "teardown on owner: true"), events);
        try {
            late.get(10, TimeUnit.SECONDS);
            fail("submission after dispose should fail");
        } catch (ExecutionException e) {
            assertTrue("cause", e.getCause() instanceof IllegalStateException);
        }
        assertTrue("thread terminated", queue.awaitTermination(10000));
        assertFalse(queue.isAlive());
        assertTrue(queue.isDisposed());
        assertTrue("second dispose fails", queue.dispose(null).isCompletedExceptionally());
    }
}
