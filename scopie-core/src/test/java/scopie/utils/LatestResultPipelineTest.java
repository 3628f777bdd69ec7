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

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class LatestResultPipelineTest {

    @Test
    public void testSynchronousExecution() {
        SimplePushStream<Integer> input = new SimplePushStream<>();
        List<Throwable> errors = new ArrayList<>();
        LatestResultPipeline<Integer, String> pipeline = new LatestResultPipeline<>(input, i -> "v"+i, 1, Runnable::run, errors::add);
        List<String> results = new ArrayList<>();
        pipeline.subscribe(results::add);
        input.push(1);
        input.push(2);
        assertEquals("results", Arrays.asList("v1", "v2"), results);
        assertEquals("input version", 2, pipeline.getInputVersion());
        assertEquals("output version", 1, pipeline.getOutputVersion());
        assertTrue("no error", errors.isEmpty());
    }

    @Test
    public void testCurrentInputProcessedOnAttach() {
        SimplePushStream<Integer> input = new SimplePushStream<>();
        input.push(21);
        LatestResultPipeline<Integer, Integer> pipeline = new LatestResultPipeline<>(input, i -> i * 2, 1, Runnable::run, e -> {});
        assertEquals("result of current input", 42, (int)pipeline.current().get());
    }

    @Test
    public void testStaleItemsSkipped() {
        SimplePushStream<Integer> input = new SimplePushStream<>();
        List<Runnable> tasks = new ArrayList<>();
        List<Integer> transformed = new ArrayList<>();
        LatestResultPipeline<Integer, Integer> pipeline = new LatestResultPipeline<>(input, i -> {transformed.add(i); return i;}, 1, tasks::add, e -> {});
        for (int i = 0; i<5; ++i) input.push(i);
        assertEquals("producer never blocks", 5, tasks.size());
        for (Runnable t : tasks) t.run();
        assertEquals("only the newest item is transformed", Collections.singletonList(4), transformed);
        assertEquals("published", 4, (int)pipeline.current().get());
    }

    @Test
    public void testAdversarialCompletionOrder() {
        SimplePushStream<Integer> input = new SimplePushStream<>();
        List<Runnable> tasks = new ArrayList<>();
        LatestResultPipeline<Integer, Integer> pipeline = new LatestResultPipeline<>(input, Function.identity(), 4, tasks::add, e -> {});
        List<Integer> results = new ArrayList<>();
        pipeline.subscribe(results::add);
        input.push(0);
        input.push(1);
        tasks.get(1).run(); // newest first
        tasks.get(0).run(); // superseded by 1
        input.push(2);
        input.push(3);
        tasks.get(2).run(); // superseded by 3
        tasks.get(3).run();
        assertEquals("published results", Arrays.asList(1, 3), results);
        assertEquals("output version", 3, pipeline.getOutputVersion());
    }

    @Test
    public void testNoStalePublish() throws Exception {
        SimplePushStream<String> input = new SimplePushStream<>();
        CountDownLatch slowStarted = new CountDownLatch(1);
        CountDownLatch releaseSlow = new CountDownLatch(1);
        CountDownLatch slowDone = new CountDownLatch(1);
        CountDownLatch fastPublished = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            LatestResultPipeline<String, String> pipeline = new LatestResultPipeline<>(input, s -> {
                if (s.equals("slow")) {
                    slowStarted.countDown();
                    try {
                        releaseSlow.await(10, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    slowDone.countDown();
                }
                return s;
            }, 2, executor, e -> {});
            List<String> results = new CopyOnWriteArrayList<>();
            pipeline.subscribe(results::add);
            pipeline.subscribe(s -> {if (s.equals("fast")) fastPublished.countDown();});
            input.push("slow");
            assertTrue("slow transform started", slowStarted.await(10, TimeUnit.SECONDS));
            input.push("fast");
            assertTrue("fast result published", fastPublished.await(10, TimeUnit.SECONDS));
            releaseSlow.countDown();
            assertTrue("slow transform finished", slowDone.await(10, TimeUnit.SECONDS));
            executor.shutdown();
            assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
            assertEquals("stale result discarded", Collections.singletonList("fast"), results);
            assertEquals("output version", 1, pipeline.getOutputVersion());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testMonotonicUnderLoad() throws Exception {
        final int n = 500;
        SimplePushStream<Integer> input = new SimplePushStream<>();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        Random random = new Random(1);
        List<Integer> delays = new ArrayList<>();
        for (int i = 0; i<n; ++i) delays.add(random.nextInt(3));
        CountDownLatch lastPublished = new CountDownLatch(1);
        List<Integer> results = new CopyOnWriteArrayList<>();
        try {
            LatestResultPipeline<Integer, Integer> pipeline = new LatestResultPipeline<>(input, i -> {
                try {
                    Thread.sleep(delays.get(i));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return i;
            }, 3, executor, e -> {});
            pipeline.subscribe(results::add);
            pipeline.subscribe(i -> {if (i==n-1) lastPublished.countDown();});
            for (int i = 0; i<n; ++i) input.push(i);
            assertTrue("newest item always published", lastPublished.await(30, TimeUnit.SECONDS));
            for (int i = 1; i<results.size(); ++i) assertTrue("strictly increasing: "+results.get(i-1)+" then "+results.get(i), results.get(i)>results.get(i-1));
            assertEquals("input version", n, pipeline.getInputVersion());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testFailureAndNoResult() {
        SimplePushStream<Integer> input = new SimplePushStream<>();
        List<Throwable> errors = new ArrayList<>();
        LatestResultPipeline<Integer, Integer> pipeline = new LatestResultPipeline<>(input, i -> {
            if (i<0) throw new IllegalStateException("negative");
            return i%2==0 ? i : null;
        }, 1, Runnable::run, errors::add);
        input.push(2);
        input.push(-1);
        assertEquals("error reported", 1, errors.size());
        assertEquals("error message", "negative", errors.get(0).getMessage());
        input.push(3);
        assertEquals("no result not published", 2, (int)pipeline.current().get());
        input.push(4);
        assertEquals("pipeline keeps running", 4, (int)pipeline.current().get());
        assertEquals("output version", 3, pipeline.getOutputVersion());
    }

    @Test
    public void testFailingSubscriberReported() throws Exception {
        SimplePushStream<Integer> input = new SimplePushStream<>();
        List<Throwable> errors = new CopyOnWriteArrayList<>();
        List<Throwable> uncaught = new CopyOnWriteArrayList<>();
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setUncaughtExceptionHandler((th, e) -> uncaught.add(e));
            return t;
        });
        try {
            LatestResultPipeline<Integer, Integer> pipeline = new LatestResultPipeline<>(input, Function.identity(), 1, executor, errors::add);
            List<Integer> results = new CopyOnWriteArrayList<>();
            pipeline.subscribe(i -> {if (i==1) throw new IllegalStateException("display failed");});
            pipeline.subscribe(results::add);
            input.push(1);
            executor.submit(() -> {}).get(10, TimeUnit.SECONDS);
            assertEquals("subscriber failure reported", 1, errors.size());
            assertTrue(errors.get(0) instanceof MultipleException);
            assertTrue("not thrown on worker thread", uncaught.isEmpty());
            assertEquals("output version updated", 0, pipeline.getOutputVersion());
            input.push(2);
            executor.submit(() -> {}).get(10, TimeUnit.SECONDS);
            assertEquals("pipeline keeps publishing", Arrays.asList(1, 2), results);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void testFailingSubscriberWithSynchronousExecution() {
        SimplePushStream<Integer> input = new SimplePushStream<>();
        List<Throwable> errors = new ArrayList<>();
        LatestResultPipeline<Integer, Integer> pipeline = new LatestResultPipeline<>(input, Function.identity(), 1, Runnable::run, errors::add);
        pipeline.subscribe(i -> {throw new IllegalStateException("display failed");});
        input.push(1);
        assertEquals("failure not propagated to the producer", 1, errors.size());
        assertEquals(1, (int)pipeline.current().get());
    }

    @Test
    public void testRejectedExecutionReported() {
        SimplePushStream<Integer> input = new SimplePushStream<>();
        List<Throwable> errors = new ArrayList<>();
        new LatestResultPipeline<>(input, Function.identity(), 1, r -> {throw new RejectedExecutionException("shut down");}, errors::add);
        input.push(1);
        assertEquals("rejection reported", 1, errors.size());
        assertTrue(errors.get(0) instanceof RejectedExecutionException);
    }

    @Test
    public void testResubmitAndClose() {
        SimplePushStream<Integer> input = new SimplePushStream<>();
        List<Integer> results = new ArrayList<>();
        LatestResultPipeline<Integer, Integer> pipeline = new LatestResultPipeline<>(input, Function.identity(), 1, Runnable::run, e -> {});
        pipeline.subscribe(results::add);
        input.push(7);
        pipeline.resubmitCurrent();
        assertEquals("current input processed again", Arrays.asList(7, 7), results);
        pipeline.close();
        input.push(8);
        assertEquals("detached from input", 2, pipeline.getInputVersion());
        assertFalse("closed pipeline ignores input", results.contains(8));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNoWorker() {
        new LatestResultPipeline<>(new SimplePushStream<Integer>(), Function.identity(), 0, Runnable::run, e -> {});
    }
}
