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
import scopie.core.PropertyUtils;
import scopie.image.RawImage;
import scopie.utils.PushStream;
import scopie.utils.SimplePushStream;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Simulated camera producing frames from a supplier.
 * The supplier is only called from the owner thread of the camera's {@link HardwareCommandQueue}, like a device handle.
 * While exposing, a frame is produced each time the owner thread is idle. Otherwise control values are refreshed periodically.
 */
public class DebugCamera implements Camera {
    public final static Logger logger = LoggerFactory.getLogger(DebugCamera.class);
    public final static String CONTROL_EXPOSING = "exposing";
    public final static String CONTROL_FRAME_COUNT = "frame_count";
    private final String id;
    private final Supplier<? extends RawImage<?>> frameSource;
    private final long controlRefreshMillis;
    private final SimplePushStream<RawImage<?>> frames = new SimplePushStream<>();
    private final SimplePushStream<Map<String, Double>> controls = new SimplePushStream<>();
    private final HardwareCommandQueue queue;
    // owner thread only
    private boolean exposing;
    private long frameCount;

    public DebugCamera(String id, RawImage<?> image) {
        this(id, () -> image);
    }

    public DebugCamera(String id, Supplier<? extends RawImage<?>> frameSource) {
        this(id, frameSource, PropertyUtils.get(PropertyUtils.CAMERA_CONTROL_REFRESH_MS, 1000L), WaitStrategy.BLOCKING);
    }

    public DebugCamera(String id, Supplier<? extends RawImage<?>> frameSource, long controlRefreshMillis, WaitStrategy waitStrategy) {
        if (controlRefreshMillis<=0) throw new IllegalArgumentException("Control refresh period must be positive, got: "+controlRefreshMillis);
        this.id = id;
        this.frameSource = frameSource;
        this.controlRefreshMillis = controlRefreshMillis;
        this.queue = new HardwareCommandQueue(id, this::idle, waitStrategy);
    }

    private IdleActionResult idle() {
        if (exposing) {
            pushFrame();
            return IdleActionResult.loopImmediately();
        } else {
            refreshControls();
            return IdleActionResult.waitFor(controlRefreshMillis, TimeUnit.MILLISECONDS);
        }
    }

    private void pushFrame() {
        RawImage<?> frame = frameSource.get();
        if (frame==null) throw new IllegalStateException(id+": no frame available");
        ++frameCount;
        frames.push(frame);
    }

    private void refreshControls() {
        Map<String, Double> values = new LinkedHashMap<>();
        values.put(CONTROL_EXPOSING, exposing ? 1d : 0d);
        values.put(CONTROL_FRAME_COUNT, (double)frameCount);
        controls.push(Collections.unmodifiableMap(values));
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public CompletableFuture<Void> setExposing(boolean exposing) {
        return queue.execute(() -> {
            if (this.exposing!=exposing) logger.debug("{}: exposing: {}", id, exposing);
            this.exposing = exposing;
        });
    }

    /**
     * Pushes {@param n} frames from the owner thread
     */
    public CompletableFuture<Void> push(int n) {
        return queue.execute(() -> {
            for (int i = 0; i<n; ++i) pushFrame();
        });
    }

    @Override
    public PushStream<Map<String, Double>> getControls() {
        return controls;
    }

    public HardwareCommandQueue getCommandQueue() {
        return queue;
    }

    @Override
    public Optional<RawImage<?>> current() {
        return frames.current();
    }

    @Override
    public void subscribe(Consumer<? super RawImage<?>> listener) {
        frames.subscribe(listener);
    }

    @Override
    public void unsubscribe(Consumer<? super RawImage<?>> listener) {
        frames.unsubscribe(listener);
    }

    @Override
    public void close() {
        if (!queue.isDisposed()) queue.dispose(() -> {
            exposing = false;
            logger.debug("{}: closed after {} frames", id, frameCount);
        });
    }

    @Override
    public String toString() {
        return "DebugCamera{" + id + "}";
    }
}
