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
package scopie.guiding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scopie.core.ExceptionReporter;
import scopie.core.PropertyUtils;
import scopie.image.RawImage;
import scopie.processing.registration.PhaseCorrelation;
import scopie.processing.registration.PixelOffset;
import scopie.utils.LatestResultPipeline;
import scopie.utils.PushStream;
import scopie.utils.ThreadRunner;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Offset of each incoming frame relative to a reference frame, for guiding.
 * No offset is published while no reference is set. Frames arriving while a previous one is being registered are skipped when a newer frame is available.
 */
public class OffsetPipeline implements PushStream<PixelOffset>, AutoCloseable {
    public final static Logger logger = LoggerFactory.getLogger(OffsetPipeline.class);
    private final int requestedSize, maxSize;
    private final boolean normalize;
    private volatile PhaseCorrelation reference;
    private final LatestResultPipeline<RawImage<?>, PixelOffset> pipeline;

    /**
     * Working size and workers are read from properties
     */
    public OffsetPipeline(PushStream<RawImage<?>> frames) {
        this(frames, PropertyUtils.get(PropertyUtils.REGISTRATION_REQUESTED_SIZE, 256), PropertyUtils.get(PropertyUtils.REGISTRATION_MAX_SIZE, 512),
                PropertyUtils.get(PropertyUtils.REGISTRATION_NORMALIZE, false), Math.max(1, PropertyUtils.get(PropertyUtils.GUIDING_WORKERS, 1)),
                ThreadRunner.sharedPool(), ExceptionReporter::report);
    }

    public OffsetPipeline(PushStream<RawImage<?>> frames, int requestedSize, int maxSize, boolean normalize, int workers, Executor executor, Consumer<Throwable> errorReporter) {
        this.requestedSize = requestedSize;
        this.maxSize = maxSize;
        this.normalize = normalize;
        this.pipeline = new LatestResultPipeline<>(frames, this::register, workers, executor, errorReporter);
    }

    private PixelOffset register(RawImage<?> frame) {
        PhaseCorrelation ref = reference;
        if (ref==null) return null;
        return ref.offset(frame);
    }

    /**
     * Sets the reference frame. Following frames are registered against it.
     * @return working size of the registration
     * @throws IllegalArgumentException if the frame is too small
     */
    public int setReference(RawImage<?> frame) {
        PhaseCorrelation ref = new PhaseCorrelation(frame, requestedSize, maxSize, normalize);
        reference = ref;
        logger.info("guiding reference set: {} (working size: {})", frame, ref.getWorkingSize());
        return ref.getWorkingSize();
    }

    /**
     * Uses the last received frame as reference
     * @return false if no frame was received yet
     */
    public boolean setReferenceFromCurrent() {
        Optional<RawImage<?>> frame = pipeline.getInput().current();
        if (!frame.isPresent()) return false;
        setReference(frame.get());
        return true;
    }

    public void clearReference() {
        reference = null;
        logger.info("guiding reference cleared");
    }

    public boolean hasReference() {
        return reference!=null;
    }

    public LatestResultPipeline<RawImage<?>, PixelOffset> getPipeline() {
        return pipeline;
    }

    @Override
    public Optional<PixelOffset> current() {
        return pipeline.current();
    }

    @Override
    public void subscribe(Consumer<? super PixelOffset> listener) {
        pipeline.subscribe(listener);
    }

    @Override
    public void unsubscribe(Consumer<? super PixelOffset> listener) {
        pipeline.unsubscribe(listener);
    }

    @Override
    public void close() {
        pipeline.close();
    }
}
