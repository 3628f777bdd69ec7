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
package scopie.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scopie.core.ExceptionReporter;
import scopie.core.PropertyUtils;
import scopie.image.RawImage;
import scopie.utils.LatestResultPipeline;
import scopie.utils.PushStream;
import scopie.utils.ThreadRunner;

import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Post-processing of raw frames before display: only the result of the newest frame is published.
 * Changing a setting reprocesses the last frame.
 */
public class ImageProcessor implements PushStream<RawImage<?>>, AutoCloseable {
    public final static Logger logger = LoggerFactory.getLogger(ImageProcessor.class);
    private volatile boolean sortStretch;
    private final LatestResultPipeline<RawImage<?>, RawImage<?>> pipeline;

    /**
     * Workers: {@value PropertyUtils#PROCESSING_WORKERS} property, or available processors minus one if not positive
     */
    public ImageProcessor(PushStream<RawImage<?>> input) {
        this(input, getDefaultWorkers(), ThreadRunner.sharedPool(), ExceptionReporter::report);
    }

    public ImageProcessor(PushStream<RawImage<?>> input, int workers, Executor executor, Consumer<Throwable> errorReporter) {
        this.pipeline = new LatestResultPipeline<>(input, this::process, workers, executor, errorReporter);
    }

    public static int getDefaultWorkers() {
        int workers = PropertyUtils.get(PropertyUtils.PROCESSING_WORKERS, 0);
        return workers>0 ? workers : ThreadRunner.getNbCpus(0);
    }

    private RawImage<?> process(RawImage<?> frame) {
        return sortStretch ? SortStretch.stretch(frame) : frame;
    }

    public boolean isSortStretch() {
        return sortStretch;
    }

    public void setSortStretch(boolean sortStretch) {
        if (this.sortStretch == sortStretch) return;
        this.sortStretch = sortStretch;
        logger.debug("sort stretch: {}", sortStretch);
        pipeline.resubmitCurrent();
    }

    public LatestResultPipeline<RawImage<?>, RawImage<?>> getPipeline() {
        return pipeline;
    }

    @Override
    public Optional<RawImage<?>> current() {
        return pipeline.current();
    }

    @Override
    public void subscribe(Consumer<? super RawImage<?>> listener) {
        pipeline.subscribe(listener);
    }

    @Override
    public void unsubscribe(Consumer<? super RawImage<?>> listener) {
        pipeline.unsubscribe(listener);
    }

    @Override
    public void close() {
        pipeline.close();
    }
}
