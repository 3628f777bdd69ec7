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

import scopie.image.RawImage;
import scopie.utils.PushStream;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Frame producer. Frames are pushed from the thread that owns the camera hardware.
 */
public interface Camera extends PushStream<RawImage<?>>, AutoCloseable {
    String getId();

    /**
     * Starts or stops continuous exposures
     * @return future completed once the owner thread has applied the change
     */
    CompletableFuture<Void> setExposing(boolean exposing);

    /**
     * @return last read control values, by control name
     */
    PushStream<Map<String, Double>> getControls();

    @Override
    void close();
}
