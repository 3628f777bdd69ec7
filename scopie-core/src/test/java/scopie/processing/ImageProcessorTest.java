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

import org.junit.Test;
import scopie.image.ImageByte;
import scopie.image.RawImage;
import scopie.utils.SimplePushStream;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ImageProcessorTest {

    @Test
    public void testSortStretchToggle() {
        SimplePushStream<RawImage<?>> frames = new SimplePushStream<>();
        List<Throwable> errors = new ArrayList<>();
        ImageProcessor processor = new ImageProcessor(frames, 1, Runnable::run, errors::add);
        List<RawImage<?>> results = new ArrayList<>();
        processor.subscribe(results::add);
        ImageByte frame = new ImageByte("frame", 2, new byte[]{10, (byte)200, 10, 50});
        frames.push(frame);
        assertSame("identity when stretch disabled", frame, processor.current().get());
        processor.setSortStretch(true);
        assertTrue(processor.isSortStretch());
        assertEquals("last frame reprocessed", 2, results.size());
        assertEquals("stretched", 191, processor.current().get().getPixelInt(1));
        processor.setSortStretch(true);
        assertEquals("unchanged setting does not reprocess", 2, results.size());
        processor.close();
        frames.push(frame);
        assertEquals("closed", 2, results.size());
        assertTrue(errors.isEmpty());
    }

    @Test
    public void testDefaultWorkers() {
        assertTrue("at least one worker", ImageProcessor.getDefaultWorkers()>=1);
    }
}
