/*-
 * #%L
 * LuckyStack lucky imaging stacker for ImageJ.
 * %%
 * Copyright (C) 2025 LuckyStack developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */
package luckystack.imaging;

import static org.junit.Assert.*;

import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

import org.junit.Test;

public class ChannelsTest {

	@Test
	public void roundsAndClampsIntegerTypes() {
		final float[] v = {-3, 12.4f, 12.6f, 300};
		final ImageProcessor b = Channels.toProcessor(new float[][]{v}, 2, 2, 8);
		assertTrue(b instanceof ByteProcessor);
		assertEquals(0, b.get(0, 0));
		assertEquals(12, b.get(1, 0));
		assertEquals(13, b.get(0, 1));
		assertEquals(255, b.get(1, 1));

		final ImageProcessor s = Channels.toProcessor(new float[][]{{70000, 40000.2f, 1, -1}}, 2, 2, 16);
		assertTrue(s instanceof ShortProcessor);
		assertEquals(65535, s.get(0, 0));
		assertEquals(40000, s.get(1, 0));
		assertEquals(0, s.get(1, 1));
	}

	@Test
	public void packsColorChannels() {
		final ImageProcessor c = Channels.toProcessor(new float[][]{{10}, {20.4f}, {300}}, 1, 1, 24);
		assertTrue(c instanceof ColorProcessor);
		assertEquals((10 << 16) | (20 << 8) | 255, c.get(0, 0) & 0xffffff);
	}

	@Test
	public void keepsFloats() {
		final float[] v = {1.25f, -2};
		final ImageProcessor f = Channels.toProcessor(new float[][]{v}, 2, 1, 32);
		assertTrue(f instanceof FloatProcessor);
		assertEquals(-2, f.getf(1, 0), 0);
		assertNotSame(v, f.getPixels());
	}

	@Test(expected = IllegalArgumentException.class)
	public void rejectsUnknownDepth() {
		Channels.toProcessor(new float[][]{{0}}, 1, 1, 12);
	}
}
