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

import org.junit.Test;

public class ResamplerTest {

	private final float[] p = {
		0, 1, 2,
		3, 4, 5,
		6, 7, 8 };

	@Test
	public void integerPositionsAreExact() {
		assertEquals(4, Resampler.bilinear(p, 3, 3, 1, 1), 0);
		assertEquals(8, Resampler.bilinear(p, 3, 3, 2, 2), 0);
	}

	@Test
	public void interpolatesLinearly() {
		assertEquals(0.5f, Resampler.bilinear(p, 3, 3, 0.5, 0), 1e-6);
		assertEquals(2f, Resampler.bilinear(p, 3, 3, 0.5, 0.5), 1e-6);
		assertEquals(5.75f, Resampler.bilinear(p, 3, 3, 1.25, 1.5), 1e-6);
	}

	@Test
	public void clampsToTheImage() {
		assertEquals(0, Resampler.bilinear(p, 3, 3, -3, -1), 0);
		assertEquals(8, Resampler.bilinear(p, 3, 3, 7, 2.5), 0);
	}

	@Test
	public void translatesAWindow() {
		assertArrayEquals(new float[]{4, 5, 7, 8}, Resampler.translate(p, 3, 3, 1, 1, 2, 2), 0);
	}
}
