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

import ij.process.FloatProcessor;

import java.awt.Rectangle;

import luckystack.SyntheticFrames;

import org.junit.Test;

public class QualityMeasuresTest {

	@Test
	public void noiseEstimateOfWhiteNoise() {
		final FloatProcessor flat = new FloatProcessor(200, 200);
		flat.add(100);
		final FloatProcessor noisy = SyntheticFrames.noisy(flat, 10, 1);
		assertEquals(10, QualityMeasures.noiseSigma(noisy, new Rectangle(0, 0, 200, 200)), 0.5);
		assertEquals(0, QualityMeasures.noiseSigma(flat, new Rectangle(0, 0, 200, 200)), 1e-9);
	}

	@Test
	public void noiseEstimateIgnoresSmoothStructure() {
		final FloatProcessor clean = SyntheticFrames.clean(128, 128);
		assertTrue(QualityMeasures.noiseSigma(clean, new Rectangle(0, 0, 128, 128)) < 0.5);
	}

	@Test
	public void sharperFrameScoresHigher() {
		final FloatProcessor clean = SyntheticFrames.clean(128, 128);
		final FloatProcessor soft = Filters.blur(clean, 15);
		final Rectangle all = new Rectangle(0, 0, 128, 128);
		for (final QualityMeasures.Method method : QualityMeasures.Method.values()) {
			final double sharp = QualityMeasures.score(method, clean, Filters.laplacian(clean), clean, all, 2, 0);
			final double blurred = QualityMeasures.score(method, soft, Filters.laplacian(soft), soft, all, 2, 0);
			assertTrue(method + ": " + sharp + " vs " + blurred, sharp > blurred);
		}
	}

	@Test
	public void structureOfConstantIsZero() {
		final float[] p = new float[20 * 20];
		java.util.Arrays.fill(p, 50);
		assertEquals(0, QualityMeasures.structure(p, 20, 20, new Rectangle(0, 0, 20, 20), 1), 0);
		assertEquals(0, QualityMeasures.structureThresholdWeighted(p, 20, 20, new Rectangle(0, 0, 20, 20), 2, 40, 0.7), 0);
	}

	@Test
	public void thresholdWeightedStructureIgnoresDarkPixels() {
		final FloatProcessor clean = SyntheticFrames.clean(64, 64);
		final float[] p = (float[]) clean.getPixels();
		final Rectangle r = new Rectangle(8, 8, 40, 40);
		assertTrue(QualityMeasures.structureThresholdWeighted(p, 64, 64, r, 2, 40, 0.7) > 0);
		assertEquals(0, QualityMeasures.structureThresholdWeighted(p, 64, 64, r, 2, 1000, 0.7), 0);
	}

	@Test
	public void rangeOfRectangle() {
		final float[] p = {1, 2, 3, 4, 5, 6, 7, 8, 9};
		final double[] r = QualityMeasures.range(p, 3, 3, new Rectangle(1, 1, 2, 2));
		assertEquals(5, r[0], 0);
		assertEquals(9, r[1], 0);
		assertEquals(7, r[2], 1e-9);
	}
}
