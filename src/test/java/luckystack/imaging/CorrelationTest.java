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

import luckystack.SyntheticFrames;

import org.junit.Test;

public class CorrelationTest {

	static private final Correlation.Filter FILTER = new Correlation.Filter(0.5, 1.0, 10);

	static private FloatProcessor periodic(final int w, final int h) {
		final FloatProcessor fp = new FloatProcessor(w, h);
		for (int y=0; y<h; ++y)
			for (int x=0; x<w; ++x)
				fp.setf(x, y, (float)(100 + 50 * Math.sin(2 * Math.PI * x / 8) * Math.sin(2 * Math.PI * y / 8)));
		return fp;
	}

	@Test
	public void identicalImagesMatchExactly() throws Exception {
		final FloatProcessor fp = SyntheticFrames.clean(96, 96);
		final Correlation.Match m = Correlation.match(fp, 46, 46, 15, 15, fp, 0, 0, 8, FILTER);
		assertTrue(m.isValid());
		assertEquals(0, m.dx, 0);
		assertEquals(0, m.dy, 0);
		assertTrue(m.r >= Correlation.PERFECT_MATCH);
	}

	@Test
	public void recoversSubPixelShift() throws Exception {
		final FloatProcessor reference = SyntheticFrames.clean(96, 96);
		final FloatProcessor target = SyntheticFrames.shifted(96, 96, 2.3, -1.6, 1);
		final Correlation.Match m = Correlation.match(reference, 46, 46, 16, 16, target, 0, 0, 8, FILTER);
		assertEquals(Correlation.Outcome.MATCHED, m.outcome);
		assertEquals(2.3, m.dx, 0.1);
		assertEquals(-1.6, m.dy, 0.1);
		assertTrue(m.r > 0.95);
	}

	@Test
	public void shiftIsRelativeToTheOffset() throws Exception {
		final FloatProcessor reference = SyntheticFrames.clean(96, 96);
		final FloatProcessor target = SyntheticFrames.shifted(96, 96, 5.4, -3.2, 1);
		final Correlation.Match m = Correlation.match(reference, 46, 46, 12, 12, target, 5, -3, 2, FILTER);
		assertTrue(m.isValid());
		assertEquals(0.4, m.dx, 0.1);
		assertEquals(-0.2, m.dy, 0.1);
	}

	@Test
	public void findsTheHighestPeakOnQuasiPeriodicContent() throws Exception {
		// the sinusoid repeats within the search window, only the blobs tell the true peak apart
		final FloatProcessor reference = SyntheticFrames.clean(160, 160);
		final FloatProcessor target = SyntheticFrames.shifted(160, 160, 0.9, 0.9, 1);
		final Correlation.Match m = Correlation.match(reference, 64, 64, 16, 16, target, 0, 0, 24, FILTER);
		assertEquals(Correlation.Outcome.MATCHED, m.outcome);
		assertEquals(0.9, m.dx, 0.1);
		assertEquals(0.9, m.dy, 0.1);
		assertTrue(m.r > 0.99);
	}

	@Test
	public void ambiguousPeaksAreRejectedOnlyWhenAsked() throws Exception {
		final FloatProcessor fp = periodic(96, 96);
		assertTrue(Correlation.match(fp, 48, 48, 12, 12, fp, 0, 0, 12, FILTER).isValid());
		final Correlation.Match m = Correlation.match(fp, 48, 48, 12, 12, fp, 0, 0, 12, new Correlation.Filter(0.5, 0.9, 10));
		assertEquals(Correlation.Outcome.NO_MATCH, m.outcome);
	}

	@Test
	public void peakBeyondRadiusIsNotMatched() throws Exception {
		final FloatProcessor reference = SyntheticFrames.clean(96, 96);
		final FloatProcessor target = SyntheticFrames.shifted(96, 96, 6, 0, 1);
		assertFalse(Correlation.match(reference, 46, 46, 8, 8, target, 0, 0, 3, FILTER).isValid());
		final Correlation.Match m = Correlation.match(reference, 46, 46, 8, 8, target, 0, 0, 8, FILTER);
		assertTrue(m.isValid());
		assertEquals(6, m.dx, 0.1);
	}

	@Test
	public void flatTargetDoesNotMatch() throws Exception {
		final FloatProcessor reference = SyntheticFrames.clean(64, 64);
		final FloatProcessor target = new FloatProcessor(64, 64);
		target.set(100);
		final Correlation.Match m = Correlation.match(reference, 30, 30, 8, 8, target, 0, 0, 4, FILTER);
		assertEquals(Correlation.Outcome.NO_MATCH, m.outcome);
		assertTrue(Double.isNaN(m.r));
	}

	@Test
	public void searchShrinksAtTheImageEdge() throws Exception {
		final FloatProcessor fp = SyntheticFrames.clean(64, 64);
		assertEquals(1, Correlation.room(10, 32, 8, 8, 0, 0, fp));
		final Correlation.Match m = Correlation.match(fp, 10, 32, 8, 8, fp, 0, 0, 4, FILTER);
		assertTrue(m.isValid());
		assertEquals(0, m.dx, 0);

		assertEquals(0, Correlation.room(9, 32, 8, 8, 0, 0, fp));
		assertEquals(Correlation.Outcome.OUT_OF_RANGE, Correlation.match(fp, 9, 32, 8, 8, fp, 0, 0, 4, FILTER).outcome);
	}

	@Test
	public void pointsAreMatchedInOneCall() throws Exception {
		final FloatProcessor reference = SyntheticFrames.clean(128, 128);
		final FloatProcessor target = SyntheticFrames.shifted(128, 128, 1.4, 0.6, 1);
		final int[] x = {30, 64, 96, 3};
		final int[] y = {40, 64, 90, 64};
		final Correlation.Match[] m = Correlation.match(reference, x, y, 10, 10, target, 1, 0, 4, FILTER);
		assertEquals(4, m.length);
		for (int i=0; i<3; ++i) {
			assertTrue(m[i].toString(), m[i].isValid());
			assertEquals(0.4, m[i].dx, 0.1);
			assertEquals(0.6, m[i].dy, 0.1);
		}
		// the block leaves the source
		assertEquals(Correlation.Outcome.OUT_OF_RANGE, m[3].outcome);
	}

	@Test
	public void pmccOfEqualAndInvertedBlocks() {
		final FloatProcessor fp = SyntheticFrames.clean(64, 64);
		final FloatProcessor inverted = (FloatProcessor)fp.duplicate();
		inverted.multiply(-1);
		assertEquals(1, Correlation.pmcc(fp, 30, 30, 5, 5, fp, 30, 30), 1e-9);
		assertEquals(-1, Correlation.pmcc(fp, 30, 30, 5, 5, inverted, 30, 30), 1e-9);
		final FloatProcessor flat = new FloatProcessor(64, 64);
		assertEquals(0, Correlation.pmcc(fp, 30, 30, 5, 5, flat, 30, 30), 0);
	}
}
