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
package luckystack.align;

import static org.junit.Assert.*;

import ij.process.FloatProcessor;

import java.awt.Rectangle;
import java.util.Random;

import luckystack.SyntheticFrames;
import luckystack.frames.FrameStore;
import luckystack.stack.Diagnostics;
import luckystack.stack.JobContext;

import org.junit.Test;

public class GlobalAlignerTest {

	static private FloatProcessor noise(final int w, final int h, final long seed) {
		final Random rnd = new Random(seed);
		final float[] p = new float[w * h];
		for (int i=0; i<p.length; ++i) p[i] = (float)(110 + 40 * rnd.nextGaussian());
		return new FloatProcessor(w, h, p, null);
	}

	@Test
	public void recoversRelativeOffsetsAndRejectsNoise() throws Exception {
		final FrameStore store = new FrameStore(SyntheticFrames.source(
				SyntheticFrames.clean(128, 128),
				SyntheticFrames.shifted(128, 128, 2.3, -1.6, 1),
				SyntheticFrames.shifted(128, 128, -3.4, 2.7, 1),
				noise(128, 128, 3)), 2, 7);
		final StackingParam param = new StackingParam();
		param.alignSearchWidth = 8;
		param.alignMinCorrelation = 0.7;
		final JobContext context = new JobContext(2);

		final FrameRanking ranking = QualityRanker.rank(store, param, context);
		assertTrue(3 != ranking.best());
		final ReferencePatch reference = ReferencePatchSelector.select(store.blurred(ranking.best()), param, 255);
		final GlobalAlignment alignment = GlobalAligner.align(store, ranking, reference, param, context);

		assertEquals(3, alignment.getNumberOfValidFrames());
		final double[] d0 = alignment.getOffset(0);
		final double[] d1 = alignment.getOffset(1);
		final double[] d2 = alignment.getOffset(2);
		assertEquals(2.3, d1[0] - d0[0], 0.1);
		assertEquals(-1.6, d1[1] - d0[1], 0.1);
		assertEquals(-3.4, d2[0] - d0[0], 0.1);
		assertEquals(2.7, d2[1] - d0[1], 0.1);
		final double[] best = alignment.getOffset(ranking.best());
		assertEquals(0, best[0], 0);
		assertEquals(0, best[1], 0);

		assertFalse(alignment.isValid(3));
		assertEquals(Rejection.LOW_CORRELATION, alignment.getRejection(3));
		final Diagnostics diagnostics = context.getDiagnostics();
		assertEquals(1, diagnostics.getExcludedFrames().size());
		assertEquals(3, diagnostics.getExcludedFrames().get(0).frame);

		// the common area lies inside every valid frame
		final Rectangle common = alignment.getIntersection();
		for (int i=0; i<3; ++i) {
			final double[] d = alignment.getOffset(i);
			assertTrue(common.x + d[0] >= 0);
			assertTrue(common.y + d[1] >= 0);
			assertTrue(common.x + common.width - 1 + d[0] <= 127);
			assertTrue(common.y + common.height - 1 + d[1] <= 127);
		}
	}

	@Test
	public void identicalFramesAlignExactly() throws Exception {
		final FloatProcessor clean = SyntheticFrames.clean(96, 96);
		final FrameStore store = new FrameStore(SyntheticFrames.source(clean, clean, clean), 2, 7);
		final StackingParam param = new StackingParam();
		param.alignSearchWidth = 6;
		final JobContext context = new JobContext(1);
		final FrameRanking ranking = QualityRanker.rank(store, param, context);
		final ReferencePatch reference = ReferencePatchSelector.select(store.blurred(ranking.best()), param, 255);
		final GlobalAlignment alignment = GlobalAligner.align(store, ranking, reference, param, context);
		for (int i=0; i<3; ++i) {
			assertArrayEquals(new double[]{0, 0}, alignment.getOffset(i), 0);
		}
		assertEquals(new Rectangle(0, 0, 96, 96), alignment.getIntersection());
	}

	@Test
	public void findsTheHighestPeakOnQuasiPeriodicContent() throws Exception {
		final FrameStore store = new FrameStore(SyntheticFrames.source(
				SyntheticFrames.clean(160, 160),
				SyntheticFrames.shifted(160, 160, 0.9, 0.9, 1)), 2, 7);
		final StackingParam param = new StackingParam();
		param.alignSearchWidth = 24;
		// the sinusoid repeats within the search window, the blob in this patch tells the true peak apart
		param.referencePatch = new Rectangle(44, 56, 34, 34);
		final JobContext context = new JobContext(2);
		final FrameRanking ranking = QualityRanker.rank(store, param, context);
		final ReferencePatch reference = ReferencePatchSelector.select(store.blurred(ranking.best()), param, 255);
		final GlobalAlignment alignment = GlobalAligner.align(store, ranking, reference, param, context);
		assertEquals(2, alignment.getNumberOfValidFrames());
		final double[] d0 = alignment.getOffset(0);
		final double[] d1 = alignment.getOffset(1);
		assertEquals(0.9, d1[0] - d0[0], 0.1);
		assertEquals(0.9, d1[1] - d0[1], 0.1);
	}

	@Test
	public void ambiguousMatchesCanBeRejected() throws Exception {
		final FloatProcessor periodic = new FloatProcessor(128, 128);
		for (int y=0; y<128; ++y)
			for (int x=0; x<128; ++x)
				periodic.setf(x, y, (float)(110 + 60 * Math.sin(2 * Math.PI * x / 10) * Math.sin(2 * Math.PI * y / 10)));
		final FrameStore store = new FrameStore(SyntheticFrames.source(periodic, periodic), 2, 1);
		final StackingParam param = new StackingParam();
		param.noiseLevel = 1;
		param.alignSearchWidth = 12;
		param.maxRatioOfDistances = 0.9;
		final JobContext context = new JobContext(1);
		final FrameRanking ranking = QualityRanker.rank(store, param, context);
		final ReferencePatch reference = ReferencePatchSelector.select(store.blurred(ranking.best()), param, 255);
		final GlobalAlignment alignment = GlobalAligner.align(store, ranking, reference, param, context);
		final int other = 1 - ranking.best();
		assertFalse(alignment.isValid(other));
		assertEquals(Rejection.LOW_CORRELATION, alignment.getRejection(other));
	}

	@Test
	public void planetFramesAreSearchedFromTheirCentreOfGravity() throws Exception {
		// the disc moves by more than the search width, the centre of gravity brings it back into reach
		final FrameStore store = new FrameStore(SyntheticFrames.source(
				SyntheticFrames.planet(128, 128, 64, 64, 1),
				SyntheticFrames.planet(128, 128, 73.4, 58.7, 2)), 2, 3);
		final StackingParam param = new StackingParam();
		param.mode = StackingParam.Mode.PLANET;
		param.noiseLevel = 3;
		param.alignSearchWidth = 4;
		final JobContext context = new JobContext(2);
		final FrameRanking ranking = QualityRanker.rank(store, param, context);
		final ReferencePatch reference = ReferencePatchSelector.select(store.blurred(ranking.best()), param, 255);
		final GlobalAlignment alignment = GlobalAligner.align(store, ranking, reference, param, context);
		assertEquals(2, alignment.getNumberOfValidFrames());
		final double[] d0 = alignment.getOffset(0);
		final double[] d1 = alignment.getOffset(1);
		assertEquals(9.4, d1[0] - d0[0], 0.1);
		assertEquals(-5.3, d1[1] - d0[1], 0.1);
	}

	@Test
	public void intersectionOfOffsets() {
		final GlobalAlignment a = new GlobalAlignment(
				new double[][]{{0, 0}, {1.5, -2}, {-0.5, 3}, {40, 40}},
				new boolean[]{true, true, true, false},
				new Rejection[]{null, null, null, Rejection.LOW_CORRELATION},
				100, 80);
		// x: lo = ceil(max(0, -1.5, 0.5)) = 1, hi = floor(min(99, 97.5, 99.5)) = 97
		// y: lo = ceil(max(0, 2, -3)) = 2, hi = floor(min(79, 81, 76)) = 76
		assertEquals(new Rectangle(1, 2, 97, 75), a.getIntersection());
		assertEquals(3, a.getNumberOfValidFrames());
		assertArrayEquals(new double[]{1.5, -2}, a.getOffset(1), 0);
	}

	@Test
	public void centerOfGravityOfBlob() {
		final FloatProcessor fp = new FloatProcessor(64, 64);
		for (int y=0; y<64; ++y)
			for (int x=0; x<64; ++x)
				fp.setf(x, y, (float)(200 * Math.exp(-((x - 20.5) * (x - 20.5) + (y - 40) * (y - 40)) / 18.0)));
		final double[] c = GlobalAligner.centerOfGravity(fp);
		assertEquals(20.5, c[0], 0.05);
		assertEquals(40, c[1], 0.05);
	}
}
