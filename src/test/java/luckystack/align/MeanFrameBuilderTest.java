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

import luckystack.SyntheticFrames;
import luckystack.frames.FrameStore;
import luckystack.stack.JobContext;
import luckystack.stack.JobFailedException;
import luckystack.stack.JobFailedException.FatalReason;

import org.junit.Test;

public class MeanFrameBuilderTest {

	static private FloatProcessor flat(final float value) {
		final FloatProcessor fp = new FloatProcessor(40, 30);
		fp.add(value);
		return fp;
	}

	private final FrameStore store = new FrameStore(SyntheticFrames.source(flat(10), flat(20), flat(30)), 2, 1);
	private final FrameRanking ranking = new FrameRanking(new double[]{0.5, 1, 0.8}, new double[]{10, 20, 30});

	@Test
	public void averagesBestValidFrames() throws Exception {
		final StackingParam param = new StackingParam();
		param.averageFrameNumber = 2;
		final MeanFrame mean = MeanFrameBuilder.build(store, ranking, GlobalAlignment.identity(3, 40, 30), param, new JobContext(2));
		assertArrayEquals(new int[]{1, 2}, mean.getFrames());
		assertEquals(new Rectangle(0, 0, 40, 30), mean.getRegion());
		assertEquals(25, mean.getMean().getf(7, 9), 1e-6);
	}

	@Test
	public void skipsInvalidFrames() throws Exception {
		final GlobalAlignment alignment = new GlobalAlignment(
				new double[3][2],
				new boolean[]{true, true, false},
				new Rejection[]{null, null, Rejection.LOW_CORRELATION},
				40, 30);
		final StackingParam param = new StackingParam();
		param.averageFrameNumber = 2;
		final MeanFrame mean = MeanFrameBuilder.build(store, ranking, alignment, param, new JobContext(1));
		assertArrayEquals(new int[]{1, 0}, mean.getFrames());
		assertEquals(15, mean.getMean().getf(0, 0), 1e-6);
	}

	@Test
	public void followsGlobalOffsets() throws Exception {
		final FrameStore shifted = new FrameStore(SyntheticFrames.source(
				SyntheticFrames.clean(64, 64),
				SyntheticFrames.shifted(64, 64, 3, -2, 1)), 2, 1);
		final GlobalAlignment alignment = new GlobalAlignment(
				new double[][]{{0, 0}, {3, -2}},
				new boolean[]{true, true},
				new Rejection[2],
				64, 64);
		final StackingParam param = new StackingParam();
		param.averageFrameNumber = 2;
		final MeanFrame mean = MeanFrameBuilder.build(shifted, new FrameRanking(new double[]{1, 1}, new double[]{110, 110}), alignment, param, new JobContext(1));
		assertEquals(new Rectangle(0, 2, 61, 62), mean.getRegion());
		// pixel (u, v) shows reference position (u, v + 2)
		assertEquals(SyntheticFrames.pattern(10, 12), mean.getMean().getf(10, 10), 1e-3);
	}

	@Test
	public void regionOfInterestIsRelativeToCommonArea() throws Exception {
		final GlobalAlignment alignment = new GlobalAlignment(
				new double[][]{{0, 0}, {-2, -1}},
				new boolean[]{true, true},
				new Rejection[2],
				40, 30);
		final StackingParam param = new StackingParam();
		param.roi = new Rectangle(5, 5, 10, 8);
		assertEquals(new Rectangle(7, 6, 10, 8), MeanFrameBuilder.region(alignment, param));

		param.roi = new Rectangle(100, 100, 10, 10);
		try {
			MeanFrameBuilder.region(alignment, param);
			fail("Expected a job failure");
		} catch (final JobFailedException e) {
			assertEquals(FatalReason.EMPTY_INTERSECTION, e.getReason());
		}
	}

	@Test
	public void backgroundAppliesBrightnessFactors() throws Exception {
		final Rectangle region = new Rectangle(0, 0, 40, 30);
		final float[][] bg = MeanFrameBuilder.background(store, ranking, GlobalAlignment.identity(3, 40, 30), region, 2, new double[]{1, 2, 0.5}, new JobContext(2));
		assertEquals(1, bg.length);
		// (20 * 2 + 30 * 0.5) / 2
		assertEquals(27.5, bg[0][100], 1e-5);
	}
}
