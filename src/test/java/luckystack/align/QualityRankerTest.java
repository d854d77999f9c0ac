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

import luckystack.SyntheticFrames;
import luckystack.frames.FrameStore;
import luckystack.imaging.QualityMeasures;
import luckystack.stack.JobContext;

import org.junit.Test;

public class QualityRankerTest {

	@Test
	public void noisyFramesRankBelowCleanOnes() throws Exception {
		final FloatProcessor clean = SyntheticFrames.clean(128, 128);
		final FrameStore store = new FrameStore(SyntheticFrames.source(
				SyntheticFrames.noisy(clean, 12, 1),
				clean,
				SyntheticFrames.noisy(clean, 12, 2),
				clean), 2, 7);
		for (final QualityMeasures.Method method : QualityMeasures.Method.values()) {
			final StackingParam param = new StackingParam();
			param.rankingMethod = method;
			final FrameRanking ranking = QualityRanker.rank(store, param, new JobContext(2));
			// identical frames tie and keep index order
			assertEquals(method.toString(), 1, ranking.getOrder()[0]);
			assertEquals(method.toString(), 3, ranking.getOrder()[1]);
			assertEquals(1.0, ranking.getScore(1), 0);
			assertEquals(1.0, ranking.getScore(3), 0);
			assertTrue(ranking.getScore(0) < 1);
		}
	}

	@Test
	public void brightnessIsTheMeanLuminance() throws Exception {
		final FloatProcessor flat = new FloatProcessor(64, 64);
		flat.add(42);
		final FrameStore store = new FrameStore(SyntheticFrames.source(flat, SyntheticFrames.clean(64, 64)), 2, 7);
		final FrameRanking ranking = QualityRanker.rank(store, new StackingParam(), new JobContext(1));
		assertEquals(42, ranking.getBrightness(0), 1e-6);
		assertEquals(1, ranking.best());
		assertTrue(ranking.getScore(0) < 1e-3);
	}
}
