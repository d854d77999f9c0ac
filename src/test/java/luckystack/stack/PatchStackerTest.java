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
package luckystack.stack;

import static org.junit.Assert.*;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.awt.Rectangle;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicIntegerArray;

import luckystack.SyntheticFrames;
import luckystack.align.FrameRanking;
import luckystack.align.GlobalAlignment;
import luckystack.align.MeanFrame;
import luckystack.align.Rejection;
import luckystack.align.StackingParam;
import luckystack.frames.FrameSource;
import luckystack.frames.FrameStore;
import luckystack.mesh.AlignmentPoint;

import org.junit.Test;

public class PatchStackerTest {

	/** Counts the decodes of every frame. */
	static private final class CountingSource implements FrameSource {
		final FrameSource source;
		final AtomicIntegerArray decodes;
		CountingSource(final FrameSource source) {
			this.source = source;
			this.decodes = new AtomicIntegerArray(source.getNumberOfFrames());
		}
		public int getNumberOfFrames() { return source.getNumberOfFrames(); }
		public int getWidth() { return source.getWidth(); }
		public int getHeight() { return source.getHeight(); }
		public ImageProcessor decode(final int index) {
			decodes.incrementAndGet(index);
			return source.decode(index);
		}
	}

	private final FrameRanking ranking = new FrameRanking(new double[]{1, 0.9, 0.8, 0.7, 0.6}, new double[]{100, 50, 200, 5, 1000});
	private final GlobalAlignment alignment = new GlobalAlignment(
			new double[5][2],
			new boolean[]{true, true, true, true, false},
			new Rejection[]{null, null, null, null, Rejection.LOW_CORRELATION},
			10, 10);

	@Test
	public void brightnessFactorsBringFramesToTheMedian() {
		final double[] f = PatchStacker.brightnessFactors(ranking, alignment, new StackingParam(), 255);
		// median of the valid frames {5, 50, 100, 200}
		assertEquals(0.75, f[0], 1e-12);
		assertEquals(1.5, f[1], 1e-12);
		assertEquals(0.375, f[2], 1e-12);
		// below the normalization threshold
		assertEquals(1, f[3], 0);
		// invalid
		assertEquals(1, f[4], 0);
	}

	@Test
	public void thresholdScalesWithBitDepth() {
		final double[] f = PatchStacker.brightnessFactors(ranking, alignment, new StackingParam(), 65535);
		// 15 on the 8-bit scale is 3855 at 16 bits: every frame is too dim
		for (final double v : f) assertEquals(1, v, 0);
	}

	@Test
	public void normalizationCanBeTurnedOff() {
		final StackingParam param = new StackingParam();
		param.normalizeBrightness = false;
		for (final double v : PatchStacker.brightnessFactors(ranking, alignment, param, 255)) assertEquals(1, v, 0);
	}

	@Test
	public void distanceToRectangle() {
		final Rectangle r = new Rectangle(10, 10, 11, 11);
		assertEquals(0, PatchStacker.distance(15, 15, r), 0);
		assertEquals(0, PatchStacker.distance(20, 10, r), 0);
		assertEquals(5, PatchStacker.distance(25, 15, r), 1e-12);
		assertEquals(5, PatchStacker.distance(17, 5, r), 1e-12);
		assertEquals(Math.sqrt(2), PatchStacker.distance(9, 9, r), 1e-12);
	}

	@Test
	public void fieldRadiusScalesWithStep() {
		final StackingParam param = new StackingParam();
		param.fieldRadiusFactor = 1.5;
		assertEquals(27, PatchStacker.fieldRadius(param, 18), 1e-12);
	}

	static private LocalShifts zeroShifts(final AlignmentPoint ap, final int n) {
		final int[] frames = new int[n];
		for (int i=0; i<n; ++i) frames[i] = i;
		return new LocalShifts(ap, frames, new double[n][2]);
	}

	static private LocalRanking ranking(final AlignmentPoint ap, final double... scores) {
		final int[] order = new int[scores.length];
		for (int i=0; i<order.length; ++i) order[i] = i;
		return new LocalRanking(ap, scores, order, scores.length);
	}

	@Test
	public void framesWithoutQualityGetNoWeight() {
		final AlignmentPoint ap = new AlignmentPoint(20, 20, 8, 12, 64, 64, false, false, false, false);
		final LocalShifts ls = zeroShifts(ap, 3);
		final LocalRanking r = ranking(ap, 0.5, 0, 2);
		assertArrayEquals(new double[]{0.5, 0, 2}, PatchStacker.frameWeights(ls, r, StackingParam.Averaging.QUALITY_WEIGHTED), 0);
		assertArrayEquals(new double[]{1, 1, 1}, PatchStacker.frameWeights(ls, r, StackingParam.Averaging.UNWEIGHTED), 0);
	}

	@Test
	public void qualityWeightsFallBackToEqualWeights() {
		final AlignmentPoint ap = new AlignmentPoint(20, 20, 8, 12, 64, 64, false, false, false, false);
		final LocalShifts ls = zeroShifts(ap, 3);
		assertArrayEquals(new double[]{1, 1, 1},
				PatchStacker.frameWeights(ls, ranking(ap, 0, 0, 0), StackingParam.Averaging.QUALITY_WEIGHTED), 0);
		assertArrayEquals(new double[]{1, 1, 1},
				PatchStacker.frameWeights(ls, ranking(ap, 0, -1, 0), StackingParam.Averaging.QUALITY_WEIGHTED), 0);
	}

	static private List<StackedPatch> stackFourPoints(final CountingSource source, final double... scores) throws Exception {
		final StackingParam param = new StackingParam();
		param.averaging = StackingParam.Averaging.QUALITY_WEIGHTED;
		final FrameStore store = new FrameStore(source, 0, param.noiseLevel);
		final int n = store.size();
		final FloatProcessor clean = SyntheticFrames.clean(64, 64);
		final MeanFrame mean = new MeanFrame(clean, new Rectangle(0, 0, 64, 64), param.noiseLevel, new int[]{0});
		final Map<AlignmentPoint, LocalRanking> rankings = new HashMap<AlignmentPoint, LocalRanking>();
		final Map<AlignmentPoint, LocalShifts> shifts = new HashMap<AlignmentPoint, LocalShifts>();
		for (final int x : new int[]{20, 44}) {
			for (final int y : new int[]{20, 44}) {
				final AlignmentPoint ap = new AlignmentPoint(x, y, 8, 12, 64, 64, false, false, false, false);
				rankings.put(ap, ranking(ap, scores));
				shifts.put(ap, zeroShifts(ap, n));
			}
		}
		final double[] factors = new double[n];
		Arrays.fill(factors, 1);
		store.getNChannels();
		for (int i=0; i<n; ++i) source.decodes.set(i, 0);
		return PatchStacker.stack(store, GlobalAlignment.identity(n, 64, 64), mean, rankings, shifts, factors, 36, 24, param, new JobContext(2));
	}

	@Test
	public void everyStackedFrameIsDecodedOnce() throws Exception {
		final FloatProcessor clean = SyntheticFrames.clean(64, 64);
		final CountingSource source = new CountingSource(SyntheticFrames.source(clean, clean, clean, clean, clean));
		final List<StackedPatch> patches = stackFourPoints(source, 1, 0.5, 0, 2, 1);
		assertEquals(4, patches.size());
		// frame 2 has no weight anywhere
		assertEquals(0, source.decodes.get(2));
		for (final int i : new int[]{0, 1, 3, 4}) assertEquals(1, source.decodes.get(i));
		for (final StackedPatch patch : patches) {
			assertEquals(4, patch.getNumberOfFrames());
			final Rectangle r = patch.getPatch();
			final float[] pixels = patch.getChannel(0);
			for (int v=0; v<r.height; ++v)
				for (int u=0; u<r.width; ++u)
					assertEquals(clean.getf(r.x + u, r.y + v), pixels[v * r.width + u], 1e-3);
		}
	}

	@Test
	public void allFramesCountWithoutQuality() throws Exception {
		final FloatProcessor clean = SyntheticFrames.clean(64, 64);
		final CountingSource source = new CountingSource(SyntheticFrames.source(clean, clean, clean));
		for (final StackedPatch patch : stackFourPoints(source, 0, 0, 0)) assertEquals(3, patch.getNumberOfFrames());
		for (int i=0; i<3; ++i) assertEquals(1, source.decodes.get(i));
	}
}
