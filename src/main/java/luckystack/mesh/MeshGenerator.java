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
package luckystack.mesh;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;

import luckystack.align.MeanFrame;
import luckystack.align.StackingParam;
import luckystack.imaging.FastIntegralImage;
import luckystack.imaging.QualityMeasures;
import luckystack.stack.JobFailedException;
import luckystack.stack.JobFailedException.FatalReason;
import luckystack.stack.Phase;
import luckystack.utils.Utils;

/**
 * Lays a staggered grid of alignment points over the mean frame and discards those whose box
 * is unsuitable for matching. Even rows hold one point more than odd rows, whose points sit
 * half way between those of the even rows.
 */
public class MeshGenerator {

	private MeshGenerator() {}

	/**
	 * Positions along one axis of {@code numPixels}, at least {@code minBoundary} from both ends and
	 * about {@code step} apart, spread evenly. Odd rows get the midpoints of the even row positions.
	 * An axis too short for two positions gets its centre only.
	 */
	static public int[] locations(final int numPixels, final int minBoundary, final int step, final boolean even) {
		final int length = numPixels - 2 * minBoundary;
		if (length < 0) return new int[0];
		if (2 * length < step) return new int[]{numPixels / 2};
		final int num = (int)Math.ceil(length / (double)step);
		final double delta = length / (double)num;
		final int[] locations = new int[even ? num + 1 : num];
		for (int i=0; i<locations.length; i++) {
			locations[i] = minBoundary + (int)((even ? i : i + 0.5) * delta);
		}
		return locations;
	}

	/** Smallest allowed distance between two kept points of a mesh with the given step. */
	static public int minimumDistance(final int step) {
		return step / 2;
	}

	/**
	 * @param fullScale value of a saturated pixel, to scale the thresholds given on the 8-bit scale
	 * @throws JobFailedException if no point is kept
	 */
	static public AlignmentPointMesh create(final MeanFrame mean, final StackingParam param, final double fullScale) throws JobFailedException {
		final AlignmentPointMesh mesh = generate(mean, param, fullScale);
		if (0 == mesh.size()) throw new JobFailedException(Phase.CREATE_MESH, FatalReason.NO_ALIGNMENT_POINTS, "no alignment point is suitable for matching");
		return mesh;
	}

	/** As {@link #create(MeanFrame, StackingParam, double)} but returns an empty mesh instead of failing. */
	static public AlignmentPointMesh generate(final MeanFrame mean, final StackingParam param, final double fullScale) {
		final int w = mean.getWidth(), h = mean.getHeight();
		final float[] pixels = (float[])mean.getBlurred().getPixels();
		final int halfBox = param.apHalfBoxWidth;
		final int halfPatch = param.halfPatchWidth();
		final int step = param.stepSize();
		final int minBoundary = Math.max(halfBox + param.apSearchWidth, halfPatch);
		final double scale = fullScale / 255.0;
		final double brightness = param.apBrightnessThreshold * scale;
		final double contrast = param.apContrastThreshold * scale;
		final AlignmentPointMesh mesh = new AlignmentPointMesh(w, h, param.apSearchWidth, step);

		double[] objectCounts = null;
		if (StackingParam.Mode.PLANET == param.mode) {
			// object pixels: brighter than half the maximum, as for the centre of gravity
			float max = -Float.MAX_VALUE;
			for (final float v : pixels) max = Math.max(max, v);
			final double level = Math.max(brightness, max / 2.0);
			final boolean[] object = new boolean[pixels.length];
			for (int i=0; i<pixels.length; i++) object[i] = pixels[i] > level;
			objectCounts = FastIntegralImage.doubleIntegralImage(object, w, h);
		}

		final int[] ys = locations(h, minBoundary, step, true);
		final int[] xsEven = locations(w, minBoundary, step, true);
		final int[] xsOdd = locations(w, minBoundary, step, false);

		final List<AlignmentPoint> candidates = new ArrayList<AlignmentPoint>();
		final List<DiscardReason> reasons = new ArrayList<DiscardReason>();
		final List<Double> structures = new ArrayList<Double>();

		for (int iy=0; iy<ys.length; iy++) {
			final int[] xs = 0 == iy % 2 ? xsEven : xsOdd;
			for (int ix=0; ix<xs.length; ix++) {
				AlignmentPoint ap = new AlignmentPoint(xs[ix], ys[iy], halfBox, halfPatch, w, h,
						0 == ix, xs.length - 1 == ix, 0 == iy, ys.length - 1 == iy);
				final double[] range = QualityMeasures.range(pixels, w, h, ap.getBox());
				DiscardReason reason = null;
				if (range[1] <= brightness) {
					reason = DiscardReason.LOW_BRIGHTNESS;
				} else if (range[1] - range[0] <= contrast) {
					reason = DiscardReason.LOW_CONTRAST;
				} else {
					ap = recenterIfDim(ap, mesh, pixels, w, h, brightness, param.apDimFractionThreshold, step);
					if (null != objectCounts && !touchesObject(ap, objectCounts, w, h)) reason = DiscardReason.OUTSIDE_OBJECT;
				}
				candidates.add(ap);
				reasons.add(reason);
				structures.add(null == reason ? QualityMeasures.structure(pixels, w, h, ap.getBox(), param.rankPixelStride) : 0.0);
			}
		}

		double maxStructure = 0;
		for (int i=0; i<candidates.size(); i++) {
			if (null == reasons.get(i)) maxStructure = Math.max(maxStructure, structures.get(i));
		}
		final int minDistance = minimumDistance(step);
		final List<AlignmentPoint> kept = new ArrayList<AlignmentPoint>();
		for (int i=0; i<candidates.size(); i++) {
			final AlignmentPoint ap = candidates.get(i);
			DiscardReason reason = reasons.get(i);
			if (null == reason && (maxStructure <= 0 || structures.get(i) / maxStructure < param.apStructureThreshold)) {
				reason = DiscardReason.LOW_STRUCTURE;
			}
			if (null == reason) {
				for (final AlignmentPoint k : kept) {
					if (k.distance(ap) < minDistance) {
						reason = DiscardReason.TOO_CLOSE;
						break;
					}
				}
			}
			if (null == reason) kept.add(ap);
			mesh.add(ap, reason);
		}
		Utils.log("Created " + candidates.size() + " alignment points, kept " + mesh.size() + " (box width " + 2 * halfBox + ", step " + step + ")");
		return mesh;
	}

	/** If more than {@code dimFraction} of the box is dark, moves the point towards the centre of mass of the box, by at most a quarter step. */
	static private AlignmentPoint recenterIfDim(final AlignmentPoint ap, final AlignmentPointMesh mesh, final float[] pixels, final int w, final int h,
			final double brightness, final double dimFraction, final int step) {
		final Rectangle box = ap.getBox().intersection(new Rectangle(0, 0, w, h));
		int dark = 0;
		double m00 = 0, m10 = 0, m01 = 0;
		for (int y=box.y; y<box.y + box.height; y++) {
			for (int x=box.x; x<box.x + box.width; x++) {
				final double v = pixels[y * w + x];
				if (v <= brightness) dark++;
				if (v > 0) {
					m00 += v;
					m10 += v * x;
					m01 += v * y;
				}
			}
		}
		if (dark <= dimFraction * box.width * box.height || m00 <= 0) return ap;
		final int limit = step / 4;
		final int dx = clamp((int)Math.round(m10 / m00) - ap.getX(), limit);
		final int dy = clamp((int)Math.round(m01 / m00) - ap.getY(), limit);
		if (0 == dx && 0 == dy) return ap;
		final int x = ap.getX() + dx, y = ap.getY() + dy;
		if (!mesh.fits(x, y, ap.getHalfBoxWidth())) return ap;
		return new AlignmentPoint(x, y, ap.getHalfBoxWidth(), ap.getHalfPatchWidth(), w, h,
				ap.isExtendedLowX(), ap.isExtendedHighX(), ap.isExtendedLowY(), ap.isExtendedHighY());
	}

	static private int clamp(final int v, final int limit) {
		return Math.max(-limit, Math.min(limit, v));
	}

	static private boolean touchesObject(final AlignmentPoint ap, final double[] counts, final int w, final int h) {
		final int r = ap.getHalfPatchWidth();
		final int x0 = Math.max(0, ap.getX() - r), x1 = Math.min(w, ap.getX() + r);
		final int y0 = Math.max(0, ap.getY() - r), y1 = Math.min(h, ap.getY() + r);
		return FastIntegralImage.sum(counts, w + 1, x0, y0, x1, y1) > 0;
	}
}
