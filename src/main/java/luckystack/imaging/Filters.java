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

import ij.plugin.filter.GaussianBlur;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.awt.Rectangle;

/** Pixel filters on {@link FloatProcessor}s. None of them modifies its input. */
public final class Filters {

	static public final double BLUR_ACCURACY = 0.002;

	private Filters() {}

	/** The standard deviation of a Gaussian kernel @param width pixels wide, as used for the noise level. */
	static public final double sigmaForWidth(final int width) {
		return 0.3 * ((width - 1) * 0.5 - 1) + 0.8;
	}

	/** The luminance of @param ip as a new float image; RGB uses the Rec. 601 weights. */
	static public final FloatProcessor mono(final ImageProcessor ip) {
		final int w = ip.getWidth(),
		          h = ip.getHeight();
		if (ip instanceof ColorProcessor) {
			final int[] rgb = (int[]) ip.getPixels();
			final float[] f = new float[rgb.length];
			for (int i=0; i<rgb.length; ++i) {
				final int c = rgb[i];
				f[i] = (float)(0.299 * ((c >> 16) & 0xff) + 0.587 * ((c >> 8) & 0xff) + 0.114 * (c & 0xff));
			}
			return new FloatProcessor(w, h, f, null);
		}
		if (ip instanceof FloatProcessor) {
			return new FloatProcessor(w, h, ((float[]) ip.getPixels()).clone(), null);
		}
		return ip.toFloat(0, null);
	}

	/** Returns a blurred copy of @param fp with a Gaussian kernel @param width pixels wide.
	 *  Widths below 3 return an unblurred copy. */
	static public final FloatProcessor blur(final FloatProcessor fp, final int width) {
		final FloatProcessor copy = new FloatProcessor(fp.getWidth(), fp.getHeight(), ((float[]) fp.getPixels()).clone(), null);
		if (width < 3) return copy;
		final double sigma = sigmaForWidth(width);
		new GaussianBlur().blurGaussian(copy, sigma, sigma, BLUR_ACCURACY);
		return copy;
	}

	/** The 4-neighbour Laplacian, with edge pixels replicated. */
	static public final FloatProcessor laplacian(final FloatProcessor fp) {
		final int w = fp.getWidth(),
		          h = fp.getHeight();
		final float[] p = (float[]) fp.getPixels();
		final float[] q = new float[p.length];
		for (int y=0; y<h; ++y) {
			final int o = y * w;
			final int up = (y > 0 ? y - 1 : 0) * w;
			final int down = (y < h - 1 ? y + 1 : y) * w;
			for (int x=0; x<w; ++x) {
				final int left = x > 0 ? x - 1 : 0;
				final int right = x < w - 1 ? x + 1 : x;
				q[o + x] = p[o + left] + p[o + right] + p[up + x] + p[down + x] - 4 * p[o + x];
			}
		}
		return new FloatProcessor(w, h, q, null);
	}

	/** Copies the pixels of @param r, which must lie inside @param fp.
	 *  Does not touch the ROI of @param fp, so that shared processors can be cropped concurrently. */
	static public final float[] crop(final FloatProcessor fp, final Rectangle r) {
		return crop((float[]) fp.getPixels(), fp.getWidth(), r.x, r.y, r.width, r.height);
	}

	static public final float[] crop(final float[] p, final int width, final int x0, final int y0, final int w, final int h) {
		final float[] q = new float[w * h];
		for (int y=0; y<h; ++y) {
			System.arraycopy(p, (y0 + y) * width + x0, q, y * w, w);
		}
		return q;
	}

	static public final FloatProcessor cropProcessor(final FloatProcessor fp, final Rectangle r) {
		return new FloatProcessor(r.width, r.height, crop(fp, r), null);
	}

	static public final double mean(final float[] p) {
		double s = 0;
		for (int i=0; i<p.length; ++i) s += p[i];
		return 0 == p.length ? 0 : s / p.length;
	}
}
