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

/** Summed-area tables over pixel masks, for constant-time window counts.
 * <p>
 * Every table has size (w+1) x (h+1): the first row and the first column are zeros,
 * and the rest contain the sum of the area from 0,0 to that pixel, inclusive.
 */
public final class FastIntegralImage
{
	private FastIntegralImage() {}

	/** Returns the integral image of a binary mask: counts of true pixels. */
	static public final double[] doubleIntegralImage(final boolean[] b, final int w, final int h) {
		final float[] f = new float[b.length];
		for (int i=0; i<b.length; ++i) if (b[i]) f[i] = 1;
		return integrate(f, w, h);
	}

	static private final double[] integrate(final float[] b, final int w, final int h) {
		final int w2 = w+1;
		final int h2 = h+1;
		final double[] f = new double[w2 * h2];
		// Sum rows
		for (int y=0, offset1=0, offset2=w2+1; y<h; ++y) {
			double s = 0;
			for (int x=0; x<w; ++x) {
				s += b[offset1 + x];
				f[offset2 + x] = s;
			}
			offset1 += w;
			offset2 += w2;
		}
		// Sum columns over the summed rows
		for (int x=1; x<w2; ++x) {
			 double s = 0;
			 for (int y=1, i=w2+x; y<h2; ++y) {
				 s += f[i];
				 f[i] = s;
				 i += w2;
			 }
		}
		return f;
	}

	/** Sum of the source pixels in [x0,x1) x [y0,y1), read from integral image {@code f} of width {@code fw} (source width + 1). */
	static public final double sum(final double[] f, final int fw, final int x0, final int y0, final int x1, final int y1) {
		final int o1 = y0 * fw,
		          o2 = y1 * fw;
		return f[o2 + x1] - f[o1 + x1] - f[o2 + x0] + f[o1 + x0];
	}
}
