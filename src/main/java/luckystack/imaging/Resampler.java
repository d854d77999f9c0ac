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

/** Bilinear sampling with coordinates clamped to the image. */
public final class Resampler
{
	private Resampler() {}

	/** Value at the real-valued position (x, y); integer positions return the pixel unchanged. */
	static public final float bilinear( final float[] p, final int w, final int h, double x, double y )
	{
		if ( x < 0 ) x = 0;
		else if ( x > w - 1 ) x = w - 1;
		if ( y < 0 ) y = 0;
		else if ( y > h - 1 ) y = h - 1;
		final int x0 = ( int )x, y0 = ( int )y;
		final int x1 = x0 < w - 1 ? x0 + 1 : x0;
		final int y1 = y0 < h - 1 ? y0 + 1 : y0;
		final double fx = x - x0, fy = y - y0;
		final int o0 = y0 * w, o1 = y1 * w;
		final double top = fx == 0 ? p[ o0 + x0 ] : p[ o0 + x0 ] * ( 1 - fx ) + p[ o0 + x1 ] * fx;
		if ( fy == 0 ) return ( float )top;
		final double bottom = fx == 0 ? p[ o1 + x0 ] : p[ o1 + x0 ] * ( 1 - fx ) + p[ o1 + x1 ] * fx;
		return ( float )( top * ( 1 - fy ) + bottom * fy );
	}

	/**
	 * Samples a {@code w} x {@code h} window whose pixel (u, v) is read from ({@code x0 + u}, {@code y0 + v})
	 * of the source, i.e. a translation by a real-valued offset.
	 */
	static public final float[] translate( final float[] p, final int pw, final int ph, final double x0, final double y0, final int w, final int h )
	{
		final float[] q = new float[ w * h ];
		for ( int v = 0; v < h; ++v )
			for ( int u = 0; u < w; ++u )
				q[ v * w + u ] = bilinear( p, pw, ph, x0 + u, y0 + v );
		return q;
	}
}
