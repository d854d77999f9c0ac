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

import ij.process.FloatProcessor;

import java.awt.Rectangle;

/**
 * Sharpness and structure measures evaluated inside a rectangle of a float image.
 * All rectangles are clipped to the image first.
 */
public final class QualityMeasures
{
	/** How sharpness is measured when ranking frames, globally and at alignment points. */
	static public enum Method {
		/** Mean gradient magnitude on a subsampled grid. */
		GRADIENT,
		/** Standard deviation of the Laplacian of the blurred image. */
		LAPLACE,
		/** Mean Sobel edge magnitude. */
		SOBEL
	}

	static private final double IMMERKAER_NORM = Math.sqrt( Math.PI / 2 ) / 6;

	private QualityMeasures() {}

	static private final Rectangle clip( final Rectangle r, final int w, final int h )
	{
		return r.intersection( new Rectangle( 0, 0, w, h ) );
	}

	/**
	 * Sharpness of a frame inside {@code r}, penalized by its noise:
	 * {@code measure / (1 + noiseWeight * sigma)}, where sigma is the noise estimate of the unblurred mono image.
	 * 
	 * @param blurred the blurred mono image
	 * @param laplacian the Laplacian of {@code blurred}; only read for {@link Method#LAPLACE}
	 * @param mono the unblurred mono image; only read when {@code noiseWeight} is positive
	 */
	static public final double score(
			final Method method,
			final FloatProcessor blurred,
			final FloatProcessor laplacian,
			final FloatProcessor mono,
			final Rectangle r,
			final int stride,
			final double noiseWeight )
	{
		final double measure;
		switch ( method )
		{
		case GRADIENT:
			measure = gradient( blurred, r, stride );
			break;
		case SOBEL:
			measure = sobel( blurred, r );
			break;
		case LAPLACE:
		default:
			measure = laplaceDeviation( laplacian, r, stride );
		}
		if ( noiseWeight <= 0 ) return measure;
		return measure / ( 1 + noiseWeight * noiseSigma( mono, r ) );
	}

	/** Mean gradient magnitude, sampling every {@code stride} pixels with differences {@code stride} apart. */
	static public final double gradient( final FloatProcessor fp, final Rectangle rect, final int stride )
	{
		final int w = fp.getWidth();
		final Rectangle r = clip( rect, w, fp.getHeight() );
		final float[] p = ( float[] )fp.getPixels();
		double sum = 0;
		long n = 0;
		for ( int y = r.y; y + stride < r.y + r.height; y += stride )
		{
			for ( int x = r.x; x + stride < r.x + r.width; x += stride )
			{
				final int i = y * w + x;
				final double dx = p[ i + stride ] - p[ i ];
				final double dy = p[ i + stride * w ] - p[ i ];
				sum += Math.sqrt( dx * dx + dy * dy );
				++n;
			}
		}
		return 0 == n ? 0 : sum / n;
	}

	/** Standard deviation of the Laplacian values sampled every {@code stride} pixels. */
	static public final double laplaceDeviation( final FloatProcessor laplacian, final Rectangle rect, final int stride )
	{
		final int w = laplacian.getWidth();
		final Rectangle r = clip( rect, w, laplacian.getHeight() );
		final float[] p = ( float[] )laplacian.getPixels();
		double s = 0, s2 = 0;
		long n = 0;
		for ( int y = r.y; y < r.y + r.height; y += stride )
		{
			for ( int x = r.x; x < r.x + r.width; x += stride )
			{
				final double v = p[ y * w + x ];
				s += v;
				s2 += v * v;
				++n;
			}
		}
		if ( n < 2 ) return 0;
		final double mean = s / n;
		return Math.sqrt( Math.max( 0, s2 / n - mean * mean ) );
	}

	/** Mean of ImageJ's Sobel edge filter over the rectangle. */
	static public final double sobel( final FloatProcessor fp, final Rectangle rect )
	{
		final Rectangle r = clip( rect, fp.getWidth(), fp.getHeight() );
		if ( r.width < 3 || r.height < 3 ) return 0;
		final FloatProcessor crop = Filters.cropProcessor( fp, r );
		crop.findEdges();
		return Filters.mean( ( float[] )crop.getPixels() );
	}

	/**
	 * Immerkær's fast noise estimate: the standard deviation of additive white noise,
	 * from the mean absolute response to the difference of two Laplacians.
	 */
	static public final double noiseSigma( final FloatProcessor fp, final Rectangle rect )
	{
		final int w = fp.getWidth();
		final Rectangle r = clip( rect, w, fp.getHeight() ).intersection( new Rectangle( 1, 1, w - 2, fp.getHeight() - 2 ) );
		if ( r.width < 1 || r.height < 1 ) return 0;
		final float[] p = ( float[] )fp.getPixels();
		double sum = 0;
		for ( int y = r.y; y < r.y + r.height; ++y )
		{
			for ( int x = r.x; x < r.x + r.width; ++x )
			{
				final int i = y * w + x;
				final double v =
						      p[ i - w - 1 ] - 2 * p[ i - w ] + p[ i - w + 1 ]
						- 2 * p[ i - 1 ]     + 4 * p[ i ]     - 2 * p[ i + 1 ]
						    + p[ i + w - 1 ] - 2 * p[ i + w ] + p[ i + w + 1 ];
				sum += Math.abs( v );
			}
		}
		return IMMERKAER_NORM * sum / ( ( double )r.width * r.height );
	}

	/** Minimum over both axes of the mean absolute difference between pixels {@code distance} apart. */
	static public final double structure( final float[] p, final int w, final int h, final Rectangle rect, final int distance )
	{
		final Rectangle r = clip( rect, w, h );
		double sh = 0, sv = 0;
		long nh = 0, nv = 0;
		for ( int y = r.y; y < r.y + r.height; ++y )
		{
			for ( int x = r.x; x < r.x + r.width; ++x )
			{
				final int i = y * w + x;
				if ( x + distance < r.x + r.width )
				{
					sh += Math.abs( p[ i + distance ] - p[ i ] );
					++nh;
				}
				if ( y + distance < r.y + r.height )
				{
					sv += Math.abs( p[ i + distance * w ] - p[ i ] );
					++nv;
				}
			}
		}
		if ( 0 == nh || 0 == nv ) return 0;
		return Math.min( sh / nh, sv / nv );
	}

	/**
	 * Structure counting only differences centred on pixels brighter than {@code blackThreshold},
	 * {@code 2*stride} pixels apart. When more than {@code minFraction} of the pixels are bright,
	 * the reduced sample count is compensated for; otherwise it is not, which penalizes dim windows.
	 * The result is per pixel of the window.
	 */
	static public final double structureThresholdWeighted(
			final float[] p,
			final int w,
			final int h,
			final Rectangle rect,
			final int stride,
			final double blackThreshold,
			final double minFraction )
	{
		final Rectangle r = clip( rect, w, h );
		final int size = r.width * r.height;
		if ( 0 == size ) return 0;
		int bright = 0;
		for ( int y = r.y; y < r.y + r.height; ++y )
			for ( int x = r.x; x < r.x + r.width; ++x )
				if ( p[ y * w + x ] > blackThreshold ) ++bright;
		final double fraction = bright / ( double )size;

		double sh = 0, sv = 0;
		for ( int y = r.y; y < r.y + r.height; ++y )
		{
			for ( int x = r.x; x < r.x + r.width; ++x )
			{
				final int i = y * w + x;
				if ( x - stride >= r.x && x + stride < r.x + r.width && p[ i ] > blackThreshold )
					sh += Math.abs( p[ i + stride ] - p[ i - stride ] );
				if ( y - stride >= r.y && y + stride < r.y + r.height && p[ i ] > blackThreshold )
					sv += Math.abs( p[ i + stride * w ] - p[ i - stride * w ] );
			}
		}
		double s = Math.min( sh, sv ) / size;
		if ( fraction > minFraction ) s /= fraction;
		return s;
	}

	/** Minimum, maximum and mean of the rectangle, in that order. */
	static public final double[] range( final float[] p, final int w, final int h, final Rectangle rect )
	{
		final Rectangle r = clip( rect, w, h );
		double min = Double.MAX_VALUE, max = -Double.MAX_VALUE, s = 0;
		for ( int y = r.y; y < r.y + r.height; ++y )
		{
			for ( int x = r.x; x < r.x + r.width; ++x )
			{
				final double v = p[ y * w + x ];
				if ( v < min ) min = v;
				if ( v > max ) max = v;
				s += v;
			}
		}
		final int n = r.width * r.height;
		return 0 == n ? new double[]{ 0, 0, 0 } : new double[]{ min, max, s / n };
	}
}
