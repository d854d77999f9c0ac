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

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;

import ij.process.FloatProcessor;
import mpicbg.ij.blockmatching.BlockMatching;
import mpicbg.models.ErrorStatistic;
import mpicbg.models.Point;
import mpicbg.models.PointMatch;
import mpicbg.models.TranslationModel2D;

/**
 * Block matching by Pearson's product-moment correlation coefficient (PMCC) on top of
 * {@link BlockMatching#matchByMaximalPMCC}. Blocks of a source image centred at integer points are
 * searched for in a target image that is translated by a fixed offset, over all integer shifts
 * within the search radius, and the best interior maximum is refined to sub-pixel precision.
 * <p>
 * The search radius is reduced where the target ends, and a maximum on the border of the searched
 * window is reported as out of range rather than as a match.
 */
public final class Correlation
{
	/** Integer peaks at least this high are taken as exact and are not refined. */
	static public final double PERFECT_MATCH = 1 - 1e-6;

	private Correlation() {}

	static public enum Outcome
	{
		MATCHED,
		/** No sufficiently well defined correlation peak. */
		NO_MATCH,
		/** The peak lies on the border of the search window, or there is no room to search at all. */
		OUT_OF_RANGE
	}

	/** The outcome of one block. The shift maps source coordinates onto target coordinates. */
	static public final class Match
	{
		/** Sub-pixel shift relative to the offset. */
		final public double dx, dy;
		/** PMCC at the integer peak; NaN unless matched. */
		final public double r;
		final public Outcome outcome;

		public Match( final double dx, final double dy, final double r, final Outcome outcome )
		{
			this.dx = dx;
			this.dy = dy;
			this.r = r;
			this.outcome = outcome;
		}

		public boolean isValid()
		{
			return Outcome.MATCHED == outcome;
		}

		@Override
		public String toString()
		{
			return "Match[" + dx + ", " + dy + ", r=" + r + ", " + outcome + "]";
		}
	}

	/** Thresholds passed to {@link BlockMatching}. */
	static public final class Filter
	{
		final public float minR, rod, maxCurvature;

		/**
		 * @param minR minimal PMCC of an accepted peak
		 * @param rod maximal ratio (1 + second best) / (1 + best) of the two highest maxima
		 * @param maxCurvature maximal ratio of the principal curvatures of the peak
		 */
		public Filter( final double minR, final double rod, final double maxCurvature )
		{
			this.minR = ( float )minR;
			this.rod = ( float )rod;
			this.maxCurvature = ( float )maxCurvature;
		}
	}

	/**
	 * Matches the blocks of {@code source} centred at ({@code x[i]}, {@code y[i]}) against
	 * {@code target}, where source pixel p is expected at p + ({@code ox}, {@code oy}).
	 * 
	 * @param blockRadiusX half block width, the block is 2 * radius + 1 wide
	 * @param blockRadiusY half block height
	 * @param radius maximal integer shift on both axes
	 * @return one match per point, in the order of the points
	 */
	static public Match[] match(
			final FloatProcessor source,
			final int[] x,
			final int[] y,
			final int blockRadiusX,
			final int blockRadiusY,
			final FloatProcessor target,
			final double ox,
			final double oy,
			final int radius,
			final Filter filter ) throws InterruptedException, ExecutionException
	{
		final Match[] matches = new Match[ x.length ];
		final int sw = source.getWidth(), sh = source.getHeight();

		// points grouped by the radius that fits into the target
		final TreeMap< Integer, List< Integer > > groups = new TreeMap< Integer, List< Integer > >();
		for ( int i = 0; i < x.length; ++i )
		{
			final int s = Math.min( radius + 1, room( x[ i ], y[ i ], blockRadiusX, blockRadiusY, ox, oy, target ) );
			final boolean inside = x[ i ] - blockRadiusX >= 0 && x[ i ] + blockRadiusX < sw && y[ i ] - blockRadiusY >= 0 && y[ i ] + blockRadiusY < sh;
			if ( s < 1 || !inside )
			{
				matches[ i ] = new Match( 0, 0, Double.NaN, Outcome.OUT_OF_RANGE );
				continue;
			}
			List< Integer > group = groups.get( s );
			if ( null == group )
			{
				group = new ArrayList< Integer >();
				groups.put( s, group );
			}
			group.add( i );
		}
		if ( groups.isEmpty() ) return matches;

		final FloatProcessor paddedSource = pad( source );
		final FloatProcessor paddedTarget = pad( target );
		final TranslationModel2D offset = new TranslationModel2D();
		offset.set( ox, oy );

		for ( final Map.Entry< Integer, List< Integer > > e : groups.entrySet() )
		{
			final int s = e.getKey();
			final IdentityHashMap< Point, Integer > index = new IdentityHashMap< Point, Integer >();
			final ArrayList< Point > points = new ArrayList< Point >();
			for ( final int i : e.getValue() )
			{
				final Point p = new Point( new double[]{ x[ i ], y[ i ] } );
				index.put( p, i );
				points.add( p );
			}

			final ArrayList< PointMatch > found = new ArrayList< PointMatch >();
			BlockMatching.matchByMaximalPMCC(
					paddedSource,
					paddedTarget,
					null,
					null,
					1.0,
					offset,
					blockRadiusX,
					blockRadiusY,
					s,
					s,
					filter.minR,
					filter.rod,
					filter.maxCurvature,
					points,
					found,
					new ErrorStatistic( 1 ) );

			for ( final int i : e.getValue() )
				matches[ i ] = new Match( 0, 0, Double.NaN, Outcome.NO_MATCH );
			for ( final PointMatch pm : found )
			{
				final int i = index.get( pm.getP1() );
				final double[] q = pm.getP2().getL();
				double dx = q[ 0 ] - x[ i ] - ox;
				double dy = q[ 1 ] - y[ i ] - oy;
				final long ix = Math.round( dx ), iy = Math.round( dy );
				if ( Math.abs( ix ) >= s || Math.abs( iy ) >= s )
				{
					matches[ i ] = new Match( dx, dy, Double.NaN, Outcome.OUT_OF_RANGE );
					continue;
				}
				final double r = pmcc( source, x[ i ], y[ i ], blockRadiusX, blockRadiusY, target, x[ i ] + ox + ix, y[ i ] + oy + iy );
				if ( r >= PERFECT_MATCH )
				{
					dx = ix;
					dy = iy;
				}
				matches[ i ] = new Match( dx, dy, r, Outcome.MATCHED );
			}
		}
		return matches;
	}

	/** Convenience for a single block. */
	static public Match match(
			final FloatProcessor source,
			final int x,
			final int y,
			final int blockRadiusX,
			final int blockRadiusY,
			final FloatProcessor target,
			final double ox,
			final double oy,
			final int radius,
			final Filter filter ) throws InterruptedException, ExecutionException
	{
		return match( source, new int[]{ x }, new int[]{ y }, blockRadiusX, blockRadiusY, target, ox, oy, radius, filter )[ 0 ];
	}

	/**
	 * Largest search radius for which the block at (x, y) and the 3x3 neighbourhood of its extreme
	 * shifts stay inside {@code target}.
	 */
	static int room( final int x, final int y, final int bx, final int by, final double ox, final double oy, final FloatProcessor target )
	{
		final double x0 = x + ox - bx - 1, x1 = x + ox + bx + 1;
		final double y0 = y + oy - by - 1, y1 = y + oy + by + 1;
		final double m = Math.min(
				Math.min( x0, target.getWidth() - 1 - x1 ),
				Math.min( y0, target.getHeight() - 1 - y1 ) );
		return m < 0 ? -1 : ( int )Math.floor( m );
	}

	/**
	 * Adds a last column and row that repeat the ones before. {@link BlockMatching} needs them
	 * beyond the last source block, and they make interpolation up to the last target pixel exact.
	 */
	static private FloatProcessor pad( final FloatProcessor fp )
	{
		final int w = fp.getWidth(), h = fp.getHeight();
		final FloatProcessor padded = new FloatProcessor( w + 1, h + 1 );
		for ( int y = 0; y <= h; ++y )
		{
			final int sy = Math.min( y, h - 1 );
			for ( int x = 0; x <= w; ++x )
				padded.setf( x, y, fp.getf( Math.min( x, w - 1 ), sy ) );
		}
		return padded;
	}

	/**
	 * PMCC of the source block at (x, y) and the target block centred at (tx, ty), sampled with
	 * bilinear interpolation. 0 if either block is flat.
	 */
	static double pmcc( final FloatProcessor source, final int x, final int y, final int bx, final int by, final FloatProcessor target, final double tx, final double ty )
	{
		final float[] t = ( float[] )target.getPixels();
		final int tw = target.getWidth(), th = target.getHeight();
		final int n = ( 2 * bx + 1 ) * ( 2 * by + 1 );
		final double[] a = new double[ n ], b = new double[ n ];
		double ma = 0, mb = 0;
		for ( int v = -by, k = 0; v <= by; ++v )
			for ( int u = -bx; u <= bx; ++u, ++k )
			{
				a[ k ] = source.getf( x + u, y + v );
				b[ k ] = Resampler.bilinear( t, tw, th, tx + u, ty + v );
				ma += a[ k ];
				mb += b[ k ];
			}
		ma /= n;
		mb /= n;
		double sab = 0, saa = 0, sbb = 0;
		for ( int k = 0; k < n; ++k )
		{
			final double da = a[ k ] - ma, db = b[ k ] - mb;
			sab += da * db;
			saa += da * da;
			sbb += db * db;
		}
		if ( saa <= 0 || sbb <= 0 ) return 0;
		return sab / Math.sqrt( saa * sbb );
	}
}
