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

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;

import luckystack.align.FrameRanking;
import luckystack.align.GlobalAlignment;
import luckystack.align.MeanFrame;
import luckystack.align.StackingParam;
import luckystack.frames.Frame;
import luckystack.frames.FrameStore;
import luckystack.imaging.Resampler;
import luckystack.mesh.AlignmentPoint;
import luckystack.parallel.TaskFactory;
import luckystack.utils.Utils;

/**
 * Stacks the selected frames of every alignment point over its patch. Each patch pixel p is read
 * from its frame at {@code p + origin + global offset + F(p)}, where F is the {@link ShiftField} of
 * the frame, with bilinear interpolation in every channel.
 */
public class PatchStacker
{
	private PatchStacker() {}

	/**
	 * Factors that bring the mean brightness of every valid frame to the median over valid frames.
	 * Frames dimmer than the normalization threshold, invalid frames, and all frames when normalization
	 * is off, get 1.
	 */
	static public double[] brightnessFactors( final FrameRanking ranking, final GlobalAlignment alignment, final StackingParam param, final double fullScale )
	{
		final int n = ranking.size();
		final double[] factors = new double[ n ];
		Arrays.fill( factors, 1 );
		if ( !param.normalizeBrightness ) return factors;
		final double[] valid = new double[ alignment.getNumberOfValidFrames() ];
		for ( int i = 0, k = 0; i < n; ++i ) if ( alignment.isValid( i ) ) valid[ k++ ] = ranking.getBrightness( i );
		if ( 0 == valid.length ) return factors;
		Arrays.sort( valid );
		final int m = valid.length / 2;
		final double median = 0 == valid.length % 2 ? ( valid[ m - 1 ] + valid[ m ] ) / 2 : valid[ m ];
		final double threshold = param.normalizationThreshold * fullScale / 255.0;
		for ( int i = 0; i < n; ++i )
		{
			final double b = ranking.getBrightness( i );
			if ( alignment.isValid( i ) && b > threshold && b > 0 ) factors[ i ] = median / b;
		}
		return factors;
	}

	/** Smallest distance from (x, y) to rectangle {@code r}; 0 inside. */
	static double distance( final double x, final double y, final Rectangle r )
	{
		final double dx = Math.max( 0, Math.max( r.x - x, x - ( r.x + r.width - 1 ) ) );
		final double dy = Math.max( 0, Math.max( r.y - y, y - ( r.y + r.height - 1 ) ) );
		return Math.sqrt( dx * dx + dy * dy );
	}

	/** Radius of influence of a local shift for a mesh of the given step. */
	static public double fieldRadius( final StackingParam param, final int step )
	{
		return param.fieldRadiusFactor * step;
	}

	/**
	 * Frames are read in increasing index, in groups processed in parallel, and each frame is
	 * decoded once for all points that selected it. Contributions are added in increasing frame
	 * index, so that results do not depend on scheduling.
	 * 
	 * @param shifts the local shifts of every point to stack, in mesh order
	 * @param rankings the local rankings, for quality weights
	 * @param radius radius of influence of a local shift
	 * @param spacing distance between neighbouring alignment points
	 * @return one patch per entry of {@code shifts}, in the same order
	 */
	static public List< StackedPatch > stack(
			final FrameStore store,
			final GlobalAlignment alignment,
			final MeanFrame mean,
			final Map< AlignmentPoint, LocalRanking > rankings,
			final Map< AlignmentPoint, LocalShifts > shifts,
			final double[] brightnessFactors,
			final double radius,
			final double spacing,
			final StackingParam param,
			final JobContext context ) throws InterruptedException, ExecutionException
	{
		final List< AlignmentPoint > aps = new ArrayList< AlignmentPoint >( shifts.keySet() );
		final int na = aps.size();
		final int w = store.getWidth(), h = store.getHeight();
		final int nc = store.getNChannels();

		final List< List< AlignmentPoint > > neighbours = new ArrayList< List< AlignmentPoint > >( na );
		final double[][] weights = new double[ na ][];
		final double[] totals = new double[ na ];
		final int[] counts = new int[ na ];
		// (point, position in its shifts) of every frame, by increasing frame
		final TreeMap< Integer, List< int[] > > entries = new TreeMap< Integer, List< int[] > >();
		for ( int k = 0; k < na; ++k )
		{
			final AlignmentPoint ap = aps.get( k );
			final Rectangle patch = ap.getPatch();
			final List< AlignmentPoint > near = new ArrayList< AlignmentPoint >();
			for ( final AlignmentPoint other : aps )
				if ( distance( other.getX(), other.getY(), patch ) < radius ) near.add( other );
			neighbours.add( near );

			final LocalShifts ls = shifts.get( ap );
			weights[ k ] = frameWeights( ls, rankings.get( ap ), param.averaging );
			for ( int q = 0; q < ls.size(); ++q )
			{
				if ( 0 == weights[ k ][ q ] ) continue;
				totals[ k ] += weights[ k ][ q ];
				++counts[ k ];
				List< int[] > e = entries.get( ls.getFrame( q ) );
				if ( null == e )
				{
					e = new ArrayList< int[] >();
					entries.put( ls.getFrame( q ), e );
				}
				e.add( new int[]{ k, q } );
			}
		}

		final double[][][] sums = new double[ na ][][];
		for ( int k = 0; k < na; ++k )
		{
			final Rectangle patch = aps.get( k ).getPatch();
			sums[ k ] = new double[ nc ][ patch.width * patch.height ];
		}

		final List< Integer > frames = new ArrayList< Integer >( entries.keySet() );
		final int group = Math.max( 1, context.getNumThreads() );
		for ( int start = 0; start < frames.size(); start += group )
		{
			final List< Integer > part = frames.subList( start, Math.min( frames.size(), start + group ) );
			final List< double[][][] > contributions = context.map( Phase.STACK_PATCHES, part, new TaskFactory< Integer, double[][][] >()
			{
				@Override
				public double[][][] process( final Integer frame ) throws Exception
				{
					final List< int[] > e = entries.get( frame );
					final double[] g = alignment.getOffset( frame );
					final double ox = mean.getX() + g[ 0 ], oy = mean.getY() + g[ 1 ];
					final Frame fr = store.frame( frame );
					final float[][] channels = new float[ nc ][];
					for ( int c = 0; c < nc; ++c ) channels[ c ] = fr.channel( c );

					final double[][][] out = new double[ e.size() ][][];
					final double[] f = new double[ 2 ];
					for ( int j = 0; j < out.length; ++j )
					{
						if ( context.isCancelled() ) return null;
						final int k = e.get( j )[ 0 ], q = e.get( j )[ 1 ];
						final Rectangle patch = aps.get( k ).getPatch();
						final double scale = weights[ k ][ q ] * brightnessFactors[ frame ];
						final ShiftField field = ShiftField.forFrame( frame, neighbours.get( k ), shifts, patch, radius, spacing );
						final double[][] add = new double[ nc ][ patch.width * patch.height ];
						for ( int v = 0; v < patch.height; ++v )
						{
							final int py = patch.y + v;
							for ( int u = 0; u < patch.width; ++u )
							{
								final int px = patch.x + u;
								field.evaluate( px, py, f );
								final double sx = px + ox + f[ 0 ], sy = py + oy + f[ 1 ];
								final int i = v * patch.width + u;
								for ( int c = 0; c < nc; ++c )
									add[ c ][ i ] = scale * Resampler.bilinear( channels[ c ], w, h, sx, sy );
							}
						}
						out[ j ] = add;
					}
					return out;
				}
			}, start, frames.size() );
			context.checkCancelled();

			for ( int i = 0; i < part.size(); ++i )
			{
				final List< int[] > e = entries.get( part.get( i ) );
				final double[][][] add = contributions.get( i );
				for ( int j = 0; j < add.length; ++j )
				{
					final double[][] sum = sums[ e.get( j )[ 0 ] ];
					for ( int c = 0; c < nc; ++c )
						for ( int p = 0; p < sum[ c ].length; ++p )
							sum[ c ][ p ] += add[ j ][ c ][ p ];
				}
			}
		}

		final List< StackedPatch > patches = new ArrayList< StackedPatch >( na );
		for ( int k = 0; k < na; ++k )
		{
			final double[][] sum = sums[ k ];
			final float[][] out = new float[ nc ][ sum[ 0 ].length ];
			if ( totals[ k ] > 0 )
				for ( int c = 0; c < nc; ++c )
					for ( int p = 0; p < out[ c ].length; ++p ) out[ c ][ p ] = ( float )( sum[ c ][ p ] / totals[ k ] );
			patches.add( new StackedPatch( aps.get( k ), out, counts[ k ] ) );
		}
		Utils.log( "Stacked " + patches.size() + " patches from " + frames.size() + " frames" );
		return patches;
	}

	/**
	 * Weight of every frame with a shift: 1, or its local quality score for quality weighted
	 * averaging. Falls back to equal weights if no frame has a positive score.
	 */
	static double[] frameWeights( final LocalShifts ls, final LocalRanking ranking, final StackingParam.Averaging averaging )
	{
		final double[] weights = new double[ ls.size() ];
		double total = 0;
		if ( StackingParam.Averaging.QUALITY_WEIGHTED == averaging )
		{
			for ( int q = 0; q < weights.length; ++q )
			{
				weights[ q ] = Math.max( 0, ranking.getScore( ls.getFrame( q ) ) );
				total += weights[ q ];
			}
			if ( total > 0 ) return weights;
			Utils.log2( ls.getAlignmentPoint() + ": no frame has a positive quality, averaging without weights" );
		}
		Arrays.fill( weights, 1 );
		return weights;
	}
}
