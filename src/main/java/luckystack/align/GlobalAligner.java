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

import ij.process.FloatProcessor;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;

import luckystack.frames.FrameStore;
import luckystack.imaging.Correlation;
import luckystack.parallel.TaskFactory;
import luckystack.stack.JobContext;
import luckystack.stack.JobFailedException;
import luckystack.stack.JobFailedException.FatalReason;
import luckystack.stack.Phase;
import luckystack.utils.Utils;

/**
 * Finds the translation of every frame relative to the best frame by matching the reference patch
 * against the blurred luminance of each frame. Frames are aligned independently and in parallel.
 * In {@link StackingParam.Mode#PLANET} mode the search starts from the offset between the centres
 * of gravity of the frame and the best frame.
 */
public class GlobalAligner
{
	private GlobalAligner() {}

	static public GlobalAlignment align(
			final FrameStore store,
			final FrameRanking ranking,
			final ReferencePatch reference,
			final StackingParam param,
			final JobContext context ) throws InterruptedException, ExecutionException, JobFailedException
	{
		final int n = store.size();
		final int best = ranking.best();
		final FloatProcessor bestBlurred = store.blurred( best );
		final Rectangle r = reference.getBounds();
		final int bx = ( r.width - 1 ) / 2, by = ( r.height - 1 ) / 2;
		final Correlation.Filter filter = new Correlation.Filter( param.alignMinCorrelation, param.maxRatioOfDistances, param.maxCurvatureRatio );
		final double[] bestCenter = StackingParam.Mode.PLANET == param.mode ? centerOfGravity( bestBlurred ) : null;

		final List< Integer > frames = new ArrayList< Integer >( n );
		for ( int i = 0; i < n; ++i ) frames.add( i );

		final List< Correlation.Match > matches = context.map( Phase.ALIGN_FRAMES, frames, new TaskFactory< Integer, Correlation.Match >()
		{
			@Override
			public Correlation.Match process( final Integer i ) throws Exception
			{
				if ( best == i ) return null;
				final FloatProcessor blurred = store.blurred( i );
				int cx = 0, cy = 0;
				if ( null != bestCenter )
				{
					final double[] c = centerOfGravity( blurred );
					cx = ( int )Math.round( c[ 0 ] - bestCenter[ 0 ] );
					cy = ( int )Math.round( c[ 1 ] - bestCenter[ 1 ] );
				}
				final Correlation.Match m = Correlation.match( bestBlurred, r.x + bx, r.y + by, bx, by, blurred, cx, cy, param.alignSearchWidth, filter );
				return shifted( m, cx, cy );
			}
		} );
		context.checkCancelled();

		final double[][] offsets = new double[ n ][ 2 ];
		final boolean[] valid = new boolean[ n ];
		final Rejection[] rejection = new Rejection[ n ];
		for ( int i = 0; i < n; ++i )
		{
			if ( best == i )
			{
				valid[ i ] = true;
				continue;
			}
			final Correlation.Match m = matches.get( i );
			if ( Correlation.Outcome.OUT_OF_RANGE == m.outcome ) rejection[ i ] = Rejection.SHIFT_OUT_OF_RANGE;
			else if ( !m.isValid() ) rejection[ i ] = Rejection.LOW_CORRELATION;
			if ( null == rejection[ i ] )
			{
				valid[ i ] = true;
				offsets[ i ][ 0 ] = m.dx;
				offsets[ i ][ 1 ] = m.dy;
			}
			else
			{
				context.getDiagnostics().excludeFrame( i, store.getSourceIndex( i ), rejection[ i ] );
				Utils.log2( "Frame " + i + " excluded from stacking: " + rejection[ i ] );
			}
		}

		final GlobalAlignment alignment = new GlobalAlignment( offsets, valid, rejection, store.getWidth(), store.getHeight() );
		if ( 0 == alignment.getNumberOfValidFrames() )
			throw new JobFailedException( Phase.ALIGN_FRAMES, FatalReason.NO_VALID_FRAMES, "no frame could be aligned" );
		if ( null == alignment.getIntersection() )
			throw new JobFailedException( Phase.ALIGN_FRAMES, FatalReason.EMPTY_INTERSECTION, "the aligned frames have no area in common" );
		Utils.log( "Aligned " + alignment.getNumberOfValidFrames() + " of " + n + " frames; common area: " + alignment.getIntersection() );
		return alignment;
	}

	/** The match with the shift taken relative to the unshifted frame instead of the search origin. */
	static private Correlation.Match shifted( final Correlation.Match m, final int cx, final int cy )
	{
		if ( 0 == cx && 0 == cy ) return m;
		return new Correlation.Match( m.dx + cx, m.dy + cy, m.r, m.outcome );
	}

	/**
	 * Centre of gravity of the pixels brighter than half the maximum, weighted by their excess over it.
	 * Returns the image centre if there are no such pixels.
	 */
	static public double[] centerOfGravity( final FloatProcessor fp )
	{
		final int w = fp.getWidth(), h = fp.getHeight();
		final float[] p = ( float[] )fp.getPixels();
		double max = -Double.MAX_VALUE;
		for ( final float v : p ) max = Math.max( max, v );
		final double threshold = max / 2;
		double m00 = 0, m10 = 0, m01 = 0;
		for ( int y = 0; y < h; ++y )
		{
			for ( int x = 0; x < w; ++x )
			{
				final double v = p[ y * w + x ] - threshold;
				if ( v <= 0 ) continue;
				m00 += v;
				m10 += v * x;
				m01 += v * y;
			}
		}
		if ( m00 <= 0 ) return new double[]{ w / 2.0, h / 2.0 };
		return new double[]{ m10 / m00, m01 / m00 };
	}
}
