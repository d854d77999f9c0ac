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

import ij.process.FloatProcessor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import luckystack.align.GlobalAlignment;
import luckystack.align.MeanFrame;
import luckystack.align.Rejection;
import luckystack.align.StackingParam;
import luckystack.frames.FrameStore;
import luckystack.imaging.Correlation;
import luckystack.mesh.AlignmentPoint;
import luckystack.mesh.AlignmentPointMesh;
import luckystack.mesh.DiscardReason;
import luckystack.parallel.TaskFactory;
import luckystack.utils.Utils;

/**
 * Matches the box of every alignment point on the blurred mean frame against each of its selected
 * frames, translated by the global offset of the frame, so that the shift found is relative to
 * that offset. Each frame is read once and matched at all points that selected it in a single
 * block matching pass.
 */
public class LocalShiftEstimator
{
	private LocalShiftEstimator() {}

	/** Outcome of one match: a shift, or a rejection. */
	static private final class Result
	{
		final double dx, dy;
		final Rejection rejection;

		Result( final double dx, final double dy, final Rejection rejection )
		{
			this.dx = dx;
			this.dy = dy;
			this.rejection = rejection;
		}
	}

	/**
	 * Pairs that fail are recorded in the diagnostics; points left with fewer than
	 * max(1, {@link StackingParam#apMinFrames}) frames are discarded from the mesh as {@link DiscardReason#INSUFFICIENT_DATA}.
	 * 
	 * @return the shifts of every remaining point, in mesh order
	 */
	static public Map< AlignmentPoint, LocalShifts > estimate(
			final FrameStore store,
			final GlobalAlignment alignment,
			final MeanFrame mean,
			final AlignmentPointMesh mesh,
			final Map< AlignmentPoint, LocalRanking > rankings,
			final StackingParam param,
			final JobContext context ) throws InterruptedException, ExecutionException
	{
		final int n = store.size();
		final List< AlignmentPoint > aps = new ArrayList< AlignmentPoint >();
		for ( final AlignmentPoint ap : mesh.getAlignmentPoints() ) if ( rankings.containsKey( ap ) ) aps.add( ap );

		// The points that selected each frame
		final List< List< Integer > > pointsOfFrame = new ArrayList< List< Integer > >( n );
		for ( int i = 0; i < n; ++i ) pointsOfFrame.add( new ArrayList< Integer >() );
		for ( int k = 0; k < aps.size(); ++k )
			for ( final int f : rankings.get( aps.get( k ) ).getSelectedAscending() )
				pointsOfFrame.get( f ).add( k );

		final FloatProcessor meanBlurred = mean.getBlurred();
		final Correlation.Filter filter = new Correlation.Filter( param.apMinCorrelation, param.maxRatioOfDistances, param.maxCurvatureRatio );

		final List< Integer > frames = new ArrayList< Integer >();
		for ( int i = 0; i < n; ++i ) if ( !pointsOfFrame.get( i ).isEmpty() ) frames.add( i );

		final List< Result[] > results = context.map( Phase.LOCAL_SHIFTS, frames, new TaskFactory< Integer, Result[] >()
		{
			@Override
			public Result[] process( final Integer i ) throws Exception
			{
				final double[] g = alignment.getOffset( i );
				final List< Integer > points = pointsOfFrame.get( i );
				final int[] x = new int[ points.size() ], y = new int[ points.size() ];
				int radius = Integer.MAX_VALUE;
				for ( int j = 0; j < x.length; ++j )
				{
					final AlignmentPoint ap = aps.get( points.get( j ) );
					x[ j ] = ap.getX();
					y[ j ] = ap.getY();
					radius = Math.min( radius, ap.getHalfBoxWidth() - 1 );
				}
				final Correlation.Match[] m = Correlation.match(
						meanBlurred, x, y, radius, radius,
						store.blurred( i ), mean.getX() + g[ 0 ], mean.getY() + g[ 1 ],
						param.apSearchWidth, filter );
				final Result[] r = new Result[ m.length ];
				for ( int j = 0; j < r.length; ++j )
				{
					Rejection rejection = null;
					if ( Correlation.Outcome.OUT_OF_RANGE == m[ j ].outcome ) rejection = Rejection.SHIFT_OUT_OF_RANGE;
					else if ( !m[ j ].isValid() ) rejection = Rejection.LOW_CORRELATION;
					r[ j ] = new Result( m[ j ].dx, m[ j ].dy, rejection );
				}
				return r;
			}
		} );
		context.checkCancelled();

		// Regroup by point, frames in increasing order
		final List< List< Integer > > framesOfPoint = new ArrayList< List< Integer > >();
		final List< List< Result > > resultsOfPoint = new ArrayList< List< Result > >();
		for ( int k = 0; k < aps.size(); ++k )
		{
			framesOfPoint.add( new ArrayList< Integer >() );
			resultsOfPoint.add( new ArrayList< Result >() );
		}
		final int[] histogram = new int[ param.apSearchWidth + 2 ];
		int attempted = 0;
		for ( int j = 0; j < frames.size(); ++j )
		{
			final int f = frames.get( j );
			final List< Integer > points = pointsOfFrame.get( f );
			final Result[] r = results.get( j );
			for ( int q = 0; q < r.length; ++q )
			{
				final int k = points.get( q );
				++attempted;
				if ( null != r[ q ].rejection )
				{
					context.getDiagnostics().dropPair( aps.get( k ), f, r[ q ].rejection );
					continue;
				}
				framesOfPoint.get( k ).add( f );
				resultsOfPoint.get( k ).add( r[ q ] );
				final int bin = ( int )Math.round( Math.sqrt( r[ q ].dx * r[ q ].dx + r[ q ].dy * r[ q ].dy ) );
				++histogram[ Math.min( bin, histogram.length - 1 ) ];
			}
		}
		context.getDiagnostics().setShiftStatistics( histogram, attempted );

		final int minFrames = Math.max( 1, param.apMinFrames );
		final Map< AlignmentPoint, LocalShifts > shifts = new LinkedHashMap< AlignmentPoint, LocalShifts >();
		for ( int k = 0; k < aps.size(); ++k )
		{
			final AlignmentPoint ap = aps.get( k );
			final List< Integer > fs = framesOfPoint.get( k );
			if ( fs.size() < minFrames )
			{
				mesh.discard( ap, DiscardReason.INSUFFICIENT_DATA );
				Utils.log2( ap + " discarded: only " + fs.size() + " frames matched" );
				continue;
			}
			final int[] fa = new int[ fs.size() ];
			final double[][] sa = new double[ fs.size() ][];
			for ( int q = 0; q < fa.length; ++q )
			{
				final Result r = resultsOfPoint.get( k ).get( q );
				fa[ q ] = fs.get( q );
				sa[ q ] = new double[]{ r.dx, r.dy };
			}
			shifts.put( ap, new LocalShifts( ap, fa, sa ) );
		}
		Utils.log( "Local shifts found at " + shifts.size() + " alignment points" );
		return shifts;
	}
}
