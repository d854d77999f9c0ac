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

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import luckystack.align.GlobalAlignment;
import luckystack.align.MeanFrame;
import luckystack.align.StackingParam;
import luckystack.frames.FrameStore;
import luckystack.imaging.QualityMeasures;
import luckystack.mesh.AlignmentPoint;
import luckystack.mesh.AlignmentPointMesh;
import luckystack.mesh.DiscardReason;
import luckystack.parallel.TaskFactory;
import luckystack.utils.Utils;

/**
 * Ranks the valid frames at every alignment point by the sharpness of the frame within the point's patch,
 * and selects the best ones for stacking there. Each frame is read once and measured at all points.
 */
public class LocalRanker
{
	private LocalRanker() {}

	/** The patch of {@code ap} in the coordinates of a frame with global offset {@code offset}, clipped to the frame. */
	static Rectangle patchInFrame( final AlignmentPoint ap, final MeanFrame mean, final double[] offset, final int width, final int height )
	{
		final Rectangle p = ap.getPatch();
		p.translate( mean.getX() + ( int )Math.round( offset[ 0 ] ), mean.getY() + ( int )Math.round( offset[ 1 ] ) );
		return p.intersection( new Rectangle( 0, 0, width, height ) );
	}

	/**
	 * Points with fewer candidate frames than {@link StackingParam#apMinFrames} are discarded from the mesh
	 * as {@link DiscardReason#INSUFFICIENT_DATA}.
	 * 
	 * @return one ranking per remaining kept point, in mesh order
	 */
	static public Map< AlignmentPoint, LocalRanking > rank(
			final FrameStore store,
			final GlobalAlignment alignment,
			final MeanFrame mean,
			final AlignmentPointMesh mesh,
			final StackingParam param,
			final JobContext context ) throws InterruptedException, ExecutionException
	{
		final int n = store.size();
		final List< AlignmentPoint > aps = mesh.getAlignmentPoints();
		final double noiseWeight = param.noisePenalty * 255.0 / store.getFullScale();

		final List< Integer > frames = new ArrayList< Integer >();
		for ( int i = 0; i < n; ++i ) if ( alignment.isValid( i ) ) frames.add( i );

		final List< double[] > measured = context.map( Phase.RANK_AT_APS, frames, new TaskFactory< Integer, double[] >()
		{
			@Override
			public double[] process( final Integer i )
			{
				final FloatProcessor blurred = store.blurred( i );
				final FloatProcessor laplacian = QualityMeasures.Method.LAPLACE == param.rankingMethod ? store.laplacian( i ) : null;
				final FloatProcessor mono = noiseWeight > 0 ? store.mono( i ) : null;
				final double[] offset = alignment.getOffset( i );
				final double[] scores = new double[ aps.size() ];
				for ( int k = 0; k < scores.length; ++k )
				{
					final Rectangle r = patchInFrame( aps.get( k ), mean, offset, store.getWidth(), store.getHeight() );
					scores[ k ] = QualityMeasures.score( param.rankingMethod, blurred, laplacian, mono, r, param.rankPixelStride, noiseWeight );
				}
				return scores;
			}
		} );
		context.checkCancelled();

		final int count = param.selectionCount( n );
		final Map< AlignmentPoint, LocalRanking > rankings = new LinkedHashMap< AlignmentPoint, LocalRanking >();
		for ( int k = 0; k < aps.size(); ++k )
		{
			final AlignmentPoint ap = aps.get( k );
			if ( frames.size() < param.apMinFrames )
			{
				mesh.discard( ap, DiscardReason.INSUFFICIENT_DATA );
				continue;
			}
			final double[] scores = new double[ n ];
			Arrays.fill( scores, Double.NaN );
			final Integer[] order = new Integer[ frames.size() ];
			for ( int j = 0; j < order.length; ++j )
			{
				order[ j ] = frames.get( j );
				scores[ order[ j ] ] = measured.get( j )[ k ];
			}
			Arrays.sort( order, new Comparator< Integer >()
			{
				@Override
				public int compare( final Integer a, final Integer b )
				{
					final int c = Double.compare( scores[ b ], scores[ a ] );
					return 0 != c ? c : Integer.compare( a, b );
				}
			} );
			final int[] o = new int[ order.length ];
			for ( int j = 0; j < o.length; ++j ) o[ j ] = order[ j ];
			rankings.put( ap, new LocalRanking( ap, scores, o, count ) );
		}
		Utils.log( "Ranked " + frames.size() + " frames at " + rankings.size() + " alignment points; stacking " + Math.min( count, frames.size() ) + " frames per point" );
		return rankings;
	}
}
