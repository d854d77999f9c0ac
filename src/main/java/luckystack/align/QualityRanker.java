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
import luckystack.imaging.Filters;
import luckystack.imaging.QualityMeasures;
import luckystack.parallel.TaskFactory;
import luckystack.stack.JobContext;
import luckystack.stack.Phase;
import luckystack.utils.Utils;

/** Ranks all frames of a store by the sharpness of their blurred luminance. No frame is discarded. */
public class QualityRanker
{
	private QualityRanker() {}

	static public FrameRanking rank( final FrameStore store, final StackingParam param, final JobContext context ) throws InterruptedException, ExecutionException
	{
		final int n = store.size();
		final Rectangle all = new Rectangle( 0, 0, store.getWidth(), store.getHeight() );
		final double noiseWeight = param.noisePenalty * 255.0 / store.getFullScale();

		final List< Integer > frames = new ArrayList< Integer >( n );
		for ( int i = 0; i < n; ++i ) frames.add( i );

		final List< double[] > measured = context.map( Phase.RANK_FRAMES, frames, new TaskFactory< Integer, double[] >()
		{
			@Override
			public double[] process( final Integer i )
			{
				final FloatProcessor mono = store.mono( i );
				final FloatProcessor laplacian = QualityMeasures.Method.LAPLACE == param.rankingMethod ? store.laplacian( i ) : null;
				final double score = QualityMeasures.score(
						param.rankingMethod,
						store.blurred( i ),
						laplacian,
						mono,
						all,
						param.rankPixelStride,
						noiseWeight );
				return new double[]{ score, Filters.mean( ( float[] )mono.getPixels() ) };
			}
		} );

		final double[] scores = new double[ n ];
		final double[] brightness = new double[ n ];
		for ( int i = 0; i < n; ++i )
		{
			scores[ i ] = measured.get( i )[ 0 ];
			brightness[ i ] = measured.get( i )[ 1 ];
		}
		final FrameRanking ranking = new FrameRanking( scores, brightness );
		Utils.log( "Ranked " + n + " frames; best frame: " + ranking.best() + " (source " + store.getSourceIndex( ranking.best() ) + ")" );
		return ranking;
	}
}
