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

import luckystack.frames.Frame;
import luckystack.frames.FrameStore;
import luckystack.imaging.Resampler;
import luckystack.parallel.TaskFactory;
import luckystack.stack.JobContext;
import luckystack.stack.JobFailedException;
import luckystack.stack.JobFailedException.FatalReason;
import luckystack.stack.Phase;
import luckystack.utils.Utils;

/** Averages the best valid frames at their global offsets. */
public class MeanFrameBuilder
{
	private MeanFrameBuilder() {}

	/** The area to stack: the common area of all valid frames, restricted to the region of interest if there is one. */
	static public Rectangle region( final GlobalAlignment alignment, final StackingParam param ) throws JobFailedException
	{
		final Rectangle common = alignment.getIntersection();
		if ( null == common )
			throw new JobFailedException( Phase.MEAN_FRAME, FatalReason.EMPTY_INTERSECTION, "the aligned frames have no area in common" );
		if ( null == param.roi ) return common;
		final Rectangle r = new Rectangle( common.x + param.roi.x, common.y + param.roi.y, param.roi.width, param.roi.height ).intersection( common );
		if ( r.isEmpty() )
			throw new JobFailedException( Phase.MEAN_FRAME, FatalReason.EMPTY_INTERSECTION, "the region of interest " + param.roi + " lies outside the common area " + common );
		return r;
	}

	/** The first {@code count} valid frames in ranking order. */
	static public int[] bestValidFrames( final FrameRanking ranking, final GlobalAlignment alignment, final int count )
	{
		final int[] order = ranking.getOrder();
		final List< Integer > selected = new ArrayList< Integer >();
		for ( int i = 0; i < order.length && selected.size() < count; ++i )
			if ( alignment.isValid( order[ i ] ) ) selected.add( order[ i ] );
		final int[] a = new int[ selected.size() ];
		for ( int i = 0; i < a.length; ++i ) a[ i ] = selected.get( i );
		return a;
	}

	static public MeanFrame build(
			final FrameStore store,
			final FrameRanking ranking,
			final GlobalAlignment alignment,
			final StackingParam param,
			final JobContext context ) throws InterruptedException, ExecutionException, JobFailedException
	{
		if ( 0 == alignment.getNumberOfValidFrames() )
			throw new JobFailedException( Phase.MEAN_FRAME, FatalReason.NO_VALID_FRAMES, "there are no valid frames to average" );
		final Rectangle region = region( alignment, param );
		final int[] frames = bestValidFrames( ranking, alignment, param.averageFrameCount( store.size() ) );
		final int w = store.getWidth(), h = store.getHeight();

		final List< Integer > inputs = new ArrayList< Integer >();
		for ( final int f : frames ) inputs.add( f );
		final List< float[] > shifted = context.map( Phase.MEAN_FRAME, inputs, new TaskFactory< Integer, float[] >()
		{
			@Override
			public float[] process( final Integer i )
			{
				final double[] d = alignment.getOffset( i );
				return Resampler.translate( ( float[] )store.mono( i ).getPixels(), w, h, region.x + d[ 0 ], region.y + d[ 1 ], region.width, region.height );
			}
		} );
		context.checkCancelled();

		final float[] mean = average( shifted, region.width * region.height );
		Utils.log( "Averaged " + frames.length + " frames into a mean frame of " + region.width + "x" + region.height );
		return new MeanFrame( new FloatProcessor( region.width, region.height, mean, null ), region, param.noiseLevel, frames );
	}

	/**
	 * Averages all channels of the best {@code count} valid frames at their global offsets over {@code region},
	 * each frame multiplied by its brightness factor.
	 * 
	 * @return one buffer per channel
	 */
	static public float[][] background(
			final FrameStore store,
			final FrameRanking ranking,
			final GlobalAlignment alignment,
			final Rectangle region,
			final int count,
			final double[] brightnessFactors,
			final JobContext context ) throws InterruptedException, ExecutionException
	{
		final int[] frames = bestValidFrames( ranking, alignment, count );
		final int w = store.getWidth(), h = store.getHeight();
		final int nc = store.getNChannels();
		final int size = region.width * region.height;
		final List< Integer > inputs = new ArrayList< Integer >();
		for ( final int f : frames ) inputs.add( f );
		final List< float[][] > shifted = context.map( Phase.BLEND, inputs, new TaskFactory< Integer, float[][] >()
		{
			@Override
			public float[][] process( final Integer i )
			{
				final Frame frame = store.frame( i );
				final double[] d = alignment.getOffset( i );
				final float[][] c = new float[ nc ][];
				for ( int k = 0; k < nc; ++k )
				{
					c[ k ] = Resampler.translate( frame.channel( k ), w, h, region.x + d[ 0 ], region.y + d[ 1 ], region.width, region.height );
					final float factor = ( float )brightnessFactors[ i ];
					if ( 1 != factor ) for ( int j = 0; j < size; ++j ) c[ k ][ j ] *= factor;
				}
				return c;
			}
		} );
		context.checkCancelled();
		final float[][] bg = new float[ nc ][];
		for ( int k = 0; k < nc; ++k )
		{
			final List< float[] > channel = new ArrayList< float[] >( shifted.size() );
			for ( final float[][] c : shifted ) channel.add( c[ k ] );
			bg[ k ] = average( channel, size );
		}
		return bg;
	}

	/** Pixel-wise mean, summed in list order. */
	static private float[] average( final List< float[] > buffers, final int size )
	{
		final double[] sum = new double[ size ];
		for ( final float[] b : buffers )
			for ( int j = 0; j < size; ++j ) sum[ j ] += b[ j ];
		final float[] mean = new float[ size ];
		final int n = buffers.size();
		for ( int j = 0; j < size; ++j ) mean[ j ] = ( float )( sum[ j ] / n );
		return mean;
	}
}
