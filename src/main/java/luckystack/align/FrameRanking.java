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

import java.util.Arrays;
import java.util.Comparator;

/**
 * A total order of frames by global quality, best first. Scores are normalized so that the best frame
 * scores 1; equal scores are ordered by frame index. Also holds each frame's mean brightness.
 */
public class FrameRanking
{
	final private double[] scores;
	final private double[] brightness;
	final private int[] order;
	final private int[] rank;

	/**
	 * @param rawScores quality per frame index, higher is better
	 * @param brightness mean brightness per frame index
	 */
	public FrameRanking( final double[] rawScores, final double[] brightness )
	{
		final int n = rawScores.length;
		double max = 0;
		for ( final double s : rawScores ) max = Math.max( max, s );
		scores = new double[ n ];
		for ( int i = 0; i < n; ++i ) scores[ i ] = max > 0 ? rawScores[ i ] / max : rawScores[ i ];
		this.brightness = brightness.clone();

		final Integer[] idx = new Integer[ n ];
		for ( int i = 0; i < n; ++i ) idx[ i ] = i;
		Arrays.sort( idx, new Comparator< Integer >()
		{
			@Override
			public int compare( final Integer a, final Integer b )
			{
				final int c = Double.compare( scores[ b ], scores[ a ] );
				return 0 != c ? c : Integer.compare( a, b );
			}
		} );
		order = new int[ n ];
		rank = new int[ n ];
		for ( int i = 0; i < n; ++i )
		{
			order[ i ] = idx[ i ];
			rank[ idx[ i ] ] = i;
		}
	}

	public int size()
	{
		return order.length;
	}

	/** Index of the best frame. */
	public int best()
	{
		return order[ 0 ];
	}

	public double getScore( final int frame )
	{
		return scores[ frame ];
	}

	public double getBrightness( final int frame )
	{
		return brightness[ frame ];
	}

	/** 0 for the best frame. */
	public int rankOf( final int frame )
	{
		return rank[ frame ];
	}

	/** Frame indices, best first. */
	public int[] getOrder()
	{
		return order.clone();
	}
}
