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

import luckystack.mesh.AlignmentPoint;

/**
 * Merges overlapping stacked patches into one image. Within a patch, the weight of a pixel falls from 1 at the
 * alignment point to 1/(n+1) at the patch border, n being the distance in pixels; it stays 1 on sides extended to
 * the image border. The patch weight is the smaller of its row and column weights.
 * <p>
 * Where the accumulated weight is below the background threshold, the blend fades into a background image,
 * so that areas covered by no patch are filled smoothly.
 */
public class Blender
{
	final private int width, height, nChannels;
	final private double threshold;
	final private double[] weights;
	final private double[][] sums;

	public Blender( final int width, final int height, final int nChannels, final double threshold )
	{
		this.width = width;
		this.height = height;
		this.nChannels = nChannels;
		this.threshold = threshold;
		this.weights = new double[ width * height ];
		this.sums = new double[ nChannels ][ width * height ];
	}

	/**
	 * Weights along one axis of a patch spanning [low, high) with the alignment point at {@code center}.
	 */
	static public double[] rampWeights( final int low, final int high, final int center, final boolean extendLow, final boolean extendHigh )
	{
		final double[] w = new double[ high - low ];
		final int c = center - low;
		for ( int i = 0; i < w.length; ++i )
		{
			if ( i < c ) w[ i ] = extendLow ? 1 : ( i + 1 ) / ( double )( c + 1 );
			else w[ i ] = extendHigh ? 1 : ( high - center - ( i - c ) ) / ( double )( high - center );
		}
		return w;
	}

	public void add( final StackedPatch patch )
	{
		final AlignmentPoint ap = patch.getAlignmentPoint();
		final Rectangle r = patch.getPatch();
		final double[] wy = rampWeights( r.y, r.y + r.height, ap.getY(), ap.isExtendedLowY(), ap.isExtendedHighY() );
		final double[] wx = rampWeights( r.x, r.x + r.width, ap.getX(), ap.isExtendedLowX(), ap.isExtendedHighX() );
		for ( int v = 0; v < r.height; ++v )
		{
			final int y = r.y + v;
			if ( y < 0 || y >= height ) continue;
			for ( int u = 0; u < r.width; ++u )
			{
				final int x = r.x + u;
				if ( x < 0 || x >= width ) continue;
				final double w = Math.min( wy[ v ], wx[ u ] );
				final int i = y * width + x;
				weights[ i ] += w;
				final int j = v * r.width + u;
				for ( int c = 0; c < nChannels; ++c ) sums[ c ][ i ] += w * patch.getChannel( c )[ j ];
			}
		}
	}

	/** Whether some pixel has too little patch weight and needs the background. */
	public boolean needsBackground()
	{
		for ( final double w : weights ) if ( w < threshold ) return true;
		return false;
	}

	/**
	 * @param background one buffer per channel; may be null when {@link #needsBackground()} is false
	 * @return one buffer per channel
	 */
	public float[][] blend( final float[][] background )
	{
		final int n = width * height;
		final float[][] out = new float[ nChannels ][ n ];
		for ( int i = 0; i < n; ++i )
		{
			final double w = weights[ i ];
			final double fg = Math.min( 1, w / threshold );
			for ( int c = 0; c < nChannels; ++c )
			{
				final double stacked = w > 0 ? sums[ c ][ i ] / w : 0;
				if ( fg >= 1 )
				{
					out[ c ][ i ] = ( float )stacked;
				}
				else
				{
					if ( null == background ) throw new IllegalStateException( "A background is needed where the patches leave gaps" );
					final double bg = background[ c ][ i ];
					out[ c ][ i ] = ( float )( bg + fg * ( stacked - bg ) );
				}
			}
		}
		return out;
	}
}
