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

import java.awt.Rectangle;
import java.util.Arrays;

import mpicbg.models.TranslationModel2D;

/**
 * The translation of every frame relative to the best frame, and the area all valid frames have in common.
 * <p>
 * A frame's offset maps reference coordinates to frame coordinates: the frame pixel showing what the
 * best frame shows at (x, y) is at (x + dx, y + dy). Invalid frames keep an entry but take no further part.
 */
public class GlobalAlignment
{
	final private TranslationModel2D[] models;
	final private boolean[] valid;
	final private Rejection[] rejection;
	final private Rectangle intersection;

	/**
	 * @param offsets {dx, dy} per frame
	 * @param valid per frame
	 * @param rejection reason per invalid frame, null for valid ones
	 * @param width frame width
	 * @param height frame height
	 */
	public GlobalAlignment( final double[][] offsets, final boolean[] valid, final Rejection[] rejection, final int width, final int height )
	{
		final int n = offsets.length;
		this.models = new TranslationModel2D[ n ];
		for ( int i = 0; i < n; ++i )
		{
			models[ i ] = new TranslationModel2D();
			models[ i ].set( offsets[ i ][ 0 ], offsets[ i ][ 1 ] );
		}
		this.valid = valid.clone();
		this.rejection = rejection.clone();
		this.intersection = intersect( width, height );
	}

	/** All frames valid and unshifted. */
	static public GlobalAlignment identity( final int n, final int width, final int height )
	{
		final boolean[] valid = new boolean[ n ];
		Arrays.fill( valid, true );
		return new GlobalAlignment( new double[ n ][ 2 ], valid, new Rejection[ n ], width, height );
	}

	private Rectangle intersect( final int width, final int height )
	{
		double maxNegX = -Double.MAX_VALUE, maxNegY = -Double.MAX_VALUE;
		double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE;
		boolean any = false;
		for ( int i = 0; i < models.length; ++i )
		{
			if ( !valid[ i ] ) continue;
			any = true;
			final double[] t = getOffset( i );
			maxNegX = Math.max( maxNegX, -t[ 0 ] );
			maxNegY = Math.max( maxNegY, -t[ 1 ] );
			minX = Math.min( minX, width - 1 - t[ 0 ] );
			minY = Math.min( minY, height - 1 - t[ 1 ] );
		}
		if ( !any ) return null;
		final int x0 = ( int )Math.ceil( maxNegX - 1e-9 ), y0 = ( int )Math.ceil( maxNegY - 1e-9 );
		final int x1 = ( int )Math.floor( minX + 1e-9 ), y1 = ( int )Math.floor( minY + 1e-9 );
		if ( x1 < x0 || y1 < y0 ) return null;
		return new Rectangle( x0, y0, x1 - x0 + 1, y1 - y0 + 1 );
	}

	public int size()
	{
		return models.length;
	}

	/** {dx, dy} of frame {@code i}. */
	public double[] getOffset( final int i )
	{
		return models[ i ].apply( new double[]{ 0, 0 } );
	}

	public boolean isValid( final int i )
	{
		return valid[ i ];
	}

	public Rejection getRejection( final int i )
	{
		return rejection[ i ];
	}

	public int getNumberOfValidFrames()
	{
		int count = 0;
		for ( final boolean v : valid ) if ( v ) ++count;
		return count;
	}

	/** Area covered by all valid frames, in reference coordinates; null if there is none. */
	public Rectangle getIntersection()
	{
		return null == intersection ? null : new Rectangle( intersection );
	}
}
