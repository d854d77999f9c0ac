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

import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ShortProcessor;

/** Conversion from per-channel float buffers back to the pixel type of the input frames. */
public final class Channels
{
	private Channels() {}

	/**
	 * Creates a processor of the given bit depth (8, 16, 24 for RGB, or 32) from one float buffer per channel.
	 * Integer types are rounded to the nearest value and clamped to their range.
	 */
	static public final ImageProcessor toProcessor( final float[][] channels, final int w, final int h, final int bitDepth )
	{
		final int n = w * h;
		switch ( bitDepth )
		{
		case 8:
		{
			final byte[] b = new byte[ n ];
			for ( int i = 0; i < n; ++i ) b[ i ] = ( byte )clamp( channels[ 0 ][ i ], 255 );
			return new ByteProcessor( w, h, b, null );
		}
		case 16:
		{
			final short[] s = new short[ n ];
			for ( int i = 0; i < n; ++i ) s[ i ] = ( short )clamp( channels[ 0 ][ i ], 65535 );
			return new ShortProcessor( w, h, s, null );
		}
		case 24:
		{
			final int[] rgb = new int[ n ];
			for ( int i = 0; i < n; ++i )
				rgb[ i ] = ( clamp( channels[ 0 ][ i ], 255 ) << 16 ) | ( clamp( channels[ 1 ][ i ], 255 ) << 8 ) | clamp( channels[ 2 ][ i ], 255 );
			return new ColorProcessor( w, h, rgb );
		}
		case 32:
			return new FloatProcessor( w, h, channels[ 0 ].clone(), null );
		default:
			throw new IllegalArgumentException( "Unsupported bit depth: " + bitDepth );
		}
	}

	static private final int clamp( final float v, final int max )
	{
		final int i = Math.round( v );
		return i < 0 ? 0 : ( i > max ? max : i );
	}
}
