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
import java.util.List;
import java.util.Map;

import luckystack.mesh.AlignmentPoint;
import mpicbg.models.MovingLeastSquaresTransform2;
import mpicbg.models.Point;
import mpicbg.models.PointMatch;
import mpicbg.models.TranslationModel2D;

/**
 * The local shift of one frame at any position of the mean frame, interpolated from the shifts found
 * at alignment points by a moving least squares translation.
 * <p>
 * Every alignment point with a shift maps its position p to p + s. Around a region, anchors on a
 * lattice that are at least {@code radius} away from every such point map onto themselves, so that
 * the field falls off to zero, meaning the global offset alone, away from the points.
 */
public class ShiftField
{
	/** Exponent of the inverse squared distance weights. */
	static public final double ALPHA = 1.0;

	final private MovingLeastSquaresTransform2 mls;
	final private int numPoints, numAnchors;

	/**
	 * @param x point abscissae
	 * @param y point ordinates
	 * @param sx shift abscissae
	 * @param sy shift ordinates
	 * @param region area the field is evaluated in
	 * @param radius distance within which a point suppresses anchors
	 * @param spacing distance between neighbouring anchors
	 */
	public ShiftField(
			final double[] x,
			final double[] y,
			final double[] sx,
			final double[] sy,
			final Rectangle region,
			final double radius,
			final double spacing ) throws Exception
	{
		if ( !( radius > 0 ) ) throw new IllegalArgumentException( "radius must be positive: " + radius );
		if ( !( spacing > 0 ) ) throw new IllegalArgumentException( "spacing must be positive: " + spacing );
		this.numPoints = x.length;
		if ( 0 == numPoints )
		{
			mls = null;
			numAnchors = 0;
			return;
		}

		final List< PointMatch > matches = new ArrayList< PointMatch >();
		for ( int j = 0; j < numPoints; ++j )
			matches.add( new PointMatch(
					new Point( new double[]{ x[ j ], y[ j ] } ),
					new Point( new double[]{ x[ j ] + sx[ j ], y[ j ] + sy[ j ] } ) ) );

		final double r2 = radius * radius;
		final int nx = ( int )Math.ceil( ( region.width - 1 + 2 * radius ) / spacing );
		final int ny = ( int )Math.ceil( ( region.height - 1 + 2 * radius ) / spacing );
		int anchors = 0;
		for ( int j = 0; j <= ny; ++j )
		{
			final double ay = region.y - radius + j * spacing;
			for ( int i = 0; i <= nx; ++i )
			{
				final double ax = region.x - radius + i * spacing;
				boolean free = true;
				for ( int k = 0; k < numPoints && free; ++k )
				{
					final double dx = ax - x[ k ], dy = ay - y[ k ];
					free = dx * dx + dy * dy >= r2;
				}
				if ( !free ) continue;
				final double[] l = new double[]{ ax, ay };
				matches.add( new PointMatch( new Point( l ), new Point( l.clone() ) ) );
				++anchors;
			}
		}
		this.numAnchors = anchors;

		mls = new MovingLeastSquaresTransform2();
		mls.setModel( TranslationModel2D.class );
		mls.setAlpha( ALPHA );
		mls.setMatches( matches );
	}

	/**
	 * The field of {@code frame} over {@code region} from those of {@code points} at which the frame
	 * has a shift.
	 */
	static public ShiftField forFrame(
			final int frame,
			final List< AlignmentPoint > points,
			final Map< AlignmentPoint, LocalShifts > shifts,
			final Rectangle region,
			final double radius,
			final double spacing ) throws Exception
	{
		final ArrayList< double[] > found = new ArrayList< double[] >();
		for ( final AlignmentPoint ap : points )
		{
			final LocalShifts ls = shifts.get( ap );
			if ( null == ls ) continue;
			final int i = ls.indexOf( frame );
			if ( i < 0 ) continue;
			found.add( new double[]{ ap.getX(), ap.getY(), ls.shiftX( i ), ls.shiftY( i ) } );
		}
		final int n = found.size();
		final double[] x = new double[ n ], y = new double[ n ], sx = new double[ n ], sy = new double[ n ];
		for ( int j = 0; j < n; ++j )
		{
			final double[] f = found.get( j );
			x[ j ] = f[ 0 ];
			y[ j ] = f[ 1 ];
			sx[ j ] = f[ 2 ];
			sy[ j ] = f[ 3 ];
		}
		return new ShiftField( x, y, sx, sy, region, radius, spacing );
	}

	/** Number of alignment points the field is interpolated from. */
	public int size()
	{
		return numPoints;
	}

	public int getNumAnchors()
	{
		return numAnchors;
	}

	/** Writes the shift at (px, py) into {@code out}. Not thread safe. */
	public void evaluate( final double px, final double py, final double[] out )
	{
		if ( null == mls )
		{
			out[ 0 ] = 0;
			out[ 1 ] = 0;
			return;
		}
		final double[] l = new double[]{ px, py };
		mls.applyInPlace( l );
		out[ 0 ] = l[ 0 ] - px;
		out[ 1 ] = l[ 1 ] - py;
	}
}
