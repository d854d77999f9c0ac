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

import java.util.Arrays;

import luckystack.mesh.AlignmentPoint;

/**
 * The local shifts found at one alignment point, for the selected frames that matched.
 * A local shift is relative to the exact global offset of its frame.
 */
public class LocalShifts
{
	final private AlignmentPoint ap;
	final private int[] frames;
	final private double[][] shifts;

	/**
	 * @param frames in increasing order
	 * @param shifts {dx, dy} per frame
	 */
	public LocalShifts( final AlignmentPoint ap, final int[] frames, final double[][] shifts )
	{
		this.ap = ap;
		this.frames = frames.clone();
		this.shifts = new double[ shifts.length ][];
		for ( int i = 0; i < shifts.length; ++i ) this.shifts[ i ] = shifts[ i ].clone();
	}

	public AlignmentPoint getAlignmentPoint()
	{
		return ap;
	}

	public int size()
	{
		return frames.length;
	}

	/** The frames with a shift, in increasing order. */
	public int[] getFrames()
	{
		return frames.clone();
	}

	public int getFrame( final int i )
	{
		return frames[ i ];
	}

	/** Position of {@code frame} in {@link #getFrames()}, or a negative number if it has no shift here. */
	public int indexOf( final int frame )
	{
		return Arrays.binarySearch( frames, frame );
	}

	public double[] getShift( final int i )
	{
		return shifts[ i ].clone();
	}

	double shiftX( final int i )
	{
		return shifts[ i ][ 0 ];
	}

	double shiftY( final int i )
	{
		return shifts[ i ][ 1 ];
	}
}
