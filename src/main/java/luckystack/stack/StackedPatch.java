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

/** The average of the de-warped selected frames over the patch of one alignment point, per channel. */
public class StackedPatch
{
	final private AlignmentPoint ap;
	final private Rectangle patch;
	final private float[][] channels;
	final private int numFrames;

	public StackedPatch( final AlignmentPoint ap, final float[][] channels, final int numFrames )
	{
		this.ap = ap;
		this.patch = ap.getPatch();
		this.channels = channels;
		this.numFrames = numFrames;
	}

	public AlignmentPoint getAlignmentPoint()
	{
		return ap;
	}

	/** Where the patch lies, in mean frame coordinates. */
	public Rectangle getPatch()
	{
		return new Rectangle( patch );
	}

	/** Pixels of channel {@code c}, row by row over the patch; read only. */
	public float[] getChannel( final int c )
	{
		return channels[ c ];
	}

	public int getNChannels()
	{
		return channels.length;
	}

	public int getNumberOfFrames()
	{
		return numFrames;
	}
}
