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

import luckystack.imaging.Filters;

/**
 * The average luminance of the best globally aligned frames over the common area of all valid frames
 * (or the part of it selected as region of interest), and its blurred version.
 * Pixel (u, v) of the mean frame shows reference position (region.x + u, region.y + v).
 */
public class MeanFrame
{
	final private FloatProcessor mean;
	final private FloatProcessor blurred;
	final private Rectangle region;
	final private int[] frames;

	public MeanFrame( final FloatProcessor mean, final Rectangle region, final int noiseLevel, final int[] frames )
	{
		if ( mean.getWidth() != region.width || mean.getHeight() != region.height )
			throw new IllegalArgumentException( "mean frame of " + mean.getWidth() + "x" + mean.getHeight() + " does not match region " + region );
		this.mean = mean;
		this.blurred = Filters.blur( mean, noiseLevel );
		this.region = new Rectangle( region );
		this.frames = frames.clone();
	}

	public FloatProcessor getMean()
	{
		return mean;
	}

	public FloatProcessor getBlurred()
	{
		return blurred;
	}

	/** The area covered, in reference coordinates. */
	public Rectangle getRegion()
	{
		return new Rectangle( region );
	}

	public int getX()
	{
		return region.x;
	}

	public int getY()
	{
		return region.y;
	}

	public int getWidth()
	{
		return region.width;
	}

	public int getHeight()
	{
		return region.height;
	}

	/** The frames averaged, best first. */
	public int[] getFrames()
	{
		return frames.clone();
	}
}
