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
package luckystack.frames;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/** One decoded frame as seen through a {@link FrameStore}: its pixels, its index in the store
 *  and its index in the underlying {@link FrameSource}. */
public final class Frame {

	final private int index;
	final private int sourceIndex;
	final private ImageProcessor ip;

	public Frame(final int index, final int sourceIndex, final ImageProcessor ip) {
		this.index = index;
		this.sourceIndex = sourceIndex;
		this.ip = ip;
	}

	public int getIndex() { return index; }

	public int getSourceIndex() { return sourceIndex; }

	public int getWidth() { return ip.getWidth(); }

	public int getHeight() { return ip.getHeight(); }

	/** 3 for RGB frames, 1 otherwise. */
	public int getNChannels() { return ip.getNChannels(); }

	public int getBitDepth() { return ip.getBitDepth(); }

	/** The original pixels; read only. */
	public ImageProcessor getProcessor() { return ip; }

	/** The pixels of channel @param c as floats; read only, may share the frame's array. */
	public float[] channel(final int c) {
		final FloatProcessor fp = ip.toFloat(c, null);
		return (float[]) fp.getPixels();
	}
}
