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

import ij.ImageStack;
import ij.VirtualStack;
import ij.process.ImageProcessor;

/** Reads frames from an {@link ImageStack}; a {@link VirtualStack} is decoded from disk on every call. */
public class ImageStackFrameSource implements FrameSource {

	final private ImageStack stack;

	public ImageStackFrameSource(final ImageStack stack) {
		if (null == stack) throw new IllegalArgumentException("null stack");
		this.stack = stack;
	}

	@Override
	public int getNumberOfFrames() {
		return stack.getSize();
	}

	@Override
	public int getWidth() {
		return stack.getWidth();
	}

	@Override
	public int getHeight() {
		return stack.getHeight();
	}

	@Override
	public ImageProcessor decode(final int index) {
		if (stack instanceof VirtualStack) {
			// VirtualStack opens files through shared state
			synchronized (stack) {
				return stack.getProcessor(index + 1);
			}
		}
		return stack.getProcessor(index + 1);
	}
}
