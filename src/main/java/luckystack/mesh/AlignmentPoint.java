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
package luckystack.mesh;

import java.awt.Rectangle;

/**
 * A location in the mean frame at which frames are locally ranked, matched and stacked.
 * The box, 2*halfBoxWidth pixels wide, is matched; the larger patch around it is stacked.
 * Patches of points on the mesh border reach to the image border on that side.
 * Immutable; coordinates are mean frame pixels.
 */
public final class AlignmentPoint {

	final private int x, y;
	final private int halfBoxWidth;
	final private int halfPatchWidth;
	final private Rectangle patch;
	final private boolean extendLowX, extendHighX, extendLowY, extendHighY;

	public AlignmentPoint(final int x, final int y, final int halfBoxWidth, final int halfPatchWidth, final int imageWidth, final int imageHeight,
			final boolean extendLowX, final boolean extendHighX, final boolean extendLowY, final boolean extendHighY) {
		this.x = x;
		this.y = y;
		this.halfBoxWidth = halfBoxWidth;
		this.halfPatchWidth = halfPatchWidth;
		this.extendLowX = extendLowX;
		this.extendHighX = extendHighX;
		this.extendLowY = extendLowY;
		this.extendHighY = extendHighY;
		final int x0 = extendLowX ? 0 : Math.max(0, x - halfPatchWidth);
		final int x1 = extendHighX ? imageWidth : Math.min(imageWidth, x + halfPatchWidth);
		final int y0 = extendLowY ? 0 : Math.max(0, y - halfPatchWidth);
		final int y1 = extendHighY ? imageHeight : Math.min(imageHeight, y + halfPatchWidth);
		this.patch = new Rectangle(x0, y0, x1 - x0, y1 - y0);
	}

	public int getX() { return x; }

	public int getY() { return y; }

	public int getHalfBoxWidth() { return halfBoxWidth; }

	public int getHalfPatchWidth() { return halfPatchWidth; }

	/** The matched box. */
	public Rectangle getBox() {
		return new Rectangle(x - halfBoxWidth, y - halfBoxWidth, 2 * halfBoxWidth, 2 * halfBoxWidth);
	}

	/** The stacked patch, clipped to the image and extended on border sides. */
	public Rectangle getPatch() {
		return new Rectangle(patch);
	}

	public boolean isExtendedLowX() { return extendLowX; }
	public boolean isExtendedHighX() { return extendHighX; }
	public boolean isExtendedLowY() { return extendLowY; }
	public boolean isExtendedHighY() { return extendHighY; }

	public double distance(final AlignmentPoint ap) {
		return distance(ap.x, ap.y);
	}

	public double distance(final double px, final double py) {
		final double dx = px - x, dy = py - y;
		return Math.sqrt(dx * dx + dy * dy);
	}

	@Override
	public String toString() {
		return "AP[" + x + ", " + y + ", box " + 2 * halfBoxWidth + "]";
	}
}
