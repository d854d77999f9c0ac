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

/** The window of the best frame that all frames are globally aligned on. */
public class ReferencePatch
{
	final private Rectangle bounds;
	final private double structure;
	final private boolean degraded;
	final private boolean manual;

	public ReferencePatch( final Rectangle bounds, final double structure, final boolean degraded, final boolean manual )
	{
		this.bounds = new Rectangle( bounds );
		this.structure = structure;
		this.degraded = degraded;
		this.manual = manual;
	}

	public Rectangle getBounds()
	{
		return new Rectangle( bounds );
	}

	public double getStructure()
	{
		return structure;
	}

	/** Whether no window had enough structure and the full frame, minus the search border, is used instead. */
	public boolean isDegraded()
	{
		return degraded;
	}

	/** Whether the patch was given by the user. */
	public boolean isManual()
	{
		return manual;
	}

	@Override
	public String toString()
	{
		return "ReferencePatch[" + bounds.x + ", " + bounds.y + ", " + bounds.width + "x" + bounds.height + ", structure=" + structure + ( degraded ? ", degraded" : "" ) + ( manual ? ", manual" : "" ) + "]";
	}
}
