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

/** The frames ranked by sharpness within the patch of one alignment point, and those selected for stacking there. */
public class LocalRanking
{
	final private AlignmentPoint ap;
	final private double[] scores;
	final private int[] order;
	final private int[] selected;

	/**
	 * @param scores per frame index; NaN for frames that are not candidates
	 * @param order candidate frames, best first
	 * @param count number of frames to select from the top of {@code order}
	 */
	public LocalRanking( final AlignmentPoint ap, final double[] scores, final int[] order, final int count )
	{
		this.ap = ap;
		this.scores = scores.clone();
		this.order = order.clone();
		this.selected = Arrays.copyOf( order, Math.min( count, order.length ) );
	}

	public AlignmentPoint getAlignmentPoint()
	{
		return ap;
	}

	public double getScore( final int frame )
	{
		return scores[ frame ];
	}

	/** Candidate frames, best first. */
	public int[] getOrder()
	{
		return order.clone();
	}

	/** Selected frames, best first. */
	public int[] getSelected()
	{
		return selected.clone();
	}

	/** Selected frames by increasing index. */
	public int[] getSelectedAscending()
	{
		final int[] a = selected.clone();
		Arrays.sort( a );
		return a;
	}

	public boolean isSelected( final int frame )
	{
		for ( final int f : selected ) if ( f == frame ) return true;
		return false;
	}
}
