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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import luckystack.align.Rejection;
import luckystack.mesh.AlignmentPoint;
import luckystack.utils.Utils;

/**
 * What a job left out and why: frames that failed global alignment, (alignment point, frame) pairs
 * that failed local alignment, a degraded reference patch, and the distribution of local shifts.
 * Discarded alignment points are recorded in the {@link luckystack.mesh.AlignmentPointMesh}.
 * Recording methods may be called from worker threads.
 */
public class Diagnostics
{
	static public final class FrameExclusion
	{
		final public int frame, sourceIndex;
		final public Rejection reason;

		FrameExclusion( final int frame, final int sourceIndex, final Rejection reason )
		{
			this.frame = frame;
			this.sourceIndex = sourceIndex;
			this.reason = reason;
		}

		@Override
		public String toString()
		{
			return "frame " + frame + " (source " + sourceIndex + "): " + reason;
		}
	}

	static public final class PairDrop
	{
		final public AlignmentPoint ap;
		final public int frame;
		final public Rejection reason;

		PairDrop( final AlignmentPoint ap, final int frame, final Rejection reason )
		{
			this.ap = ap;
			this.frame = frame;
			this.reason = reason;
		}

		@Override
		public String toString()
		{
			return ap + " frame " + frame + ": " + reason;
		}
	}

	final private List<FrameExclusion> excludedFrames = new ArrayList<FrameExclusion>();
	final private List<PairDrop> droppedPairs = new ArrayList<PairDrop>();
	private boolean referenceDegraded = false;
	private int[] shiftHistogram = new int[ 0 ];
	private int shiftsAttempted = 0;

	public synchronized void excludeFrame( final int frame, final int sourceIndex, final Rejection reason )
	{
		excludedFrames.add( new FrameExclusion( frame, sourceIndex, reason ) );
	}

	public synchronized void dropPair( final AlignmentPoint ap, final int frame, final Rejection reason )
	{
		droppedPairs.add( new PairDrop( ap, frame, reason ) );
	}

	public synchronized void setReferenceDegraded( final boolean degraded )
	{
		this.referenceDegraded = degraded;
	}

	/**
	 * @param histogram counts of local shifts by magnitude rounded to whole pixels
	 * @param attempted number of (alignment point, frame) pairs for which a shift was searched
	 */
	public synchronized void setShiftStatistics( final int[] histogram, final int attempted )
	{
		this.shiftHistogram = histogram.clone();
		this.shiftsAttempted = attempted;
	}

	public synchronized List<FrameExclusion> getExcludedFrames()
	{
		return Collections.unmodifiableList( new ArrayList<FrameExclusion>( excludedFrames ) );
	}

	public synchronized List<PairDrop> getDroppedPairs()
	{
		return Collections.unmodifiableList( new ArrayList<PairDrop>( droppedPairs ) );
	}

	public synchronized boolean isReferenceDegraded()
	{
		return referenceDegraded;
	}

	public synchronized int[] getShiftHistogram()
	{
		return shiftHistogram.clone();
	}

	/** Percentage of local shift searches that failed. */
	public synchronized double getShiftFailurePercent()
	{
		return 0 == shiftsAttempted ? 0 : 100.0 * droppedPairs.size() / shiftsAttempted;
	}

	public synchronized void log()
	{
		Utils.log( "Excluded frames: " + excludedFrames.size() );
		for ( final FrameExclusion e : excludedFrames ) Utils.log2( "  " + e );
		if ( referenceDegraded ) Utils.log( "Reference patch: no structured window found, aligned on the full frame" );
		Utils.log( "Failed local shift searches: " + droppedPairs.size() + " of " + shiftsAttempted + String.format( " (%.1f%%)", getShiftFailurePercent() ) );
		Utils.log2( "Local shift histogram (pixels): " + Utils.toString( shiftHistogram ) );
	}
}
