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
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import luckystack.imaging.QualityMeasures;
import luckystack.stack.JobFailedException;
import luckystack.stack.JobFailedException.FatalReason;
import luckystack.stack.Phase;
import luckystack.utils.Utils;

/**
 * Chooses the window of the best frame with the most structure, scanning windows of a fixed size
 * at half-window steps. Windows keep clear of the frame border by the border width plus the search width,
 * so that every shift searched during alignment stays inside the frame.
 */
public class ReferencePatchSelector
{
	/** Structure below this fraction of the full scale is taken as none, i.e. rounding residue of the blur. */
	static public final double NO_STRUCTURE = 1e-6;

	private ReferencePatchSelector() {}

	/**
	 * @param best the blurred luminance of the best frame
	 * @param fullScale value of a saturated pixel, to scale the thresholds given on the 8-bit scale
	 */
	static public ReferencePatch select( final FloatProcessor best, final StackingParam param, final double fullScale ) throws JobFailedException
	{
		final int w = best.getWidth(), h = best.getHeight();
		final float[] pixels = ( float[] )best.getPixels();
		final double scale = fullScale / 255.0;
		final int border = param.alignBorderWidth + param.alignSearchWidth;
		final Rectangle inner = new Rectangle( border, border, w - 2 * border, h - 2 * border );

		if ( inner.width < 1 || inner.height < 1
				|| QualityMeasures.structure( pixels, w, h, new Rectangle( 0, 0, w, h ), 1 ) <= NO_STRUCTURE * fullScale )
			throw new JobFailedException( Phase.SELECT_REFERENCE_PATCH, FatalReason.NO_STRUCTURE, "the best frame shows no structure" );

		if ( null != param.referencePatch )
		{
			final Rectangle r = param.referencePatch;
			final double s = QualityMeasures.structureThresholdWeighted( pixels, w, h, r, param.alignRectangleStride, param.alignRectangleBlackThreshold * scale, param.alignRectangleMinFraction );
			return new ReferencePatch( r, s, false, true );
		}

		final List< ReferencePatch > candidates = candidates( best, param, fullScale );
		if ( !candidates.isEmpty() && candidates.get( 0 ).getStructure() > param.referenceMinStructure * scale )
		{
			final ReferencePatch p = candidates.get( 0 );
			Utils.log2( "Selected " + p );
			return p;
		}

		final double s = QualityMeasures.structure( pixels, w, h, inner, param.alignRectangleStride );
		final ReferencePatch p = new ReferencePatch( inner, s, true, false );
		Utils.log( "No window of the best frame has enough structure; aligning on " + p );
		return p;
	}

	/** All candidate windows, most structured first; equal structure keeps scan order. */
	static public List< ReferencePatch > candidates( final FloatProcessor best, final StackingParam param, final double fullScale )
	{
		final int w = best.getWidth(), h = best.getHeight();
		final float[] pixels = ( float[] )best.getPixels();
		final double threshold = param.alignRectangleBlackThreshold * fullScale / 255.0;
		final int border = param.alignBorderWidth + param.alignSearchWidth;
		final List< ReferencePatch > list = new ArrayList< ReferencePatch >();
		final Rectangle size = param.referenceWindowSize( w, h );
		if ( null == size ) return list;

		final int stepX = Math.max( 1, size.width / 2 ), stepY = Math.max( 1, size.height / 2 );
		for ( int y = border; y + size.height <= h - border; y += stepY )
		{
			for ( int x = border; x + size.width <= w - border; x += stepX )
			{
				final Rectangle r = new Rectangle( x, y, size.width, size.height );
				final double s = QualityMeasures.structureThresholdWeighted( pixels, w, h, r, param.alignRectangleStride, threshold, param.alignRectangleMinFraction );
				list.add( new ReferencePatch( r, s, false, false ) );
			}
		}
		Collections.sort( list, new Comparator< ReferencePatch >()
		{
			@Override
			public int compare( final ReferencePatch a, final ReferencePatch b )
			{
				return Double.compare( b.getStructure(), a.getStructure() );
			}
		} );
		return list;
	}
}
