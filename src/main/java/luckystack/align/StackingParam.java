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
import java.io.Serializable;
import java.util.Properties;

import luckystack.frames.BufferingPolicy;
import luckystack.imaging.QualityMeasures;

/**
 * All parameters of one stacking job. Thresholds on pixel values are given on the 8-bit scale
 * and are scaled to the full range of the frames when applied.
 */
public class StackingParam implements Serializable, Cloneable
{
	private static final long serialVersionUID = 7420367812211694509L;

	static public enum Mode
	{
		/** Extended object filling the frame, e.g. lunar or solar surface. */
		SURFACE,
		/** Small bright object on a dark background. */
		PLANET
	}

	static public enum Averaging
	{
		UNWEIGHTED,
		QUALITY_WEIGHTED
	}

	static public final int MIN_HALF_BOX_WIDTH = 4;
	static public final int MIN_REFERENCE_SIZE = 8;

	public Mode mode = Mode.SURFACE;

	/**
	 * Width of the Gaussian kernel applied before ranking and matching
	 */
	public int noiseLevel = 7;

	public QualityMeasures.Method rankingMethod = QualityMeasures.Method.LAPLACE;
	public int rankPixelStride = 2;

	/**
	 * Divides the sharpness by 1 + noisePenalty * (estimated noise sigma, 8-bit scale)
	 */
	public double noisePenalty = 0.1;

	/* Reference patch */
	public double alignRectangleScaleFactor = 3.0;
	public int alignBorderWidth = 4;
	public int alignRectangleStride = 2;
	public double alignRectangleBlackThreshold = 40;
	public double alignRectangleMinFraction = 0.7;
	public double referenceMinStructure = 0.5;

	/**
	 * Rectangle on the best frame to align on instead of an automatic choice, or null
	 */
	public Rectangle referencePatch = null;

	/* Global alignment */
	public int alignSearchWidth = 34;
	public double alignMinCorrelation = 0.5;

	/* Mean frame: one of the two, a positive frame number wins */
	public double averageFramePercent = 5;
	public int averageFrameNumber = -1;

	/**
	 * Part of the common area of all frames to stack, in mean frame coordinates, or null for all of it
	 */
	public Rectangle roi = null;

	/* Alignment points */
	public int apHalfBoxWidth = 24;
	public int apSearchWidth = 14;
	public double apStructureThreshold = 0.04;
	public double apBrightnessThreshold = 10;
	public double apContrastThreshold = 0;
	public double apDimFractionThreshold = 0.6;
	public double apMinCorrelation = 0.4;

	/**
	 * Matches whose second best correlation peak exceeds this ratio of the best one are
	 * discarded as ambiguous; 1 keeps them all
	 */
	public double maxRatioOfDistances = 1.0;

	/**
	 * Maximal ratio of the principal curvatures of an accepted correlation peak
	 */
	public double maxCurvatureRatio = 10.0;

	/* Frames stacked per alignment point: one of the two, a positive frame number wins */
	public double stackFramePercent = 10;
	public int stackFrameNumber = -1;

	/**
	 * Minimum number of frames an alignment point needs to be stacked
	 */
	public int apMinFrames = 1;

	/**
	 * Radius of influence of a local shift, in units of the alignment point step
	 */
	public double fieldRadiusFactor = 2.0;

	public Averaging averaging = Averaging.UNWEIGHTED;

	public boolean normalizeBrightness = true;

	/**
	 * Frames dimmer than this on average are not brightness-normalized
	 */
	public double normalizationThreshold = 15;

	public double backgroundBlendThreshold = 0.2;

	public int bufferingLevel = 2;

	public int maxNumThreads = Runtime.getRuntime().availableProcessors();

	public StackingParam() {}

	/** Half width of the patch stacked around an alignment point. */
	public int halfPatchWidth()
	{
		return halfPatchWidth( apHalfBoxWidth );
	}

	static public int halfPatchWidth( final int halfBoxWidth )
	{
		return ( int )Math.round( halfBoxWidth * 1.5 );
	}

	/** Distance between neighbouring alignment points of the generated mesh. */
	public int stepSize()
	{
		return stepSize( apHalfBoxWidth );
	}

	static public int stepSize( final int halfBoxWidth )
	{
		return ( int )Math.round( halfPatchWidth( halfBoxWidth ) * 4.5 / 3.0 );
	}

	/** Number of frames averaged into the mean frame, for {@code numFrames} frames in the job. */
	public int averageFrameCount( final int numFrames )
	{
		return count( averageFrameNumber, averageFramePercent, numFrames );
	}

	/** Number of frames stacked at each alignment point, for {@code numFrames} frames in the job. */
	public int selectionCount( final int numFrames )
	{
		return count( stackFrameNumber, stackFramePercent, numFrames );
	}

	static private int count( final int number, final double percent, final int numFrames )
	{
		if ( number > 0 ) return number;
		return Math.max( 1, ( int )Math.ceil( numFrames * percent / 100.0 - 1e-9 ) );
	}

	/** The reference patch size chosen automatically, or null if the frame is too small for it. */
	public Rectangle referenceWindowSize( final int width, final int height )
	{
		final int border = alignBorderWidth + alignSearchWidth;
		final int w = ( int )( ( width - 2 * border ) / alignRectangleScaleFactor );
		final int h = ( int )( ( height - 2 * border ) / alignRectangleScaleFactor );
		if ( w < MIN_REFERENCE_SIZE || h < MIN_REFERENCE_SIZE ) return null;
		return new Rectangle( 0, 0, w, h );
	}

	/**
	 * Checks the parameters against each other and against the frames to stack.
	 * 
	 * @throws ParameterException describing the first problem found
	 */
	public void validate( final int numFrames, final int width, final int height ) throws ParameterException
	{
		if ( null == mode ) fail( "mode is not set" );
		if ( null == rankingMethod ) fail( "ranking method is not set" );
		if ( null == averaging ) fail( "averaging is not set" );
		if ( noiseLevel < 1 ) fail( "noise level must be at least 1: " + noiseLevel );
		if ( rankPixelStride < 1 ) fail( "rank pixel stride must be at least 1: " + rankPixelStride );
		if ( noisePenalty < 0 ) fail( "noise penalty must not be negative: " + noisePenalty );
		if ( alignRectangleScaleFactor < 1 ) fail( "align rectangle scale factor must be at least 1: " + alignRectangleScaleFactor );
		if ( alignBorderWidth < 0 ) fail( "align border width must not be negative: " + alignBorderWidth );
		if ( alignRectangleStride < 1 ) fail( "align rectangle stride must be at least 1: " + alignRectangleStride );
		if ( alignRectangleMinFraction < 0 || alignRectangleMinFraction > 1 ) fail( "align rectangle min fraction must be within [0, 1]: " + alignRectangleMinFraction );
		if ( alignSearchWidth < 1 ) fail( "align search width must be at least 1: " + alignSearchWidth );
		if ( alignMinCorrelation < -1 || alignMinCorrelation > 1 ) fail( "align min correlation must be within [-1, 1]: " + alignMinCorrelation );
		if ( apMinCorrelation < -1 || apMinCorrelation > 1 ) fail( "alignment point min correlation must be within [-1, 1]: " + apMinCorrelation );
		if ( apHalfBoxWidth < MIN_HALF_BOX_WIDTH ) fail( "alignment point half box width must be at least " + MIN_HALF_BOX_WIDTH + ": " + apHalfBoxWidth );
		if ( apSearchWidth < 1 ) fail( "alignment point search width must be at least 1: " + apSearchWidth );
		if ( apStructureThreshold < 0 || apStructureThreshold > 1 ) fail( "structure threshold must be within [0, 1]: " + apStructureThreshold );
		if ( apDimFractionThreshold < 0 || apDimFractionThreshold > 1 ) fail( "dim fraction threshold must be within [0, 1]: " + apDimFractionThreshold );
		if ( maxRatioOfDistances <= 0 || maxRatioOfDistances > 1 ) fail( "max ratio of distances must be within (0, 1]: " + maxRatioOfDistances );
		if ( maxCurvatureRatio <= 0 ) fail( "max curvature ratio must be positive: " + maxCurvatureRatio );
		if ( fieldRadiusFactor <= 0 ) fail( "field radius factor must be positive: " + fieldRadiusFactor );
		if ( backgroundBlendThreshold <= 0 ) fail( "background blend threshold must be positive: " + backgroundBlendThreshold );
		if ( bufferingLevel < BufferingPolicy.MIN_LEVEL || bufferingLevel > BufferingPolicy.MAX_LEVEL )
			fail( "buffering level must be within [" + BufferingPolicy.MIN_LEVEL + ", " + BufferingPolicy.MAX_LEVEL + "]: " + bufferingLevel );
		if ( maxNumThreads < 1 ) fail( "max number of threads must be at least 1: " + maxNumThreads );

		checkCount( "average frame", averageFrameNumber, averageFramePercent, numFrames );
		checkCount( "stack frame", stackFrameNumber, stackFramePercent, numFrames );
		if ( apMinFrames < 1 ) fail( "minimum number of frames per alignment point must be at least 1: " + apMinFrames );
		if ( apMinFrames > selectionCount( numFrames ) )
			fail( "minimum number of frames per alignment point (" + apMinFrames + ") exceeds the number of frames stacked (" + selectionCount( numFrames ) + ")" );

		if ( null == referencePatch )
		{
			if ( null == referenceWindowSize( width, height ) )
				fail( "frames of " + width + "x" + height + " are too small for an align search width of " + alignSearchWidth );
		}
		else
		{
			final Rectangle r = referencePatch;
			if ( r.width < MIN_REFERENCE_SIZE || r.height < MIN_REFERENCE_SIZE )
				fail( "reference patch must be at least " + MIN_REFERENCE_SIZE + " pixels wide and high: " + r );
			if ( r.x < alignSearchWidth || r.y < alignSearchWidth || r.x + r.width > width - alignSearchWidth || r.y + r.height > height - alignSearchWidth )
				fail( "reference patch " + r + " leaves no room for an align search width of " + alignSearchWidth + " in a frame of " + width + "x" + height );
		}

		if ( null != roi )
		{
			if ( roi.width < 1 || roi.height < 1 || roi.x < 0 || roi.y < 0 || roi.x + roi.width > width || roi.y + roi.height > height )
				fail( "region of interest " + roi + " does not fit into a frame of " + width + "x" + height );
		}
	}

	static private void checkCount( final String name, final int number, final double percent, final int numFrames )
	{
		if ( number > numFrames ) fail( name + " number (" + number + ") exceeds the number of frames (" + numFrames + ")" );
		if ( 0 == number || number < -1 ) fail( name + " number must be positive, or -1 to use the percentage: " + number );
		if ( number < 0 && ( percent <= 0 || percent > 100 ) ) fail( name + " percentage must be within (0, 100]: " + percent );
	}

	static private void fail( final String message )
	{
		throw new ParameterException( "Invalid stacking parameters: " + message );
	}

	@Override
	public StackingParam clone()
	{
		try
		{
			final StackingParam p = ( StackingParam )super.clone();
			if ( null != referencePatch ) p.referencePatch = new Rectangle( referencePatch );
			if ( null != roi ) p.roi = new Rectangle( roi );
			return p;
		}
		catch ( final CloneNotSupportedException e )
		{
			throw new IllegalStateException( e );
		}
	}

	/** Writes all parameters under keys of the form {@code section.name}. */
	public Properties toProperties()
	{
		final Properties p = new Properties();
		p.setProperty( "general.mode", mode.name() );
		p.setProperty( "general.noise_level", Integer.toString( noiseLevel ) );
		p.setProperty( "general.buffering_level", Integer.toString( bufferingLevel ) );
		p.setProperty( "general.max_num_threads", Integer.toString( maxNumThreads ) );
		p.setProperty( "frames.ranking_method", rankingMethod.name() );
		p.setProperty( "frames.rank_pixel_stride", Integer.toString( rankPixelStride ) );
		p.setProperty( "frames.noise_penalty", Double.toString( noisePenalty ) );
		p.setProperty( "frames.normalize_brightness", Boolean.toString( normalizeBrightness ) );
		p.setProperty( "frames.normalization_threshold", Double.toString( normalizationThreshold ) );
		p.setProperty( "align.rectangle_scale_factor", Double.toString( alignRectangleScaleFactor ) );
		p.setProperty( "align.border_width", Integer.toString( alignBorderWidth ) );
		p.setProperty( "align.rectangle_stride", Integer.toString( alignRectangleStride ) );
		p.setProperty( "align.rectangle_black_threshold", Double.toString( alignRectangleBlackThreshold ) );
		p.setProperty( "align.rectangle_min_fraction", Double.toString( alignRectangleMinFraction ) );
		p.setProperty( "align.reference_min_structure", Double.toString( referenceMinStructure ) );
		p.setProperty( "align.search_width", Integer.toString( alignSearchWidth ) );
		p.setProperty( "align.min_correlation", Double.toString( alignMinCorrelation ) );
		if ( null != referencePatch ) p.setProperty( "align.reference_patch", toString( referencePatch ) );
		p.setProperty( "average.frame_percent", Double.toString( averageFramePercent ) );
		p.setProperty( "average.frame_number", Integer.toString( averageFrameNumber ) );
		if ( null != roi ) p.setProperty( "stack.roi", toString( roi ) );
		p.setProperty( "ap.half_box_width", Integer.toString( apHalfBoxWidth ) );
		p.setProperty( "ap.search_width", Integer.toString( apSearchWidth ) );
		p.setProperty( "ap.structure_threshold", Double.toString( apStructureThreshold ) );
		p.setProperty( "ap.brightness_threshold", Double.toString( apBrightnessThreshold ) );
		p.setProperty( "ap.contrast_threshold", Double.toString( apContrastThreshold ) );
		p.setProperty( "ap.dim_fraction_threshold", Double.toString( apDimFractionThreshold ) );
		p.setProperty( "ap.min_correlation", Double.toString( apMinCorrelation ) );
		p.setProperty( "ap.max_ratio_of_distances", Double.toString( maxRatioOfDistances ) );
		p.setProperty( "ap.max_curvature_ratio", Double.toString( maxCurvatureRatio ) );
		p.setProperty( "ap.min_frames", Integer.toString( apMinFrames ) );
		p.setProperty( "stack.frame_percent", Double.toString( stackFramePercent ) );
		p.setProperty( "stack.frame_number", Integer.toString( stackFrameNumber ) );
		p.setProperty( "stack.field_radius_factor", Double.toString( fieldRadiusFactor ) );
		p.setProperty( "stack.averaging", averaging.name() );
		p.setProperty( "stack.background_blend_threshold", Double.toString( backgroundBlendThreshold ) );
		return p;
	}

	/**
	 * Reads parameters written by {@link #toProperties()}. Missing keys keep their defaults.
	 * 
	 * @throws ParameterException if a value cannot be parsed
	 */
	static public StackingParam fromProperties( final Properties p ) throws ParameterException
	{
		final StackingParam s = new StackingParam();
		try
		{
			s.mode = Mode.valueOf( p.getProperty( "general.mode", s.mode.name() ) );
			s.noiseLevel = getInt( p, "general.noise_level", s.noiseLevel );
			s.bufferingLevel = getInt( p, "general.buffering_level", s.bufferingLevel );
			s.maxNumThreads = getInt( p, "general.max_num_threads", s.maxNumThreads );
			s.rankingMethod = QualityMeasures.Method.valueOf( p.getProperty( "frames.ranking_method", s.rankingMethod.name() ) );
			s.rankPixelStride = getInt( p, "frames.rank_pixel_stride", s.rankPixelStride );
			s.noisePenalty = getDouble( p, "frames.noise_penalty", s.noisePenalty );
			s.normalizeBrightness = Boolean.parseBoolean( p.getProperty( "frames.normalize_brightness", Boolean.toString( s.normalizeBrightness ) ) );
			s.normalizationThreshold = getDouble( p, "frames.normalization_threshold", s.normalizationThreshold );
			s.alignRectangleScaleFactor = getDouble( p, "align.rectangle_scale_factor", s.alignRectangleScaleFactor );
			s.alignBorderWidth = getInt( p, "align.border_width", s.alignBorderWidth );
			s.alignRectangleStride = getInt( p, "align.rectangle_stride", s.alignRectangleStride );
			s.alignRectangleBlackThreshold = getDouble( p, "align.rectangle_black_threshold", s.alignRectangleBlackThreshold );
			s.alignRectangleMinFraction = getDouble( p, "align.rectangle_min_fraction", s.alignRectangleMinFraction );
			s.referenceMinStructure = getDouble( p, "align.reference_min_structure", s.referenceMinStructure );
			s.alignSearchWidth = getInt( p, "align.search_width", s.alignSearchWidth );
			s.alignMinCorrelation = getDouble( p, "align.min_correlation", s.alignMinCorrelation );
			s.referencePatch = getRectangle( p, "align.reference_patch" );
			s.averageFramePercent = getDouble( p, "average.frame_percent", s.averageFramePercent );
			s.averageFrameNumber = getInt( p, "average.frame_number", s.averageFrameNumber );
			s.roi = getRectangle( p, "stack.roi" );
			s.apHalfBoxWidth = getInt( p, "ap.half_box_width", s.apHalfBoxWidth );
			s.apSearchWidth = getInt( p, "ap.search_width", s.apSearchWidth );
			s.apStructureThreshold = getDouble( p, "ap.structure_threshold", s.apStructureThreshold );
			s.apBrightnessThreshold = getDouble( p, "ap.brightness_threshold", s.apBrightnessThreshold );
			s.apContrastThreshold = getDouble( p, "ap.contrast_threshold", s.apContrastThreshold );
			s.apDimFractionThreshold = getDouble( p, "ap.dim_fraction_threshold", s.apDimFractionThreshold );
			s.apMinCorrelation = getDouble( p, "ap.min_correlation", s.apMinCorrelation );
			s.maxRatioOfDistances = getDouble( p, "ap.max_ratio_of_distances", s.maxRatioOfDistances );
			s.maxCurvatureRatio = getDouble( p, "ap.max_curvature_ratio", s.maxCurvatureRatio );
			s.apMinFrames = getInt( p, "ap.min_frames", s.apMinFrames );
			s.stackFramePercent = getDouble( p, "stack.frame_percent", s.stackFramePercent );
			s.stackFrameNumber = getInt( p, "stack.frame_number", s.stackFrameNumber );
			s.fieldRadiusFactor = getDouble( p, "stack.field_radius_factor", s.fieldRadiusFactor );
			s.averaging = Averaging.valueOf( p.getProperty( "stack.averaging", s.averaging.name() ) );
			s.backgroundBlendThreshold = getDouble( p, "stack.background_blend_threshold", s.backgroundBlendThreshold );
		}
		catch ( final IllegalArgumentException e )
		{
			throw new ParameterException( "Could not read stacking parameters: " + e.getMessage(), e );
		}
		return s;
	}

	static private int getInt( final Properties p, final String key, final int def )
	{
		final String v = p.getProperty( key );
		return null == v ? def : Integer.parseInt( v.trim() );
	}

	static private double getDouble( final Properties p, final String key, final double def )
	{
		final String v = p.getProperty( key );
		return null == v ? def : Double.parseDouble( v.trim() );
	}

	static private String toString( final Rectangle r )
	{
		return r.x + "," + r.y + "," + r.width + "," + r.height;
	}

	static private Rectangle getRectangle( final Properties p, final String key )
	{
		final String v = p.getProperty( key );
		if ( null == v || v.trim().isEmpty() ) return null;
		final String[] s = v.split( "," );
		if ( 4 != s.length ) throw new IllegalArgumentException( key + " must be x,y,width,height: " + v );
		return new Rectangle( Integer.parseInt( s[ 0 ].trim() ), Integer.parseInt( s[ 1 ].trim() ), Integer.parseInt( s[ 2 ].trim() ), Integer.parseInt( s[ 3 ].trim() ) );
	}
}
