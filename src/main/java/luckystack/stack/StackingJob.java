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

import ij.process.ImageProcessor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import luckystack.align.FrameRanking;
import luckystack.align.GlobalAligner;
import luckystack.align.GlobalAlignment;
import luckystack.align.MeanFrame;
import luckystack.align.MeanFrameBuilder;
import luckystack.align.ParameterException;
import luckystack.align.QualityRanker;
import luckystack.align.ReferencePatch;
import luckystack.align.ReferencePatchSelector;
import luckystack.align.StackingParam;
import luckystack.frames.FrameSource;
import luckystack.frames.FrameStore;
import luckystack.imaging.Channels;
import luckystack.mesh.AlignmentPoint;
import luckystack.mesh.AlignmentPointMesh;
import luckystack.mesh.MeshGenerator;
import luckystack.stack.JobFailedException.FatalReason;
import luckystack.utils.IJError;
import luckystack.utils.Utils;

/**
 * One run of the stacking pipeline over the frames of a {@link FrameStore}.
 * <p>
 * {@link #prepare()} ranks and aligns the frames, builds the mean frame and generates the alignment point mesh,
 * which can then be edited or replaced with {@link #setMesh(AlignmentPointMesh)}. {@link #stack()} freezes the mesh,
 * ranks and matches the frames at every alignment point, stacks the patches and blends them.
 * {@link #run()} does both. A job is meant to run once.
 * <p>
 * {@link #cancel()} may be called from any thread; the running phase then stops at the next frame or alignment point
 * and throws an {@link InterruptedException}.
 */
public class StackingJob
{
	final private FrameStore store;
	final private StackingParam param;
	final private JobContext context;

	private FrameRanking ranking = null;
	private ReferencePatch reference = null;
	private GlobalAlignment alignment = null;
	private MeanFrame mean = null;
	private AlignmentPointMesh mesh = null;

	/**
	 * @throws ParameterException if the store blurs with another noise level than {@code param} asks for
	 */
	public StackingJob( final FrameStore store, final StackingParam param )
	{
		if ( store.getNoiseLevel() != param.noiseLevel )
			throw new ParameterException( "the frame store blurs with noise level " + store.getNoiseLevel() + " but the parameters ask for " + param.noiseLevel );
		this.store = store;
		this.param = param.clone();
		this.context = new JobContext( param.maxNumThreads );
	}

	/** Stacks the frames of {@code source} not flagged in {@code excluded}, which may be null. */
	public StackingJob( final FrameSource source, final boolean[] excluded, final StackingParam param )
	{
		this( new FrameStore( source, excluded, param.bufferingLevel, param.noiseLevel ), param );
	}

	public void setProgressListener( final ProgressListener listener )
	{
		context.setProgressListener( listener );
	}

	public void cancel()
	{
		context.cancel();
	}

	public boolean isCancelled()
	{
		return context.isCancelled();
	}

	public FrameStore getFrameStore() { return store; }

	public StackingParam getParam() { return param.clone(); }

	public Diagnostics getDiagnostics() { return context.getDiagnostics(); }

	public FrameRanking getRanking() { return ranking; }

	public ReferencePatch getReferencePatch() { return reference; }

	public GlobalAlignment getAlignment() { return alignment; }

	public MeanFrame getMeanFrame() { return mean; }

	/** The mesh to stack with; null before {@link #prepare()} unless one was set. */
	public AlignmentPointMesh getMesh() { return mesh; }

	/**
	 * Replaces the generated mesh. The mesh must have the size of the mean frame when stacking starts.
	 */
	public void setMesh( final AlignmentPointMesh mesh )
	{
		if ( null == mesh ) throw new IllegalArgumentException( "null mesh" );
		this.mesh = mesh;
	}

	/** Checks frames and parameters before any work is done. */
	private void validate() throws JobFailedException
	{
		if ( 0 == store.size() ) throw new JobFailedException( Phase.RANK_FRAMES, FatalReason.NO_FRAMES, "there are no frames to stack" );
		param.validate( store.size(), store.getWidth(), store.getHeight() );
	}

	/**
	 * Runs the phases up to and including the creation of the alignment point mesh, unless a mesh was set.
	 * 
	 * @return the mesh to stack with
	 */
	public AlignmentPointMesh prepare() throws JobFailedException, InterruptedException, ExecutionException
	{
		validate();
		try
		{
			final double fullScale = store.getFullScale();

			ranking = QualityRanker.rank( store, param, context );
			context.checkCancelled();

			context.progress( Phase.SELECT_REFERENCE_PATCH, 0, 1 );
			reference = ReferencePatchSelector.select( store.blurred( ranking.best() ), param, fullScale );
			context.getDiagnostics().setReferenceDegraded( reference.isDegraded() );
			context.progress( Phase.SELECT_REFERENCE_PATCH, 1, 1 );
			context.checkCancelled();

			alignment = GlobalAligner.align( store, ranking, reference, param, context );
			mean = MeanFrameBuilder.build( store, ranking, alignment, param, context );

			if ( null == mesh )
			{
				context.progress( Phase.CREATE_MESH, 0, 1 );
				mesh = MeshGenerator.create( mean, param, fullScale );
				context.progress( Phase.CREATE_MESH, 1, 1 );
			}
			return mesh;
		}
		catch ( final ExecutionException e )
		{
			IJError.print( e );
			throw e;
		}
	}

	/**
	 * Stacks with the current mesh, preparing first if needed.
	 */
	public StackingResult stack() throws JobFailedException, InterruptedException, ExecutionException
	{
		if ( null == mean ) prepare();
		if ( mesh.getWidth() != mean.getWidth() || mesh.getHeight() != mean.getHeight() )
			throw new ParameterException( "the alignment point mesh of " + mesh.getWidth() + "x" + mesh.getHeight() + " does not match the mean frame of " + mean.getWidth() + "x" + mean.getHeight() );
		mesh.freeze();
		if ( 0 == mesh.size() )
			throw new JobFailedException( Phase.CREATE_MESH, FatalReason.NO_ALIGNMENT_POINTS, "the mesh has no alignment points" );
		try
		{
			final Map< AlignmentPoint, LocalRanking > rankings = LocalRanker.rank( store, alignment, mean, mesh, param, context );
			final Map< AlignmentPoint, LocalShifts > shifts = LocalShiftEstimator.estimate( store, alignment, mean, mesh, rankings, param, context );
			if ( shifts.isEmpty() )
				throw new JobFailedException( Phase.LOCAL_SHIFTS, FatalReason.NO_ALIGNMENT_POINTS, "no alignment point could be matched in enough frames" );

			final double fullScale = store.getFullScale();
			final double[] factors = PatchStacker.brightnessFactors( ranking, alignment, param, fullScale );
			final double radius = PatchStacker.fieldRadius( param, mesh.getStep() );
			final List< StackedPatch > patches = PatchStacker.stack( store, alignment, mean, rankings, shifts, factors, radius, mesh.getStep(), param, context );

			context.checkCancelled();
			final Blender blender = new Blender( mean.getWidth(), mean.getHeight(), store.getNChannels(), param.backgroundBlendThreshold );
			for ( final StackedPatch p : patches ) blender.add( p );
			float[][] background = null;
			if ( blender.needsBackground() )
			{
				Utils.log( "Filling gaps between patches with the average of the best frames" );
				background = MeanFrameBuilder.background( store, ranking, alignment, mean.getRegion(), param.selectionCount( store.size() ), factors, context );
			}
			final float[][] blended = blender.blend( background );
			context.progress( Phase.BLEND, 1, 1 );

			final ImageProcessor image = Channels.toProcessor( blended, mean.getWidth(), mean.getHeight(), store.getBitDepth() );
			context.getDiagnostics().log();
			return new StackingResult( image, mesh, context.getDiagnostics(), ranking, reference, alignment, mean );
		}
		catch ( final ExecutionException e )
		{
			IJError.print( e );
			throw e;
		}
	}

	/** Runs all phases. */
	public StackingResult run() throws JobFailedException, InterruptedException, ExecutionException
	{
		prepare();
		return stack();
	}
}
