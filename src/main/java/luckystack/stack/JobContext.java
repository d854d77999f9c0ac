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

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import luckystack.parallel.Process;
import luckystack.parallel.TaskFactory;
import luckystack.utils.Utils;

/** Threads, cancellation, progress reporting and diagnostics shared by the phases of one job. */
public class JobContext
{
	final private int numThreads;
	final private AtomicBoolean cancelled = new AtomicBoolean( false );
	final private Diagnostics diagnostics = new Diagnostics();
	private volatile ProgressListener listener = null;

	public JobContext( final int numThreads )
	{
		this.numThreads = Process.sensible( numThreads );
	}

	public int getNumThreads()
	{
		return numThreads;
	}

	public Diagnostics getDiagnostics()
	{
		return diagnostics;
	}

	public void setProgressListener( final ProgressListener listener )
	{
		this.listener = listener;
	}

	public void cancel()
	{
		cancelled.set( true );
	}

	public boolean isCancelled()
	{
		return cancelled.get();
	}

	/** @throws InterruptedException if the job was cancelled or the calling thread interrupted. */
	public void checkCancelled() throws InterruptedException
	{
		if ( cancelled.get() || Thread.currentThread().isInterrupted() ) throw new InterruptedException( "Stacking cancelled" );
	}

	public void progress( final Phase phase, final int done, final int total )
	{
		final ProgressListener l = listener;
		if ( null != l ) l.progress( phase, done, total );
		Utils.showProgress( 0 == total ? 1 : done / ( double )total );
	}

	/**
	 * Runs {@code factory} on every input in parallel and returns the outputs in input order.
	 * Progress is reported per completed input.
	 */
	public <I, O> List<O> map( final Phase phase, final List<I> inputs, final TaskFactory<I, O> factory ) throws InterruptedException, ExecutionException
	{
		return map( phase, inputs, factory, 0, inputs.size() );
	}

	/**
	 * As {@link #map(Phase, List, TaskFactory)} for one part of a phase that is run in several calls:
	 * progress counts from {@code offset} up to {@code total}.
	 */
	public <I, O> List<O> map( final Phase phase, final List<I> inputs, final TaskFactory<I, O> factory, final int offset, final int total ) throws InterruptedException, ExecutionException
	{
		checkCancelled();
		final AtomicInteger done = new AtomicInteger( offset );
		final BooleanSupplier flag = new BooleanSupplier()
		{
			@Override
			public boolean getAsBoolean()
			{
				return cancelled.get();
			}
		};
		progress( phase, offset, total );
		return Process.map( inputs, new TaskFactory<I, O>()
		{
			@Override
			public Callable<O> create( final I input )
			{
				return new Callable<O>()
				{
					@Override
					public O call() throws Exception
					{
						if ( cancelled.get() ) return null;
						final O o = factory.process( input );
						progress( phase, done.incrementAndGet(), total );
						return o;
					}
				};
			}

			@Override
			public O process( final I input ) throws Exception
			{
				return factory.process( input );
			}
		}, numThreads, flag );
	}
}
