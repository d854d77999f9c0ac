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
package luckystack.parallel;

import luckystack.utils.Utils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

/** For all methods, if the number of processors given as argument is zero or larger than the maximum available plus 2,
 *  the number of processors will be adjusted to fall within the range [1, max+2]. */
public class Process {

	static private final int MIN_AHEAD = 4;
	static public final int NUM_PROCESSORS = Runtime.getRuntime().availableProcessors();

	private Process() {}

	static public final int sensible(final int nproc) {
		return Math.max(1, Math.min(nproc, NUM_PROCESSORS + 2));
	}

	/** Applies the task created by @param generator to each input and returns the outputs
	 *  in the order of the inputs, regardless of the order in which the tasks finish.
	 *  No more than twice the number of threads tasks are queued at any time.
	 *  When @param cancelled reports true, pending tasks are cancelled and an InterruptedException is thrown;
	 *  partial outputs are discarded. */
	static public final <I,O> List<O> map(final List<I> inputs, final TaskFactory<I,O> generator, final int n_proc, final BooleanSupplier cancelled) throws InterruptedException, ExecutionException {
		if (inputs.isEmpty()) return Collections.emptyList();
		final int nproc = Math.min(sensible(n_proc), inputs.size());
		final ArrayList<O> outputs = new ArrayList<O>(inputs.size());
		final ExecutorService exec = Utils.newFixedThreadPool(nproc, "Process.map");
		final LinkedList<Future<O>> fus = new LinkedList<Future<O>>();
		try {
			final int ahead = Math.max(nproc + nproc, MIN_AHEAD);
			for (final I input : inputs) {
				if (isCancelled(cancelled)) throw new InterruptedException("Cancelled");
				fus.add(exec.submit(generator.create(input)));
				while (fus.size() > ahead) {
					outputs.add(fus.removeFirst().get());
				}
			}
			while (!fus.isEmpty()) {
				outputs.add(fus.removeFirst().get());
			}
			if (isCancelled(cancelled)) throw new InterruptedException("Cancelled");
			return outputs;
		} finally {
			for (final Future<O> fu : fus) fu.cancel(true);
			exec.shutdownNow();
		}
	}

	static private final boolean isCancelled(final BooleanSupplier cancelled) {
		return Thread.currentThread().isInterrupted() || (null != cancelled && cancelled.getAsBoolean());
	}
}
