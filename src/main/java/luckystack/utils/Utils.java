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
package luckystack.utils;

import ij.IJ;

import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.atomic.AtomicInteger;

/** Logging, progress and thread pool helpers shared by all stacking phases. */
public class Utils {

	private Utils() {}

	static private final boolean hasGUI() {
		return null != IJ.getInstance() && !IJ.isMacro();
	}

	/** Intended for the user to see. */
	static public final void log(final String msg) {
		if (hasGUI()) {
			IJ.log(msg);
		} else {
			System.out.println(msg);
		}
	}

	/** Intended for developers: prints to terminal. */
	static public final void log2(final String msg) {
		System.out.println(msg);
	}

	/** Shows progress in the ImageJ status bar, if there is one. Values outside [0,1] hide the bar. */
	static public final void showProgress(final double p) {
		if (null == IJ.getInstance()) return;
		IJ.showProgress(p < 0 || p > 1 ? 1.0 : p);
	}

	static public final String toString(final int[] a) {
		if (null == a) return "null";
		final StringBuilder sb = new StringBuilder("[");
		for (int i=0; i<a.length; i++) {
			if (i > 0) sb.append(", ");
			sb.append(a[i]);
		}
		return sb.append(']').toString();
	}

	/** Creates a fixed thread pool of daemon threads named after @param namePrefix. */
	static public final ThreadPoolExecutor newFixedThreadPool(final int n_proc, final String namePrefix) {
		final ThreadPoolExecutor exec = (ThreadPoolExecutor) Executors.newFixedThreadPool(n_proc);
		final AtomicInteger ai = new AtomicInteger(0);
		exec.setThreadFactory(new ThreadFactory() {
			public Thread newThread(final Runnable r) {
				final ThreadGroup tg = Thread.currentThread().getThreadGroup();
				final Thread t = new Thread(tg, r, new StringBuilder(null == namePrefix ? tg.getName() : namePrefix).append('-').append(ai.incrementAndGet()).toString());
				t.setDaemon(true);
				t.setPriority(Thread.NORM_PRIORITY);
				return t;
			}
		});
		return exec;
	}
}
