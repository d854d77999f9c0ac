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

import java.io.CharArrayWriter;
import java.io.PrintWriter;

/** Logs the stack trace of an error, followed by those of all its causes. */
public class IJError {

	private IJError() {}

	static public final void print(final Throwable e) {
		print(e, false);
	}

	static public final void print(Throwable e, final boolean stdout) {
		final StringBuilder sb = new StringBuilder("==================\nERROR:\n");
		while (null != e) {
			final CharArrayWriter caw = new CharArrayWriter();
			final PrintWriter pw = new PrintWriter(caw);
			e.printStackTrace(pw);
			pw.flush();
			sb.append(caw.toString().replace('\r', '\n'));
			final Throwable t = e.getCause();
			if (e == t || null == t) break;
			sb.append("==> Caused by:\n");
			e = t;
		}
		sb.append("==================\n");
		if (stdout) Utils.log2(sb.toString());
		else Utils.log(sb.toString());
	}
}
