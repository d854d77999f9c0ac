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
package luckystack.frames;

/** Which per-frame artifacts the {@link FrameStore} retains after computing them once.
 *  Each level adds one artifact to the previous one:
 *  0 retains nothing, 1 the Laplacian, 2 the blurred mono, 3 the original, 4 the mono. */
public final class BufferingPolicy {

	static public enum Artifact { ORIGINAL, MONO, BLURRED, LAPLACIAN }

	static public final int MIN_LEVEL = 0;
	static public final int MAX_LEVEL = 4;

	final private int level;

	public BufferingPolicy(final int level) {
		if (level < MIN_LEVEL || level > MAX_LEVEL) throw new IllegalArgumentException("Buffering level must be within [" + MIN_LEVEL + ", " + MAX_LEVEL + "]: " + level);
		this.level = level;
	}

	public int getLevel() {
		return level;
	}

	public boolean retains(final Artifact a) {
		switch (a) {
			case LAPLACIAN: return level >= 1;
			case BLURRED: return level >= 2;
			case ORIGINAL: return level >= 3;
			case MONO: return level >= 4;
			default: return false;
		}
	}

	@Override
	public String toString() {
		return "BufferingPolicy[level=" + level + "]";
	}
}
