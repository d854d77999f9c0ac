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

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

import java.util.concurrent.ConcurrentHashMap;

import luckystack.frames.BufferingPolicy.Artifact;
import luckystack.imaging.Filters;

/**
 * Indexed, read-only access to the frames of one stacking job and to the artifacts derived from them:
 * the mono (luminance) image, its Gaussian-blurred version and the Laplacian of the latter.
 * <p>
 * Frames flagged as excluded are removed from the view before any processing; the remaining frames
 * are re-indexed from 0 and keep their {@link #getSourceIndex(int) source index}.
 * <p>
 * Derived artifacts are retained according to the {@link BufferingPolicy}. All methods are safe to call
 * from several threads; a retained artifact is shared and must not be modified.
 */
public class FrameStore {

	final private FrameSource source;
	final private int[] view;
	final private BufferingPolicy policy;
	final private int noiseLevel;
	final private ConcurrentHashMap<Key, Object> cache = new ConcurrentHashMap<Key, Object>();

	private volatile int bitDepth = -1;
	private volatile int nChannels = -1;

	static private final class Key {
		final Artifact artifact;
		final int index;
		Key(final Artifact artifact, final int index) {
			this.artifact = artifact;
			this.index = index;
		}
		@Override
		public boolean equals(final Object o) {
			if (!(o instanceof Key)) return false;
			final Key k = (Key) o;
			return k.index == index && k.artifact == artifact;
		}
		@Override
		public int hashCode() {
			return 31 * index + artifact.ordinal();
		}
	}

	/**
	 * @param source the decoded frames.
	 * @param excluded per source frame, whether to leave it out; may be null or shorter than the source.
	 * @param bufferingLevel 0..4, see {@link BufferingPolicy}.
	 * @param noiseLevel width of the Gaussian kernel used for the blurred artifact.
	 */
	public FrameStore(final FrameSource source, final boolean[] excluded, final int bufferingLevel, final int noiseLevel) {
		this.source = source;
		this.policy = new BufferingPolicy(bufferingLevel);
		this.noiseLevel = noiseLevel;
		final int n = source.getNumberOfFrames();
		int count = 0;
		for (int i=0; i<n; i++) if (!isExcluded(excluded, i)) count++;
		this.view = new int[count];
		for (int i=0, k=0; i<n; i++) if (!isExcluded(excluded, i)) view[k++] = i;
	}

	public FrameStore(final FrameSource source, final int bufferingLevel, final int noiseLevel) {
		this(source, null, bufferingLevel, noiseLevel);
	}

	static private final boolean isExcluded(final boolean[] excluded, final int i) {
		return null != excluded && i < excluded.length && excluded[i];
	}

	public int size() { return view.length; }

	public int getWidth() { return source.getWidth(); }

	public int getHeight() { return source.getHeight(); }

	public int getNoiseLevel() { return noiseLevel; }

	public BufferingPolicy getBufferingPolicy() { return policy; }

	public int getSourceIndex(final int index) { return view[index]; }

	/** 8, 16, 24 (RGB) or 32, as reported by the first frame. */
	public int getBitDepth() {
		if (-1 == bitDepth) readPixelType();
		return bitDepth;
	}

	public int getNChannels() {
		if (-1 == nChannels) readPixelType();
		return nChannels;
	}

	/** The value of a fully saturated pixel: 65535 for 16-bit frames, 255 for all others.
	 *  Float frames are taken to be on the 8-bit scale. */
	public double getFullScale() {
		return 16 == getBitDepth() ? 65535.0 : 255.0;
	}

	private void readPixelType() {
		if (0 == view.length) {
			bitDepth = 8;
			nChannels = 1;
			return;
		}
		final ImageProcessor ip = frame(0).getProcessor();
		nChannels = ip.getNChannels();
		bitDepth = ip.getBitDepth();
	}

	@SuppressWarnings("unchecked")
	private <T> T cached(final Artifact a, final int index) {
		return (T) cache.get(new Key(a, index));
	}

	/** Retains @param value if the policy says so; returns the retained instance,
	 *  which is the one computed first when two threads race on the same key. */
	@SuppressWarnings("unchecked")
	private <T> T retain(final Artifact a, final int index, final T value) {
		if (!policy.retains(a)) return value;
		final Object previous = cache.putIfAbsent(new Key(a, index), value);
		return null == previous ? value : (T) previous;
	}

	/** The frame at @param index of this view, with its original pixels. */
	public Frame frame(final int index) {
		final ImageProcessor cached = cached(Artifact.ORIGINAL, index);
		if (null != cached) return new Frame(index, view[index], cached);
		final ImageProcessor ip = source.decode(view[index]);
		if (null == ip) throw new IllegalStateException("Could not decode frame " + view[index]);
		if (ip.getWidth() != getWidth() || ip.getHeight() != getHeight()) {
			throw new IllegalStateException("Frame " + view[index] + " has size " + ip.getWidth() + "x" + ip.getHeight() + ", expected " + getWidth() + "x" + getHeight());
		}
		return new Frame(index, view[index], retain(Artifact.ORIGINAL, index, ip));
	}

	/** The luminance of frame @param index. */
	public FloatProcessor mono(final int index) {
		final FloatProcessor cached = cached(Artifact.MONO, index);
		if (null != cached) return cached;
		return retain(Artifact.MONO, index, Filters.mono(frame(index).getProcessor()));
	}

	/** The luminance of frame @param index blurred with the noise-level Gaussian. */
	public FloatProcessor blurred(final int index) {
		final FloatProcessor cached = cached(Artifact.BLURRED, index);
		if (null != cached) return cached;
		return retain(Artifact.BLURRED, index, Filters.blur(mono(index), noiseLevel));
	}

	/** The Laplacian of {@link #blurred(int)}. */
	public FloatProcessor laplacian(final int index) {
		final FloatProcessor cached = cached(Artifact.LAPLACIAN, index);
		if (null != cached) return cached;
		return retain(Artifact.LAPLACIAN, index, Filters.laplacian(blurred(index)));
	}

	/** Drops all retained artifacts. */
	public void clear() {
		cache.clear();
	}

	/** Number of retained artifacts of kind @param a. */
	public int countRetained(final Artifact a) {
		int count = 0;
		for (final Key k : cache.keySet()) if (k.artifact == a) count++;
		return count;
	}
}
