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
package luckystack.mesh;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import luckystack.align.StackingParam;

/**
 * The alignment points of one job, each either kept or discarded with a reason.
 * <p>
 * Before stacking, points can be added, removed, moved and resized. Every edit is checked against the bounds
 * rule: the patch must lie inside the image and the box, widened by the search width, too.
 * Stacking {@link #freeze() freezes} the mesh; from then on only the status of points changes.
 */
public class AlignmentPointMesh {

	final private int width, height;
	final private int searchWidth;
	final private int step;
	/** All points, kept or not, in creation order. */
	final private List<AlignmentPoint> points = new ArrayList<AlignmentPoint>();
	final private Map<AlignmentPoint,DiscardReason> discarded = new LinkedHashMap<AlignmentPoint,DiscardReason>();
	private boolean frozen = false;

	/**
	 * @param width of the mean frame
	 * @param height of the mean frame
	 * @param searchWidth maximal local shift searched at each point
	 * @param step distance between neighbouring points of a generated mesh
	 */
	public AlignmentPointMesh(final int width, final int height, final int searchWidth, final int step) {
		this.width = width;
		this.height = height;
		this.searchWidth = searchWidth;
		this.step = step;
	}

	public int getWidth() { return width; }

	public int getHeight() { return height; }

	public int getSearchWidth() { return searchWidth; }

	public int getStep() { return step; }

	/** The kept points, in creation order. */
	public synchronized List<AlignmentPoint> getAlignmentPoints() {
		final ArrayList<AlignmentPoint> kept = new ArrayList<AlignmentPoint>();
		for (final AlignmentPoint ap : points) if (!discarded.containsKey(ap)) kept.add(ap);
		return Collections.unmodifiableList(kept);
	}

	/** Kept and discarded points, in creation order. */
	public synchronized List<AlignmentPoint> getAllAlignmentPoints() {
		return Collections.unmodifiableList(new ArrayList<AlignmentPoint>(points));
	}

	public synchronized Map<AlignmentPoint,DiscardReason> getDiscarded() {
		return Collections.unmodifiableMap(new LinkedHashMap<AlignmentPoint,DiscardReason>(discarded));
	}

	/** Null if {@code ap} is kept. */
	public synchronized DiscardReason getStatus(final AlignmentPoint ap) {
		return discarded.get(ap);
	}

	public synchronized boolean isKept(final AlignmentPoint ap) {
		return points.contains(ap) && !discarded.containsKey(ap);
	}

	public synchronized int size() {
		return points.size() - discarded.size();
	}

	public synchronized boolean isFrozen() { return frozen; }

	public synchronized void freeze() { frozen = true; }

	/** Whether a point at (x, y) with the given half box width obeys the bounds rule. */
	public boolean fits(final int x, final int y, final int halfBoxWidth) {
		if (halfBoxWidth < StackingParam.MIN_HALF_BOX_WIDTH) return false;
		final int halfPatch = StackingParam.halfPatchWidth(halfBoxWidth);
		final int reach = halfBoxWidth + searchWidth;
		return x - halfPatch >= 0 && x + halfPatch <= width
		    && y - halfPatch >= 0 && y + halfPatch <= height
		    && x - reach >= 0 && x + reach <= width
		    && y - reach >= 0 && y + reach <= height;
	}

	private void checkEditable() {
		if (frozen) throw new IllegalStateException("The alignment point mesh can no longer be edited");
	}

	private void checkFits(final int x, final int y, final int halfBoxWidth) {
		if (!fits(x, y, halfBoxWidth)) throw new IllegalArgumentException("An alignment point at " + x + ", " + y + " with half box width " + halfBoxWidth + " does not fit into " + width + "x" + height + " with search width " + searchWidth);
	}

	/** Adds a kept point, with its patch not extended. */
	public synchronized AlignmentPoint add(final int x, final int y, final int halfBoxWidth) {
		checkEditable();
		checkFits(x, y, halfBoxWidth);
		final AlignmentPoint ap = new AlignmentPoint(x, y, halfBoxWidth, StackingParam.halfPatchWidth(halfBoxWidth), width, height, false, false, false, false);
		points.add(ap);
		return ap;
	}

	/** Adds a point created elsewhere, kept if {@code reason} is null. */
	synchronized void add(final AlignmentPoint ap, final DiscardReason reason) {
		checkEditable();
		points.add(ap);
		if (null != reason) discarded.put(ap, reason);
	}

	public synchronized void remove(final AlignmentPoint ap) {
		checkEditable();
		if (!points.remove(ap)) throw new IllegalArgumentException("Not in this mesh: " + ap);
		discarded.remove(ap);
	}

	/** Replaces {@code ap} by a point at (x, y) with the same box and the same border extensions. */
	public synchronized AlignmentPoint move(final AlignmentPoint ap, final int x, final int y) {
		return replace(ap, x, y, ap.getHalfBoxWidth());
	}

	/** Replaces {@code ap} by a point with its half box width multiplied by {@code factor}. */
	public synchronized AlignmentPoint resize(final AlignmentPoint ap, final double factor) {
		if (!(factor > 0)) throw new IllegalArgumentException("Resize factor must be positive: " + factor);
		return replace(ap, ap.getX(), ap.getY(), (int)Math.round(ap.getHalfBoxWidth() * factor));
	}

	private AlignmentPoint replace(final AlignmentPoint ap, final int x, final int y, final int halfBoxWidth) {
		checkEditable();
		final int index = points.indexOf(ap);
		if (-1 == index) throw new IllegalArgumentException("Not in this mesh: " + ap);
		checkFits(x, y, halfBoxWidth);
		final AlignmentPoint moved = new AlignmentPoint(x, y, halfBoxWidth, StackingParam.halfPatchWidth(halfBoxWidth), width, height,
				ap.isExtendedLowX(), ap.isExtendedHighX(), ap.isExtendedLowY(), ap.isExtendedHighY());
		points.set(index, moved);
		final DiscardReason reason = discarded.remove(ap);
		if (null != reason) discarded.put(moved, reason);
		return moved;
	}

	/** Marks a kept point as discarded; allowed also once frozen. */
	public synchronized void discard(final AlignmentPoint ap, final DiscardReason reason) {
		if (!points.contains(ap)) throw new IllegalArgumentException("Not in this mesh: " + ap);
		if (!discarded.containsKey(ap)) discarded.put(ap, reason);
	}

	/** Smallest distance between two kept points, or infinity if there are fewer than two. */
	public synchronized double minimumDistance() {
		final List<AlignmentPoint> kept = getAlignmentPoints();
		double min = Double.POSITIVE_INFINITY;
		for (int i=0; i<kept.size(); i++) {
			for (int j=i+1; j<kept.size(); j++) {
				min = Math.min(min, kept.get(i).distance(kept.get(j)));
			}
		}
		return min;
	}

	public synchronized void exportXML(final StringBuilder sb_body, final String indent) {
		sb_body.append(indent).append("<ap_mesh\n");
		final String in = indent + "\t";
		sb_body.append(in).append("width=\"").append(width).append("\"\n")
		       .append(in).append("height=\"").append(height).append("\"\n")
		       .append(in).append("search_width=\"").append(searchWidth).append("\"\n")
		       .append(in).append("step=\"").append(step).append("\"\n")
		;
		sb_body.append(indent).append(">\n");
		for (final AlignmentPoint ap : points) {
			final Rectangle p = ap.getPatch();
			final DiscardReason reason = discarded.get(ap);
			sb_body.append(in).append("<ap x=\"").append(ap.getX())
			       .append("\" y=\"").append(ap.getY())
			       .append("\" half_box_width=\"").append(ap.getHalfBoxWidth())
			       .append("\" patch=\"").append(p.x).append(',').append(p.y).append(',').append(p.width).append(',').append(p.height)
			       .append("\" status=\"").append(null == reason ? "kept" : reason.name())
			       .append("\" />\n");
		}
		sb_body.append(indent).append("</ap_mesh>\n");
	}
}
