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

import luckystack.align.FrameRanking;
import luckystack.align.GlobalAlignment;
import luckystack.align.MeanFrame;
import luckystack.align.ReferencePatch;
import luckystack.mesh.AlignmentPointMesh;

/** Everything a finished job produced. */
public class StackingResult
{
	final private ImageProcessor image;
	final private AlignmentPointMesh mesh;
	final private Diagnostics diagnostics;
	final private FrameRanking ranking;
	final private ReferencePatch reference;
	final private GlobalAlignment alignment;
	final private MeanFrame mean;

	public StackingResult( final ImageProcessor image, final AlignmentPointMesh mesh, final Diagnostics diagnostics,
			final FrameRanking ranking, final ReferencePatch reference, final GlobalAlignment alignment, final MeanFrame mean )
	{
		this.image = image;
		this.mesh = mesh;
		this.diagnostics = diagnostics;
		this.ranking = ranking;
		this.reference = reference;
		this.alignment = alignment;
		this.mean = mean;
	}

	/** The stacked image, of the pixel type of the frames and the size of the mean frame. */
	public ImageProcessor getImage() { return image; }

	/** The frozen mesh with the status of every alignment point. */
	public AlignmentPointMesh getMesh() { return mesh; }

	public Diagnostics getDiagnostics() { return diagnostics; }

	public FrameRanking getRanking() { return ranking; }

	public ReferencePatch getReferencePatch() { return reference; }

	public GlobalAlignment getAlignment() { return alignment; }

	public MeanFrame getMeanFrame() { return mean; }
}
