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

import static org.junit.Assert.*;

import ij.process.FloatProcessor;

import java.awt.Rectangle;
import java.util.List;

import luckystack.SyntheticFrames;
import luckystack.imaging.Filters;
import luckystack.stack.JobFailedException;
import luckystack.stack.JobFailedException.FatalReason;
import luckystack.stack.Phase;

import org.junit.Test;

public class ReferencePatchSelectorTest {

	@Test
	public void picksMostStructuredWindowInsideTheSearchBorder() throws Exception {
		final StackingParam param = new StackingParam();
		final FloatProcessor best = Filters.blur(SyntheticFrames.clean(128, 128), param.noiseLevel);
		final ReferencePatch p = ReferencePatchSelector.select(best, param, 255);
		assertFalse(p.isDegraded());
		assertFalse(p.isManual());
		final Rectangle inner = new Rectangle(38, 38, 52, 52);
		assertTrue(p.getBounds().toString(), inner.contains(p.getBounds()));
		assertEquals(param.referenceWindowSize(128, 128).getSize(), p.getBounds().getSize());

		final List<ReferencePatch> candidates = ReferencePatchSelector.candidates(best, param, 255);
		assertEquals(p.getBounds(), candidates.get(0).getBounds());
		for (int i=1; i<candidates.size(); ++i)
			assertTrue(candidates.get(i - 1).getStructure() >= candidates.get(i).getStructure());
	}

	@Test
	public void darkFrameDegradesToInnerArea() throws Exception {
		final StackingParam param = new StackingParam();
		final FloatProcessor best = Filters.blur(SyntheticFrames.shifted(128, 128, 0, 0, 0.05), param.noiseLevel);
		final ReferencePatch p = ReferencePatchSelector.select(best, param, 255);
		assertTrue(p.isDegraded());
		assertEquals(new Rectangle(38, 38, 52, 52), p.getBounds());
	}

	@Test
	public void manualPatchIsUsedAsGiven() throws Exception {
		final StackingParam param = new StackingParam();
		param.referencePatch = new Rectangle(40, 40, 30, 30);
		final ReferencePatch p = ReferencePatchSelector.select(SyntheticFrames.clean(128, 128), param, 255);
		assertTrue(p.isManual());
		assertFalse(p.isDegraded());
		assertEquals(new Rectangle(40, 40, 30, 30), p.getBounds());
	}

	@Test
	public void constantFrameHasNoStructure() {
		final FloatProcessor flat = new FloatProcessor(128, 128);
		flat.add(80);
		try {
			ReferencePatchSelector.select(flat, new StackingParam(), 255);
			fail("Expected a job failure");
		} catch (final JobFailedException e) {
			assertEquals(FatalReason.NO_STRUCTURE, e.getReason());
			assertEquals(Phase.SELECT_REFERENCE_PATCH, e.getPhase());
		}
	}

	@Test
	public void roundingResidueIsNoStructure() {
		// a flat frame after blurring keeps differences in the last float digits
		final FloatProcessor flat = new FloatProcessor(128, 128);
		flat.add(80);
		for (int y=0; y<128; ++y)
			for (int x=0; x<128; ++x)
				if (0 == (x + y) % 2) flat.setf(x, y, Math.nextUp(80f));
		try {
			ReferencePatchSelector.select(flat, new StackingParam(), 255);
			fail("Expected a job failure");
		} catch (final JobFailedException e) {
			assertEquals(FatalReason.NO_STRUCTURE, e.getReason());
		}
	}
}
