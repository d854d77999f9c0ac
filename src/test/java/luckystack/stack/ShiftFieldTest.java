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

import static org.junit.Assert.*;

import java.awt.Rectangle;

import org.junit.Test;

public class ShiftFieldTest {

	static private final Rectangle REGION = new Rectangle(20, 20, 80, 20);

	static private ShiftField single(final double sx, final double sy) throws Exception {
		return new ShiftField(new double[]{50}, new double[]{30}, new double[]{sx}, new double[]{sy}, REGION, 36, 18);
	}

	@Test
	public void exactShiftAtThePoint() throws Exception {
		final ShiftField field = single(1.5, -0.5);
		final double[] out = new double[2];
		field.evaluate(50, 30, out);
		assertEquals(1.5, out[0], 1e-9);
		assertEquals(-0.5, out[1], 1e-9);
		assertEquals(1, field.size());
		assertTrue(field.getNumAnchors() > 0);
	}

	@Test
	public void fallsOffAwayFromThePoint() throws Exception {
		final ShiftField field = single(1.5, -0.5);
		final double[] near = new double[2], mid = new double[2], far = new double[2];
		field.evaluate(55, 30, near);
		field.evaluate(75, 30, mid);
		field.evaluate(95, 30, far);
		assertTrue(near[0] > mid[0]);
		assertTrue(mid[0] > far[0]);
		assertTrue(far[0] >= 0);
		assertTrue(Math.abs(far[0]) < 0.5);
		assertTrue(near[0] <= 1.5 + 1e-9);
	}

	@Test
	public void anchorsMapOntoThemselves() throws Exception {
		final ShiftField field = single(1.5, -0.5);
		final double[] out = {9, 9};
		// (20 - 36 + 6 * 18, 20 - 36) is an anchor, farther than the radius from the point
		field.evaluate(92, -16, out);
		assertEquals(0, out[0], 1e-9);
		assertEquals(0, out[1], 1e-9);
	}

	@Test
	public void zeroShiftsGiveAZeroField() throws Exception {
		final ShiftField field = new ShiftField(
				new double[]{40, 58, 76},
				new double[]{30, 30, 30},
				new double[3], new double[3], REGION, 36, 18);
		final double[] out = {9, 9};
		for (double x = 20; x < 100; x += 3.5) {
			field.evaluate(x, 25, out);
			assertEquals(0, out[0], 0);
			assertEquals(0, out[1], 0);
		}
	}

	@Test
	public void noPointsGiveAZeroField() throws Exception {
		final ShiftField empty = new ShiftField(new double[0], new double[0], new double[0], new double[0], REGION, 36, 18);
		final double[] out = {9, 9};
		empty.evaluate(10, 10, out);
		assertEquals(0, out[0], 0);
		assertEquals(0, out[1], 0);
		assertEquals(0, empty.size());
		assertEquals(0, empty.getNumAnchors());
	}

	@Test
	public void continuousAlongALine() throws Exception {
		final ShiftField field = new ShiftField(
				new double[]{40, 58, 76},
				new double[]{30, 30, 30},
				new double[]{0.5, -0.5, 0.25},
				new double[]{0, 0.5, -0.5},
				REGION, 36, 18);
		final double[] a = new double[2], b = new double[2];
		field.evaluate(20, 30.5, a);
		for (double x = 20.25; x <= 100; x += 0.25) {
			field.evaluate(x, 30.5, b);
			assertTrue("step at " + x, Math.abs(b[0] - a[0]) < 0.1);
			assertTrue("step at " + x, Math.abs(b[1] - a[1]) < 0.1);
			a[0] = b[0];
			a[1] = b[1];
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void radiusMustBePositive() throws Exception {
		new ShiftField(new double[0], new double[0], new double[0], new double[0], REGION, 0, 18);
	}
}
