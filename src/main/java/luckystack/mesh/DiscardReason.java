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

/** Why an alignment point takes no part in stacking. */
public enum DiscardReason {
	/** The box is too dark. */
	LOW_BRIGHTNESS,
	/** The box is too uniform. */
	LOW_CONTRAST,
	/** The box has too little structure compared to the other boxes. */
	LOW_STRUCTURE,
	/** Another alignment point is too near. */
	TOO_CLOSE,
	/** No pixel of the object lies within the patch. */
	OUTSIDE_OBJECT,
	/** Too few frames could be stacked. */
	INSUFFICIENT_DATA
}
