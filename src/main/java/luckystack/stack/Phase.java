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

/** The phases of a stacking job, in execution order. Each phase completes before the next starts. */
public enum Phase
{
	RANK_FRAMES,
	SELECT_REFERENCE_PATCH,
	ALIGN_FRAMES,
	MEAN_FRAME,
	CREATE_MESH,
	RANK_AT_APS,
	LOCAL_SHIFTS,
	STACK_PATCHES,
	BLEND
}
