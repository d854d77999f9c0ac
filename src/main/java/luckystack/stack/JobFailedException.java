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

/** A stacking job cannot produce an image. */
public class JobFailedException extends Exception
{
	private static final long serialVersionUID = 3022853530467261735L;

	static public enum FatalReason
	{
		NO_FRAMES,
		/** The best frame shows no structure to align on. */
		NO_STRUCTURE,
		NO_VALID_FRAMES,
		/** The valid frames have no area in common. */
		EMPTY_INTERSECTION,
		NO_ALIGNMENT_POINTS
	}

	final private Phase phase;
	final private FatalReason reason;

	public JobFailedException( final Phase phase, final FatalReason reason, final String message )
	{
		super( phase + ": " + message );
		this.phase = phase;
		this.reason = reason;
	}

	public Phase getPhase()
	{
		return phase;
	}

	public FatalReason getReason()
	{
		return reason;
	}
}
