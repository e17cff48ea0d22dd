package com.jeffdisher.delve.types;


/**
 * The elevation tier of a cell.  Declaration order is low to high so tiers can be compared by ordinal.
 */
public enum Elevation
{
	LOW,
	GROUND,
	HILL,
	HIGH,
	;

	public boolean isAbove(Elevation other)
	{
		return this.ordinal() > other.ordinal();
	}
}
