package com.jeffdisher.delve.types;


/**
 * The biome-style strategy assigned to each 2x2 block sector.  RUINS is the default and is left for ordinary room
 * placement.
 */
public enum SectorType
{
	RUINS,
	CAVERN,
	PLAZA,
	DARK,
	HILL,
	PIT,
	CLIFF,
}
