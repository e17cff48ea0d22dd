package com.jeffdisher.delve.types;


/**
 * How much protection a cell provides as cover.
 */
public enum CoverTier
{
	NONE,
	LIGHT,
	MEDIUM,
	HEAVY,
	;

	/**
	 * Determines the cover provided by a terrain feature when no destructible cover has been registered for the cell.
	 * 
	 * @param feature The terrain feature.
	 * @return The cover tier of that terrain.
	 */
	public static CoverTier forFeature(Feature feature)
	{
		CoverTier tier;
		switch (feature)
		{
		case WALL_INNER:
		case WALL_OUTER:
		case WALL_SOLID:
		case PERM_INNER:
		case PERM_OUTER:
		case PERM_SOLID:
		case STONE_PILLAR:
			tier = HEAVY;
			break;
		case TREES:
		case BOULDER:
		case RUBBLE:
			tier = MEDIUM;
			break;
		case CRATE:
		case BARREL:
		case TALL_GRASS:
		case SHRUB:
		case FOG:
		case CHAOS_FOG:
			tier = LIGHT;
			break;
			default:
				tier = NONE;
		}
		return tier;
	}
}
