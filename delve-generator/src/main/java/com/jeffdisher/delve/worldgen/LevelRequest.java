package com.jeffdisher.delve.worldgen;

import java.util.Collections;
import java.util.List;

import com.jeffdisher.delve.types.GenerationMode;
import com.jeffdisher.delve.types.Location;


/**
 * Describes the level a caller wants generated.
 *
 * @param mode The kind of level.
 * @param depth The depth (0 is the surface).
 * @param turn The current game turn (drives the day/night cycle and the level feeling delay).
 * @param lastLevelTurn The turn on which the previous level was entered.
 * @param wildX The wilderness column (wilderness, town and quest levels).
 * @param wildY The wilderness row (wilderness, town and quest levels).
 * @param vaultName The vault to use for store, arena and quest levels (null picks the first vault of the right type).
 * @param arenaRace The race of the arena opponent.
 * @param previousPlayer Where the player stood when crossing from a neighbouring wilderness region (null if not).
 * @param arrivals The monsters following the player onto this level.
 */
public record LevelRequest(GenerationMode mode
		, int depth
		, long turn
		, long lastLevelTurn
		, int wildX
		, int wildY
		, String vaultName
		, int arenaRace
		, Location previousPlayer
		, PendingArrivals arrivals
)
{
	/**
	 * A plain dungeon (or dream) level request with nobody following the player.
	 */
	public static LevelRequest dungeon(GenerationMode mode, int depth, long turn)
	{
		return new LevelRequest(mode, depth, turn, 0L, 0, 0, null, 0, null, PendingArrivals.NONE);
	}

	/**
	 * A monster which was adjacent to the player when they left the previous level.
	 */
	public static record Arrival(int race
			, int hp
			, int maxHp
	)
	{}

	/**
	 * The monsters following the player.
	 *
	 * @param pursuer The monster which followed the player down the stairs (null if none).
	 * @param ambushers The monsters waiting for a player recalling to the town.
	 * @param ancientChasing True if the ancient is hunting the player.
	 */
	public static record PendingArrivals(Arrival pursuer
			, List<Arrival> ambushers
			, boolean ancientChasing
	)
	{
		public static final PendingArrivals NONE = new PendingArrivals(null, Collections.emptyList(), false);
	}
}
