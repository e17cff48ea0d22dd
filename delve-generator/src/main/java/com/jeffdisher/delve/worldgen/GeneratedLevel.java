package com.jeffdisher.delve.worldgen;

import java.util.List;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.Location;


/**
 * The accepted result of level generation.
 *
 * @param grid The committed grid (the player has been placed).
 * @param depth The depth of the level.
 * @param feeling The level feeling (0 means "not yet known", 1 is special, lower is more interesting).
 * @param rating The raw rating the feeling was derived from.
 * @param attempts How many attempts were needed (1 if the first was accepted).
 * @param origin The generation origin (first start staircase or the level centre).
 * @param puzzleSolution The rune order of an echo-lock sanctum (empty if there is none).
 */
public record GeneratedLevel(CaveGrid grid
		, int depth
		, int feeling
		, int rating
		, int attempts
		, Location origin
		, List<Integer> puzzleSolution
)
{}
