package com.jeffdisher.delve.worldgen;


/**
 * The generic interface the builder of each kind of level must implement.
 */
public interface ILevelBuilder
{
	/**
	 * Builds a complete level into the context's grid:  terrain, stairs, monsters, objects and the player.  The grid
	 * has already been wiped and the context's scratch state is fresh.
	 *
	 * @param context The context of this generation attempt.
	 */
	void build(GenerationContext context);
}
