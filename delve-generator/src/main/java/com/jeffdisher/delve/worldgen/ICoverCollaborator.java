package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.types.CoverTier;
import com.jeffdisher.delve.types.Feature;


/**
 * Receives the destructible scenery seeded by generation.  Damage and destruction are not handled here.
 */
public interface ICoverCollaborator
{
	/**
	 * Registers a piece of destructible cover.
	 *
	 * @param y The row of the cell.
	 * @param x The column of the cell.
	 * @param tier How much protection it gives.
	 * @param durability How much damage it takes to destroy.
	 * @param feature The terrain feature which was painted for it.
	 */
	void registerCover(int y, int x, CoverTier tier, int durability, Feature feature);

	/**
	 * @return The tier of any cover registered at the cell, or the natural cover of the given terrain otherwise.
	 */
	CoverTier getCover(int y, int x, Feature terrain);

	/**
	 * Forgets all registered cover.
	 */
	void resetCover();
}
