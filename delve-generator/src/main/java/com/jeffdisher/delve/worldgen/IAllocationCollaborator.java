package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.ObjectQuality;


/**
 * The monster, object and trap tables used by generation.  Generation only decides where things go and how deep they
 * should be, never what they are:  selection from the tables is entirely the job of the implementation.
 * All placement calls write the created id into the grid and return it, or return CaveGrid.NO_ENTITY if nothing could
 * be placed (table full, nothing suitable, cell occupied).
 */
public interface IAllocationCollaborator
{
	/**
	 * The monster is created asleep.
	 */
	int MON_SLEEP = 0x01;
	/**
	 * Friends of the monster may be placed around it.
	 */
	int MON_HORDE = 0x02;
	/**
	 * The monster is chosen for a nest or pit (restricted theme).
	 */
	int MON_PIT = 0x04;
	/**
	 * Escorts may be placed around it.
	 */
	int MON_GROUP = 0x08;
	/**
	 * Only placed if no monster of that race already exists.
	 */
	int MON_JUST_ONE = 0x10;
	/**
	 * The monster belongs to a quest.
	 */
	int MON_QUEST = 0x20;
	/**
	 * The monster starts hidden (ambushers).
	 */
	int MON_HIDE = 0x40;
	/**
	 * Only aquatic races are chosen.
	 */
	int MON_AQUATIC = 0x80;
	/**
	 * The monster is an arena opponent.
	 */
	int MON_ARENA = 0x100;

	/**
	 * Places a random monster suitable for the given level.
	 */
	int placeMonster(CaveGrid grid, int y, int x, int level, int flags);

	/**
	 * Places a monster of the given race.
	 */
	int placeMonsterRace(CaveGrid grid, int y, int x, int race, int flags);

	/**
	 * Places a random monster, suitable for the given level, whose display glyph is the one given.
	 */
	int placeMonsterByGlyph(CaveGrid grid, int y, int x, char glyph, int level, int flags);

	/**
	 * Places a random object of the given quality, suitable for the given level.
	 */
	int placeObject(CaveGrid grid, int y, int x, int level, ObjectQuality quality);

	/**
	 * Places a random object, suitable for the given level, whose display glyph is the one given.
	 */
	int placeObjectByGlyph(CaveGrid grid, int y, int x, char glyph, int level);

	/**
	 * Places a pile of gold appropriate for the given level.
	 */
	int placeGold(CaveGrid grid, int y, int x, int level);

	/**
	 * @return True if the given object is a chest (traps like to be placed near them).
	 */
	boolean isChest(int objectId);

	/**
	 * Chooses the kind of a new trap.
	 *
	 * @param depth The current depth.
	 * @return The trap kind, stored as the variant of a TRAP cell (0-127).
	 */
	int chooseTrapKind(int depth);

	/**
	 * Places a monster generator spawning the given race.
	 */
	void placeGenerator(CaveGrid grid, int y, int x, int race);

	/**
	 * Deletes any monster at the given cell.
	 */
	void deleteMonster(CaveGrid grid, int y, int x);

	/**
	 * Deletes any objects at the given cell.
	 */
	void deleteObjects(CaveGrid grid, int y, int x);

	int getMonsterCount();

	int getObjectCount();

	/**
	 * Forgets every monster and object of the current level (the grid itself is wiped separately).
	 */
	void wipe();

	/**
	 * @return The id of a live monster of the given race, or CaveGrid.NO_ENTITY if there is none.
	 */
	int findMonsterByRace(int race);

	/**
	 * Moves an existing monster to a new cell, updating the grid.
	 */
	void moveMonster(CaveGrid grid, int monsterId, int y, int x);

	void setMonsterHealth(int monsterId, int hp, int maxHp);

	/**
	 * Makes the monster permanently hostile and awake.
	 */
	void enrageMonster(int monsterId);

	/**
	 * @return The rarity of each deity, indexed by the deity number stored as an altar's variant.
	 */
	int[] getDeityRarities();

	/**
	 * @return The race of the travelling merchant.
	 */
	int getMerchantRace();

	/**
	 * @return The race of the town scholar.
	 */
	int getScholarRace();

	/**
	 * @return The race of the ancient which chases the player between levels.
	 */
	int getAncientRace();
}
