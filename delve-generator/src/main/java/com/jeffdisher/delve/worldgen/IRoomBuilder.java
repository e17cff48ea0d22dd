package com.jeffdisher.delve.worldgen;


/**
 * Paints one kind of room around a centre cell.  The placer has already checked that the blocks the room needs are
 * free, so a builder only paints within them.
 */
public interface IRoomBuilder
{
	/**
	 * Builds the room.
	 *
	 * @param context The generation context.
	 * @param yval The centre row.
	 * @param xval The centre column.
	 * @return False if the builder gave up before painting anything (the blocks will not be reserved).
	 */
	boolean build(GenerationContext context, int yval, int xval);
}
