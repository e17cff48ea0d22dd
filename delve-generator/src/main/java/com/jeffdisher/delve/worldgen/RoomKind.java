package com.jeffdisher.delve.worldgen;


/**
 * One row of the room table:  the blocks a room needs, relative to its anchor block, and the shallowest depth it can
 * appear at.
 *
 * @param tag The numeric room kind.
 * @param name A human-readable name.
 * @param dy1 The first block row, relative to the anchor.
 * @param dy2 The last block row, relative to the anchor.
 * @param dx1 The first block column, relative to the anchor.
 * @param dx2 The last block column, relative to the anchor.
 * @param minDepth The shallowest depth the room may be built at.
 * @param crowding True if the room fills the level with monsters (only one such room per level).
 * @param builder The builder which paints it.
 */
public record RoomKind(int tag
		, String name
		, int dy1
		, int dy2
		, int dx1
		, int dx2
		, int minDepth
		, boolean crowding
		, IRoomBuilder builder
)
{}
