package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.data.BlockOccupancy;
import com.jeffdisher.delve.types.Location;


/**
 * Places rooms on the block grid.  Every check happens before any painting so a refused room leaves the level
 * untouched.
 */
public class RoomPlacer
{
	private final RoomRegistry _registry;

	public RoomPlacer(RoomRegistry registry)
	{
		_registry = registry;
	}

	/**
	 * Tries to build a room of the given kind anchored at the given block.
	 *
	 * @param context The generation context.
	 * @param blockY The anchor block row.
	 * @param blockX The anchor block column.
	 * @param tag The room kind.
	 * @return True if the room was built and its blocks reserved.
	 */
	public boolean placeRoom(GenerationContext context, int blockY, int blockX, int tag)
	{
		RoomKind kind = _registry.get(tag);
		boolean placed = false;
		if ((null != kind)
				&& (context.depth >= kind.minDepth())
				&& !(context.crowded && kind.crowding())
		)
		{
			int y1 = blockY + kind.dy1();
			int y2 = blockY + kind.dy2();
			int x1 = blockX + kind.dx1();
			int x2 = blockX + kind.dx2();
			BlockOccupancy blocks = context.blocks;
			if (blocks.isInside(y1, x1, y2, x2) && blocks.isFree(y1, x1, y2, x2))
			{
				// The room is centred on the exact middle of its blocks.
				int yval = ((y1 + y2 + 1) * BlockOccupancy.BLOCK_HEIGHT) / 2;
				int xval = ((x1 + x2 + 1) * BlockOccupancy.BLOCK_WIDTH) / 2;
				if (kind.builder().build(context, yval, xval))
				{
					context.centres.add(new Location(yval, xval));
					blocks.reserve(y1, x1, y2, x2);
					if (kind.crowding())
					{
						context.crowded = true;
					}
					placed = true;
				}
			}
		}
		return placed;
	}
}
