package com.jeffdisher.delve.worldgen;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.jeffdisher.delve.utils.Assert;


/**
 * Maps room kind tags to their block extents, depth gates and builders.
 */
public class RoomRegistry
{
	public static final int SIMPLE = 1;
	public static final int OVERLAPPING = 2;
	public static final int CROSS = 3;
	public static final int LARGE = 4;
	public static final int NEST = 5;
	public static final int PIT = 6;
	public static final int LESSER_VAULT = 7;
	public static final int GREATER_VAULT = 8;
	public static final int THEMED_VAULT = 9;
	public static final int SANCTUM = 10;
	public static final int FOLLY = 11;
	public static final int CIRCULAR = 12;
	public static final int COMPOSITE = 13;
	public static final int CAVERN = 14;
	public static final int GUARD_POST = 17;
	public static final int AMBUSH_CORRIDOR = 18;

	/**
	 * Creates the registry of every room kind the dungeon builder knows about.
	 */
	public static RoomRegistry createDefault()
	{
		RoomKind[] kinds = new RoomKind[] {
				new RoomKind(SIMPLE, "simple", 0, 0, -1, 1, 1, false, RectangularRooms::buildSimple),
				new RoomKind(OVERLAPPING, "overlapping", 0, 0, -1, 1, 1, false, RectangularRooms::buildOverlapping),
				new RoomKind(CROSS, "cross", 0, 0, -1, 1, 3, false, CrossRoom::build),
				new RoomKind(LARGE, "large", 0, 0, -1, 1, 3, false, LargeRoom::build),
				new RoomKind(NEST, "monster nest", 0, 0, -1, 1, 5, true, MonsterRooms::buildNest),
				new RoomKind(PIT, "monster pit", 0, 0, -1, 1, 5, true, MonsterRooms::buildPit),
				new RoomKind(LESSER_VAULT, "lesser vault", 0, 1, -1, 1, 5, false, (GenerationContext context, int yval, int xval) -> VaultRooms.build(context, yval, xval, VaultType.LESSER)),
				new RoomKind(GREATER_VAULT, "greater vault", -1, 2, -2, 3, 10, false, (GenerationContext context, int yval, int xval) -> VaultRooms.build(context, yval, xval, VaultType.GREATER)),
				new RoomKind(THEMED_VAULT, "themed vault", -1, 2, -2, 3, 5, false, (GenerationContext context, int yval, int xval) -> VaultRooms.build(context, yval, xval, VaultType.THEMED)),
				new RoomKind(SANCTUM, "sanctum", -1, 2, -2, 3, 40, false, SanctumRooms::buildSanctum),
				new RoomKind(FOLLY, "folly", -1, 3, -3, 3, 30, false, SanctumRooms::buildFolly),
				new RoomKind(CIRCULAR, "circular", -2, 2, -2, 2, 1, false, ShapedRooms::buildCircular),
				new RoomKind(COMPOSITE, "composite", -2, 2, -2, 2, 1, false, ShapedRooms::buildComposite),
				new RoomKind(CAVERN, "cavern", -2, 2, -2, 2, 1, false, ShapedRooms::buildCavern),
				new RoomKind(GUARD_POST, "guard post", 0, 0, -1, 1, 10, false, TacticalRooms::buildGuardPost),
				new RoomKind(AMBUSH_CORRIDOR, "ambush corridor", 0, 0, -1, 1, 10, false, TacticalRooms::buildAmbushCorridor),
		};
		Map<Integer, RoomKind> map = new HashMap<>();
		for (RoomKind kind : kinds)
		{
			Assert.assertTrue(null == map.put(kind.tag(), kind));
		}
		return new RoomRegistry(map);
	}


	private final Map<Integer, RoomKind> _kinds;

	private RoomRegistry(Map<Integer, RoomKind> kinds)
	{
		_kinds = Collections.unmodifiableMap(kinds);
	}

	/**
	 * @return The kind with the given tag, or null if there is none.
	 */
	public RoomKind get(int tag)
	{
		return _kinds.get(tag);
	}
}
