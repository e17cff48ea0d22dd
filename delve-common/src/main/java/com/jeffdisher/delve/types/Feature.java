package com.jeffdisher.delve.types;


/**
 * The terrain type of a single cell.
 * NOTE:  The declaration order is significant.  Several generation rules compare features by rank ("anything at least
 * as hard as magma", "any granite class", "anything permanent"), so the rock classes must stay at the end, in this
 * order:  doors, rubble, mineral veins, granite classes, then the permanent classes.
 * Everything declared before the doors is open ground or scenery which tunnels treat as existing corridor.
 */
public enum Feature
{
	NONE(' ', false),
	FLOOR('.', true),
	INVIS('.', true),
	TRAP('^', true),
	GLYPH(';', true),
	LESS('<', true),
	MORE('>', true),
	SHAFT('>', true),
	DREAM_EXIT('>', true),
	DREAM_PORTAL('0', true),
	QUEST_ENTER('Q', true),
	QUEST_EXIT('E', true),
	SHOP('1', false),
	BUILDING('b', false),
	STORE_EXIT('S', true),
	ALTAR('_', false),
	UNSEEN(' ', false),

	GRASS('"', true),
	TALL_GRASS('"', true),
	SWAMP(',', true),
	MUD(',', true),
	SHRUB('%', true),
	ROCKY_HILL(':', true),
	TREES('T', true),
	MOUNTAIN('^', false),
	SHALLOW_WATER('~', true),
	DEEP_WATER('~', false),
	FOG('*', true),
	CHAOS_FOG('*', false),
	SHALLOW_LAVA('#', false),
	DEEP_LAVA('#', false),
	OIL('~', true),
	ICE('_', false),
	ACID('~', false),

	HILL_TOP('n', true),
	SLOPE_UP('/', true),
	SLOPE_DOWN('\\', true),
	PIT('v', true),
	CLIFF_UP('|', true),
	CLIFF_DOWN('|', false),
	LEDGE('=', true),

	GLOWING_TILE('.', true),
	FOUNTAIN('{', false),
	CARTOGRAPHER_DESK('&', false),
	HEROIC_REMAINS('~', true),
	RUIN_DOOR('\'', true),
	CRATE('x', false),
	BARREL('o', false),
	STONE_PILLAR('I', false),
	BOULDER('0', false),

	RUNE('r', true),
	LEVER_LEFT('\\', false),
	LEVER_RIGHT('/', false),
	FLOW_ACID('~', false),
	EMITTER('E', false),
	CRYSTAL('*', false),
	MIRROR_PLATE('_', true),
	WHISPERING_IDOL('&', false),
	SANCTUM_DOOR('+', false),

	OPEN('\'', true),
	BROKEN('\'', true),
	DOOR('+', false),
	SECRET('#', false),

	RUBBLE(':', false),
	MAGMA('%', false),
	QUARTZ('%', false),
	MAGMA_H('%', false),
	QUARTZ_H('%', false),
	MAGMA_K('*', false),
	QUARTZ_K('*', false),

	WALL_EXTRA('#', false),
	WALL_INNER('#', false),
	WALL_OUTER('#', false),
	WALL_SOLID('#', false),

	PERM_EXTRA('#', false),
	PERM_INNER('#', false),
	SANCTUM_WALL('#', false),
	FOLLY_WALL('#', false),
	PERM_OUTER('#', false),
	PERM_SOLID('#', false),
	;

	/**
	 * The character used when dumping a grid as text.
	 */
	public final char glyph;
	private final boolean _isOpen;

	private Feature(char glyph, boolean isOpen)
	{
		this.glyph = glyph;
		_isOpen = isOpen;
	}

	/**
	 * @return True if this is open ground a creature can stand on (floors, stairs, open doors, passable terrain).
	 */
	public boolean isOpen()
	{
		return _isOpen;
	}

	/**
	 * @return True for any granite or permanent rock.
	 */
	public boolean isRock()
	{
		return this.ordinal() >= WALL_EXTRA.ordinal();
	}

	/**
	 * @return True for mineral veins and anything harder.
	 */
	public boolean isWallOrVein()
	{
		return this.ordinal() >= MAGMA.ordinal();
	}

	/**
	 * @return True for the granite classes which streamers may convert.
	 */
	public boolean isGranite()
	{
		return (this.ordinal() >= WALL_EXTRA.ordinal()) && (this.ordinal() <= WALL_SOLID.ordinal());
	}

	/**
	 * @return True for any permanent (undiggable) rock.
	 */
	public boolean isPermanent()
	{
		return this.ordinal() >= PERM_EXTRA.ordinal();
	}

	/**
	 * @return True for regular up/down staircases.
	 */
	public boolean isStairs()
	{
		return (LESS == this) || (MORE == this);
	}

	/**
	 * @return True for bare floor and the open grass of the wilderness:  the ground things are placed on.
	 */
	public boolean isPlainGround()
	{
		return (FLOOR == this) || (GRASS == this);
	}

	/**
	 * @return True for closed doors of any kind, including secret doors.
	 */
	public boolean isClosedDoor()
	{
		return (DOOR == this) || (SECRET == this);
	}

	/**
	 * @return The treasure-bearing variant of a mineral vein, or this feature if it has none.
	 */
	public Feature withKnownTreasure()
	{
		Feature result;
		switch (this)
		{
		case MAGMA:
			result = MAGMA_K;
			break;
		case QUARTZ:
			result = QUARTZ_K;
			break;
			default:
				result = this;
		}
		return result;
	}
}
