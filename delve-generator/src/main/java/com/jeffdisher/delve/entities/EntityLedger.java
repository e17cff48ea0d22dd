package com.jeffdisher.delve.entities;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CoverTier;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.GuardPostType;
import com.jeffdisher.delve.types.Location;
import com.jeffdisher.delve.types.ObjectQuality;
import com.jeffdisher.delve.types.PatrolType;
import com.jeffdisher.delve.utils.Assert;
import com.jeffdisher.delve.worldgen.IAllocationCollaborator;
import com.jeffdisher.delve.worldgen.ICoverCollaborator;
import com.jeffdisher.delve.worldgen.IPatrolCollaborator;


/**
 * An in-memory record of everything generation placed on the current level:  monsters, objects, generators, cover and
 * the AI behaviour registered for monsters.
 * It makes no attempt at real table selection:  a random monster's race is derived from the level it was asked for and
 * objects only remember what they were asked to be.  Ids start at 1 and are never reused within a level.
 * The monster and object tables have fixed capacities, like the real tables, and placement fails once they are full.
 */
public class EntityLedger implements IAllocationCollaborator, ICoverCollaborator, IPatrolCollaborator
{
	public static final int MERCHANT_RACE = 1000;
	public static final int SCHOLAR_RACE = 1001;
	public static final int ANCIENT_RACE = 1002;
	/**
	 * Random monsters are given this race plus the level they were generated for.
	 */
	public static final int LEVEL_RACE_BASE = 1;
	public static final int TRAP_KINDS = 16;
	public static final char CHEST_GLYPH = '~';
	public static final char DEFAULT_MONSTER_GLYPH = 'm';
	public static final char DEFAULT_OBJECT_GLYPH = '*';
	public static final char GOLD_GLYPH = '$';

	private static final int[] DEITY_RARITIES = new int[] { 1, 1, 2, 2, 3 };

	private final int _monsterCapacity;
	private final int _objectCapacity;
	private final Map<Integer, Monster> _monsters;
	private final Map<Integer, Item> _objects;
	private final List<Generator> _generators;
	private final Map<Location, Cover> _cover;
	private final Map<Integer, PatrolType> _patrols;
	private final Map<Integer, GuardPostType> _guardPosts;
	private int _nextId;
	private int _nextTrap;

	public EntityLedger(int monsterCapacity, int objectCapacity)
	{
		Assert.assertTrue(monsterCapacity > 0);
		Assert.assertTrue(objectCapacity > 0);
		_monsterCapacity = monsterCapacity;
		_objectCapacity = objectCapacity;
		_monsters = new HashMap<>();
		_objects = new HashMap<>();
		_generators = new ArrayList<>();
		_cover = new HashMap<>();
		_patrols = new HashMap<>();
		_guardPosts = new HashMap<>();
		_nextId = 1;
		_nextTrap = 0;
	}

	@Override
	public int placeMonster(CaveGrid grid, int y, int x, int level, int flags)
	{
		return _addMonster(grid, y, x, LEVEL_RACE_BASE + level, DEFAULT_MONSTER_GLYPH, flags);
	}

	@Override
	public int placeMonsterRace(CaveGrid grid, int y, int x, int race, int flags)
	{
		return _addMonster(grid, y, x, race, DEFAULT_MONSTER_GLYPH, flags);
	}

	@Override
	public int placeMonsterByGlyph(CaveGrid grid, int y, int x, char glyph, int level, int flags)
	{
		return _addMonster(grid, y, x, LEVEL_RACE_BASE + level, glyph, flags);
	}

	@Override
	public int placeObject(CaveGrid grid, int y, int x, int level, ObjectQuality quality)
	{
		return _addObject(grid, y, x, level, quality, DEFAULT_OBJECT_GLYPH);
	}

	@Override
	public int placeObjectByGlyph(CaveGrid grid, int y, int x, char glyph, int level)
	{
		return _addObject(grid, y, x, level, ObjectQuality.PLAIN, glyph);
	}

	@Override
	public int placeGold(CaveGrid grid, int y, int x, int level)
	{
		return _addObject(grid, y, x, level, ObjectQuality.PLAIN, GOLD_GLYPH);
	}

	@Override
	public boolean isChest(int objectId)
	{
		Item item = _objects.get(objectId);
		return (null != item) && (CHEST_GLYPH == item.glyph());
	}

	@Override
	public int chooseTrapKind(int depth)
	{
		int kind = (depth + _nextTrap) % TRAP_KINDS;
		_nextTrap += 1;
		return kind;
	}

	@Override
	public void placeGenerator(CaveGrid grid, int y, int x, int race)
	{
		_generators.add(new Generator(y, x, race));
	}

	@Override
	public void deleteMonster(CaveGrid grid, int y, int x)
	{
		int id = grid.getMonster(y, x);
		if (CaveGrid.NO_ENTITY != id)
		{
			_monsters.remove(id);
			_patrols.remove(id);
			_guardPosts.remove(id);
			grid.setMonster(y, x, CaveGrid.NO_ENTITY);
		}
	}

	@Override
	public void deleteObjects(CaveGrid grid, int y, int x)
	{
		int id = grid.getObject(y, x);
		if (CaveGrid.NO_ENTITY != id)
		{
			_objects.remove(id);
			grid.setObject(y, x, CaveGrid.NO_ENTITY);
		}
	}

	@Override
	public int getMonsterCount()
	{
		return _monsters.size();
	}

	@Override
	public int getObjectCount()
	{
		return _objects.size();
	}

	@Override
	public void wipe()
	{
		_monsters.clear();
		_objects.clear();
		_generators.clear();
		_nextId = 1;
		_nextTrap = 0;
	}

	@Override
	public int findMonsterByRace(int race)
	{
		int found = CaveGrid.NO_ENTITY;
		for (Monster monster : _monsters.values())
		{
			if (race == monster.race)
			{
				found = monster.id;
				break;
			}
		}
		return found;
	}

	@Override
	public void moveMonster(CaveGrid grid, int monsterId, int y, int x)
	{
		Monster monster = _monsters.get(monsterId);
		Assert.assertTrue(null != monster);
		Assert.assertTrue(CaveGrid.NO_ENTITY == grid.getMonster(y, x));
		grid.setMonster(monster.y, monster.x, CaveGrid.NO_ENTITY);
		monster.y = y;
		monster.x = x;
		grid.setMonster(y, x, monsterId);
	}

	@Override
	public void setMonsterHealth(int monsterId, int hp, int maxHp)
	{
		Monster monster = _monsters.get(monsterId);
		Assert.assertTrue(null != monster);
		monster.hp = hp;
		monster.maxHp = maxHp;
	}

	@Override
	public void enrageMonster(int monsterId)
	{
		Monster monster = _monsters.get(monsterId);
		Assert.assertTrue(null != monster);
		monster.enraged = true;
		monster.flags &= ~MON_SLEEP;
	}

	@Override
	public int[] getDeityRarities()
	{
		return DEITY_RARITIES.clone();
	}

	@Override
	public int getMerchantRace()
	{
		return MERCHANT_RACE;
	}

	@Override
	public int getScholarRace()
	{
		return SCHOLAR_RACE;
	}

	@Override
	public int getAncientRace()
	{
		return ANCIENT_RACE;
	}

	@Override
	public void registerCover(int y, int x, CoverTier tier, int durability, Feature feature)
	{
		Assert.assertTrue(durability > 0);
		_cover.put(new Location(y, x), new Cover(tier, durability, feature));
	}

	@Override
	public CoverTier getCover(int y, int x, Feature terrain)
	{
		Cover cover = _cover.get(new Location(y, x));
		return (null != cover)
				? cover.tier()
				: CoverTier.forFeature(terrain)
		;
	}

	@Override
	public void resetCover()
	{
		_cover.clear();
	}

	@Override
	public void registerPatrol(int monsterId, PatrolType type, int homeY, int homeX)
	{
		Assert.assertTrue(_monsters.containsKey(monsterId));
		_patrols.put(monsterId, type);
	}

	@Override
	public void registerGuardPost(int monsterId, GuardPostType type, int postY, int postX)
	{
		Assert.assertTrue(_monsters.containsKey(monsterId));
		_guardPosts.put(monsterId, type);
	}

	@Override
	public void resetPatrols()
	{
		_patrols.clear();
		_guardPosts.clear();
	}

	/**
	 * @return The monster with the given id, or null if there is none.
	 */
	public Monster getMonster(int id)
	{
		return _monsters.get(id);
	}

	/**
	 * @return The object with the given id, or null if there is none.
	 */
	public Item getObject(int id)
	{
		return _objects.get(id);
	}

	public List<Generator> getGenerators()
	{
		return Collections.unmodifiableList(_generators);
	}

	public int getCoverCount()
	{
		return _cover.size();
	}

	public PatrolType getPatrol(int monsterId)
	{
		return _patrols.get(monsterId);
	}

	public GuardPostType getGuardPost(int monsterId)
	{
		return _guardPosts.get(monsterId);
	}


	private int _addMonster(CaveGrid grid, int y, int x, int race, char glyph, int flags)
	{
		int id = CaveGrid.NO_ENTITY;
		boolean isDuplicate = (0 != (flags & MON_JUST_ONE)) && (CaveGrid.NO_ENTITY != findMonsterByRace(race));
		if (!isDuplicate
				&& (_monsters.size() < _monsterCapacity)
				&& grid.inBounds(y, x)
				&& grid.isEmpty(y, x)
		)
		{
			id = _nextId;
			_nextId += 1;
			_monsters.put(id, new Monster(id, race, glyph, flags, y, x));
			grid.setMonster(y, x, id);
		}
		return id;
	}

	private int _addObject(CaveGrid grid, int y, int x, int level, ObjectQuality quality, char glyph)
	{
		int id = CaveGrid.NO_ENTITY;
		if ((_objects.size() < _objectCapacity)
				&& grid.inBounds(y, x)
				&& (CaveGrid.NO_ENTITY == grid.getObject(y, x))
		)
		{
			id = _nextId;
			_nextId += 1;
			_objects.put(id, new Item(id, level, quality, glyph));
			grid.setObject(y, x, id);
		}
		return id;
	}


	/**
	 * A placed monster.  Position, health and temper change after placement.
	 */
	public static final class Monster
	{
		public final int id;
		public final int race;
		public final char glyph;
		public int flags;
		public int y;
		public int x;
		public int hp;
		public int maxHp;
		public boolean enraged;

		private Monster(int id, int race, char glyph, int flags, int y, int x)
		{
			this.id = id;
			this.race = race;
			this.glyph = glyph;
			this.flags = flags;
			this.y = y;
			this.x = x;
		}
	}

	/**
	 * A placed object.
	 */
	public static record Item(int id
			, int level
			, ObjectQuality quality
			, char glyph
	)
	{}

	/**
	 * A monster generator placed by a vault.
	 */
	public static record Generator(int y
			, int x
			, int race
	)
	{}

	private static record Cover(CoverTier tier
			, int durability
			, Feature feature
	)
	{}
}
