package com.jeffdisher.delve.types;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;

import com.jeffdisher.delve.utils.Assert;


/**
 * A container of the options which shape level generation.
 * WARNING:  This is a shared mutable instance so care must be taken when modifying fields (marked volatile to make
 * this clear).
 */
public class LevelConfig
{
	/**
	 * The height of the level grid, in cells.  Must leave room for at least one 11x11 room block.
	 */
	public static final String KEY_DUNGEON_HEIGHT = "dungeon_height";
	public volatile int dungeonHeight;

	/**
	 * The width of the level grid, in cells.
	 */
	public static final String KEY_DUNGEON_WIDTH = "dungeon_width";
	public volatile int dungeonWidth;

	/**
	 * The deepest level which exists.  The last level only has up staircases.
	 */
	public static final String KEY_MAX_DEPTH = "max_depth";
	public volatile int maxDepth;

	/**
	 * When true, levels judged boring (by the thresholds below) are thrown away and regenerated.
	 */
	public static final String KEY_REJECT_BORING_LEVELS = "reject_boring_levels";
	public volatile boolean rejectBoringLevels;

	/**
	 * The boring-level bands, written as comma-separated "depth:feeling" pairs.  A level at or below the given depth
	 * whose feeling is greater than the given value is boring.  The bands are not required to be monotonic.
	 */
	public static final String KEY_BORING_THRESHOLDS = "boring_thresholds";
	public static final String DEFAULT_BORING_THRESHOLDS = "0:9,5:8,10:7,20:6,40:5";
	public volatile BoringThreshold[] boringThresholds;

	/**
	 * After this many attempts, the next generated level is accepted regardless of how boring it is.
	 */
	public static final String KEY_FORCED_ACCEPT_ATTEMPTS = "forced_accept_attempts";
	public volatile int forcedAcceptAttempts;

	/**
	 * The capacity of the object table.  A level which fills it is regenerated.
	 */
	public static final String KEY_MAX_OBJECTS = "max_objects";
	public volatile int maxObjects;

	/**
	 * The capacity of the monster table.  A level which fills it is regenerated.
	 */
	public static final String KEY_MAX_MONSTERS = "max_monsters";
	public volatile int maxMonsters;

	/**
	 * Allows open levels (lit caverns, flooded or fogged levels) and the unusual room kinds.
	 */
	public static final String KEY_ALLOW_WEIRD_LEVELS = "allow_weird_levels";
	public volatile boolean allowWeirdLevels;

	/**
	 * Halves the chance of open levels and most themed vaults.
	 */
	public static final String KEY_RARE_WEIRDNESS = "rare_weirdness";
	public volatile boolean rareWeirdness;

	/**
	 * Nudges room anchors onto every third block so rooms line up.
	 */
	public static final String KEY_ALIGN_ROOMS = "align_rooms";
	public volatile boolean alignRooms;

	/**
	 * The seed of the wilderness.  Wilderness regions are hashed from this so they regenerate identically.
	 */
	public static final String KEY_WILDERNESS_SEED = "wilderness_seed";
	public volatile int wildernessSeed;

	/**
	 * When non-zero, dungeon levels are generated in hashed mode from this plus the depth, making them persistent.
	 */
	public static final String KEY_DUNGEON_SEED = "dungeon_seed";
	public volatile int dungeonSeed;

	/**
	 * Creates a level config with all default options.
	 */
	public LevelConfig()
	{
		this.dungeonHeight = 66;
		this.dungeonWidth = 198;
		this.maxDepth = 128;
		// Most players don't want the generator second-guessing them.
		this.rejectBoringLevels = false;
		this.boringThresholds = parseThresholds(DEFAULT_BORING_THRESHOLDS);
		this.forcedAcceptAttempts = 100;
		this.maxObjects = 1024;
		this.maxMonsters = 1024;
		this.allowWeirdLevels = true;
		this.rareWeirdness = false;
		this.alignRooms = true;
		// We default the wilderness seed to a random int.
		this.wildernessSeed = new Random().nextInt();
		this.dungeonSeed = 0;
	}

	public void loadOverrides(Map<String, String> overrides)
	{
		if (overrides.containsKey(KEY_DUNGEON_HEIGHT))
		{
			this.dungeonHeight = Integer.parseInt(overrides.get(KEY_DUNGEON_HEIGHT));
			Assert.assertTrue(this.dungeonHeight >= 22);
		}
		if (overrides.containsKey(KEY_DUNGEON_WIDTH))
		{
			this.dungeonWidth = Integer.parseInt(overrides.get(KEY_DUNGEON_WIDTH));
			Assert.assertTrue(this.dungeonWidth >= 44);
		}
		if (overrides.containsKey(KEY_MAX_DEPTH))
		{
			this.maxDepth = Integer.parseInt(overrides.get(KEY_MAX_DEPTH));
			Assert.assertTrue(this.maxDepth > 0);
		}
		if (overrides.containsKey(KEY_REJECT_BORING_LEVELS))
		{
			this.rejectBoringLevels = Boolean.parseBoolean(overrides.get(KEY_REJECT_BORING_LEVELS));
		}
		if (overrides.containsKey(KEY_BORING_THRESHOLDS))
		{
			this.boringThresholds = parseThresholds(overrides.get(KEY_BORING_THRESHOLDS));
		}
		if (overrides.containsKey(KEY_FORCED_ACCEPT_ATTEMPTS))
		{
			this.forcedAcceptAttempts = Integer.parseInt(overrides.get(KEY_FORCED_ACCEPT_ATTEMPTS));
			Assert.assertTrue(this.forcedAcceptAttempts > 0);
		}
		if (overrides.containsKey(KEY_MAX_OBJECTS))
		{
			this.maxObjects = Integer.parseInt(overrides.get(KEY_MAX_OBJECTS));
		}
		if (overrides.containsKey(KEY_MAX_MONSTERS))
		{
			this.maxMonsters = Integer.parseInt(overrides.get(KEY_MAX_MONSTERS));
		}
		if (overrides.containsKey(KEY_ALLOW_WEIRD_LEVELS))
		{
			this.allowWeirdLevels = Boolean.parseBoolean(overrides.get(KEY_ALLOW_WEIRD_LEVELS));
		}
		if (overrides.containsKey(KEY_RARE_WEIRDNESS))
		{
			this.rareWeirdness = Boolean.parseBoolean(overrides.get(KEY_RARE_WEIRDNESS));
		}
		if (overrides.containsKey(KEY_ALIGN_ROOMS))
		{
			this.alignRooms = Boolean.parseBoolean(overrides.get(KEY_ALIGN_ROOMS));
		}
		if (overrides.containsKey(KEY_WILDERNESS_SEED))
		{
			this.wildernessSeed = Integer.parseInt(overrides.get(KEY_WILDERNESS_SEED));
		}
		if (overrides.containsKey(KEY_DUNGEON_SEED))
		{
			this.dungeonSeed = Integer.parseInt(overrides.get(KEY_DUNGEON_SEED));
		}
	}

	public Map<String, String> getRawOptions()
	{
		Map<String, String> map = new HashMap<>();
		map.put(KEY_DUNGEON_HEIGHT, Integer.toString(this.dungeonHeight));
		map.put(KEY_DUNGEON_WIDTH, Integer.toString(this.dungeonWidth));
		map.put(KEY_MAX_DEPTH, Integer.toString(this.maxDepth));
		map.put(KEY_REJECT_BORING_LEVELS, Boolean.toString(this.rejectBoringLevels));
		map.put(KEY_BORING_THRESHOLDS, _describeThresholds(this.boringThresholds));
		map.put(KEY_FORCED_ACCEPT_ATTEMPTS, Integer.toString(this.forcedAcceptAttempts));
		map.put(KEY_MAX_OBJECTS, Integer.toString(this.maxObjects));
		map.put(KEY_MAX_MONSTERS, Integer.toString(this.maxMonsters));
		map.put(KEY_ALLOW_WEIRD_LEVELS, Boolean.toString(this.allowWeirdLevels));
		map.put(KEY_RARE_WEIRDNESS, Boolean.toString(this.rareWeirdness));
		map.put(KEY_ALIGN_ROOMS, Boolean.toString(this.alignRooms));
		map.put(KEY_WILDERNESS_SEED, Integer.toString(this.wildernessSeed));
		map.put(KEY_DUNGEON_SEED, Integer.toString(this.dungeonSeed));
		return Collections.unmodifiableMap(map);
	}

	/**
	 * Checks a level feeling against the boring-level bands.  Every band is checked independently, exactly as written.
	 * 
	 * @param depth The depth of the level.
	 * @param feeling The level feeling (lower is more interesting).
	 * @return True if some band considers this level boring.
	 */
	public boolean isBoring(int depth, int feeling)
	{
		boolean isBoring = false;
		for (BoringThreshold threshold : this.boringThresholds)
		{
			if ((depth >= threshold.minDepth()) && (feeling > threshold.maxFeeling()))
			{
				isBoring = true;
				break;
			}
		}
		return isBoring;
	}

	/**
	 * Parses a list of comma-separated "depth:feeling" pairs.
	 * 
	 * @param raw The raw string.
	 * @return The parsed thresholds, in the order given.
	 */
	public static BoringThreshold[] parseThresholds(String raw)
	{
		String[] pairs = raw.split(",");
		BoringThreshold[] thresholds = new BoringThreshold[pairs.length];
		for (int i = 0; i < pairs.length; ++i)
		{
			String[] parts = pairs[i].trim().split(":");
			if (2 != parts.length)
			{
				throw new IllegalArgumentException("Boring threshold must be \"depth:feeling\": \"" + pairs[i] + "\"");
			}
			thresholds[i] = new BoringThreshold(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()));
		}
		return thresholds;
	}


	private static String _describeThresholds(BoringThreshold[] thresholds)
	{
		StringBuilder builder = new StringBuilder();
		for (BoringThreshold threshold : thresholds)
		{
			if (builder.length() > 0)
			{
				builder.append(",");
			}
			builder.append(threshold.minDepth()).append(":").append(threshold.maxFeeling());
		}
		return builder.toString();
	}


	/**
	 * One boring-level band:  at minDepth or deeper, a feeling above maxFeeling is boring.
	 */
	public static record BoringThreshold(int minDepth
			, int maxFeeling
	)
	{}
}
