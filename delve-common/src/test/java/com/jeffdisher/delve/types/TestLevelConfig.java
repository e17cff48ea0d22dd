package com.jeffdisher.delve.types;

import java.util.Map;

import org.junit.Assert;
import org.junit.Test;


public class TestLevelConfig
{
	@Test
	public void defaults() throws Throwable
	{
		LevelConfig config = new LevelConfig();
		Assert.assertEquals(66, config.dungeonHeight);
		Assert.assertEquals(198, config.dungeonWidth);
		Assert.assertFalse(config.rejectBoringLevels);
		Assert.assertEquals(100, config.forcedAcceptAttempts);
		Assert.assertEquals(5, config.boringThresholds.length);
		Assert.assertEquals(0, config.dungeonSeed);
	}

	@Test
	public void boringBands() throws Throwable
	{
		LevelConfig config = new LevelConfig();
		// Surface levels are only boring at the very bottom of the scale.
		Assert.assertTrue(config.isBoring(0, 10));
		Assert.assertFalse(config.isBoring(0, 9));
		Assert.assertFalse(config.isBoring(4, 9));
		Assert.assertTrue(config.isBoring(5, 9));
		Assert.assertFalse(config.isBoring(19, 7));
		Assert.assertTrue(config.isBoring(20, 7));
		Assert.assertTrue(config.isBoring(40, 6));
		Assert.assertFalse(config.isBoring(40, 5));

		// A shallower band still applies once a deeper one is reached.
		config.boringThresholds = LevelConfig.parseThresholds("0:9,10:2,20:8");
		Assert.assertTrue(config.isBoring(25, 5));
		Assert.assertFalse(config.isBoring(5, 5));
	}

	@Test
	public void overridesRoundTrip() throws Throwable
	{
		LevelConfig config = new LevelConfig();
		config.loadOverrides(Map.of(LevelConfig.KEY_REJECT_BORING_LEVELS, "true"
				, LevelConfig.KEY_BORING_THRESHOLDS, "3:4, 8:2"
				, LevelConfig.KEY_DUNGEON_SEED, "77"
				, LevelConfig.KEY_ALIGN_ROOMS, "false"
		));
		Assert.assertTrue(config.rejectBoringLevels);
		Assert.assertEquals(77, config.dungeonSeed);
		Assert.assertFalse(config.alignRooms);
		Assert.assertTrue(config.isBoring(3, 5));
		Assert.assertFalse(config.isBoring(2, 10));

		Map<String, String> raw = config.getRawOptions();
		Assert.assertEquals("3:4,8:2", raw.get(LevelConfig.KEY_BORING_THRESHOLDS));
		Assert.assertEquals("77", raw.get(LevelConfig.KEY_DUNGEON_SEED));

		LevelConfig copy = new LevelConfig();
		copy.loadOverrides(raw);
		Assert.assertEquals(raw, copy.getRawOptions());
	}

	@Test(expected=IllegalArgumentException.class)
	public void badThreshold() throws Throwable
	{
		LevelConfig.parseThresholds("5");
	}

	@Test(expected=NumberFormatException.class)
	public void badNumber() throws Throwable
	{
		new LevelConfig().loadOverrides(Map.of(LevelConfig.KEY_MAX_OBJECTS, "many"));
	}
}
