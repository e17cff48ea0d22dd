package com.jeffdisher.delve.worldgen;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.GenerationMode;


public class TestVaultStamper
{
	@Test
	public void dungeonVaultIsProtected() throws Throwable
	{
		VaultRecord vault = _vault(VaultType.LESSER
				, "%%%%%" + "%.<.%" + "%%%%%"
				, "     " + " 0 @ " + "     "
		);
		GenerationContext context = ContextBuilder.dungeon(10).seed(3L).finish();
		CaveGrid grid = context.grid;
		VaultStamper.stamp(context, 20, 40, vault);

		// Centred on (20, 40) so the top-left corner is (19, 38).
		Assert.assertEquals(Feature.WALL_OUTER, grid.getFeature(19, 38));
		Assert.assertEquals(Feature.LESS, grid.getFeature(20, 40));
		Assert.assertEquals(Feature.FLOOR, grid.getFeature(20, 39));
		Assert.assertTrue(grid.hasFlag(20, 39, CellFlags.ICKY));
		Assert.assertTrue(grid.hasFlag(20, 39, CellFlags.ROOM));
		Assert.assertEquals(Feature.WALL_EXTRA, grid.getFeature(18, 38));

		int monster = grid.getMonster(20, 39);
		Assert.assertNotEquals(CaveGrid.NO_ENTITY, monster);
		Assert.assertEquals(monster, context.allocator.findMonsterByRace(33));
		Assert.assertTrue(grid.hasPlayer());
		Assert.assertEquals(20, grid.getPlayerY());
		Assert.assertEquals(41, grid.getPlayerX());
	}

	@Test
	public void townVaultIsOpen() throws Throwable
	{
		VaultRecord vault = _vault(VaultType.TOWN
				, "....." + ".3.a." + "....."
				, "     " + "     " + "     "
		);
		LevelRequest request = new LevelRequest(GenerationMode.TOWN, 0, 0L, 0L, 0, 0, null, 0, null, LevelRequest.PendingArrivals.NONE);
		GenerationContext context = ContextBuilder.forRequest(request).seed(3L).finish();
		CaveGrid grid = context.grid;
		VaultStamper.stamp(context, 10, 10, vault);

		Assert.assertEquals(Feature.SHOP, grid.getFeature(10, 9));
		Assert.assertEquals(3, grid.getVariant(10, 9));
		Assert.assertEquals(Feature.BUILDING, grid.getFeature(10, 11));
		Assert.assertFalse(grid.hasFlag(10, 10, CellFlags.ICKY));
	}

	@Test
	public void blanksLeaveTheGridAlone() throws Throwable
	{
		VaultRecord vault = _vault(VaultType.LESSER
				, "  -  " + "  .  " + "  -  "
				, "     " + "     " + "     "
		);
		GenerationContext context = ContextBuilder.dungeon(10).seed(3L).finish();
		CaveGrid grid = context.grid;
		VaultStamper.stamp(context, 20, 40, vault);
		Assert.assertEquals(Feature.FLOOR, grid.getFeature(20, 40));
		Assert.assertEquals(Feature.WALL_EXTRA, grid.getFeature(19, 40));
		Assert.assertEquals(Feature.WALL_EXTRA, grid.getFeature(20, 39));
		Assert.assertEquals(0, grid.getFlags(20, 39));
	}


	private static VaultRecord _vault(VaultType type, String terrain, String contents)
	{
		return new VaultRecord("test", type, 0, 5, 3, terrain.toCharArray(), contents.toCharArray(), new int[] { 33 }, VaultRecord.Background.PERM);
	}
}
