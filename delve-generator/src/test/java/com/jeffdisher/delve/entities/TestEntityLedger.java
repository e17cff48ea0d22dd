package com.jeffdisher.delve.entities;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CoverTier;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.GuardPostType;
import com.jeffdisher.delve.types.ObjectQuality;
import com.jeffdisher.delve.types.PatrolType;
import com.jeffdisher.delve.worldgen.IAllocationCollaborator;


public class TestEntityLedger
{
	@Test
	public void placeAndDelete() throws Throwable
	{
		CaveGrid grid = _floorGrid();
		EntityLedger ledger = new EntityLedger(10, 10);
		int monster = ledger.placeMonster(grid, 3, 3, 7, IAllocationCollaborator.MON_SLEEP);
		int object = ledger.placeObject(grid, 3, 4, 7, ObjectQuality.GOOD);
		Assert.assertEquals(1, monster);
		Assert.assertEquals(2, object);
		Assert.assertEquals(monster, grid.getMonster(3, 3));
		Assert.assertEquals(object, grid.getObject(3, 4));
		Assert.assertEquals(EntityLedger.LEVEL_RACE_BASE + 7, ledger.getMonster(monster).race);
		Assert.assertEquals(ObjectQuality.GOOD, ledger.getObject(object).quality());

		ledger.deleteMonster(grid, 3, 3);
		ledger.deleteObjects(grid, 3, 4);
		Assert.assertEquals(CaveGrid.NO_ENTITY, grid.getMonster(3, 3));
		Assert.assertEquals(CaveGrid.NO_ENTITY, grid.getObject(3, 4));
		Assert.assertEquals(0, ledger.getMonsterCount());
		Assert.assertEquals(0, ledger.getObjectCount());
		// Deleting an empty cell is fine.
		ledger.deleteMonster(grid, 3, 3);
	}

	@Test
	public void occupiedCellsAreRefused() throws Throwable
	{
		CaveGrid grid = _floorGrid();
		EntityLedger ledger = new EntityLedger(10, 10);
		Assert.assertNotEquals(CaveGrid.NO_ENTITY, ledger.placeMonster(grid, 2, 2, 1, 0));
		Assert.assertEquals(CaveGrid.NO_ENTITY, ledger.placeMonster(grid, 2, 2, 1, 0));
		Assert.assertNotEquals(CaveGrid.NO_ENTITY, ledger.placeGold(grid, 2, 3, 1));
		Assert.assertEquals(CaveGrid.NO_ENTITY, ledger.placeObject(grid, 2, 3, 1, ObjectQuality.PLAIN));
		grid.setFeature(5, 5, Feature.WALL_EXTRA);
		Assert.assertEquals(CaveGrid.NO_ENTITY, ledger.placeMonster(grid, 5, 5, 1, 0));
		Assert.assertEquals(CaveGrid.NO_ENTITY, ledger.placeMonster(grid, 50, 50, 1, 0));
	}

	@Test
	public void capacity() throws Throwable
	{
		CaveGrid grid = _floorGrid();
		EntityLedger ledger = new EntityLedger(2, 1);
		Assert.assertNotEquals(CaveGrid.NO_ENTITY, ledger.placeMonster(grid, 1, 1, 1, 0));
		Assert.assertNotEquals(CaveGrid.NO_ENTITY, ledger.placeMonster(grid, 1, 2, 1, 0));
		Assert.assertEquals(CaveGrid.NO_ENTITY, ledger.placeMonster(grid, 1, 3, 1, 0));
		Assert.assertNotEquals(CaveGrid.NO_ENTITY, ledger.placeObject(grid, 2, 1, 1, ObjectQuality.PLAIN));
		Assert.assertEquals(CaveGrid.NO_ENTITY, ledger.placeObject(grid, 2, 2, 1, ObjectQuality.PLAIN));

		ledger.wipe();
		Assert.assertEquals(0, ledger.getMonsterCount());
		Assert.assertEquals(0, ledger.getObjectCount());
	}

	@Test
	public void justOne() throws Throwable
	{
		CaveGrid grid = _floorGrid();
		EntityLedger ledger = new EntityLedger(10, 10);
		int merchant = ledger.placeMonsterRace(grid, 1, 1, ledger.getMerchantRace(), IAllocationCollaborator.MON_JUST_ONE);
		Assert.assertNotEquals(CaveGrid.NO_ENTITY, merchant);
		Assert.assertEquals(CaveGrid.NO_ENTITY, ledger.placeMonsterRace(grid, 4, 4, ledger.getMerchantRace(), IAllocationCollaborator.MON_JUST_ONE));
		Assert.assertEquals(merchant, ledger.findMonsterByRace(ledger.getMerchantRace()));
		Assert.assertEquals(CaveGrid.NO_ENTITY, ledger.findMonsterByRace(ledger.getAncientRace()));
	}

	@Test
	public void moveHealAndEnrage() throws Throwable
	{
		CaveGrid grid = _floorGrid();
		EntityLedger ledger = new EntityLedger(10, 10);
		int id = ledger.placeMonsterRace(grid, 1, 1, ledger.getAncientRace(), IAllocationCollaborator.MON_SLEEP);
		ledger.moveMonster(grid, id, 6, 7);
		Assert.assertEquals(CaveGrid.NO_ENTITY, grid.getMonster(1, 1));
		Assert.assertEquals(id, grid.getMonster(6, 7));

		ledger.setMonsterHealth(id, 5, 20);
		ledger.enrageMonster(id);
		EntityLedger.Monster monster = ledger.getMonster(id);
		Assert.assertEquals(6, monster.y);
		Assert.assertEquals(7, monster.x);
		Assert.assertEquals(5, monster.hp);
		Assert.assertEquals(20, monster.maxHp);
		Assert.assertTrue(monster.enraged);
		Assert.assertEquals(0, monster.flags & IAllocationCollaborator.MON_SLEEP);
	}

	@Test
	public void coverFallsBackToTerrain() throws Throwable
	{
		EntityLedger ledger = new EntityLedger(10, 10);
		Assert.assertEquals(CoverTier.HEAVY, ledger.getCover(1, 1, Feature.WALL_OUTER));
		Assert.assertEquals(CoverTier.NONE, ledger.getCover(1, 1, Feature.FLOOR));
		ledger.registerCover(1, 1, CoverTier.MEDIUM, 30, Feature.CRATE);
		Assert.assertEquals(CoverTier.MEDIUM, ledger.getCover(1, 1, Feature.CRATE));
		Assert.assertEquals(1, ledger.getCoverCount());
		ledger.resetCover();
		Assert.assertEquals(CoverTier.LIGHT, ledger.getCover(1, 1, Feature.CRATE));
	}

	@Test
	public void patrolsFollowTheirMonster() throws Throwable
	{
		CaveGrid grid = _floorGrid();
		EntityLedger ledger = new EntityLedger(10, 10);
		int patroller = ledger.placeMonster(grid, 2, 2, 3, 0);
		int guard = ledger.placeMonster(grid, 4, 4, 3, 0);
		ledger.registerPatrol(patroller, PatrolType.CIRCUIT, 2, 2);
		ledger.registerGuardPost(guard, GuardPostType.DOOR, 4, 5);
		Assert.assertEquals(PatrolType.CIRCUIT, ledger.getPatrol(patroller));
		Assert.assertEquals(GuardPostType.DOOR, ledger.getGuardPost(guard));

		ledger.deleteMonster(grid, 2, 2);
		Assert.assertNull(ledger.getPatrol(patroller));
		ledger.resetPatrols();
		Assert.assertNull(ledger.getGuardPost(guard));
	}

	@Test(expected=AssertionError.class)
	public void patrolNeedsMonster() throws Throwable
	{
		EntityLedger ledger = new EntityLedger(10, 10);
		ledger.registerPatrol(42, PatrolType.RANDOM, 1, 1);
	}

	@Test
	public void trapKindsCycle() throws Throwable
	{
		EntityLedger ledger = new EntityLedger(10, 10);
		for (int i = 0; i < 40; ++i)
		{
			int kind = ledger.chooseTrapKind(30);
			Assert.assertTrue(kind >= 0);
			Assert.assertTrue(kind < EntityLedger.TRAP_KINDS);
		}
	}


	private static CaveGrid _floorGrid()
	{
		CaveGrid grid = new CaveGrid(10, 10);
		grid.wipe(Feature.FLOOR);
		return grid;
	}
}
