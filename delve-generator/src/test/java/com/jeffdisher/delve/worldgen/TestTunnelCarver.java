package com.jeffdisher.delve.worldgen;

import java.util.ArrayDeque;

import org.junit.Assert;
import org.junit.Test;

import com.jeffdisher.delve.data.CaveGrid;
import com.jeffdisher.delve.types.CellFlags;
import com.jeffdisher.delve.types.Feature;


public class TestTunnelCarver
{
	@Test
	public void directedConnects() throws Throwable
	{
		for (long seed = 1L; seed <= 10L; ++seed)
		{
			GenerationContext context = _graniteContext(seed);
			CaveGrid grid = context.grid;
			grid.setFeature(5, 5, Feature.FLOOR);
			grid.setFeature(50, 150, Feature.FLOOR);
			Assert.assertTrue(TunnelCarver.carveDirected(context, 5, 5, 50, 150));
			_assertJoined(grid, 5, 5, 50, 150);
		}
	}

	@Test
	public void windingConnects() throws Throwable
	{
		for (long seed = 1L; seed <= 10L; ++seed)
		{
			GenerationContext context = _graniteContext(seed);
			CaveGrid grid = context.grid;
			grid.setFeature(40, 20, Feature.FLOOR);
			grid.setFeature(10, 90, Feature.FLOOR);
			Assert.assertTrue(TunnelCarver.carveWinding(context, 40, 20, 10, 90));
			_assertJoined(grid, 40, 20, 10, 90);
		}
	}

	@Test
	public void abortLeavesGridUntouched() throws Throwable
	{
		GenerationContext context = _graniteContext(3L);
		CaveGrid grid = context.grid;
		grid.setFeature(5, 5, Feature.FLOOR);
		// The target is sealed inside solid walls which no corridor may enter.
		grid.setFeature(30, 100, Feature.FLOOR);
		for (int y = 29; y <= 31; ++y)
		{
			for (int x = 99; x <= 101; ++x)
			{
				if ((30 != y) || (100 != x))
				{
					grid.setFeature(y, x, Feature.WALL_SOLID);
				}
			}
		}
		String before = grid.render();
		Assert.assertFalse(TunnelCarver.carveDirected(context, 5, 5, 30, 100));
		Assert.assertEquals(before, grid.render());
		Assert.assertFalse(TunnelCarver.carveWinding(context, 5, 5, 30, 100));
		Assert.assertEquals(before, grid.render());
		Assert.assertTrue(context.doorCandidates.isEmpty());
	}

	@Test
	public void piercedWallTurnsNeighboursSolid() throws Throwable
	{
		for (long seed = 1L; seed <= 10L; ++seed)
		{
			GenerationContext context = _graniteContext(seed);
			CaveGrid grid = context.grid;
			RoomPainting.paintFloor(grid, 20, 30, 40, 60, false);
			RoomPainting.border(grid, 19, 29, 41, 61, Feature.WALL_OUTER);
			grid.setFeature(30, 10, Feature.FLOOR);
			Assert.assertTrue(TunnelCarver.carveDirected(context, 30, 10, 30, 45));
			Assert.assertTrue(grid.hasFlag(30, 45, CellFlags.ROOM));

			// Every entrance through the room wall has no outer wall left around it.
			int entrances = 0;
			for (int y = 19; y <= 41; ++y)
			{
				for (int x = 29; x <= 61; ++x)
				{
					boolean isRing = (19 == y) || (41 == y) || (29 == x) || (61 == x);
					Feature feature = grid.getFeature(y, x);
					if (isRing && (Feature.WALL_OUTER != feature) && (Feature.WALL_SOLID != feature))
					{
						entrances += 1;
						for (int dy = -1; dy <= 1; ++dy)
						{
							for (int dx = -1; dx <= 1; ++dx)
							{
								Assert.assertNotEquals(Feature.WALL_OUTER, grid.getFeature(y + dy, x + dx));
							}
						}
					}
				}
			}
			Assert.assertTrue(entrances >= 1);
		}
	}


	private static GenerationContext _graniteContext(long seed)
	{
		CaveGrid grid = new CaveGrid(66, 198);
		RoomPainting.border(grid, 0, 0, grid.height - 1, grid.width - 1, Feature.PERM_SOLID);
		return ContextBuilder.dungeon(1).grid(grid).seed(seed).finish();
	}

	private static void _assertJoined(CaveGrid grid, int y1, int x1, int y2, int x2)
	{
		// A 4-way flood fill over the walkable cells must reach the target from the start.
		boolean[][] seen = new boolean[grid.height][grid.width];
		ArrayDeque<int[]> queue = new ArrayDeque<>();
		seen[y1][x1] = true;
		queue.add(new int[] { y1, x1 });
		while (!queue.isEmpty())
		{
			int[] cell = queue.remove();
			int[][] steps = new int[][] { {1, 0}, {-1, 0}, {0, 1}, {0, -1} };
			for (int[] step : steps)
			{
				int y = cell[0] + step[0];
				int x = cell[1] + step[1];
				if (grid.inBounds(y, x) && !seen[y][x] && _isWalkable(grid.getFeature(y, x)))
				{
					seen[y][x] = true;
					queue.add(new int[] { y, x });
				}
			}
		}
		Assert.assertTrue(seen[y2][x2]);
	}

	private static boolean _isWalkable(Feature feature)
	{
		return feature.isOpen() || feature.isClosedDoor();
	}
}
