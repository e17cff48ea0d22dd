package com.jeffdisher.delve.data;

import com.jeffdisher.delve.utils.Assert;


/**
 * The coarse room-occupancy bitmap.  The level is split into square blocks and every room or sector reserves the
 * blocks it covers.  A block can only ever be reserved once.
 */
public class BlockOccupancy
{
	public static final int BLOCK_HEIGHT = 11;
	public static final int BLOCK_WIDTH = 11;

	public final int rows;
	public final int columns;
	private final boolean[][] _reserved;

	public BlockOccupancy(int gridHeight, int gridWidth)
	{
		this.rows = gridHeight / BLOCK_HEIGHT;
		this.columns = gridWidth / BLOCK_WIDTH;
		Assert.assertTrue(this.rows > 0);
		Assert.assertTrue(this.columns > 0);
		_reserved = new boolean[this.rows][this.columns];
	}

	/**
	 * @return True if the inclusive block rectangle lies within the block grid.
	 */
	public boolean isInside(int y1, int x1, int y2, int x2)
	{
		return (y1 >= 0) && (y2 < this.rows) && (x1 >= 0) && (x2 < this.columns) && (y1 <= y2) && (x1 <= x2);
	}

	/**
	 * @return True if no block in the inclusive rectangle is reserved.  The rectangle must be inside the grid.
	 */
	public boolean isFree(int y1, int x1, int y2, int x2)
	{
		Assert.assertTrue(isInside(y1, x1, y2, x2));
		boolean isFree = true;
		for (int y = y1; isFree && (y <= y2); ++y)
		{
			for (int x = x1; isFree && (x <= x2); ++x)
			{
				isFree = !_reserved[y][x];
			}
		}
		return isFree;
	}

	public boolean isReserved(int y, int x)
	{
		return _reserved[y][x];
	}

	/**
	 * Reserves every block in the inclusive rectangle.  All of them must currently be free.
	 */
	public void reserve(int y1, int x1, int y2, int x2)
	{
		Assert.assertTrue(isFree(y1, x1, y2, x2));
		for (int y = y1; y <= y2; ++y)
		{
			for (int x = x1; x <= x2; ++x)
			{
				_reserved[y][x] = true;
			}
		}
	}
}
