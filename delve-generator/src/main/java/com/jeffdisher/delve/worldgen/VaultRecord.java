package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.utils.Assert;


/**
 * A decoded vault template.  Both layers are stored decoded, one symbol per cell in row-major order.
 */
public class VaultRecord
{
	/**
	 * What a quest level is filled with around its vault.
	 */
	public static enum Background
	{
		PERM,
		WILD,
		FOG,
	}

	public final String name;
	public final VaultType type;
	public final int rating;
	public final int width;
	public final int height;
	private final char[] _terrain;
	private final char[] _contents;
	private final int[] _monsterSlots;
	public final Background background;

	public VaultRecord(String name
			, VaultType type
			, int rating
			, int width
			, int height
			, char[] terrain
			, char[] contents
			, int[] monsterSlots
			, Background background
	)
	{
		Assert.assertTrue((width * height) == terrain.length);
		Assert.assertTrue((width * height) == contents.length);
		this.name = name;
		this.type = type;
		this.rating = rating;
		this.width = width;
		this.height = height;
		_terrain = terrain;
		_contents = contents;
		_monsterSlots = monsterSlots;
		this.background = background;
	}

	public char getTerrain(int row, int column)
	{
		return _terrain[_index(row, column)];
	}

	public char getContents(int row, int column)
	{
		return _contents[_index(row, column)];
	}

	/**
	 * @return The race in the given monster slot, or 0 if that slot is empty.
	 */
	public int getMonsterSlot(int slot)
	{
		return (slot < _monsterSlots.length)
				? _monsterSlots[slot]
				: 0
		;
	}


	private int _index(int row, int column)
	{
		Assert.assertInGrid(this.height, this.width, row, column);
		return (row * this.width) + column;
	}
}
