package com.jeffdisher.delve.data;

import java.util.Arrays;

import com.jeffdisher.delve.types.Elevation;
import com.jeffdisher.delve.types.Feature;
import com.jeffdisher.delve.types.SectorType;
import com.jeffdisher.delve.utils.Assert;


/**
 * The mutable level grid.  Each cell has a feature, a feature variant (door lock strength, altar deity, shop number,
 * rune index), flag bits (see CellFlags), an elevation tier, a sector tag, and the ids of the monster and object placed
 * there (0 means none).
 * Addressing is always (y, x), row first.
 */
public class CaveGrid
{
	public static final int NO_ENTITY = 0;

	public final int height;
	public final int width;
	private final Feature[] _features;
	private final byte[] _variants;
	private final byte[] _flags;
	private final Elevation[] _elevations;
	private final SectorType[] _sectors;
	private final int[] _monsters;
	private final int[] _objects;
	private int _playerY;
	private int _playerX;

	public CaveGrid(int height, int width)
	{
		Assert.assertTrue(height > 2);
		Assert.assertTrue(width > 2);
		this.height = height;
		this.width = width;
		int size = height * width;
		_features = new Feature[size];
		_variants = new byte[size];
		_flags = new byte[size];
		_elevations = new Elevation[size];
		_sectors = new SectorType[size];
		_monsters = new int[size];
		_objects = new int[size];
		wipe(Feature.WALL_EXTRA);
	}

	/**
	 * Resets every cell to the given feature with no flags, ground elevation, the default sector and no entities.
	 * 
	 * @param background The feature to fill the grid with.
	 */
	public void wipe(Feature background)
	{
		Arrays.fill(_features, background);
		Arrays.fill(_variants, (byte)0);
		Arrays.fill(_flags, (byte)0);
		Arrays.fill(_elevations, Elevation.GROUND);
		Arrays.fill(_sectors, SectorType.RUINS);
		Arrays.fill(_monsters, NO_ENTITY);
		Arrays.fill(_objects, NO_ENTITY);
		_playerY = -1;
		_playerX = -1;
	}

	public boolean inBounds(int y, int x)
	{
		return (y >= 0) && (y < this.height) && (x >= 0) && (x < this.width);
	}

	/**
	 * @return True if the cell is in bounds and not on the outer edge of the grid.
	 */
	public boolean inBoundsFully(int y, int x)
	{
		return (y > 0) && (y < (this.height - 1)) && (x > 0) && (x < (this.width - 1));
	}

	public Feature getFeature(int y, int x)
	{
		return _features[_index(y, x)];
	}

	/**
	 * Sets the feature of a cell, clearing any previous variant.
	 */
	public void setFeature(int y, int x, Feature feature)
	{
		setFeature(y, x, feature, 0);
	}

	public void setFeature(int y, int x, Feature feature, int variant)
	{
		Assert.assertTrue(null != feature);
		Assert.assertTrue((variant >= 0) && (variant <= Byte.MAX_VALUE));
		int index = _index(y, x);
		_features[index] = feature;
		_variants[index] = (byte)variant;
	}

	public int getVariant(int y, int x)
	{
		return _variants[_index(y, x)];
	}

	public int getFlags(int y, int x)
	{
		return _flags[_index(y, x)];
	}

	public boolean hasFlag(int y, int x, int flag)
	{
		return 0 != (_flags[_index(y, x)] & flag);
	}

	public void addFlags(int y, int x, int flags)
	{
		int index = _index(y, x);
		_flags[index] = (byte)(_flags[index] | flags);
	}

	public void clearFlags(int y, int x, int flags)
	{
		int index = _index(y, x);
		_flags[index] = (byte)(_flags[index] & ~flags);
	}

	public Elevation getElevation(int y, int x)
	{
		return _elevations[_index(y, x)];
	}

	public void setElevation(int y, int x, Elevation elevation)
	{
		_elevations[_index(y, x)] = elevation;
	}

	public SectorType getSector(int y, int x)
	{
		return _sectors[_index(y, x)];
	}

	public void setSector(int y, int x, SectorType sector)
	{
		_sectors[_index(y, x)] = sector;
	}

	public int getMonster(int y, int x)
	{
		return _monsters[_index(y, x)];
	}

	public void setMonster(int y, int x, int monsterId)
	{
		_monsters[_index(y, x)] = monsterId;
	}

	public int getObject(int y, int x)
	{
		return _objects[_index(y, x)];
	}

	public void setObject(int y, int x, int objectId)
	{
		_objects[_index(y, x)] = objectId;
	}

	public void setPlayer(int y, int x)
	{
		Assert.assertInGrid(this.height, this.width, y, x);
		_playerY = y;
		_playerX = x;
	}

	public boolean hasPlayer()
	{
		return _playerY >= 0;
	}

	public int getPlayerY()
	{
		return _playerY;
	}

	public int getPlayerX()
	{
		return _playerX;
	}

	/**
	 * @return True if the cell is open ground (see Feature.isOpen()).
	 */
	public boolean isOpen(int y, int x)
	{
		return _features[_index(y, x)].isOpen();
	}

	/**
	 * @return True if the cell is plain ground (floor or grass) with no object on it.
	 */
	public boolean isClean(int y, int x)
	{
		int index = _index(y, x);
		return _features[index].isPlainGround() && (NO_ENTITY == _objects[index]);
	}

	/**
	 * @return True if the cell is plain ground (floor or grass) with no object, monster or player on it.
	 */
	public boolean isNaked(int y, int x)
	{
		int index = _index(y, x);
		return _features[index].isPlainGround()
				&& (NO_ENTITY == _objects[index])
				&& (NO_ENTITY == _monsters[index])
				&& !_isPlayer(y, x)
		;
	}

	/**
	 * @return True if the cell is open ground with no monster or player on it.
	 */
	public boolean isEmpty(int y, int x)
	{
		int index = _index(y, x);
		return _features[index].isOpen()
				&& (NO_ENTITY == _monsters[index])
				&& !_isPlayer(y, x)
		;
	}

	/**
	 * @return True if the cell may be destroyed (it is not permanent rock).
	 */
	public boolean isValid(int y, int x)
	{
		return !_features[_index(y, x)].isPermanent();
	}

	/**
	 * Counts the granite or permanent rock cells among the 4 cardinal neighbours.  The cell must be fully in bounds.
	 */
	public int countAdjacentRock(int y, int x)
	{
		int count = 0;
		if (getFeature(y + 1, x).isRock())
		{
			count += 1;
		}
		if (getFeature(y - 1, x).isRock())
		{
			count += 1;
		}
		if (getFeature(y, x + 1).isRock())
		{
			count += 1;
		}
		if (getFeature(y, x - 1).isRock())
		{
			count += 1;
		}
		return count;
	}

	/**
	 * Renders the feature layer as text, one line per row.  Only useful for debugging and tests.
	 */
	public String render()
	{
		StringBuilder builder = new StringBuilder();
		for (int y = 0; y < this.height; ++y)
		{
			for (int x = 0; x < this.width; ++x)
			{
				char c;
				if (_isPlayer(y, x))
				{
					c = '@';
				}
				else if (NO_ENTITY != _monsters[_index(y, x)])
				{
					c = 'm';
				}
				else if (NO_ENTITY != _objects[_index(y, x)])
				{
					c = '$';
				}
				else
				{
					c = getFeature(y, x).glyph;
				}
				builder.append(c);
			}
			builder.append('\n');
		}
		return builder.toString();
	}


	private boolean _isPlayer(int y, int x)
	{
		return (y == _playerY) && (x == _playerX);
	}

	private int _index(int y, int x)
	{
		Assert.assertInGrid(this.height, this.width, y, x);
		return (y * this.width) + x;
	}
}
