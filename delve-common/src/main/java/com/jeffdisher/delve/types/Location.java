package com.jeffdisher.delve.types;


/**
 * A cell location in the level grid.  Note that the row comes first, matching how the grid is addressed everywhere.
 */
public record Location(int y
		, int x
)
{
	public Location getRelative(int dy, int dx)
	{
		return new Location(this.y + dy, this.x + dx);
	}

	/**
	 * The classic roguelike distance approximation:  the longer axis plus half of the shorter axis.
	 * 
	 * @param other The other location.
	 * @return The approximate distance between the receiver and other.
	 */
	public int distance(Location other)
	{
		return distance(this.y, this.x, other.y, other.x);
	}

	public static int distance(int y1, int x1, int y2, int x2)
	{
		int dy = Math.abs(y1 - y2);
		int dx = Math.abs(x1 - x2);
		return (dy > dx)
				? (dy + (dx >> 1))
				: (dx + (dy >> 1))
		;
	}
}
