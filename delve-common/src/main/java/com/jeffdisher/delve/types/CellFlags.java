package com.jeffdisher.delve.types;


/**
 * The bit flags stored per cell.
 */
public class CellFlags
{
	/**
	 * Part of a room (tunnels pass through, corridor-only allocation skips it).
	 */
	public static final int ROOM = 0x01;
	/**
	 * Vault-protected:  tunnels, streamers and teleports leave these cells alone.
	 */
	public static final int ICKY = 0x02;
	/**
	 * Permanently lit.
	 */
	public static final int GLOW = 0x04;
	/**
	 * Remembered by the player.
	 */
	public static final int MARK = 0x08;

	public static final int ALL = ROOM | ICKY | GLOW | MARK;
}
