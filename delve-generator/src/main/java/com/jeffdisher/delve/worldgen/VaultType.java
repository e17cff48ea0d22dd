package com.jeffdisher.delve.worldgen;


/**
 * The vault kinds, keyed by the numeric tag used in the template file.
 */
public enum VaultType
{
	LESSER(7),
	GREATER(8),
	THEMED(9),
	TOWN(10),
	STORE(11),
	ARENA(12),
	WILDERNESS(13),
	QUEST(99),
	;

	public final int tag;

	private VaultType(int tag)
	{
		this.tag = tag;
	}

	/**
	 * @return The type with the given tag, or null if there isn't one.
	 */
	public static VaultType fromTag(int tag)
	{
		VaultType match = null;
		for (VaultType type : values())
		{
			if (tag == type.tag)
			{
				match = type;
				break;
			}
		}
		return match;
	}

	/**
	 * @return True for the kinds stamped with town semantics (numbered shops, unprotected cells, arena opponents).
	 */
	public boolean isTownKind()
	{
		return (TOWN == this) || (STORE == this) || (ARENA == this);
	}
}
