package com.jeffdisher.delve.types;


/**
 * Where random allocation may place something.
 */
public enum AllocationSet
{
	CORRIDOR,
	ROOM,
	BOTH,
	;

	public boolean allows(boolean isRoom)
	{
		return (BOTH == this)
				|| ((ROOM == this) && isRoom)
				|| ((CORRIDOR == this) && !isRoom)
		;
	}
}
