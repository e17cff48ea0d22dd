package com.jeffdisher.delve.types;


/**
 * The kind of level being generated.  Everything other than DUNGEON and DREAM is a "special" level.
 */
public enum GenerationMode
{
	DUNGEON,
	DREAM,
	WILDERNESS,
	TOWN,
	STORE,
	ARENA,
	QUEST,
	;

	public boolean isSpecial()
	{
		return (DUNGEON != this) && (DREAM != this);
	}
}
