package com.jeffdisher.delve.types;


/**
 * What random allocation places.
 */
public enum AllocationType
{
	RUBBLE,
	TRAP,
	OBJECT,
	ALTAR,
}
