package com.jeffdisher.delve.types;


/**
 * What a guard monster is posted to protect.
 */
public enum GuardPostType
{
	DOOR,
	HIGH_GROUND,
	TREASURE,
	ROOM,
}
