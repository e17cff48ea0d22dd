package com.jeffdisher.delve.types;


/**
 * The quality requested when asking for an object.
 */
public enum ObjectQuality
{
	PLAIN,
	GOOD,
	GREAT,
}
