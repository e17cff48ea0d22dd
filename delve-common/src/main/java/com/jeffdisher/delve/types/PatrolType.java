package com.jeffdisher.delve.types;


/**
 * The movement pattern registered for a patrolling monster.
 */
public enum PatrolType
{
	CIRCUIT,
	BACK_AND_FORTH,
	RANDOM,
	STATIONARY,
}
