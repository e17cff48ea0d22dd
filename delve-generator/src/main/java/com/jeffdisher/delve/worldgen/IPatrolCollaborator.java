package com.jeffdisher.delve.worldgen;

import com.jeffdisher.delve.types.GuardPostType;
import com.jeffdisher.delve.types.PatrolType;


/**
 * Receives the AI behaviour chosen for monsters placed by the tactical rooms.  Generation only registers behaviour,
 * it never runs it.
 */
public interface IPatrolCollaborator
{
	void registerPatrol(int monsterId, PatrolType type, int homeY, int homeX);

	void registerGuardPost(int monsterId, GuardPostType type, int postY, int postX);

	/**
	 * Forgets all patrols and guard posts.
	 */
	void resetPatrols();
}
