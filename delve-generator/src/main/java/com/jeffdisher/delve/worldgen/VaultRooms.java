package com.jeffdisher.delve.worldgen;


/**
 * Rooms which are hand-authored vaults chosen at random from the loaded table.
 */
public class VaultRooms
{
	public static boolean build(GenerationContext context, int yval, int xval, VaultType type)
	{
		VaultRecord vault = context.vaults.pickRandom(context.random, type);
		boolean built = false;
		if (null != vault)
		{
			context.rating += vault.rating;
			int excess = context.depth - 40;
			if ((context.depth <= 50) || (context.random.roll(excess * excess + 1) < 400))
			{
				context.goodItemFlag = true;
			}
			VaultStamper.stamp(context, yval, xval, vault);
			built = true;
		}
		return built;
	}
}
