package com.danieljhkim.tabletmgr.tmagent.binlog;

/**
 * Control handle on the binlog players replicating filtered data into this tablet.
 */
public interface BinlogPlayerController {

	/**
	 * Stops every running player and forgets their configuration.
	 */
	void stopAllPlayersAndReset();
}
