package com.danieljhkim.tabletmgr.tmagent.mysql;

/**
 * The local MySQL daemon, as far as the agent needs it.
 */
public interface MysqlDaemon {

	/**
	 * Asks the running daemon which port it listens on.
	 *
	 * @throws com.danieljhkim.tabletmgr.tmcommon.exception.MysqlDaemonException
	 *             if the daemon cannot be reached
	 */
	int getListeningPort();

	/**
	 * Releases connections to the daemon. The daemon itself keeps running.
	 */
	void close();
}
