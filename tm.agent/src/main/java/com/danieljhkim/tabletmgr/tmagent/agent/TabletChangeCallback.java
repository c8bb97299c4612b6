package com.danieljhkim.tabletmgr.tmagent.agent;

import com.danieljhkim.tabletmgr.tmcommon.topo.Tablet;

/**
 * Reacts to a change of the tablet record, typically by starting or stopping the services that depend on it.
 */
@FunctionalInterface
public interface TabletChangeCallback {

	/**
	 * @param oldTablet
	 *            the record before the change, {@link Tablet#EMPTY} on startup
	 * @param newTablet
	 *            the record now cached by the agent
	 */
	void onTabletChange(Tablet oldTablet, Tablet newTablet);
}
