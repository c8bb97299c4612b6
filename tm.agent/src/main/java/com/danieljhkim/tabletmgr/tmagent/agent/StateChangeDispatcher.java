package com.danieljhkim.tabletmgr.tmagent.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.danieljhkim.tabletmgr.tmagent.state.TabletStateStore;
import com.danieljhkim.tabletmgr.tmcommon.topo.Tablet;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletInfo;

/**
 * Runs the registered {@link TabletChangeCallback} with the previous record and the record currently cached.
 *
 * <p>
 * The new record is taken from the state store once, at the start of the dispatch, so the callback works on one
 * coherent value even if the cache moves on while it runs. Dispatches are serialized by the action lock held by
 * every caller.
 */
public class StateChangeDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(StateChangeDispatcher.class);

	private final TabletStateStore stateStore;
	private final TabletChangeCallback callback;

	public StateChangeDispatcher(TabletStateStore stateStore, TabletChangeCallback callback) {
		this.stateStore = stateStore;
		this.callback = callback;
	}

	/**
	 * Invokes the callback once. Exceptions thrown by the callback propagate to the caller.
	 */
	public void updateState(Tablet oldTablet, String reason) {
		TabletInfo current = stateStore.getTablet();
		if (current == null) {
			throw new IllegalStateException("no cached tablet to dispatch a state change for");
		}
		logger.info("Running tablet callback because: {}", reason);
		callback.onTabletChange(oldTablet == null ? Tablet.EMPTY : oldTablet, current.tablet());
	}
}
