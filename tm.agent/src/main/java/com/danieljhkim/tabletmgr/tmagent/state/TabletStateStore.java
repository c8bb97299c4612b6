package com.danieljhkim.tabletmgr.tmagent.state;

import java.util.Set;

import com.danieljhkim.tabletmgr.tmcommon.topo.TabletControl;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletInfo;

/**
 * Holder of the agent's cached tablet record, tablet control and latest health status.
 *
 * <p>
 * Every accessor holds {@code mutex} for the single read or write only. Nothing here ever calls out while
 * holding it, so it can be taken from any thread, including while the action lock is held. All values are
 * immutable, so returning them hands out a point-in-time snapshot.
 */
public class TabletStateStore {

	private final Object mutex = new Object();

	private TabletInfo tablet;
	private TabletControl tabletControl;
	private HealthStatus health = HealthStatus.notYetRun();

	public TabletInfo getTablet() {
		synchronized (mutex) {
			return tablet;
		}
	}

	public void setTablet(TabletInfo newTablet) {
		synchronized (mutex) {
			this.tablet = newTablet;
		}
	}

	public TabletControl getTabletControl() {
		synchronized (mutex) {
			return tabletControl;
		}
	}

	/**
	 * Replaces the tablet control as a whole; {@code null} clears it.
	 */
	public void setTabletControl(TabletControl newControl) {
		synchronized (mutex) {
			this.tabletControl = newControl;
		}
	}

	public Set<String> getBlacklistedTables() {
		synchronized (mutex) {
			return tabletControl == null ? Set.of() : tabletControl.blacklistedTables();
		}
	}

	public boolean isQueryServiceDisabled() {
		synchronized (mutex) {
			return tabletControl != null && tabletControl.disableQueryService();
		}
	}

	public HealthStatus getHealth() {
		synchronized (mutex) {
			return health;
		}
	}

	public void setHealth(HealthStatus newHealth) {
		if (newHealth == null) {
			throw new IllegalArgumentException("health status cannot be null");
		}
		synchronized (mutex) {
			this.health = newHealth;
		}
	}
}
