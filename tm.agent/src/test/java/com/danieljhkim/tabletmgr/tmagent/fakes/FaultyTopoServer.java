package com.danieljhkim.tabletmgr.tmagent.fakes;

import java.util.concurrent.atomic.AtomicInteger;

import com.danieljhkim.tabletmgr.tmcommon.exception.TopoNotFoundException;
import com.danieljhkim.tabletmgr.tmcommon.exception.TopoUnavailableException;
import com.danieljhkim.tabletmgr.tmcommon.exception.TopoValidationException;
import com.danieljhkim.tabletmgr.tmcommon.topo.EndPoint;
import com.danieljhkim.tabletmgr.tmcommon.topo.InMemoryTopoServer;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletAlias;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletInfo;
import com.danieljhkim.tabletmgr.tmcommon.topo.TabletType;

/**
 * In-memory topology store whose individual operations can be switched to fail.
 */
public class FaultyTopoServer extends InMemoryTopoServer {

	private volatile boolean tabletMissing;
	private volatile boolean updateTabletFails;
	private volatile boolean validateFails;
	private volatile boolean endpointFails;
	private final AtomicInteger getTabletCalls = new AtomicInteger();

	@Override
	public TabletInfo getTablet(TabletAlias alias) {
		getTabletCalls.incrementAndGet();
		if (tabletMissing) {
			throw new TopoNotFoundException("node doesn't exist", alias.toString());
		}
		return super.getTablet(alias);
	}

	@Override
	public long updateTablet(TabletInfo tabletInfo) {
		if (updateTabletFails) {
			throw new TopoUnavailableException("topo write failed", tabletInfo.alias().toString());
		}
		return super.updateTablet(tabletInfo);
	}

	@Override
	public void validateTablet(TabletAlias alias) {
		if (validateFails) {
			throw new TopoValidationException("replication graph is missing the tablet", alias.toString());
		}
		super.validateTablet(alias);
	}

	@Override
	public void updateTabletEndpoint(String cell, String keyspace, String shard, TabletType type, EndPoint endPoint) {
		if (endpointFails) {
			throw new TopoUnavailableException("serving graph unavailable");
		}
		super.updateTabletEndpoint(cell, keyspace, shard, type, endPoint);
	}

	@Override
	public void deleteTabletEndpoint(String cell, String keyspace, String shard, TabletType type, long uid) {
		if (endpointFails) {
			throw new TopoUnavailableException("serving graph unavailable");
		}
		super.deleteTabletEndpoint(cell, keyspace, shard, type, uid);
	}

	public void setTabletMissing(boolean tabletMissing) {
		this.tabletMissing = tabletMissing;
	}

	public void setUpdateTabletFails(boolean updateTabletFails) {
		this.updateTabletFails = updateTabletFails;
	}

	public void setValidateFails(boolean validateFails) {
		this.validateFails = validateFails;
	}

	public void setEndpointFails(boolean endpointFails) {
		this.endpointFails = endpointFails;
	}

	public int getTabletCalls() {
		return getTabletCalls.get();
	}
}
