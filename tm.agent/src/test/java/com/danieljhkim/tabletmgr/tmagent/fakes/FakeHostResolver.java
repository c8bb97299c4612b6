package com.danieljhkim.tabletmgr.tmagent.fakes;

import java.io.IOException;
import java.net.UnknownHostException;

import com.danieljhkim.tabletmgr.tmagent.topo.HostResolver;

/**
 * Resolves every hostname to a fixed address, or fails when {@code ipAddr} is null.
 */
public class FakeHostResolver implements HostResolver {

	private final String hostname;
	private final String ipAddr;

	public FakeHostResolver(String hostname, String ipAddr) {
		this.hostname = hostname;
		this.ipAddr = ipAddr;
	}

	@Override
	public String fullyQualifiedHostname() {
		return hostname;
	}

	@Override
	public String resolveIpAddr(String name) throws IOException {
		if (ipAddr == null) {
			throw new UnknownHostException(name);
		}
		return ipAddr;
	}
}
