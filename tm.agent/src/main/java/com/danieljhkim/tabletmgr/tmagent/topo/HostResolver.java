package com.danieljhkim.tabletmgr.tmagent.topo;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Resolves this machine's identity on the network.
 */
public interface HostResolver {

	/**
	 * Returns the fully qualified hostname of the local machine.
	 */
	String fullyQualifiedHostname() throws IOException;

	/**
	 * Returns the first IP address {@code hostname} resolves to.
	 */
	String resolveIpAddr(String hostname) throws IOException;

	/**
	 * Resolver backed by the JDK's DNS lookups.
	 */
	static HostResolver dns() {
		return new HostResolver() {
			@Override
			public String fullyQualifiedHostname() throws UnknownHostException {
				return InetAddress.getLocalHost().getCanonicalHostName();
			}

			@Override
			public String resolveIpAddr(String hostname) throws UnknownHostException {
				InetAddress[] addrs = InetAddress.getAllByName(hostname);
				if (addrs.length == 0) {
					throw new UnknownHostException("no address for " + hostname);
				}
				return addrs[0].getHostAddress();
			}
		};
	}
}
