// This file is part of metrics-agent.
// Copyright (C) 2016-2026  The metrics-agent Authors.
//
// This program is free software: you can redistribute it and/or modify it
// under the terms of the GNU Lesser General Public License as published by
// the Free Software Foundation, either version 2.1 of the License, or (at your
// option) any later version.  This program is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the implied warranty
// of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU Lesser
// General Public License for more details.  You should have received a copy
// of the GNU Lesser General Public License along with this program.  If not,
// see <http://www.gnu.org/licenses/>.
package net.metricsagent.util;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;

/**
 * <p>Title: LocalHost</p>
 * <p>Description: Figures out the name of the current host for tagging locally collected samples</p>
 * <p><code>net.metricsagent.util.LocalHost</code></p>
 */

public class LocalHost {

    /** The config prop key to specify the exact externally accessible host name */
    public static final String PROP_EXT_HOST_NAME = "host.ext.name";
	/** Indicates if we're running on Windows */
	public static final boolean IS_WIN = System.getProperty("os.name", "").toLowerCase().contains("windows");
	/** The JVM's host name according to the RuntimeMXBean */
	public static final String HOST = ManagementFactory.getRuntimeMXBean().getName().split("@")[1];

	/** The resolved host name */
	private static volatile String hostName = null;

	/**
	 * Returns the host name, computing it on first call
	 * @return the host name
	 */
	public static String hostName() {
		if(hostName==null) {
			synchronized(LocalHost.class) {
				if(hostName==null) {
					hostName = resolveHostName();
				}
			}
		}
		return hostName;
	}

	/**
	 * Attempts a series of methods of divining the host name
	 * @return the determined host name
	 */
	static String resolveHostName() {
		String host = System.getProperty(PROP_EXT_HOST_NAME);
		if(host!=null && !host.trim().isEmpty()) return host.trim();
		host = System.getenv(PROP_EXT_HOST_NAME.replace('.', '_').toUpperCase());
		if(host!=null && !host.trim().isEmpty()) return host.trim();
		host = getHostNameByInet();
		if(host!=null) return host;
		host = System.getenv(IS_WIN ? "COMPUTERNAME" : "HOSTNAME");
		if(host!=null && !host.trim().isEmpty()) return host.trim();
		return HOST;
	}

	/**
	 * Uses <b><code>InetAddress.getLocalHost().getHostName()</code></b> to get the host name.
	 * If the value is null, empty or equals <b><code>localhost</code></b>, returns null.
	 * @return The host name or null if one was not found.
	 */
	public static String getHostNameByInet() {
		try {
			final String inetHost = InetAddress.getLocalHost().getHostName();
			if(inetHost==null || inetHost.trim().isEmpty() || "localhost".equalsIgnoreCase(inetHost.trim())) return null;
			return inetHost.trim();
		} catch (Exception x) {
			return null;
		}
	}

	private LocalHost() {}
}
