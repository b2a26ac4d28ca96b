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
package net.metricsagent;

import java.net.InetSocketAddress;
import java.util.Map;

import net.metricsagent.protocol.BaseClient;

/**
 * <p>Title: ClientBuilder</p>
 * <p>Description: Creates the clients of one backend</p>
 * <p><code>net.metricsagent.ClientBuilder</code></p>
 */

public interface ClientBuilder {

	/**
	 * Parses a remote endpoint, applying the backend's default port when none is given
	 * @param address The endpoint as <b><code>host[:port]</code></b>
	 * @return the unresolved socket address
	 */
	public InetSocketAddress fromString(String address);

	/**
	 * Creates a new, unstarted client
	 * @param config The client configuration
	 * @param defaultMetadata The agent-wide metadata merged under every sample's metadata
	 * @return the new client
	 */
	public BaseClient newClient(final ClientConfiguration config, final Map<String, String> defaultMetadata);

}
