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
import net.metricsagent.protocol.CarbonClient;
import net.metricsagent.protocol.ElasticsearchClient;
import net.metricsagent.util.StringsUtil;

/**
 * <p>Title: Backend</p>
 * <p>Description: Functional enumeration of the supported backends</p>
 * <p><code>net.metricsagent.Backend</code></p>
 */

public enum Backend implements ClientBuilder {
	/** Graphite carbon plaintext protocol */
	CARBON("carbon", 2003) {
		@Override
		public BaseClient newClient(final ClientConfiguration config, final Map<String, String> defaultMetadata) {
			return new CarbonClient(config, defaultMetadata);
		}
	},
	/** Elasticsearch bulk API */
	ELASTICSEARCH("elasticsearch", 9200) {
		@Override
		public BaseClient newClient(final ClientConfiguration config, final Map<String, String> defaultMetadata) {
			return new ElasticsearchClient(config, defaultMetadata);
		}
	};

	private Backend(final String key, final int defaultPort) {
		this.key = key;
		this.defaultPort = defaultPort;
		defaultHost = "127.0.0.1:" + defaultPort;
	}

	/** The backend's key in the configuration */
	public final String key;
	/** The port used when an endpoint specifies none */
	public final int defaultPort;
	/** The endpoint used when none is configured */
	public final String defaultHost;

	/**
	 * Decodes the passed configuration key to a backend
	 * @param key The key to decode
	 * @return the backend
	 */
	public static Backend forKey(final String key) {
		if(key==null || key.trim().isEmpty()) throw new IllegalArgumentException("The passed backend key was null or empty");
		final String k = key.trim().toLowerCase();
		for(Backend b: values()) {
			if(b.key.equals(k)) return b;
		}
		throw new IllegalArgumentException("Unknown backend [" + key + "]");
	}

	/**
	 * {@inheritDoc}
	 * @see net.metricsagent.ClientBuilder#fromString(java.lang.String)
	 */
	@Override
	public InetSocketAddress fromString(final String address) {
		return StringsUtil.toAddress(address, defaultPort);
	}
}
