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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

import net.metricsagent.json.JSONOps;

/**
 * <p>Title: CollectorConfiguration</p>
 * <p>Description: Configuration bean for one collector</p>
 * <p><code>net.metricsagent.CollectorConfiguration</code></p>
 */

public class CollectorConfiguration {
	/** The default sampling interval in ms */
	public static final long DEFAULT_INTERVAL = 10000;

	/** The collector name */
	protected final String name;
	/** The collector type, defaults to the name */
	protected final String type;
	/** Indicates if the collector is started */
	protected final boolean enabled;
	/** The sampling interval in ms */
	protected final long interval;
	/** Tags added to every sample */
	protected final Map<String, String> metadata;

	/**
	 * Creates a new CollectorConfiguration
	 * @param name The collector name
	 * @param type The collector type, null to use the name
	 * @param enabled Indicates if the collector is started
	 * @param interval The sampling interval in ms
	 * @param metadata Tags added to every sample, may be null
	 */
	public CollectorConfiguration(final String name, final String type, final boolean enabled, final long interval, final Map<String, String> metadata) {
		if(name==null || name.trim().isEmpty()) throw new IllegalArgumentException("The passed name was null or empty");
		if(interval < 1) throw new IllegalArgumentException("Invalid interval for collector [" + name + "]: " + interval);
		this.name = name;
		this.type = type==null ? name : type;
		this.enabled = enabled;
		this.interval = interval;
		this.metadata = metadata==null ? Collections.<String, String>emptyMap() : Collections.unmodifiableMap(new HashMap<String, String>(metadata));
	}

	/**
	 * Creates an enabled collector configuration with default settings
	 * @param name The collector name, also its type
	 */
	public CollectorConfiguration(final String name) {
		this(name, null, true, DEFAULT_INTERVAL, null);
	}

	/**
	 * Builds a collector configuration from a JSON node
	 * @param name The collector name
	 * @param node The node to read
	 * @return the collector configuration
	 */
	public static CollectorConfiguration fromNode(final String name, final JsonNode node) {
		return new CollectorConfiguration(
			name,
			node.hasNonNull("type") ? node.get("type").textValue() : null,
			node.has("enabled") ? node.get("enabled").booleanValue() : true,
			node.has("interval") ? node.get("interval").longValue() : DEFAULT_INTERVAL,
			node.hasNonNull("metadata") ? JSONOps.parseToObject(node.get("metadata"), JSONOps.TR_STR_STR_HASH_MAP) : null
		);
	}

	public String name() {
		return name;
	}

	public String type() {
		return type;
	}

	public boolean enabled() {
		return enabled;
	}

	public long interval() {
		return interval;
	}

	public Map<String, String> metadata() {
		return metadata;
	}

	@Override
	public String toString() {
		return "CollectorConfiguration [name=" + name + ", type=" + type + ", enabled=" + enabled + ", interval=" + interval + "]";
	}
}
