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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.google.common.collect.ImmutableList;

import net.metricsagent.json.JSONOps;

/**
 * <p>Title: AgentConfiguration</p>
 * <p>Description: The top level agent configuration: default metadata, supervisor timings
 * and the collector and client configurations.</p>
 * <p>Sample:<pre>
 * {
 *   "metadata": {"dc": "eu1"},
 *   "collectors": {"jvm": {"interval": 10000}},
 *   "clients": {
 *     "carbon": {"remotehosts": ["graphite:2003"], "namemapping": ["host"]},
 *     "elasticsearch": {"indexname": "metrics-{date:yyyy.MM.dd}", "compression": "gzip"}
 *   }
 * }
 * </pre></p>
 * <p><code>net.metricsagent.AgentConfiguration</code></p>
 */
@JsonDeserialize(using=AgentConfiguration.AgentConfigurationDeser.class)
@JsonSerialize(using=AgentConfiguration.AgentConfigurationSer.class)
public class AgentConfiguration {
	/** The default supervisor intake poll timeout in ms */
	public static final long DEFAULT_POLL_TIMEOUT = 1000;
	/** The default per task graceful shutdown join timeout in ms */
	public static final long DEFAULT_JOIN_TIMEOUT = 5000;

	/** Agent-wide default tags merged under every sample's metadata */
	protected final Map<String, String> metadata;
	/** The supervisor intake poll timeout in ms */
	protected final long pollTimeout;
	/** The per task graceful shutdown join timeout in ms */
	protected final long joinTimeout;
	/** The collector configurations */
	protected final List<CollectorConfiguration> collectors;
	/** The client configurations */
	protected final List<ClientConfiguration> clients;

	/**
	 * Creates a new AgentConfiguration
	 * @param metadata Agent-wide default tags, may be null
	 * @param pollTimeout The supervisor intake poll timeout in ms
	 * @param joinTimeout The per task graceful shutdown join timeout in ms
	 * @param collectors The collector configurations, may be null
	 * @param clients The client configurations, may be null
	 */
	public AgentConfiguration(final Map<String, String> metadata, final long pollTimeout, final long joinTimeout,
			final List<CollectorConfiguration> collectors, final List<ClientConfiguration> clients) {
		if(pollTimeout < 1) throw new IllegalArgumentException("Invalid poll timeout: " + pollTimeout);
		if(joinTimeout < 1) throw new IllegalArgumentException("Invalid join timeout: " + joinTimeout);
		this.metadata = metadata==null ? Collections.<String, String>emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<String, String>(metadata));
		this.pollTimeout = pollTimeout;
		this.joinTimeout = joinTimeout;
		this.collectors = collectors==null ? Collections.<CollectorConfiguration>emptyList() : ImmutableList.copyOf(collectors);
		this.clients = clients==null ? Collections.<ClientConfiguration>emptyList() : ImmutableList.copyOf(clients);
		final List<String> names = new ArrayList<String>();
		for(ClientConfiguration cc: this.clients) {
			if(names.contains(cc.name())) throw new IllegalArgumentException("Duplicate client name [" + cc.name() + "]");
			names.add(cc.name());
		}
	}

	/**
	 * Creates a new AgentConfiguration with default timings and no metadata
	 * @param collectors The collector configurations, may be null
	 * @param clients The client configurations, may be null
	 */
	public AgentConfiguration(final List<CollectorConfiguration> collectors, final List<ClientConfiguration> clients) {
		this(null, DEFAULT_POLL_TIMEOUT, DEFAULT_JOIN_TIMEOUT, collectors, clients);
	}

	/**
	 * Returns the configuration used when no file is given: the JVM collector
	 * pushing to a local carbon listener
	 * @return the default configuration
	 */
	public static AgentConfiguration defaults() {
		return new AgentConfiguration(
			Collections.singletonList(new CollectorConfiguration("jvm")),
			Collections.singletonList(ClientConfiguration.builder(Backend.CARBON).build())
		);
	}

	public Map<String, String> metadata() {
		return metadata;
	}

	public long pollTimeout() {
		return pollTimeout;
	}

	public long joinTimeout() {
		return joinTimeout;
	}

	public List<CollectorConfiguration> collectors() {
		return collectors;
	}

	public List<ClientConfiguration> clients() {
		return clients;
	}

	public static class AgentConfigurationSer extends JsonSerializer<AgentConfiguration> {
		@Override
		public void serialize(final AgentConfiguration value, final JsonGenerator gen, final SerializerProvider serializers)
				throws IOException, JsonProcessingException {
			gen.writeStartObject();
			gen.writeObjectField("metadata", value.metadata);
			gen.writeNumberField("polltimeout", value.pollTimeout);
			gen.writeNumberField("jointimeout", value.joinTimeout);
			gen.writeObjectFieldStart("collectors");
			for(CollectorConfiguration cc: value.collectors) {
				gen.writeObjectFieldStart(cc.name());
				gen.writeStringField("type", cc.type());
				gen.writeBooleanField("enabled", cc.enabled());
				gen.writeNumberField("interval", cc.interval());
				gen.writeObjectField("metadata", cc.metadata());
				gen.writeEndObject();
			}
			gen.writeEndObject();
			gen.writeObjectFieldStart("clients");
			for(ClientConfiguration cc: value.clients) {
				gen.writeObjectField(cc.name(), cc);
			}
			gen.writeEndObject();
			gen.writeEndObject();
		}
	}

	public static class AgentConfigurationDeser extends JsonDeserializer<AgentConfiguration> {
		@Override
		public AgentConfiguration deserialize(final JsonParser p, final DeserializationContext ctxt) throws IOException, JsonProcessingException {
			final JsonNode node = p.readValueAsTree();
			final Map<String, String> metadata = node.hasNonNull("metadata")
					? JSONOps.parseToObject(node.get("metadata"), JSONOps.TR_STR_STR_HASH_MAP)
					: null;
			final long pollTimeout = node.has("polltimeout") ? node.get("polltimeout").longValue() : DEFAULT_POLL_TIMEOUT;
			final long joinTimeout = node.has("jointimeout") ? node.get("jointimeout").longValue() : DEFAULT_JOIN_TIMEOUT;
			final List<CollectorConfiguration> collectors = new ArrayList<CollectorConfiguration>();
			if(node.hasNonNull("collectors")) {
				final Iterator<Map.Entry<String, JsonNode>> iter = node.get("collectors").fields();
				while(iter.hasNext()) {
					final Map.Entry<String, JsonNode> entry = iter.next();
					collectors.add(CollectorConfiguration.fromNode(entry.getKey(), entry.getValue()));
				}
			}
			final List<ClientConfiguration> clients = new ArrayList<ClientConfiguration>();
			if(node.hasNonNull("clients")) {
				final Iterator<Map.Entry<String, JsonNode>> iter = node.get("clients").fields();
				while(iter.hasNext()) {
					final Map.Entry<String, JsonNode> entry = iter.next();
					clients.add(ClientConfiguration.ClientConfigurationDeser.fromNode(entry.getKey(), entry.getValue()));
				}
			}
			return new AgentConfiguration(metadata, pollTimeout, joinTimeout, collectors, clients);
		}
	}

	@Override
	public String toString() {
		return "AgentConfiguration [metadata=" + metadata + ", pollTimeout=" + pollTimeout + ", joinTimeout=" + joinTimeout
				+ ", collectors=" + collectors + ", clients=" + clients + "]";
	}
}
