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
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

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

import net.metricsagent.codec.Compression;
import net.metricsagent.codec.IndexNamer;

/**
 * <p>Title: ClientConfiguration</p>
 * <p>Description: Configuration bean for one backend client</p>
 * <p><code>net.metricsagent.ClientConfiguration</code></p>
 */
@JsonDeserialize(using=ClientConfiguration.ClientConfigurationDeser.class)
@JsonSerialize(using=ClientConfiguration.ClientConfigurationSer.class)
public class ClientConfiguration {
	/** The default flush interval in ms */
	public static final long DEFAULT_INTERVAL = 1000;
	/** The default connect timeout in ms */
	public static final int DEFAULT_CONNECT_TIMEOUT = 5000;
	/** The default send timeout in ms */
	public static final int DEFAULT_SEND_TIMEOUT = 5000;
	/** The default maximum number of buffered fragments pushed in one request */
	public static final int DEFAULT_CHUNK_SIZE = 300;
	/** The default bulk upload path */
	public static final String DEFAULT_BULK_PATH = "/_bulk";

	/** The client name, unique within the agent */
	protected final String name;
	/** The backend the client pushes to */
	protected final Backend backend;
	/** Indicates if the client is started */
	protected final boolean enabled;
	/** The flush interval in ms */
	protected final long interval;
	/** The remote endpoints */
	protected final List<InetSocketAddress> remoteHosts;
	/** The connect timeout in ms */
	protected final int connectTimeout;
	/** The send and response timeout in ms */
	protected final int sendTimeout;
	/** The maximum number of buffered fragments pushed in one request */
	protected final int chunkSize;
	/** Buffer size that triggers an immediate flush, 0 to flush on the interval only */
	protected final int flushThreshold;
	/** Buffer high-water mark above which the oldest fragments are dropped, 0 for unbounded */
	protected final int bufferLimit;
	/** Carbon: the ordered metadata keys leading every metric name */
	protected final List<String> nameMapping;
	/** Bulk: the configured index template, null to index by bucket */
	protected final String indexName;
	/** Bulk: the index namer, null to index by bucket */
	protected final IndexNamer indexNamer;
	/** Bulk: the document type, null to use the bucket, empty to omit */
	protected final String typeName;
	/** Bulk: the request body compression */
	protected final Compression compression;
	/** Bulk: the upload path */
	protected final String bulkPath;

	protected ClientConfiguration(final Builder b) {
		backend = b.backend;
		name = b.name==null ? backend.key : b.name;
		enabled = b.enabled;
		interval = b.interval;
		remoteHosts = b.remoteHosts.isEmpty()
				? ImmutableList.of(backend.fromString(backend.defaultHost))
				: ImmutableList.copyOf(b.remoteHosts);
		connectTimeout = b.connectTimeout;
		sendTimeout = b.sendTimeout;
		chunkSize = b.chunkSize;
		flushThreshold = b.flushThreshold;
		bufferLimit = b.bufferLimit;
		nameMapping = ImmutableList.copyOf(b.nameMapping);
		indexName = b.indexName;
		indexNamer = b.indexNamer!=null ? b.indexNamer : (indexName==null ? null : IndexNamer.template(indexName));
		typeName = b.typeName;
		compression = b.compression;
		bulkPath = b.bulkPath;
		validate();
	}

	private void validate() {
		if(name.trim().isEmpty()) throw new IllegalArgumentException("Client name was empty");
		if(interval < 1) throw new IllegalArgumentException("Invalid interval for client [" + name + "]: " + interval);
		if(connectTimeout < 1) throw new IllegalArgumentException("Invalid connect timeout for client [" + name + "]: " + connectTimeout);
		if(sendTimeout < 1) throw new IllegalArgumentException("Invalid send timeout for client [" + name + "]: " + sendTimeout);
		if(chunkSize < 1) throw new IllegalArgumentException("Invalid chunk size for client [" + name + "]: " + chunkSize);
		if(flushThreshold < 0) throw new IllegalArgumentException("Invalid flush threshold for client [" + name + "]: " + flushThreshold);
		if(bufferLimit < 0) throw new IllegalArgumentException("Invalid buffer limit for client [" + name + "]: " + bufferLimit);
		if(bulkPath==null || !bulkPath.startsWith("/")) throw new IllegalArgumentException("Invalid bulk path for client [" + name + "]: " + bulkPath);
	}

	/**
	 * Creates a new builder
	 * @param backend The backend the client pushes to
	 * @return the builder
	 */
	public static Builder builder(final Backend backend) {
		return new Builder(backend);
	}

	public String name() {
		return name;
	}

	public Backend backend() {
		return backend;
	}

	public boolean enabled() {
		return enabled;
	}

	public long interval() {
		return interval;
	}

	public List<InetSocketAddress> remoteHosts() {
		return remoteHosts;
	}

	public int connectTimeout() {
		return connectTimeout;
	}

	public int sendTimeout() {
		return sendTimeout;
	}

	public int chunkSize() {
		return chunkSize;
	}

	public int flushThreshold() {
		return flushThreshold;
	}

	public int bufferLimit() {
		return bufferLimit;
	}

	public List<String> nameMapping() {
		return nameMapping;
	}

	public IndexNamer indexNamer() {
		return indexNamer;
	}

	public String typeName() {
		return typeName;
	}

	public Compression compression() {
		return compression;
	}

	public String bulkPath() {
		return bulkPath;
	}

	/**
	 * <p>Title: Builder</p>
	 * <p>Description: Fluent builder for {@link ClientConfiguration}s</p>
	 * <p><code>net.metricsagent.ClientConfiguration.Builder</code></p>
	 */
	public static class Builder {
		private final Backend backend;
		private String name = null;
		private boolean enabled = true;
		private long interval = DEFAULT_INTERVAL;
		private final List<InetSocketAddress> remoteHosts = new ArrayList<InetSocketAddress>();
		private int connectTimeout = DEFAULT_CONNECT_TIMEOUT;
		private int sendTimeout = DEFAULT_SEND_TIMEOUT;
		private int chunkSize = DEFAULT_CHUNK_SIZE;
		private int flushThreshold = 0;
		private int bufferLimit = 0;
		private List<String> nameMapping = Collections.emptyList();
		private String indexName = null;
		private IndexNamer indexNamer = null;
		private String typeName = null;
		private Compression compression = Compression.IDENTITY;
		private String bulkPath = DEFAULT_BULK_PATH;

		Builder(final Backend backend) {
			if(backend==null) throw new IllegalArgumentException("The passed backend was null");
			this.backend = backend;
		}

		public Builder name(final String name) {
			this.name = name;
			return this;
		}

		public Builder enabled(final boolean enabled) {
			this.enabled = enabled;
			return this;
		}

		public Builder interval(final long interval) {
			this.interval = interval;
			return this;
		}

		/**
		 * Adds a remote endpoint
		 * @param address The endpoint as <b><code>host[:port]</code></b>
		 * @return this builder
		 */
		public Builder remoteHost(final String address) {
			remoteHosts.add(backend.fromString(address));
			return this;
		}

		public Builder remoteHost(final InetSocketAddress address) {
			if(address==null) throw new IllegalArgumentException("The passed address was null");
			remoteHosts.add(address);
			return this;
		}

		public Builder connectTimeout(final int connectTimeout) {
			this.connectTimeout = connectTimeout;
			return this;
		}

		public Builder sendTimeout(final int sendTimeout) {
			this.sendTimeout = sendTimeout;
			return this;
		}

		public Builder chunkSize(final int chunkSize) {
			this.chunkSize = chunkSize;
			return this;
		}

		public Builder flushThreshold(final int flushThreshold) {
			this.flushThreshold = flushThreshold;
			return this;
		}

		public Builder bufferLimit(final int bufferLimit) {
			this.bufferLimit = bufferLimit;
			return this;
		}

		public Builder nameMapping(final List<String> nameMapping) {
			this.nameMapping = nameMapping==null ? Collections.<String>emptyList() : nameMapping;
			return this;
		}

		/**
		 * Sets the index template. See {@link IndexNamer#template(String)}.
		 * @param indexName The index template, null to index by bucket
		 * @return this builder
		 */
		public Builder indexName(final String indexName) {
			this.indexName = indexName;
			return this;
		}

		public Builder indexNamer(final IndexNamer indexNamer) {
			this.indexNamer = indexNamer;
			return this;
		}

		public Builder typeName(final String typeName) {
			this.typeName = typeName;
			return this;
		}

		public Builder compression(final Compression compression) {
			this.compression = compression==null ? Compression.IDENTITY : compression;
			return this;
		}

		public Builder bulkPath(final String bulkPath) {
			this.bulkPath = bulkPath;
			return this;
		}

		public ClientConfiguration build() {
			return new ClientConfiguration(this);
		}
	}

	public static class ClientConfigurationSer extends JsonSerializer<ClientConfiguration> {
		@Override
		public void serialize(final ClientConfiguration value, final JsonGenerator gen, final SerializerProvider serializers)
				throws IOException, JsonProcessingException {
			gen.writeStartObject();
			gen.writeStringField("name", value.name);
			gen.writeStringField("type", value.backend.key);
			gen.writeBooleanField("enabled", value.enabled);
			gen.writeNumberField("interval", value.interval);
			gen.writeArrayFieldStart("remotehosts");
			for(InetSocketAddress isa: value.remoteHosts) {
				gen.writeString(isa.getHostString() + ":" + isa.getPort());
			}
			gen.writeEndArray();
			gen.writeNumberField("connecttimeout", value.connectTimeout);
			gen.writeNumberField("sendtimeout", value.sendTimeout);
			gen.writeNumberField("chunksize", value.chunkSize);
			gen.writeNumberField("flushthreshold", value.flushThreshold);
			gen.writeNumberField("bufferlimit", value.bufferLimit);
			if(value.backend==Backend.CARBON) {
				gen.writeArrayFieldStart("namemapping");
				for(String key: value.nameMapping) {
					gen.writeString(key);
				}
				gen.writeEndArray();
			} else {
				if(value.indexName!=null) gen.writeStringField("indexname", value.indexName);
				if(value.typeName!=null) gen.writeStringField("typename", value.typeName);
				gen.writeStringField("compression", value.compression.encoding);
				gen.writeStringField("bulkpath", value.bulkPath);
			}
			gen.writeEndObject();
		}
	}

	public static class ClientConfigurationDeser extends JsonDeserializer<ClientConfiguration> {
		@Override
		public ClientConfiguration deserialize(final JsonParser p, final DeserializationContext ctxt) throws IOException, JsonProcessingException {
			final JsonNode node = p.readValueAsTree();
			return fromNode(null, node);
		}

		/**
		 * Builds a client configuration from a JSON node
		 * @param defaultName The name to use if the node has none, also the default type
		 * @param node The node to read
		 * @return the client configuration
		 */
		public static ClientConfiguration fromNode(final String defaultName, final JsonNode node) {
			final String name = node.has("name") ? node.get("name").textValue() : defaultName;
			final String type;
			if(node.has("type")) {
				type = node.get("type").textValue();
			} else if(name!=null) {
				type = name;
			} else {
				throw new IllegalArgumentException("Client configuration has no type: " + node);
			}
			final Builder b = builder(Backend.forKey(type)).name(name);
			if(node.has("enabled")) b.enabled(node.get("enabled").booleanValue());
			if(node.has("interval")) b.interval(node.get("interval").longValue());
			if(node.has("remotehosts")) {
				for(JsonNode host: node.get("remotehosts")) {
					b.remoteHost(host.textValue());
				}
			}
			if(node.has("connecttimeout")) b.connectTimeout(node.get("connecttimeout").intValue());
			if(node.has("sendtimeout")) b.sendTimeout(node.get("sendtimeout").intValue());
			if(node.has("chunksize")) b.chunkSize(node.get("chunksize").intValue());
			if(node.has("flushthreshold")) b.flushThreshold(node.get("flushthreshold").intValue());
			if(node.has("bufferlimit")) b.bufferLimit(node.get("bufferlimit").intValue());
			if(node.has("namemapping")) {
				final List<String> mapping = new ArrayList<String>();
				for(JsonNode key: node.get("namemapping")) {
					mapping.add(key.textValue());
				}
				b.nameMapping(mapping);
			}
			if(node.hasNonNull("indexname")) b.indexName(node.get("indexname").textValue());
			if(node.hasNonNull("typename")) b.typeName(node.get("typename").textValue());
			if(node.hasNonNull("compression")) b.compression(Compression.forName(node.get("compression").textValue()));
			if(node.hasNonNull("bulkpath")) b.bulkPath(node.get("bulkpath").textValue());
			return b.build();
		}
	}

	@Override
	public String toString() {
		StringBuilder builder = new StringBuilder();
		builder.append("ClientConfiguration [name=").append(name).append(", backend=").append(backend)
				.append(", enabled=").append(enabled).append(", interval=").append(interval)
				.append(", remoteHosts=").append(remoteHosts).append(", chunkSize=").append(chunkSize)
				.append(", flushThreshold=").append(flushThreshold).append(", bufferLimit=").append(bufferLimit)
				.append("]");
		return builder.toString();
	}
}
