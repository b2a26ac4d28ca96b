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
package net.metricsagent.protocol;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Gauge;
import com.codahale.metrics.Meter;
import com.codahale.metrics.Metric;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.MetricSet;
import com.codahale.metrics.Timer;
import com.codahale.metrics.Timer.Context;

import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import net.metricsagent.ClientConfiguration;
import net.metricsagent.sample.Sample;
import net.metricsagent.task.AgentTask;
import net.metricsagent.transport.ConnectionException;
import net.metricsagent.transport.TcpConnector;

/**
 * <p>Title: BaseClient</p>
 * <p>Description: The abstract push client. Samples handed over by the supervisor are encoded
 * into buffered output fragments without any I/O. The buffer is pushed in chunks when the flush
 * interval elapses, when the flush threshold is reached and one last time on shutdown. A failed
 * push keeps the unacknowledged fragments buffered, in order, for the next flush.</p>
 * <p>The buffer is owned by the client's thread. Tests may drive {@link #accept(Sample)} and
 * {@link #flush()} directly as long as the client is not started.</p>
 * <p><code>net.metricsagent.protocol.BaseClient</code></p>
 */

public abstract class BaseClient extends AgentTask implements MetricSet {
	/** The client configuration */
	protected final ClientConfiguration config;
	/** Agent-wide metadata merged under every sample's metadata */
	protected final Map<String, String> defaultMetadata;
	/** The inbound sample channel fed by the supervisor */
	protected final LinkedBlockingQueue<Sample> channel = new LinkedBlockingQueue<Sample>();
	/** Encoded fragments awaiting a push */
	protected final List<String> buffer = new ArrayList<String>();
	/** The current push state */
	protected volatile ClientState state = ClientState.DISCONNECTED;
	/** Set when the last flush failed, suppressing threshold flushes until the next interval */
	protected boolean lastFlushFailed = false;
	/** The lazily created connector */
	private TcpConnector connector = null;

	protected final MetricRegistry registry = new MetricRegistry();
	protected final Timer flushTimer = registry.timer("flush");
	protected final Meter sampleMeter = registry.meter("samples");
	protected final Counter flushErrorCounter = registry.counter("flushErrors");
	protected final Counter droppedCounter = registry.counter("dropped");
	protected final Counter pushedCounter = registry.counter("pushed");

	/**
	 * Creates a new BaseClient
	 * @param config The client configuration
	 * @param defaultMetadata Agent-wide metadata merged under every sample's metadata, may be null
	 */
	protected BaseClient(final ClientConfiguration config, final Map<String, String> defaultMetadata) {
		super(config==null ? "client" : config.name());
		if(config==null) throw new IllegalArgumentException("The passed ClientConfiguration was null");
		this.config = config;
		this.defaultMetadata = defaultMetadata==null
				? Collections.<String, String>emptyMap()
				: Collections.unmodifiableMap(new LinkedHashMap<String, String>(defaultMetadata));
		registry.register("bufferSize", new Gauge<Integer>() {
			@Override
			public Integer getValue() {
				return buffer.size();
			}
		});
	}

	/**
	 * Encodes one sample into zero or more buffered fragments via {@link #bufferOutput(String)}.
	 * Performs no I/O.
	 * @param bucket The metric family
	 * @param values Metric field name to value
	 * @param timestamp The effective timestamp in fractional epoch seconds
	 * @param metadata The merged metadata
	 */
	protected abstract void processValues(String bucket, Map<String, Number> values, double timestamp, Map<String, String> metadata);

	/**
	 * Pushes one chunk of fragments to the backend over {@link #connection()}.
	 * Returning normally means the backend acknowledged the whole chunk.
	 * @param chunk The fragments to push
	 * @throws IOException on any transport failure or rejection
	 * @throws InterruptedException if the thread was interrupted while waiting on the backend
	 */
	protected abstract void pushChunk(List<String> chunk) throws IOException, InterruptedException;

	/**
	 * Returns the pipeline initializer for the connections of this client
	 * @return the channel initializer
	 */
	protected abstract ChannelInitializer<Channel> channelInitializer();

	/**
	 * Hands a sample to this client. Called by the supervisor.
	 * @param sample The sample to enqueue
	 */
	public void send(final Sample sample) {
		if(sample==null) throw new IllegalArgumentException("The passed sample was null");
		channel.add(sample);
	}

	/**
	 * Asks the client to make a final flush and exit
	 */
	public void requestShutdown() {
		channel.add(Sample.SENTINEL);
	}

	@Override
	protected void runTask() throws Exception {
		long nextFlush = System.currentTimeMillis() + config.interval();
		try {
			while(true) {
				final long wait = nextFlush - System.currentTimeMillis();
				final Sample sample = wait > 0 ? channel.poll(wait, TimeUnit.MILLISECONDS) : null;
				if(sample==null) {
					flush();
					nextFlush = System.currentTimeMillis() + config.interval();
				} else if(sample.isSentinel()) {
					log.info("Client [{}] shutting down, final flush of {} fragments", name, buffer.size());
					flush();
					break;
				} else {
					accept(sample);
					if(config.flushThreshold() > 0 && !lastFlushFailed && buffer.size() >= config.flushThreshold()) {
						flush();
					}
				}
			}
		} finally {
			state = ClientState.CLOSED;
			releaseConnector();
		}
	}

	/**
	 * Merges the default metadata under the sample's metadata and encodes the sample
	 * @param sample The sample to accept
	 */
	public void accept(final Sample sample) {
		sampleMeter.mark();
		final Map<String, String> metadata;
		if(defaultMetadata.isEmpty()) {
			metadata = sample.metadata();
		} else {
			metadata = new LinkedHashMap<String, String>(defaultMetadata);
			metadata.putAll(sample.metadata());
		}
		processValues(sample.bucket(), sample.values(), sample.effectiveTimestamp(), metadata);
	}

	/**
	 * Appends an encoded fragment to the buffer, dropping the oldest fragments
	 * if the configured buffer limit is exceeded
	 * @param fragment The fragment to buffer
	 */
	protected void bufferOutput(final String fragment) {
		buffer.add(fragment);
		final int limit = config.bufferLimit();
		if(limit > 0 && buffer.size() > limit) {
			final int excess = buffer.size() - limit;
			buffer.subList(0, excess).clear();
			droppedCounter.inc(excess);
			log.warn("Client [{}] buffer limit of {} exceeded, dropped {} oldest fragments", name, limit, excess);
		}
	}

	/**
	 * Counts a sample that produced no output
	 * @param reason The reason the sample was dropped
	 * @param bucket The sample's bucket
	 */
	protected void drop(final String reason, final String bucket) {
		droppedCounter.inc();
		log.debug("Client [{}] dropped sample [{}]: {}", name, bucket, reason);
	}

	/**
	 * Pushes the buffer in chunks. Each acknowledged chunk is removed from the buffer.
	 * The first failure stops the flush, drops the connection and keeps the rest buffered.
	 * @return true if the buffer was fully pushed
	 * @throws InterruptedException if the thread was interrupted while pushing
	 */
	public boolean flush() throws InterruptedException {
		if(buffer.isEmpty()) {
			lastFlushFailed = false;
			return true;
		}
		final Context ctx = flushTimer.time();
		state = ClientState.FLUSHING;
		try {
			while(!buffer.isEmpty()) {
				final List<String> chunk = buffer.subList(0, Math.min(config.chunkSize(), buffer.size()));
				final int size = chunk.size();
				pushChunk(Collections.unmodifiableList(chunk));
				chunk.clear();
				pushedCounter.inc(size);
			}
			state = ClientState.CONNECTED;
			lastFlushFailed = false;
			return true;
		} catch (IOException ex) {
			flushErrorCounter.inc();
			lastFlushFailed = true;
			log.warn("Client [{}] push failed, retaining {} fragments: {}", name, buffer.size(), ex.toString());
			if(connector!=null) connector.drop();
			state = ClientState.DISCONNECTED;
			return false;
		} finally {
			ctx.stop();
		}
	}

	/**
	 * Returns the connection to push on, connecting if there is none
	 * @return the connection
	 * @throws ConnectionException if the connect failed or timed out
	 * @throws InterruptedException if the thread was interrupted while connecting
	 */
	protected Channel connection() throws ConnectionException, InterruptedException {
		return connector().getChannel(true);
	}

	/**
	 * Returns this client's connector, creating it on first use
	 * @return the connector
	 */
	protected TcpConnector connector() {
		if(connector==null) {
			connector = new TcpConnector(name, config.remoteHosts(), config.connectTimeout(), channelInitializer());
		}
		return connector;
	}

	protected void releaseConnector() {
		final TcpConnector c = connector;
		connector = null;
		if(c!=null) {
			c.close();
			log.info("Client [{}] released its connection", name);
		}
	}

	/**
	 * Returns a copy of the currently buffered fragments
	 * @return the buffered fragments
	 */
	public List<String> bufferSnapshot() {
		return new ArrayList<String>(buffer);
	}

	public ClientState state() {
		return state;
	}

	public ClientConfiguration config() {
		return config;
	}

	@Override
	public Map<String, Metric> getMetrics() {
		return registry.getMetrics();
	}
}
