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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Slf4jReporter;

import net.metricsagent.protocol.BaseClient;
import net.metricsagent.sample.Sample;
import net.metricsagent.task.Collector;
import net.metricsagent.task.CollectorFactory;
import net.metricsagent.task.JvmStatsCollector;

/**
 * <p>Title: Agent</p>
 * <p>Description: The supervisor. Starts the enabled collectors and clients, forwards every
 * sample arriving on the shared intake queue to every client, polices the liveness of all tasks
 * and runs the shutdown sequence when the sentinel arrives or a task dies.</p>
 * <p><code>net.metricsagent.Agent</code></p>
 */

public class Agent {
	/** Instance logger */
	protected final Logger log = LoggerFactory.getLogger(getClass());

	/** The agent configuration */
	protected final AgentConfiguration config;
	/** The intake queue shared by all collectors */
	protected final LinkedBlockingQueue<Sample> intake = new LinkedBlockingQueue<Sample>();
	/** The collector factories keyed by collector type */
	protected final Map<String, CollectorFactory> collectorFactories = new LinkedHashMap<String, CollectorFactory>();
	/** The running collectors */
	protected final List<Collector> collectors = new ArrayList<Collector>();
	/** The running clients */
	protected final List<BaseClient> clients = new ArrayList<BaseClient>();
	/** Aggregates the agent's own metrics and those of the clients */
	protected final MetricRegistry registry = new MetricRegistry();
	protected final Meter forwardedMeter = registry.meter("forwarded");

	private final AtomicBoolean started = new AtomicBoolean(false);

	/**
	 * Creates a new Agent
	 * @param config The agent configuration
	 */
	public Agent(final AgentConfiguration config) {
		if(config==null) throw new IllegalArgumentException("The passed AgentConfiguration was null");
		this.config = config;
		registerCollector(JvmStatsCollector.NAME, new CollectorFactory() {
			@Override
			public Collector newCollector(final CollectorConfiguration cc, final BlockingQueue<Sample> queue) {
				return new JvmStatsCollector(queue, cc.interval(), cc.metadata());
			}
		});
	}

	/**
	 * Registers a collector type. Must be called before {@link #start()}.
	 * @param type The collector type as referenced in the configuration
	 * @param factory The factory creating collectors of the type
	 * @return this agent
	 */
	public Agent registerCollector(final String type, final CollectorFactory factory) {
		if(type==null || type.trim().isEmpty()) throw new IllegalArgumentException("The passed type was null or empty");
		if(factory==null) throw new IllegalArgumentException("The passed CollectorFactory was null");
		collectorFactories.put(type, factory);
		return this;
	}

	/**
	 * Creates and starts the enabled collectors and clients of the configuration
	 */
	public void start() {
		final List<Collector> enabledCollectors = new ArrayList<Collector>();
		for(CollectorConfiguration cc: config.collectors()) {
			if(!cc.enabled()) {
				log.info("Collector [{}] is disabled", cc.name());
				continue;
			}
			final CollectorFactory factory = collectorFactories.get(cc.type());
			if(factory==null) throw new IllegalArgumentException("Unknown collector type [" + cc.type() + "] for collector [" + cc.name() + "]");
			enabledCollectors.add(factory.newCollector(cc, intake));
		}
		final List<BaseClient> enabledClients = new ArrayList<BaseClient>();
		for(ClientConfiguration cc: config.clients()) {
			if(!cc.enabled()) {
				log.info("Client [{}] is disabled", cc.name());
				continue;
			}
			enabledClients.add(cc.backend().newClient(cc, config.metadata()));
		}
		start(enabledCollectors, enabledClients);
	}

	/**
	 * Starts the passed collectors and clients. Clients start first so no sample
	 * is forwarded to a client that is not running.
	 * @param enabledCollectors The collectors, constructed with {@link #intake()}
	 * @param enabledClients The clients
	 */
	public void start(final List<? extends Collector> enabledCollectors, final List<? extends BaseClient> enabledClients) {
		if(enabledCollectors==null) throw new IllegalArgumentException("The passed collectors were null");
		if(enabledClients==null) throw new IllegalArgumentException("The passed clients were null");
		if(!started.compareAndSet(false, true)) throw new IllegalStateException("Agent already started");
		for(BaseClient client: enabledClients) {
			registry.register(MetricRegistry.name("client", client.name()), client);
			client.start();
			clients.add(client);
			log.info("Started client [{}]", client.name());
		}
		for(Collector collector: enabledCollectors) {
			collector.start();
			collectors.add(collector);
			log.info("Started collector [{}]", collector.name());
		}
		log.info("Agent started with {} collectors and {} clients", collectors.size(), clients.size());
	}

	/**
	 * Runs the supervisor loop until the sentinel arrives or a task dies, then shuts down
	 * @throws AgentException if a task died or the shutdown was not clean
	 */
	public void run() {
		if(!started.get()) throw new IllegalStateException("Agent not started");
		String error = null;
		try {
			while(true) {
				final Sample sample = intake.poll(config.pollTimeout(), TimeUnit.MILLISECONDS);
				if(sample!=null) {
					if(sample.isSentinel()) {
						log.info("Shutdown requested");
						break;
					}
					error = checkClients();
					if(error!=null) break;
					for(BaseClient client: clients) {
						client.send(sample);
					}
					forwardedMeter.mark();
				}
				error = checkLiveness();
				if(error!=null) break;
			}
		} catch (InterruptedException iex) {
			Thread.currentThread().interrupt();
			error = "Supervisor interrupted";
		}
		shutdown(error);
	}

	/**
	 * Asks the supervisor to shut down by pushing the sentinel onto the intake queue
	 */
	public void stop() {
		intake.offer(Sample.SENTINEL);
	}

	protected String checkClients() {
		for(BaseClient client: clients) {
			if(!client.isAlive()) return "Client [" + client.name() + "] died";
		}
		return null;
	}

	protected String checkLiveness() {
		for(Collector collector: collectors) {
			if(!collector.isAlive()) return "Collector [" + collector.name() + "] died";
		}
		return checkClients();
	}

	/**
	 * Stops the collectors, then sends the sentinel to the clients so they make a final flush,
	 * joins every task with the configured timeout and forcibly terminates those still running.
	 * @param error The reason for an abnormal shutdown, null for a requested one
	 * @throws AgentException if the error was not null or any task had to be terminated
	 */
	protected void shutdown(final String error) {
		if(error!=null) {
			log.error("Shutting down: {}", error);
		} else {
			log.info("Shutting down");
		}
		final List<String> forced = new ArrayList<String>();
		for(Collector collector: collectors) {
			collector.close();
		}
		for(Collector collector: collectors) {
			if(!join(collector.name(), collector)) {
				log.error("Collector [{}] did not exit within {} ms, terminating", collector.name(), config.joinTimeout());
				collector.terminate();
				forced.add(collector.name());
			}
		}
		for(BaseClient client: clients) {
			client.requestShutdown();
		}
		for(BaseClient client: clients) {
			if(!join(client.name(), client)) {
				log.error("Client [{}] did not exit within {} ms, terminating", client.name(), config.joinTimeout());
				client.terminate();
				forced.add(client.name());
			}
		}
		Slf4jReporter.forRegistry(registry)
			.outputTo(log)
			.convertRatesTo(TimeUnit.SECONDS)
			.convertDurationsTo(TimeUnit.MILLISECONDS)
			.build()
			.report();
		if(error!=null) {
			throw new AgentException(forced.isEmpty() ? error : error + ", terminated " + forced);
		}
		if(!forced.isEmpty()) {
			throw new AgentException("Tasks did not exit gracefully and were terminated: " + forced);
		}
		log.info("Agent shut down cleanly");
	}

	private boolean join(final String name, final Collector collector) {
		try {
			return collector.join(config.joinTimeout());
		} catch (InterruptedException iex) {
			Thread.currentThread().interrupt();
			log.warn("Interrupted while joining [{}]", name);
			return !collector.isAlive();
		}
	}

	private boolean join(final String name, final BaseClient client) {
		try {
			return client.join(config.joinTimeout());
		} catch (InterruptedException iex) {
			Thread.currentThread().interrupt();
			log.warn("Interrupted while joining [{}]", name);
			return !client.isAlive();
		}
	}

	/**
	 * Returns the intake queue collectors push samples to
	 * @return the intake queue
	 */
	public BlockingQueue<Sample> intake() {
		return intake;
	}

	public List<Collector> collectors() {
		return Collections.unmodifiableList(collectors);
	}

	public List<BaseClient> clients() {
		return Collections.unmodifiableList(clients);
	}

	public MetricRegistry registry() {
		return registry;
	}
}
