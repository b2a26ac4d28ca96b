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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.metricsagent.json.JSONOps;

/**
 * <p>Title: Main</p>
 * <p>Description: Command line entry point. Loads the configuration file passed as the sole
 * argument, or the bundled <code>metrics-agent.json</code> when there is none, and runs the agent
 * until it is signalled.</p>
 * <p>A signal starts the JVM shutdown before {@link #run(String[])} returns, so the exit code can no
 * longer be set by <code>System.exit</code>. The shutdown hook waits for the code computed by the
 * agent thread and halts the JVM with it.</p>
 * <p><code>net.metricsagent.Main</code></p>
 */

public class Main {
	private static final Logger LOG = LoggerFactory.getLogger(Main.class);
	/** The classpath resource holding the default configuration */
	public static final String DEFAULT_CONFIG = "/metrics-agent.json";
	/** The time allowed to a forcibly terminated task to exit, in ms */
	private static final long TERMINATE_GRACE = TimeUnit.SECONDS.toMillis(1);

	/** Set once the shutdown hook runs */
	private static final AtomicBoolean hookActive = new AtomicBoolean(false);

	/**
	 * @param args The optional path of the JSON configuration file
	 */
	public static void main(final String[] args) {
		final int code = run(args);
		if(!hookActive.get()) {
			System.exit(code);
		}
	}

	/**
	 * Runs the agent
	 * @param args The optional path of the JSON configuration file
	 * @return the process exit code, 0 on a clean shutdown
	 */
	public static int run(final String[] args) {
		final AgentConfiguration config;
		try {
			config = loadConfiguration(args);
		} catch (RuntimeException ex) {
			LOG.error("Invalid configuration", ex);
			return 1;
		}
		LOG.info("Configuration: {}", JSONOps.serializeToString(config));
		final Agent agent = new Agent(config);
		try {
			agent.start();
		} catch (RuntimeException ex) {
			LOG.error("Agent failed to start", ex);
			return 1;
		}
		final AtomicInteger exitCode = new AtomicInteger(1);
		final CountDownLatch exited = new CountDownLatch(1);
		final int tasks = agent.collectors().size() + agent.clients().size();
		final long hookWait = config.pollTimeout() + (config.joinTimeout() + TERMINATE_GRACE) * tasks + TERMINATE_GRACE;
		Runtime.getRuntime().addShutdownHook(new Thread("AgentShutdownHook") {
			@Override
			public void run() {
				hookActive.set(true);
				agent.stop();
				try {
					if(!exited.await(hookWait, TimeUnit.MILLISECONDS)) {
						LOG.error("Agent did not shut down within {} ms", hookWait);
					}
				} catch (InterruptedException iex) {
					Thread.currentThread().interrupt();
				}
				Runtime.getRuntime().halt(exitCode.get());
			}
		});
		try {
			agent.run();
			exitCode.set(0);
		} catch (AgentException ex) {
			LOG.error("Agent failed", ex);
		} finally {
			LOG.info("Agent exited with code {}", exitCode.get());
			exited.countDown();
		}
		return exitCode.get();
	}

	/**
	 * Loads the configuration from the file named by the first argument,
	 * or from the classpath when there is no argument
	 * @param args The command line arguments
	 * @return the configuration
	 */
	static AgentConfiguration loadConfiguration(final String[] args) {
		if(args==null || args.length==0) {
			final InputStream is = Main.class.getResourceAsStream(DEFAULT_CONFIG);
			if(is==null) {
				LOG.info("No configuration file specified and no [{}] on the classpath, using defaults", DEFAULT_CONFIG);
				return AgentConfiguration.defaults();
			}
			LOG.info("No configuration file specified, loading [{}] from the classpath", DEFAULT_CONFIG);
			try {
				return JSONOps.parseToObject(is, AgentConfiguration.class);
			} finally {
				try {
					is.close();
				} catch (IOException ex) {
					LOG.debug("Failed to close [{}]: {}", DEFAULT_CONFIG, ex.toString());
				}
			}
		}
		final File file = new File(args[0]);
		if(!file.canRead()) throw new IllegalArgumentException("Cannot read configuration file [" + file + "]");
		LOG.info("Loading configuration from [{}]", file.getAbsolutePath());
		return JSONOps.parseToObject(file, AgentConfiguration.class);
	}
}
