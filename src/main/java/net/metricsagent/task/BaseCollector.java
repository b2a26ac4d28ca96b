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
package net.metricsagent.task;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import net.metricsagent.sample.Sample;

/**
 * <p>Title: BaseCollector</p>
 * <p>Description: A collector that samples on a fixed interval</p>
 * <p><code>net.metricsagent.task.BaseCollector</code></p>
 */

public abstract class BaseCollector extends AgentTask implements Collector {
	/** The intake queue samples are pushed to */
	protected final BlockingQueue<Sample> intake;
	/** The sampling interval in ms */
	protected final long interval;
	/** Tags added to every sample */
	protected final Map<String, String> metadata;
	/** Released on close */
	private final CountDownLatch stopLatch = new CountDownLatch(1);

	/**
	 * Creates a new BaseCollector
	 * @param name The collector name
	 * @param intake The intake queue samples are pushed to
	 * @param interval The sampling interval in ms
	 * @param metadata Tags added to every sample, may be null
	 */
	protected BaseCollector(final String name, final BlockingQueue<Sample> intake, final long interval, final Map<String, String> metadata) {
		super(name);
		if(intake==null) throw new IllegalArgumentException("The passed intake queue was null");
		if(interval < 1) throw new IllegalArgumentException("Invalid interval: " + interval);
		this.intake = intake;
		this.interval = interval;
		this.metadata = metadata==null ? Collections.<String, String>emptyMap() : Collections.unmodifiableMap(new HashMap<String, String>(metadata));
	}

	/**
	 * Takes one round of samples
	 * @param now The current time in fractional epoch seconds
	 * @return the samples
	 */
	protected abstract List<Sample> collect(double now);

	@Override
	protected void runTask() throws Exception {
		do {
			final List<Sample> samples = collect(System.currentTimeMillis() / 1000D);
			for(Sample sample: samples) {
				intake.put(sample);
			}
			log.debug("Collector [{}] pushed {} samples", name, samples.size());
		} while(!stopLatch.await(interval, TimeUnit.MILLISECONDS));
	}

	@Override
	public void close() {
		stopLatch.countDown();
	}
}
