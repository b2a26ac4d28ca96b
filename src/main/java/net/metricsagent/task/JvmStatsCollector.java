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

import java.lang.management.ClassLoadingMXBean;
import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.lang.management.RuntimeMXBean;
import java.lang.management.ThreadMXBean;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;

import net.metricsagent.sample.Sample;
import net.metricsagent.util.LocalHost;

/**
 * <p>Title: JvmStatsCollector</p>
 * <p>Description: Samples the agent's own JVM: memory, threads, class loading and uptime</p>
 * <p><code>net.metricsagent.task.JvmStatsCollector</code></p>
 */

public class JvmStatsCollector extends BaseCollector {
	/** The collector name in the configuration */
	public static final String NAME = "jvm";

	protected final MemoryMXBean memory = ManagementFactory.getMemoryMXBean();
	protected final ThreadMXBean threads = ManagementFactory.getThreadMXBean();
	protected final ClassLoadingMXBean classLoading = ManagementFactory.getClassLoadingMXBean();
	protected final RuntimeMXBean runtime = ManagementFactory.getRuntimeMXBean();

	/** The tags on every sample, the host plus the configured metadata */
	private final Map<String, String> tags;

	/**
	 * Creates a new JvmStatsCollector
	 * @param intake The intake queue samples are pushed to
	 * @param interval The sampling interval in ms
	 * @param metadata Tags added to every sample, may be null
	 */
	public JvmStatsCollector(final BlockingQueue<Sample> intake, final long interval, final Map<String, String> metadata) {
		super(NAME, intake, interval, metadata);
		final Map<String, String> t = new HashMap<String, String>(this.metadata);
		if(!t.containsKey("host")) {
			t.put("host", LocalHost.hostName());
		}
		tags = t;
	}

	@Override
	protected List<Sample> collect(final double now) {
		final List<Sample> samples = new ArrayList<Sample>(4);
		samples.add(memorySample(now, "heap", memory.getHeapMemoryUsage()));
		samples.add(memorySample(now, "nonheap", memory.getNonHeapMemoryUsage()));

		final Map<String, Number> t = new LinkedHashMap<String, Number>();
		t.put("count", threads.getThreadCount());
		t.put("daemon", threads.getDaemonThreadCount());
		t.put("peak", threads.getPeakThreadCount());
		samples.add(new Sample(now, "jvm_threads", t, null, tags));

		final Map<String, Number> r = new LinkedHashMap<String, Number>();
		r.put("uptime", runtime.getUptime());
		r.put("classes_loaded", classLoading.getLoadedClassCount());
		r.put("classes_unloaded", classLoading.getUnloadedClassCount());
		samples.add(new Sample(now, "jvm_runtime", r, null, tags));
		return samples;
	}

	protected Sample memorySample(final double now, final String area, final MemoryUsage usage) {
		final Map<String, Number> v = new LinkedHashMap<String, Number>();
		v.put("used", usage.getUsed());
		v.put("committed", usage.getCommitted());
		if(usage.getMax() >= 0) {
			v.put("max", usage.getMax());
		}
		final Map<String, String> m = new HashMap<String, String>(tags);
		m.put("area", area);
		return new Sample(now, "jvm_memory", v, null, m);
	}
}
