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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import net.metricsagent.sample.Sample;

/**
 * <p>Title: JvmStatsCollectorTest</p>
 * <p>Description: Tests for the JVM stats collector and the interval collector loop</p>
 * <p><code>net.metricsagent.task.JvmStatsCollectorTest</code></p>
 */

public class JvmStatsCollectorTest {

	@Test
	public void collectsMemoryThreadsAndRuntime() {
		final JvmStatsCollector collector = new JvmStatsCollector(new LinkedBlockingQueue<Sample>(), 1000, Collections.singletonMap("dc", "eu1"));
		final List<Sample> samples = collector.collect(1700000000D);
		final List<String> buckets = new ArrayList<String>();
		for(Sample s: samples) {
			buckets.add(s.bucket());
			assertThat(s.metadata()).containsKeys("host", "dc");
			assertThat(s.effectiveTimestamp()).isEqualTo(1700000000D);
		}
		assertThat(buckets).containsExactly("jvm_memory", "jvm_memory", "jvm_threads", "jvm_runtime");
		assertThat(samples.get(0).metadata()).containsEntry("area", "heap");
		assertThat(samples.get(0).values()).containsKeys("used", "committed");
		assertThat(samples.get(2).values().get("count").intValue()).isPositive();
	}

	@Test
	public void pushesUntilClosed() throws Exception {
		final LinkedBlockingQueue<Sample> intake = new LinkedBlockingQueue<Sample>();
		final JvmStatsCollector collector = new JvmStatsCollector(intake, 20, null);
		collector.start();
		final Sample first = intake.poll(5, TimeUnit.SECONDS);
		assertThat(first).isNotNull();
		assertThat(collector.isAlive()).isTrue();
		collector.close();
		assertThat(collector.join(5000)).isTrue();
		assertThat(collector.failure()).isNull();
		assertThat(collector.wasTerminated()).isFalse();
	}

	@Test
	public void terminateInterruptsStuckCollector() throws Exception {
		final LinkedBlockingQueue<Sample> intake = new LinkedBlockingQueue<Sample>();
		final BaseCollector stuck = new BaseCollector("stuck", intake, 10, null) {
			@Override
			protected List<Sample> collect(final double now) {
				return Collections.emptyList();
			}
			@Override
			public void close() {
				// ignores the request
			}
		};
		stuck.start();
		stuck.close();
		assertThat(stuck.join(100)).isFalse();
		assertThat(stuck.terminate()).isTrue();
		assertThat(stuck.wasTerminated()).isTrue();
		assertThat(stuck.failure()).isNull();
	}

	@Test
	public void failingCollectorDies() throws Exception {
		final BaseCollector failing = new BaseCollector("failing", new LinkedBlockingQueue<Sample>(), 10, null) {
			@Override
			protected List<Sample> collect(final double now) {
				throw new IllegalStateException("boom");
			}
		};
		failing.start();
		assertThat(failing.join(5000)).isTrue();
		assertThat(failing.isAlive()).isFalse();
		assertThat(failing.failure()).isInstanceOf(IllegalStateException.class).hasMessage("boom");
	}
}
