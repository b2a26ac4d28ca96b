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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BlockingQueue;

import org.junit.jupiter.api.Test;

import net.metricsagent.protocol.BaseClient;
import net.metricsagent.protocol.ClientState;
import net.metricsagent.protocol.RecordingClient;
import net.metricsagent.sample.Sample;
import net.metricsagent.task.BaseCollector;
import net.metricsagent.task.Collector;
import net.metricsagent.task.CollectorFactory;

/**
 * <p>Title: AgentTest</p>
 * <p>Description: Tests fan-out, liveness policing and the shutdown sequence of the supervisor</p>
 * <p><code>net.metricsagent.AgentTest</code></p>
 */

public class AgentTest {

	private static AgentConfiguration config(final long joinTimeout) {
		return new AgentConfiguration(null, 50, joinTimeout, null, null);
	}

	private static ClientConfiguration client(final String name) {
		return ClientConfiguration.builder(Backend.CARBON).name(name).interval(50).build();
	}

	/**
	 * Emits one sample of the configured bucket per interval
	 */
	static class FixedCollector extends BaseCollector {
		private final String bucket;
		private int seq = 0;

		FixedCollector(final String name, final BlockingQueue<Sample> intake, final String bucket) {
			super(name, intake, 20, null);
			this.bucket = bucket;
		}

		@Override
		protected List<Sample> collect(final double now) {
			return Collections.singletonList(new Sample(now, bucket, Collections.singletonMap("seq", seq++), null, Collections.singletonMap("host", "a1")));
		}
	}

	private static Thread stopLater(final Agent agent, final long delayMs) {
		final Thread t = new Thread("stopper") {
			@Override
			public void run() {
				try {
					Thread.sleep(delayMs);
				} catch (InterruptedException iex) {
					Thread.currentThread().interrupt();
				}
				agent.stop();
			}
		};
		t.setDaemon(true);
		t.start();
		return t;
	}

	@Test
	public void fansOutEverySampleAndShutsDownCleanly() throws Exception {
		final Agent agent = new Agent(config(5000));
		final RecordingClient first = new RecordingClient(client("first"));
		final RecordingClient second = new RecordingClient(client("second"));
		agent.start(Collections.singletonList(new FixedCollector("fixed", agent.intake(), "cpu")), Arrays.asList(first, second));
		stopLater(agent, 500);
		agent.run();
		assertThat(first.pushedFragments()).isNotEmpty().isEqualTo(second.pushedFragments());
		assertThat(first.state()).isEqualTo(ClientState.CLOSED);
		assertThat(second.state()).isEqualTo(ClientState.CLOSED);
		assertThat(first.isAlive()).isFalse();
		assertThat(agent.collectors().get(0).isAlive()).isFalse();
		assertThat(agent.registry().getMeters().get("forwarded").getCount()).isEqualTo(first.pushedFragments().size());
		assertThat(agent.registry().getNames()).contains("client.first.flush", "client.second.pushed");
	}

	@Test
	public void deadClientShutsTheAgentDown() throws Exception {
		final Agent agent = new Agent(config(5000));
		final RecordingClient healthy = new RecordingClient(client("healthy"));
		final RecordingClient poisoned = new RecordingClient(client("poisoned"));
		poisoned.poison = "cpu";
		agent.start(Collections.singletonList(new FixedCollector("fixed", agent.intake(), "cpu")), Arrays.asList(healthy, poisoned));
		assertThatThrownBy(agent::run)
			.isInstanceOf(AgentException.class)
			.hasMessageContaining("Client [poisoned] died");
		assertThat(healthy.isAlive()).isFalse();
		assertThat(healthy.state()).isEqualTo(ClientState.CLOSED);
		assertThat(poisoned.failure()).isInstanceOf(IllegalStateException.class);
	}

	@Test
	public void deadCollectorShutsTheAgentDown() throws Exception {
		final Agent agent = new Agent(config(5000));
		final RecordingClient client = new RecordingClient(client("client"));
		final BaseCollector failing = new BaseCollector("failing", agent.intake(), 20, null) {
			@Override
			protected List<Sample> collect(final double now) {
				throw new IllegalStateException("boom");
			}
		};
		agent.start(Collections.singletonList(failing), Collections.singletonList(client));
		assertThatThrownBy(agent::run)
			.isInstanceOf(AgentException.class)
			.hasMessageContaining("Collector [failing] died");
		assertThat(client.isAlive()).isFalse();
	}

	@Test
	public void stuckCollectorIsTerminated() throws Exception {
		final Agent agent = new Agent(config(200));
		final RecordingClient client = new RecordingClient(client("client"));
		final BaseCollector stuck = new BaseCollector("stuck", agent.intake(), 20, null) {
			@Override
			protected List<Sample> collect(final double now) {
				return Collections.emptyList();
			}
			@Override
			public void close() {
				// never stops on request
			}
		};
		agent.start(Collections.singletonList(stuck), Collections.singletonList(client));
		stopLater(agent, 100);
		assertThatThrownBy(agent::run)
			.isInstanceOf(AgentException.class)
			.hasMessageContaining("stuck");
		assertThat(stuck.isAlive()).isFalse();
		assertThat(stuck.wasTerminated()).isTrue();
		assertThat(client.state()).isEqualTo(ClientState.CLOSED);
	}

	@Test
	public void startBuildsEnabledTasksFromConfiguration() throws Exception {
		final CollectorConfiguration enabled = new CollectorConfiguration("sampler", "fixed", true, 1000, null);
		final CollectorConfiguration disabled = new CollectorConfiguration("jvm", null, false, 1000, null);
		final ClientConfiguration carbon = ClientConfiguration.builder(Backend.CARBON).build();
		final ClientConfiguration es = ClientConfiguration.builder(Backend.ELASTICSEARCH).enabled(false).build();
		final Agent agent = new Agent(new AgentConfiguration(null, 50, 5000, Arrays.asList(enabled, disabled), Arrays.asList(carbon, es)));
		agent.registerCollector("fixed", new CollectorFactory() {
			@Override
			public Collector newCollector(final CollectorConfiguration config, final BlockingQueue<Sample> intake) {
				return new FixedCollector(config.name(), intake, "cpu");
			}
		});
		agent.start();
		try {
			assertThat(agent.collectors()).extracting(Collector::name).containsExactly("sampler");
			assertThat(agent.clients()).extracting(BaseClient::name).containsExactly("carbon");
		} finally {
			agent.stop();
			agent.run();
		}
	}

	@Test
	public void unknownCollectorTypeIsRejected() {
		final Agent agent = new Agent(new AgentConfiguration(Collections.singletonList(new CollectorConfiguration("statsd")), null));
		assertThatThrownBy(agent::start)
			.isInstanceOf(IllegalArgumentException.class)
			.hasMessageContaining("statsd");
	}
}
