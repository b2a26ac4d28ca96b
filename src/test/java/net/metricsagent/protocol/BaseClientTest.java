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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import net.metricsagent.Backend;
import net.metricsagent.ClientConfiguration;
import net.metricsagent.sample.Sample;

/**
 * <p>Title: BaseClientTest</p>
 * <p>Description: Tests for buffering, chunked flushing and buffer retention</p>
 * <p><code>net.metricsagent.protocol.BaseClientTest</code></p>
 */

public class BaseClientTest {

	private static ClientConfiguration.Builder config() {
		return ClientConfiguration.builder(Backend.CARBON).name("rec");
	}

	private static Sample sample(final int i) {
		return new Sample(1700000000D + i, "cpu", Collections.singletonMap("idle", i), null, Collections.singletonMap("host", "a1"));
	}

	private static void fill(final BaseClient client, final int count) {
		for(int i = 0; i < count; i++) {
			client.accept(sample(i));
		}
	}

	static void await(final RecordingClient client, final int fragments, final long timeoutMs) throws InterruptedException {
		final long deadline = System.currentTimeMillis() + timeoutMs;
		while(client.pushedFragments().size() < fragments && System.currentTimeMillis() < deadline) {
			Thread.sleep(10);
		}
	}

	@Test
	public void acceptBuffersWithoutPushing() {
		final RecordingClient client = new RecordingClient(config().build());
		fill(client, 3);
		assertThat(client.bufferSnapshot()).hasSize(3);
		assertThat(client.pushed).isEmpty();
		assertThat(client.state()).isEqualTo(ClientState.DISCONNECTED);
	}

	@Test
	public void flushPushesInChunks() throws Exception {
		final RecordingClient client = new RecordingClient(config().chunkSize(2).build());
		fill(client, 5);
		final List<String> before = client.bufferSnapshot();
		assertThat(client.flush()).isTrue();
		assertThat(client.pushed).hasSize(3);
		assertThat(client.pushed.get(0)).hasSize(2);
		assertThat(client.pushed.get(2)).hasSize(1);
		assertThat(client.pushedFragments()).isEqualTo(before);
		assertThat(client.bufferSnapshot()).isEmpty();
		assertThat(client.state()).isEqualTo(ClientState.CONNECTED);
		assertThat(client.pushedCounter.getCount()).isEqualTo(5);
	}

	@Test
	public void failedFlushRetainsBuffer() throws Exception {
		final RecordingClient client = new RecordingClient(config().build());
		fill(client, 4);
		final List<String> before = client.bufferSnapshot();
		client.failures = 1;
		assertThat(client.flush()).isFalse();
		assertThat(client.bufferSnapshot()).isEqualTo(before);
		assertThat(client.state()).isEqualTo(ClientState.DISCONNECTED);
		assertThat(client.flushErrorCounter.getCount()).isEqualTo(1);

		client.accept(sample(10));
		assertThat(client.flush()).isTrue();
		assertThat(client.bufferSnapshot()).isEmpty();
		assertThat(client.pushedFragments()).hasSize(5).startsWith(before.toArray(new String[0]));
	}

	@Test
	public void failureMidFlushKeepsUnacknowledgedChunks() throws Exception {
		final RecordingClient client = new RecordingClient(config().chunkSize(2).build());
		fill(client, 5);
		final List<String> before = client.bufferSnapshot();
		client.successesBeforeFailure = 1;
		client.failures = 1;
		assertThat(client.flush()).isFalse();
		assertThat(client.pushedFragments()).isEqualTo(before.subList(0, 2));
		assertThat(client.bufferSnapshot()).isEqualTo(before.subList(2, 5));

		assertThat(client.flush()).isTrue();
		assertThat(client.pushedFragments()).isEqualTo(before);
	}

	@Test
	public void bufferLimitDropsOldest() {
		final RecordingClient client = new RecordingClient(config().bufferLimit(3).build());
		fill(client, 5);
		final List<String> buffered = client.bufferSnapshot();
		assertThat(buffered).hasSize(3);
		assertThat(buffered.get(0)).startsWith("cpu {idle=2}");
		assertThat(client.droppedCounter.getCount()).isEqualTo(2);
	}

	@Test
	public void defaultMetadataIsMergedUnderSampleMetadata() {
		final Map<String, String> defaults = new HashMap<String, String>();
		defaults.put("dc", "eu1");
		defaults.put("host", "default");
		final RecordingClient client = new RecordingClient(config().build(), defaults);
		client.accept(sample(0));
		assertThat(client.bufferSnapshot()).containsExactly("cpu {idle=0} 1700000000 {dc=eu1, host=a1}");
	}

	@Test
	public void emptyFlushDoesNothing() throws Exception {
		final RecordingClient client = new RecordingClient(config().build());
		client.failures = 1;
		assertThat(client.flush()).isTrue();
		assertThat(client.failures).isEqualTo(1);
	}

	@Test
	public void sentinelTriggersFinalFlush() throws Exception {
		final RecordingClient client = new RecordingClient(config().interval(60000).build());
		client.start();
		client.send(sample(0));
		client.send(sample(1));
		client.requestShutdown();
		assertThat(client.join(5000)).isTrue();
		assertThat(client.pushedFragments()).hasSize(2);
		assertThat(client.state()).isEqualTo(ClientState.CLOSED);
		assertThat(client.failure()).isNull();
	}

	@Test
	public void thresholdTriggersFlush() throws Exception {
		final RecordingClient client = new RecordingClient(config().interval(60000).flushThreshold(3).build());
		client.start();
		try {
			client.send(sample(0));
			client.send(sample(1));
			client.send(sample(2));
			await(client, 3, 5000);
			assertThat(client.pushedFragments()).hasSize(3);
		} finally {
			client.requestShutdown();
			client.join(5000);
		}
	}

	@Test
	public void intervalTriggersFlushAndRetries() throws Exception {
		final RecordingClient client = new RecordingClient(config().interval(50).build());
		client.failures = 2;
		client.start();
		try {
			client.send(sample(0));
			await(client, 1, 5000);
			assertThat(client.pushedFragments()).hasSize(1);
			assertThat(client.flushErrorCounter.getCount()).isEqualTo(2);
		} finally {
			client.requestShutdown();
			client.join(5000);
		}
	}

	@Test
	public void exposesMetrics() {
		final RecordingClient client = new RecordingClient(config().build());
		assertThat(client.getMetrics()).containsKeys("flush", "samples", "flushErrors", "dropped", "pushed", "bufferSize");
	}
}
