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

import java.net.ServerSocket;
import java.util.Collections;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import net.metricsagent.Backend;
import net.metricsagent.ClientConfiguration;
import net.metricsagent.protocol.TestServers.LineServer;
import net.metricsagent.sample.Sample;

/**
 * <p>Title: CarbonClientTest</p>
 * <p>Description: Tests the carbon client against an in-process line server</p>
 * <p><code>net.metricsagent.protocol.CarbonClientTest</code></p>
 */

public class CarbonClientTest {

	private static final Sample CPU = new Sample(1700000000D, "cpu", Collections.singletonMap("idle", 97.5), null, Collections.singletonMap("host", "a1"));

	static String deadAddress() throws Exception {
		try (ServerSocket ss = new ServerSocket(0)) {
			return "127.0.0.1:" + ss.getLocalPort();
		}
	}

	@Test
	public void pushesPlaintextLines() throws Exception {
		try (LineServer server = new LineServer()) {
			final CarbonClient client = new CarbonClient(ClientConfiguration.builder(Backend.CARBON)
					.remoteHost(server.address())
					.nameMapping(Collections.singletonList("host"))
					.build(), null);
			try {
				client.accept(CPU);
				assertThat(client.flush()).isTrue();
				assertThat(server.lines.poll(5, TimeUnit.SECONDS)).isEqualTo("a1.cpu.idle 97.5 1700000000");
				assertThat(client.bufferSnapshot()).isEmpty();
				assertThat(client.connector().isConnected()).isTrue();
			} finally {
				client.releaseConnector();
			}
		}
	}

	@Test
	public void retainsBufferUntilAHostAccepts() throws Exception {
		try (LineServer server = new LineServer()) {
			final CarbonClient client = new CarbonClient(ClientConfiguration.builder(Backend.CARBON)
					.remoteHost(deadAddress())
					.remoteHost(server.address())
					.connectTimeout(1000)
					.build(), Collections.singletonMap("dc", "eu1"));
			try {
				client.accept(CPU);
				assertThat(client.flush()).isFalse();
				assertThat(client.bufferSnapshot()).containsExactly("cpu.eu1.a1.idle 97.5 1700000000\n");
				assertThat(client.state()).isEqualTo(ClientState.DISCONNECTED);

				client.accept(new Sample(1700000001D, "cpu", Collections.singletonMap("idle", 90), null, Collections.singletonMap("host", "a1")));
				assertThat(client.flush()).isTrue();
				// cpu, dc, host, value sorted by key
				assertThat(server.lines.poll(5, TimeUnit.SECONDS)).isEqualTo("cpu.eu1.a1.idle 97.5 1700000000");
				assertThat(server.lines.poll(5, TimeUnit.SECONDS)).isEqualTo("cpu.eu1.a1.idle 90 1700000001");
				assertThat(client.state()).isEqualTo(ClientState.CONNECTED);
			} finally {
				client.releaseConnector();
			}
		}
	}

	@Test
	public void runsAsTask() throws Exception {
		try (LineServer server = new LineServer()) {
			final CarbonClient client = new CarbonClient(ClientConfiguration.builder(Backend.CARBON)
					.remoteHost(server.address())
					.interval(60000)
					.build(), null);
			client.start();
			client.send(CPU);
			client.requestShutdown();
			assertThat(client.join(10000)).isTrue();
			assertThat(server.lines.poll(5, TimeUnit.SECONDS)).isEqualTo("cpu.a1.idle 97.5 1700000000");
			assertThat(client.state()).isEqualTo(ClientState.CLOSED);
		}
	}
}
