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
package net.metricsagent.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.net.InetSocketAddress;

import org.junit.jupiter.api.Test;

/**
 * <p>Title: StringsUtilTest</p>
 * <p>Description: Tests for string and address parsing</p>
 * <p><code>net.metricsagent.util.StringsUtilTest</code></p>
 */

public class StringsUtilTest {

	@Test
	public void splitsOnChar() {
		assertThat(StringsUtil.splitString("a.b..c", '.')).containsExactly("a", "b", "", "c");
		assertThat(StringsUtil.splitString("abc", '.')).containsExactly("abc");
	}

	@Test
	public void parsesHostAndPort() {
		final InetSocketAddress isa = StringsUtil.toAddress(" graphite:2004 ", 2003);
		assertThat(isa.getHostString()).isEqualTo("graphite");
		assertThat(isa.getPort()).isEqualTo(2004);
		assertThat(isa.isUnresolved()).isTrue();
	}

	@Test
	public void appliesDefaultPort() {
		assertThat(StringsUtil.toAddress("graphite", 2003).getPort()).isEqualTo(2003);
		assertThat(StringsUtil.toAddress("graphite:", 9200).getPort()).isEqualTo(9200);
	}

	@Test
	public void rejectsBadAddresses() {
		assertThatThrownBy(() -> StringsUtil.toAddress("", 1)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> StringsUtil.toAddress(":2003", 1)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> StringsUtil.toAddress("host:port", 1)).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> StringsUtil.toAddress("a:1:2", 1)).isInstanceOf(IllegalArgumentException.class);
	}
}
