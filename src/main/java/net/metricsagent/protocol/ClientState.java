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

/**
 * <p>Title: ClientState</p>
 * <p>Description: The push state of a client</p>
 * <p><code>net.metricsagent.protocol.ClientState</code></p>
 */

public enum ClientState {
	/** No connection is held. The next flush connects. */
	DISCONNECTED,
	/** A connection is held and the last flush succeeded */
	CONNECTED,
	/** A flush is in progress */
	FLUSHING,
	/** The client received the sentinel and released its connection */
	CLOSED;
}
