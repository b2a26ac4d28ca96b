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
package net.metricsagent.transport;

import java.io.IOException;

/**
 * <p>Title: ConnectionException</p>
 * <p>Description: A transient transport failure. The connection that raised it must be
 * discarded, the data it was carrying is kept and retried on the next flush.</p>
 * <p><code>net.metricsagent.transport.ConnectionException</code></p>
 */

public class ConnectionException extends IOException {

	/**  */
	private static final long serialVersionUID = -3318734620437102465L;

	public ConnectionException(final String message) {
		super(message);
	}

	public ConnectionException(final String message, final Throwable cause) {
		super(message, cause);
	}

}
