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

/**
 * <p>Title: AgentException</p>
 * <p>Description: Fatal agent condition. Raised by the supervisor when a task died,
 * when tasks had to be forcibly terminated on shutdown or when shutdown itself failed.</p>
 * <p><code>net.metricsagent.AgentException</code></p>
 */

public class AgentException extends RuntimeException {

	/**  */
	private static final long serialVersionUID = -2841764512308412877L;

	public AgentException(String message, Throwable cause) {
		super(message, cause);
	}

	public AgentException(String message) {
		super(message);
	}

}
