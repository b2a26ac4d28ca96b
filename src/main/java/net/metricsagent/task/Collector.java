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

/**
 * <p>Title: Collector</p>
 * <p>Description: A sample source. A collector runs concurrently, pushes
 * {@link net.metricsagent.sample.Sample}s onto the intake queue it was constructed with,
 * and exits when asked to close.</p>
 * <p><code>net.metricsagent.task.Collector</code></p>
 */

public interface Collector {

	public String name();

	/**
	 * Starts collecting
	 */
	public void start();

	/**
	 * Asks the collector to stop. Does not wait for it.
	 */
	public void close();

	public boolean isAlive();

	/**
	 * Waits up to the passed timeout for the collector to exit
	 * @param timeoutMs The timeout in ms
	 * @return true if the collector has exited
	 * @throws InterruptedException if the calling thread was interrupted
	 */
	public boolean join(long timeoutMs) throws InterruptedException;

	/**
	 * Forcibly stops the collector
	 * @return true if the collector has exited
	 */
	public boolean terminate();
}
