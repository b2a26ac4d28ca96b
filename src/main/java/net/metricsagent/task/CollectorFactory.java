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

import java.util.concurrent.BlockingQueue;

import net.metricsagent.CollectorConfiguration;
import net.metricsagent.sample.Sample;

/**
 * <p>Title: CollectorFactory</p>
 * <p>Description: Creates the collectors of one collector type</p>
 * <p><code>net.metricsagent.task.CollectorFactory</code></p>
 */

public interface CollectorFactory {

	/**
	 * Creates a new, unstarted collector
	 * @param config The collector configuration
	 * @param intake The intake queue the collector pushes samples to
	 * @return the new collector
	 */
	public Collector newCollector(CollectorConfiguration config, BlockingQueue<Sample> intake);
}
