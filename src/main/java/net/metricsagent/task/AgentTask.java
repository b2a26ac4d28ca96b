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

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Title: AgentTask</p>
 * <p>Description: A supervised unit of work running on its own thread. Tasks share nothing
 * with the supervisor except the queues they are handed, and expose liveness, bounded join and
 * forced termination so the supervisor can police them.</p>
 * <p><code>net.metricsagent.task.AgentTask</code></p>
 */

public abstract class AgentTask {
	/** Instance logger */
	protected final Logger log = LoggerFactory.getLogger(getClass());
	/** The task name */
	protected final String name;
	/** The thread the task runs on */
	private final Thread thread;
	private final AtomicBoolean started = new AtomicBoolean(false);
	/** Set when the supervisor forcibly terminated the task */
	private final AtomicBoolean terminated = new AtomicBoolean(false);
	/** The throwable that killed the task, if any */
	private volatile Throwable failure = null;

	/**
	 * Creates a new AgentTask
	 * @param name The task name
	 */
	protected AgentTask(final String name) {
		if(name==null || name.trim().isEmpty()) throw new IllegalArgumentException("The passed name was null or empty");
		this.name = name;
		thread = new Thread(new Runnable() {
			@Override
			public void run() {
				execute();
			}
		}, name);
		thread.setDaemon(true);
	}

	/**
	 * The task body. Returning normally means the task exited cleanly.
	 * @throws Exception on any failure, which ends the task
	 */
	protected abstract void runTask() throws Exception;

	private void execute() {
		log.info("Task [{}] started", name);
		try {
			runTask();
			log.info("Task [{}] exited", name);
		} catch (InterruptedException iex) {
			if(terminated.get()) {
				log.warn("Task [{}] terminated", name);
			} else {
				failure = iex;
				log.error("Task [{}] interrupted", name, iex);
			}
		} catch (Throwable t) {
			failure = t;
			log.error("Task [{}] died", name, t);
		}
	}

	/**
	 * Starts the task
	 */
	public void start() {
		if(started.compareAndSet(false, true)) {
			thread.start();
		}
	}

	/**
	 * Indicates if the task's thread is running
	 * @return true if running
	 */
	public boolean isAlive() {
		return thread.isAlive();
	}

	/**
	 * Waits up to the passed timeout for the task to exit
	 * @param timeoutMs The timeout in ms
	 * @return true if the task has exited
	 * @throws InterruptedException if the calling thread was interrupted
	 */
	public boolean join(final long timeoutMs) throws InterruptedException {
		thread.join(Math.max(1L, timeoutMs));
		return !thread.isAlive();
	}

	/**
	 * Forcibly terminates the task by interrupting its thread and waiting briefly for it to go
	 * @return true if the task has exited
	 */
	public boolean terminate() {
		terminated.set(true);
		thread.interrupt();
		try {
			thread.join(TimeUnit.SECONDS.toMillis(1));
		} catch (InterruptedException iex) {
			Thread.currentThread().interrupt();
		}
		return !thread.isAlive();
	}

	public String name() {
		return name;
	}

	/**
	 * Returns the throwable that killed the task
	 * @return the failure or null
	 */
	public Throwable failure() {
		return failure;
	}

	public boolean wasTerminated() {
		return terminated.get();
	}

	@Override
	public String toString() {
		return getClass().getSimpleName() + " [" + name + "]";
	}
}
