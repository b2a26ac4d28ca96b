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

import java.io.Closeable;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.ImmutableList;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.internal.logging.InternalLoggerFactory;
import io.netty.util.internal.logging.Slf4JLoggerFactory;

/**
 * <p>Title: TcpConnector</p>
 * <p>Description: Lazily owns the single outbound connection of one client. The connection is
 * opened on demand, kept while it stays active and discarded by the caller after any failure,
 * after which the next remote host in the list is used. No retry happens in here.</p>
 * <p><code>net.metricsagent.transport.TcpConnector</code></p>
 */

public class TcpConnector implements Closeable {
	/** Instance logger */
	protected final Logger log = LoggerFactory.getLogger(getClass());

	/** The remote endpoints, tried in order */
	protected final List<InetSocketAddress> remoteHosts;
	/** The connect timeout in ms */
	protected final int connectTimeout;
	/** The single threaded event loop owned by this connector */
	protected final EventLoopGroup group;
	protected final Bootstrap bootstrap = new Bootstrap();

	/** The current connection, null when disconnected */
	protected Channel channel = null;
	/** The index of the remote host the next connect goes to */
	protected int hostIndex = 0;

	static {
		InternalLoggerFactory.setDefaultFactory(Slf4JLoggerFactory.INSTANCE);
	}

	/**
	 * Creates a new TcpConnector
	 * @param name The owning client's name, used for the event loop thread
	 * @param remoteHosts The remote endpoints, tried in order
	 * @param connectTimeout The connect timeout in ms
	 * @param initializer The channel pipeline initializer
	 */
	public TcpConnector(final String name, final List<InetSocketAddress> remoteHosts, final int connectTimeout, final ChannelInitializer<Channel> initializer) {
		if(remoteHosts==null || remoteHosts.isEmpty()) throw new IllegalArgumentException("The passed remote hosts were null or empty");
		if(initializer==null) throw new IllegalArgumentException("The passed ChannelInitializer was null");
		this.remoteHosts = ImmutableList.copyOf(remoteHosts);
		this.connectTimeout = connectTimeout;
		group = new NioEventLoopGroup(1, new DefaultThreadFactory(name + "-io", true));
		bootstrap
			.group(group)
			.channel(NioSocketChannel.class)
			.option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeout)
			.option(ChannelOption.TCP_NODELAY, true)
			.option(ChannelOption.SO_KEEPALIVE, true)
			.handler(initializer);
	}

	/**
	 * Returns the current connection, opening one if there is none and <code>connect</code> is true
	 * @param connect true to connect when disconnected
	 * @return the connection, or null if disconnected and <code>connect</code> is false
	 * @throws ConnectionException if the connect failed or timed out
	 * @throws InterruptedException if the thread was interrupted while connecting
	 */
	public Channel getChannel(final boolean connect) throws ConnectionException, InterruptedException {
		if(channel!=null) {
			if(channel.isActive()) return channel;
			log.debug("Discarding inactive connection [{}]", channel);
			drop();
		}
		if(!connect) return null;
		final InetSocketAddress remote = remoteHosts.get(hostIndex);
		final ChannelFuture connectFuture = bootstrap.connect(remote.getHostString(), remote.getPort());
		if(!connectFuture.await(connectTimeout + 1000L, TimeUnit.MILLISECONDS)) {
			connectFuture.cancel(true);
			advance();
			throw new ConnectionException("Timed out connecting to [" + remote + "]");
		}
		if(!connectFuture.isSuccess()) {
			advance();
			throw new ConnectionException("Failed to connect to [" + remote + "]", connectFuture.cause());
		}
		channel = connectFuture.channel();
		log.info("Connected to [{}]", remote);
		return channel;
	}

	/**
	 * Discards the current connection after a failure. The next connect goes to the next remote host.
	 */
	public void drop() {
		final Channel ch = channel;
		channel = null;
		if(ch!=null) {
			advance();
			ch.close();
			log.debug("Dropped connection [{}]", ch);
		}
	}

	/**
	 * Indicates if a connection is currently held
	 * @return true if connected
	 */
	public boolean isConnected() {
		return channel!=null && channel.isActive();
	}

	/**
	 * Returns the remote host the next connect goes to
	 * @return the remote host
	 */
	public InetSocketAddress currentHost() {
		return remoteHosts.get(hostIndex);
	}

	protected void advance() {
		hostIndex = (hostIndex + 1) % remoteHosts.size();
	}

	/**
	 * Closes the connection and releases the event loop
	 */
	@Override
	public void close() {
		final Channel ch = channel;
		channel = null;
		if(ch!=null) {
			ch.close().awaitUninterruptibly(connectTimeout);
		}
		group.shutdownGracefully(0, 1, TimeUnit.SECONDS);
	}
}
