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

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import io.netty.buffer.ByteBufUtil;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.util.ReferenceCountUtil;
import net.metricsagent.ClientConfiguration;
import net.metricsagent.codec.LineCodec;
import net.metricsagent.transport.ConnectionException;

/**
 * <p>Title: CarbonClient</p>
 * <p>Description: Pushes samples to a carbon plaintext listener as
 * <b><code>name value timestamp</code></b> lines. A chunk is acknowledged once it is written to the socket.</p>
 * <p><code>net.metricsagent.protocol.CarbonClient</code></p>
 */

public class CarbonClient extends BaseClient {
	/** The line encoder */
	protected final LineCodec codec;

	/**
	 * Creates a new CarbonClient
	 * @param config The client configuration
	 * @param defaultMetadata Agent-wide metadata merged under every sample's metadata
	 */
	public CarbonClient(final ClientConfiguration config, final Map<String, String> defaultMetadata) {
		super(config, defaultMetadata);
		codec = new LineCodec(config.nameMapping());
	}

	@Override
	protected void processValues(final String bucket, final Map<String, Number> values, final double timestamp, final Map<String, String> metadata) {
		for(String line: codec.encode(bucket, values, timestamp, metadata)) {
			bufferOutput(line);
		}
	}

	@Override
	protected void pushChunk(final List<String> chunk) throws IOException, InterruptedException {
		final Channel ch = connection();
		final StringBuilder b = new StringBuilder();
		for(String line: chunk) {
			b.append(line);
		}
		final ChannelFuture f = ch.writeAndFlush(ByteBufUtil.writeUtf8(ch.alloc(), b));
		if(!f.await(config.sendTimeout(), TimeUnit.MILLISECONDS)) {
			throw new ConnectionException("Timed out sending " + chunk.size() + " lines to [" + ch.remoteAddress() + "]");
		}
		if(!f.isSuccess()) {
			throw new ConnectionException("Failed to send " + chunk.size() + " lines to [" + ch.remoteAddress() + "]", f.cause());
		}
		log.debug("Client [{}] sent {} lines", name, chunk.size());
	}

	@Override
	protected ChannelInitializer<Channel> channelInitializer() {
		return new ChannelInitializer<Channel>() {
			@Override
			protected void initChannel(final Channel ch) throws Exception {
				ch.pipeline().addLast("discard", new ChannelInboundHandlerAdapter() {
					@Override
					public void channelRead(final ChannelHandlerContext ctx, final Object msg) throws Exception {
						// carbon never answers
						ReferenceCountUtil.release(msg);
					}
					@Override
					public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) throws Exception {
						log.debug("Client [{}] connection error on [{}]", name, ctx.channel(), cause);
						ctx.close();
					}
				});
			}
		};
	}
}
