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

import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.util.concurrent.Promise;
import net.metricsagent.transport.ConnectionException;

/**
 * <p>Title: HttpResponseHandler</p>
 * <p>Description: Completes the promise of the one outstanding request on a connection
 * with the status of the aggregated response</p>
 * <p><code>net.metricsagent.protocol.HttpResponseHandler</code></p>
 */

public class HttpResponseHandler extends SimpleChannelInboundHandler<FullHttpResponse> {
	private static final Logger LOG = LoggerFactory.getLogger(HttpResponseHandler.class);
	/** The promise of the outstanding request */
	private final AtomicReference<Promise<HttpResponseStatus>> pending = new AtomicReference<Promise<HttpResponseStatus>>(null);

	/**
	 * Registers the promise to complete with the next response
	 * @param promise The promise
	 */
	public void expect(final Promise<HttpResponseStatus> promise) {
		pending.set(promise);
	}

	@Override
	protected void channelRead0(final ChannelHandlerContext ctx, final FullHttpResponse response) throws Exception {
		final Promise<HttpResponseStatus> promise = pending.getAndSet(null);
		if(promise!=null) {
			promise.trySuccess(response.status());
		} else {
			LOG.debug("Unsolicited response [{}] on [{}]", response.status(), ctx.channel());
		}
	}

	@Override
	public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) throws Exception {
		final Promise<HttpResponseStatus> promise = pending.getAndSet(null);
		if(promise!=null) {
			promise.tryFailure(cause);
		}
		LOG.debug("Connection error on [{}]", ctx.channel(), cause);
		ctx.close();
	}

	@Override
	public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
		final Promise<HttpResponseStatus> promise = pending.getAndSet(null);
		if(promise!=null) {
			promise.tryFailure(new ConnectionException("Connection [" + ctx.channel() + "] closed before a response was received"));
		}
		super.channelInactive(ctx);
	}
}
