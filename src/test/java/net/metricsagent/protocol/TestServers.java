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

import java.io.Closeable;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpContentDecompressor;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.string.StringDecoder;

/**
 * <p>Title: TestServers</p>
 * <p>Description: In-process carbon and bulk servers bound to ephemeral loopback ports</p>
 * <p><code>net.metricsagent.protocol.TestServers</code></p>
 */

public class TestServers {

	/**
	 * <p>Title: TestServer</p>
	 * <p>Description: Owns the event loop and the bound server channel</p>
	 */
	public abstract static class TestServer implements Closeable {
		protected final EventLoopGroup group = new NioEventLoopGroup(1);
		protected final Channel serverChannel;

		protected TestServer() throws InterruptedException {
			serverChannel = new ServerBootstrap()
				.group(group)
				.channel(NioServerSocketChannel.class)
				.childHandler(new ChannelInitializer<Channel>() {
					@Override
					protected void initChannel(final Channel ch) throws Exception {
						configure(ch);
					}
				})
				.bind("127.0.0.1", 0).sync().channel();
		}

		protected abstract void configure(Channel ch);

		public int port() {
			return ((InetSocketAddress)serverChannel.localAddress()).getPort();
		}

		public String address() {
			return "127.0.0.1:" + port();
		}

		@Override
		public void close() {
			serverChannel.close().awaitUninterruptibly(2000);
			group.shutdownGracefully(0, 1, TimeUnit.SECONDS).awaitUninterruptibly(5000);
		}
	}

	/**
	 * <p>Title: LineServer</p>
	 * <p>Description: Records received plaintext lines without their EOL</p>
	 */
	public static class LineServer extends TestServer {
		public final BlockingQueue<String> lines = new LinkedBlockingQueue<String>();

		public LineServer() throws InterruptedException {
			super();
		}

		@Override
		protected void configure(final Channel ch) {
			ch.pipeline().addLast(new LineBasedFrameDecoder(8192), new StringDecoder(StandardCharsets.UTF_8), new SimpleChannelInboundHandler<String>() {
				@Override
				protected void channelRead0(final ChannelHandlerContext ctx, final String msg) throws Exception {
					lines.add(msg);
				}
			});
		}
	}

	/**
	 * <p>Title: BulkRequest</p>
	 * <p>Description: One received bulk request, body decompressed</p>
	 */
	public static class BulkRequest {
		public final String uri;
		public final String contentType;
		public final String contentEncoding;
		public final String acceptEncoding;
		public final String body;

		BulkRequest(final String uri, final String contentType, final String contentEncoding, final String acceptEncoding, final String body) {
			this.uri = uri;
			this.contentType = contentType;
			this.contentEncoding = contentEncoding;
			this.acceptEncoding = acceptEncoding;
			this.body = body;
		}
	}

	/**
	 * <p>Title: BulkServer</p>
	 * <p>Description: Records bulk requests and answers each with the configured status</p>
	 */
	public static class BulkServer extends TestServer {
		public final BlockingQueue<BulkRequest> requests = new LinkedBlockingQueue<BulkRequest>();
		/** The status of the next responses */
		public volatile HttpResponseStatus status = HttpResponseStatus.OK;

		public BulkServer() throws InterruptedException {
			super();
		}

		@Override
		protected void configure(final Channel ch) {
			final String[] encoding = new String[1];
			ch.pipeline().addLast(new HttpServerCodec());
			ch.pipeline().addLast(new ChannelInboundHandlerAdapter() {
				@Override
				public void channelRead(final ChannelHandlerContext ctx, final Object msg) throws Exception {
					if(msg instanceof HttpRequest) {
						encoding[0] = ((HttpRequest)msg).headers().get(HttpHeaderNames.CONTENT_ENCODING);
					}
					ctx.fireChannelRead(msg);
				}
			});
			ch.pipeline().addLast(new HttpContentDecompressor());
			ch.pipeline().addLast(new HttpObjectAggregator(10 * 1024 * 1024));
			ch.pipeline().addLast(new SimpleChannelInboundHandler<FullHttpRequest>() {
				@Override
				protected void channelRead0(final ChannelHandlerContext ctx, final FullHttpRequest request) throws Exception {
					requests.add(new BulkRequest(
						request.uri(),
						request.headers().get(HttpHeaderNames.CONTENT_TYPE),
						encoding[0],
						request.headers().get(HttpHeaderNames.ACCEPT_ENCODING),
						request.content().toString(StandardCharsets.UTF_8)
					));
					final FullHttpResponse response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status,
						Unpooled.copiedBuffer("{\"errors\":false}", StandardCharsets.UTF_8));
					response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON);
					response.headers().set(HttpHeaderNames.CONTENT_LENGTH, response.content().readableBytes());
					ctx.writeAndFlush(response);
				}
			});
		}
	}

	private TestServers() {}
}
