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
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import io.netty.buffer.ByteBuf;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.http.DefaultFullHttpRequest;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpContentDecompressor;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.util.concurrent.Promise;
import net.metricsagent.ClientConfiguration;
import net.metricsagent.codec.BulkCodec;
import net.metricsagent.codec.Compression;
import net.metricsagent.transport.ConnectionException;

/**
 * <p>Title: ElasticsearchClient</p>
 * <p>Description: Pushes samples to a bulk indexing endpoint. Each sample becomes an action line
 * and a document line; a chunk is POSTed as one newline delimited request and is acknowledged
 * only by a 200 response.</p>
 * <p><code>net.metricsagent.protocol.ElasticsearchClient</code></p>
 */

public class ElasticsearchClient extends BaseClient {
	/** The content type of bulk requests */
	public static final String NDJSON = "application/x-ndjson";
	/** The maximum aggregated response size */
	public static final int MAX_RESPONSE_SIZE = 10 * 1024 * 1024;

	/** The bulk encoder */
	protected final BulkCodec codec;
	/** The request body compression */
	protected final Compression compression;

	/**
	 * Creates a new ElasticsearchClient
	 * @param config The client configuration
	 * @param defaultMetadata Agent-wide metadata merged under every sample's metadata
	 */
	public ElasticsearchClient(final ClientConfiguration config, final Map<String, String> defaultMetadata) {
		super(config, defaultMetadata);
		codec = new BulkCodec(config.indexNamer(), config.typeName());
		compression = config.compression();
	}

	@Override
	protected void processValues(final String bucket, final Map<String, Number> values, final double timestamp, final Map<String, String> metadata) {
		final String pair = codec.encode(bucket, values, timestamp, metadata);
		if(pair==null) {
			drop("no index name", bucket);
		} else {
			bufferOutput(pair);
		}
	}

	@Override
	protected void pushChunk(final List<String> chunk) throws IOException, InterruptedException {
		final Channel ch = connection();
		final StringBuilder body = new StringBuilder();
		for(String pair: chunk) {
			body.append(pair);
		}
		final ByteBuf content = compression.encode(ch.alloc(), body);
		final DefaultFullHttpRequest request = new DefaultFullHttpRequest(HttpVersion.HTTP_1_1, HttpMethod.POST, config.bulkPath(), content);
		final InetSocketAddress remote = connector().currentHost();
		request.headers().set(HttpHeaderNames.HOST, remote.getHostString() + ":" + remote.getPort());
		request.headers().set(HttpHeaderNames.CONTENT_TYPE, NDJSON);
		request.headers().set(HttpHeaderNames.CONTENT_LENGTH, content.readableBytes());
		if(compression.enabled()) {
			request.headers().set(HttpHeaderNames.CONTENT_ENCODING, compression.encoding);
			request.headers().set(HttpHeaderNames.ACCEPT_ENCODING, compression.encoding);
		}
		final HttpResponseHandler handler = ch.pipeline().get(HttpResponseHandler.class);
		final Promise<HttpResponseStatus> promise = ch.eventLoop().newPromise();
		handler.expect(promise);
		ch.writeAndFlush(request).addListener(new ChannelFutureListener() {
			@Override
			public void operationComplete(final ChannelFuture f) throws Exception {
				if(!f.isSuccess()) {
					promise.tryFailure(f.cause());
				}
			}
		});
		if(!promise.await(config.sendTimeout(), TimeUnit.MILLISECONDS)) {
			handler.expect(null);
			throw new ConnectionException("Timed out waiting for bulk response from [" + remote + "]");
		}
		if(!promise.isSuccess()) {
			throw new ConnectionException("Bulk request to [" + remote + "] failed", promise.cause());
		}
		final HttpResponseStatus status = promise.getNow();
		if(status.code()!=HttpResponseStatus.OK.code()) {
			throw new ConnectionException("Bulk request to [" + remote + "] rejected: " + status);
		}
		log.debug("Client [{}] indexed {} documents", name, chunk.size());
	}

	@Override
	protected ChannelInitializer<Channel> channelInitializer() {
		return new ChannelInitializer<Channel>() {
			@Override
			protected void initChannel(final Channel ch) throws Exception {
				final ChannelPipeline p = ch.pipeline();
				p.addLast("HttpCodec", new HttpClientCodec());
				p.addLast("Decompressor", new HttpContentDecompressor());
				p.addLast("Aggregator", new HttpObjectAggregator(MAX_RESPONSE_SIZE));
				p.addLast("ResponseHandler", new HttpResponseHandler());
			}
		};
	}
}
