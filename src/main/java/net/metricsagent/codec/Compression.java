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
package net.metricsagent.codec;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.Charset;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPOutputStream;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufAllocator;
import io.netty.buffer.ByteBufOutputStream;
import io.netty.handler.codec.http.HttpHeaderValues;

/**
 * <p>Title: Compression</p>
 * <p>Description: Enumerates the bulk request body encodings</p>
 * <p><code>net.metricsagent.codec.Compression</code></p>
 */

public enum Compression {
	/** No compression */
	IDENTITY(HttpHeaderValues.IDENTITY.toString()),
	/** gzip framed deflate */
	GZIP(HttpHeaderValues.GZIP.toString()),
	/** zlib framed deflate */
	DEFLATE(HttpHeaderValues.DEFLATE.toString());

	private Compression(final String encoding) {
		this.encoding = encoding;
	}

	/** The UTF8 character set */
	public static final Charset UTF8 = Charset.forName("UTF8");

	/** The content encoding header value */
	public final String encoding;

	/**
	 * Decodes the configured compression name. Null and unknown names mean no compression.
	 * @param name The name to decode
	 * @return the compression
	 */
	public static Compression forName(final String name) {
		if(name==null) return IDENTITY;
		final String n = name.trim().toLowerCase();
		for(Compression c: values()) {
			if(c.encoding.equals(n)) return c;
		}
		return IDENTITY;
	}

	/**
	 * Indicates if request bodies are compressed
	 * @return true if compressed
	 */
	public boolean enabled() {
		return this!=IDENTITY;
	}

	/**
	 * Writes the passed body into a new buffer, compressing it if enabled
	 * @param allocator The allocator for the new buffer
	 * @param body The body to write
	 * @return the encoded body
	 * @throws IOException if the body could not be written to the buffer
	 */
	public ByteBuf encode(final ByteBufAllocator allocator, final CharSequence body) throws IOException {
		final byte[] bytes = body.toString().getBytes(UTF8);
		final ByteBuf buf = allocator.buffer(enabled() ? Math.max(64, bytes.length / 4) : bytes.length);
		try {
			if(!enabled()) {
				return buf.writeBytes(bytes);
			}
			final OutputStream out = this==GZIP
					? new GZIPOutputStream(new ByteBufOutputStream(buf))
					: new DeflaterOutputStream(new ByteBufOutputStream(buf));
			try {
				out.write(bytes);
			} finally {
				out.close();
			}
			return buf;
		} catch (IOException ex) {
			buf.release();
			throw ex;
		} catch (RuntimeException ex) {
			buf.release();
			throw new IOException("Failed to write " + encoding + " bulk body", ex);
		}
	}
}
