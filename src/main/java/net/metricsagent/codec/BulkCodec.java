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

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.google.common.base.Strings;

import net.metricsagent.json.JSONOps;

/**
 * <p>Title: BulkCodec</p>
 * <p>Description: Encodes samples as bulk index action/document pairs.</p>
 * <p>Format: <b><pre>
 * {"index":{"_id":"...","_index":"cpu","_type":"cpu"}}
 * {"bucket":"cpu","host":"a1","idle":97.5,"timestamp":"2023-11-14 22:13:20.000"}
 * </pre></b></p>
 * <p>Both lines are minified with sorted keys. The document id is a name based (version 5) UUID of the
 * document line, so re-sending unchanged content after a failed push overwrites instead of duplicating.</p>
 * <p><code>net.metricsagent.codec.BulkCodec</code></p>
 */

public class BulkCodec {
	/** The UTF8 character set */
	public static final Charset UTF8 = Charset.forName("UTF8");
	/** The DNS name space UUID (RFC 4122 appendix C) */
	public static final UUID NAMESPACE_DNS = UUID.fromString("6ba7b810-9dad-11d1-80b4-00c04fd430c8");
	/** The timestamp format the document store accepts without a mapping: ms precision, no zone */
	public static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);
	/** The document field the formatted timestamp is written to */
	public static final String TIMESTAMP_FIELD = "timestamp";
	/** The document field the bucket is written to */
	public static final String BUCKET_FIELD = "bucket";

	/** The index namer, null to index by bucket */
	private final IndexNamer indexNamer;
	/** The type name, null to use the bucket, empty to omit the type */
	private final String typeName;

	/**
	 * Creates a new BulkCodec
	 * @param indexNamer The index namer, null to index by bucket
	 * @param typeName The type name, null to use the bucket, empty to omit the type
	 */
	public BulkCodec(final IndexNamer indexNamer, final String typeName) {
		this.indexNamer = indexNamer;
		this.typeName = typeName;
	}

	/**
	 * Encodes one sample into its two NDJSON lines
	 * @param bucket The sample bucket
	 * @param values The sample values
	 * @param timestamp The effective timestamp in fractional epoch seconds
	 * @param metadata The sample metadata, which supplies defaults for the values
	 * @return the action and document lines, each terminated with an EOL, or null if the index resolved empty
	 */
	public String encode(final String bucket, final Map<String, ? extends Number> values, final double timestamp, final Map<String, String> metadata) {
		final Map<String, Object> doc = new HashMap<String, Object>(metadata.size() + values.size() + 2);
		doc.putAll(metadata);
		doc.putAll(values);
		doc.put(TIMESTAMP_FIELD, formatTimestamp(timestamp));
		doc.put(BUCKET_FIELD, bucket);
		final String indexName = indexNamer==null ? bucket : indexNamer.indexName(bucket, doc, timestamp);
		if(Strings.isNullOrEmpty(indexName)) {
			return null;
		}
		final String docStr = JSONOps.serializeCanonical(doc);
		final Map<String, Object> action = new LinkedHashMap<String, Object>(3);
		action.put("_id", documentId(docStr));
		action.put("_index", indexName);
		if(typeName==null) {
			action.put("_type", bucket);
		} else if(!typeName.isEmpty()) {
			action.put("_type", typeName);
		}
		return new StringBuilder()
			.append(JSONOps.serializeCanonical(Collections.singletonMap("index", action))).append('\n')
			.append(docStr).append('\n')
			.toString();
	}

	/**
	 * Converts fractional epoch seconds to epoch millis, rounding to the microsecond then truncating
	 * @param seconds The fractional epoch seconds
	 * @return the epoch millis
	 */
	public static long toEpochMillis(final double seconds) {
		final long micros = Math.round(seconds * 1000000D);
		return Math.floorDiv(micros, 1000L);
	}

	/**
	 * Formats a timestamp as <b><code>yyyy-MM-dd HH:mm:ss.SSS</code></b> in UTC
	 * @param seconds The fractional epoch seconds
	 * @return the formatted timestamp
	 */
	public static String formatTimestamp(final double seconds) {
		return TIMESTAMP_FORMAT.format(Instant.ofEpochMilli(toEpochMillis(seconds)));
	}

	/**
	 * Computes the document id for the passed canonical document
	 * @param docStr The canonical document JSON
	 * @return the document id
	 */
	public static String documentId(final String docStr) {
		return nameUUID(NAMESPACE_DNS, docStr).toString();
	}

	/**
	 * Generates a version 5 (SHA-1, name based) UUID
	 * @param namespace The name space UUID
	 * @param name The name
	 * @return the UUID
	 */
	public static UUID nameUUID(final UUID namespace, final String name) {
		final MessageDigest sha1;
		try {
			sha1 = MessageDigest.getInstance("SHA-1");
		} catch (NoSuchAlgorithmException ex) {
			throw new IllegalStateException("SHA-1 not supported", ex);
		}
		final ByteBuffer ns = ByteBuffer.allocate(16);
		ns.putLong(namespace.getMostSignificantBits());
		ns.putLong(namespace.getLeastSignificantBits());
		sha1.update(ns.array());
		sha1.update(name.getBytes(UTF8));
		final byte[] hash = sha1.digest();
		hash[6] &= 0x0f;
		hash[6] |= 0x50;
		hash[8] &= 0x3f;
		hash[8] |= (byte)0x80;
		final ByteBuffer bb = ByteBuffer.wrap(hash, 0, 16);
		return new UUID(bb.getLong(), bb.getLong());
	}
}
