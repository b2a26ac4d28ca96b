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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * <p>Title: LineCodec</p>
 * <p>Description: Carbon plaintext line encoder.</p>
 * <p>Format: <b><code>host01.cpu.idle 97.5 1700000000</code></b>, one field per line.
 * The dotted name is built from the sample metadata augmented with the bucket and the field name:
 * the configured name mapping keys come first, in configured order, followed by the values
 * of every remaining key sorted by key.</p>
 * <p><code>net.metricsagent.codec.LineCodec</code></p>
 */

public class LineCodec {
	/** The metadata key the bucket is stored under while naming */
	public static final String BUCKET_KEY = "bucket";
	/** The metadata key the field name is stored under while naming */
	public static final String VALUE_KEY = "value";

	private static final Joiner DOT_JOINER = Joiner.on('.').skipNulls();

	/** The ordered keys that lead the metric name */
	private final List<String> nameMapping;

	/**
	 * Creates a new LineCodec
	 * @param nameMapping The ordered keys that lead the metric name, may be null
	 */
	public LineCodec(final List<String> nameMapping) {
		this.nameMapping = nameMapping==null ? Collections.<String>emptyList() : ImmutableList.copyOf(nameMapping);
	}

	/**
	 * Builds the dotted metric name for the passed metadata. The passed map is not modified.
	 * Null tag values contribute no component.
	 * @param metadata The metadata to build the name from
	 * @return the dotted metric name
	 */
	public String buildName(final Map<String, String> metadata) {
		if(metadata==null) throw new IllegalArgumentException("The passed metadata was null");
		final Map<String, String> working = new HashMap<String, String>(metadata);
		final List<String> components = new ArrayList<String>(working.size());
		for(String key: nameMapping) {
			if(working.containsKey(key)) {
				components.add(working.remove(key));
			}
		}
		components.addAll(new TreeMap<String, String>(working).values());
		return DOT_JOINER.join(components);
	}

	/**
	 * Encodes every field of a sample into one line each, in field iteration order
	 * @param bucket The sample bucket
	 * @param values The sample values
	 * @param timestamp The effective timestamp in fractional epoch seconds
	 * @param metadata The sample metadata
	 * @return the encoded lines, each terminated with an EOL
	 */
	public List<String> encode(final String bucket, final Map<String, ? extends Number> values, final double timestamp, final Map<String, String> metadata) {
		final List<String> lines = new ArrayList<String>(values.size());
		final long seconds = (long)timestamp;
		for(Map.Entry<String, ? extends Number> entry: values.entrySet()) {
			final Map<String, String> valueMetadata = new HashMap<String, String>(metadata);
			valueMetadata.put(BUCKET_KEY, bucket);
			valueMetadata.put(VALUE_KEY, entry.getKey());
			lines.add(new StringBuilder()
				.append(buildName(valueMetadata)).append(' ')
				.append(entry.getValue()).append(' ')
				.append(seconds).append('\n')
				.toString());
		}
		return lines;
	}

	public List<String> nameMapping() {
		return nameMapping;
	}
}
