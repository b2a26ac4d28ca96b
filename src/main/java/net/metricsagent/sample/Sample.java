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
package net.metricsagent.sample;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * <p>Title: Sample</p>
 * <p>Description: One measurement event produced by a collector and fanned out to every client.
 * Instances are immutable, so the supervisor can hand the same instance to every client channel.</p>
 * <p><code>net.metricsagent.sample.Sample</code></p>
 */

public final class Sample {
	/** The shutdown sentinel. Never encoded, only compared by identity */
	public static final Sample SENTINEL = new Sample();

	/** When the collector observed the measurement, in fractional epoch seconds */
	private final double receiveTimestamp;
	/** The metric family */
	private final String bucket;
	/** Metric field name to value */
	private final Map<String, Number> values;
	/** The optional event time in fractional epoch seconds */
	private final Double timestamp;
	/** Free form tags. Values may be null */
	private final Map<String, String> metadata;

	/**
	 * Creates a new Sample
	 * @param receiveTimestamp When the collector observed the measurement, in fractional epoch seconds
	 * @param bucket The metric family
	 * @param values Metric field name to value
	 * @param timestamp The optional event time, null if the receive timestamp is the effective time
	 * @param metadata Free form tags, may be null
	 */
	public Sample(final double receiveTimestamp, final String bucket, final Map<String, ? extends Number> values, final Double timestamp, final Map<String, String> metadata) {
		if(bucket==null || bucket.isEmpty()) throw new IllegalArgumentException("The passed bucket was null or empty");
		if(values==null) throw new IllegalArgumentException("The passed values were null");
		this.receiveTimestamp = receiveTimestamp;
		this.bucket = bucket;
		this.values = ImmutableMap.copyOf(values);
		this.timestamp = timestamp;
		if(metadata==null || metadata.isEmpty()) {
			this.metadata = Collections.emptyMap();
		} else {
			// ImmutableMap rejects null values, which are legal tags here
			this.metadata = Collections.unmodifiableMap(new LinkedHashMap<String, String>(metadata));
		}
	}

	/**
	 * Creates a new Sample received now
	 * @param bucket The metric family
	 * @param values Metric field name to value
	 * @param metadata Free form tags, may be null
	 */
	public Sample(final String bucket, final Map<String, ? extends Number> values, final Map<String, String> metadata) {
		this(System.currentTimeMillis() / 1000D, bucket, values, null, metadata);
	}

	private Sample() {
		receiveTimestamp = 0D;
		bucket = "";
		values = Collections.emptyMap();
		timestamp = null;
		metadata = Collections.emptyMap();
	}

	public double receiveTimestamp() {
		return receiveTimestamp;
	}

	public String bucket() {
		return bucket;
	}

	public Map<String, Number> values() {
		return values;
	}

	public Double timestamp() {
		return timestamp;
	}

	public Map<String, String> metadata() {
		return metadata;
	}

	/**
	 * Returns the event time if one was supplied, otherwise the receive time
	 * @return the effective time in fractional epoch seconds
	 */
	public double effectiveTimestamp() {
		return timestamp!=null ? timestamp : receiveTimestamp;
	}

	public boolean isSentinel() {
		return this==SENTINEL;
	}

	@Override
	public String toString() {
		if(isSentinel()) return "Sample [SENTINEL]";
		final StringBuilder builder = new StringBuilder();
		builder.append("Sample [bucket=").append(bucket).append(", values=").append(values)
			.append(", timestamp=").append(effectiveTimestamp()).append(", metadata=").append(metadata).append("]");
		return builder.toString();
	}
}
