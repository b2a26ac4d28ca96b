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

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * <p>Title: IndexNamer</p>
 * <p>Description: Resolves the bulk index a document is written to. A null or empty
 * result filters the document out.</p>
 * <p><code>net.metricsagent.codec.IndexNamer</code></p>
 */

public interface IndexNamer {

	/**
	 * Resolves the index name for a document
	 * @param bucket The sample bucket
	 * @param values The document fields, including the bucket and the formatted timestamp
	 * @param timestamp The effective timestamp in fractional epoch seconds
	 * @return the index name, or null/empty to drop the document
	 */
	public String indexName(String bucket, Map<String, Object> values, double timestamp);

	/**
	 * <p>Builds an index namer from a template.</p>
	 * <p><b><code>{key}</code></b> is replaced with the document value of <code>key</code>,
	 * <b><code>{date:PATTERN}</code></b> with the timestamp formatted in UTC using the
	 * {@link DateTimeFormatter} pattern. A template without tokens names every document
	 * the same. A referenced key that is absent resolves to null.</p>
	 * @param template The template
	 * @return the index namer
	 */
	public static IndexNamer template(final String template) {
		return new TemplateIndexNamer(template);
	}

	/**
	 * <p>Title: TemplateIndexNamer</p>
	 * <p>Description: Index namer driven by a <code>{key}</code> / <code>{date:PATTERN}</code> template</p>
	 * <p><code>net.metricsagent.codec.IndexNamer.TemplateIndexNamer</code></p>
	 */
	public static class TemplateIndexNamer implements IndexNamer {
		/** The date token prefix */
		private static final String DATE_PREFIX = "date:";

		private final String template;
		/** Literal strings, field names and formatters in template order */
		private final List<Object> parts = new ArrayList<Object>();

		TemplateIndexNamer(final String template) {
			if(template==null) throw new IllegalArgumentException("The passed template was null");
			this.template = template;
			int pos = 0;
			while(pos < template.length()) {
				final int open = template.indexOf('{', pos);
				if(open==-1) {
					parts.add(template.substring(pos));
					break;
				}
				final int close = template.indexOf('}', open);
				if(close==-1) throw new IllegalArgumentException("Unterminated token in index template [" + template + "]");
				if(open > pos) parts.add(template.substring(pos, open));
				final String token = template.substring(open + 1, close).trim();
				if(token.isEmpty()) throw new IllegalArgumentException("Empty token in index template [" + template + "]");
				if(token.startsWith(DATE_PREFIX)) {
					parts.add(DateTimeFormatter.ofPattern(token.substring(DATE_PREFIX.length())).withZone(ZoneOffset.UTC));
				} else {
					parts.add(new FieldToken(token));
				}
				pos = close + 1;
			}
		}

		@Override
		public String indexName(final String bucket, final Map<String, Object> values, final double timestamp) {
			final StringBuilder b = new StringBuilder();
			for(Object part: parts) {
				if(part instanceof FieldToken) {
					final Object v = values.get(((FieldToken)part).name);
					if(v==null) return null;
					b.append(v);
				} else if(part instanceof DateTimeFormatter) {
					b.append(((DateTimeFormatter)part).format(Instant.ofEpochMilli(BulkCodec.toEpochMillis(timestamp))));
				} else {
					b.append(part);
				}
			}
			return b.toString();
		}

		@Override
		public String toString() {
			return "TemplateIndexNamer [" + template + "]";
		}

		private static final class FieldToken {
			final String name;
			FieldToken(final String name) {
				this.name = name;
			}
		}
	}
}
