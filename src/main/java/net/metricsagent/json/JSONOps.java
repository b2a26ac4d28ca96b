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
package net.metricsagent.json;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.HashMap;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/**
 * <p>Title: JSONOps</p>
 * <p>Description: Shared JSON utilities</p>
 * <p><code>net.metricsagent.json.JSONOps</code></p>
 */

public class JSONOps {

	/** Shared ObjectMapper */
	public static final ObjectMapper objectMapper = new ObjectMapper();

	/**
	 * Mapper producing the canonical form used for bulk documents: minified,
	 * map keys sorted and non ascii characters escaped, so equal content always
	 * serializes to the same bytes.
	 */
	public static final ObjectMapper canonicalMapper = JsonMapper.builder()
			.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
			.enable(JsonWriteFeature.ESCAPE_NON_ASCII)
			.build();

	/** Type reference for common string/string maps */
	public static final TypeReference<HashMap<String, String>> TR_STR_STR_HASH_MAP =
	    new TypeReference<HashMap<String, String>>() {};

	/**
	 * Serializes the given object to a JSON string
	 * @param object The object to serialize
	 * @return A JSON formatted string
	 * @throws IllegalArgumentException if the object was null
	 * @throws JSONException if the object could not be serialized
	 */
	public static final String serializeToString(final Object object) {
		if (object == null)
			throw new IllegalArgumentException("Object was null");
		try {
			return objectMapper.writeValueAsString(object);
		} catch (JsonProcessingException e) {
			throw new JSONException(e);
		}
	}

	/**
	 * Serializes the given object to its canonical JSON string
	 * @param object The object to serialize
	 * @return the minified, key sorted JSON
	 * @throws JSONException if the object could not be serialized
	 */
	public static final String serializeCanonical(final Object object) {
		if (object == null)
			throw new IllegalArgumentException("Object was null");
		try {
			return canonicalMapper.writeValueAsString(object);
		} catch (JsonProcessingException e) {
			throw new JSONException(e);
		}
	}

	/**
	 * Deserializes a JSON formatted input stream to a specific class type
	 * @param json The input stream to deserialize from
	 * @param type The class type of the object used for deserialization
	 * @return An object of the {@code type} type
	 * @throws IllegalArgumentException if the data or type was null or parsing
	 * failed
	 * @throws JSONException if the data could not be parsed
	 */
	public static final <T> T parseToObject(final InputStream json, final Class<T> type) {
		if (json == null)
			throw new IllegalArgumentException("Incoming data was null");
		if (type == null)
			throw new IllegalArgumentException("Missing type reference");
		try {
			return objectMapper.readValue(json, type);
		} catch (JsonParseException e) {
			throw new IllegalArgumentException(e);
		} catch (JsonMappingException e) {
			throw new IllegalArgumentException(e);
		} catch (IOException e) {
			throw new JSONException(e);
		}
	}

	/**
	 * Deserializes a JSON formatted file to a specific class type
	 * @param json The file to deserialize from
	 * @param type The class type of the object used for deserialization
	 * @return An object of the {@code type} type
	 */
	public static final <T> T parseToObject(final File json, final Class<T> type) {
		if (json == null)
			throw new IllegalArgumentException("Incoming data was null");
		if (type == null)
			throw new IllegalArgumentException("Missing type reference");
		try {
			return objectMapper.readValue(json, type);
		} catch (JsonParseException e) {
			throw new IllegalArgumentException(e);
		} catch (JsonMappingException e) {
			throw new IllegalArgumentException(e);
		} catch (IOException e) {
			throw new JSONException(e);
		}
	}

	/**
	 * Converts a JSON node to a specific type
	 * @param json The node to convert
	 * @param type A type definition for a complex object
	 * @return the converted value
	 */
	public static final <T> T parseToObject(final JsonNode json, final TypeReference<T> type) {
		if (json == null)
			throw new IllegalArgumentException("Incoming data was null or empty");
		if (type == null)
			throw new IllegalArgumentException("Missing class type");
		try {
			return objectMapper.convertValue(json, type);
		} catch (Exception e) {
			throw new JSONException(e);
		}
	}

	private JSONOps() {}

}
