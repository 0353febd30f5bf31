package org.plenum.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.HashMap;

/**
 * Little JSON builder. Mostly used to build variables for GraphQL requests.
 *
 * <pre>
 *   Lson.builder()
 *     .put("ballotId", 4711)
 *     .put("voter.id", "member1")   // creates a nested object "voter"
 *     .toString()
 * </pre>
 */
public class Lson extends HashMap<String, Object> {

	private static final ObjectMapper mapper = new ObjectMapper();

	public Lson() {
		super();
	}

	public static Lson builder() {
		return new Lson();
	}

	public static Lson builder(String key, Object value) {
		return new Lson().put(key, value);
	}

	/**
	 * Put a value under a path. Dots in the path create nested objects.
	 * @param path e.g. "parent.child.attribute"
	 * @param value any value that Jackson can serialize
	 * @return this for chaining
	 */
	@Override
	public Lson put(String path, Object value) {
		int dot = path.indexOf('.');
		if (dot < 0) {
			super.put(path, value);
			return this;
		}
		String key = path.substring(0, dot);
		Object child = super.get(key);
		if (!(child instanceof Lson)) {
			child = new Lson();
			super.put(key, child);
		}
		((Lson) child).put(path.substring(dot + 1), value);
		return this;
	}

	/**
	 * Get the value under a path
	 * @param path e.g. "parent.child.attribute"
	 * @return the value or null if there is none
	 */
	public Object get(String path) {
		int dot = path.indexOf('.');
		if (dot < 0) return super.get(path);
		Object child = super.get(path.substring(0, dot));
		if (child instanceof Lson lson) return lson.get(path.substring(dot + 1));
		return null;
	}

	@Override
	public String toString() {
		try {
			return mapper.writeValueAsString(this);
		} catch (JsonProcessingException e) {
			throw new RuntimeException("Cannot write Lson as JSON", e);
		}
	}
}
