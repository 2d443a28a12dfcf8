/**
 * Copyright © 2023 JAdaptive Limited (support@jadaptive.com)
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy of this
 * software and associated documentation files (the “Software”), to deal in the Software
 * without restriction, including without limitation the rights to use, copy, modify,
 * merge, publish, distribute, sublicense, and/or sell copies of the Software, and to
 * permit persons to whom the Software is furnished to do so, subject to the following
 * conditions:
 *
 * The above copyright notice and this permission notice shall be included in all copies
 * or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED “AS IS”, WITHOUT WARRANTY OF ANY KIND, EXPRESS OR IMPLIED,
 * INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY, FITNESS FOR A
 * PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT
 * HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION
 * OF CONTRACT, TORT OR OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE
 * SOFTWARE OR THE USE OR OTHER DEALINGS IN THE SOFTWARE.
 */
package com.sshtools.tinyconditions;

import java.io.Reader;
import java.io.StringReader;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * An immutable tree of named {@link Value}s, typically built from the JSON
 * arguments given to a template merged with the defaults it declares.
 */
public final class ValueTree implements ValueResolver {

	private final static ValueTree EMPTY = new Builder().build();

	public final static class Builder {
		private final Map<String, Value> members = new LinkedHashMap<>();
		private final Map<String, Value> defaults = new LinkedHashMap<>();

		public Builder variable(String key, Object value) {
			members.put(key, Value.of(value));
			return this;
		}

		public Builder fromMap(Map<String, ? extends Object> map) {
			map.forEach(this::variable);
			return this;
		}

		public Builder fromTree(ValueTree tree) {
			members.putAll(tree.root.asObject());
			return this;
		}

		public Builder fromJson(String json) {
			return fromJson(new StringReader(json));
		}

		public Builder fromJson(Reader json) {
			Value root;
			try {
				root = Value.ofJson(JsonParser.parseReader(json));
			} catch (JsonParseException jpe) {
				throw new IllegalArgumentException("Invalid JSON arguments. " + jpe.getMessage(), jpe);
			}
			if (root.kind() != Value.Kind.OBJECT)
				throw new IllegalArgumentException("JSON arguments must be an object, not " + root.kind());
			members.putAll(root.asObject());
			return this;
		}

		/**
		 * Supply a value to use only if nothing else resolves at the same path
		 * once the tree is built. Dotted paths create the intermediate objects
		 * they need.
		 *
		 * @param path  path
		 * @param value default value
		 * @return this for chaining
		 */
		public Builder withDefault(String path, Object value) {
			defaults.put(path, Value.of(value));
			return this;
		}

		public Builder withDefaults(Map<String, ? extends Object> defaults) {
			defaults.forEach(this::withDefault);
			return this;
		}

		public ValueTree build() {
			var root = Value.object(members);
			for (var en : defaults.entrySet()) {
				if (!en.getValue().isAbsent() && resolve(root, en.getKey()).isAbsent()) {
					root = withMember(root, en.getKey().split("\\."), 0, en.getValue());
				}
			}
			return new ValueTree(root);
		}
	}

	private final Value root;

	private ValueTree(Value root) {
		this.root = root;
	}

	public static ValueTree empty() {
		return EMPTY;
	}

	public static ValueTree ofJson(String json) {
		return new Builder().fromJson(json).build();
	}

	public static ValueTree ofMap(Map<String, ? extends Object> map) {
		return new Builder().fromMap(map).build();
	}

	/**
	 * The top level object of this tree.
	 *
	 * @return root object
	 */
	public Value root() {
		return root;
	}

	/**
	 * Create a copy of this tree with defaults applied for any paths that do
	 * not already resolve.
	 *
	 * @param defaults defaults
	 * @return new tree
	 */
	public ValueTree withDefaults(Map<String, ? extends Object> defaults) {
		return new Builder().fromTree(this).withDefaults(defaults).build();
	}

	@Override
	public Value resolve(String path) {
		return resolve(root, path);
	}

	@Override
	public String toString() {
		return root.text();
	}

	static Value resolve(Value root, String path) {
		if (path == null || path.isBlank())
			return Value.absent();

		var current = root;
		for (var segment : path.split("\\.", -1)) {
			if (current.kind() != Value.Kind.OBJECT)
				return Value.absent();
			current = current.get(segment);
		}
		return current;
	}

	private static Value withMember(Value object, String[] segments, int index, Value value) {
		var members = new LinkedHashMap<>(object.asObject());
		var segment = segments[index];
		var key = keyFor(object, segment);

		if (index == segments.length - 1) {
			members.put(key, value);
		} else {
			var existing = object.get(segment);
			if (existing.isAbsent()) {
				existing = Value.object(Map.of());
			} else if (existing.kind() != Value.Kind.OBJECT) {
				/* Something scalar is already in the way, the default cannot apply */
				return object;
			}
			members.put(key, withMember(existing, segments, index + 1, value));
		}
		return Value.object(members);
	}

	private static String keyFor(Value object, String segment) {
		var normalized = Value.normalize(segment);
		for (var key : object.asObject().keySet()) {
			if (key.equals(segment))
				return key;
		}
		for (var key : object.asObject().keySet()) {
			if (key.equalsIgnoreCase(segment))
				return key;
		}
		for (var key : object.asObject().keySet()) {
			if (Value.normalize(key).equals(normalized))
				return key;
		}
		return segment;
	}
}
