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

import java.math.BigDecimal;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * A single value in the loosely typed argument tree. Exactly one of the
 * {@link Kind}s, with conversion helpers for each.
 * <p>
 * Object members are looked up by exact name first, then ignoring case, then
 * by a normalized form with underscores removed, so <code>USER_NAME</code>,
 * <code>userName</code> and <code>user_name</code> all find the same member.
 */
public final class Value {

	public enum Kind {
		STRING, NUMBER, BOOLEAN, OBJECT, ARRAY, ABSENT
	}

	private final static double EPSILON = 0.0000001;
	private final static Gson GSON = new Gson();

	private final static Value ABSENT = new Value(Kind.ABSENT, null);
	private final static Value TRUE = new Value(Kind.BOOLEAN, Boolean.TRUE);
	private final static Value FALSE = new Value(Kind.BOOLEAN, Boolean.FALSE);

	private final Kind kind;
	private final Object value;

	private Value(Kind kind, Object value) {
		this.kind = kind;
		this.value = value;
	}

	public static Value absent() {
		return ABSENT;
	}

	public static Value of(String value) {
		return value == null ? ABSENT : new Value(Kind.STRING, value);
	}

	public static Value of(double value) {
		return new Value(Kind.NUMBER, value);
	}

	public static Value of(boolean value) {
		return value ? TRUE : FALSE;
	}

	public static Value object(Map<String, Value> members) {
		return new Value(Kind.OBJECT, Collections.unmodifiableMap(new LinkedHashMap<>(members)));
	}

	public static Value array(List<Value> elements) {
		return new Value(Kind.ARRAY, Collections.unmodifiableList(new ArrayList<>(elements)));
	}

	/**
	 * Convert a plain Java object. {@link Supplier}s and {@link Optional}s are
	 * unwrapped, maps become objects, collections and object, <code>int</code>,
	 * <code>long</code>, <code>double</code> or <code>boolean</code> arrays become
	 * arrays, <code>null</code> becomes {@link #absent()} and anything
	 * unrecognised is turned into a string.
	 *
	 * @param val value
	 * @return value
	 */
	public static Value of(Object val) {
		if (val instanceof Supplier) {
			val = ((Supplier<?>) val).get();
		}
		if (val instanceof Optional) {
			val = ((Optional<?>) val).orElse(null);
		}

		if (val == null) {
			return ABSENT;
		} else if (val instanceof Value) {
			return (Value) val;
		} else if (val instanceof Boolean) {
			return of(((Boolean) val).booleanValue());
		} else if (val instanceof Number) {
			return of(((Number) val).doubleValue());
		} else if (val instanceof CharSequence || val instanceof Character) {
			return of(val.toString());
		} else if (val instanceof Map) {
			var members = new LinkedHashMap<String, Value>();
			for (var en : ((Map<?, ?>) val).entrySet()) {
				members.put(String.valueOf(en.getKey()), of(en.getValue()));
			}
			return object(members);
		} else if (val instanceof Collection) {
			var elements = new ArrayList<Value>();
			for (var el : (Collection<?>) val) {
				elements.add(of(el));
			}
			return array(elements);
		} else if (val instanceof Object[]) {
			return of(Arrays.asList((Object[]) val));
		} else if (val instanceof int[]) {
			return of(Arrays.stream((int[]) val).boxed().toList());
		} else if (val instanceof long[]) {
			return of(Arrays.stream((long[]) val).boxed().toList());
		} else if (val instanceof double[]) {
			return of(Arrays.stream((double[]) val).boxed().toList());
		} else if (val instanceof boolean[]) {
			var bools = (boolean[]) val;
			var elements = new ArrayList<Value>(bools.length);
			for (var b : bools) {
				elements.add(of(b));
			}
			return array(elements);
		} else {
			return of(val.toString());
		}
	}

	/**
	 * Convert a parsed JSON element. JSON <code>null</code> is {@link #absent()}.
	 *
	 * @param element element
	 * @return value
	 */
	public static Value ofJson(JsonElement element) {
		if (element == null || element.isJsonNull()) {
			return ABSENT;
		} else if (element.isJsonObject()) {
			var members = new LinkedHashMap<String, Value>();
			for (var en : element.getAsJsonObject().entrySet()) {
				members.put(en.getKey(), ofJson(en.getValue()));
			}
			return object(members);
		} else if (element.isJsonArray()) {
			var elements = new ArrayList<Value>();
			for (var el : element.getAsJsonArray()) {
				elements.add(ofJson(el));
			}
			return array(elements);
		} else {
			var prim = element.getAsJsonPrimitive();
			if (prim.isBoolean())
				return of(prim.getAsBoolean());
			else if (prim.isNumber())
				return of(prim.getAsDouble());
			else
				return of(prim.getAsString());
		}
	}

	public Kind kind() {
		return kind;
	}

	public boolean isAbsent() {
		return kind == Kind.ABSENT;
	}

	public String asString() {
		return (String) expect(Kind.STRING);
	}

	public double asNumber() {
		return (Double) expect(Kind.NUMBER);
	}

	public boolean asBoolean() {
		return (Boolean) expect(Kind.BOOLEAN);
	}

	@SuppressWarnings("unchecked")
	public Map<String, Value> asObject() {
		return (Map<String, Value>) expect(Kind.OBJECT);
	}

	@SuppressWarnings("unchecked")
	public List<Value> asArray() {
		return (List<Value>) expect(Kind.ARRAY);
	}

	/**
	 * Look up a member of an object value. Anything that is not an object has
	 * no members.
	 *
	 * @param name member name
	 * @return member or {@link #absent()}
	 */
	public Value get(String name) {
		if (kind != Kind.OBJECT)
			return ABSENT;

		var members = asObject();
		var val = members.get(name);
		if (val != null)
			return val;

		for (var en : members.entrySet()) {
			if (en.getKey().equalsIgnoreCase(name))
				return en.getValue();
		}

		var normalized = normalize(name);
		for (var en : members.entrySet()) {
			if (normalize(en.getKey()).equals(normalized))
				return en.getValue();
		}

		return ABSENT;
	}

	/**
	 * The truth of this value when used as a condition on its own.
	 * <code>false</code>, the empty string, the string "false" (in any case),
	 * zero and absent values are false, everything else is true.
	 *
	 * @return truth
	 */
	public boolean toCondition() {
		switch (kind) {
		case BOOLEAN:
			return asBoolean();
		case STRING:
			var str = asString();
			return !str.isEmpty() && !str.equalsIgnoreCase("false");
		case NUMBER:
			return Math.abs(asNumber()) > EPSILON;
		case OBJECT:
		case ARRAY:
			return true;
		default:
			return false;
		}
	}

	/**
	 * The text form of this value, as used in string functions and when
	 * substituted into a document. Integral numbers have no fraction, objects
	 * and arrays are rendered as compact JSON and absent values are empty.
	 *
	 * @return text
	 */
	public String text() {
		switch (kind) {
		case STRING:
			return asString();
		case NUMBER:
			return formatNumber(asNumber());
		case BOOLEAN:
			return String.valueOf(asBoolean());
		case OBJECT:
		case ARRAY:
			return GSON.toJson(toJson());
		default:
			return "";
		}
	}

	public JsonElement toJson() {
		switch (kind) {
		case STRING:
			return new JsonPrimitive(asString());
		case NUMBER:
			var num = asNumber();
			if (num == Math.rint(num) && Math.abs(num) < Long.MAX_VALUE)
				return new JsonPrimitive((long) num);
			return new JsonPrimitive(num);
		case BOOLEAN:
			return new JsonPrimitive(asBoolean());
		case OBJECT:
			var obj = new JsonObject();
			asObject().forEach((k, v) -> obj.add(k, v.toJson()));
			return obj;
		case ARRAY:
			var arr = new JsonArray();
			asArray().forEach(v -> arr.add(v.toJson()));
			return arr;
		default:
			return JsonNull.INSTANCE;
		}
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, value);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null || getClass() != obj.getClass())
			return false;
		var other = (Value) obj;
		return kind == other.kind && Objects.equals(value, other.value);
	}

	@Override
	public String toString() {
		return kind == Kind.ABSENT ? "<absent>" : kind + ":" + text();
	}

	static String normalize(String name) {
		return name.replace("_", "").toLowerCase(Locale.ROOT);
	}

	static String formatNumber(double number) {
		if (Double.isNaN(number) || Double.isInfinite(number))
			return String.valueOf(number);
		return BigDecimal.valueOf(number).stripTrailingZeros().toPlainString();
	}

	private Object expect(Kind expected) {
		if (kind != expected)
			throw new IllegalStateException(MessageFormat.format("Value is a {0}, not a {1}", kind, expected));
		return value;
	}
}
