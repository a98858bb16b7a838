package org.javai.wwisedsl.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Value on the right-hand side of {@code SET_PROP}. Sealed so renderers and backends see every form.
 * <p>
 * Values are read with {@link #parse(String)} and written with {@link #render()}; the two are inverse
 * for every value produced by {@code parse}.
 */
public sealed interface PropertyValue {

	Pattern NUMBER_WITH_UNIT = Pattern.compile(
			"^(-?\\d+(?:\\.\\d+)?(?:[eE][-+]?\\d+)?)\\s*(dB|%|cents|ms|s|Hz)?$", Pattern.CASE_INSENSITIVE);

	Pattern CURVE_POINT = Pattern.compile("\\(\\s*([^,()]+?)\\s*,\\s*([^,()]+?)\\s*\\)");

	/**
	 * DSL text for this value.
	 */
	String render();

	record Bool(boolean value) implements PropertyValue {
		@Override
		public String render() {
			return value ? "True" : "False";
		}
	}

	record Int(long value) implements PropertyValue {
		@Override
		public String render() {
			return Long.toString(value);
		}
	}

	record Decimal(double value) implements PropertyValue {
		public Decimal {
			if (!Double.isFinite(value)) {
				throw new IllegalArgumentException("Decimal property values must be finite: " + value);
			}
		}

		@Override
		public String render() {
			return Double.toString(value);
		}
	}

	record Text(String value) implements PropertyValue {
		public Text {
			if (value == null) {
				throw new IllegalArgumentException("Text property value must not be null");
			}
		}

		@Override
		public String render() {
			return Quoting.quote(value);
		}
	}

	/**
	 * Curve points, written as {@code [(x1, y1), (x2, y2)]}.
	 */
	record Curve(List<CurvePoint> points) implements PropertyValue {
		public Curve {
			points = points != null ? List.copyOf(points) : List.of();
			if (points.isEmpty()) {
				throw new IllegalArgumentException("A curve needs at least one point");
			}
		}

		@Override
		public String render() {
			return points.stream()
					.map(p -> "(" + p.x() + ", " + p.y() + ")")
					.collect(Collectors.joining(", ", "[", "]"));
		}
	}

	static PropertyValue of(boolean value) {
		return new Bool(value);
	}

	static PropertyValue of(long value) {
		return new Int(value);
	}

	static PropertyValue of(double value) {
		return new Decimal(value);
	}

	static PropertyValue text(String value) {
		return new Text(value);
	}

	/**
	 * Read a value as written in DSL or in a project file.
	 * <p>
	 * Numbers may carry a unit suffix ({@code dB}, {@code %}, {@code cents}, {@code ms}, {@code s},
	 * {@code Hz}) which is dropped. Unquoted words that are neither booleans nor numbers are text.
	 *
	 * @throws IllegalArgumentException if the value is empty, a malformed quoted literal or a malformed curve
	 */
	static PropertyValue parse(String source) {
		if (source == null || source.isBlank()) {
			throw new IllegalArgumentException("Missing property value");
		}
		String s = source.strip();
		if (s.startsWith("[")) {
			return parseCurve(s);
		}
		if (s.startsWith("\"")) {
			return new Text(Quoting.unquote(s));
		}
		String lower = s.toLowerCase(Locale.ROOT);
		if (lower.equals("true") || lower.equals("false")) {
			return new Bool(lower.equals("true"));
		}
		Matcher number = NUMBER_WITH_UNIT.matcher(s);
		if (number.matches()) {
			return parseNumber(number.group(1));
		}
		return new Text(s);
	}

	private static PropertyValue parseNumber(String digits) {
		if (digits.indexOf('.') < 0 && digits.indexOf('e') < 0 && digits.indexOf('E') < 0) {
			try {
				return new Int(Long.parseLong(digits));
			}
			catch (NumberFormatException tooLarge) {
				return new Decimal(Double.parseDouble(digits));
			}
		}
		return new Decimal(Double.parseDouble(digits));
	}

	private static PropertyValue parseCurve(String s) {
		if (!s.endsWith("]")) {
			throw new IllegalArgumentException("Unterminated curve: " + s);
		}
		String body = s.substring(1, s.length() - 1).strip();
		Matcher matcher = CURVE_POINT.matcher(body);
		List<CurvePoint> points = new ArrayList<>();
		int consumed = 0;
		while (matcher.find()) {
			String between = body.substring(consumed, matcher.start()).strip();
			if (!between.isEmpty() && !between.equals(",")) {
				throw new IllegalArgumentException("Unexpected text in curve: " + between);
			}
			try {
				points.add(new CurvePoint(Double.parseDouble(matcher.group(1)), Double.parseDouble(matcher.group(2))));
			}
			catch (NumberFormatException ex) {
				throw new IllegalArgumentException("Curve point is not numeric: " + matcher.group(), ex);
			}
			consumed = matcher.end();
		}
		if (!body.substring(consumed).isBlank()) {
			throw new IllegalArgumentException("Unexpected text in curve: " + body.substring(consumed).strip());
		}
		return new Curve(points);
	}
}
