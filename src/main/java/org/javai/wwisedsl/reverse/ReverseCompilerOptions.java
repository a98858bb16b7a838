package org.javai.wwisedsl.reverse;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.javai.wwisedsl.model.PropertyValue;

/**
 * Options for the reverse compiler.
 *
 * @param maxNodes largest inline subtree, in nodes, a sample keeps before a descendant is split off
 * @param maxDepth deepest inline nesting a sample keeps before a descendant is split off
 * @param propertyWhitelist properties to emit; empty emits every property. Curve values are always emitted.
 * @param defaultValues property values equal to the project default, which are not emitted
 * @param systemObjectNames objects that always exist in a project; their CREATE is not emitted
 * @param implicitLinkTargets link targets every object has implicitly; links to them are not emitted
 */
public record ReverseCompilerOptions(
		int maxNodes,
		int maxDepth,
		Set<String> propertyWhitelist,
		Map<String, PropertyValue> defaultValues,
		Set<String> systemObjectNames,
		Set<String> implicitLinkTargets
) {

	public static final int DEFAULT_MAX_NODES = 30;
	public static final int DEFAULT_MAX_DEPTH = 3;

	public ReverseCompilerOptions {
		if (maxNodes < 1) {
			throw new IllegalArgumentException("maxNodes must be at least 1, was " + maxNodes);
		}
		if (maxDepth < 0) {
			throw new IllegalArgumentException("maxDepth must not be negative, was " + maxDepth);
		}
		propertyWhitelist = propertyWhitelist != null ? Set.copyOf(propertyWhitelist) : Set.of();
		defaultValues = defaultValues != null
				? Collections.unmodifiableMap(new LinkedHashMap<>(defaultValues))
				: Map.of();
		systemObjectNames = systemObjectNames != null ? Set.copyOf(systemObjectNames) : Set.of();
		implicitLinkTargets = implicitLinkTargets != null ? Set.copyOf(implicitLinkTargets) : Set.of();
	}

	/**
	 * Emit every property; skip only the project's built-in objects and the master bus link.
	 */
	public static ReverseCompilerOptions defaults() {
		return new ReverseCompilerOptions(DEFAULT_MAX_NODES, DEFAULT_MAX_DEPTH, Set.of(), Map.of(),
				Set.of("Default Work Unit", "Master Audio Bus", "Master-Mixer Hierarchy"),
				Set.of("Master Audio Bus"));
	}

	public ReverseCompilerOptions withThresholds(int nodes, int depth) {
		return new ReverseCompilerOptions(nodes, depth, propertyWhitelist, defaultValues, systemObjectNames,
				implicitLinkTargets);
	}

	public boolean emitsProperty(String property, PropertyValue value) {
		if (value instanceof PropertyValue.Curve) {
			return true;
		}
		if (!propertyWhitelist.isEmpty() && !propertyWhitelist.contains(property)) {
			return false;
		}
		return !isDefault(property, value);
	}

	private boolean isDefault(String property, PropertyValue value) {
		PropertyValue defaultValue = defaultValues.get(property);
		if (defaultValue == null) {
			return false;
		}
		if (isNumber(defaultValue) && isNumber(value)) {
			return Double.compare(toDouble(defaultValue), toDouble(value)) == 0;
		}
		return defaultValue.equals(value);
	}

	private static boolean isNumber(PropertyValue value) {
		return value instanceof PropertyValue.Int || value instanceof PropertyValue.Decimal;
	}

	private static double toDouble(PropertyValue value) {
		if (value instanceof PropertyValue.Int i) {
			return i.value();
		}
		return ((PropertyValue.Decimal) value).value();
	}
}
