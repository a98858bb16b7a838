package org.javai.wwisedsl.reverse;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.javai.wwisedsl.model.PropertyValue;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads {@link ReverseCompilerOptions} from YAML.
 * <pre>
 * thresholds:
 *   max_nodes: 30
 *   max_depth: 3
 * property_whitelist: [Volume, Pitch]
 * default_values:
 *   Volume: 0
 *   IsLoopingEnabled: false
 * system_objects: [Default Work Unit, Master Audio Bus]
 * implicit_link_targets: [Master Audio Bus]
 * </pre>
 * Every section is optional; a missing section keeps the value from {@link ReverseCompilerOptions#defaults()}.
 */
public class ReverseCompilerOptionsLoader {

	/**
	 * Classpath location of the bundled profile, which emits a curated property set.
	 */
	public static final String CURATED_PROFILE = "/reverse-compiler.yml";

	private final Yaml yaml = new Yaml();

	public ReverseCompilerOptions load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return load(reader);
		}
		catch (ReverseCompilerConfigException e) {
			throw e;
		}
		catch (Exception e) {
			throw new ReverseCompilerConfigException("Failed to read reverse compiler options from " + path, e);
		}
	}

	public ReverseCompilerOptions load(Reader reader) {
		Object data;
		try {
			data = yaml.load(reader);
		}
		catch (Exception e) {
			throw new ReverseCompilerConfigException("Failed to read reverse compiler options", e);
		}
		return build(data);
	}

	public ReverseCompilerOptions load(InputStream inputStream) {
		Object data;
		try {
			data = yaml.load(inputStream);
		}
		catch (Exception e) {
			throw new ReverseCompilerConfigException("Failed to read reverse compiler options", e);
		}
		return build(data);
	}

	public ReverseCompilerOptions loadString(String content) {
		Object data;
		try {
			data = yaml.load(content);
		}
		catch (Exception e) {
			throw new ReverseCompilerConfigException("Failed to read reverse compiler options", e);
		}
		return build(data);
	}

	/**
	 * Load the bundled curated profile.
	 */
	public ReverseCompilerOptions loadCurated() {
		InputStream in = ReverseCompilerOptionsLoader.class.getResourceAsStream(CURATED_PROFILE);
		if (in == null) {
			throw new ReverseCompilerConfigException("Missing classpath resource " + CURATED_PROFILE);
		}
		try (in) {
			return load(in);
		}
		catch (IOException e) {
			throw new ReverseCompilerConfigException("Failed to close " + CURATED_PROFILE, e);
		}
	}

	@SuppressWarnings("unchecked")
	private ReverseCompilerOptions build(Object data) {
		ReverseCompilerOptions defaults = ReverseCompilerOptions.defaults();
		if (data == null) {
			return defaults;
		}
		if (!(data instanceof Map)) {
			throw new ReverseCompilerConfigException("Expected a mapping at the top level");
		}
		Map<String, Object> root = (Map<String, Object>) data;

		int maxNodes = defaults.maxNodes();
		int maxDepth = defaults.maxDepth();
		Object thresholds = root.get("thresholds");
		if (thresholds != null) {
			Map<String, Object> map = asMap(thresholds, "thresholds");
			maxNodes = toInt(map.getOrDefault("max_nodes", maxNodes), "thresholds.max_nodes");
			maxDepth = toInt(map.getOrDefault("max_depth", maxDepth), "thresholds.max_depth");
		}

		Set<String> whitelist = root.containsKey("property_whitelist")
				? toNames(root.get("property_whitelist"), "property_whitelist")
				: defaults.propertyWhitelist();
		Map<String, PropertyValue> defaultValues = root.containsKey("default_values")
				? toValues(root.get("default_values"))
				: defaults.defaultValues();
		Set<String> systemObjects = root.containsKey("system_objects")
				? toNames(root.get("system_objects"), "system_objects")
				: defaults.systemObjectNames();
		Set<String> implicitTargets = root.containsKey("implicit_link_targets")
				? toNames(root.get("implicit_link_targets"), "implicit_link_targets")
				: defaults.implicitLinkTargets();

		try {
			return new ReverseCompilerOptions(maxNodes, maxDepth, whitelist, defaultValues, systemObjects,
					implicitTargets);
		}
		catch (IllegalArgumentException e) {
			throw new ReverseCompilerConfigException(e.getMessage(), e);
		}
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> asMap(Object value, String section) {
		if (!(value instanceof Map)) {
			throw new ReverseCompilerConfigException("'" + section + "' must be a mapping");
		}
		return (Map<String, Object>) value;
	}

	private static int toInt(Object value, String field) {
		if (value instanceof Number number) {
			return number.intValue();
		}
		throw new ReverseCompilerConfigException("'" + field + "' must be a number, was " + value);
	}

	private static Set<String> toNames(Object value, String section) {
		if (value == null) {
			return Set.of();
		}
		if (!(value instanceof List<?> list)) {
			throw new ReverseCompilerConfigException("'" + section + "' must be a list");
		}
		Set<String> names = new LinkedHashSet<>();
		for (Object item : list) {
			names.add(String.valueOf(item));
		}
		return names;
	}

	private static Map<String, PropertyValue> toValues(Object value) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?> map)) {
			throw new ReverseCompilerConfigException("'default_values' must be a mapping");
		}
		Map<String, PropertyValue> values = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : map.entrySet()) {
			String property = String.valueOf(entry.getKey());
			values.put(property, toValue(property, entry.getValue()));
		}
		return values;
	}

	private static PropertyValue toValue(String property, Object raw) {
		if (raw instanceof Boolean b) {
			return PropertyValue.of(b);
		}
		if (raw instanceof Integer || raw instanceof Long) {
			return PropertyValue.of(((Number) raw).longValue());
		}
		if (raw instanceof Number number) {
			return PropertyValue.of(number.doubleValue());
		}
		try {
			return PropertyValue.parse(String.valueOf(raw));
		}
		catch (IllegalArgumentException e) {
			throw new ReverseCompilerConfigException("Invalid default for " + property + ": " + raw, e);
		}
	}
}
