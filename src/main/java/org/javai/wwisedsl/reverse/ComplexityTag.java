package org.javai.wwisedsl.reverse;

import java.util.Locale;

/**
 * Coarse difficulty label attached to every sample.
 */
public enum ComplexityTag {
	SIMPLE,
	MEDIUM,
	COMPLEX,
	EXPERT;

	/**
	 * Classify a sample. The first matching rule wins:
	 * <ol>
	 * <li>at most 3 lines and depth at most 1: simple</li>
	 * <li>at most 10 lines and depth at most 2: medium</li>
	 * <li>any ADD_ACTION, 3 or more LINKs, or depth 3 or more: expert</li>
	 * <li>otherwise complex</li>
	 * </ol>
	 */
	public static ComplexityTag classify(int lineCount, int depth, boolean hasActions, int linkCount) {
		if (lineCount <= 3 && depth <= 1) {
			return SIMPLE;
		}
		if (lineCount <= 10 && depth <= 2) {
			return MEDIUM;
		}
		if (hasActions || linkCount >= 3 || depth >= 3) {
			return EXPERT;
		}
		return COMPLEX;
	}

	/**
	 * Lower-case label used in dataset records.
	 */
	public String label() {
		return name().toLowerCase(Locale.ROOT);
	}
}
