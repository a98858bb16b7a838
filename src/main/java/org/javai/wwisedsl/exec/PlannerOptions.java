package org.javai.wwisedsl.exec;

/**
 * Options for executing statements.
 *
 * @param overrideOnLink set the owning object's override flag ({@code OverrideOutput} for bus links,
 * {@code OverridePositioning} for attenuation links) before linking, so the link takes effect on
 * objects that inherit these settings from their parent
 */
public record PlannerOptions(boolean overrideOnLink) {

	public static PlannerOptions defaults() {
		return new PlannerOptions(false);
	}

	public static PlannerOptions linkOverrideOptions() {
		return new PlannerOptions(true);
	}
}
