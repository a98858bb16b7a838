package org.javai.wwisedsl.model;

/**
 * One point of an attenuation or parameter curve. Segments between points are linear.
 */
public record CurvePoint(double x, double y) {

	public CurvePoint {
		if (!Double.isFinite(x) || !Double.isFinite(y)) {
			throw new IllegalArgumentException("Curve point coordinates must be finite: (" + x + ", " + y + ")");
		}
	}
}
