package org.tactool.model;

import java.util.Objects;

/**
 * Immutable set of the current point settings: the values given to a newly placed point and the
 * fallbacks used when an imported row leaves a field empty.
 *
 * <p>Instances are passed explicitly to placement and import operations. Use the {@code with*}
 * methods to derive a modified copy.
 *
 * <pre>{@code
 * PointSettings settings = PointSettings.defaults()
 *         .withSampleName("sample_x83")
 *         .withScale(2.5);
 * }</pre>
 *
 * @since 1.0
 */
public final class PointSettings {

    /** Sentinel for metadata that has not been filled in. */
    public static final String NONE = "None";

    public static final String DEFAULT_COLOUR = "#ffff00";
    public static final int DEFAULT_DIAMETER = 10;
    public static final double DEFAULT_SCALE = 1.0;
    public static final PointLabel DEFAULT_LABEL = PointLabel.REF_MARK;

    private static final PointSettings DEFAULTS = new PointSettings(
            NONE, NONE, NONE, DEFAULT_COLOUR, DEFAULT_DIAMETER, DEFAULT_SCALE, DEFAULT_LABEL);

    private final String sampleName;
    private final String mountName;
    private final String material;
    private final String colour;
    private final int diameter;
    private final double scale;
    private final PointLabel label;

    public PointSettings(String sampleName, String mountName, String material,
                         String colour, int diameter, double scale, PointLabel label) {
        if (diameter <= 0) {
            throw new IllegalArgumentException("Diameter must be positive, got " + diameter);
        }
        if (!(scale > 0) || Double.isInfinite(scale)) {
            throw new IllegalArgumentException("Scale must be a positive number, got " + scale);
        }
        this.sampleName = sampleName == null ? NONE : sampleName;
        this.mountName = mountName == null ? NONE : mountName;
        this.material = material == null ? NONE : material;
        this.colour = colour == null ? DEFAULT_COLOUR : colour;
        this.diameter = diameter;
        this.scale = scale;
        this.label = label == null ? DEFAULT_LABEL : label;
    }

    /**
     * @return {@code sample_name=None, mount_name=None, material=None, colour=#ffff00,
     *         diameter=10, scale=1.0, label=RefMark}
     */
    public static PointSettings defaults() {
        return DEFAULTS;
    }

    public String getSampleName() { return sampleName; }
    public String getMountName() { return mountName; }
    public String getMaterial() { return material; }
    public String getColour() { return colour; }
    public int getDiameter() { return diameter; }
    public double getScale() { return scale; }
    public PointLabel getLabel() { return label; }

    public PointSettings withSampleName(String value) {
        return new PointSettings(value, mountName, material, colour, diameter, scale, label);
    }

    public PointSettings withMountName(String value) {
        return new PointSettings(sampleName, value, material, colour, diameter, scale, label);
    }

    public PointSettings withMaterial(String value) {
        return new PointSettings(sampleName, mountName, value, colour, diameter, scale, label);
    }

    public PointSettings withColour(String value) {
        return new PointSettings(sampleName, mountName, material, value, diameter, scale, label);
    }

    public PointSettings withDiameter(int value) {
        return new PointSettings(sampleName, mountName, material, colour, value, scale, label);
    }

    public PointSettings withScale(double value) {
        return new PointSettings(sampleName, mountName, material, colour, diameter, value, label);
    }

    public PointSettings withLabel(PointLabel value) {
        return new PointSettings(sampleName, mountName, material, colour, diameter, scale, value);
    }

    /**
     * Starts a point builder pre-filled with these settings at the given position.
     * This is how a click on the image becomes a point.
     */
    public AnalysisPoint.Builder newPoint(int x, int y) {
        return AnalysisPoint.builder()
                .position(x, y)
                .label(label)
                .diameter(diameter)
                .scale(scale)
                .colour(colour)
                .sampleName(sampleName)
                .mountName(mountName)
                .material(material);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PointSettings other)) return false;
        return diameter == other.diameter
                && Double.compare(scale, other.scale) == 0
                && sampleName.equals(other.sampleName)
                && mountName.equals(other.mountName)
                && material.equals(other.material)
                && colour.equals(other.colour)
                && label == other.label;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sampleName, mountName, material, colour, diameter, scale, label);
    }

    @Override
    public String toString() {
        return String.format("PointSettings[sample=%s, mount=%s, material=%s, colour=%s, diameter=%d, scale=%s, label=%s]",
                sampleName, mountName, material, colour, diameter, scale, label);
    }
}
