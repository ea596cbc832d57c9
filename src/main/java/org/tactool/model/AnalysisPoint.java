package org.tactool.model;

import java.util.Objects;

/**
 * One annotated location on the loaded image: a laser-ablation target or a reference mark.
 *
 * <p>An {@code AnalysisPoint} is an immutable value. Metadata edits produce a new instance through
 * {@link #toBuilder()}; the owning {@link PointRegistry} swaps it in under the same id. The point holds
 * only data, anything drawn on screen is rebuilt from it.
 *
 * <h3>Fields</h3>
 * <ul>
 *   <li><b>id</b>: positive, unique within a registry. {@code 0} means "not yet assigned" and is
 *       replaced by the registry on insertion.</li>
 *   <li><b>label</b>: {@link PointLabel#REF_MARK} or {@link PointLabel#SPOT}</li>
 *   <li><b>x, y</b>: pixel coordinates in the loaded image, origin top-left</li>
 *   <li><b>diameter</b>: positive, intended in micrometres</li>
 *   <li><b>scale</b>: pixels per micron in force when the point was placed</li>
 *   <li><b>colour</b>: display colour tag, carried through unchanged</li>
 *   <li><b>sampleName, mountName, material, notes</b>: free text</li>
 * </ul>
 *
 * @since 1.0
 */
public final class AnalysisPoint {

    /** Id value of a point that has not been added to a registry yet. */
    public static final int UNASSIGNED_ID = 0;

    private final int id;
    private final PointLabel label;
    private final int x;
    private final int y;
    private final int diameter;
    private final double scale;
    private final String colour;
    private final String sampleName;
    private final String mountName;
    private final String material;
    private final String notes;

    private AnalysisPoint(Builder b) {
        this.id = b.id;
        this.label = b.label;
        this.x = b.x;
        this.y = b.y;
        this.diameter = b.diameter;
        this.scale = b.scale;
        this.colour = b.colour;
        this.sampleName = b.sampleName;
        this.mountName = b.mountName;
        this.material = b.material;
        this.notes = b.notes;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder holding every field of this point
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .label(label)
                .position(x, y)
                .diameter(diameter)
                .scale(scale)
                .colour(colour)
                .sampleName(sampleName)
                .mountName(mountName)
                .material(material)
                .notes(notes);
    }

    public int getId() { return id; }
    public PointLabel getLabel() { return label; }
    public int getX() { return x; }
    public int getY() { return y; }
    public int getDiameter() { return diameter; }
    public double getScale() { return scale; }
    public String getColour() { return colour; }
    public String getSampleName() { return sampleName; }
    public String getMountName() { return mountName; }
    public String getMaterial() { return material; }
    public String getNotes() { return notes; }

    public boolean hasId() {
        return id != UNASSIGNED_ID;
    }

    public boolean isReferenceMark() {
        return label == PointLabel.REF_MARK;
    }

    /**
     * Radius of the drawn circle in image pixels: half the diameter converted with the point's scale,
     * never below one pixel.
     */
    public double getDisplayRadius() {
        return Math.max(1.0, diameter * scale / 2.0);
    }

    AnalysisPoint withId(int newId) {
        return toBuilder().id(newId).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AnalysisPoint other)) return false;
        return id == other.id
                && x == other.x
                && y == other.y
                && diameter == other.diameter
                && Double.compare(scale, other.scale) == 0
                && label == other.label
                && colour.equals(other.colour)
                && sampleName.equals(other.sampleName)
                && mountName.equals(other.mountName)
                && material.equals(other.material)
                && notes.equals(other.notes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, x, y, diameter, scale, colour, sampleName, mountName, material, notes);
    }

    @Override
    public String toString() {
        return String.format("AnalysisPoint[id=%d, label=%s, x=%d, y=%d, diameter=%d, scale=%s, colour=%s, sample=%s]",
                id, label, x, y, diameter, scale, colour, sampleName);
    }

    /**
     * Builder for {@link AnalysisPoint}. Position is required; everything else has a default taken
     * from {@link PointSettings#defaults()}.
     */
    public static final class Builder {
        private int id = UNASSIGNED_ID;
        private PointLabel label = PointSettings.DEFAULT_LABEL;
        private Integer x;
        private Integer y;
        private int diameter = PointSettings.DEFAULT_DIAMETER;
        private double scale = PointSettings.DEFAULT_SCALE;
        private String colour = PointSettings.DEFAULT_COLOUR;
        private String sampleName = PointSettings.NONE;
        private String mountName = PointSettings.NONE;
        private String material = PointSettings.NONE;
        private String notes = "";

        private Builder() {
        }

        public Builder id(int id) {
            this.id = id;
            return this;
        }

        public Builder label(PointLabel label) {
            this.label = label;
            return this;
        }

        /**
         * @throws InvalidLabelException if the text is not a known label
         */
        public Builder label(String label) {
            this.label = PointLabel.parse(label);
            return this;
        }

        public Builder position(int x, int y) {
            this.x = x;
            this.y = y;
            return this;
        }

        public Builder diameter(int diameter) {
            this.diameter = diameter;
            return this;
        }

        public Builder scale(double scale) {
            this.scale = scale;
            return this;
        }

        public Builder colour(String colour) {
            this.colour = colour;
            return this;
        }

        public Builder sampleName(String sampleName) {
            this.sampleName = sampleName;
            return this;
        }

        public Builder mountName(String mountName) {
            this.mountName = mountName;
            return this;
        }

        public Builder material(String material) {
            this.material = material;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the position is missing or a numeric field is out of range
         */
        public AnalysisPoint build() {
            if (x == null || y == null) {
                throw new IllegalArgumentException("An analysis point needs x and y coordinates");
            }
            if (id < 0) {
                throw new IllegalArgumentException("Point id must be positive, got " + id);
            }
            if (label == null) {
                throw new InvalidLabelException(null);
            }
            if (diameter <= 0) {
                throw new IllegalArgumentException("Diameter must be positive, got " + diameter);
            }
            if (!(scale > 0) || Double.isInfinite(scale)) {
                throw new IllegalArgumentException("Scale must be a positive number, got " + scale);
            }
            colour = colour == null ? PointSettings.DEFAULT_COLOUR : colour;
            sampleName = sampleName == null ? PointSettings.NONE : sampleName;
            mountName = mountName == null ? PointSettings.NONE : mountName;
            material = material == null ? PointSettings.NONE : material;
            notes = notes == null ? "" : notes;
            return new AnalysisPoint(this);
        }
    }
}
