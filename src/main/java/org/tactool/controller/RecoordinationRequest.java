package org.tactool.controller;

import org.tactool.model.PointSettings;
import org.tactool.service.csv.InstrumentDialect;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Parameters of one recoordination run, assembled with {@link Builder}.
 *
 * <pre>{@code
 * RecoordinationRequest request = RecoordinationRequest.builder()
 *         .instrumentFile(Path.of("sem_points.csv"))
 *         .imageSize(image.getWidth(), image.getHeight())
 *         .settings(currentSettings)
 *         .outputFile(Path.of("sem_points_recoordinated.csv"))
 *         .build();
 * }</pre>
 *
 * @since 1.0
 */
public class RecoordinationRequest {
    private final Path instrumentFile;
    private final InstrumentDialect dialect;
    private final PointSettings settings;
    private final double imageWidth;
    private final double imageHeight;
    private final Path outputFile;

    private RecoordinationRequest(Builder builder) {
        this.instrumentFile = builder.instrumentFile;
        this.dialect = builder.dialect;
        this.settings = builder.settings;
        this.imageWidth = builder.imageWidth;
        this.imageHeight = builder.imageHeight;
        this.outputFile = builder.outputFile;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getInstrumentFile() { return instrumentFile; }
    public InstrumentDialect getDialect() { return dialect; }
    public PointSettings getSettings() { return settings; }
    public double getImageWidth() { return imageWidth; }
    public double getImageHeight() { return imageHeight; }

    /**
     * @return where to write the recoordinated instrument file, if requested
     */
    public Optional<Path> getOutputFile() {
        return Optional.ofNullable(outputFile);
    }

    /**
     * @return the dialect bound to this request's image width
     */
    InstrumentDialect boundDialect() {
        return dialect.withImageWidth(imageWidth);
    }

    public static class Builder {
        private Path instrumentFile;
        private InstrumentDialect dialect = InstrumentDialect.defaults();
        private PointSettings settings = PointSettings.defaults();
        private double imageWidth = Double.NaN;
        private double imageHeight = Double.NaN;
        private Path outputFile;

        public Builder instrumentFile(Path instrumentFile) {
            this.instrumentFile = instrumentFile;
            return this;
        }

        public Builder dialect(InstrumentDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder settings(PointSettings settings) {
            this.settings = settings;
            return this;
        }

        /** Pixel size of the destination (annotation) image. */
        public Builder imageSize(double width, double height) {
            this.imageWidth = width;
            this.imageHeight = height;
            return this;
        }

        public Builder outputFile(Path outputFile) {
            this.outputFile = outputFile;
            return this;
        }

        public RecoordinationRequest build() {
            Objects.requireNonNull(instrumentFile, "Instrument file must be specified");
            Objects.requireNonNull(dialect, "Instrument dialect must be specified");
            Objects.requireNonNull(settings, "Point settings must be specified");
            if (!(imageWidth > 0) || !(imageHeight > 0)) {
                throw new IllegalArgumentException(
                        "Image size must be positive, got " + imageWidth + " x " + imageHeight);
            }
            return new RecoordinationRequest(this);
        }
    }
}
