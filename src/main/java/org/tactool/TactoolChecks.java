package org.tactool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactool.model.AnalysisPoint;
import org.tactool.model.PointRegistry;
import org.tactool.model.PointSettings;
import org.tactool.model.ReferenceTriplet;
import org.tactool.utilities.SampleNameValidator;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * TactoolChecks collects the warnings shown to the user before an export. None of them blocks the
 * export:
 *
 * 1. Fewer than three reference marks, so the file cannot be recoordinated later.
 * 2. Every point still carries the default scale, so the scale was probably never set.
 * 3. A sample name that would not survive the Name column round trip.
 * 4. For image export, no image loaded.
 */
public class TactoolChecks {

    private static final Logger logger = LoggerFactory.getLogger(TactoolChecks.class);

    private TactoolChecks() {
    }

    /**
     * Checks a registry before writing it to a point file.
     *
     * @return warning messages, empty if there is nothing to report
     */
    public static List<String> checkPointExport(PointRegistry registry) {
        List<String> warnings = new ArrayList<>();

        int references = registry.referencePoints().size();
        if (references < ReferenceTriplet.SIZE) {
            warnings.add("There are " + references + " reference marks. At least "
                    + ReferenceTriplet.SIZE + " are needed to recoordinate this data later.");
        }

        if (!registry.isEmpty() && registry.points().stream()
                .allMatch(p -> p.getScale() == PointSettings.DEFAULT_SCALE)) {
            warnings.add("The scale has not been set. Every point uses the default scale of "
                    + PointSettings.DEFAULT_SCALE + " pixels per micron.");
        }

        Set<String> sampleNames = new LinkedHashSet<>();
        for (AnalysisPoint point : registry.points()) {
            sampleNames.add(point.getSampleName());
        }
        for (String sampleName : sampleNames) {
            String error = SampleNameValidator.getValidationError(sampleName);
            if (error != null) {
                warnings.add("Sample name '" + sampleName + "': " + error);
            }
        }

        log(warnings);
        return warnings;
    }

    /**
     * Checks before rendering points onto an image.
     *
     * @param imageLoaded whether an annotation image is currently open
     */
    public static List<String> checkImageExport(PointRegistry registry, boolean imageLoaded) {
        List<String> warnings = new ArrayList<>();
        if (!imageLoaded) {
            warnings.add("No image has been loaded.");
        }
        if (registry.isEmpty()) {
            warnings.add("There are no analysis points to draw.");
        }
        log(warnings);
        return warnings;
    }

    private static void log(List<String> warnings) {
        if (warnings.isEmpty()) {
            logger.info("Export checks passed");
        } else {
            warnings.forEach(w -> logger.warn("Export check: {}", w));
        }
    }
}
