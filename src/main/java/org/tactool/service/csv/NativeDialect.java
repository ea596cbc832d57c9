package org.tactool.service.csv;

import org.tactool.model.AnalysisPoint;
import org.tactool.model.InvalidLabelException;
import org.tactool.model.PointLabel;
import org.tactool.model.PointSettings;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * The tool's own point file.
 *
 * <p>Columns, in export order:
 * <pre>
 * Name,label,x,y,diameter,scale,colour,mount_name,material,notes
 * </pre>
 * {@code Name} joins sample name and id as {@code <sample_name>_#<id>}, the id padded to three digits
 * ({@code sample_x83_#001}). Reading splits it again on the <em>last</em> {@code _#}, so the round trip
 * is lossless unless a sample name itself contains {@code _#}.
 *
 * <p>On import the older laser layout headers {@code Type}, {@code X} and {@code Y} are accepted in
 * place of {@code label}, {@code x} and {@code y}, and a {@code Z} column is ignored. Empty optional
 * cells take the values of the {@link PointSettings} given to the dialect; coordinates, diameter and
 * scale that are present but not numeric reject the row.
 *
 * @since 1.0
 */
public class NativeDialect implements CsvDialect<AnalysisPoint> {

    public static final String NAME = "Name";
    public static final String LABEL = "label";
    public static final String X = "x";
    public static final String Y = "y";
    public static final String DIAMETER = "diameter";
    public static final String SCALE = "scale";
    public static final String COLOUR = "colour";
    public static final String SAMPLE_NAME = "sample_name";
    public static final String MOUNT_NAME = "mount_name";
    public static final String MATERIAL = "material";
    public static final String NOTES = "notes";

    /** Separator between sample name and id in the Name column. */
    public static final String ID_SEPARATOR = "_#";

    /** Export header, in order. */
    public static final List<String> HEADERS = List.of(
            NAME, LABEL, X, Y, DIAMETER, SCALE, COLOUR, MOUNT_NAME, MATERIAL, NOTES);

    // Laser layout spellings accepted on import
    static final String LEGACY_LABEL = "Type";
    static final String LEGACY_X = "X";
    static final String LEGACY_Y = "Y";

    private final PointSettings defaults;

    /**
     * @param defaults values used for empty optional cells
     */
    public NativeDialect(PointSettings defaults) {
        this.defaults = defaults == null ? PointSettings.defaults() : defaults;
    }

    public PointSettings getDefaults() {
        return defaults;
    }

    @Override
    public String getName() {
        return "native";
    }

    @Override
    public void checkHeaders(Path path, List<String> headers) throws MalformedFileException {
        boolean hasName = headers.contains(NAME);
        boolean hasX = headers.contains(X) || headers.contains(LEGACY_X);
        boolean hasY = headers.contains(Y) || headers.contains(LEGACY_Y);
        if (!hasName || !hasX || !hasY) {
            throw MalformedFileException.missingHeaders(path, List.of(NAME, X, Y));
        }
    }

    @Override
    public AnalysisPoint parseRow(Map<String, String> row, int rowNumber) throws MalformedRowException {
        String name = row.getOrDefault(NAME, "");
        String sampleName = Cells.value(row, SAMPLE_NAME);
        String idText = name.trim();

        int split = name.lastIndexOf(ID_SEPARATOR);
        if (split >= 0) {
            sampleName = name.substring(0, split);
            idText = name.substring(split + ID_SEPARATOR.length()).trim();
        }
        int id = idText.isEmpty() ? rowNumber : Cells.parsePositiveInteger(idText, "id", rowNumber);

        PointLabel label = defaults.getLabel();
        String labelText = Cells.value(row, LABEL, LEGACY_LABEL);
        if (labelText != null) {
            try {
                label = PointLabel.parse(labelText);
            } catch (InvalidLabelException e) {
                throw new MalformedRowException(rowNumber, e.getMessage());
            }
        }

        int x = Cells.parsePixel(Cells.value(row, X, LEGACY_X), X, rowNumber);
        int y = Cells.parsePixel(Cells.value(row, Y, LEGACY_Y), Y, rowNumber);

        String diameterText = Cells.value(row, DIAMETER);
        int diameter = diameterText == null
                ? defaults.getDiameter()
                : Cells.parsePositiveInteger(diameterText, DIAMETER, rowNumber);

        String scaleText = Cells.value(row, SCALE);
        double scale = scaleText == null
                ? defaults.getScale()
                : Cells.parsePositiveDouble(scaleText, SCALE, rowNumber);

        return AnalysisPoint.builder()
                .id(id)
                .label(label)
                .position(x, y)
                .diameter(diameter)
                .scale(scale)
                .colour(orDefault(Cells.value(row, COLOUR), defaults.getColour()))
                .sampleName(sampleName == null ? defaults.getSampleName() : sampleName)
                .mountName(orDefault(Cells.value(row, MOUNT_NAME), defaults.getMountName()))
                .material(orDefault(Cells.value(row, MATERIAL), defaults.getMaterial()))
                .notes(row.getOrDefault(NOTES, ""))
                .build();
    }

    /**
     * Joins sample name and id into the Name column value.
     */
    public static String formatName(String sampleName, int id) {
        return sampleName + ID_SEPARATOR + String.format("%03d", id);
    }

    /**
     * Converts a point into an export row matching {@link #HEADERS}.
     */
    public static String[] toRow(AnalysisPoint point) {
        return new String[]{
                formatName(point.getSampleName(), point.getId()),
                point.getLabel().getText(),
                Integer.toString(point.getX()),
                Integer.toString(point.getY()),
                Integer.toString(point.getDiameter()),
                Double.toString(point.getScale()),
                point.getColour(),
                point.getMountName(),
                point.getMaterial(),
                point.getNotes()
        };
    }

    private static String orDefault(String value, String fallback) {
        return value == null ? fallback : value;
    }
}
