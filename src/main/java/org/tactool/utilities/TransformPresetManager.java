package org.tactool.utilities;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactool.service.FileAccessException;

import java.awt.geom.AffineTransform;
import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps fitted recoordination transforms under a name so that later instrument files from the same
 * mount can be recoordinated without placing reference marks again.
 * Presets are stored together in one JSON file, rewritten on every change.
 *
 * @since 1.0
 */
public class TransformPresetManager {
    private static final Logger logger = LoggerFactory.getLogger(TransformPresetManager.class);

    private static final Type PRESET_MAP_TYPE = new TypeToken<Map<String, TransformPreset>>() {}.getType();

    private final Path presetsPath;
    private Map<String, TransformPreset> presets;
    private final Gson gson;

    /**
     * Opens a preset file, reading any presets it already holds. A file that does not exist yet is
     * created on the first save.
     *
     * @throws FileAccessException if an existing file cannot be read or is not a preset file
     */
    public TransformPresetManager(Path presetsPath) throws FileAccessException {
        this.presetsPath = presetsPath;
        this.gson = new GsonBuilder()
                .registerTypeAdapter(AffineTransform.class, new AffineTransformAdapter())
                .setPrettyPrinting()
                .create();
        this.presets = loadPresets();
        logger.info("Loaded {} transform presets from {}", presets.size(), presetsPath);
    }

    /**
     * A saved transform with the details needed to pick it again.
     */
    public static class TransformPreset {
        private final String name;
        private final String sourceDescription;
        private final AffineTransform transform;
        private final String createdDate;
        private final String notes;

        /**
         * @param sourceDescription what the transform maps from, e.g. the instrument file or mount name
         */
        public TransformPreset(String name, String sourceDescription, AffineTransform transform, String notes) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Preset name must not be blank");
            }
            this.name = name;
            this.sourceDescription = sourceDescription;
            this.transform = new AffineTransform(transform);
            this.createdDate = Instant.now().toString();
            this.notes = notes;
        }

        public String getName() { return name; }
        public String getSourceDescription() { return sourceDescription; }
        public AffineTransform getTransform() { return new AffineTransform(transform); }
        public String getCreatedDate() { return createdDate; }
        public String getNotes() { return notes; }

        @Override
        public String toString() {
            return String.format("%s (%s)", name, sourceDescription);
        }
    }

    /**
     * Writes a transform as its six matrix entries, named as in {@link AffineTransform}.
     */
    static class AffineTransformAdapter extends TypeAdapter<AffineTransform> {

        @Override
        public void write(JsonWriter out, AffineTransform transform) throws IOException {
            if (transform == null) {
                out.nullValue();
                return;
            }
            double[] m = new double[6];
            transform.getMatrix(m);
            out.beginObject();
            out.name("m00").value(m[0]);
            out.name("m10").value(m[1]);
            out.name("m01").value(m[2]);
            out.name("m11").value(m[3]);
            out.name("m02").value(m[4]);
            out.name("m12").value(m[5]);
            out.endObject();
        }

        @Override
        public AffineTransform read(JsonReader in) throws IOException {
            if (in.peek() == JsonToken.NULL) {
                in.nextNull();
                return null;
            }
            // Missing entries default to the identity
            double[] m = {1, 0, 0, 1, 0, 0};
            in.beginObject();
            while (in.hasNext()) {
                switch (in.nextName()) {
                    case "m00" -> m[0] = in.nextDouble();
                    case "m10" -> m[1] = in.nextDouble();
                    case "m01" -> m[2] = in.nextDouble();
                    case "m11" -> m[3] = in.nextDouble();
                    case "m02" -> m[4] = in.nextDouble();
                    case "m12" -> m[5] = in.nextDouble();
                    default -> in.skipValue();
                }
            }
            in.endObject();
            return new AffineTransform(m);
        }
    }

    private Map<String, TransformPreset> loadPresets() throws FileAccessException {
        if (!Files.exists(presetsPath)) {
            logger.info("No saved transforms file found at {}", presetsPath);
            return new LinkedHashMap<>();
        }
        try {
            String json = Files.readString(presetsPath, StandardCharsets.UTF_8);
            Map<String, TransformPreset> loaded = gson.fromJson(json, PRESET_MAP_TYPE);
            return loaded != null ? new LinkedHashMap<>(loaded) : new LinkedHashMap<>();
        } catch (IOException e) {
            logger.error("Failed to load transforms from {}", presetsPath, e);
            throw new FileAccessException(presetsPath, "Could not read transform presets", e);
        } catch (JsonParseException e) {
            logger.error("Transform preset file {} is not valid JSON", presetsPath, e);
            throw new FileAccessException(presetsPath, "Invalid transform preset file", e);
        }
    }

    /**
     * Writes the given presets and makes them current. The in-memory presets are left as they were if
     * the write fails.
     */
    private void savePresets(Map<String, TransformPreset> updated) throws FileAccessException {
        try {
            Files.writeString(presetsPath, gson.toJson(updated, PRESET_MAP_TYPE), StandardCharsets.UTF_8);
            presets = updated;
            logger.info("Saved {} transforms to {}", updated.size(), presetsPath);
        } catch (IOException e) {
            logger.error("Failed to save transforms to {}", presetsPath, e);
            throw new FileAccessException(presetsPath, "Could not write transform presets", e);
        }
    }

    /**
     * Saves a preset, replacing any preset with the same name.
     */
    public void savePreset(TransformPreset preset) throws FileAccessException {
        Map<String, TransformPreset> updated = new LinkedHashMap<>(presets);
        updated.put(preset.getName(), preset);
        savePresets(updated);
        logger.info("Saved transform preset: {} {}", preset.getName(),
                TransformationFunctions.formatTransformMatrix(preset.getTransform()));
    }

    public Optional<TransformPreset> getPreset(String name) {
        return Optional.ofNullable(presets.get(name));
    }

    /**
     * @return all presets sorted by name
     */
    public List<TransformPreset> listPresets() {
        return presets.values().stream()
                .sorted(Comparator.comparing(TransformPreset::getName))
                .toList();
    }

    /**
     * @return true if a preset was deleted
     */
    public boolean deletePreset(String name) throws FileAccessException {
        if (presets.containsKey(name)) {
            Map<String, TransformPreset> updated = new LinkedHashMap<>(presets);
            updated.remove(name);
            savePresets(updated);
            logger.info("Deleted transform preset: {}", name);
            return true;
        }
        return false;
    }
}
