package solcore.io;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stores one JSON file per plant under the artifact directory:
 * <pre>
 * {"plant_id": "P1", "parameters": {"mu0": .., "g": ..},
 *  "metrics": {"train": {"ME": .., "MAE": .., "RMSE": ..}, "validation": null, "testing": null},
 *  "radiation_type": "ghi"}
 * </pre>
 * NaN metrics are written as bare NaN literals.
 */
public final class ParameterArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ParameterArtifactStore.class);

    private static final String SUFFIX = ".json";

    private static final Gson gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .serializeSpecialFloatingPointValues()
            .serializeNulls()
            .setPrettyPrinting()
            .create();

    private final Path dir;

    public ParameterArtifactStore(Path dir) {
        this.dir = dir;
    }

    public Path save(PlantArtifact artifact) throws IOException {
        Files.createDirectories(dir);
        Path tmp = dir.resolve(artifact.getPlantId() + SUFFIX + ".tmp");
        Path fin = dir.resolve(artifact.getPlantId() + SUFFIX);
        try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
            gson.toJson(artifact, w);
        }
        Files.move(tmp, fin, StandardCopyOption.REPLACE_EXISTING);
        log.info("Wrote parameters of {} to {}", artifact.getPlantId(), fin);
        return fin;
    }

    public PlantArtifact load(String plantId) throws IOException {
        Path file = dir.resolve(plantId + SUFFIX);
        if (!Files.exists(file)) {
            throw new IOException("No artifact for plant " + plantId + " in " + dir);
        }
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            PlantArtifact artifact = gson.fromJson(r, PlantArtifact.class);
            if (artifact == null) throw new IOException("Empty artifact " + file);
            if (artifact.getPlantId() == null) artifact.setPlantId(plantId);
            return artifact;
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new IOException("Malformed artifact " + file + ": " + e.getMessage(), e);
        }
    }

    /** Plant ids with a stored artifact, sorted. */
    public List<String> listPlantIds() throws IOException {
        if (!Files.isDirectory(dir)) return new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
