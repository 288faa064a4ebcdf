package solcore.config;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import solcore.model.RadiationType;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads {@link RunConfig} from a JSON file.
 * <pre>
 * {
 *   "mode": "train",
 *   "input": "data/input", "output": "data/output", "artifact": "data/artifacts",
 *   "plant_ids": ["P1"],
 *   "target_radiation_type": "ghi",
 *   "time_windows": {"training": "2024-01-01T00:00/2024-01-31T23:50", ...},
 *   "postprocessing": {"errors": true}
 * }
 * </pre>
 */
public final class RunConfigLoader {

    private RunConfigLoader() {}

    public static RunConfig load(Path file) throws IOException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonElement root = JsonParser.parseReader(reader);
            return parse(root);
        } catch (JsonParseException e) {
            throw new IOException("Malformed config " + file + ": " + e.getMessage(), e);
        }
    }

    public static RunConfig parse(String json) {
        return parse(JsonParser.parseString(json));
    }

    static RunConfig parse(JsonElement root) {
        if (root == null || !root.isJsonObject()) {
            throw new IllegalArgumentException("config must be a JSON object");
        }
        JsonObject obj = root.getAsJsonObject();

        RunMode mode = RunMode.fromKey(requireString(obj, "mode"));
        Path input = Paths.get(requireString(obj, "input"));
        Path output = Paths.get(requireString(obj, "output"));
        Path artifact = Paths.get(requireString(obj, "artifact"));

        List<String> plantIds = new ArrayList<>();
        JsonElement ids = obj.get("plant_ids");
        if (ids != null && !ids.isJsonNull()) {
            if (!ids.isJsonArray()) throw new IllegalArgumentException("plant_ids must be an array");
            JsonArray arr = ids.getAsJsonArray();
            for (JsonElement id : arr) {
                plantIds.add(id.getAsString());
            }
        }

        RadiationType target = RadiationType.GHI;
        String targetKey = optionalString(obj, "target_radiation_type");
        if (targetKey != null) {
            target = RadiationType.fromKey(targetKey);
        }

        JsonElement windowsElement = obj.get("time_windows");
        if (windowsElement == null || !windowsElement.isJsonObject()) {
            throw new IllegalArgumentException("Missing config key: time_windows");
        }
        JsonObject windows = windowsElement.getAsJsonObject();
        TimeWindow training = optionalWindow(windows, "training");
        TimeWindow validation = optionalWindow(windows, "validation");
        TimeWindow test = optionalWindow(windows, "test");
        TimeWindow inference = optionalWindow(windows, "inference");

        if (mode == RunMode.TRAIN && training == null) {
            throw new IllegalArgumentException("Missing config key: time_windows.training");
        }
        if (mode == RunMode.INFERENCE && inference == null) {
            throw new IllegalArgumentException("Missing config key: time_windows.inference");
        }

        boolean errors = false;
        JsonElement post = obj.get("postprocessing");
        if (post != null && post.isJsonObject()) {
            JsonElement e = post.getAsJsonObject().get("errors");
            errors = e != null && !e.isJsonNull() && e.getAsBoolean();
        }

        return new RunConfig(mode, input, output, artifact, plantIds, target,
                training, validation, test, inference, errors);
    }

    private static String requireString(JsonObject obj, String key) {
        String v = optionalString(obj, key);
        if (v == null) throw new IllegalArgumentException("Missing config key: " + key);
        return v;
    }

    private static String optionalString(JsonObject obj, String key) {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) return null;
        return e.getAsString();
    }

    private static TimeWindow optionalWindow(JsonObject windows, String key) {
        String v = optionalString(windows, key);
        return v == null ? null : TimeWindow.parse(v);
    }
}
