package io.surfworks.spectrastack.data.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import io.surfworks.spectrastack.core.array.ScalarType;
import io.surfworks.spectrastack.core.index.Slice;
import io.surfworks.spectrastack.core.memory.MemoryProbe;
import io.surfworks.spectrastack.core.view.ChunkListener;
import io.surfworks.spectrastack.core.view.ViewOptions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * JSON form of {@link ViewOptions}.
 *
 * <pre>{@code
 * {
 *   "channel_axis": -1,
 *   "channel_slice": "10:200:2",
 *   "row_capacity": 0,
 *   "traversal_order": [0, 1],
 *   "read_only": false,
 *   "buffer_type": "F32",
 *   "memory_margin": 0.01,
 *   "minimum_rows": 1,
 *   "memory_probe": "heap"
 * }
 * }</pre>
 *
 * Every property is optional; absent ones take the {@link ViewOptions.Builder} default.
 * {@code memory_probe} is {@code "heap"}, {@code "physical"}, {@code "unknown"} or a fixed
 * number of bytes. Listeners are not part of the JSON form.
 */
public final class ViewOptionsJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private ViewOptionsJson() {} // Utility class

    public static String toJson(ViewOptions options) {
        return GSON.toJson(toJsonTree(options));
    }

    public static JsonObject toJsonTree(ViewOptions options) {
        JsonObject json = new JsonObject();
        json.addProperty("channel_axis", options.channelAxis());
        json.addProperty("channel_slice", options.channelSlice().toString());
        json.addProperty("row_capacity", options.rowCapacity());
        if (options.traversalOrder() != null) {
            json.add("traversal_order", GSON.toJsonTree(options.traversalOrder()));
        }
        json.addProperty("read_only", options.readOnly());
        if (options.bufferType() != null) {
            json.addProperty("buffer_type", options.bufferType().name());
        }
        json.addProperty("memory_margin", options.memoryMargin());
        json.addProperty("minimum_rows", options.minimumRows());
        json.add("memory_probe", probeToJson(options.memoryProbe()));
        return json;
    }

    /**
     * Parse options, with {@link ChunkListener#NONE} as listener.
     *
     * @throws JsonParseException       if the text is not a JSON object
     * @throws IllegalArgumentException if a property has an invalid value
     */
    public static ViewOptions fromJson(String text) {
        return fromJson(text, ChunkListener.NONE);
    }

    public static ViewOptions fromJson(String text, ChunkListener listener) {
        JsonObject json = GSON.fromJson(text, JsonObject.class);
        if (json == null) {
            throw new JsonParseException("Empty view options document");
        }
        return fromJsonTree(json, listener);
    }

    public static ViewOptions fromJsonTree(JsonObject json, ChunkListener listener) {
        ViewOptions.Builder builder = ViewOptions.builder().listener(listener);
        if (json.has("channel_axis")) {
            builder.channelAxis(json.get("channel_axis").getAsInt());
        }
        if (json.has("channel_slice")) {
            builder.channelSlice(Slice.parse(json.get("channel_slice").getAsString()));
        }
        if (json.has("row_capacity")) {
            builder.rowCapacity(json.get("row_capacity").getAsInt());
        }
        if (json.has("traversal_order") && !json.get("traversal_order").isJsonNull()) {
            builder.traversalOrder(GSON.fromJson(json.get("traversal_order"), int[].class));
        }
        if (json.has("read_only")) {
            builder.readOnly(json.get("read_only").getAsBoolean());
        }
        if (json.has("buffer_type") && !json.get("buffer_type").isJsonNull()) {
            builder.bufferType(ScalarType.valueOf(json.get("buffer_type").getAsString().toUpperCase(Locale.ROOT)));
        }
        if (json.has("memory_margin")) {
            builder.memoryMargin(json.get("memory_margin").getAsDouble());
        }
        if (json.has("minimum_rows")) {
            builder.minimumRows(json.get("minimum_rows").getAsInt());
        }
        if (json.has("memory_probe")) {
            builder.memoryProbe(probeFromJson(json.get("memory_probe")));
        }
        return builder.build();
    }

    public static ViewOptions read(Path path) throws IOException {
        return fromJson(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static void write(Path path, ViewOptions options) throws IOException {
        Files.writeString(path, toJson(options), StandardCharsets.UTF_8);
    }

    private static JsonElement probeToJson(MemoryProbe probe) {
        if (probe instanceof MemoryProbe.Fixed fixed) {
            return GSON.toJsonTree(fixed.bytes());
        }
        if (probe == MemoryProbe.PHYSICAL) {
            return GSON.toJsonTree("physical");
        }
        if (probe == MemoryProbe.UNKNOWN) {
            return GSON.toJsonTree("unknown");
        }
        if (probe == MemoryProbe.HEAP) {
            return GSON.toJsonTree("heap");
        }
        throw new IllegalArgumentException("Memory probe has no JSON form: " + probe);
    }

    private static MemoryProbe probeFromJson(JsonElement element) {
        if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
            return MemoryProbe.fixed(element.getAsLong());
        }
        String name = element.getAsString();
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "heap" -> MemoryProbe.heap();
            case "physical" -> MemoryProbe.physical();
            case "unknown" -> MemoryProbe.unknown();
            default -> throw new IllegalArgumentException("Unknown memory probe: " + name);
        };
    }
}
