package com.workqueue.registry;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.workqueue.core.JobExecutionException;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encoding and decoding of the JSON lists stored on jobs and cron entries.
 *
 * <p>All methods are pure functions. Lists are parsed strictly: unquoted words,
 * trailing garbage and anything that is not a top-level list are rejected.</p>
 *
 * <p>Numbers decode to {@code Long} when integral and to {@code Double} otherwise.</p>
 */
public final class ArgumentDecoder {
    // Shared Gson instance - thread-safe
    private static final Gson gson = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();
    private static final TypeAdapter<JsonElement> elementAdapter = gson.getAdapter(JsonElement.class);

    private ArgumentDecoder() {
    }

    /**
     * Encode values as a JSON list.
     *
     * <p>A {@link SubjectSet} is written as its list of ids, so it can be passed
     * to a SUBJECTS parameter.</p>
     *
     * @param values the values, in order
     * @return the JSON list text
     */
    public static String encodeList(List<?> values) {
        List<Object> plain = new ArrayList<>(values.size());
        for (Object value : values) {
            plain.add(value instanceof SubjectSet ? ((SubjectSet) value).getIds() : value);
        }
        return gson.toJson(plain);
    }

    /**
     * Parse a JSON list of integer ids.
     *
     * @param encoded the stored encoding, e.g. {@code [1, 2]}
     * @return the ids in order
     * @throws IllegalArgumentException if the text is not a list of integers
     */
    public static List<Long> decodeSubjectIds(String encoded) {
        JsonArray array = parseList(encoded);
        List<Long> ids = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            Long id = asInteger(array.get(i));
            if (id == null) {
                throw new IllegalArgumentException("element " + i + " is not an integer id: " + array.get(i));
            }
            ids.add(id);
        }
        return Collections.unmodifiableList(ids);
    }

    /**
     * Parse a JSON list of argument values without interpreting them.
     *
     * @param encoded the stored encoding, e.g. {@code [[1, 2], "My string value", true]}
     * @return the raw elements in order
     * @throws IllegalArgumentException if the text is not a JSON list
     */
    public static List<JsonElement> decodeArgumentList(String encoded) {
        JsonArray array = parseList(encoded);
        List<JsonElement> elements = new ArrayList<>(array.size());
        array.forEach(elements::add);
        return elements;
    }

    /**
     * Convert one raw argument according to the kind of the parameter receiving it.
     *
     * @param kind   declared parameter kind
     * @param raw    raw element from {@link #decodeArgumentList(String)}
     * @param domain domain of the job, used for SUBJECTS arguments
     * @return the Java value passed to the handler
     * @throws JobExecutionException if the value does not fit the kind
     */
    public static Object decodeArgument(ParamKind kind, JsonElement raw, String domain) {
        switch (kind) {
            case SUBJECTS:
                return new SubjectSet(domain, toSubjectIds(raw));
            case STRUCTURED:
                if (!raw.isJsonObject()) {
                    throw new JobExecutionException("expected a JSON object for structured data, got " + raw);
                }
                return toJava(raw);
            case SCALAR:
            default:
                return toJava(raw);
        }
    }

    private static List<Long> toSubjectIds(JsonElement raw) {
        Long single = asInteger(raw);
        if (single != null) {
            return List.of(single);
        }
        if (raw.isJsonArray()) {
            List<Long> ids = new ArrayList<>();
            for (JsonElement element : raw.getAsJsonArray()) {
                Long id = asInteger(element);
                if (id == null) {
                    throw new JobExecutionException("expected an id or a list of ids, got " + raw);
                }
                ids.add(id);
            }
            return ids;
        }
        throw new JobExecutionException("expected an id or a list of ids, got " + raw);
    }

    private static JsonArray parseList(String encoded) {
        if (encoded == null) {
            throw new IllegalArgumentException("no list given");
        }
        try (JsonReader reader = new JsonReader(new StringReader(encoded))) {
            reader.setLenient(false);
            JsonElement element = elementAdapter.read(reader);
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new IllegalArgumentException("unexpected content after the list at " + reader.getPath());
            }
            if (!element.isJsonArray()) {
                throw new IllegalArgumentException("expected a JSON list, got " + element);
            }
            return element.getAsJsonArray();
        } catch (IOException | IllegalStateException | NumberFormatException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    private static Long asInteger(JsonElement element) {
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            return null;
        }
        BigDecimal value = element.getAsBigDecimal();
        try {
            return value.stripTrailingZeros().scale() <= 0 ? value.longValueExact() : null;
        } catch (ArithmeticException e) {
            return null;
        }
    }

    private static Object toJava(JsonElement element) {
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive()) {
            JsonPrimitive primitive = element.getAsJsonPrimitive();
            if (primitive.isBoolean()) {
                return primitive.getAsBoolean();
            }
            if (primitive.isNumber()) {
                Long integral = asInteger(primitive);
                return integral != null ? integral : (Object) primitive.getAsDouble();
            }
            return primitive.getAsString();
        }
        if (element.isJsonArray()) {
            List<Object> list = new ArrayList<>();
            for (JsonElement item : element.getAsJsonArray()) {
                list.add(toJava(item));
            }
            return Collections.unmodifiableList(list);
        }
        JsonObject object = element.getAsJsonObject();
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : object.entrySet()) {
            map.put(entry.getKey(), toJava(entry.getValue()));
        }
        return Collections.unmodifiableMap(map);
    }
}
