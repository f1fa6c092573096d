package ai.attackframework.tools.opensearch.utils;

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.SerializableString;
import com.fasterxml.jackson.core.io.CharacterEscapes;
import com.fasterxml.jackson.core.io.SerializedString;
import com.fasterxml.jackson.core.util.MinimalPrettyPrinter;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import ai.attackframework.tools.opensearch.errors.ValidationException;

/**
 * Stateless helpers for index names, document ids, document normalization and paging.
 */
public final class OpenSearchUtils {

    private static final Pattern VALID_INDEX_NAME = Pattern.compile("^[a-z0-9][a-z0-9._-]*$");
    private static final Pattern INVALID_INDEX_CHARS = Pattern.compile("[^a-z0-9._-]");
    private static final int MAX_INDEX_NAME_BYTES = 255;
    private static final String[] BYTE_UNITS = {"B", "KB", "MB", "GB", "TB"};

    static final ObjectMapper SORTED_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    /** Key-sorted JSON with {@code ", "}/{@code ": "} separators and ASCII-only output, for stable ids. */
    private static final ObjectWriter ID_WRITER = SORTED_MAPPER
            .writer(new SpacedSeparators())
            .with(new AsciiEscapes());

    private OpenSearchUtils() {}

    /**
     * Validates an index name.
     *
     * @throws ValidationException when the name is empty, too long, {@code .}/{@code ..},
     *                             or does not match {@code ^[a-z0-9][a-z0-9._-]*$}
     */
    public static void validateIndexName(String indexName) {
        if (indexName == null || indexName.isEmpty()) {
            throw new ValidationException("Index name cannot be empty");
        }
        if (indexName.getBytes(StandardCharsets.UTF_8).length > MAX_INDEX_NAME_BYTES) {
            throw new ValidationException("Index name cannot be longer than 255 bytes");
        }
        if (".".equals(indexName) || "..".equals(indexName)) {
            throw new ValidationException("Index name cannot be '.' or '..'");
        }
        if (!VALID_INDEX_NAME.matcher(indexName).matches()) {
            throw new ValidationException("Invalid index name: " + indexName
                    + ". Must be lowercase, start with alphanumeric, and contain only alphanumeric, dots, hyphens, and underscores");
        }
    }

    /** Lowercases, replaces invalid characters with {@code _}, prefixes {@code idx_} when needed. */
    public static String sanitizeIndexName(String name) {
        String s = INVALID_INDEX_CHARS.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("_");
        if (s.isEmpty() || !Character.isLetterOrDigit(s.charAt(0))) {
            s = "idx_" + s;
        }
        while (s.getBytes(StandardCharsets.UTF_8).length > MAX_INDEX_NAME_BYTES) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }

    /**
     * Deterministic id: first 32 hex chars of the SHA-256 of {@link #canonicalJson(Map)}.
     * The text is the same one Python's {@code json.dumps(doc, sort_keys=True)} produces, so
     * clients in either language derive the same id for the same document.
     */
    public static String generateDocumentId(Map<String, Object> document) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonicalJson(document).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 32);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    /** @throws ValidationException when the document cannot be serialized */
    static String canonicalJson(Map<String, Object> document) {
        try {
            return ID_WRITER.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Document is not serializable: " + e.getOriginalMessage());
        }
    }

    private static final class SpacedSeparators extends MinimalPrettyPrinter {
        private static final long serialVersionUID = 1L;

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }

        @Override
        public void writeObjectEntrySeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }

        @Override
        public void writeArrayValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(", ");
        }
    }

    /** Escapes DEL, control characters and everything above ASCII as lowercase unicode escapes. */
    private static final class AsciiEscapes extends CharacterEscapes {
        private static final long serialVersionUID = 1L;

        private final int[] asciiEscapes;

        AsciiEscapes() {
            asciiEscapes = standardAsciiEscapesForJSON();
            for (int c = 0; c < asciiEscapes.length; c++) {
                if (asciiEscapes[c] == ESCAPE_STANDARD) {
                    asciiEscapes[c] = ESCAPE_CUSTOM;
                }
            }
            asciiEscapes[0x7f] = ESCAPE_CUSTOM;
        }

        @Override
        public int[] getEscapeCodesForAscii() {
            return asciiEscapes;
        }

        @Override
        public SerializableString getEscapeSequence(int ch) {
            return new SerializedString(String.format("\\u%04x", ch));
        }
    }

    /**
     * Prepares a document for indexing: drops null values, renders dates as ISO-8601,
     * converts {@link BigDecimal} to double and POJOs to maps. Recurses into maps and lists.
     */
    public static Map<String, Object> normalizeDocument(Map<String, ?> document) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (document == null) {
            return out;
        }
        for (Map.Entry<String, ?> e : document.entrySet()) {
            Object v = normalizeValue(e.getValue());
            if (v != null) {
                out.put(e.getKey(), v);
            }
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Object normalizeValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String || value instanceof Boolean || value instanceof Integer
                || value instanceof Long || value instanceof Double || value instanceof Float
                || value instanceof Short || value instanceof Byte || value instanceof BigInteger) {
            return value;
        }
        if (value instanceof BigDecimal bd) {
            return bd.doubleValue();
        }
        if (value instanceof Date d) {
            return d.toInstant().toString();
        }
        if (value instanceof TemporalAccessor t) {
            return t.toString();
        }
        if (value instanceof Enum<?> en) {
            return en.name();
        }
        if (value instanceof Map<?, ?> m) {
            return normalizeDocument((Map<String, ?>) m);
        }
        if (value instanceof Collection<?> c) {
            List<Object> list = new ArrayList<>(c.size());
            for (Object item : c) {
                list.add(normalizeValue(item));
            }
            return list;
        }
        if (value instanceof Object[] arr) {
            return normalizeValue(Arrays.asList(arr));
        }
        Map<String, Object> asMap = SORTED_MAPPER.convertValue(value, new TypeReference<Map<String, Object>>() {});
        return normalizeDocument(asMap);
    }

    /** Splits {@code items} into consecutive chunks of at most {@code size}. */
    public static <T> List<List<T>> chunk(List<T> items, int size) {
        if (size <= 0) {
            throw new ValidationException("Chunk size must be positive");
        }
        List<List<T>> chunks = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            chunks.add(new ArrayList<>(items.subList(i, Math.min(i + size, items.size()))));
        }
        return chunks;
    }

    /**
     * Flattens raw {@code hits.hits} from a response body map.
     */
    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> extractHits(Map<String, Object> response) {
        List<Map<String, Object>> out = new ArrayList<>();
        Object hitsObj = response == null ? null : response.get("hits");
        if (!(hitsObj instanceof Map<?, ?> hits)) {
            return out;
        }
        Object list = hits.get("hits");
        if (!(list instanceof List<?> items)) {
            return out;
        }
        for (Object o : items) {
            Map<String, Object> hit = (Map<String, Object>) o;
            Map<String, Object> doc = new LinkedHashMap<>();
            Object source = hit.get("_source");
            if (source instanceof Map<?, ?> src) {
                doc.putAll((Map<String, Object>) src);
            }
            doc.put("_id", hit.get("_id"));
            doc.put("_index", hit.get("_index"));
            doc.put("_score", hit.get("_score"));
            if (hit.containsKey("highlight")) {
                doc.put("highlight", hit.get("highlight"));
            }
            out.add(doc);
        }
        return out;
    }

    /** {@code base * 2^attempt}, capped at {@code max}. */
    public static long calculateBackoffDelay(int attempt, long baseDelayMs, long maxDelayMs) {
        double delay = baseDelayMs * Math.pow(2, attempt);
        return (long) Math.min(delay, maxDelayMs);
    }

    public static String buildAliasName(String indexName, String suffix) {
        return suffix == null || suffix.isEmpty() ? indexName + "_alias" : indexName + "_" + suffix;
    }

    /** Scroll body: the query, page size and {@code _doc} order. */
    public static Map<String, Object> buildScrollQuery(Map<String, Object> query, int size) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query == null ? Map.of("match_all", Map.of()) : query);
        body.put("size", size);
        body.put("sort", List.of("_doc"));
        return body;
    }

    /** Human-readable byte count with two decimals, B through PB. */
    public static String formatBytes(long bytes) {
        double value = bytes;
        for (String unit : BYTE_UNITS) {
            if (value < 1024.0) {
                return String.format(Locale.ROOT, "%.2f %s", value, unit);
            }
            value /= 1024.0;
        }
        return String.format(Locale.ROOT, "%.2f PB", value);
    }

    /**
     * Parses ISO-8601 (offset or {@code Z}) or epoch milliseconds.
     *
     * @return parsed instant, empty when neither form matches
     */
    public static Optional<Instant> parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String v = value.trim();
        Optional<Instant> iso = parseIso(v);
        if (iso.isPresent()) {
            return iso;
        }
        try {
            return Optional.of(Instant.ofEpochMilli(Long.parseLong(v)));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static Optional<Instant> parseIso(String v) {
        try {
            return Optional.of(OffsetDateTime.parse(v).toInstant());
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
