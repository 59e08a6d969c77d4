package work.deeployd.workflow.shared;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts Jackson trees to plain Java values (ordered maps, lists, numbers, strings) and back.
 */
public final class JsonValues {
    private static final ObjectMapper JSON = new ObjectMapper();
    private static final ObjectWriter PRETTY = JSON.writerWithDefaultPrettyPrinter();

    private JsonValues() {}

    public static Object read(String text) throws JsonProcessingException {
        return convertNode(JSON.readTree(text));
    }

    public static String write(Object value) throws JsonProcessingException {
        return PRETTY.writeValueAsString(value);
    }

    public static Object convertNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }

    /**
     * Deep copy of a decoded value; maps and lists are rebuilt, scalars are shared.
     */
    @SuppressWarnings("unchecked")
    public static Object copy(Object value) {
        if (value instanceof Map<?, ?> map) {
            var copy = new LinkedHashMap<String, Object>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), copy(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            var copy = new ArrayList<Object>(list.size());
            for (var item : list) {
                copy.add(copy(item));
            }
            return copy;
        }
        return value;
    }

    /**
     * True for an integer-typed number that fits in an {@code int} without narrowing.
     */
    public static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return true;
        }
        if (value instanceof Long number) {
            return number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE;
        }
        return value instanceof BigInteger big && big.bitLength() < 32;
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> asMap(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    public static List<?> asList(Object value) {
        return value instanceof List<?> list ? list : null;
    }

    public static String asText(Object value) {
        return value instanceof String str ? str : null;
    }

    /**
     * Reads an integer out of a decoded JSON number; decimals with no fraction are accepted, values outside
     * the {@code int} range are not.
     */
    public static Integer asInt(Object value) {
        if (isIntegral(value)) {
            return ((Number) value).intValue();
        }
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
                return (int) d;
            }
        }
        if (value instanceof String str && !str.isBlank()) {
            try {
                return Integer.parseInt(str.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
