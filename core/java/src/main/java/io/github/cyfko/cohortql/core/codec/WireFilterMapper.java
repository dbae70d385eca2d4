package io.github.cyfko.cohortql.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.cohortql.core.api.Combinator;
import io.github.cyfko.cohortql.core.api.FilterCondition;
import io.github.cyfko.cohortql.core.api.FilterNode;
import io.github.cyfko.cohortql.core.api.Op;
import io.github.cyfko.cohortql.core.exception.FilterCodecException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes the JSON forms of filter trees and filter states.
 *
 * <h2>Wire Filter JSON</h2>
 * <pre>{@code
 * {"AND": [
 *   {"IN": {"sex": ["Male"]}},
 *   {"GTE": {"age_at_censor_status": 0}},
 *   {"nested": {"path": "tumor_assessments", "AND": [{"IN": {"tumor_site": ["Liver"]}}]}}
 * ]}
 * }</pre>
 * <p>
 * Reading is strict: every filter object has exactly one key; {@code AND}/{@code OR} carry a
 * non-empty array; {@code nested} carries exactly {@code path} and one combinator; {@code IN} maps
 * fields to arrays and the other operators map fields to scalars. An operator object naming several
 * fields reads as an {@code AND} of one condition per field. Anything else is rejected with a
 * {@link FilterCodecException}. An empty object reads as "no filter".
 * </p>
 *
 * <h2>FilterState JSON</h2>
 * <pre>{@code
 * {"__combineMode": "AND", "__type": "STANDARD", "value": {
 *   "race": {"__type": "OPTION", "selectedValues": ["Asian"], "isExclusion": false},
 *   "age_at_censor_status": {"__type": "RANGE", "lowerBound": 0, "upperBound": 18}
 * }}
 * }</pre>
 * <p>A {@code COMPOSED} state carries an array of states under {@code value}.</p>
 *
 * @since 1.0.0
 */
public class WireFilterMapper {

    static final String NESTED = "nested";
    static final String PATH = "path";

    static final String COMBINE_MODE = "__combineMode";
    static final String TYPE = "__type";
    static final String VALUE = "value";
    static final String SELECTED_VALUES = "selectedValues";
    static final String IS_EXCLUSION = "isExclusion";
    static final String LOWER_BOUND = "lowerBound";
    static final String UPPER_BOUND = "upperBound";

    private final ObjectMapper objectMapper;

    public WireFilterMapper() {
        this(new ObjectMapper());
    }

    public WireFilterMapper(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    // ---------------------------------------------------------------- wire filter

    /**
     * @param json wire filter JSON
     * @return the tree, or {@code null} for JSON {@code null} or {@code {}}
     * @throws FilterCodecException on invalid JSON or grammar violations
     */
    public FilterNode read(String json) {
        return read(parse(json));
    }

    /**
     * @param node wire filter JSON tree
     * @return the tree, or {@code null} for a missing node, JSON {@code null} or {@code {}}
     * @throws FilterCodecException on grammar violations
     */
    public FilterNode read(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || (node.isObject() && node.isEmpty())) {
            return null;
        }
        return readFilter(node, "$", false);
    }

    /**
     * @param wire a wire filter held as plain maps and lists, as returned by {@link #write(FilterNode)}
     * @return the tree, or {@code null} for {@code null} or an empty map
     * @throws FilterCodecException on grammar violations
     */
    public FilterNode read(Map<String, ?> wire) {
        if (wire == null) {
            return null;
        }
        try {
            return read(objectMapper.<JsonNode>valueToTree(wire));
        } catch (IllegalArgumentException e) {
            throw new FilterCodecException("Wire filter is not convertible to JSON: " + e.getMessage(), e);
        }
    }

    /**
     * Converts a tree into plain maps and lists, ready for any JSON serializer.
     *
     * @param filter the tree, may be {@code null}
     * @return the wire object, or {@code null}
     */
    public Map<String, Object> write(FilterNode filter) {
        return filter == null ? null : filter.accept(new WireWriter());
    }

    /**
     * @param filter the tree, may be {@code null}
     * @return compact JSON, {@code "null"} for no filter
     */
    public String writeJson(FilterNode filter) {
        return toJson(write(filter));
    }

    /**
     * @param value any map/list/scalar structure
     * @return compact JSON
     */
    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new FilterCodecException("Failed to serialize filter: " + e.getOriginalMessage(), e);
        }
    }

    private FilterNode readFilter(JsonNode node, String location, boolean insideNested) {
        String key = singleKey(node, location);
        JsonNode body = node.get(key);

        if (Combinator.isCombinatorKey(key)) {
            return new FilterNode.Logical(Combinator.valueOf(key), readChildren(body, location + "." + key, insideNested));
        }
        if (NESTED.equals(key)) {
            if (insideNested) {
                throw new FilterCodecException("Nested block at " + location + " cannot contain another nested block");
            }
            return readNested(body, location + "." + NESTED);
        }
        Op op = Op.fromWireKey(key).orElseThrow(() ->
                new FilterCodecException("Unknown filter operator '" + key + "' at " + location));
        return readCondition(op, body, location + "." + key);
    }

    private List<FilterNode> readChildren(JsonNode body, String location, boolean insideNested) {
        if (body == null || !body.isArray()) {
            throw new FilterCodecException("Combinator at " + location + " must carry an array");
        }
        if (body.isEmpty()) {
            throw new FilterCodecException("Combinator at " + location + " must carry at least one filter");
        }
        List<FilterNode> children = new ArrayList<>(body.size());
        for (int i = 0; i < body.size(); i++) {
            children.add(readFilter(body.get(i), location + "[" + i + "]", insideNested));
        }
        return children;
    }

    private FilterNode readNested(JsonNode body, String location) {
        if (body == null || !body.isObject()) {
            throw new FilterCodecException("Nested block at " + location + " must be an object");
        }
        JsonNode path = body.get(PATH);
        if (path == null || !path.isTextual() || path.asText().isBlank()) {
            throw new FilterCodecException("Nested block at " + location + " requires a 'path' string");
        }
        String combinatorKey = null;
        for (Iterator<String> names = body.fieldNames(); names.hasNext(); ) {
            String name = names.next();
            if (PATH.equals(name)) continue;
            if (!Combinator.isCombinatorKey(name) || combinatorKey != null) {
                throw new FilterCodecException("Nested block at " + location
                        + " must contain exactly 'path' and one of AND/OR, found '" + name + "'");
            }
            combinatorKey = name;
        }
        if (combinatorKey == null) {
            throw new FilterCodecException("Nested block at " + location + " requires an AND or OR array");
        }
        List<FilterNode> children = readChildren(body.get(combinatorKey), location + "." + combinatorKey, true);
        return new FilterNode.Nested(path.asText(), Combinator.valueOf(combinatorKey), children);
    }

    private FilterNode readCondition(Op op, JsonNode body, String location) {
        if (body == null || !body.isObject() || body.isEmpty()) {
            throw new FilterCodecException(op.getCode() + " at " + location + " must map at least one field to a value");
        }
        List<FilterNode> leaves = new ArrayList<>();
        for (Iterator<Map.Entry<String, JsonNode>> fields = body.fields(); fields.hasNext(); ) {
            Map.Entry<String, JsonNode> field = fields.next();
            String fieldLocation = location + "." + field.getKey();
            Object value;
            if (op == Op.IN) {
                if (!field.getValue().isArray()) {
                    throw new FilterCodecException("IN at " + fieldLocation + " requires an array of values");
                }
                List<Object> values = new ArrayList<>();
                for (JsonNode item : field.getValue()) {
                    values.add(scalar(item, fieldLocation));
                }
                value = values;
            } else {
                value = scalar(field.getValue(), fieldLocation);
            }
            leaves.add(FilterNode.leaf(new FilterCondition(field.getKey(), op, value)));
        }
        return FilterNode.combine(Combinator.AND, leaves);
    }

    private static String singleKey(JsonNode node, String location) {
        if (node == null || !node.isObject()) {
            throw new FilterCodecException("Filter at " + location + " must be an object");
        }
        if (node.size() != 1) {
            List<String> keys = new ArrayList<>();
            node.fieldNames().forEachRemaining(keys::add);
            throw new FilterCodecException("Filter object at " + location + " must have exactly one key, got " + keys);
        }
        return node.fieldNames().next();
    }

    private static Object scalar(JsonNode node, String location) {
        if (node.isTextual()) return node.asText();
        if (node.isBoolean()) return node.asBoolean();
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.asLong() : node.bigIntegerValue();
        }
        if (node.isNumber()) return node.doubleValue();
        throw new FilterCodecException("Value at " + location + " must be a string, number or boolean, got "
                + node.getNodeType());
    }

    /**
     * Writes nodes as {@code {"KEY": ...}} maps.
     */
    private static final class WireWriter implements FilterNode.Visitor<Map<String, Object>> {

        @Override
        public Map<String, Object> visitLogical(FilterNode.Logical node) {
            Map<String, Object> wire = new LinkedHashMap<>();
            wire.put(node.combinator().name(), writeAll(node.children()));
            return wire;
        }

        @Override
        public Map<String, Object> visitLeaf(FilterNode.Leaf node) {
            FilterCondition condition = node.condition();
            Map<String, Object> operand = new LinkedHashMap<>();
            operand.put(condition.field(), condition.value());
            Map<String, Object> wire = new LinkedHashMap<>();
            wire.put(condition.operator().getCode(), operand);
            return wire;
        }

        @Override
        public Map<String, Object> visitNested(FilterNode.Nested node) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put(PATH, node.path());
            body.put(node.combinator().name(), writeAll(node.children()));
            Map<String, Object> wire = new LinkedHashMap<>();
            wire.put(NESTED, body);
            return wire;
        }

        private List<Object> writeAll(List<FilterNode> children) {
            List<Object> written = new ArrayList<>(children.size());
            children.forEach(child -> written.add(child.accept(this)));
            return written;
        }
    }

    // ---------------------------------------------------------------- filter state

    /**
     * @param json FilterState JSON
     * @return the state, or {@code null} for JSON {@code null}
     * @throws FilterCodecException on invalid JSON or an invalid state
     */
    public FilterState readState(String json) {
        return readState(parse(json));
    }

    /**
     * @param node FilterState JSON tree
     * @return the state, or {@code null} for a missing node or JSON {@code null}
     * @throws FilterCodecException on an invalid state
     */
    public FilterState readState(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return readState(node, "$");
    }

    private FilterState readState(JsonNode node, String location) {
        if (!node.isObject()) {
            throw new FilterCodecException("Filter state at " + location + " must be an object");
        }
        Combinator mode = Combinator.AND;
        JsonNode modeNode = node.get(COMBINE_MODE);
        if (modeNode != null && !modeNode.isNull()) {
            try {
                mode = Combinator.fromString(modeNode.asText());
            } catch (IllegalArgumentException e) {
                throw new FilterCodecException("Invalid " + COMBINE_MODE + " at " + location + ": " + modeNode.asText(), e);
            }
        }
        JsonNode typeNode = node.get(TYPE);
        FilterKind kind = typeNode != null && FilterKind.COMPOSED.name().equals(typeNode.asText())
                ? FilterKind.COMPOSED : FilterKind.STANDARD;
        JsonNode value = node.get(VALUE);

        if (kind == FilterKind.COMPOSED) {
            List<FilterState> children = new ArrayList<>();
            if (value != null && !value.isNull()) {
                if (!value.isArray()) {
                    throw new FilterCodecException("Composed filter state at " + location + " requires an array value");
                }
                for (int i = 0; i < value.size(); i++) {
                    JsonNode child = value.get(i);
                    children.add(child.isNull() ? null : readState(child, location + ".value[" + i + "]"));
                }
            }
            return FilterState.composed(mode, children);
        }

        Map<String, FilterValue> values = new LinkedHashMap<>();
        if (value != null && !value.isNull()) {
            if (!value.isObject()) {
                throw new FilterCodecException("Filter state at " + location + " requires an object value");
            }
            for (Iterator<Map.Entry<String, JsonNode>> entries = value.fields(); entries.hasNext(); ) {
                Map.Entry<String, JsonNode> entry = entries.next();
                values.put(entry.getKey(), readValue(entry.getValue(), location + ".value." + entry.getKey()));
            }
        }
        return FilterState.standard(mode, values);
    }

    private FilterValue readValue(JsonNode node, String location) {
        if (!node.isObject()) {
            throw new FilterCodecException("Filter value at " + location + " must be an object");
        }
        String type = node.path(TYPE).asText("");
        switch (type) {
            case "OPTION": {
                List<Object> selected = new ArrayList<>();
                JsonNode values = node.get(SELECTED_VALUES);
                if (values != null && !values.isNull()) {
                    if (!values.isArray()) {
                        throw new FilterCodecException(SELECTED_VALUES + " at " + location + " must be an array");
                    }
                    for (JsonNode item : values) {
                        selected.add(scalar(item, location + "." + SELECTED_VALUES));
                    }
                }
                return new FilterValue.Option(selected, node.path(IS_EXCLUSION).asBoolean(false));
            }
            case "RANGE":
                return new FilterValue.Range(optionalScalar(node.get(LOWER_BOUND), location + "." + LOWER_BOUND),
                        optionalScalar(node.get(UPPER_BOUND), location + "." + UPPER_BOUND));
            case "ANCHORED": {
                Map<String, Object> properties = objectMapper.convertValue(node, objectMapper.getTypeFactory()
                        .constructMapType(LinkedHashMap.class, String.class, Object.class));
                properties.remove(TYPE);
                return new FilterValue.Anchored(properties);
            }
            default:
                throw new FilterCodecException("Unknown filter value type '" + type + "' at " + location);
        }
    }

    private static Object optionalScalar(JsonNode node, String location) {
        return node == null || node.isNull() ? null : scalar(node, location);
    }

    /**
     * Converts a state into plain maps and lists using the FilterState JSON keys.
     *
     * @param state the state, may be {@code null}
     * @return the JSON object, or {@code null}
     */
    public Map<String, Object> writeState(FilterState state) {
        if (state == null) return null;
        Map<String, Object> json = new LinkedHashMap<>();
        json.put(COMBINE_MODE, state.combineMode().name());
        json.put(TYPE, state.kind().name());
        if (state.kind() == FilterKind.COMPOSED) {
            List<Object> children = new ArrayList<>();
            state.children().forEach(child -> children.add(writeState(child)));
            json.put(VALUE, children);
        } else {
            Map<String, Object> values = new LinkedHashMap<>();
            state.values().forEach((key, value) -> values.put(key, writeValue(value)));
            json.put(VALUE, values);
        }
        return json;
    }

    /**
     * @param state the state, may be {@code null}
     * @return compact FilterState JSON
     */
    public String writeStateJson(FilterState state) {
        return toJson(writeState(state));
    }

    private static Map<String, Object> writeValue(FilterValue value) {
        Map<String, Object> json = new LinkedHashMap<>();
        if (value instanceof FilterValue.Option option) {
            json.put(TYPE, "OPTION");
            json.put(SELECTED_VALUES, option.selectedValues());
            json.put(IS_EXCLUSION, option.exclusion());
        } else if (value instanceof FilterValue.Range range) {
            json.put(TYPE, "RANGE");
            json.put(LOWER_BOUND, range.lowerBound());
            json.put(UPPER_BOUND, range.upperBound());
        } else if (value instanceof FilterValue.Anchored anchored) {
            json.put(TYPE, "ANCHORED");
            json.putAll(anchored.properties());
        }
        return json;
    }

    private JsonNode parse(String json) {
        if (json == null) {
            throw new FilterCodecException("Filter JSON is required");
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new FilterCodecException("Invalid filter JSON: " + e.getOriginalMessage(), e);
        }
    }
}
