package com.e2eq.filter.model.persistent.morphia.sanitizer;

import com.e2eq.filter.model.persistent.morphia.query.FilterJsonReader;
import com.e2eq.filter.model.query.FieldCondition;
import com.e2eq.filter.model.query.FilterClause;
import com.e2eq.filter.model.query.FilterTree;
import com.e2eq.filter.model.query.LogicalGroup;
import com.e2eq.filter.model.query.LogicalOperator;
import com.e2eq.filter.model.security.FilterSecurityPolicy;
import com.e2eq.filter.model.security.SanitizationResult;
import com.e2eq.filter.model.security.SanitizerOptions;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class FilterSanitizerTest {

    private static final FilterJsonReader READER = new FilterJsonReader();

    private static Object json(String text) {
        return READER.read(text).orElseThrow();
    }

    private static SanitizationResult sanitize(String text) {
        return FilterSanitizer.sanitize(json(text));
    }

    private static FieldCondition field(FilterTree tree, String key) {
        for (FilterClause clause : tree.clauses()) {
            if (clause instanceof FieldCondition condition && condition.key().equals(key)) {
                return condition;
            }
        }
        return fail("no clause for " + key + " in " + tree);
    }

    private static String nested(String operator, int levels) {
        String inner = "{\"name\":\"x\"}";
        for (int i = 0; i < levels; i++) {
            inner = "{\"" + operator + "\":[" + inner + "]}";
        }
        return inner;
    }

    @Test
    public void sanitize_nullIsEmptyWithoutViolations() {
        SanitizationResult result = FilterSanitizer.sanitize(null);
        assertTrue(result.sanitized().isEmpty());
        assertTrue(result.violations().isEmpty());
    }

    @Test
    public void sanitize_validDslFilterPassesUnchanged() {
        SanitizationResult result = sanitize("{\"status\":\"active\",\"age\":{\"gte\":18,\"lt\":65},"
                + "\"or\":[{\"city\":\"Lima\"},{\"city\":{\"like\":\"Cusco\"}}]}");

        assertTrue(result.violations().isEmpty(), result.violations().toString());
        FilterTree tree = result.sanitized();
        assertEquals(3, tree.size());
        assertEquals("active", field(tree, "status").value());
        assertEquals(Map.of("gte", 18, "lt", 65), field(tree, "age").operators());
        LogicalGroup or = (LogicalGroup) tree.clauses().get(2);
        assertEquals(LogicalOperator.OR, or.operator());
        assertEquals(2, or.operands().size());
    }

    @Test
    public void sanitize_nativeOperatorsAreDroppedAtEveryLevel() {
        SanitizationResult result = sanitize("{\"$where\":\"sleep(1000)\",\"name\":\"ok\","
                + "\"age\":{\"$gt\":1,\"gte\":2},"
                + "\"or\":[{\"$expr\":{\"$eq\":[1,1]}},{\"city\":\"Lima\"}],"
                + "\"not\":{\"a.$b\":1,\"c\":2}}");

        List<String> violations = result.violations();
        assertTrue(violations.contains("$ operators not allowed. Use DSL operators instead. Found: $where"));
        assertTrue(violations.contains("$ operators not allowed in field age. Use DSL operators instead. Found: $gt"));
        assertTrue(violations.contains("$ operators not allowed. Use DSL operators instead. Found: $expr"));
        assertTrue(violations.contains("$ operators not allowed. Use DSL operators instead. Found: a.$b"));
        assertFalse(result.sanitized().toString().contains("$"), result.sanitized().toString());

        FilterTree tree = result.sanitized();
        assertEquals("ok", field(tree, "name").value());
        assertEquals(Map.of("gte", 2), field(tree, "age").operators());
    }

    @Test
    public void sanitize_operatorsDifferingOnlyInCaseKeepFirstAndReportSecond() {
        SanitizationResult result = sanitize("{\"age\":{\"GT\":1,\"gt\":5},\"name\":{\"Like\":\"a\",\"LIKE\":\"b\"}}");

        assertEquals(Map.of("gt", 1), field(result.sanitized(), "age").operators());
        assertEquals(Map.of("like", "a"), field(result.sanitized(), "name").operators());
        assertEquals(List.of(
                "Duplicate operator gt in field age, keeping the first occurrence",
                "Duplicate operator LIKE in field name, keeping the first occurrence"), result.violations());
    }

    @Test
    public void sanitize_protectedFieldsAreBlockedEvenWithEscapeOrPath() {
        SanitizationResult result = sanitize("{\"isDeleted\":true,\"isDeleted*\":true,\"deletedAt.at\":1,"
                + "\"__v\":0,\"_bsontype\":\"ObjectId\",\"name\":\"ok\"}");

        assertTrue(result.violations().contains("Blocked protected field: isDeleted"));
        assertTrue(result.violations().contains("Blocked protected field: isDeleted*"));
        assertTrue(result.violations().contains("Blocked protected field: deletedAt.at"));
        assertTrue(result.violations().contains("Blocked protected field: __v"));
        assertTrue(result.violations().contains("Blocked protected field: _bsontype"));
        assertEquals(1, result.sanitized().size());
    }

    @Test
    public void sanitize_protectedFieldsInsideLogicalGroupsAreBlocked() {
        SanitizationResult result = sanitize("{\"or\":[{\"isDeleted\":true},{\"name\":\"a\"}]}");

        assertEquals(List.of("Blocked protected field: isDeleted"), result.violations());
        LogicalGroup or = (LogicalGroup) result.sanitized().clauses().get(0);
        assertEquals(1, or.operands().size());
    }

    @Test
    public void sanitize_customProtectedFieldsExtendThePolicy() {
        SanitizerOptions options = SanitizerOptions.builder().customProtectedFields(Set.of("tenantId")).build();
        SanitizationResult result = FilterSanitizer.sanitize(json("{\"tenantId\":\"t1\",\"name\":\"a\"}"), options);

        assertEquals(List.of("Blocked protected field: tenantId"), result.violations());
        assertEquals(1, result.sanitized().size());
    }

    @Test
    public void sanitize_whitelistDropsOtherFields() {
        SanitizerOptions options = SanitizerOptions.builder().allowedFields(Set.of("name", "price")).build();
        SanitizationResult result = FilterSanitizer.sanitize(
                json("{\"name\":\"a\",\"price\":{\"lt\":10},\"secret\":1,\"and\":[{\"other\":2}]}"), options);

        assertTrue(result.violations().contains("Field not in whitelist: secret"));
        assertTrue(result.violations().contains("Field not in whitelist: other"));
        assertEquals(2, result.sanitized().size());
    }

    @Test
    public void sanitize_depthBeyondLimitFailsClosed() {
        SanitizationResult ok = sanitize(nested("and", 5));
        assertTrue(ok.violations().isEmpty(), ok.violations().toString());
        assertFalse(ok.sanitized().isEmpty());

        SanitizationResult result = sanitize(nested("and", 10));
        assertTrue(result.failedClosed());
        assertTrue(result.sanitized().isEmpty());
        assertEquals(List.of("Sanitization failed: Filter depth exceeds maximum allowed depth of 5"), result.violations());
    }

    @Test
    public void sanitize_depthOverrideApplies() {
        SanitizerOptions options = SanitizerOptions.builder().maxDepth(2).build();
        SanitizationResult result = FilterSanitizer.sanitize(json(nested("or", 3)), options);
        assertTrue(result.failedClosed());
    }

    @Test
    public void sanitize_oversizedOrArrayFailsClosed() {
        List<Object> operands = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            operands.add(Map.of("name", "n" + i));
        }
        SanitizationResult result = FilterSanitizer.sanitize(Map.of("or", operands));

        assertTrue(result.failedClosed());
        assertEquals(List.of("Sanitization failed: or array exceeds maximum length of 100"), result.violations());
    }

    @Test
    public void sanitize_fatalBreachDiscardsEarlierViolations() {
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("$where", "x");
        filter.put("isDeleted", true);
        filter.put("name", "a".repeat(201));
        SanitizationResult result = FilterSanitizer.sanitize(filter);

        assertEquals(List.of("Sanitization failed: String value exceeds maximum length of 200"), result.violations());
        assertTrue(result.sanitized().isEmpty());
    }

    @Test
    public void sanitize_tooManyKeysFailsClosed() {
        Map<String, Object> filter = new LinkedHashMap<>();
        for (int i = 0; i < 51; i++) {
            filter.put("f" + i, i);
        }
        assertTrue(FilterSanitizer.sanitize(filter).failedClosed());

        filter.remove("f50");
        assertFalse(FilterSanitizer.sanitize(filter).hasViolations());
    }

    @Test
    public void sanitize_operatorValuesAreChecked() {
        SanitizationResult result = sanitize("{\"a\":{\"in\":\"x\"},\"b\":{\"like\":5},\"c\":{\"between\":[1]},"
                + "\"d\":{\"exists\":\"yes\"},\"e\":{\"regex\":\".*\"},\"f\":{\"gt\":{\"x\":1}},\"g\":{}}");

        List<String> violations = result.violations();
        assertTrue(violations.contains("in expects an array in field a"));
        assertTrue(violations.contains("like expects a string value in field b"));
        assertTrue(violations.contains("between expects [min, max] array in field c"));
        assertTrue(violations.contains("exists expects boolean value in field d"));
        assertTrue(violations.contains("Unknown DSL operator in field e: regex"));
        assertTrue(violations.contains("Unsupported value for operator gt in field f: object"));
        assertTrue(violations.contains("Empty operator object in field g"));
        assertTrue(result.sanitized().isEmpty());
    }

    @Test
    public void sanitize_longLikeAndInValuesDropOnlyTheOperator() {
        List<Object> many = new ArrayList<>();
        for (int i = 0; i < 101; i++) {
            many.add(i);
        }
        Map<String, Object> ops = new LinkedHashMap<>();
        ops.put("like", "x".repeat(201));
        ops.put("ne", "y");
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("name", ops);
        filter.put("code", Map.of("in", many));
        SanitizationResult result = FilterSanitizer.sanitize(filter);

        assertFalse(result.failedClosed());
        assertTrue(result.violations().contains("like value too long in field name (max 200 chars)"));
        assertTrue(result.violations().contains("in array too long in field code (max 100 items)"));
        assertEquals(Map.of("ne", "y"), field(result.sanitized(), "name").operators());
    }

    @Test
    public void sanitize_operatorNamesAreNormalized() {
        SanitizationResult result = sanitize("{\"name\":{\"LIKE\":\"a\",\"Not In\":[\"b\"]},\"x\":{\"IS NULL\":false}}");

        assertTrue(result.violations().isEmpty(), result.violations().toString());
        assertEquals(Map.of("like", "a", "not in", List.of("b")), field(result.sanitized(), "name").operators());
        assertEquals(Map.of("is null", true), field(result.sanitized(), "x").operators());
    }

    @Test
    public void sanitize_imitatedObjectIdIsRejectedButRealOneKept() {
        ObjectId id = new ObjectId();
        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put("owner_id", Map.of("eq", Map.of("_bsontype", "ObjectId", "id", "x")));
        filter.put("group_id", id);
        SanitizationResult result = FilterSanitizer.sanitize(filter);

        assertEquals(1, result.violations().size());
        assertTrue(result.violations().get(0).startsWith("Unsupported value for operator eq in field owner_id"));
        assertSame(id, field(result.sanitized(), "group_id").value());
    }

    @Test
    public void sanitize_structuralProblemsAreViolations() {
        assertEquals(List.of("Expected a filter object but found array"), FilterSanitizer.sanitize(List.of(1)).violations());
        assertEquals(List.of("or requires an array value"), sanitize("{\"or\":{\"a\":1}}").violations());
        assertEquals(List.of("not operator requires an object value"), sanitize("{\"not\":[{\"a\":1}]}").violations());
        assertEquals(List.of("Expected a filter object but found Integer"), sanitize("{\"and\":[1]}").violations());
        assertEquals(List.of("Empty field name"), sanitize("{\"\":1}").violations());
        assertEquals(List.of("Unsupported array element dropped in field tags: object"),
                sanitize("{\"tags\":[\"a\",{\"b\":1}]}").violations());
    }

    @Test
    public void sanitize_disallowedLogicalOperatorIsDropped() {
        FilterSecurityPolicy policy = FilterSecurityPolicy.builder().allowedLogicalOperators(Set.of("and")).build();
        SanitizationResult result = FilterSanitizer.sanitize(json("{\"or\":[{\"a\":1}],\"b\":2}"), SanitizerOptions.of(policy));

        assertEquals(List.of("Logical operator not allowed: or"), result.violations());
        assertEquals(1, result.sanitized().size());
    }

    @Test
    public void sanitize_castEscapeIsKeptOnFieldName() {
        SanitizationResult result = sanitize("{\"external_id*\":\"507f1f77bcf86cd799439011\"}");
        assertTrue(result.violations().isEmpty());
        assertTrue(field(result.sanitized(), "external_id*").hasCastEscape());
    }

    @Test
    public void sanitize_isIdempotent() {
        SanitizationResult first = sanitize("{\"name\":{\"like\":\"a\"},\"$where\":\"x\",\"or\":[{\"a\":1},{\"b\":{\"in\":[1,2]}}]}");
        SanitizationResult second = FilterSanitizer.sanitize(first.sanitized().toMap());

        assertTrue(second.violations().isEmpty(), second.violations().toString());
        assertEquals(first.sanitized(), second.sanitized());
    }

    @Test
    public void sanitize_betweenBoundsAreKept() {
        SanitizationResult result = sanitize("{\"price\":{\"between\":[10,20]}}");
        assertEquals(List.of(10, 20), field(result.sanitized(), "price").operators().get("between"));
    }
}
