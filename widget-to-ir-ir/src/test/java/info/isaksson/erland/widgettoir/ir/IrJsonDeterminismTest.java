package info.isaksson.erland.widgettoir.ir;

import com.fasterxml.jackson.databind.JsonNode;
import info.isaksson.erland.widgettoir.ir.expr.IrBinaryExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrBinaryOperator;
import info.isaksson.erland.widgettoir.ir.expr.IrExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrIdentifierExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrInterpolationPart;
import info.isaksson.erland.widgettoir.ir.expr.IrLiteralExpression;
import info.isaksson.erland.widgettoir.ir.expr.IrLiteralKind;
import info.isaksson.erland.widgettoir.ir.expr.IrStringInterpolationExpression;
import info.isaksson.erland.widgettoir.ir.stmt.IrReturnStatement;
import info.isaksson.erland.widgettoir.ir.stmt.IrStatement;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class IrJsonDeterminismTest {

    private static final IrSourceLocation LOC = new IrSourceLocation("lib/main.dart", 3, 5, 20, 7);

    private static IrStatement sample(Map<String, Object> metadata) {
        IrExpression left = new IrIdentifierExpression("identifier_1", LOC, Map.of(), "count", null);
        IrExpression right = new IrLiteralExpression("literal_2", LOC, Map.of(), 1L, IrLiteralKind.INTEGER);
        IrExpression sum = new IrBinaryExpression("binary_3", LOC, metadata, left, IrBinaryOperator.ADD, right);
        return new IrReturnStatement("return_4", LOC, Map.of(), sum);
    }

    @Test
    void sameTreeRendersIdentically() throws Exception {
        Map<String, Object> a = new LinkedHashMap<>();
        a.put("zeta", 1);
        a.put("alpha", true);
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("alpha", true);
        b.put("zeta", 1);

        String first = IrJson.toJsonString(sample(a));
        String second = IrJson.toJsonString(sample(b));
        assertEquals(first, second, "Metadata insertion order must not leak into the output.");
        assertTrue(first.endsWith("}\n"));
        assertTrue(first.indexOf("\"alpha\"") < first.indexOf("\"zeta\""));
    }

    @Test
    void nodesCarryTheirKindTag() throws Exception {
        JsonNode tree = IrJson.readTree(IrJson.toJsonString(sample(Map.of())));
        assertEquals("return", tree.get("kind").asText());
        JsonNode value = tree.get("value");
        assertEquals("binary", value.get("kind").asText());
        assertEquals("ADD", value.get("operator").asText());
        assertEquals("count", value.get("left").get("name").asText());
        assertEquals(1, value.get("right").get("value").asInt());
        assertEquals(3, value.get("location").get("line").asInt());
        assertFalse(value.has("metadata"), "Empty metadata is omitted.");
    }

    @Test
    void interpolationPartsKeepTheirText() throws Exception {
        IrStringInterpolationExpression s = new IrStringInterpolationExpression("interpolation_1", LOC, Map.of(), List.of(
                IrInterpolationPart.text("Hello "),
                IrInterpolationPart.expression(new IrIdentifierExpression("identifier_2", LOC, Map.of(), "name", null))));
        JsonNode parts = IrJson.toTree(s).get("parts");
        assertEquals("Hello ", parts.get(0).get("text").asText());
        assertFalse(parts.get(0).has("expression"));
        assertFalse(parts.get(1).has("text"));
        assertTrue(s.parts.get(0).holdsText());
        assertFalse(s.parts.get(1).holdsText());
    }

    @Test
    void writeAddsTrailingNewlineAndIsRepeatable() throws Exception {
        Path dir = Files.createTempDirectory("irjson-");
        Path out = dir.resolve("nested/out.json");
        IrJson.write(sample(Map.of("k", "v")), out);
        String written = Files.readString(out, StandardCharsets.UTF_8);
        assertEquals(IrJson.toJsonString(sample(Map.of("k", "v"))), written);

        IrJson.write(sample(Map.of("k", "v")), out);
        assertEquals(written, Files.readString(out, StandardCharsets.UTF_8), "Writing twice must produce identical output.");
    }

    @Test
    void rejectsNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> IrJson.write(sample(Map.of()), null));
        assertThrows(IllegalArgumentException.class, () -> IrJson.readTree(null));
    }

    @Test
    void sourceLocationsAreClamped() {
        IrSourceLocation loc = new IrSourceLocation(null, 0, -2, -1, -5);
        assertEquals("", loc.file);
        assertEquals(1, loc.line);
        assertEquals(1, loc.column);
        assertEquals(0, loc.offset);
        assertEquals(0, loc.length);
        assertEquals("a.dart:1:1", IrSourceLocation.unknown("a.dart").humanReadable());
        assertEquals(IrSourceLocation.unknown("a.dart"), new IrSourceLocation("a.dart", 1, 1, 0, 0));
    }
}
