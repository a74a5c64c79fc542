package com.github.cinder.ast;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.DynamicContainer;
import org.junit.jupiter.api.DynamicNode;
import org.junit.jupiter.api.DynamicTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestFactory;

import com.github.cinder.ast.Expr.TupleShuffleExpr;

public class PrinterGoldenTest {

    private static final Path BASE_PATH = Paths.get("src/test/resources/printer-tests");

    @TestFactory
    public DynamicNode testFactory() {
        var dumpFiles = BASE_PATH.toFile().listFiles((dir, name) -> name.endsWith(".dump"));
        var tests = Arrays.stream(dumpFiles)
            .map(this::createTest).toList();

        return DynamicContainer.dynamicContainer("Printer tests", tests);
    }

    private DynamicNode createTest(File dumpFile) {
        var caseName = dumpFile.getName().substring(0, dumpFile.getName().indexOf('.'));
        return DynamicTest.dynamicTest("print " + caseName, () -> {
            var builder = PrinterCases.CASES.get(caseName);
            assertTrue(builder != null, "no tree named " + caseName);

            try (var ctx = new AstContext()) {
                var expected = Files.readString(dumpFile.toPath()).stripTrailing();
                assertEquals(expected, builder.apply(ctx).toString());
            }
        });
    }

    @Test
    public void testEveryCaseHasDump() {
        for (var name : PrinterCases.CASES.keySet()) {
            assertTrue(Files.isRegularFile(BASE_PATH.resolve(name + ".dump")), name);
        }
    }

    @Test
    public void testPrintingIsIdempotent() {
        try (var ctx = new AstContext()) {
            for (var builder : PrinterCases.CASES.values()) {
                var e = builder.apply(ctx);
                long bytes = ctx.bytesAllocated();
                var first = e.toString();
                assertEquals(first, e.toString());
                assertEquals(bytes, ctx.bytesAllocated());
            }
        }
    }

    @Test
    public void testShuffleMappingPrintedInOrder() throws IOException {
        try (var ctx = new AstContext()) {
            var shuffle = (TupleShuffleExpr) PrinterCases.CASES.get("tuple_shuffle").apply(ctx);
            assertEquals(3, shuffle.elementMapping().length());
            var firstLine = shuffle.toString().lines().findFirst().orElseThrow();
            assertTrue(firstLine.endsWith(" elements=[1, -1, 0]"), firstLine);
        }
    }

    @Test
    public void testIndentOffset() {
        try (var ctx = new AstContext()) {
            var sb = new StringBuilder();
            PrinterCases.CASES.get("load_paren").apply(ctx).print(sb, 4);
            var lines = List.of(sb.toString().split("\n"));
            assertEquals("    (load_expr type='Int'", lines.get(0));
            assertEquals("      (paren_expr type='Int'", lines.get(1));
            assertEquals("        (declref_expr type='Int' decl=x)))", lines.get(2));
        }
    }
}
