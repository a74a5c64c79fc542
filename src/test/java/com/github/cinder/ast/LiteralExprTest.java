package com.github.cinder.ast;

import static com.github.cinder.ast.PrinterCases.at;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.math.BigInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import com.github.cinder.ast.Expr.CharacterLiteralExpr;
import com.github.cinder.ast.Expr.FloatLiteralExpr;
import com.github.cinder.ast.Expr.IntegerLiteralExpr;
import com.github.cinder.source.SourceRange;
import com.github.cinder.types.Type.BuiltinFloatType.FPKind;
import com.google.common.base.VerifyException;

public class LiteralExprTest {

    private final AstContext ctx = new AstContext();

    @AfterEach
    public void close() {
        ctx.close();
    }

    @ParameterizedTest
    @MethodSource("integers")
    public void testIntegerValue(String text, int bitWidth, long expected) {
        var lit = IntegerLiteralExpr.create(ctx, text, at(0));
        lit.type(ctx.types().integer(bitWidth));
        assertEquals(BigInteger.valueOf(expected), lit.value());
    }

    private static Object[][] integers() {
        return new Object[][] {
            { "42", 32, 42L },
            { "0x2A", 32, 42L },
            { "0o52", 32, 42L },
            { "0b101010", 32, 42L },
            { "0", 1, 0L },
            { "256", 8, 0L },
            { "257", 8, 1L },
            { "0xFFFFFFFF", 32, 4294967295L },
            { "4294967296", 32, 0L },
        };
    }

    @Test
    public void testValueBeforeTypeAssignment() {
        var lit = IntegerLiteralExpr.create(ctx, "42", at(0));
        assertThrows(IllegalStateException.class, lit::value);
    }

    @Test
    public void testValueWithNonBuiltinType() {
        var lit = IntegerLiteralExpr.create(ctx, "42", at(0));
        lit.type(ctx.types().nominal("Int"));
        assertThrows(IllegalStateException.class, lit::value);
        lit.type(ctx.types().dependent());
        assertThrows(IllegalStateException.class, lit::value);
    }

    @Test
    public void testInvalidSpelling() {
        for (var text : new String[] {"4z2", "-1", "0x", "0xG", "\u0664\u0662", "0x\uff11"}) {
            var lit = IntegerLiteralExpr.create(ctx, text, at(0));
            lit.type(ctx.types().integer(32));
            assertThrows(VerifyException.class, lit::value, text);
        }
        assertThrows(IllegalArgumentException.class, () -> IntegerLiteralExpr.create(ctx, "", at(0)));
    }

    @Test
    public void testPrintsDerivedValueOnlyForBuiltinTypes() {
        var lit = IntegerLiteralExpr.create(ctx, "0x2A", at(0));
        assertEquals("(integer_literal_expr type='' value=0x2A)", lit.toString());
        lit.type(ctx.types().dependent());
        assertEquals("(integer_literal_expr type='<<dependent type>>' value=0x2A)", lit.toString());
        lit.type(ctx.types().integer(32));
        assertEquals("(integer_literal_expr type='Builtin.Int32' value=42)", lit.toString());
    }

    @ParameterizedTest
    @MethodSource("floats")
    public void testFloatValue(String text, FPKind kind, double expected) {
        var lit = FloatLiteralExpr.create(ctx, text, at(0));
        lit.type(ctx.types().floating(kind));
        assertEquals(expected, lit.value());
    }

    private static Object[][] floats() {
        return new Object[][] {
            { "1.5", FPKind.IEEE64, 1.5 },
            { "0.1", FPKind.IEEE64, 0.1 },
            { "0.1", FPKind.IEEE32, (double) 0.1f },
            { "2e3", FPKind.IEEE64, 2000.0 },
            { "0x1.8p1", FPKind.IEEE64, 3.0 },
        };
    }

    @Test
    public void testFloatContract() {
        var lit = FloatLiteralExpr.create(ctx, "1.2.3", at(0));
        assertThrows(IllegalStateException.class, lit::value);
        lit.type(ctx.types().floating(FPKind.IEEE64));
        assertThrows(VerifyException.class, lit::value);
    }

    @Test
    public void testLiteralLocation() {
        var lit = CharacterLiteralExpr.create(ctx, 'a', at(7));
        assertEquals(at(7), lit.loc());
        assertEquals(new SourceRange(at(7), at(7)), lit.sourceRange());
        assertEquals("(character_literal_expr type='' value=97)", lit.toString());
        assertThrows(IllegalArgumentException.class, () -> CharacterLiteralExpr.create(ctx, -1, at(0)));
    }
}
