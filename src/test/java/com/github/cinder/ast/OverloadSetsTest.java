package com.github.cinder.ast;

import static com.github.cinder.ast.PrinterCases.at;
import static com.github.cinder.ast.PrinterCases.ref;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.cinder.ast.Expr.DeclRefExpr;
import com.github.cinder.ast.Expr.DotSyntaxBaseIgnoredExpr;
import com.github.cinder.ast.Expr.DotSyntaxCallExpr;
import com.github.cinder.ast.Expr.MemberRefExpr;
import com.github.cinder.ast.Expr.OverloadSetRefExpr;
import com.github.cinder.ast.Expr.OverloadedDeclRefExpr;
import com.github.cinder.ast.Expr.OverloadedMemberRefExpr;
import com.github.cinder.ast.Expr.OverloadedSubscriptExpr;
import com.github.cinder.ast.Expr.SubscriptExpr;
import com.github.cinder.ast.ValueDecl.FuncDecl;
import com.github.cinder.ast.ValueDecl.SubscriptDecl;
import com.github.cinder.ast.ValueDecl.VarDecl;
import com.github.cinder.types.Type;

public class OverloadSetsTest {

    private final AstContext ctx = new AstContext();
    private final Type intType = ctx.types().nominal("Int");
    private final Type structType = ctx.types().nominal("S");

    @AfterEach
    public void close() {
        ctx.close();
    }

    private List<ValueDecl> funcs(String name, int count) {
        var decls = new ArrayList<ValueDecl>();
        for (int i = 0; i < count; i++) {
            var input = ctx.types().tuple(List.of(ctx.types().integer(8 * (i + 1))));
            decls.add(FuncDecl.create(ctx, name, at(10 * i), ctx.types().function(input, intType), false));
        }
        return decls;
    }

    @Test
    public void testSingleCandidateCollapsesToDirectReference() {
        var foo = VarDecl.create(ctx, "foo", at(0), intType, false);
        var e = OverloadedDeclRefExpr.createWithCopy(List.of(foo), at(5));

        var ref = assertInstanceOf(DeclRefExpr.class, e);
        assertSame(foo, ref.decl());
        assertSame(intType, ref.type());
        assertEquals(at(5), ref.loc());
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 3, 7})
    public void testMultipleCandidatesKeepOrder(int count) {
        var decls = funcs("bar", count);
        var e = (OverloadedDeclRefExpr) OverloadedDeclRefExpr.createWithCopy(decls, at(0));

        assertEquals(decls, e.decls());
        assertTrue(e.type().isDependent());
        assertNull(e.baseType());
    }

    @Test
    public void testCandidateListIsCopied() {
        var decls = funcs("bar", 3);
        var e = (OverloadedDeclRefExpr) OverloadedDeclRefExpr.createWithCopy(decls, at(0));
        decls.remove(0);
        assertEquals(3, e.decls().size());
    }

    @Test
    public void testEmptyCandidateList() {
        assertThrows(IllegalArgumentException.class, () -> OverloadedDeclRefExpr.createWithCopy(List.of(), at(0)));
        var base = ref(ctx, "s", structType, 0);
        assertThrows(IllegalArgumentException.class,
                () -> OverloadedMemberRefExpr.createWithCopy(base, at(1), List.of(), at(2)));
    }

    @Test
    public void testCandidatesFromDifferentContexts() {
        try (var other = new AstContext()) {
            var decls = List.of(
                    FuncDecl.create(ctx, "bar", at(0), null, false),
                    FuncDecl.create(other, "bar", at(1), null, false));
            assertThrows(IllegalArgumentException.class, () -> OverloadedDeclRefExpr.createWithCopy(decls, at(0)));
        }
    }

    @Test
    public void testInstanceVariableMember() {
        var base = ref(ctx, "s", structType, 0);
        var foo = VarDecl.create(ctx, "foo", at(10), intType, true);
        var e = OverloadedMemberRefExpr.createWithCopy(base, at(1), List.of(foo), at(2));

        var member = assertInstanceOf(MemberRefExpr.class, e);
        assertSame(base, member.base());
        assertSame(foo, member.decl());
        assertSame(intType, member.type());
        assertEquals(at(2), member.loc());
    }

    @Test
    public void testInstanceFunctionMember() {
        var base = ref(ctx, "s", structType, 0);
        var run = FuncDecl.create(ctx, "run", at(10), ctx.types().function(ctx.types().tuple(), intType), true);
        var e = OverloadedMemberRefExpr.createWithCopy(base, at(1), List.of(run), at(2));

        var call = assertInstanceOf(DotSyntaxCallExpr.class, e);
        assertSame(base, call.base());
        assertSame(run, call.calledValue());
        assertEquals(at(1), call.dotLoc());
        assertEquals(at(2), call.fn().loc());
    }

    @Test
    public void testMetatypeReceiverIgnoresBase() {
        var base = ref(ctx, "S", ctx.types().metatype(structType), 0);
        var run = FuncDecl.create(ctx, "run", at(10), ctx.types().function(ctx.types().tuple(), intType), true);
        var e = OverloadedMemberRefExpr.createWithCopy(base, at(1), List.of(run), at(2));

        var ignored = assertInstanceOf(DotSyntaxBaseIgnoredExpr.class, e);
        assertSame(base, ignored.lhs());
        assertSame(run, ((DeclRefExpr) ignored.rhs()).decl());
        assertSame(run.typeOfReference(), ignored.type());
    }

    @Test
    public void testStaticMemberIgnoresBase() {
        var base = ref(ctx, "s", structType, 0);
        var make = VarDecl.create(ctx, "zero", at(10), structType, false);
        var e = OverloadedMemberRefExpr.createWithCopy(base, at(1), List.of(make), at(2));
        assertInstanceOf(DotSyntaxBaseIgnoredExpr.class, e);
    }

    @Test
    public void testInstanceSubscriptIsNotAMember() {
        var base = ref(ctx, "s", structType, 0);
        var subscript = SubscriptDecl.create(ctx, at(10), intType, intType);
        assertThrows(IllegalArgumentException.class,
                () -> OverloadedMemberRefExpr.createWithCopy(base, at(1), List.of(subscript), at(2)));
    }

    @Test
    public void testMemberOverloadBaseType() {
        var decls = funcs("get", 2);
        var onValue = (OverloadSetRefExpr) OverloadedMemberRefExpr.createWithCopy(
                ref(ctx, "s", structType, 0), at(1), decls, at(2));
        assertSame(structType, onValue.baseType());

        var onMetatype = (OverloadSetRefExpr) OverloadedMemberRefExpr.createWithCopy(
                ref(ctx, "S", ctx.types().metatype(structType), 0), at(1), decls, at(2));
        assertNull(onMetatype.baseType());
    }

    @Test
    public void testFilteredCopy() {
        var decls = funcs("bar", 3);
        var set = (OverloadSetRefExpr) OverloadedDeclRefExpr.createWithCopy(decls, at(4));

        var narrowed = assertInstanceOf(OverloadedDeclRefExpr.class, set.createFilteredWithCopy(decls.subList(1, 3)));
        assertEquals(decls.subList(1, 3), narrowed.decls());
        assertEquals(at(4), narrowed.loc());

        var resolved = assertInstanceOf(DeclRefExpr.class, set.createFilteredWithCopy(List.of(decls.get(2))));
        assertSame(decls.get(2), resolved.decl());
        assertEquals(3, set.decls().size());
    }

    @Test
    public void testFilteredMemberCopyKeepsReceiver() {
        var base = ref(ctx, "s", structType, 0);
        var decls = List.<ValueDecl>of(
                VarDecl.create(ctx, "v", at(10), intType, true),
                VarDecl.create(ctx, "v", at(20), structType, true));
        var set = (OverloadSetRefExpr) OverloadedMemberRefExpr.createWithCopy(base, at(1), decls, at(2));

        var member = assertInstanceOf(MemberRefExpr.class, set.createFilteredWithCopy(List.of(decls.get(1))));
        assertSame(base, member.base());
        assertSame(structType, member.type());
    }

    @Test
    public void testSubscripts() {
        var base = ref(ctx, "a", structType, 0);
        var index = PrinterCases.literal(ctx, "0", 2);
        var first = SubscriptDecl.create(ctx, at(10), intType, intType);
        var second = SubscriptDecl.create(ctx, at(20), structType, structType);

        var single = assertInstanceOf(SubscriptExpr.class,
                OverloadedSubscriptExpr.createWithCopy(base, List.of(first), at(1), index, at(3)));
        assertSame(first, single.decl());
        assertSame(ctx.types().function(intType, intType), single.type());
        assertSame(intType, first.elementType());
        assertEquals(at(0), single.startLoc());
        assertEquals(at(3), single.endLoc());

        var set = assertInstanceOf(OverloadedSubscriptExpr.class,
                OverloadedSubscriptExpr.createWithCopy(base, List.of(first, second), at(1), index, at(3)));
        assertSame(structType, set.baseType());
        assertSame(index, set.index());

        var func = FuncDecl.create(ctx, "f", at(30), null, true);
        assertThrows(IllegalArgumentException.class,
                () -> OverloadedSubscriptExpr.createWithCopy(base, List.of(func), at(1), index, at(3)));
    }

    public static Object[][] testSingleCandidateResultType() {
        return new Object[][] {
                { "plain", DeclRefExpr.class },
                { "instanceVar", MemberRefExpr.class },
                { "instanceFunc", DotSyntaxCallExpr.class },
                { "staticVar", DotSyntaxBaseIgnoredExpr.class },
                { "subscript", SubscriptExpr.class },
        };
    }

    @ParameterizedTest
    @MethodSource
    public void testSingleCandidateResultType(String shape, Class<? extends Expr> expected) {
        var base = ref(ctx, "s", structType, 0);
        var fnType = ctx.types().function(ctx.types().tuple(), intType);
        ValueDecl decl = switch (shape) {
            case "plain" -> FuncDecl.create(ctx, "f", at(10), fnType, false);
            case "instanceVar" -> VarDecl.create(ctx, "v", at(10), intType, true);
            case "instanceFunc" -> FuncDecl.create(ctx, "run", at(10), fnType, true);
            case "staticVar" -> VarDecl.create(ctx, "zero", at(10), structType, false);
            case "subscript" -> SubscriptDecl.create(ctx, at(10), intType, structType);
            default -> throw new IllegalArgumentException(shape);
        };
        Expr e;
        if (shape.equals("plain")) {
            e = OverloadedDeclRefExpr.createWithCopy(List.of(decl), at(1));
        } else if (shape.equals("subscript")) {
            e = OverloadedSubscriptExpr.createWithCopy(base, List.of(decl), at(1), PrinterCases.literal(ctx, "0", 2), at(3));
        } else {
            e = OverloadedMemberRefExpr.createWithCopy(base, at(1), List.of(decl), at(2));
        }

        assertInstanceOf(expected, e);
        assertSame(decl.typeOfReference(), e.type());
    }

    @Test
    public void testInstanceMemberFlag() {
        assertTrue(VarDecl.create(ctx, "v", at(0), intType, true).isInstanceMember());
        assertFalse(FuncDecl.create(ctx, "f", at(0), null, false).isInstanceMember());
        assertTrue(SubscriptDecl.create(ctx, at(0), intType, intType).isInstanceMember());
    }

    @ParameterizedTest
    @ValueSource(ints = {2, 5, 40})
    public void testArenaGrowsWithCandidateCount(int count) {
        var decls = funcs("bar", count);
        long before = ctx.bytesAllocated();
        var e = OverloadedDeclRefExpr.createWithCopy(decls, at(0));
        assertInstanceOf(OverloadedDeclRefExpr.class, e);
        assertEquals(Expr.HEADER_BYTES + count * AstContext.POINTER_BYTES, ctx.bytesAllocated() - before);
    }

    @Test
    public void testSingleCandidateCostIsConstant() {
        var foo = VarDecl.create(ctx, "foo", at(0), intType, false);
        long before = ctx.bytesAllocated();
        OverloadedDeclRefExpr.createWithCopy(List.of(foo), at(0));
        assertEquals(Expr.HEADER_BYTES, ctx.bytesAllocated() - before);
        assertFalse(ctx.isClosed());
    }
}
