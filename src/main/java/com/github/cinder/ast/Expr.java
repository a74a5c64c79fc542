package com.github.cinder.ast;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.github.cinder.ast.ValueDecl.FuncDecl;
import com.github.cinder.ast.ValueDecl.SubscriptDecl;
import com.github.cinder.ast.ValueDecl.VarDecl;
import com.github.cinder.source.SourceLoc;
import com.github.cinder.source.SourceRange;
import com.github.cinder.types.Type;
import com.github.cinder.types.Type.BuiltinFloatType;
import com.github.cinder.types.Type.BuiltinIntegerType;
import com.github.cinder.types.Type.FunctionType;
import com.google.common.base.Preconditions;
import com.google.common.base.Verify;
import com.google.common.base.VerifyException;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Root of the expression tree. Every node is allocated in an {@link AstContext}
 * through the static {@code create} factory of its class and lives as long as
 * that context.
 */
@Accessors(fluent = true)
public abstract sealed class Expr {

    public static final int HEADER_BYTES = 48;
    public static final int ALIGNMENT = 8;

    @Getter
    private final AstContext context;
    @Getter
    private final ExprKind kind;
    @Getter
    @Setter
    private Type type;

    Expr(AstContext context, ExprKind kind, Type type) {
        this.context = context;
        this.kind = kind;
        this.type = type;
    }

    public abstract SourceRange sourceRange();

    public SourceLoc startLoc() {
        return sourceRange().start();
    }

    public SourceLoc endLoc() {
        return sourceRange().end();
    }

    public SourceLoc loc() {
        return startLoc();
    }

    public boolean isImplicit() {
        if (this instanceof DeclRefExpr dre) {
            return !dre.loc().isValid();
        }
        if (this instanceof ImplicitConversionExpr ice) {
            return ice.subExpr().isImplicit();
        }
        return false;
    }

    public Expr semanticsProvidingExpr() {
        if (this instanceof ParenExpr pe) {
            return pe.subExpr().semanticsProvidingExpr();
        }
        return this;
    }

    public Expr valueProvidingExpr() {
        // TODO project elements out of tuple literals once tuple element access on literals is folded
        return semanticsProvidingExpr();
    }

    public void print(StringBuilder out, int indent) {
        new ExprPrinter(out, indent).visit(this);
    }

    public void dump() {
        System.err.println(this);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        print(sb, 0);
        return sb.toString();
    }

    private static Expr[] copyChildren(AstContext ctx, List<Expr> children) {
        children.forEach(ctx::adopt);
        return children.toArray(new Expr[0]);
    }

    private static boolean hasMetaType(Expr e) {
        return e.type() != null && e.type().isMetaType();
    }

    public static final class ErrorExpr extends Expr {
        private final SourceRange range;

        private ErrorExpr(AstContext ctx, SourceRange range) {
            super(ctx, ExprKind.ERROR, null);
            this.range = range;
        }

        public static ErrorExpr create(AstContext ctx, SourceRange range) {
            return ctx.allocateExpr(new ErrorExpr(ctx, range), 0);
        }

        @Override
        public SourceRange sourceRange() {
            return range;
        }
    }

    // ---- literals ----

    public abstract static sealed class LiteralExpr extends Expr {
        private final SourceLoc literalLoc;

        LiteralExpr(AstContext ctx, ExprKind kind, SourceLoc literalLoc) {
            super(ctx, kind, null);
            this.literalLoc = literalLoc;
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(literalLoc);
        }

        @Override
        public SourceLoc loc() {
            return literalLoc;
        }
    }

    @Accessors(fluent = true)
    public static final class IntegerLiteralExpr extends LiteralExpr {
        @Getter
        private final String text;

        private IntegerLiteralExpr(AstContext ctx, String text, SourceLoc loc) {
            super(ctx, ExprKind.INTEGER_LITERAL, loc);
            this.text = text;
        }

        public static IntegerLiteralExpr create(AstContext ctx, String text, SourceLoc loc) {
            Preconditions.checkArgument(!text.isEmpty(), "empty integer literal");
            return ctx.allocateExpr(new IntegerLiteralExpr(ctx, text, loc), 0);
        }

        // unsigned, reduced to the bit width of the builtin type
        public BigInteger value() {
            Preconditions.checkState(type() != null, "semantic analysis has not completed for literal %s", text);
            Preconditions.checkState(type() instanceof BuiltinIntegerType,
                    "integer literal %s has non-builtin type %s", text, type());
            int bitWidth = ((BuiltinIntegerType) type()).bitWidth();
            var value = parse(text);
            Verify.verify(value != null, "invalid integer literal %s formed", text);
            return value.mod(BigInteger.ONE.shiftLeft(bitWidth));
        }

        static BigInteger parse(String text) {
            int radix = 10;
            var digits = text;
            if (text.length() > 2 && text.charAt(0) == '0') {
                switch (text.charAt(1)) {
                    case 'x', 'X' -> radix = 16;
                    case 'o', 'O' -> radix = 8;
                    case 'b', 'B' -> radix = 2;
                    default -> { }
                }
                if (radix != 10) {
                    digits = text.substring(2);
                }
            }
            // ASCII only; Character.digit also accepts other scripts
            for (int i = 0; i < digits.length(); i++) {
                char c = digits.charAt(i);
                if (c > 0x7f || Character.digit(c, radix) < 0) {
                    return null;
                }
            }
            return new BigInteger(digits, radix);
        }
    }

    @Accessors(fluent = true)
    public static final class FloatLiteralExpr extends LiteralExpr {
        private static final java.util.regex.Pattern DECIMAL = java.util.regex.Pattern.compile("[0-9]+(\\.[0-9]+)?([eE][+-]?[0-9]+)?");
        private static final java.util.regex.Pattern HEX = java.util.regex.Pattern.compile("0[xX][0-9a-fA-F]+(\\.[0-9a-fA-F]+)?[pP][+-]?[0-9]+");

        @Getter
        private final String text;

        private FloatLiteralExpr(AstContext ctx, String text, SourceLoc loc) {
            super(ctx, ExprKind.FLOAT_LITERAL, loc);
            this.text = text;
        }

        public static FloatLiteralExpr create(AstContext ctx, String text, SourceLoc loc) {
            Preconditions.checkArgument(!text.isEmpty(), "empty float literal");
            return ctx.allocateExpr(new FloatLiteralExpr(ctx, text, loc), 0);
        }

        public double value() {
            Preconditions.checkState(type() != null, "semantic analysis has not completed for literal %s", text);
            Preconditions.checkState(type() instanceof BuiltinFloatType,
                    "float literal %s has non-builtin type %s", text, type());
            if (!DECIMAL.matcher(text).matches() && !HEX.matcher(text).matches()) {
                throw new VerifyException("invalid float literal " + text + " formed");
            }
            return switch (((BuiltinFloatType) type()).fpKind()) {
                case IEEE32 -> Float.parseFloat(text);
                case IEEE64 -> Double.parseDouble(text);
            };
        }
    }

    @Accessors(fluent = true)
    public static final class CharacterLiteralExpr extends LiteralExpr {
        // code point
        @Getter
        private final int value;

        private CharacterLiteralExpr(AstContext ctx, int value, SourceLoc loc) {
            super(ctx, ExprKind.CHARACTER_LITERAL, loc);
            this.value = value;
        }

        public static CharacterLiteralExpr create(AstContext ctx, int value, SourceLoc loc) {
            Preconditions.checkArgument(Character.isValidCodePoint(value), "invalid code point %s", value);
            return ctx.allocateExpr(new CharacterLiteralExpr(ctx, value, loc), 0);
        }
    }

    @Accessors(fluent = true)
    public static final class StringLiteralExpr extends LiteralExpr {
        @Getter
        private final String value;

        private StringLiteralExpr(AstContext ctx, String value, SourceLoc loc) {
            super(ctx, ExprKind.STRING_LITERAL, loc);
            this.value = value;
        }

        public static StringLiteralExpr create(AstContext ctx, String value, SourceLoc loc) {
            return ctx.allocateExpr(new StringLiteralExpr(ctx, Preconditions.checkNotNull(value), loc), 0);
        }
    }

    public static final class InterpolatedStringLiteralExpr extends LiteralExpr {
        private final Expr[] segments;

        private InterpolatedStringLiteralExpr(AstContext ctx, SourceLoc loc, Expr[] segments) {
            super(ctx, ExprKind.INTERPOLATED_STRING_LITERAL, loc);
            this.segments = segments;
        }

        public static InterpolatedStringLiteralExpr create(AstContext ctx, SourceLoc loc, List<Expr> segments) {
            Preconditions.checkArgument(segments.stream().noneMatch(Objects::isNull), "interpolated string with a missing segment");
            var copy = copyChildren(ctx, segments);
            return ctx.allocateExpr(new InterpolatedStringLiteralExpr(ctx, loc, copy),
                    copy.length * AstContext.POINTER_BYTES);
        }

        public int numSegments() {
            return segments.length;
        }

        public Expr segment(int i) {
            return segments[i];
        }

        public void segment(int i, Expr segment) {
            context().adopt(Preconditions.checkNotNull(segment));
            segments[i] = segment;
        }

        public List<Expr> segments() {
            return Collections.unmodifiableList(Arrays.asList(segments));
        }
    }

    // ---- references ----

    @Accessors(fluent = true)
    public static final class DeclRefExpr extends Expr {
        @Getter
        private final ValueDecl decl;
        private final SourceLoc nameLoc;

        private DeclRefExpr(AstContext ctx, ValueDecl decl, SourceLoc nameLoc, Type type) {
            super(ctx, ExprKind.DECL_REF, type);
            this.decl = decl;
            this.nameLoc = nameLoc;
        }

        public static DeclRefExpr create(AstContext ctx, ValueDecl decl, SourceLoc loc, Type type) {
            ctx.adopt(Preconditions.checkNotNull(decl));
            return ctx.allocateExpr(new DeclRefExpr(ctx, decl, loc, type), 0);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(nameLoc);
        }

        @Override
        public SourceLoc loc() {
            return nameLoc;
        }
    }

    /**
     * A reference with two or more viable candidates. Resolution never edits one
     * of these in place: it builds a replacement with {@link #createFilteredWithCopy}
     * and the owner of the slot swaps it in.
     */
    @Accessors(fluent = true)
    public abstract static sealed class OverloadSetRefExpr extends Expr {
        // in candidate order
        @Getter
        private final ImmutableList<ValueDecl> decls;

        OverloadSetRefExpr(AstContext ctx, ExprKind kind, ImmutableList<ValueDecl> decls, Type type) {
            super(ctx, kind, type);
            Preconditions.checkArgument(decls.size() >= 2, "an overload set needs at least two candidates");
            this.decls = decls;
        }

        abstract Expr receiver();

        public Type baseType() {
            var receiver = receiver();
            if (receiver == null || hasMetaType(receiver)) {
                return null;
            }
            return receiver.type();
        }

        public abstract Expr createFilteredWithCopy(List<? extends ValueDecl> decls);

        static AstContext contextOf(List<? extends ValueDecl> decls) {
            Preconditions.checkArgument(!decls.isEmpty(), "cannot create a reference with an empty list of decls");
            var ctx = decls.get(0).context();
            decls.forEach(ctx::adopt);
            return ctx;
        }
    }

    @Accessors(fluent = true)
    public static final class OverloadedDeclRefExpr extends OverloadSetRefExpr {
        private final SourceLoc nameLoc;

        private OverloadedDeclRefExpr(AstContext ctx, ImmutableList<ValueDecl> decls, SourceLoc nameLoc, Type type) {
            super(ctx, ExprKind.OVERLOADED_DECL_REF, decls, type);
            this.nameLoc = nameLoc;
        }

        public static Expr createWithCopy(List<? extends ValueDecl> decls, SourceLoc loc) {
            var ctx = contextOf(decls);
            if (decls.size() == 1) {
                var decl = decls.get(0);
                return DeclRefExpr.create(ctx, decl, loc, decl.typeOfReference());
            }
            return ctx.allocateExpr(
                    new OverloadedDeclRefExpr(ctx, ctx.<ValueDecl>allocateCopy(decls), loc, ctx.types().dependent()), 0);
        }

        @Override
        Expr receiver() {
            return null;
        }

        @Override
        public Expr createFilteredWithCopy(List<? extends ValueDecl> decls) {
            return createWithCopy(decls, nameLoc);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(nameLoc);
        }

        @Override
        public SourceLoc loc() {
            return nameLoc;
        }
    }

    @Accessors(fluent = true)
    public static final class OverloadedMemberRefExpr extends OverloadSetRefExpr {
        @Getter
        private final Expr base;
        @Getter
        private final SourceLoc dotLoc;
        @Getter
        private final SourceLoc memberLoc;

        private OverloadedMemberRefExpr(AstContext ctx, Expr base, SourceLoc dotLoc, ImmutableList<ValueDecl> decls,
                SourceLoc memberLoc, Type type) {
            super(ctx, ExprKind.OVERLOADED_MEMBER_REF, decls, type);
            this.base = base;
            this.dotLoc = dotLoc;
            this.memberLoc = memberLoc;
        }

        /**
         * Collapses {@code base.member}. With one candidate: a metatype receiver or a
         * non-instance member yields a {@link DotSyntaxBaseIgnoredExpr}, an instance
         * function a curried {@link DotSyntaxCallExpr}, an instance variable a
         * {@link MemberRefExpr}. Each is typed with the candidate's reference type.
         */
        public static Expr createWithCopy(Expr base, SourceLoc dotLoc, List<? extends ValueDecl> decls,
                SourceLoc memberLoc) {
            var ctx = contextOf(decls);
            ctx.adopt(Preconditions.checkNotNull(base, "member reference without a base"));

            if (decls.size() == 1) {
                var decl = decls.get(0);
                if (decl.isInstanceMember() && !hasMetaType(base)) {
                    if (decl instanceof FuncDecl) {
                        var fn = DeclRefExpr.create(ctx, decl, memberLoc, decl.typeOfReference());
                        return DotSyntaxCallExpr.create(ctx, fn, dotLoc, base, decl.typeOfReference());
                    }
                    Preconditions.checkArgument(decl instanceof VarDecl,
                            "instance member %s is neither a function nor a variable", decl.name());
                    return MemberRefExpr.create(ctx, base, dotLoc, (VarDecl) decl, memberLoc);
                }
                var fn = DeclRefExpr.create(ctx, decl, memberLoc, decl.typeOfReference());
                return DotSyntaxBaseIgnoredExpr.create(ctx, base, dotLoc, fn);
            }

            return ctx.allocateExpr(new OverloadedMemberRefExpr(ctx, base, dotLoc, ctx.<ValueDecl>allocateCopy(decls),
                    memberLoc, ctx.types().dependent()), 0);
        }

        @Override
        Expr receiver() {
            return base;
        }

        @Override
        public Expr createFilteredWithCopy(List<? extends ValueDecl> decls) {
            return createWithCopy(base, dotLoc, decls, memberLoc);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(base.startLoc(), memberLoc);
        }

        @Override
        public SourceLoc loc() {
            return memberLoc;
        }
    }

    @Accessors(fluent = true)
    public static final class OverloadedSubscriptExpr extends OverloadSetRefExpr {
        @Getter
        private final Expr base;
        @Getter
        private final SourceLoc lbracketLoc;
        @Getter
        private final Expr index;
        @Getter
        private final SourceLoc rbracketLoc;

        private OverloadedSubscriptExpr(AstContext ctx, Expr base, ImmutableList<ValueDecl> decls,
                SourceLoc lbracketLoc, Expr index, SourceLoc rbracketLoc, Type type) {
            super(ctx, ExprKind.OVERLOADED_SUBSCRIPT, decls, type);
            this.base = base;
            this.lbracketLoc = lbracketLoc;
            this.index = index;
            this.rbracketLoc = rbracketLoc;
        }

        public static Expr createWithCopy(Expr base, List<? extends ValueDecl> decls, SourceLoc lbracketLoc,
                Expr index, SourceLoc rbracketLoc) {
            var ctx = contextOf(decls);
            ctx.adopt(Preconditions.checkNotNull(base, "subscript without a base"));
            ctx.adopt(Preconditions.checkNotNull(index, "subscript without an index"));

            if (decls.size() == 1) {
                var decl = decls.get(0);
                Preconditions.checkArgument(decl instanceof SubscriptDecl, "%s is not a subscript", decl.name());
                return SubscriptExpr.create(ctx, base, lbracketLoc, index, rbracketLoc, (SubscriptDecl) decl);
            }

            return ctx.allocateExpr(new OverloadedSubscriptExpr(ctx, base, ctx.<ValueDecl>allocateCopy(decls),
                    lbracketLoc, index, rbracketLoc, ctx.types().dependent()), 0);
        }

        @Override
        Expr receiver() {
            return base;
        }

        @Override
        public Expr createFilteredWithCopy(List<? extends ValueDecl> decls) {
            return createWithCopy(base, decls, lbracketLoc, index, rbracketLoc);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(base.startLoc(), rbracketLoc);
        }
    }

    @Accessors(fluent = true)
    public static final class UnresolvedDeclRefExpr extends Expr {
        @Getter
        private final String name;
        private final SourceLoc nameLoc;

        private UnresolvedDeclRefExpr(AstContext ctx, String name, SourceLoc nameLoc) {
            super(ctx, ExprKind.UNRESOLVED_DECL_REF, null);
            this.name = name;
            this.nameLoc = nameLoc;
        }

        public static UnresolvedDeclRefExpr create(AstContext ctx, String name, SourceLoc loc) {
            return ctx.allocateExpr(new UnresolvedDeclRefExpr(ctx, Preconditions.checkNotNull(name), loc), 0);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(nameLoc);
        }

        @Override
        public SourceLoc loc() {
            return nameLoc;
        }
    }

    @Accessors(fluent = true)
    public static final class MemberRefExpr extends Expr {
        @Getter
        private Expr base;
        @Getter
        private final VarDecl decl;
        @Getter
        private final SourceLoc dotLoc;
        @Getter
        private final SourceLoc nameLoc;

        private MemberRefExpr(AstContext ctx, Expr base, SourceLoc dotLoc, VarDecl decl, SourceLoc nameLoc) {
            super(ctx, ExprKind.MEMBER_REF, decl.typeOfReference());
            this.base = base;
            this.decl = decl;
            this.dotLoc = dotLoc;
            this.nameLoc = nameLoc;
        }

        public static MemberRefExpr create(AstContext ctx, Expr base, SourceLoc dotLoc, VarDecl decl,
                SourceLoc nameLoc) {
            ctx.adopt(Preconditions.checkNotNull(base));
            ctx.adopt(Preconditions.checkNotNull(decl));
            return ctx.allocateExpr(new MemberRefExpr(ctx, base, dotLoc, decl, nameLoc), 0);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(base.startLoc(), nameLoc);
        }

        @Override
        public SourceLoc loc() {
            return nameLoc;
        }

        public MemberRefExpr base(Expr base) {
            context().adopt(Preconditions.checkNotNull(base));
            this.base = base;
            return this;
        }
    }

    @Accessors(fluent = true)
    public static final class UnresolvedMemberExpr extends Expr {
        @Getter
        private final SourceLoc colonLoc;
        @Getter
        private final SourceLoc nameLoc;
        @Getter
        private final String name;

        private UnresolvedMemberExpr(AstContext ctx, SourceLoc colonLoc, SourceLoc nameLoc, String name) {
            super(ctx, ExprKind.UNRESOLVED_MEMBER, null);
            this.colonLoc = colonLoc;
            this.nameLoc = nameLoc;
            this.name = name;
        }

        public static UnresolvedMemberExpr create(AstContext ctx, SourceLoc colonLoc, SourceLoc nameLoc, String name) {
            return ctx.allocateExpr(new UnresolvedMemberExpr(ctx, colonLoc, nameLoc, Preconditions.checkNotNull(name)), 0);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(colonLoc, nameLoc);
        }

        @Override
        public SourceLoc loc() {
            return nameLoc;
        }
    }

    @Accessors(fluent = true)
    public static final class UnresolvedDotExpr extends Expr {
        // null for a leading-dot reference
        @Getter
        private Expr base;
        @Getter
        private final SourceLoc dotLoc;
        @Getter
        private final String name;
        @Getter
        private final SourceLoc nameLoc;

        private UnresolvedDotExpr(AstContext ctx, Expr base, SourceLoc dotLoc, String name, SourceLoc nameLoc) {
            super(ctx, ExprKind.UNRESOLVED_DOT, null);
            this.base = base;
            this.dotLoc = dotLoc;
            this.name = name;
            this.nameLoc = nameLoc;
        }

        public static UnresolvedDotExpr create(AstContext ctx, Expr base, SourceLoc dotLoc, String name,
                SourceLoc nameLoc) {
            ctx.adopt(base);
            return ctx.allocateExpr(new UnresolvedDotExpr(ctx, base, dotLoc, Preconditions.checkNotNull(name), nameLoc), 0);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(base != null ? base.startLoc() : dotLoc, nameLoc);
        }

        @Override
        public SourceLoc loc() {
            return nameLoc;
        }

        public UnresolvedDotExpr base(Expr base) {
            context().adopt(base);
            this.base = base;
            return this;
        }
    }

    public static final class ModuleExpr extends Expr {
        private final SourceLoc moduleLoc;

        private ModuleExpr(AstContext ctx, SourceLoc moduleLoc, Type type) {
            super(ctx, ExprKind.MODULE, type);
            this.moduleLoc = moduleLoc;
        }

        public static ModuleExpr create(AstContext ctx, SourceLoc loc, Type type) {
            return ctx.allocateExpr(new ModuleExpr(ctx, loc, type), 0);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(moduleLoc);
        }

        @Override
        public SourceLoc loc() {
            return moduleLoc;
        }
    }

    @Accessors(fluent = true)
    public static final class SubscriptExpr extends Expr {
        @Getter
        private Expr base;
        @Getter
        private Expr index;
        // null until resolved
        @Getter
        private final SubscriptDecl decl;
        @Getter
        private final SourceLoc lbracketLoc;
        @Getter
        private final SourceLoc rbracketLoc;

        private SubscriptExpr(AstContext ctx, Expr base, SourceLoc lbracketLoc, Expr index, SourceLoc rbracketLoc,
                SubscriptDecl decl) {
            super(ctx, ExprKind.SUBSCRIPT, decl != null ? decl.typeOfReference() : null);
            this.base = base;
            this.index = index;
            this.decl = decl;
            this.lbracketLoc = lbracketLoc;
            this.rbracketLoc = rbracketLoc;
        }

        public static SubscriptExpr create(AstContext ctx, Expr base, SourceLoc lbracketLoc, Expr index,
                SourceLoc rbracketLoc, SubscriptDecl decl) {
            ctx.adopt(Preconditions.checkNotNull(base));
            ctx.adopt(Preconditions.checkNotNull(index));
            ctx.adopt(decl);
            return ctx.allocateExpr(new SubscriptExpr(ctx, base, lbracketLoc, index, rbracketLoc, decl), 0);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(base.startLoc(), rbracketLoc);
        }

        public SubscriptExpr base(Expr base) {
            context().adopt(Preconditions.checkNotNull(base));
            this.base = base;
            return this;
        }

        public SubscriptExpr index(Expr index) {
            context().adopt(Preconditions.checkNotNull(index));
            this.index = index;
            return this;
        }
    }

    // ---- tuples and sequences ----

    @Accessors(fluent = true)
    public static final class ParenExpr extends Expr {
        @Getter
        private final SourceLoc lparenLoc;
        @Getter
        private Expr subExpr;
        @Getter
        private final SourceLoc rparenLoc;

        private ParenExpr(AstContext ctx, SourceLoc lparenLoc, Expr subExpr, SourceLoc rparenLoc) {
            super(ctx, ExprKind.PAREN, subExpr.type());
            this.lparenLoc = lparenLoc;
            this.subExpr = subExpr;
            this.rparenLoc = rparenLoc;
        }

        public static ParenExpr create(AstContext ctx, SourceLoc lparenLoc, Expr subExpr, SourceLoc rparenLoc) {
            ctx.adopt(Preconditions.checkNotNull(subExpr));
            Preconditions.checkArgument(lparenLoc.isValid() == rparenLoc.isValid(), "mismatched parentheses");
            return ctx.allocateExpr(new ParenExpr(ctx, lparenLoc, subExpr, rparenLoc), 0);
        }

        @Override
        public SourceRange sourceRange() {
            if (!lparenLoc.isValid()) {
                return subExpr.sourceRange();
            }
            return new SourceRange(lparenLoc, rparenLoc);
        }

        public ParenExpr subExpr(Expr subExpr) {
            context().adopt(Preconditions.checkNotNull(subExpr));
            this.subExpr = subExpr;
            return this;
        }
    }

    // null elements are defaulted; without parens the elements delimit the range
    @Accessors(fluent = true)
    public static final class TupleExpr extends Expr {
        @Getter
        private final SourceLoc lparenLoc;
        private final Expr[] elements;
        @Getter
        private final SourceLoc rparenLoc;

        private TupleExpr(AstContext ctx, SourceLoc lparenLoc, Expr[] elements, SourceLoc rparenLoc, Type type) {
            super(ctx, ExprKind.TUPLE, type);
            this.lparenLoc = lparenLoc;
            this.elements = elements;
            this.rparenLoc = rparenLoc;
        }

        public static TupleExpr create(AstContext ctx, SourceLoc lparenLoc, List<Expr> elements, SourceLoc rparenLoc,
                Type type) {
            var copy = copyChildren(ctx, elements);
            checkDelimiters(lparenLoc, copy, rparenLoc);
            return ctx.allocateExpr(new TupleExpr(ctx, lparenLoc, copy, rparenLoc, type),
                    copy.length * AstContext.POINTER_BYTES);
        }

        private static void checkDelimiters(SourceLoc lparenLoc, Expr[] elements, SourceLoc rparenLoc) {
            if (lparenLoc.isValid() || rparenLoc.isValid()) {
                Preconditions.checkArgument(lparenLoc.isValid() && rparenLoc.isValid(), "mismatched parentheses");
                return;
            }
            Preconditions.checkArgument(elements.length > 0 && elements[0] != null
                            && elements[elements.length - 1] != null,
                    "a tuple without parentheses needs explicit first and last elements");
        }

        public int numElements() {
            return elements.length;
        }

        public Expr element(int i) {
            return elements[i];
        }

        public void element(int i, Expr element) {
            context().adopt(element);
            elements[i] = element;
        }

        public List<Expr> elements() {
            return Collections.unmodifiableList(Arrays.asList(elements));
        }

        public boolean hasParens() {
            return lparenLoc.isValid();
        }

        @Override
        public SourceRange sourceRange() {
            if (lparenLoc.isValid()) {
                Verify.verify(rparenLoc.isValid(), "mismatched parentheses");
                return new SourceRange(lparenLoc, rparenLoc);
            }
            Verify.verify(elements.length > 0 && elements[0] != null && elements[elements.length - 1] != null,
                    "tuple without parentheses lost its first or last element");
            return new SourceRange(elements[0].startLoc(), elements[elements.length - 1].endLoc());
        }
    }

    @Accessors(fluent = true)
    public abstract static sealed class TupleElementExpr extends Expr {
        @Getter
        private Expr base;
        @Getter
        private final SourceLoc dotLoc;
        @Getter
        private final int fieldNumber;
        @Getter
        private final SourceLoc nameLoc;

        TupleElementExpr(AstContext ctx, ExprKind kind, Expr base, SourceLoc dotLoc, int fieldNumber,
                SourceLoc nameLoc, Type type) {
            super(ctx, kind, type);
            Preconditions.checkArgument(fieldNumber >= 0, "negative tuple field %s", fieldNumber);
            this.base = base;
            this.dotLoc = dotLoc;
            this.fieldNumber = fieldNumber;
            this.nameLoc = nameLoc;
        }

        @Override
        public SourceLoc loc() {
            return nameLoc;
        }

        public TupleElementExpr base(Expr base) {
            context().adopt(Preconditions.checkNotNull(base));
            this.base = base;
            return this;
        }
    }

    public static final class SyntacticTupleElementExpr extends TupleElementExpr {
        private SyntacticTupleElementExpr(AstContext ctx, Expr base, SourceLoc dotLoc, int fieldNumber,
                SourceLoc nameLoc, Type type) {
            super(ctx, ExprKind.SYNTACTIC_TUPLE_ELEMENT, base, dotLoc, fieldNumber, nameLoc, type);
        }

        public static SyntacticTupleElementExpr create(AstContext ctx, Expr base, SourceLoc dotLoc, int fieldNumber,
                SourceLoc nameLoc, Type type) {
            ctx.adopt(Preconditions.checkNotNull(base));
            return ctx.allocateExpr(new SyntacticTupleElementExpr(ctx, base, dotLoc, fieldNumber, nameLoc, type), 0);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(base().startLoc(), nameLoc());
        }
    }

    // field of the implicit this
    public static final class ImplicitThisTupleElementExpr extends TupleElementExpr {
        private ImplicitThisTupleElementExpr(AstContext ctx, Expr base, int fieldNumber, SourceLoc nameLoc,
                Type type) {
            super(ctx, ExprKind.IMPLICIT_THIS_TUPLE_ELEMENT, base, SourceLoc.INVALID, fieldNumber, nameLoc, type);
        }

        public static ImplicitThisTupleElementExpr create(AstContext ctx, Expr base, int fieldNumber,
                SourceLoc nameLoc, Type type) {
            ctx.adopt(Preconditions.checkNotNull(base));
            return ctx.allocateExpr(new ImplicitThisTupleElementExpr(ctx, base, fieldNumber, nameLoc, type), 0);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(nameLoc());
        }
    }

    // unfolded operator sequence
    public static final class SequenceExpr extends Expr {
        private final Expr[] elements;

        private SequenceExpr(AstContext ctx, Expr[] elements) {
            super(ctx, ExprKind.SEQUENCE, null);
            this.elements = elements;
        }

        public static SequenceExpr create(AstContext ctx, List<Expr> elements) {
            Preconditions.checkArgument(!elements.isEmpty(), "empty sequence");
            Preconditions.checkArgument(elements.stream().noneMatch(Objects::isNull), "sequence with a missing element");
            var copy = copyChildren(ctx, elements);
            return ctx.allocateExpr(new SequenceExpr(ctx, copy), copy.length * AstContext.POINTER_BYTES);
        }

        public int numElements() {
            return elements.length;
        }

        public Expr element(int i) {
            return elements[i];
        }

        public void element(int i, Expr element) {
            context().adopt(Preconditions.checkNotNull(element));
            elements[i] = element;
        }

        public List<Expr> elements() {
            return Collections.unmodifiableList(Arrays.asList(elements));
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(elements[0].startLoc(), elements[elements.length - 1].endLoc());
        }
    }

    @Accessors(fluent = true)
    public static final class NewArrayExpr extends Expr {
        static final int BOUND_BYTES = 24;

        public record Bound(Expr value, SourceRange brackets) {}

        @Getter
        private final SourceLoc newLoc;
        @Getter
        private final Type elementType;
        private final Bound[] bounds;

        private NewArrayExpr(AstContext ctx, SourceLoc newLoc, Type elementType, Bound[] bounds, Type type) {
            super(ctx, ExprKind.NEW_ARRAY, type);
            this.newLoc = newLoc;
            this.elementType = elementType;
            this.bounds = bounds;
        }

        public static NewArrayExpr create(AstContext ctx, SourceLoc newLoc, Type elementType, List<Bound> bounds,
                Type type) {
            Preconditions.checkArgument(!bounds.isEmpty(), "array allocation without bounds");
            for (var bound : bounds) {
                Preconditions.checkNotNull(bound.brackets(), "array bound without brackets");
                ctx.adopt(bound.value());
            }
            var copy = bounds.toArray(new Bound[0]);
            return ctx.allocateExpr(new NewArrayExpr(ctx, newLoc, elementType, copy, type),
                    copy.length * BOUND_BYTES);
        }

        public int numBounds() {
            return bounds.length;
        }

        public Bound bound(int i) {
            return bounds[i];
        }

        public List<Bound> bounds() {
            return Collections.unmodifiableList(Arrays.asList(bounds));
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(newLoc, bounds[bounds.length - 1].brackets().end());
        }
    }

    // ---- implicit conversions ----

    @Accessors(fluent = true)
    public abstract static sealed class ImplicitConversionExpr extends Expr {
        @Getter
        private Expr subExpr;

        ImplicitConversionExpr(AstContext ctx, ExprKind kind, Expr subExpr, Type type) {
            super(ctx, kind, Preconditions.checkNotNull(type, "implicit conversion without a type"));
            this.subExpr = subExpr;
        }

        static <E extends ImplicitConversionExpr> E allocate(AstContext ctx, E node) {
            ctx.adopt(Preconditions.checkNotNull(node.subExpr()));
            return ctx.allocateExpr(node, 0);
        }

        @Override
        public SourceRange sourceRange() {
            return subExpr.sourceRange();
        }

        @Override
        public SourceLoc loc() {
            return subExpr.loc();
        }

        public ImplicitConversionExpr subExpr(Expr subExpr) {
            context().adopt(Preconditions.checkNotNull(subExpr));
            this.subExpr = subExpr;
            return this;
        }
    }

    /**
     * Reorders tuple elements. Entry {@code i} of the mapping is the source
     * element for destination {@code i}, or {@link #DEFAULT_INITIALIZE}.
     */
    @Accessors(fluent = true)
    public static final class TupleShuffleExpr extends ImplicitConversionExpr {
        public static final int DEFAULT_INITIALIZE = -1;

        @Getter
        private final ImmutableIntArray elementMapping;

        private TupleShuffleExpr(AstContext ctx, Expr subExpr, ImmutableIntArray elementMapping, Type type) {
            super(ctx, ExprKind.TUPLE_SHUFFLE, subExpr, type);
            this.elementMapping = elementMapping;
        }

        public static TupleShuffleExpr create(AstContext ctx, Expr subExpr, int[] elementMapping, Type type) {
            for (int source : elementMapping) {
                Preconditions.checkArgument(source >= DEFAULT_INITIALIZE, "invalid tuple shuffle source %s", source);
            }
            return allocate(ctx, new TupleShuffleExpr(ctx, subExpr, ctx.allocateCopy(elementMapping), type));
        }
    }

    public static final class LookThroughOneofExpr extends ImplicitConversionExpr {
        private LookThroughOneofExpr(AstContext ctx, Expr subExpr, Type type) {
            super(ctx, ExprKind.LOOK_THROUGH_ONEOF, subExpr, type);
        }

        public static LookThroughOneofExpr create(AstContext ctx, Expr subExpr, Type type) {
            return allocate(ctx, new LookThroughOneofExpr(ctx, subExpr, type));
        }
    }

    public static final class ParameterRenameExpr extends ImplicitConversionExpr {
        private ParameterRenameExpr(AstContext ctx, Expr subExpr, Type type) {
            super(ctx, ExprKind.PARAMETER_RENAME, subExpr, type);
        }

        public static ParameterRenameExpr create(AstContext ctx, Expr subExpr, Type type) {
            return allocate(ctx, new ParameterRenameExpr(ctx, subExpr, type));
        }
    }

    public static final class ScalarToTupleExpr extends ImplicitConversionExpr {
        private ScalarToTupleExpr(AstContext ctx, Expr subExpr, Type type) {
            super(ctx, ExprKind.SCALAR_TO_TUPLE, subExpr, type);
        }

        public static ScalarToTupleExpr create(AstContext ctx, Expr subExpr, Type type) {
            return allocate(ctx, new ScalarToTupleExpr(ctx, subExpr, type));
        }
    }

    public static final class LoadExpr extends ImplicitConversionExpr {
        private LoadExpr(AstContext ctx, Expr subExpr, Type type) {
            super(ctx, ExprKind.LOAD, subExpr, type);
        }

        public static LoadExpr create(AstContext ctx, Expr subExpr, Type type) {
            return allocate(ctx, new LoadExpr(ctx, subExpr, type));
        }
    }

    public static final class MaterializeExpr extends ImplicitConversionExpr {
        private MaterializeExpr(AstContext ctx, Expr subExpr, Type type) {
            super(ctx, ExprKind.MATERIALIZE, subExpr, type);
        }

        public static MaterializeExpr create(AstContext ctx, Expr subExpr, Type type) {
            return allocate(ctx, new MaterializeExpr(ctx, subExpr, type));
        }
    }

    public static final class RequalifyExpr extends ImplicitConversionExpr {
        private RequalifyExpr(AstContext ctx, Expr subExpr, Type type) {
            super(ctx, ExprKind.REQUALIFY, subExpr, type);
        }

        public static RequalifyExpr create(AstContext ctx, Expr subExpr, Type type) {
            return allocate(ctx, new RequalifyExpr(ctx, subExpr, type));
        }
    }

    public static final class AddressOfExpr extends ImplicitConversionExpr {
        private AddressOfExpr(AstContext ctx, Expr subExpr, Type type) {
            super(ctx, ExprKind.ADDRESS_OF, subExpr, type);
        }

        public static AddressOfExpr create(AstContext ctx, Expr subExpr, Type type) {
            return allocate(ctx, new AddressOfExpr(ctx, subExpr, type));
        }
    }

    // ---- functions and closures ----

    @Accessors(fluent = true)
    public static final class FuncExpr extends Expr {
        @Getter
        private final SourceLoc funcLoc;
        private final Pattern[] paramPatterns;
        // null until the parser has seen the body
        @Getter
        private BraceStmt body;

        private FuncExpr(AstContext ctx, SourceLoc funcLoc, Pattern[] paramPatterns, Type type, BraceStmt body) {
            super(ctx, ExprKind.FUNC, type);
            this.funcLoc = funcLoc;
            this.paramPatterns = paramPatterns;
            this.body = body;
        }

        public static FuncExpr create(AstContext ctx, SourceLoc funcLoc, List<Pattern> params, Type type,
                BraceStmt body) {
            Preconditions.checkArgument(params.stream().noneMatch(Objects::isNull), "missing parameter clause");
            Preconditions.checkArgument(body == null || body.context() == ctx, "body belongs to a different context");
            var copy = params.toArray(new Pattern[0]);
            return ctx.allocateExpr(new FuncExpr(ctx, funcLoc, copy, type, body),
                    copy.length * AstContext.POINTER_BYTES);
        }

        public FuncExpr body(BraceStmt body) {
            Preconditions.checkArgument(body == null || body.context() == context(),
                    "body belongs to a different context");
            this.body = body;
            return this;
        }

        public int numParamPatterns() {
            return paramPatterns.length;
        }

        public List<Pattern> paramPatterns() {
            return Collections.unmodifiableList(Arrays.asList(paramPatterns));
        }

        public Type bodyResultType() {
            Preconditions.checkState(paramPatterns.length > 0, "function without parameter clauses");
            var ty = type();
            for (int i = 0; i < paramPatterns.length; i++) {
                Preconditions.checkState(ty instanceof FunctionType, "%s is not a function type", ty);
                ty = ((FunctionType) ty).result();
            }
            return ty;
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(funcLoc, body != null ? body.endLoc() : funcLoc);
        }
    }

    @Accessors(fluent = true)
    public abstract static sealed class ClosureExpr extends Expr {
        @Getter
        private Expr body;

        ClosureExpr(AstContext ctx, ExprKind kind, Expr body, Type type) {
            super(ctx, kind, type);
            this.body = body;
        }

        public ClosureExpr body(Expr body) {
            context().adopt(Preconditions.checkNotNull(body));
            this.body = body;
            return this;
        }
    }

    @Accessors(fluent = true)
    public static final class ExplicitClosureExpr extends ClosureExpr {
        @Getter
        private final SourceLoc lbraceLoc;
        @Getter
        private final SourceLoc rbraceLoc;

        private ExplicitClosureExpr(AstContext ctx, SourceLoc lbraceLoc, Expr body, SourceLoc rbraceLoc, Type type) {
            super(ctx, ExprKind.EXPLICIT_CLOSURE, body, type);
            this.lbraceLoc = lbraceLoc;
            this.rbraceLoc = rbraceLoc;
        }

        public static ExplicitClosureExpr create(AstContext ctx, SourceLoc lbraceLoc, Expr body, SourceLoc rbraceLoc,
                Type type) {
            ctx.adopt(body);
            return ctx.allocateExpr(new ExplicitClosureExpr(ctx, lbraceLoc, body, rbraceLoc, type), 0);
        }

        public void generateVarDecls(int numDecls, List<VarDecl> decls) {
            while (numDecls >= decls.size()) {
                int next = decls.size();
                decls.add(VarDecl.create(context(), "$" + next, SourceLoc.INVALID, null, false));
            }
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(lbraceLoc, rbraceLoc);
        }
    }

    public static final class ImplicitClosureExpr extends ClosureExpr {
        private ImplicitClosureExpr(AstContext ctx, Expr body, Type type) {
            super(ctx, ExprKind.IMPLICIT_CLOSURE, body, type);
        }

        public static ImplicitClosureExpr create(AstContext ctx, Expr body, Type type) {
            ctx.adopt(Preconditions.checkNotNull(body));
            return ctx.allocateExpr(new ImplicitClosureExpr(ctx, body, type), 0);
        }

        @Override
        public SourceRange sourceRange() {
            return body().sourceRange();
        }
    }

    // ---- applications ----

    @Accessors(fluent = true)
    public abstract static sealed class ApplyExpr extends Expr {
        @Getter
        private Expr fn;
        @Getter
        private Expr arg;

        ApplyExpr(AstContext ctx, ExprKind kind, Expr fn, Expr arg, Type type) {
            super(ctx, kind, type);
            this.fn = fn;
            this.arg = arg;
        }

        static <E extends ApplyExpr> E allocate(AstContext ctx, E node) {
            ctx.adopt(Preconditions.checkNotNull(node.fn(), "application without a callee"));
            ctx.adopt(Preconditions.checkNotNull(node.arg(), "application without an argument"));
            return ctx.allocateExpr(node, 0);
        }

        public ValueDecl calledValue() {
            return calledValue(fn);
        }

        private static ValueDecl calledValue(Expr e) {
            if (e instanceof DeclRefExpr dre) {
                return dre.decl();
            }
            var provider = e.valueProvidingExpr();
            if (provider != e) {
                return calledValue(provider);
            }
            return null;
        }

        public ApplyExpr fn(Expr fn) {
            context().adopt(Preconditions.checkNotNull(fn));
            this.fn = fn;
            return this;
        }

        public ApplyExpr arg(Expr arg) {
            context().adopt(Preconditions.checkNotNull(arg));
            this.arg = arg;
            return this;
        }
    }

    public static final class CallExpr extends ApplyExpr {
        private CallExpr(AstContext ctx, Expr fn, Expr arg, Type type) {
            super(ctx, ExprKind.CALL, fn, arg, type);
        }

        public static CallExpr create(AstContext ctx, Expr fn, Expr arg, Type type) {
            return allocate(ctx, new CallExpr(ctx, fn, arg, type));
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(fn().startLoc(), arg().endLoc());
        }
    }

    public static final class UnaryExpr extends ApplyExpr {
        private UnaryExpr(AstContext ctx, Expr fn, Expr arg, Type type) {
            super(ctx, ExprKind.UNARY, fn, arg, type);
        }

        public static UnaryExpr create(AstContext ctx, Expr fn, Expr arg, Type type) {
            return allocate(ctx, new UnaryExpr(ctx, fn, arg, type));
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(fn().startLoc(), arg().endLoc());
        }

        @Override
        public SourceLoc loc() {
            return fn().loc();
        }
    }

    public static final class BinaryExpr extends ApplyExpr {
        private BinaryExpr(AstContext ctx, Expr fn, TupleExpr arg, Type type) {
            super(ctx, ExprKind.BINARY, fn, arg, type);
        }

        public static BinaryExpr create(AstContext ctx, Expr fn, TupleExpr arg, Type type) {
            Preconditions.checkArgument(arg.numElements() == 2, "binary operator applied to %s operands",
                    arg.numElements());
            return allocate(ctx, new BinaryExpr(ctx, fn, arg, type));
        }

        @Override
        public SourceRange sourceRange() {
            return arg().sourceRange();
        }

        @Override
        public SourceLoc loc() {
            return fn().loc();
        }
    }

    public static final class ConstructorCallExpr extends ApplyExpr {
        private ConstructorCallExpr(AstContext ctx, Expr fn, Expr arg, Type type) {
            super(ctx, ExprKind.CONSTRUCTOR_CALL, fn, arg, type);
        }

        public static ConstructorCallExpr create(AstContext ctx, Expr fn, Expr arg, Type type) {
            return allocate(ctx, new ConstructorCallExpr(ctx, fn, arg, type));
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(fn().startLoc(), arg().endLoc());
        }
    }

    @Accessors(fluent = true)
    public static final class DotSyntaxCallExpr extends ApplyExpr {
        @Getter
        private final SourceLoc dotLoc;

        private DotSyntaxCallExpr(AstContext ctx, Expr fn, SourceLoc dotLoc, Expr base, Type type) {
            super(ctx, ExprKind.DOT_SYNTAX_CALL, fn, base, type);
            this.dotLoc = dotLoc;
        }

        public static DotSyntaxCallExpr create(AstContext ctx, Expr fn, SourceLoc dotLoc, Expr base, Type type) {
            return allocate(ctx, new DotSyntaxCallExpr(ctx, fn, dotLoc, base, type));
        }

        public Expr base() {
            return arg();
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(arg().startLoc(), fn().endLoc());
        }

        @Override
        public SourceLoc loc() {
            return fn().loc();
        }
    }

    @Accessors(fluent = true)
    public static final class DotSyntaxBaseIgnoredExpr extends Expr {
        @Getter
        private Expr lhs;
        @Getter
        private final SourceLoc dotLoc;
        @Getter
        private Expr rhs;

        private DotSyntaxBaseIgnoredExpr(AstContext ctx, Expr lhs, SourceLoc dotLoc, Expr rhs) {
            super(ctx, ExprKind.DOT_SYNTAX_BASE_IGNORED, rhs.type());
            this.lhs = lhs;
            this.dotLoc = dotLoc;
            this.rhs = rhs;
        }

        public static DotSyntaxBaseIgnoredExpr create(AstContext ctx, Expr lhs, SourceLoc dotLoc, Expr rhs) {
            ctx.adopt(Preconditions.checkNotNull(lhs));
            ctx.adopt(Preconditions.checkNotNull(rhs));
            return ctx.allocateExpr(new DotSyntaxBaseIgnoredExpr(ctx, lhs, dotLoc, rhs), 0);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(lhs.startLoc(), rhs.endLoc());
        }

        @Override
        public SourceLoc loc() {
            return rhs.loc();
        }

        public DotSyntaxBaseIgnoredExpr lhs(Expr lhs) {
            context().adopt(Preconditions.checkNotNull(lhs));
            this.lhs = lhs;
            return this;
        }

        public DotSyntaxBaseIgnoredExpr rhs(Expr rhs) {
            context().adopt(Preconditions.checkNotNull(rhs));
            this.rhs = rhs;
            return this;
        }
    }

    @Accessors(fluent = true)
    public static final class CoerceExpr extends Expr {
        @Getter
        private Expr lhs;
        @Getter
        private Expr rhs;

        private CoerceExpr(AstContext ctx, Expr lhs, Expr rhs, Type type) {
            super(ctx, ExprKind.COERCE, type);
            this.lhs = lhs;
            this.rhs = rhs;
        }

        public static CoerceExpr create(AstContext ctx, Expr lhs, Expr rhs, Type type) {
            ctx.adopt(Preconditions.checkNotNull(lhs));
            ctx.adopt(Preconditions.checkNotNull(rhs));
            return ctx.allocateExpr(new CoerceExpr(ctx, lhs, rhs, type), 0);
        }

        @Override
        public SourceRange sourceRange() {
            return new SourceRange(lhs.startLoc(), rhs.endLoc());
        }

        public CoerceExpr lhs(Expr lhs) {
            context().adopt(Preconditions.checkNotNull(lhs));
            this.lhs = lhs;
            return this;
        }

        public CoerceExpr rhs(Expr rhs) {
            context().adopt(Preconditions.checkNotNull(rhs));
            this.rhs = rhs;
            return this;
        }
    }
}
