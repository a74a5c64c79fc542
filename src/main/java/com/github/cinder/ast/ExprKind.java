package com.github.cinder.ast;

import com.github.cinder.ast.Expr.AddressOfExpr;
import com.github.cinder.ast.Expr.BinaryExpr;
import com.github.cinder.ast.Expr.CallExpr;
import com.github.cinder.ast.Expr.CharacterLiteralExpr;
import com.github.cinder.ast.Expr.CoerceExpr;
import com.github.cinder.ast.Expr.ConstructorCallExpr;
import com.github.cinder.ast.Expr.DeclRefExpr;
import com.github.cinder.ast.Expr.DotSyntaxBaseIgnoredExpr;
import com.github.cinder.ast.Expr.DotSyntaxCallExpr;
import com.github.cinder.ast.Expr.ErrorExpr;
import com.github.cinder.ast.Expr.ExplicitClosureExpr;
import com.github.cinder.ast.Expr.FloatLiteralExpr;
import com.github.cinder.ast.Expr.FuncExpr;
import com.github.cinder.ast.Expr.ImplicitClosureExpr;
import com.github.cinder.ast.Expr.ImplicitThisTupleElementExpr;
import com.github.cinder.ast.Expr.IntegerLiteralExpr;
import com.github.cinder.ast.Expr.InterpolatedStringLiteralExpr;
import com.github.cinder.ast.Expr.LoadExpr;
import com.github.cinder.ast.Expr.LookThroughOneofExpr;
import com.github.cinder.ast.Expr.MaterializeExpr;
import com.github.cinder.ast.Expr.MemberRefExpr;
import com.github.cinder.ast.Expr.ModuleExpr;
import com.github.cinder.ast.Expr.NewArrayExpr;
import com.github.cinder.ast.Expr.OverloadedDeclRefExpr;
import com.github.cinder.ast.Expr.OverloadedMemberRefExpr;
import com.github.cinder.ast.Expr.OverloadedSubscriptExpr;
import com.github.cinder.ast.Expr.ParameterRenameExpr;
import com.github.cinder.ast.Expr.ParenExpr;
import com.github.cinder.ast.Expr.RequalifyExpr;
import com.github.cinder.ast.Expr.ScalarToTupleExpr;
import com.github.cinder.ast.Expr.SequenceExpr;
import com.github.cinder.ast.Expr.StringLiteralExpr;
import com.github.cinder.ast.Expr.SubscriptExpr;
import com.github.cinder.ast.Expr.SyntacticTupleElementExpr;
import com.github.cinder.ast.Expr.TupleExpr;
import com.github.cinder.ast.Expr.TupleShuffleExpr;
import com.github.cinder.ast.Expr.UnaryExpr;
import com.github.cinder.ast.Expr.UnresolvedDeclRefExpr;
import com.github.cinder.ast.Expr.UnresolvedDotExpr;
import com.github.cinder.ast.Expr.UnresolvedMemberExpr;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Every expression variant, in canonical order. {@link ExprVisitor#visit}
 * switches over this without a default branch, so a kind added here is a
 * compile error until every visitor handles it.
 */
@Accessors(fluent = true)
public enum ExprKind {
    ERROR(Category.PLAIN, "error_expr", ErrorExpr.class),
    INTEGER_LITERAL(Category.LITERAL, "integer_literal_expr", IntegerLiteralExpr.class),
    FLOAT_LITERAL(Category.LITERAL, "float_literal_expr", FloatLiteralExpr.class),
    CHARACTER_LITERAL(Category.LITERAL, "character_literal_expr", CharacterLiteralExpr.class),
    STRING_LITERAL(Category.LITERAL, "string_literal_expr", StringLiteralExpr.class),
    INTERPOLATED_STRING_LITERAL(Category.LITERAL, "interpolated_string_literal_expr", InterpolatedStringLiteralExpr.class),
    DECL_REF(Category.PLAIN, "declref_expr", DeclRefExpr.class),
    OVERLOADED_DECL_REF(Category.OVERLOAD_SET_REF, "overloadeddeclref_expr", OverloadedDeclRefExpr.class),
    OVERLOADED_MEMBER_REF(Category.OVERLOAD_SET_REF, "overloadedmemberref_expr", OverloadedMemberRefExpr.class),
    UNRESOLVED_DECL_REF(Category.PLAIN, "unresolved_decl_ref_expr", UnresolvedDeclRefExpr.class),
    MEMBER_REF(Category.PLAIN, "member_ref_expr", MemberRefExpr.class),
    UNRESOLVED_MEMBER(Category.PLAIN, "unresolved_member_expr", UnresolvedMemberExpr.class),
    PAREN(Category.PLAIN, "paren_expr", ParenExpr.class),
    TUPLE(Category.PLAIN, "tuple_expr", TupleExpr.class),
    SUBSCRIPT(Category.PLAIN, "subscript_expr", SubscriptExpr.class),
    OVERLOADED_SUBSCRIPT(Category.OVERLOAD_SET_REF, "overloaded_subscript_expr", OverloadedSubscriptExpr.class),
    UNRESOLVED_DOT(Category.PLAIN, "unresolved_dot_expr", UnresolvedDotExpr.class),
    MODULE(Category.PLAIN, "module_expr", ModuleExpr.class),
    SYNTACTIC_TUPLE_ELEMENT(Category.TUPLE_ELEMENT, "syntactic_tuple_element_expr", SyntacticTupleElementExpr.class),
    IMPLICIT_THIS_TUPLE_ELEMENT(Category.TUPLE_ELEMENT, "implicit_this_tuple_element_expr", ImplicitThisTupleElementExpr.class),
    TUPLE_SHUFFLE(Category.IMPLICIT_CONVERSION, "tuple_shuffle_expr", TupleShuffleExpr.class),
    LOOK_THROUGH_ONEOF(Category.IMPLICIT_CONVERSION, "look_through_oneof_expr", LookThroughOneofExpr.class),
    PARAMETER_RENAME(Category.IMPLICIT_CONVERSION, "parameter_rename_expr", ParameterRenameExpr.class),
    SCALAR_TO_TUPLE(Category.IMPLICIT_CONVERSION, "scalar_to_tuple_expr", ScalarToTupleExpr.class),
    LOAD(Category.IMPLICIT_CONVERSION, "load_expr", LoadExpr.class),
    MATERIALIZE(Category.IMPLICIT_CONVERSION, "materialize_expr", MaterializeExpr.class),
    REQUALIFY(Category.IMPLICIT_CONVERSION, "requalify_expr", RequalifyExpr.class),
    ADDRESS_OF(Category.IMPLICIT_CONVERSION, "address_of_expr", AddressOfExpr.class),
    SEQUENCE(Category.PLAIN, "sequence_expr", SequenceExpr.class),
    FUNC(Category.CAPTURING, "func_expr", FuncExpr.class),
    EXPLICIT_CLOSURE(Category.CAPTURING, "explicit_closure_expr", ExplicitClosureExpr.class),
    IMPLICIT_CLOSURE(Category.CAPTURING, "implicit_closure_expr", ImplicitClosureExpr.class),
    NEW_ARRAY(Category.PLAIN, "new_array_expr", NewArrayExpr.class),
    CALL(Category.APPLY, "call_expr", CallExpr.class),
    UNARY(Category.APPLY, "unary_expr", UnaryExpr.class),
    BINARY(Category.APPLY, "binary_expr", BinaryExpr.class),
    CONSTRUCTOR_CALL(Category.APPLY, "constructor_call_expr", ConstructorCallExpr.class),
    DOT_SYNTAX_CALL(Category.APPLY, "dot_syntax_call_expr", DotSyntaxCallExpr.class),
    DOT_SYNTAX_BASE_IGNORED(Category.PLAIN, "dot_syntax_base_ignored", DotSyntaxBaseIgnoredExpr.class),
    COERCE(Category.PLAIN, "coerce_expr", CoerceExpr.class);

    public enum Category {
        PLAIN,
        LITERAL,
        OVERLOAD_SET_REF,
        TUPLE_ELEMENT,
        IMPLICIT_CONVERSION,
        CAPTURING,
        APPLY
    }

    @Getter
    private final Category category;
    // stable; golden dumps depend on it
    @Getter
    private final String tag;
    @Getter
    private final Class<? extends Expr> nodeClass;

    ExprKind(Category category, String tag, Class<? extends Expr> nodeClass) {
        this.category = category;
        this.tag = tag;
        this.nodeClass = nodeClass;
    }

    public boolean isImplicitConversion() {
        return category == Category.IMPLICIT_CONVERSION;
    }

    public boolean isOverloadSet() {
        return category == Category.OVERLOAD_SET_REF;
    }
}
