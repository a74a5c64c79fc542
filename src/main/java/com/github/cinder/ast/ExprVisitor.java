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

/**
 * Double dispatch over the concrete node classes. The switch in
 * {@link #visit(Expr)} has no default branch: adding a kind breaks the build
 * until it is handled here and in every implementation.
 */
public interface ExprVisitor<R> {

    default R visit(Expr e) {
        return switch (e.kind()) {
            case ERROR -> visitErrorExpr((ErrorExpr) e);
            case INTEGER_LITERAL -> visitIntegerLiteralExpr((IntegerLiteralExpr) e);
            case FLOAT_LITERAL -> visitFloatLiteralExpr((FloatLiteralExpr) e);
            case CHARACTER_LITERAL -> visitCharacterLiteralExpr((CharacterLiteralExpr) e);
            case STRING_LITERAL -> visitStringLiteralExpr((StringLiteralExpr) e);
            case INTERPOLATED_STRING_LITERAL -> visitInterpolatedStringLiteralExpr((InterpolatedStringLiteralExpr) e);
            case DECL_REF -> visitDeclRefExpr((DeclRefExpr) e);
            case OVERLOADED_DECL_REF -> visitOverloadedDeclRefExpr((OverloadedDeclRefExpr) e);
            case OVERLOADED_MEMBER_REF -> visitOverloadedMemberRefExpr((OverloadedMemberRefExpr) e);
            case UNRESOLVED_DECL_REF -> visitUnresolvedDeclRefExpr((UnresolvedDeclRefExpr) e);
            case MEMBER_REF -> visitMemberRefExpr((MemberRefExpr) e);
            case UNRESOLVED_MEMBER -> visitUnresolvedMemberExpr((UnresolvedMemberExpr) e);
            case PAREN -> visitParenExpr((ParenExpr) e);
            case TUPLE -> visitTupleExpr((TupleExpr) e);
            case SUBSCRIPT -> visitSubscriptExpr((SubscriptExpr) e);
            case OVERLOADED_SUBSCRIPT -> visitOverloadedSubscriptExpr((OverloadedSubscriptExpr) e);
            case UNRESOLVED_DOT -> visitUnresolvedDotExpr((UnresolvedDotExpr) e);
            case MODULE -> visitModuleExpr((ModuleExpr) e);
            case SYNTACTIC_TUPLE_ELEMENT -> visitSyntacticTupleElementExpr((SyntacticTupleElementExpr) e);
            case IMPLICIT_THIS_TUPLE_ELEMENT -> visitImplicitThisTupleElementExpr((ImplicitThisTupleElementExpr) e);
            case TUPLE_SHUFFLE -> visitTupleShuffleExpr((TupleShuffleExpr) e);
            case LOOK_THROUGH_ONEOF -> visitLookThroughOneofExpr((LookThroughOneofExpr) e);
            case PARAMETER_RENAME -> visitParameterRenameExpr((ParameterRenameExpr) e);
            case SCALAR_TO_TUPLE -> visitScalarToTupleExpr((ScalarToTupleExpr) e);
            case LOAD -> visitLoadExpr((LoadExpr) e);
            case MATERIALIZE -> visitMaterializeExpr((MaterializeExpr) e);
            case REQUALIFY -> visitRequalifyExpr((RequalifyExpr) e);
            case ADDRESS_OF -> visitAddressOfExpr((AddressOfExpr) e);
            case SEQUENCE -> visitSequenceExpr((SequenceExpr) e);
            case FUNC -> visitFuncExpr((FuncExpr) e);
            case EXPLICIT_CLOSURE -> visitExplicitClosureExpr((ExplicitClosureExpr) e);
            case IMPLICIT_CLOSURE -> visitImplicitClosureExpr((ImplicitClosureExpr) e);
            case NEW_ARRAY -> visitNewArrayExpr((NewArrayExpr) e);
            case CALL -> visitCallExpr((CallExpr) e);
            case UNARY -> visitUnaryExpr((UnaryExpr) e);
            case BINARY -> visitBinaryExpr((BinaryExpr) e);
            case CONSTRUCTOR_CALL -> visitConstructorCallExpr((ConstructorCallExpr) e);
            case DOT_SYNTAX_CALL -> visitDotSyntaxCallExpr((DotSyntaxCallExpr) e);
            case DOT_SYNTAX_BASE_IGNORED -> visitDotSyntaxBaseIgnoredExpr((DotSyntaxBaseIgnoredExpr) e);
            case COERCE -> visitCoerceExpr((CoerceExpr) e);
        };
    }

    R visitErrorExpr(ErrorExpr e);
    R visitIntegerLiteralExpr(IntegerLiteralExpr e);
    R visitFloatLiteralExpr(FloatLiteralExpr e);
    R visitCharacterLiteralExpr(CharacterLiteralExpr e);
    R visitStringLiteralExpr(StringLiteralExpr e);
    R visitInterpolatedStringLiteralExpr(InterpolatedStringLiteralExpr e);
    R visitDeclRefExpr(DeclRefExpr e);
    R visitOverloadedDeclRefExpr(OverloadedDeclRefExpr e);
    R visitOverloadedMemberRefExpr(OverloadedMemberRefExpr e);
    R visitUnresolvedDeclRefExpr(UnresolvedDeclRefExpr e);
    R visitMemberRefExpr(MemberRefExpr e);
    R visitUnresolvedMemberExpr(UnresolvedMemberExpr e);
    R visitParenExpr(ParenExpr e);
    R visitTupleExpr(TupleExpr e);
    R visitSubscriptExpr(SubscriptExpr e);
    R visitOverloadedSubscriptExpr(OverloadedSubscriptExpr e);
    R visitUnresolvedDotExpr(UnresolvedDotExpr e);
    R visitModuleExpr(ModuleExpr e);
    R visitSyntacticTupleElementExpr(SyntacticTupleElementExpr e);
    R visitImplicitThisTupleElementExpr(ImplicitThisTupleElementExpr e);
    R visitTupleShuffleExpr(TupleShuffleExpr e);
    R visitLookThroughOneofExpr(LookThroughOneofExpr e);
    R visitParameterRenameExpr(ParameterRenameExpr e);
    R visitScalarToTupleExpr(ScalarToTupleExpr e);
    R visitLoadExpr(LoadExpr e);
    R visitMaterializeExpr(MaterializeExpr e);
    R visitRequalifyExpr(RequalifyExpr e);
    R visitAddressOfExpr(AddressOfExpr e);
    R visitSequenceExpr(SequenceExpr e);
    R visitFuncExpr(FuncExpr e);
    R visitExplicitClosureExpr(ExplicitClosureExpr e);
    R visitImplicitClosureExpr(ImplicitClosureExpr e);
    R visitNewArrayExpr(NewArrayExpr e);
    R visitCallExpr(CallExpr e);
    R visitUnaryExpr(UnaryExpr e);
    R visitBinaryExpr(BinaryExpr e);
    R visitConstructorCallExpr(ConstructorCallExpr e);
    R visitDotSyntaxCallExpr(DotSyntaxCallExpr e);
    R visitDotSyntaxBaseIgnoredExpr(DotSyntaxBaseIgnoredExpr e);
    R visitCoerceExpr(CoerceExpr e);
}
