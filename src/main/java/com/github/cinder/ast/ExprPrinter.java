package com.github.cinder.ast;

import com.github.cinder.ast.Expr.AddressOfExpr;
import com.github.cinder.ast.Expr.ApplyExpr;
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
import com.github.cinder.ast.Expr.ImplicitConversionExpr;
import com.github.cinder.ast.Expr.ImplicitThisTupleElementExpr;
import com.github.cinder.ast.Expr.IntegerLiteralExpr;
import com.github.cinder.ast.Expr.InterpolatedStringLiteralExpr;
import com.github.cinder.ast.Expr.LoadExpr;
import com.github.cinder.ast.Expr.LookThroughOneofExpr;
import com.github.cinder.ast.Expr.MaterializeExpr;
import com.github.cinder.ast.Expr.MemberRefExpr;
import com.github.cinder.ast.Expr.ModuleExpr;
import com.github.cinder.ast.Expr.NewArrayExpr;
import com.github.cinder.ast.Expr.OverloadSetRefExpr;
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
import com.github.cinder.ast.Expr.TupleElementExpr;
import com.github.cinder.ast.Expr.TupleExpr;
import com.github.cinder.ast.Expr.TupleShuffleExpr;
import com.github.cinder.ast.Expr.UnaryExpr;
import com.github.cinder.ast.Expr.UnresolvedDeclRefExpr;
import com.github.cinder.ast.Expr.UnresolvedDotExpr;
import com.github.cinder.ast.Expr.UnresolvedMemberExpr;
import com.github.cinder.types.Type.BuiltinIntegerType;

import lombok.AllArgsConstructor;

/**
 * Writes the parenthesized debug dump of a tree. Each node opens with its tag
 * and type, children follow on their own lines two columns deeper, and the
 * node closes on the line of its last child.
 */
@AllArgsConstructor
class ExprPrinter implements ExprVisitor<Void> {

    private final StringBuilder out;
    private int indent;

    private void printCommon(Expr e) {
        out.append(" ".repeat(indent)).append('(').append(e.kind().tag())
                .append(" type='").append(e.type() == null ? "" : e.type()).append('\'');
    }

    private void printRec(Expr e) {
        out.append('\n');
        if (e == null) {
            out.append(" ".repeat(indent + 2)).append("(**NULL EXPRESSION**)");
            return;
        }
        indent += 2;
        visit(e);
        indent -= 2;
    }

    private void printRec(ValueDecl d) {
        out.append('\n');
        d.print(out, indent + 2);
    }

    private void printRec(BraceStmt s) {
        out.append('\n');
        if (s == null) {
            out.append(" ".repeat(indent + 2)).append("(**NULL STATEMENT**)");
            return;
        }
        s.print(out, indent + 2);
    }

    private Void close() {
        out.append(')');
        return null;
    }

    private void printCandidates(OverloadSetRefExpr e) {
        for (var d : e.decls()) {
            printRec(d);
        }
    }

    private Void printConversion(ImplicitConversionExpr e) {
        printCommon(e);
        printRec(e.subExpr());
        return close();
    }

    private Void printApply(ApplyExpr e) {
        printCommon(e);
        printRec(e.fn());
        printRec(e.arg());
        return close();
    }

    private Void printTupleElement(TupleElementExpr e) {
        printCommon(e);
        out.append(" field #").append(e.fieldNumber());
        printRec(e.base());
        return close();
    }

    @Override
    public Void visitErrorExpr(ErrorExpr e) {
        printCommon(e);
        return close();
    }

    @Override
    public Void visitIntegerLiteralExpr(IntegerLiteralExpr e) {
        printCommon(e);
        out.append(" value=");
        if (e.type() instanceof BuiltinIntegerType) {
            out.append(e.value());
        } else {
            out.append(e.text());
        }
        return close();
    }

    @Override
    public Void visitFloatLiteralExpr(FloatLiteralExpr e) {
        printCommon(e);
        out.append(" value=").append(e.text());
        return close();
    }

    @Override
    public Void visitCharacterLiteralExpr(CharacterLiteralExpr e) {
        printCommon(e);
        out.append(" value=").append(e.value());
        return close();
    }

    @Override
    public Void visitStringLiteralExpr(StringLiteralExpr e) {
        printCommon(e);
        out.append(" value=\"").append(e.value()).append('"');
        return close();
    }

    @Override
    public Void visitInterpolatedStringLiteralExpr(InterpolatedStringLiteralExpr e) {
        printCommon(e);
        for (var segment : e.segments()) {
            printRec(segment);
        }
        return close();
    }

    @Override
    public Void visitDeclRefExpr(DeclRefExpr e) {
        printCommon(e);
        out.append(" decl=").append(e.decl().name());
        return close();
    }

    @Override
    public Void visitOverloadedDeclRefExpr(OverloadedDeclRefExpr e) {
        printCommon(e);
        out.append(" #decls=").append(e.decls().size());
        printCandidates(e);
        return close();
    }

    @Override
    public Void visitOverloadedMemberRefExpr(OverloadedMemberRefExpr e) {
        printCommon(e);
        out.append(" #decls=").append(e.decls().size());
        printRec(e.base());
        printCandidates(e);
        return close();
    }

    @Override
    public Void visitUnresolvedDeclRefExpr(UnresolvedDeclRefExpr e) {
        printCommon(e);
        out.append(" name=").append(e.name());
        return close();
    }

    @Override
    public Void visitMemberRefExpr(MemberRefExpr e) {
        printCommon(e);
        out.append(" decl=").append(e.decl().name());
        printRec(e.base());
        return close();
    }

    @Override
    public Void visitUnresolvedMemberExpr(UnresolvedMemberExpr e) {
        printCommon(e);
        out.append(" name='").append(e.name()).append('\'');
        return close();
    }

    @Override
    public Void visitParenExpr(ParenExpr e) {
        printCommon(e);
        printRec(e.subExpr());
        return close();
    }

    @Override
    public Void visitTupleExpr(TupleExpr e) {
        printCommon(e);
        for (var element : e.elements()) {
            if (element == null) {
                out.append('\n').append(" ".repeat(indent + 2)).append("<<tuple element default value>>");
            } else {
                printRec(element);
            }
        }
        return close();
    }

    @Override
    public Void visitSubscriptExpr(SubscriptExpr e) {
        printCommon(e);
        if (e.decl() != null) {
            out.append(" decl=").append(e.decl().name());
        }
        printRec(e.base());
        printRec(e.index());
        return close();
    }

    @Override
    public Void visitOverloadedSubscriptExpr(OverloadedSubscriptExpr e) {
        printCommon(e);
        out.append(" #decls=").append(e.decls().size());
        printRec(e.base());
        printRec(e.index());
        printCandidates(e);
        return close();
    }

    @Override
    public Void visitUnresolvedDotExpr(UnresolvedDotExpr e) {
        printCommon(e);
        out.append(" field '").append(e.name()).append('\'');
        if (e.base() != null) {
            printRec(e.base());
        }
        return close();
    }

    @Override
    public Void visitModuleExpr(ModuleExpr e) {
        printCommon(e);
        return close();
    }

    @Override
    public Void visitSyntacticTupleElementExpr(SyntacticTupleElementExpr e) {
        return printTupleElement(e);
    }

    @Override
    public Void visitImplicitThisTupleElementExpr(ImplicitThisTupleElementExpr e) {
        return printTupleElement(e);
    }

    @Override
    public Void visitTupleShuffleExpr(TupleShuffleExpr e) {
        printCommon(e);
        out.append(" elements=").append(e.elementMapping());
        printRec(e.subExpr());
        return close();
    }

    @Override
    public Void visitLookThroughOneofExpr(LookThroughOneofExpr e) {
        return printConversion(e);
    }

    @Override
    public Void visitParameterRenameExpr(ParameterRenameExpr e) {
        return printConversion(e);
    }

    @Override
    public Void visitScalarToTupleExpr(ScalarToTupleExpr e) {
        return printConversion(e);
    }

    @Override
    public Void visitLoadExpr(LoadExpr e) {
        return printConversion(e);
    }

    @Override
    public Void visitMaterializeExpr(MaterializeExpr e) {
        return printConversion(e);
    }

    @Override
    public Void visitRequalifyExpr(RequalifyExpr e) {
        return printConversion(e);
    }

    @Override
    public Void visitAddressOfExpr(AddressOfExpr e) {
        return printConversion(e);
    }

    @Override
    public Void visitSequenceExpr(SequenceExpr e) {
        printCommon(e);
        for (var element : e.elements()) {
            printRec(element);
        }
        return close();
    }

    @Override
    public Void visitFuncExpr(FuncExpr e) {
        printCommon(e);
        printRec(e.body());
        return close();
    }

    @Override
    public Void visitExplicitClosureExpr(ExplicitClosureExpr e) {
        printCommon(e);
        printRec(e.body());
        return close();
    }

    @Override
    public Void visitImplicitClosureExpr(ImplicitClosureExpr e) {
        printCommon(e);
        printRec(e.body());
        return close();
    }

    @Override
    public Void visitNewArrayExpr(NewArrayExpr e) {
        printCommon(e);
        out.append(" elementType='").append(e.elementType()).append('\'');
        for (var bound : e.bounds()) {
            printRec(bound.value());
        }
        return close();
    }

    @Override
    public Void visitCallExpr(CallExpr e) {
        return printApply(e);
    }

    @Override
    public Void visitUnaryExpr(UnaryExpr e) {
        return printApply(e);
    }

    @Override
    public Void visitBinaryExpr(BinaryExpr e) {
        return printApply(e);
    }

    @Override
    public Void visitConstructorCallExpr(ConstructorCallExpr e) {
        return printApply(e);
    }

    @Override
    public Void visitDotSyntaxCallExpr(DotSyntaxCallExpr e) {
        return printApply(e);
    }

    @Override
    public Void visitDotSyntaxBaseIgnoredExpr(DotSyntaxBaseIgnoredExpr e) {
        printCommon(e);
        printRec(e.lhs());
        printRec(e.rhs());
        return close();
    }

    @Override
    public Void visitCoerceExpr(CoerceExpr e) {
        printCommon(e);
        printRec(e.lhs());
        printRec(e.rhs());
        return close();
    }
}
