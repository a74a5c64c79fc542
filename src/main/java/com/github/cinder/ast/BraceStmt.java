package com.github.cinder.ast;

import java.util.List;

import com.github.cinder.source.SourceLoc;
import com.github.cinder.source.SourceRange;
import com.google.common.collect.ImmutableList;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * A braced body. Only the surface needed by function expressions is modeled.
 */
@Accessors(fluent = true)
public final class BraceStmt {

    @Getter
    private final AstContext context;
    @Getter
    private final SourceLoc lbraceLoc;
    @Getter
    private final ImmutableList<Expr> elements;
    @Getter
    private final SourceLoc rbraceLoc;

    private BraceStmt(AstContext context, SourceLoc lbraceLoc, ImmutableList<Expr> elements, SourceLoc rbraceLoc) {
        this.context = context;
        this.lbraceLoc = lbraceLoc;
        this.elements = elements;
        this.rbraceLoc = rbraceLoc;
    }

    public static BraceStmt create(AstContext ctx, SourceLoc lbraceLoc, List<Expr> elements, SourceLoc rbraceLoc) {
        elements.forEach(ctx::adopt);
        return ctx.allocate(new BraceStmt(ctx, lbraceLoc, ctx.allocateCopy(elements), rbraceLoc), Expr.HEADER_BYTES);
    }

    public SourceRange sourceRange() {
        return new SourceRange(lbraceLoc, rbraceLoc);
    }

    public SourceLoc endLoc() {
        return rbraceLoc;
    }

    public void print(StringBuilder out, int indent) {
        out.append(" ".repeat(indent)).append("(brace_stmt");
        for (var element : elements) {
            out.append('\n');
            element.print(out, indent + 2);
        }
        out.append(')');
    }
}
