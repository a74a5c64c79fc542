package com.github.cinder.ast;

import java.util.List;

import com.github.cinder.ast.ValueDecl.VarDecl;
import com.github.cinder.source.SourceLoc;
import com.github.cinder.source.SourceRange;
import com.google.common.collect.ImmutableList;

/**
 * Parameter clause of a function expression.
 */
public sealed interface Pattern {

    SourceRange sourceRange();

    record NamedPattern(VarDecl decl) implements Pattern {
        public SourceRange sourceRange() {
            return new SourceRange(decl.loc());
        }
    }

    record TuplePattern(SourceLoc lparenLoc, ImmutableList<Pattern> elements, SourceLoc rparenLoc) implements Pattern {
        public TuplePattern(SourceLoc lparenLoc, List<Pattern> elements, SourceLoc rparenLoc) {
            this(lparenLoc, ImmutableList.copyOf(elements), rparenLoc);
        }

        public SourceRange sourceRange() {
            return new SourceRange(lparenLoc, rparenLoc);
        }
    }
}
