package com.github.cinder.ast;

import com.github.cinder.source.SourceLoc;
import com.github.cinder.types.Type;
import com.google.common.base.Preconditions;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Declaration handle referenced by expressions. Expressions only ask for the
 * name, the type of a reference to it, and whether it is an instance member.
 */
@Accessors(fluent = true)
public abstract sealed class ValueDecl {

    static final int DECL_BYTES = 40;

    @Getter
    private final AstContext context;
    @Getter
    private final String name;
    @Getter
    private final SourceLoc loc;
    @Getter
    @Setter
    private Type type;
    private final boolean instanceMember;

    ValueDecl(AstContext context, String name, SourceLoc loc, Type type, boolean instanceMember) {
        this.context = Preconditions.checkNotNull(context);
        this.name = Preconditions.checkNotNull(name);
        this.loc = Preconditions.checkNotNull(loc);
        this.type = type;
        this.instanceMember = instanceMember;
    }

    public Type typeOfReference() {
        return type;
    }

    public boolean isInstanceMember() {
        return instanceMember;
    }

    abstract String tag();

    public void print(StringBuilder out, int indent) {
        out.append(" ".repeat(indent))
                .append('(').append(tag())
                .append(" name='").append(name)
                .append("' type='").append(type == null ? "" : type)
                .append("')");
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        print(sb, 0);
        return sb.toString();
    }

    public static final class FuncDecl extends ValueDecl {
        private FuncDecl(AstContext context, String name, SourceLoc loc, Type type, boolean instanceMember) {
            super(context, name, loc, type, instanceMember);
        }

        public static FuncDecl create(AstContext ctx, String name, SourceLoc loc, Type type, boolean instanceMember) {
            return ctx.allocate(new FuncDecl(ctx, name, loc, type, instanceMember), DECL_BYTES);
        }

        @Override
        String tag() {
            return "func_decl";
        }
    }

    public static final class VarDecl extends ValueDecl {
        private VarDecl(AstContext context, String name, SourceLoc loc, Type type, boolean instanceMember) {
            super(context, name, loc, type, instanceMember);
        }

        public static VarDecl create(AstContext ctx, String name, SourceLoc loc, Type type, boolean instanceMember) {
            return ctx.allocate(new VarDecl(ctx, name, loc, type, instanceMember), DECL_BYTES);
        }

        @Override
        String tag() {
            return "var_decl";
        }
    }

    @Accessors(fluent = true)
    public static final class SubscriptDecl extends ValueDecl {
        @Getter
        private final Type elementType;

        private SubscriptDecl(AstContext context, SourceLoc loc, Type indicesType, Type elementType) {
            super(context, "subscript", loc,
                    indicesType == null || elementType == null ? null : context.types().function(indicesType, elementType),
                    true);
            this.elementType = elementType;
        }

        public static SubscriptDecl create(AstContext ctx, SourceLoc loc, Type indicesType, Type elementType) {
            return ctx.allocate(new SubscriptDecl(ctx, loc, indicesType, elementType), DECL_BYTES);
        }

        @Override
        String tag() {
            return "subscript_decl";
        }
    }
}
