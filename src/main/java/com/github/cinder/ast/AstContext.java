package com.github.cinder.ast;

import java.util.List;

import com.github.cinder.Arena;
import com.github.cinder.ConfigReader;
import com.github.cinder.types.Type;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * A compilation session. Owns the arena every node, declaration and candidate
 * list is carved from, and the table of interned types. Nodes never outlive
 * their context and never reference nodes of another context.
 *
 * <p>Not thread-safe: one writer per context. Independent contexts may be used
 * from different threads.
 */
public class AstContext implements ConfigReader.ConfigTarget, AutoCloseable {

    static final int POINTER_BYTES = 8;
    static final int INT_BYTES = 4;

    @Accessors(fluent = true)
    @Getter
    private final Arena arena = new Arena();
    @Accessors(fluent = true)
    @Getter
    private final Type.Table types = new Type.Table();

    public static AstContext fromConfig(ConfigReader.Config config) {
        var ctx = new AstContext();
        config.applyConfig(ctx);
        return ctx;
    }

    @Override
    public void setSlabSize(int slabSize) {
        arena.slabSize(slabSize);
    }

    @Override
    public void setByteLimit(long byteLimit) {
        arena.byteLimit(byteLimit);
    }

    <T> T allocate(T object, int bytes) {
        arena.allocate(bytes, Expr.ALIGNMENT);
        return arena.retain(object);
    }

    <E extends Expr> E allocateExpr(E node, int trailingBytes) {
        return allocate(node, Expr.HEADER_BYTES + trailingBytes);
    }

    /** Copies {@code elements} into arena-accounted storage, preserving order. */
    public <T> ImmutableList<T> allocateCopy(List<? extends T> elements) {
        arena.allocate(elements.size() * POINTER_BYTES, Expr.ALIGNMENT);
        return arena.retain(ImmutableList.copyOf(elements));
    }

    public ImmutableIntArray allocateCopy(int[] values) {
        arena.allocate(values.length * INT_BYTES, INT_BYTES);
        return arena.retain(ImmutableIntArray.copyOf(values));
    }

    void adopt(Expr child) {
        Preconditions.checkArgument(child == null || child.context() == this,
                "%s belongs to a different context", child == null ? null : child.kind());
    }

    void adopt(ValueDecl decl) {
        Preconditions.checkArgument(decl == null || decl.context() == this,
                "declaration %s belongs to a different context", decl == null ? null : decl.name());
    }

    public long bytesAllocated() {
        return arena.bytesAllocated();
    }

    public int allocationCount() {
        return arena.retainedCount();
    }

    public boolean isClosed() {
        return arena.isReleased();
    }

    @Override
    public void close() {
        arena.release();
    }
}
