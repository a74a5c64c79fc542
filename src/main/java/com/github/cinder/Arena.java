package com.github.cinder;

import java.util.ArrayList;
import java.util.List;

import com.google.common.base.Preconditions;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

/**
 * Session-scoped bump allocator. Requests are carved from slabs in order and
 * never returned; everything is dropped at once by {@link #release()}.
 */
public class Arena {

    public static final int DEFAULT_SLAB_SIZE = 4096;

    // applies to slabs opened after the change
    @Accessors(fluent = true)
    @Getter
    @Setter
    private int slabSize = DEFAULT_SLAB_SIZE;
    // 0 means unlimited
    @Accessors(fluent = true)
    @Getter
    @Setter
    private long byteLimit;

    @Accessors(fluent = true)
    @Getter
    private long bytesAllocated;

    private final List<Slab> slabs = new ArrayList<>();
    private final List<Object> retained = new ArrayList<>();
    private boolean released;

    public Block allocate(int bytes, int alignment) {
        Preconditions.checkState(!released, "arena used after release");
        Preconditions.checkArgument(bytes >= 0, "negative allocation size %s", bytes);
        Preconditions.checkArgument(alignment > 0 && Integer.bitCount(alignment) == 1,
                "alignment must be a power of two: %s", alignment);

        Slab slab = slabs.isEmpty() ? null : slabs.get(slabs.size() - 1);
        int offset = slab == null ? 0 : align(slab.used, alignment);
        boolean needsSlab = slab == null || (long) offset + bytes > slab.capacity;
        long padding = needsSlab ? 0 : offset - slab.used;

        if (byteLimit > 0 && bytesAllocated + padding + bytes > byteLimit) {
            throw new ArenaExhaustedError("arena limit of " + byteLimit + " bytes exceeded by request of "
                    + bytes + " bytes (" + bytesAllocated + " in use)");
        }

        if (needsSlab) {
            slab = new Slab(Math.max(slabSize, bytes));
            slabs.add(slab);
            offset = 0;
        }
        slab.used = offset + bytes;
        bytesAllocated += padding + bytes;
        return new Block(slabs.size() - 1, offset, bytes);
    }

    /** Keeps {@code object} reachable until the arena is released. */
    public <T> T retain(T object) {
        Preconditions.checkState(!released, "arena used after release");
        retained.add(object);
        return object;
    }

    public int retainedCount() {
        return retained.size();
    }

    public int slabCount() {
        return slabs.size();
    }

    public boolean isReleased() {
        return released;
    }

    public void release() {
        slabs.clear();
        retained.clear();
        released = true;
    }

    private static int align(int offset, int alignment) {
        return (offset + alignment - 1) & -alignment;
    }

    private static final class Slab {
        final int capacity;
        int used;

        Slab(int capacity) {
            this.capacity = capacity;
        }
    }

    public record Block(int slab, int offset, int size) {}
}
