package com.github.cinder;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.github.cinder.Arena.Block;

public class ArenaTest {

    @Test
    public void testAlignedBumpAllocation() {
        var arena = new Arena();
        assertEquals(new Block(0, 0, 10), arena.allocate(10, 8));
        assertEquals(new Block(0, 16, 4), arena.allocate(4, 8));
        assertEquals(new Block(0, 20, 2), arena.allocate(2, 2));
        assertEquals(22, arena.bytesAllocated());
        assertEquals(1, arena.slabCount());
    }

    @Test
    public void testOpensNewSlabWhenFull() {
        var arena = new Arena().slabSize(32);
        arena.allocate(24, 8);
        assertEquals(new Block(1, 0, 16), arena.allocate(16, 8));
        assertEquals(2, arena.slabCount());
        assertEquals(40, arena.bytesAllocated());
    }

    @Test
    public void testOversizedRequestGetsItsOwnSlab() {
        var arena = new Arena().slabSize(16);
        assertEquals(new Block(0, 0, 100), arena.allocate(100, 8));
        assertEquals(new Block(1, 0, 8), arena.allocate(8, 8));
    }

    @Test
    public void testByteLimit() {
        var arena = new Arena().byteLimit(64);
        arena.allocate(60, 8);
        var e = assertThrows(ArenaExhaustedError.class, () -> arena.allocate(8, 8));
        assertTrue(e.getMessage().contains("64"));
        assertEquals(60, arena.bytesAllocated());
    }

    @Test
    public void testRetainAndRelease() {
        var arena = new Arena();
        var s = "kept";
        assertEquals(s, arena.retain(s));
        assertEquals(1, arena.retainedCount());

        arena.release();
        assertTrue(arena.isReleased());
        assertEquals(0, arena.retainedCount());
        assertThrows(IllegalStateException.class, () -> arena.allocate(8, 8));
    }

    @Test
    public void testRejectsBadRequests() {
        var arena = new Arena();
        assertThrows(IllegalArgumentException.class, () -> arena.allocate(8, 3));
        assertThrows(IllegalArgumentException.class, () -> arena.allocate(-1, 8));
    }
}
