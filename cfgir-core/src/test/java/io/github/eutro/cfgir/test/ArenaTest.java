package io.github.eutro.cfgir.test;

import io.github.eutro.cfgir.InvalidPointerException;
import io.github.eutro.cfgir.arena.Arena;
import io.github.eutro.cfgir.arena.Ptr;
import io.github.eutro.cfgir.ir.Block;
import io.github.eutro.cfgir.ir.IrContext;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

public class ArenaTest {
    @Test
    void testAllocDeref() {
        Arena<String> arena = new Arena<>("string");
        Ptr<String> a = arena.allocWith(p -> "a");
        Ptr<String> b = arena.allocWith(p -> "b");
        assertNotEquals(a, b);
        assertEquals("a", arena.deref(a));
        assertEquals("b", arena.deref(b));
        assertEquals(2, arena.size());
    }

    @Test
    void testDoubleDealloc() {
        Arena<String> arena = new Arena<>("string");
        Ptr<String> a = arena.allocWith(p -> "a");
        assertEquals(Optional.of("a"), arena.tryDealloc(a));
        assertEquals(Optional.empty(), arena.tryDealloc(a));
        assertEquals(Optional.empty(), arena.tryDealloc(a));
        assertEquals(0, arena.size());
        assertFalse(arena.isValid(a));
        assertNull(arena.tryDeref(a));
    }

    @Test
    void testStalePointerAfterReuse() {
        Arena<String> arena = new Arena<>("string");
        Ptr<String> a = arena.allocWith(p -> "a");
        arena.tryDealloc(a);
        Ptr<String> b = arena.allocWith(p -> "b");

        assertEquals(a.index(), b.index());
        assertNotEquals(a, b);
        assertEquals("b", arena.deref(b));
        InvalidPointerException e = assertThrows(InvalidPointerException.class, () -> arena.deref(a));
        assertTrue(e.getMessage().contains("string"));
        assertEquals(Optional.empty(), arena.tryDealloc(a));
        assertTrue(arena.isValid(b));
    }

    @Test
    void testInitializerSeesOwnPointer() {
        Arena<Object> arena = new Arena<>("object");
        AtomicReference<Ptr<Object>> seen = new AtomicReference<>();
        Ptr<Object> ptr = arena.allocWith(p -> {
            seen.set(p);
            return new Object();
        });
        assertEquals(ptr, seen.get());
    }

    @Test
    void testInitializerThrowReleasesSlot() {
        Arena<String> arena = new Arena<>("string");
        AtomicReference<Ptr<String>> seen = new AtomicReference<>();
        assertThrows(IllegalStateException.class, () -> arena.allocWith(p -> {
            seen.set(p);
            throw new IllegalStateException("boom");
        }));
        assertEquals(0, arena.size());
        assertFalse(arena.isValid(seen.get()));

        Ptr<String> next = arena.allocWith(p -> "next");
        assertEquals(seen.get().index(), next.index());
        assertNotEquals(seen.get(), next);
    }

    @Test
    void testStaleHandle() {
        IrContext ctx = new IrContext();
        Block bb = Block.create(ctx);
        assertTrue(bb.dealloc(ctx));
        assertFalse(bb.dealloc(ctx));
        assertFalse(bb.isValid(ctx));

        Block reused = Block.create(ctx);
        assertEquals(bb.index(), reused.index());
        assertNotEquals(bb, reused);
        assertThrows(InvalidPointerException.class, () -> bb.successors(ctx));
        assertTrue(reused.successors(ctx).isEmpty());
    }
}
