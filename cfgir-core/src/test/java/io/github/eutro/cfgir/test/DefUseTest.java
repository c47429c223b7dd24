package io.github.eutro.cfgir.test;

import io.github.eutro.cfgir.InvalidPointerException;
import io.github.eutro.cfgir.InvariantViolationException;
import io.github.eutro.cfgir.StructuralPreconditionException;
import io.github.eutro.cfgir.ir.*;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class DefUseTest {
    @Test
    void testUsersRegistered() {
        IrContext ctx = new IrContext();
        Block b0 = Block.create(ctx);
        Block b1 = Block.create(ctx);
        Inst x = Inst.constant(ctx, 1);
        Inst y = Inst.constant(ctx, 2);
        Inst phi = Inst.phi(ctx, Arrays.asList(b0, b1), Arrays.asList(x, y));
        Inst ret = Inst.ret(ctx, phi);

        assertEquals(Collections.singleton(User.<Inst>of(phi, 0)), x.users(ctx));
        assertEquals(Collections.singleton(User.<Inst>of(phi, 1)), y.users(ctx));
        assertEquals(Collections.singleton(User.<Block>of(phi, 0)), b0.users(ctx));
        assertEquals(Collections.singleton(User.<Block>of(phi, 1)), b1.users(ctx));
        assertEquals(Collections.singleton(User.<Inst>of(ret, 0)), phi.users(ctx));
        assertTrue(ret.users(ctx).isEmpty());
        assertEquals(InstKind.OTHER, phi.kind(ctx));
    }

    @Test
    void testPhiArity() {
        IrContext ctx = new IrContext();
        Block b0 = Block.create(ctx);
        Inst x = Inst.constant(ctx, 1);
        assertThrows(StructuralPreconditionException.class,
                () -> Inst.phi(ctx, Collections.singletonList(b0), Arrays.asList(x, x)));
        assertTrue(x.users(ctx).isEmpty());
        assertEquals(1, ctx.liveInsts());
    }

    @Test
    void testDeadOperand() {
        IrContext ctx = new IrContext();
        Inst x = Inst.constant(ctx, 1);
        x.remove(ctx);
        assertThrows(InvalidPointerException.class, () -> Inst.ret(ctx, x));
        assertEquals(0, ctx.liveInsts());
    }

    @Test
    void testSetOperands() {
        IrContext ctx = new IrContext();
        Block t = Block.create(ctx);
        Block u = Block.create(ctx);
        Inst x = Inst.constant(ctx, 1);
        Inst y = Inst.constant(ctx, 2);
        Inst phi = Inst.phi(ctx, Collections.singletonList(t), Collections.singletonList(x));

        phi.setArg(ctx, 0, y);
        assertTrue(x.users(ctx).isEmpty());
        assertEquals(Collections.singleton(User.<Inst>of(phi, 0)), y.users(ctx));
        assertEquals(y, phi.argAt(ctx, 0));

        phi.setTarget(ctx, 0, u);
        assertTrue(t.users(ctx).isEmpty());
        assertEquals(Collections.singleton(User.<Block>of(phi, 0)), u.users(ctx));
        assertEquals(u, phi.target(ctx, 0));
    }

    @Test
    void testReplaceValue() {
        IrContext ctx = new IrContext();
        Block b = Block.create(ctx);
        Inst x = Inst.constant(ctx, 1);
        Inst y = Inst.constant(ctx, 2);
        Inst ret = Inst.ret(ctx, x);
        b.append(ctx, x);
        b.append(ctx, y);
        b.append(ctx, ret);

        x.replaceAllUsesWith(ctx, y);
        assertFalse(x.hasUsers(ctx));
        assertEquals(y, ret.argAt(ctx, 0));

        b.removeInstruction(ctx, x);
        assertFalse(x.isValid(ctx));
        assertEquals("return %v" + y.index(), ret.display(ctx));
    }

    @Test
    void testReplaceBlock() {
        IrContext ctx = new IrContext();
        ctx.setVerifying(true);
        Block b = Block.create(ctx);
        Block t = Block.create(ctx);
        Block u = Block.create(ctx);
        Block v = Block.create(ctx);
        Inst cond = Inst.arg(ctx, 0);
        b.append(ctx, cond);
        Inst c = Inst.brCond(ctx, cond, t, u);
        b.append(ctx, c);
        b.addSuccessor(ctx, t, c, true);
        b.addSuccessor(ctx, u, c, false);

        t.replaceAllUsesWith(ctx, v);
        assertEquals(Arrays.asList(v, u), c.targets(ctx));
        assertEquals(new HashSet<>(Arrays.asList(
                new BlockEdge(v, c, true),
                new BlockEdge(u, c, false))), b.successors(ctx));
        assertTrue(t.users(ctx).isEmpty());
        assertEquals(Collections.singleton(User.<Block>of(c, 0)), v.users(ctx));

        u.replaceAllUsesWith(ctx, v);
        assertEquals(Arrays.asList(v, v), c.targets(ctx));
        assertEquals(2, b.successors(ctx).size());
        assertEquals(Collections.singletonList(v), b.successorBlocks(ctx));
    }

    @Test
    void testRemoveUsed() {
        IrContext ctx = new IrContext();
        Inst x = Inst.constant(ctx, 1);
        Inst ret = Inst.ret(ctx, x);

        assertThrows(InvariantViolationException.class, () -> x.remove(ctx));
        assertTrue(x.isValid(ctx));

        ret.remove(ctx);
        x.remove(ctx);
        assertEquals(0, ctx.liveInsts());
    }

    @Test
    void testTrackCreations() {
        boolean old = IrContext.TRACK_INST_CREATIONS;
        IrContext.TRACK_INST_CREATIONS = true;
        try {
            IrContext ctx = new IrContext();
            Inst x = Inst.constant(ctx, 1);
            assertNotNull(x.created(ctx));
        } finally {
            IrContext.TRACK_INST_CREATIONS = old;
        }
        IrContext ctx = new IrContext();
        if (!old) assertNull(Inst.constant(ctx, 1).created(ctx));
    }
}
