package io.github.eutro.cfgir.test;

import io.github.eutro.cfgir.ir.Block;
import io.github.eutro.cfgir.ir.Func;
import io.github.eutro.cfgir.ir.IRBuilder;
import io.github.eutro.cfgir.ir.Inst;
import io.github.eutro.cfgir.ir.IrContext;
import io.github.eutro.cfgir.util.GraphWalker;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class GraphWalkerTest {
    static Map<Integer, List<Integer>> graph(int[]... edges) {
        Map<Integer, List<Integer>> g = new HashMap<>();
        for (int[] edge : edges) {
            g.computeIfAbsent(edge[0], $ -> new ArrayList<>()).add(edge[1]);
        }
        return g;
    }

    @Test
    void testOrders() {
        // 0 -> 1, 2; 1 -> 3; 2 -> 3; 3 -> 0
        Map<Integer, List<Integer>> g = graph(
                new int[]{0, 1}, new int[]{0, 2},
                new int[]{1, 3}, new int[]{2, 3},
                new int[]{3, 0});
        GraphWalker<Integer> walker = new GraphWalker<Integer>(0, $ -> g.getOrDefault($, Collections.emptyList()));

        assertEquals(Arrays.asList(0, 2, 3, 1), walker.preOrder().toList());
        assertEquals(Arrays.asList(3, 2, 1, 0), walker.postOrder().toList());
        // orders can be walked more than once
        assertEquals(walker.preOrder().toList(), walker.preOrder().toList());
    }

    @Test
    void testExhausted() {
        GraphWalker<Integer> walker = new GraphWalker<Integer>(0, $ -> Collections.emptyList());
        Iterator<Integer> it = walker.postOrder().iterator();
        assertEquals(0, it.next());
        assertFalse(it.hasNext());
        assertThrows(NoSuchElementException.class, it::next);
    }

    @Test
    void testBlockWalker() {
        IrContext ctx = new IrContext();
        Func func = Func.create(ctx, "f");
        IRBuilder ib = new IRBuilder(ctx, func);
        Block entry = ib.getBlock();
        Block body = ib.newBlock();
        Block exit = ib.newBlock();
        ib.br(body);
        ib.setBlock(body);
        ib.brCond(ib.insert(Inst.arg(ctx, 0)), body, exit);
        ib.setBlock(exit);
        ib.ret();

        List<Block> post = GraphWalker.blockWalker(ctx, entry).postOrder().toList();
        assertEquals(Arrays.asList(exit, body, entry), post);
    }
}
