package io.github.eutro.cfgir.util;

import io.github.eutro.cfgir.InvariantViolationException;
import io.github.eutro.cfgir.ir.*;
import io.github.eutro.cfgir.list.LinkedListContainer;
import io.github.eutro.cfgir.list.LinkedListNode;

import java.util.*;

/**
 * Checks the structural invariants of the IR, throwing {@link InvariantViolationException} on the first one broken.
 * <p>
 * When {@link IrContext#isVerifying()} is set, blocks are verified after every
 * successor or instruction mutation.
 */
public class IrVerifier {
    private IrVerifier() {
    }

    /**
     * Check that {@code container}'s list is well-formed: walking forwards and backwards agree,
     * every node names this container, and no node appears twice.
     *
     * @param ctx       The context.
     * @param container The container.
     * @param <X>       The type of the context.
     * @param <N>       The type of the nodes.
     * @param <C>       The type of the container.
     */
    public static <X, N extends LinkedListNode<X, N, C>, C extends LinkedListContainer<X, N, C>>
    void verifyList(X ctx, C container) {
        List<N> forward = new ArrayList<>();
        Set<N> seen = new HashSet<>();
        N prev = null;
        for (N node = container.head(ctx); node != null; node = node.next(ctx)) {
            if (!seen.add(node)) {
                throw new InvariantViolationException(node + " appears twice in " + container);
            }
            if (!container.equals(node.container(ctx))) {
                throw new InvariantViolationException(node + " in " + container
                        + " claims to be in " + node.container(ctx));
            }
            if (!Objects.equals(prev, node.prev(ctx))) {
                throw new InvariantViolationException(node + " in " + container
                        + " has prev " + node.prev(ctx) + ", expected " + prev);
            }
            forward.add(node);
            prev = node;
        }
        if (!Objects.equals(prev, container.tail(ctx))) {
            throw new InvariantViolationException(container + " has tail " + container.tail(ctx)
                    + ", expected " + prev);
        }
        List<N> backward = new ArrayList<>();
        for (N node = container.tail(ctx); node != null && backward.size() <= forward.size(); node = node.prev(ctx)) {
            backward.add(node);
        }
        Collections.reverse(backward);
        if (!forward.equals(backward)) {
            throw new InvariantViolationException(container + " walks forward as " + forward
                    + " but backward as " + backward);
        }
    }

    /**
     * Check the instruction list of a block, and that each of its edges is
     * backed by a branch in the block that jumps to the edge's target on the edge's arm.
     *
     * @param ctx   The context.
     * @param block The block.
     */
    public static void verifyBlock(IrContext ctx, Block block) {
        verifyList(ctx, block);
        for (BlockEdge edge : block.successors(ctx)) {
            Inst terminator = edge.terminator();
            if (!terminator.isValid(ctx) || !block.contains(ctx, terminator)) {
                throw new InvariantViolationException(block.name(ctx) + " has edge " + edge
                        + " whose terminator is not in the block");
            }
            InstKind kind = terminator.kind(ctx);
            if (kind == InstKind.OTHER) {
                throw new InvariantViolationException(block.name(ctx) + " has edge " + edge
                        + " from a non-branch " + terminator.display(ctx));
            }
            if (kind == InstKind.BR && edge.isTrueArm()) {
                throw new InvariantViolationException(block.name(ctx) + " has a true-arm edge " + edge
                        + " from an unconditional jump");
            }
            Block target = terminator.target(ctx, kind.targetSlot(edge.isTrueArm()));
            if (!target.equals(edge.target())) {
                throw new InvariantViolationException(block.name(ctx) + " has edge " + edge
                        + " but " + terminator.display(ctx) + " jumps to " + target.name(ctx));
            }
        }
    }

    /**
     * Check the block list of a function.
     *
     * @param ctx  The context.
     * @param func The function.
     */
    public static void verifyBlockList(IrContext ctx, Func func) {
        verifyList(ctx, func);
    }

    /**
     * Check every invariant of a function: its block list, every block, that every branch has
     * exactly as many edges as it has arms, and that the users of each of its blocks and instructions
     * are exactly the operand slots that refer to them from within the function.
     *
     * @param ctx  The context.
     * @param func The function.
     */
    public static void verifyFunction(IrContext ctx, Func func) {
        verifyBlockList(ctx, func);

        Map<Block, Set<User<Block>>> blockUsers = new HashMap<>();
        Map<Inst, Set<User<Inst>>> instUsers = new HashMap<>();
        for (Block block : func.blocks(ctx)) {
            verifyBlock(ctx, block);

            Map<Inst, Integer> edgeCounts = new HashMap<>();
            for (BlockEdge edge : block.successors(ctx)) {
                edgeCounts.merge(edge.terminator(), 1, Integer::sum);
            }
            for (Inst inst : block.iter(ctx)) {
                int expected = inst.kind(ctx).edgeCount;
                int actual = edgeCounts.getOrDefault(inst, 0);
                if (actual != expected) {
                    throw new InvariantViolationException(block.name(ctx) + " has " + actual
                            + " edges for " + inst.display(ctx) + ", expected " + expected);
                }

                List<Inst> args = inst.args(ctx);
                for (int i = 0; i < args.size(); i++) {
                    instUsers.computeIfAbsent(args.get(i), $ -> new HashSet<>()).add(User.of(inst, i));
                }
                List<Block> targets = inst.targets(ctx);
                for (int i = 0; i < targets.size(); i++) {
                    blockUsers.computeIfAbsent(targets.get(i), $ -> new HashSet<>()).add(User.of(inst, i));
                }
            }
        }

        for (Block block : func.blocks(ctx)) {
            Set<User<Block>> expected = blockUsers.getOrDefault(block, Collections.emptySet());
            if (!expected.equals(block.users(ctx))) {
                throw new InvariantViolationException(block.name(ctx) + " has users " + block.users(ctx)
                        + ", expected " + expected);
            }
            for (Inst inst : block.iter(ctx)) {
                Set<User<Inst>> expectedUsers = instUsers.getOrDefault(inst, Collections.emptySet());
                if (!expectedUsers.equals(inst.users(ctx))) {
                    throw new InvariantViolationException(inst.name(ctx) + " has users " + inst.users(ctx)
                            + ", expected " + expectedUsers);
                }
            }
        }
    }
}
