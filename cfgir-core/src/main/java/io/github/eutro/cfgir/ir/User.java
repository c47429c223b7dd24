package io.github.eutro.cfgir.ir;

import java.util.Objects;

/**
 * A use of an entity of type {@code E}: a specific operand slot of a specific instruction.
 * <p>
 * For {@code User<Block>} the slot indexes the instruction's {@link Inst#targets(IrContext) targets},
 * for {@code User<Inst>} it indexes its {@link Inst#args(IrContext) arguments}.
 *
 * @param <E> The type of the entity being used.
 */
public final class User<E> {
    private final Inst inst;
    private final int slot;

    private User(Inst inst, int slot) {
        this.inst = inst;
        this.slot = slot;
    }

    public static <E> User<E> of(Inst inst, int slot) {
        return new User<>(inst, slot);
    }

    public Inst inst() {
        return inst;
    }

    public int slot() {
        return slot;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        User<?> user = (User<?>) o;
        return slot == user.slot && inst.equals(user.inst);
    }

    @Override
    public int hashCode() {
        return Objects.hash(inst, slot);
    }

    @Override
    public String toString() {
        return inst + "[" + slot + "]";
    }
}
