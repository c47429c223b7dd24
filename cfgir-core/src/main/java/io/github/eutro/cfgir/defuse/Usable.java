package io.github.eutro.cfgir.defuse;

import java.util.Set;

/**
 * An entity that can be referenced from operand positions elsewhere in the IR,
 * and which keeps track of exactly those positions.
 * <p>
 * Whoever creates a reference to a usable entity must {@link #insertUser(Object, Object) register}
 * a matching user on it, and whoever replaces or deletes that reference must
 * {@link #removeUser(Object, Object) remove} it again. In exchange, finding or redirecting
 * every reference costs only as much as there are references.
 *
 * @param <X> The type of the context the entity lives in.
 * @param <U> The type of user records, naming a specific operand position.
 */
public interface Usable<X, U> {
    /**
     * Get the current users of this entity.
     *
     * @param ctx The context.
     * @return A snapshot of the users, which is unaffected by later changes.
     */
    Set<U> users(X ctx);

    void insertUser(X ctx, U user);

    void removeUser(X ctx, U user);

    /**
     * Check whether anything still references this entity.
     *
     * @param ctx The context.
     * @return Whether there are any users.
     */
    default boolean hasUsers(X ctx) {
        return !users(ctx).isEmpty();
    }
}
