package com.seqdiag.core.layout;

/**
 * One-dimensional layout of measured items.
 *
 * <p>Items are identified by values of type {@code T}; their order is fixed when the layout is
 * created. Measured dimensions are applied one by one, then {@link #compute()} produces the
 * positions.
 *
 * @param <T> item identifier type
 * @see TypedConstraintLayout
 */
public interface ConstraintLayout<T> {

    /**
     * Records the measured dimension of an item, replacing any earlier value.
     *
     * @param id item identifier
     * @param dimension measured extent along the layout axis, non-negative
     * @throws IllegalArgumentException if the item is unknown or the dimension is negative
     */
    void applyDimension(T id, double dimension);

    /**
     * Computes item positions from the dimensions applied so far.
     *
     * <p>Items without an applied dimension are laid out with a dimension of zero. Calling this
     * method does not change the layout's state.
     *
     * @return the computed layout
     */
    ComputedLayout<T> compute();
}
