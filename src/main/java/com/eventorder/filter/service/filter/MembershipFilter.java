package com.eventorder.filter.service.filter;

/**
 * Probabilistic set: no false negatives, tunable false positives.
 *
 * @param <T> the element type
 */
public interface MembershipFilter<T> {

    /**
     * Adds an item. Items cannot be removed.
     *
     * @param item the item to add
     */
    void add(T item);

    /**
     * Checks whether the item may have been added.
     *
     * @param item the item to check
     * @return false if the item was definitely never added
     */
    boolean contains(T item);

    /**
     * Gets the fraction of set bits, e.g. 1 set bit in a 10 bit filter is 0.1.
     *
     * @return fill ratio between 0 and 1
     */
    double truthiness();
}
