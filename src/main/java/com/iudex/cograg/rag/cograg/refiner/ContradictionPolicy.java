package com.iudex.cograg.rag.cograg.refiner;

import java.util.List;

/**
 * Decides whether two evidence texts contradict each other.
 *
 * <p>Implementations must be symmetric: {@code signals(a, b)} and {@code signals(b, a)} return
 * the same labels in the same order.</p>
 */
public interface ContradictionPolicy {

    /**
     * Labels of the contradiction signals found between the two texts; empty when none.
     */
    List<String> signals(String first, String second);

    default boolean conflicts(String first, String second) {
        return !this.signals(first, second).isEmpty();
    }
}
