package com.lastchair.model;

import java.util.List;

/**
 * A player's opened choice for one round: the chair they sat on and the three chairs they trapped.
 */
public record RevealedChoice(int chair, int trap1, int trap2, int trap3) {

    public List<Integer> traps() {
        return List.of(trap1, trap2, trap3);
    }

    public boolean traps(int position) {
        return trap1 == position || trap2 == position || trap3 == position;
    }
}
