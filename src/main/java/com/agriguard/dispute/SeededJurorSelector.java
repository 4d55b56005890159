package com.agriguard.dispute;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Shuffles the whole registry with a PRNG seeded from the dispute id and round,
 * then takes the first {@code panelSize} addresses. The registry is passed in
 * registration order so the result depends only on stored data and the seed.
 */
public class SeededJurorSelector implements JurorSelector {

    @Override
    public List<String> select(List<String> registry, long seed, int panelSize) {
        if (panelSize <= 0 || registry.isEmpty()) {
            return List.of();
        }
        List<String> candidates = new ArrayList<>(registry);
        Collections.shuffle(candidates, new Random(seed));
        return List.copyOf(candidates.subList(0, Math.min(panelSize, candidates.size())));
    }
}
