package com.agriguard.dispute;

import java.util.List;

/**
 * Picks the panel of jurors allowed to vote on a dispute. Implementations must be
 * deterministic: the same registry and seed always give the same panel.
 */
public interface JurorSelector {

    List<String> select(List<String> registry, long seed, int panelSize);
}
