package com.goalguard.core.gate;

import com.goalguard.core.model.DataRef;
import com.goalguard.core.model.TimeSeriesDataset;
import com.goalguard.core.tools.RunTools;

/**
 * Everything a gate may consult besides the artifact itself.
 *
 * @param runId   run under evaluation
 * @param tools   recorded tool access for that run
 * @param dataRef dataset the strategy was backtested on
 * @param dataset timestamp view of that dataset, or null when not loaded
 */
public record GateContext(
    String runId,
    RunTools tools,
    DataRef dataRef,
    TimeSeriesDataset dataset
) {}
