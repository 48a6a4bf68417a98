package com.gentoro.analytics.request;

import com.gentoro.analytics.drilldown.DrillTree;
import com.gentoro.analytics.model.Dataset;

/** Scoped and filtered flat table together with the drill-down tree computed from it. */
public record DrillDownResult(Dataset table, DrillTree tree) {}
