package com.gentoro.analytics.config;

import com.gentoro.analytics.drilldown.DrillPath;
import com.gentoro.analytics.exception.ConfigurationException;
import org.apache.commons.configuration2.Configuration;

/**
 * Typed view over the {@code drilldown.*} configuration keys.
 *
 * @param parallelLevels aggregate drill levels concurrently on the service executor
 * @param maxDepth longest accepted drill path
 */
public record DrillDownSettings(boolean parallelLevels, int maxDepth) {
  public static final int DEFAULT_MAX_DEPTH = 8;

  public DrillDownSettings {
    if (maxDepth < DrillPath.MIN_LENGTH) {
      throw new ConfigurationException(
          "drilldown.max-depth must be at least " + DrillPath.MIN_LENGTH + ", got " + maxDepth);
    }
  }

  public static DrillDownSettings defaults() {
    return new DrillDownSettings(false, DEFAULT_MAX_DEPTH);
  }

  public static DrillDownSettings from(Configuration config) {
    if (config == null) {
      return defaults();
    }
    try {
      return new DrillDownSettings(
          config.getBoolean("drilldown.parallel-levels", false),
          config.getInt("drilldown.max-depth", DEFAULT_MAX_DEPTH));
    } catch (org.apache.commons.configuration2.ex.ConversionException e) {
      throw new ConfigurationException("Invalid drilldown configuration: " + e.getMessage(), e);
    }
  }
}
