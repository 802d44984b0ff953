package io.intellixity.nestplan.planner;

import io.intellixity.nestplan.mutation.ActionMarkers;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * Planner configuration.
 *
 * @param markerKey name of the verb marker field on relation values
 * @param maxDepth maximum payload nesting depth accepted; 0 disables the bound
 */
public record PlannerSettings(String markerKey, int maxDepth) {
  public static final String RESOURCE = "nestplan.properties";
  public static final String MARKER_KEY = "nestplan.marker-key";
  public static final String MAX_DEPTH = "nestplan.max-depth";
  public static final int DEFAULT_MAX_DEPTH = 64;

  public PlannerSettings {
    markerKey = (markerKey == null || markerKey.isBlank()) ? ActionMarkers.DEFAULT_MARKER_KEY : markerKey.trim();
    if (maxDepth < 0) throw new IllegalArgumentException(MAX_DEPTH + " must be >= 0: " + maxDepth);
  }

  public static PlannerSettings defaults() {
    return new PlannerSettings(ActionMarkers.DEFAULT_MARKER_KEY, DEFAULT_MAX_DEPTH);
  }

  public static PlannerSettings fromProperties(Properties p) {
    if (p == null) return defaults();
    String marker = p.getProperty(MARKER_KEY);
    String depth = p.getProperty(MAX_DEPTH);
    int maxDepth = DEFAULT_MAX_DEPTH;
    if (depth != null && !depth.isBlank()) {
      try {
        maxDepth = Integer.parseInt(depth.trim());
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException(MAX_DEPTH + " is not a number: " + depth, e);
      }
    }
    return new PlannerSettings(marker, maxDepth);
  }

  /** Reads {@value #RESOURCE} from the classpath, or returns {@link #defaults()} when absent. */
  public static PlannerSettings load() {
    return load(Thread.currentThread().getContextClassLoader());
  }

  public static PlannerSettings load(ClassLoader cl) {
    ClassLoader loader = (cl != null) ? cl : PlannerSettings.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
      if (in == null) return defaults();
      Properties p = new Properties();
      p.load(in);
      return fromProperties(p);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + RESOURCE, e);
    }
  }
}
