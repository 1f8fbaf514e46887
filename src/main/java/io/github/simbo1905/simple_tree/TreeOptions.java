// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import java.util.Properties;

import static io.github.simbo1905.simple_tree.Tree.LOGGER;

/// Tuning read once from system properties:
/// - `simple.tree.deflateThreshold` size at which a modified deflated tree is deflated again, default 1000
/// - `simple.tree.maxLookupLevel` default depth examined by [Tree#makeTreeDistinct()], default unbounded
public record TreeOptions(int deflateThreshold, int maxLookupLevel) {

  public static final String DEFLATE_THRESHOLD_PROPERTY = "simple.tree.deflateThreshold";
  public static final String MAX_LOOKUP_LEVEL_PROPERTY = "simple.tree.maxLookupLevel";
  public static final int DEFAULT_DEFLATE_THRESHOLD = 1000;
  public static final int DEFAULT_MAX_LOOKUP_LEVEL = Integer.MAX_VALUE;

  private static final TreeOptions CURRENT = load(System.getProperties());

  public TreeOptions {
    if (deflateThreshold < 0) {
      throw new IllegalArgumentException("deflateThreshold must not be negative but was " + deflateThreshold);
    }
    if (maxLookupLevel < 0) {
      throw new IllegalArgumentException("maxLookupLevel must not be negative but was " + maxLookupLevel);
    }
  }

  public static TreeOptions current() {
    return CURRENT;
  }

  static TreeOptions load(Properties properties) {
    final TreeOptions options = new TreeOptions(
        read(properties, DEFLATE_THRESHOLD_PROPERTY, DEFAULT_DEFLATE_THRESHOLD),
        read(properties, MAX_LOOKUP_LEVEL_PROPERTY, DEFAULT_MAX_LOOKUP_LEVEL));
    LOGGER.fine(() -> "Tree options " + options);
    return options;
  }

  private static int read(Properties properties, String name, int defaultValue) {
    final String text = properties.getProperty(name);
    if (text == null) {
      return defaultValue;
    }
    try {
      final int value = Integer.parseInt(text.trim());
      if (value >= 0) {
        return value;
      }
    } catch (NumberFormatException e) {
      LOGGER.warning(() -> "Property " + name + " is not an integer: " + e.getMessage());
      return defaultValue;
    }
    LOGGER.warning(() -> "Property " + name + " must not be negative, using " + defaultValue);
    return defaultValue;
  }
}
