package io.intellixity.objectql.validation;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URL;
import java.util.Objects;
import java.util.Properties;

/**
 * Recursion guards for the validator.
 *
 * <p>Can be loaded from {@code META-INF/objectql.properties} on the classpath:</p>
 * <pre>
 * objectql.validator.maxJoinDepth=8
 * objectql.validator.maxExpressionDepth=64
 * </pre>
 *
 * @param maxJoinDepth how many subquery levels joins may nest (the root query is level 0)
 * @param maxExpressionDepth how deep filter and selection trees may nest
 */
public record ValidatorOptions(int maxJoinDepth, int maxExpressionDepth) {
  public static final String RESOURCE = "META-INF/objectql.properties";
  public static final String MAX_JOIN_DEPTH = "objectql.validator.maxJoinDepth";
  public static final String MAX_EXPRESSION_DEPTH = "objectql.validator.maxExpressionDepth";

  public static final int DEFAULT_MAX_JOIN_DEPTH = 8;
  public static final int DEFAULT_MAX_EXPRESSION_DEPTH = 64;

  public ValidatorOptions {
    if (maxJoinDepth <= 0) throw new IllegalArgumentException("maxJoinDepth must be > 0");
    if (maxExpressionDepth <= 0) throw new IllegalArgumentException("maxExpressionDepth must be > 0");
  }

  public static ValidatorOptions defaults() {
    return new ValidatorOptions(DEFAULT_MAX_JOIN_DEPTH, DEFAULT_MAX_EXPRESSION_DEPTH);
  }

  public ValidatorOptions withMaxJoinDepth(int depth) { return new ValidatorOptions(depth, maxExpressionDepth); }
  public ValidatorOptions withMaxExpressionDepth(int depth) { return new ValidatorOptions(maxJoinDepth, depth); }

  /** Missing keys fall back to the defaults. */
  public static ValidatorOptions fromProperties(Properties p) {
    Objects.requireNonNull(p, "p");
    return new ValidatorOptions(
        intProperty(p, MAX_JOIN_DEPTH, DEFAULT_MAX_JOIN_DEPTH),
        intProperty(p, MAX_EXPRESSION_DEPTH, DEFAULT_MAX_EXPRESSION_DEPTH));
  }

  public static ValidatorOptions load() {
    return load(Thread.currentThread().getContextClassLoader(), RESOURCE);
  }

  /** Defaults when the resource is not on the classpath. */
  public static ValidatorOptions load(ClassLoader cl, String resource) {
    Objects.requireNonNull(resource, "resource");
    if (cl == null) cl = ValidatorOptions.class.getClassLoader();
    URL url = cl.getResource(resource);
    if (url == null) return defaults();
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to load " + resource + " from " + url, e);
    }
    return fromProperties(p);
  }

  private static int intProperty(Properties p, String key, int def) {
    String v = p.getProperty(key);
    if (v == null || v.isBlank()) return def;
    try {
      return Integer.parseInt(v.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + key + " is not an integer: '" + v + "'", e);
    }
  }
}
