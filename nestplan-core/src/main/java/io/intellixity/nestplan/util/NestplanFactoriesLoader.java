package io.intellixity.nestplan.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Loads SPI implementations listed in {@code META-INF/nestplan.factories} resources.
 * <p>
 * Each resource is a properties file keyed by the SPI's fully-qualified name:
 *
 * <pre>
 * io.intellixity.nestplan.schema.SchemaRegistryProvider=com.acme.BlogSchema,com.acme.ShopSchema
 * </pre>
 *
 * Implementation names are de-duplicated across resources; first occurrence wins the position.
 */
public final class NestplanFactoriesLoader {
  public static final String RESOURCE = "META-INF/nestplan.factories";

  private NestplanFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    ClassLoader loader = (cl != null) ? cl : NestplanFactoriesLoader.class.getClassLoader();

    Set<String> implNames = new LinkedHashSet<>();
    for (URL url : resources(loader)) {
      String v = read(url).getProperty(spiType.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(instantiate(implName, spiType, loader));
    }
    return out;
  }

  private static List<URL> resources(ClassLoader loader) {
    try {
      Enumeration<URL> e = loader.getResources(RESOURCE);
      List<URL> out = new ArrayList<>();
      while (e.hasMoreElements()) out.add(e.nextElement());
      return out;
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + RESOURCE + " from " + url, e);
    }
    return p;
  }

  private static <T> T instantiate(String implName, Class<T> spiType, ClassLoader loader) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, loader);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Unknown " + spiType.getSimpleName() + " implementation: " + implName, e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
