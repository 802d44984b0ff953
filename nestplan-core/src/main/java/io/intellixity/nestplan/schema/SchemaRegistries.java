package io.intellixity.nestplan.schema;

import io.intellixity.nestplan.util.NestplanFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** Builds a registry from every {@link SchemaRegistryProvider} registered on the classpath. */
public final class SchemaRegistries {
  private static final Logger log = LoggerFactory.getLogger(SchemaRegistries.class);

  private SchemaRegistries() {}

  public static InMemorySchemaRegistry discover() {
    return discover(Thread.currentThread().getContextClassLoader());
  }

  public static InMemorySchemaRegistry discover(ClassLoader cl) {
    List<SchemaRegistryProvider> providers = NestplanFactoriesLoader.load(SchemaRegistryProvider.class, cl);
    List<EntitySchema> all = new ArrayList<>();
    for (SchemaRegistryProvider p : providers) {
      List<EntitySchema> contributed = p.entities();
      if (contributed == null) continue;
      all.addAll(contributed);
      if (log.isDebugEnabled()) {
        log.debug("nestplan.schema provider={} entities={}", p.getClass().getName(), contributed.size());
      }
    }
    return new InMemorySchemaRegistry(all);
  }
}
