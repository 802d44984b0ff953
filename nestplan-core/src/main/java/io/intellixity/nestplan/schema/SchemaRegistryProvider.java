package io.intellixity.nestplan.schema;

import java.util.List;

/**
 * SPI contributing entity declarations.
 * <p>
 * Implementations are listed in {@code META-INF/nestplan.factories} and need a public no-arg constructor.
 */
public interface SchemaRegistryProvider {
  List<EntitySchema> entities();
}
