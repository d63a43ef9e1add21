package io.intellixity.unisql.jdbc.postgres;

import io.intellixity.unisql.error.FeatureNotSupportedException;

/** Guards for operators that need an optional Postgres extension. */
public final class PostgresExtensions {
  private final boolean vector;
  private final boolean postgis;

  public PostgresExtensions(boolean vector, boolean postgis) {
    this.vector = vector;
    this.postgis = postgis;
  }

  public boolean vectorEnabled() { return vector; }

  public boolean postgisEnabled() { return postgis; }

  /** @throws FeatureNotSupportedException when pgvector is not enabled for this driver */
  public void requireVector(String method) {
    if (!vector) {
      throw new FeatureNotSupportedException("vector", method,
          "Install the pgvector extension (CREATE EXTENSION vector) and enable it with Options.withPgvector(true).");
    }
  }

  /** @throws FeatureNotSupportedException when PostGIS is not enabled for this driver */
  public void requireGeospatial(String method) {
    if (!postgis) {
      throw new FeatureNotSupportedException("geospatial", method,
          "Install the PostGIS extension (CREATE EXTENSION postgis) and enable it with Options.withPostgis(true).");
    }
  }
}
