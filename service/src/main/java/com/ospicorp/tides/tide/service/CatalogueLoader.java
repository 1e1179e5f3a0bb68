package com.ospicorp.tides.tide.service;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.tides.tide.model.Constituent;
import com.ospicorp.tides.tide.model.ConstituentCatalogue;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/** Reads a {@code name,speed} CSV table of constituents. */
public final class CatalogueLoader {
  private static final CsvMapper MAPPER = new CsvMapper();
  private static final CsvSchema SCHEMA = CsvSchema.emptySchema().withHeader();

  private CatalogueLoader() {
  }

  public static ConstituentCatalogue fromClasspath(String resource) {
    ClassLoader loader = CatalogueLoader.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Constituent catalogue not found on classpath: " + resource);
      }
      return read(in);
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to read constituent catalogue " + resource, ex);
    }
  }

  public static ConstituentCatalogue read(InputStream in) throws IOException {
    MappingIterator<Constituent> rows = MAPPER.readerFor(Constituent.class)
        .with(SCHEMA)
        .readValues(in);
    List<Constituent> constituents = rows.readAll();
    return new ConstituentCatalogue(constituents);
  }
}
