package com.ospicorp.tides.config;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.util.Collection;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/** Writes collections of records (series samples, residual rows) as {@code text/csv}. */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Collection<?>> {
  static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");
  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
    mapper.findAndRegisterModules();
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  @NonNull
  protected Collection<?> readInternal(@NonNull Class<? extends Collection<?>> clazz,
      @NonNull HttpInputMessage inputMessage)
      throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Collection<?> rows, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    var writer = mapper.writer(schemaFor(rows)).writeValues(outputMessage.getBody());
    for (Object row : rows) {
      writer.write(row);
    }
    writer.flush();
  }

  private CsvSchema schemaFor(Collection<?> rows) {
    for (Object row : rows) {
      if (row != null) {
        return mapper.schemaFor(row.getClass()).withHeader();
      }
    }
    return CsvSchema.emptySchema().withHeader();
  }
}
