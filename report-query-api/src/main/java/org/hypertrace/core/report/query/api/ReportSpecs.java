package org.hypertrace.core.report.query.api;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;

/** Reads report specifications and compile options from their stored JSON form. */
public class ReportSpecs {
  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private ReportSpecs() {
    // empty private constructor
  }

  public static ReportSpec readReportSpec(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, ReportSpec.class);
  }

  public static ReportSpec readReportSpec(InputStream inputStream) throws IOException {
    return OBJECT_MAPPER.readValue(inputStream, ReportSpec.class);
  }

  public static CompileOptions readCompileOptions(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, CompileOptions.class);
  }

  public static CompileOptions readCompileOptions(InputStream inputStream) throws IOException {
    return OBJECT_MAPPER.readValue(inputStream, CompileOptions.class);
  }
}
