package org.hypertrace.core.report.query.validation;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;

public class ReportValidationModule extends AbstractModule {
  @Override
  protected void configure() {
    Multibinder<ReportSpecValidation> validationMultibinder =
        Multibinder.newSetBinder(binder(), ReportSpecValidation.class);
    validationMultibinder.addBinding().to(FilterOperatorValidation.class);
  }
}
