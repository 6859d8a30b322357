package org.hypertrace.core.report.query.validation;

import io.reactivex.rxjava3.core.Completable;
import org.hypertrace.core.report.query.api.CompileOptions;
import org.hypertrace.core.report.query.api.ReportSpec;

public interface ReportSpecValidation {
  Completable validate(ReportSpec reportSpec, CompileOptions compileOptions);
}
