package org.hypertrace.core.report.query.validation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.reactivex.rxjava3.core.Completable;
import java.util.List;
import java.util.Set;
import javax.inject.Inject;
import org.hypertrace.core.report.query.api.CompileOptions;
import org.hypertrace.core.report.query.api.ReportSpec;

/**
 * Runs the registered validations one after another in registration order. The first failure is
 * passed to the caller and the remaining validations are not run.
 */
public class ReportSpecValidator {
  private final List<ReportSpecValidation> validations;

  @Inject
  public ReportSpecValidator(Set<ReportSpecValidation> validations) {
    this.validations = ImmutableList.copyOf(validations);
  }

  public Completable validate(ReportSpec reportSpec, CompileOptions compileOptions) {
    return Completable.concat(
        Lists.transform(
            validations,
            validation -> Completable.defer(() -> validation.validate(reportSpec, compileOptions))));
  }
}
