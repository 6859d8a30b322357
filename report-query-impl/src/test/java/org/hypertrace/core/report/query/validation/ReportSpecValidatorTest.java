package org.hypertrace.core.report.query.validation;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableSet;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.observers.TestObserver;
import java.util.Set;
import org.hypertrace.core.report.query.api.CompileOptions;
import org.hypertrace.core.report.query.api.ReportSpec;
import org.junit.jupiter.api.Test;

class ReportSpecValidatorTest {
  ReportSpec reportSpec = ReportSpec.builder().source("emails").build();
  CompileOptions compileOptions = CompileOptions.builder().build();

  @Test
  void completesWhenEveryValidationCompletes() {
    TestObserver<Void> observer = new TestObserver<>();
    new ReportSpecValidator(Set.of(validation(Completable.complete()), validation(Completable.complete())))
        .validate(reportSpec, compileOptions)
        .blockingSubscribe(observer);
    observer.assertComplete();
  }

  @Test
  void completesWithoutValidations() {
    TestObserver<Void> observer = new TestObserver<>();
    new ReportSpecValidator(Set.of()).validate(reportSpec, compileOptions).blockingSubscribe(observer);
    observer.assertComplete();
  }

  @Test
  void stopsAtFirstFailingValidation() {
    ReportSpecValidation passing = validation(Completable.complete());
    ReportSpecValidation failing =
        validation(Completable.error(new IllegalArgumentException("bad report")));
    ReportSpecValidation notReached = validation(Completable.complete());

    TestObserver<Void> observer = new TestObserver<>();
    new ReportSpecValidator(ImmutableSet.of(passing, failing, notReached))
        .validate(reportSpec, compileOptions)
        .blockingSubscribe(observer);

    observer.assertError(IllegalArgumentException.class);
    observer.assertError(error -> "bad report".equals(error.getMessage()));
    verify(passing).validate(reportSpec, compileOptions);
    verify(notReached, never()).validate(any(), any());
  }

  private ReportSpecValidation validation(Completable result) {
    ReportSpecValidation validation = mock(ReportSpecValidation.class);
    when(validation.validate(reportSpec, compileOptions)).thenReturn(result);
    return validation;
  }
}
