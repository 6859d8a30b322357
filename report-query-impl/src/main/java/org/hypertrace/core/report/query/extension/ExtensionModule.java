package org.hypertrace.core.report.query.extension;

import com.google.inject.AbstractModule;
import com.google.inject.multibindings.Multibinder;

/**
 * Registers the built in extension hooks. Other modules add theirs with {@code
 * Multibinder.newSetBinder(binder(), ExtensionHook.class).addBinding()}.
 */
public class ExtensionModule extends AbstractModule {
  @Override
  protected void configure() {
    Multibinder<ExtensionHook> hookMultibinder =
        Multibinder.newSetBinder(binder(), ExtensionHook.class);
    hookMultibinder.addBinding().to(ConfiguredSourceExtensionHook.class);
  }
}
