package com.gentoro.scenarios.editor;

/** A named editor operation bound to one editor instance. */
@FunctionalInterface
public interface Capability {
  void invoke(FunctionArguments arguments);
}
