package com.gentoro.scenarios.editor;

/** Implementation of a capability, receiving the editor it is invoked on. */
@FunctionalInterface
public interface CapabilityHandler<E extends ConfigEditor> {
  void invoke(E editor, FunctionArguments arguments);
}
