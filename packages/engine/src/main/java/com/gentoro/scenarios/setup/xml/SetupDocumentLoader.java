package com.gentoro.scenarios.setup.xml;

import java.nio.file.Path;
import org.w3c.dom.Element;

/** Parses a setup file and returns its root element. Schema validation, if any, happens here. */
@FunctionalInterface
public interface SetupDocumentLoader {
  Element load(Path file);
}
