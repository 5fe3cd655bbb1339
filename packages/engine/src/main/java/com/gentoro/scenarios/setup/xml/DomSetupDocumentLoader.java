package com.gentoro.scenarios.setup.xml;

import com.gentoro.scenarios.exception.ConfigException;
import com.gentoro.scenarios.exception.ScenarioErrorCode;
import com.gentoro.scenarios.exception.ScenarioException;
import com.gentoro.scenarios.logging.LoggingService;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import org.slf4j.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/** {@link SetupDocumentLoader} backed by the JDK DOM parser, with DOCTYPEs disallowed. */
public class DomSetupDocumentLoader implements SetupDocumentLoader {
  private static final Logger log = LoggingService.getLogger(DomSetupDocumentLoader.class);

  @Override
  public Element load(Path file) {
    log.debug("Parsing setup document {}", file);
    try (InputStream in = Files.newInputStream(file)) {
      return parse(new InputSource(in), file.toString());
    } catch (IOException e) {
      throw new ScenarioException(
              ScenarioErrorCode.IO_ERROR, "Failed to read setup document " + file, e)
          .withContext("file", file.toString());
    }
  }

  /** Parse a document held in memory. */
  public Element parse(String xml) {
    return parse(new InputSource(new StringReader(xml)), "<string>");
  }

  private Element parse(InputSource source, String origin) {
    try {
      Document document = newBuilder().parse(source);
      document.getDocumentElement().normalize();
      return document.getDocumentElement();
    } catch (SAXException | IOException e) {
      throw new ConfigException("Setup document " + origin + " is not well-formed XML", e)
          .withContext("file", origin);
    }
  }

  private static DocumentBuilder newBuilder() {
    try {
      DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
      factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
      factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
      factory.setXIncludeAware(false);
      factory.setExpandEntityReferences(false);
      factory.setNamespaceAware(false);
      factory.setIgnoringComments(true);
      return factory.newDocumentBuilder();
    } catch (ParserConfigurationException e) {
      throw new IllegalStateException("XML parser does not support secure processing", e);
    }
  }
}
