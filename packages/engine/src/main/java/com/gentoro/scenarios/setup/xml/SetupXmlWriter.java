package com.gentoro.scenarios.setup.xml;

import com.gentoro.scenarios.exception.ScenarioErrorCode;
import com.gentoro.scenarios.exception.ScenarioException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.text.StringEscapeUtils;

/** Line-oriented builder for the expanded, iterator-free form of a setup document. */
public class SetupXmlWriter {
  private static final String TAB = "   ";

  private final StringBuilder out = new StringBuilder();

  public SetupXmlWriter line(int indent, String text) {
    out.append(TAB.repeat(Math.max(0, indent))).append(text).append('\n');
    return this;
  }

  public SetupXmlWriter blank() {
    out.append('\n');
    return this;
  }

  public static String escape(String text) {
    return text == null ? "" : StringEscapeUtils.escapeXml10(text);
  }

  public void writeTo(Path file) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Files.writeString(file, out.toString(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ScenarioException(
              ScenarioErrorCode.IO_ERROR, "Failed to write expanded setup to " + file, e)
          .withContext("file", file.toString());
    }
  }

  @Override
  public String toString() {
    return out.toString();
  }
}
