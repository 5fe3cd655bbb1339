package com.gentoro.scenarios.driver;

import com.gentoro.scenarios.setup.ScenarioGroup;
import java.util.StringJoiner;

/** Computes scenario directories as {@code root/[group/][subdir/]scenario}. */
public class DirectoryLayout {

  private final String root;

  public DirectoryLayout(String root) {
    this.root = root == null ? "" : stripTrailingSlash(root);
  }

  public String scenarioDir(ScenarioGroup group, String subdir, String scenarioName) {
    StringJoiner path = new StringJoiner("/");
    if (!root.isEmpty()) path.add(root);
    if (group != null && group.useGroupDir()) path.add(group.name());
    if (subdir != null && !subdir.isBlank()) path.add(stripTrailingSlash(subdir));
    path.add(scenarioName);
    return path.toString();
  }

  private static String stripTrailingSlash(String path) {
    String result = path.trim();
    while (result.length() > 1 && result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }
}
