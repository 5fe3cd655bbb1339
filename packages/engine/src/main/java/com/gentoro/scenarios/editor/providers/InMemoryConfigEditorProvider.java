package com.gentoro.scenarios.editor.providers;

import com.gentoro.scenarios.editor.ConfigEditor;
import com.gentoro.scenarios.editor.EditorTarget;
import com.gentoro.scenarios.editor.memory.InMemoryConfigEditor;
import com.gentoro.scenarios.editor.spi.ConfigEditorProvider;
import java.util.HashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Provider of {@link InMemoryConfigEditor}s. Editors are remembered by group and scenario name,
 * so a baseline run earlier through the same provider is reused as parent.
 *
 * <p>Remembered editors live as long as the provider unless released. Hosts running many trials
 * through one factory call {@link #release(EditorTarget)} once a scenario is done, or {@link
 * #clear()} between batches.
 */
public class InMemoryConfigEditorProvider implements ConfigEditorProvider {
  public static final String ID = "in-memory";

  private final Map<String, InMemoryConfigEditor> editors = new HashMap<>();

  @Override
  public String id() {
    return ID;
  }

  @Override
  public ConfigEditor create(
      EditorTarget target, ConfigEditor parent, Configuration configuration) {
    InMemoryConfigEditor editor = new InMemoryConfigEditor(target, parent);
    editors.put(key(target), editor);
    return editor;
  }

  @Override
  public ConfigEditor resolveParent(EditorTarget baseline, Configuration configuration) {
    InMemoryConfigEditor existing = editors.get(key(baseline));
    return existing != null ? existing : create(baseline, null, configuration);
  }

  @Override
  public void release(EditorTarget target) {
    editors.remove(key(target));
  }

  @Override
  public void clear() {
    editors.clear();
  }

  public int size() {
    return editors.size();
  }

  private static String key(EditorTarget target) {
    return target.groupName() + "/" + target.scenarioName();
  }
}
