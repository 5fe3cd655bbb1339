package com.gentoro.scenarios.editor.memory;

/** One entry of the ordered scenario component list of a configuration. */
public record ScenarioComponent(String name, String content) {}
