package com.bo.knowledge.tool;

import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Tool lookup by name, resolved once at startup
 */
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolExecutor> tools;

    public ToolRegistry(Collection<? extends ToolExecutor> executors) {
        Map<String, ToolExecutor> byName = new LinkedHashMap<>();
        for (ToolExecutor executor : executors) {
            ToolExecutor previous = byName.put(executor.name(), executor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + executor.name());
            }
        }
        this.tools = Collections.unmodifiableMap(byName);
        log.info("Tools registered: {}", tools.keySet());
    }

    /**
     * @return the tool, or null if none is registered under that name
     */
    public ToolExecutor get(String name) {
        return tools.get(name);
    }

    public Set<String> names() {
        return tools.keySet();
    }
}
