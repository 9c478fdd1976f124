package com.linlay.agentteam.hierarchy.store;

import com.linlay.agentteam.hierarchy.model.HierarchyConfig;

@FunctionalInterface
public interface HierarchyChangeListener {

    /**
     * Called synchronously after a hierarchy has been persisted, before the upsert returns.
     */
    void onHierarchyChanged(HierarchyConfig saved);
}
