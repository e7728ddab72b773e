package com.atelier.sync.core.subscription;

@FunctionalInterface
public interface ProjectChangeListener {

    void onChange(ProjectChange change);
}
