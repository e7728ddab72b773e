package com.atelier.sync.core.remote;

import com.atelier.project.model.Project;
import com.atelier.project.model.ProjectState;

/** Full remote view of one project, reassembled from its collections. */
public record RemoteSnapshot(Project project, ProjectState state) {}
