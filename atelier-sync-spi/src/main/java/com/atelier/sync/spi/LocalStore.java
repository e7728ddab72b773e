package com.atelier.sync.spi;

import com.atelier.project.model.Project;
import com.atelier.project.model.ProjectState;
import java.util.List;
import java.util.Optional;

/**
 * Durable local cache of project metadata and working state, keyed by project id.
 *
 * <p>Only the sync engine writes to it. Writes either complete or throw
 * {@link com.atelier.sync.spi.error.LocalStoreException}.
 */
public interface LocalStore {

    Optional<Project> loadProject(String projectId);

    void saveProject(Project project);

    Optional<ProjectState> loadState(String projectId);

    void saveState(ProjectState state);

    /** Removes the project record and its state. Missing records are ignored. */
    void delete(String projectId);

    List<Project> listProjects();
}
