package com.atelier.sync.testkit;

import com.atelier.project.model.Project;
import com.atelier.project.model.ProjectState;
import com.atelier.sync.spi.LocalStore;
import com.atelier.sync.spi.error.LocalStoreException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/** Test double that keeps projects and states in memory. */
public class InMemoryLocalStore implements LocalStore {
    private final Map<String, Project> projects = new ConcurrentHashMap<>();
    private final Map<String, ProjectState> states = new ConcurrentHashMap<>();
    private final AtomicInteger stateWrites = new AtomicInteger();
    private final AtomicBoolean failWrites = new AtomicBoolean();

    @Override
    public Optional<Project> loadProject(String projectId) {
        return Optional.ofNullable(projects.get(projectId));
    }

    @Override
    public void saveProject(Project project) {
        checkWritable(project.id());
        projects.put(project.id(), project);
    }

    @Override
    public Optional<ProjectState> loadState(String projectId) {
        return Optional.ofNullable(states.get(projectId));
    }

    @Override
    public void saveState(ProjectState state) {
        checkWritable(state.getId());
        states.put(state.getId(), state);
        stateWrites.incrementAndGet();
    }

    @Override
    public void delete(String projectId) {
        projects.remove(projectId);
        states.remove(projectId);
    }

    @Override
    public List<Project> listProjects() {
        return new ArrayList<>(projects.values());
    }

    /** Makes every following write throw until reset. */
    public void failWrites(boolean fail) {
        failWrites.set(fail);
    }

    public int stateWrites() {
        return stateWrites.get();
    }

    private void checkWritable(String id) {
        if (failWrites.get()) {
            throw new LocalStoreException(id, "Local store write failed", new IllegalStateException("disk full"));
        }
    }
}
