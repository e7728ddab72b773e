package com.atelier.sync.core.store;

import com.atelier.project.model.Project;
import com.atelier.project.model.ProjectState;
import com.atelier.sync.spi.LocalStore;
import com.atelier.sync.spi.error.LocalStoreException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LocalStore} keeping one JSON document per record under a base directory:
 * {@code projects/<id>.json} and {@code states/<id>.json}. Writes go to a temp file that is then moved over the
 * target, so a crash never leaves a half-written record.
 */
public class JsonFileLocalStore implements LocalStore {
    private static final Logger log = LoggerFactory.getLogger(JsonFileLocalStore.class);
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path projectsDir;
    private final Path statesDir;
    private final ObjectMapper mapper;

    public JsonFileLocalStore(Path baseDir) {
        this(baseDir, defaultMapper());
    }

    public JsonFileLocalStore(Path baseDir, ObjectMapper mapper) {
        Objects.requireNonNull(baseDir, "baseDir");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.projectsDir = baseDir.resolve("projects");
        this.statesDir = baseDir.resolve("states");
        try {
            Files.createDirectories(projectsDir);
            Files.createDirectories(statesDir);
        } catch (IOException e) {
            throw new LocalStoreException(null, "Cannot create local store at " + baseDir, e);
        }
    }

    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    @Override
    public Optional<Project> loadProject(String projectId) {
        return read(projectsDir, projectId, Project.class);
    }

    @Override
    public void saveProject(Project project) {
        write(projectsDir, project.id(), project);
    }

    @Override
    public Optional<ProjectState> loadState(String projectId) {
        return read(statesDir, projectId, ProjectState.class);
    }

    @Override
    public void saveState(ProjectState state) {
        write(statesDir, state.getId(), state);
    }

    @Override
    public void delete(String projectId) {
        try {
            Files.deleteIfExists(file(projectsDir, projectId));
            Files.deleteIfExists(file(statesDir, projectId));
        } catch (IOException e) {
            throw new LocalStoreException(projectId, "Failed to delete local project " + projectId, e);
        }
    }

    @Override
    public List<Project> listProjects() {
        List<Project> out = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(projectsDir, "*.json")) {
            for (Path path : files) {
                try {
                    out.add(mapper.readValue(path.toFile(), Project.class));
                } catch (IOException e) {
                    log.warn("Skipping unreadable project file {}: {}", path.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new LocalStoreException(null, "Failed to list local projects", e);
        }
        return out;
    }

    private <T> Optional<T> read(Path dir, String id, Class<T> type) {
        Path path = file(dir, id);
        if (!Files.exists(path)) return Optional.empty();
        try {
            return Optional.of(mapper.readValue(path.toFile(), type));
        } catch (IOException e) {
            throw new LocalStoreException(id, "Failed to read " + path.getFileName(), e);
        }
    }

    private void write(Path dir, String id, Object value) {
        Path target = file(dir, id);
        Path temp = dir.resolve(id + ".json.tmp");
        try {
            mapper.writeValue(temp.toFile(), value);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new LocalStoreException(id, "Failed to write " + target.getFileName(), e);
        }
    }

    private static Path file(Path dir, String id) {
        if (id == null || !SAFE_ID.matcher(id).matches()) {
            throw new IllegalArgumentException("Unsupported entity id for file store: " + id);
        }
        return dir.resolve(id + ".json");
    }
}
