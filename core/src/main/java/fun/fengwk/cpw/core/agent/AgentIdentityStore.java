package fun.fengwk.cpw.core.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * JSON file holding the agent identity. Writes go through a temp file and an atomic rename.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class AgentIdentityStore {

    private final ObjectMapper objectMapper;
    private final Path file;

    @Autowired
    public AgentIdentityStore(ObjectMapper objectMapper, AgentProperties agentProperties) {
        this(objectMapper, resolvePath(agentProperties.getIdentityFile()));
    }

    AgentIdentityStore(ObjectMapper objectMapper, Path file) {
        this.objectMapper = objectMapper;
        this.file = file;
    }

    public Optional<AgentIdentity> load() {
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(file.toFile(), AgentIdentity.class));
        } catch (IOException ex) {
            log.warn("read agent identity failed, file={}, error={}", file, ex.getMessage());
            return Optional.empty();
        }
    }

    public void save(AgentIdentity identity) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), identity);
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.info("agent identity saved, agentId={}, file={}", identity.agentId(), file);
        } catch (IOException ex) {
            throw new IllegalStateException("failed to save agent identity: " + ex.getMessage(), ex);
        }
    }

    public Path getFile() {
        return file;
    }

    static Path resolvePath(String value) {
        String path = value == null ? "" : value.trim();
        if (path.equals("~")) {
            return Paths.get(System.getProperty("user.home"));
        }
        if (path.startsWith("~/")) {
            return Paths.get(System.getProperty("user.home"), path.substring(2));
        }
        return Paths.get(path);
    }

}
