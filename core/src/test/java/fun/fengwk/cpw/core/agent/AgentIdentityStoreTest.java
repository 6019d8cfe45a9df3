package fun.fengwk.cpw.core.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class AgentIdentityStoreTest {

    @TempDir
    Path tempDir;

    @Test
    public void shouldSaveAndLoadIdentity() {
        AgentIdentityStore store = new AgentIdentityStore(new ObjectMapper(), tempDir.resolve("nested/identity.json"));
        AgentIdentity identity = new AgentIdentity("a1", "token", "ws://hub:8080/ws/agent");

        store.save(identity);

        assertThat(store.load()).contains(identity);
        assertThat(Files.exists(tempDir.resolve("nested/identity.json.tmp"))).isFalse();
    }

    @Test
    public void shouldReturnEmptyForMissingOrCorruptFile() throws Exception {
        Path file = tempDir.resolve("identity.json");
        AgentIdentityStore store = new AgentIdentityStore(new ObjectMapper(), file);

        assertThat(store.load()).isEmpty();

        Files.writeString(file, "{not json");
        assertThat(store.load()).isEmpty();
    }

    @Test
    public void shouldExpandHomeDirectory() {
        Path home = Paths.get(System.getProperty("user.home"));

        assertThat(AgentIdentityStore.resolvePath("~/.cpw-agent/identity.json"))
            .isEqualTo(home.resolve(".cpw-agent/identity.json"));
        assertThat(AgentIdentityStore.resolvePath("/tmp/id.json")).isEqualTo(Paths.get("/tmp/id.json"));
    }

}
