package tech.yump.envr.store.keychain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.envr.process.CommandResult;
import tech.yump.envr.process.CommandRunner;
import tech.yump.envr.store.BackendUnavailableException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MacOsKeychainClientTest {

    @Mock
    private CommandRunner commandRunner;

    @InjectMocks
    private MacOsKeychainClient client;

    private static final List<String> FIND = List.of(
            "security", "find-generic-password", "-s", "envr:app", "-a", "envr/d/app/K", "-g");
    private static final List<String> INTERACTIVE = List.of("security", "-i");

    @Test
    @DisplayName("Reads a printable password from the quoted password line")
    void getPassword() {
        when(commandRunner.run(FIND)).thenReturn(new CommandResult(0, "keychain: \"login.keychain-db\"\n",
                "password: \"value with \"quotes\"\"\n"));

        assertThat(client.getPassword("envr:app", "envr/d/app/K")).contains("value with \"quotes\"");
    }

    @Test
    @DisplayName("Decodes a hex password line back to a multi-line value")
    void getMultiLinePassword() {
        // "line1\nline2"
        when(commandRunner.run(FIND)).thenReturn(new CommandResult(0, "",
                "password: 0x6C696E65310A6C696E6532  \"line1\\012line2\"\n"));

        assertThat(client.getPassword("envr:app", "envr/d/app/K")).contains("line1\nline2");
    }

    @Test
    @DisplayName("An empty password line reads as an empty value")
    void getEmptyPassword() {
        when(commandRunner.run(FIND)).thenReturn(new CommandResult(0, "", "password: \n"));

        assertThat(client.getPassword("envr:app", "envr/d/app/K")).contains("");
    }

    @Test
    @DisplayName("Exit code 44 means the item does not exist")
    void notFound() {
        when(commandRunner.run(FIND)).thenReturn(new CommandResult(44, "", "could not be found"));

        assertThat(client.getPassword("envr:app", "envr/d/app/K")).isEmpty();
    }

    @Test
    @DisplayName("Other failures surface as BackendUnavailableException")
    void failure() {
        when(commandRunner.run(FIND)).thenReturn(new CommandResult(51, "", "user interaction is not allowed"));

        assertThatThrownBy(() -> client.getPassword("envr:app", "envr/d/app/K"))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("user interaction is not allowed");
    }

    @Test
    @DisplayName("Writes through stdin with the value hex-encoded, never on the command line")
    void setMultiLinePassword() {
        when(commandRunner.run(eq(INTERACTIVE), anyString())).thenReturn(new CommandResult(0, "", ""));

        client.setPassword("envr:app", "envr/d/app/K", "line1\nline2");

        ArgumentCaptor<String> stdin = ArgumentCaptor.forClass(String.class);
        verify(commandRunner).run(eq(INTERACTIVE), stdin.capture());
        assertThat(stdin.getValue()).isEqualTo(
                "add-generic-password -U -s \"envr:app\" -a \"envr/d/app/K\" -X 6c696e65310a6c696e6532\n");
        assertThat(stdin.getValue()).doesNotContain("line1");
    }

    @Test
    @DisplayName("A write error reported on stderr fails even with exit code 0")
    void setFailureOnStderr() {
        when(commandRunner.run(eq(INTERACTIVE), anyString()))
                .thenReturn(new CommandResult(0, "", "security: SecKeychainItemCreateFromContent: User interaction is not allowed."));

        assertThatThrownBy(() -> client.setPassword("envr:app", "acct", "v"))
                .isInstanceOf(BackendUnavailableException.class)
                .hasMessageContaining("User interaction is not allowed");
    }

    @Test
    @DisplayName("Service and account are quoted for the interactive parser")
    void quoting() {
        assertThat(MacOsKeychainClient.quote("envr:my \"app\"\\x")).isEqualTo("\"envr:my \\\"app\\\"\\\\x\"");
    }

    @Test
    @DisplayName("Deleting a missing item reports false")
    void deleteMissing() {
        when(commandRunner.run(List.of("security", "delete-generic-password", "-s", "envr:app", "-a", "acct")))
                .thenReturn(new CommandResult(44, "", ""));

        assertThat(client.deletePassword("envr:app", "acct")).isFalse();
    }
}
