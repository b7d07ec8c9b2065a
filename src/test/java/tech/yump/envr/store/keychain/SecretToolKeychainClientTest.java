package tech.yump.envr.store.keychain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.envr.process.CommandResult;
import tech.yump.envr.process.CommandRunner;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SecretToolKeychainClientTest {

    private static final List<String> LOOKUP = List.of("secret-tool", "lookup", "service", "envr:app", "account", "acct");

    @Mock
    private CommandRunner commandRunner;

    @InjectMocks
    private SecretToolKeychainClient client;

    @Test
    @DisplayName("Looks up by service and account attributes")
    void getPassword() {
        when(commandRunner.run(LOOKUP)).thenReturn(new CommandResult(0, "value", ""));

        assertThat(client.getPassword("envr:app", "acct")).contains("value");
    }

    @Test
    @DisplayName("A silent non-zero exit means not found")
    void notFound() {
        when(commandRunner.run(LOOKUP)).thenReturn(new CommandResult(1, "", ""));

        assertThat(client.getPassword("envr:app", "acct")).isEmpty();
    }

    @Test
    @DisplayName("Passes the password on stdin, not as an argument")
    void setPassword() {
        List<String> store = List.of("secret-tool", "store", "--label=envr:app acct", "service", "envr:app", "account", "acct");
        when(commandRunner.run(store, "s3cr3t")).thenReturn(new CommandResult(0, "", ""));

        client.setPassword("envr:app", "acct", "s3cr3t");

        verify(commandRunner).run(store, "s3cr3t");
    }

    @Test
    @DisplayName("Deleting a missing entry does not run clear")
    void deleteMissing() {
        when(commandRunner.run(LOOKUP)).thenReturn(new CommandResult(1, "", ""));

        assertThat(client.deletePassword("envr:app", "acct")).isFalse();
        verify(commandRunner, never()).run(List.of("secret-tool", "clear", "service", "envr:app", "account", "acct"));
    }
}
