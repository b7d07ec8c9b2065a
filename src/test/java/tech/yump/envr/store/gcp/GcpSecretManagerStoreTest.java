package tech.yump.envr.store.gcp;

import com.google.api.gax.grpc.GrpcStatusCode;
import com.google.api.gax.rpc.NotFoundException;
import com.google.cloud.secretmanager.v1.AccessSecretVersionResponse;
import com.google.cloud.secretmanager.v1.ProjectName;
import com.google.cloud.secretmanager.v1.Secret;
import com.google.cloud.secretmanager.v1.SecretManagerServiceClient;
import com.google.cloud.secretmanager.v1.SecretName;
import com.google.cloud.secretmanager.v1.SecretPayload;
import com.google.cloud.secretmanager.v1.SecretVersionName;
import com.google.protobuf.ByteString;
import io.grpc.Status;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tech.yump.envr.store.InvalidVersionException;
import tech.yump.envr.store.KeyScope;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GcpSecretManagerStoreTest {

    private static final String PROJECT = "my-gcp";
    private static final String SECRET_ID = "envr--prod--billing--1_0_0--API_KEY";

    @Mock
    private SecretManagerServiceClient client;

    private GcpSecretManagerStore store() {
        return new GcpSecretManagerStore(client, PROJECT, new KeyScope("billing", "prod", "1.0.0"), null);
    }

    private static NotFoundException notFound() {
        return new NotFoundException("not found", null, GrpcStatusCode.of(Status.Code.NOT_FOUND), false);
    }

    @Test
    @DisplayName("Secret ids use -- between segments and _ inside the version")
    void secretId() {
        assertThat(store().secretId("API_KEY")).isEqualTo(SECRET_ID);
        assertThat(store().secretId("api.key")).isEqualTo("envr--prod--billing--1_0_0--api_key");
    }

    @Test
    @DisplayName("Reads the latest version")
    void get() {
        when(client.accessSecretVersion(SecretVersionName.of(PROJECT, SECRET_ID, "latest"))).thenReturn(
                AccessSecretVersionResponse.newBuilder()
                        .setPayload(SecretPayload.newBuilder().setData(ByteString.copyFromUtf8("v")))
                        .build());

        assertThat(store().get("API_KEY")).contains("v");
    }

    @Test
    @DisplayName("A missing secret reads as empty")
    void getMissing() {
        when(client.accessSecretVersion(any(SecretVersionName.class))).thenThrow(notFound());

        assertThat(store().get("API_KEY")).isEmpty();
    }

    @Test
    @DisplayName("Creates the secret on first write, then adds a version")
    void setCreates() {
        SecretName name = SecretName.of(PROJECT, SECRET_ID);
        when(client.getSecret(name)).thenThrow(notFound());

        store().set("API_KEY", "v");

        verify(client).createSecret(eq(ProjectName.of(PROJECT)), eq(SECRET_ID), any(Secret.class));
        verify(client).addSecretVersion(name, SecretPayload.newBuilder().setData(ByteString.copyFromUtf8("v")).build());
    }

    @Test
    @DisplayName("An existing secret only gets a new version")
    void setExisting() {
        SecretName name = SecretName.of(PROJECT, SECRET_ID);
        when(client.getSecret(name)).thenReturn(Secret.getDefaultInstance());

        store().set("API_KEY", "v");

        verify(client, never()).createSecret(any(ProjectName.class), any(String.class), any(Secret.class));
        verify(client).addSecretVersion(eq(name), any(SecretPayload.class));
    }

    @Test
    @DisplayName("Deleting a missing secret is not an error")
    void deleteMissing() {
        doThrow(notFound()).when(client).deleteSecret(any(SecretName.class));

        assertThatCode(() -> store().delete("API_KEY")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Lists secret ids under the scope prefix")
    void listKeys() {
        SecretManagerServiceClient.ListSecretsPagedResponse page = mock(SecretManagerServiceClient.ListSecretsPagedResponse.class);
        when(client.listSecrets(ProjectName.of(PROJECT))).thenReturn(page);
        when(page.iterateAll()).thenReturn(List.of(
                Secret.newBuilder().setName("projects/my-gcp/secrets/" + SECRET_ID).build(),
                Secret.newBuilder().setName("projects/my-gcp/secrets/envr--dev--billing--1_0_0--API_KEY").build(),
                Secret.newBuilder().setName("projects/my-gcp/secrets/unrelated").build()));

        assertThat(store().listKeys()).containsExactly(SECRET_ID);
    }

    @Test
    @DisplayName("An invalid version fails before the client is used")
    void invalidVersion() {
        assertThatThrownBy(() -> new GcpSecretManagerStore(client, PROJECT, new KeyScope("billing", "prod", "1.0"), null))
                .isInstanceOf(InvalidVersionException.class);
        verifyNoInteractions(client);
    }
}
