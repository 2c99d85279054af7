package org.glossa.node.processes.http.api.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.ConfigFactory;
import io.javalin.http.Context;
import io.javalin.http.HttpStatus;
import org.glossa.node.processes.http.api.auth.dto.LoginResponseDto;
import org.glossa.node.spi.ServiceRegistry;
import org.glossa.workspace.Workspace;
import org.glossa.workspace.api.errors.ConflictException;
import org.glossa.workspace.api.errors.UnauthorizedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AuthControllerTest {

    @Mock
    private Context mockCtx;

    @Captor
    private ArgumentCaptor<Object> jsonCaptor;

    private Workspace workspace;
    private AuthController controller;

    @BeforeEach
    void setUp() {
        workspace = Workspace.create(ConfigFactory.parseString("storage.type = memory"), new ObjectMapper());
        final ServiceRegistry registry = new ServiceRegistry();
        registry.register(Workspace.class, workspace);
        controller = new AuthController(registry, ConfigFactory.empty());

        when(mockCtx.status(any(HttpStatus.class))).thenReturn(mockCtx);
        when(mockCtx.json(any())).thenReturn(mockCtx);
    }

    private void formCredentials(final String username, final String password) {
        when(mockCtx.contentType()).thenReturn("application/x-www-form-urlencoded");
        when(mockCtx.formParam("username")).thenReturn(username);
        when(mockCtx.formParam("password")).thenReturn(password);
    }

    @Test
    void register_shouldCreateUserAndReturn201() throws Exception {
        formCredentials("alice", "pw");

        controller.register(mockCtx);

        verify(mockCtx).status(HttpStatus.CREATED);
        assertThat(workspace.credentials().verify("alice", "pw")).isEqualTo("alice");
    }

    @Test
    void register_shouldRejectDuplicateUser() throws Exception {
        workspace.credentials().register("alice", "pw");
        formCredentials("alice", "other");

        assertThatThrownBy(() -> controller.register(mockCtx)).isInstanceOf(ConflictException.class);
    }

    @Test
    void login_shouldIssueTokenForJsonCredentials() throws Exception {
        workspace.credentials().register("alice", "pw");
        when(mockCtx.contentType()).thenReturn("application/json");
        when(mockCtx.bodyAsBytes()).thenReturn("{\"username\":\"alice\",\"password\":\"pw\"}".getBytes(StandardCharsets.UTF_8));

        controller.login(mockCtx);

        verify(mockCtx).status(HttpStatus.OK);
        verify(mockCtx).json(jsonCaptor.capture());
        final LoginResponseDto response = (LoginResponseDto) jsonCaptor.getValue();
        assertThat(response.username()).isEqualTo("alice");
        assertThat(workspace.sessions().resolve(response.token())).isEqualTo("alice");
    }

    @Test
    void login_shouldRejectWrongPassword() throws Exception {
        workspace.credentials().register("alice", "pw");
        formCredentials("alice", "nope");

        assertThatThrownBy(() -> controller.login(mockCtx)).isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void logout_shouldRevokeToken() {
        final String token = workspace.sessions().createSession("alice");
        when(mockCtx.header("Authorization")).thenReturn("bearer " + token);

        controller.logout(mockCtx);

        assertThat(workspace.sessions().activeSessions()).isZero();
        assertThatThrownBy(() -> controller.logout(mockCtx)).isInstanceOf(UnauthorizedException.class);
    }
}
