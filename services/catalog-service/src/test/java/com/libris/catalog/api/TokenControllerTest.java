package com.libris.catalog.api;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.libris.catalog.domain.User;
import com.libris.catalog.domain.service.TokenService;
import com.libris.common.error.AuthenticationException;
import com.libris.common.error.AuthenticationException.Reason;
import com.libris.security.BearerAuthenticator;
import com.libris.security.IssuedToken;
import com.libris.security.TokenCodec;
import com.libris.security.TokenScope;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = TokenController.class)
@Import(WebSliceTestConfig.class)
@ActiveProfiles("test")
@DisplayName("TokenController")
class TokenControllerTest {

    private static final String LOGIN = "{\"email\":\"ada@example.com\",\"password\":\"correct horse\"}";

    @Autowired private MockMvc mockMvc;
    @MockBean private TokenService tokens;
    @MockBean private BearerAuthenticator<User> authenticator;

    @Test
    @DisplayName("a successful login returns the token and its expiry")
    void login() throws Exception {
        var clock = Clock.fixed(Instant.parse("2024-06-01T12:00:00Z"), ZoneOffset.UTC);
        IssuedToken issued =
                new TokenCodec(new SecureRandom(), clock).issue(5, Duration.ofHours(24), TokenScope.AUTHENTICATION);
        when(tokens.createAuthenticationToken("ada@example.com", "correct horse")).thenReturn(issued);

        mockMvc.perform(post("/api/v1/tokens/authentication")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LOGIN))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.token").value(issued.plaintext()))
                .andExpect(jsonPath("$.expiresAt").value("2024-06-02T12:00:00Z"));
    }

    @Test
    @DisplayName("bad credentials are a generic 401")
    void badCredentials() throws Exception {
        when(tokens.createAuthenticationToken(anyString(), anyString()))
                .thenThrow(new AuthenticationException(Reason.INVALID_LOGIN));

        mockMvc.perform(post("/api/v1/tokens/authentication")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(LOGIN))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"))
                .andExpect(jsonPath("$.correlationId").isNotEmpty());
    }

    @Test
    @DisplayName("a non-JSON body is 415")
    void wrongMediaType() throws Exception {
        mockMvc.perform(post("/api/v1/tokens/authentication")
                        .contentType(MediaType.TEXT_PLAIN)
                        .content("ada"))
                .andExpect(status().isUnsupportedMediaType());
    }
}
