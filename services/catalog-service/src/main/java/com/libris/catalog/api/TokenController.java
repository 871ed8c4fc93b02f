package com.libris.catalog.api;

import com.libris.catalog.domain.service.TokenService;
import com.libris.security.IssuedToken;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tokens")
public class TokenController {

    private final TokenService tokens;

    public TokenController(TokenService tokens) {
        this.tokens = tokens;
    }

    @PostMapping("/authentication")
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> createAuthenticationToken(@RequestBody LoginRequest request) {
        IssuedToken issued = tokens.createAuthenticationToken(request.email(), request.password());
        return Map.of("token", issued.plaintext(), "expiresAt", issued.expiry());
    }
}
