package com.libris.catalog.api;

import com.libris.catalog.domain.service.UserService;
import com.libris.catalog.domain.service.UserService.Registration;
import com.libris.observability.SensitiveDataRedactor;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Account registration and activation. */
@RestController
@RequestMapping("/api/v1/users")
public class UserController {

    private static final Logger log = LoggerFactory.getLogger(UserController.class);

    private final UserService users;
    private final SensitiveDataRedactor redactor;

    public UserController(UserService users, SensitiveDataRedactor redactor) {
        this.users = users;
        this.redactor = redactor;
    }

    /**
     * Registers an inactive account. The response carries the activation token; it is the only
     * time the plaintext is available.
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Map<String, Object> register(@RequestBody RegisterUserRequest request) {
        if (log.isDebugEnabled()) {
            Map<String, Object> fields = new HashMap<>();
            fields.put("name", request.name());
            fields.put("email", request.email());
            fields.put("password", request.password());
            log.debug("Registration request {}", redactor.redact(fields));
        }
        Registration registration = users.register(request.name(), request.email(), request.password());
        return Map.of(
                "token", registration.activationToken().plaintext(),
                "user", UserView.of(registration.user()));
    }

    @PutMapping("/activated")
    public Map<String, Object> activate(@RequestBody ActivateUserRequest request) {
        return Map.of("user", UserView.of(users.activate(request.token())));
    }
}
