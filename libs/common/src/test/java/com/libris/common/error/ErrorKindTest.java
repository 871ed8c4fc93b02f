package com.libris.common.error;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Error taxonomy")
class ErrorKindTest {

    @Test
    @DisplayName("each exception type reports its kind")
    void exceptionsReportKind() {
        assertThat(new ValidationException("sort", "invalid sort value").kind())
                .isEqualTo(ErrorKind.VALIDATION);
        assertThat(new AuthenticationException(AuthenticationException.Reason.MISSING_CREDENTIAL).kind())
                .isEqualTo(ErrorKind.AUTHENTICATION);
        assertThat(new RecordNotFoundException("book 7").kind()).isEqualTo(ErrorKind.NOT_FOUND);
        assertThat(new EditConflictException("version moved").kind()).isEqualTo(ErrorKind.CONFLICT);
        assertThat(new StorageTimeoutException("search", null).kind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(new StorageException("down", null).kind()).isEqualTo(ErrorKind.STORAGE);
    }

    @Test
    @DisplayName("only TIMEOUT and STORAGE are server faults")
    void serverFaults() {
        assertThat(ErrorKind.TIMEOUT.isServerFault()).isTrue();
        assertThat(ErrorKind.STORAGE.isServerFault()).isTrue();
        assertThat(ErrorKind.VALIDATION.isServerFault()).isFalse();
        assertThat(ErrorKind.AUTHENTICATION.isServerFault()).isFalse();
        assertThat(ErrorKind.NOT_FOUND.isServerFault()).isFalse();
        assertThat(ErrorKind.CONFLICT.isServerFault()).isFalse();
    }

    @Test
    @DisplayName("authentication reasons share one message")
    void authenticationReasonsShareMessage() {
        var missing = new AuthenticationException(AuthenticationException.Reason.MISSING_CREDENTIAL);
        var invalid = new AuthenticationException(AuthenticationException.Reason.INVALID_CREDENTIAL);

        assertThat(missing.getMessage()).isEqualTo(invalid.getMessage());
        assertThat(missing.reason()).isNotEqualTo(invalid.reason());
    }

    @Test
    @DisplayName("ValidationException rejects an empty error map")
    void validationRejectsEmpty() {
        assertThatThrownBy(() -> new ValidationException(Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
