package com.libris.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TokenScope")
class TokenScopeTest {

    @Test
    @DisplayName("round-trips through its column value")
    void columnValues() {
        assertThat(TokenScope.ACTIVATION.dbValue()).isEqualTo("activation");
        assertThat(TokenScope.fromDbValue("authentication")).isEqualTo(TokenScope.AUTHENTICATION);
    }

    @Test
    @DisplayName("rejects unknown values")
    void rejectsUnknown() {
        assertThatThrownBy(() -> TokenScope.fromDbValue("password-reset"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("password-reset");
    }
}
