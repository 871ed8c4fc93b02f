package com.libris.database.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

@DisplayName("FlywayConfigProperties")
class FlywayConfigPropertiesTest {

    private static FlywayConfigProperties bind(Map<String, String> values) {
        return new Binder(new MapConfigurationPropertySource(values))
                .bindOrCreate("libris.flyway", FlywayConfigProperties.class);
    }

    @Nested
    @DisplayName("Binding")
    class Binding {

        @Test
        @DisplayName("defaults to enabled, classpath:db/migration, no baseline")
        void defaults() {
            var props = bind(Map.of());

            assertThat(props.enabled()).isTrue();
            assertThat(props.locations()).containsExactly("classpath:db/migration");
            assertThat(props.baselineOnMigrate()).isFalse();
        }

        @Test
        @DisplayName("binds explicit values in relaxed form")
        void explicitValues() {
            var props =
                    bind(
                            Map.of(
                                    "libris.flyway.enabled", "false",
                                    "libris.flyway.locations", "classpath:db/migration,classpath:db/seed",
                                    "libris.flyway.baseline-on-migrate", "true"));

            assertThat(props.enabled()).isFalse();
            assertThat(props.locations()).containsExactly("classpath:db/migration", "classpath:db/seed");
            assertThat(props.baselineOnMigrate()).isTrue();
        }
    }

    @Test
    @DisplayName("configured Flyway instance uses the given locations")
    void flywayUsesLocations() {
        var props = new FlywayConfigProperties(true, List.of("classpath:db/migration"), false);
        var dataSource = mock(DataSource.class);

        var flyway = FlywayMigrationConfig.createFlyway(dataSource, props);

        assertThat(flyway.getConfiguration().getLocations())
                .extracting(Object::toString)
                .containsExactly("classpath:db/migration");
        assertThat(flyway.getConfiguration().isCleanDisabled()).isTrue();
    }
}
