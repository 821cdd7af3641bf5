package com.gridsql.config;

import com.gridsql.test.TestBase;
import com.gridsql.test.TestCategories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("EngineConfig")
@Tag("config")
@Tag("tier1")
@TestCategories.Unit
public class EngineConfigTest extends TestBase {

    @AfterEach
    void clearProperties() {
        System.clearProperty(EngineConfig.PROP_BRIDGE_ENABLED);
        System.clearProperty(EngineConfig.PROP_HEADER_ROWS);
        System.clearProperty(EngineConfig.PROP_VIRTUAL_INSERT);
        System.clearProperty(EngineConfig.PROP_EMPTY_STRING_IS_NULL);
        System.clearProperty(EngineConfig.PROP_TIMEZONE);
    }

    @Test
    @DisplayName("Defaults")
    void testDefaults() {
        EngineConfig config = EngineConfig.defaults();

        assertThat(config.bridgeEnabled()).isTrue();
        assertThat(config.headerRows()).isEqualTo(1);
        assertThat(config.virtualInsertEnabled()).isTrue();
        assertThat(config.emptyStringIsNull()).isTrue();
    }

    @Test
    @DisplayName("toBuilder copies every setting")
    void testToBuilder() {
        EngineConfig original = fixedConfig().toBuilder()
            .bridgeEnabled(false)
            .headerRows(2)
            .virtualInsertEnabled(false)
            .emptyStringIsNull(false)
            .build();

        EngineConfig copy = original.toBuilder().build();

        assertThat(copy.bridgeEnabled()).isFalse();
        assertThat(copy.headerRows()).isEqualTo(2);
        assertThat(copy.virtualInsertEnabled()).isFalse();
        assertThat(copy.emptyStringIsNull()).isFalse();
        assertThat(copy.clock()).isSameAs(original.clock());
    }

    @Test
    @DisplayName("Negative header rows are rejected")
    void testNegativeHeaderRows() {
        assertThatThrownBy(() -> EngineConfig.builder().headerRows(-1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("headerRows");
    }

    @Test
    @DisplayName("System properties override the defaults")
    void testSystemProperties() {
        System.setProperty(EngineConfig.PROP_BRIDGE_ENABLED, "FALSE");
        System.setProperty(EngineConfig.PROP_HEADER_ROWS, " 0 ");
        System.setProperty(EngineConfig.PROP_VIRTUAL_INSERT, "false");
        System.setProperty(EngineConfig.PROP_TIMEZONE, "Europe/Paris");

        EngineConfig config = EngineConfig.fromSystemProperties();

        assertThat(config.bridgeEnabled()).isFalse();
        assertThat(config.headerRows()).isZero();
        assertThat(config.virtualInsertEnabled()).isFalse();
        assertThat(config.emptyStringIsNull()).isTrue();
        assertThat(config.clock().getZone()).isEqualTo(ZoneId.of("Europe/Paris"));
    }

    @Test
    @DisplayName("Invalid property values fall back to the defaults")
    void testInvalidProperties() {
        System.setProperty(EngineConfig.PROP_BRIDGE_ENABLED, "maybe");
        System.setProperty(EngineConfig.PROP_HEADER_ROWS, "-3");
        System.setProperty(EngineConfig.PROP_EMPTY_STRING_IS_NULL, "no");
        System.setProperty(EngineConfig.PROP_TIMEZONE, "Not/AZone");

        EngineConfig config = EngineConfig.fromSystemProperties();

        assertThat(config.bridgeEnabled()).isTrue();
        assertThat(config.headerRows()).isEqualTo(EngineConfig.DEFAULT_HEADER_ROWS);
        assertThat(config.emptyStringIsNull()).isTrue();
        assertThat(config.clock().getZone()).isEqualTo(ZoneId.systemDefault());

        System.setProperty(EngineConfig.PROP_HEADER_ROWS, "two");
        assertThat(EngineConfig.fromSystemProperties().headerRows()).isEqualTo(1);
    }
}
