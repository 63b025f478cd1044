/* (C)2026 */
package com.ammann.imagebuilder.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("link records")
class LinkRecordsTest {

    @Test
    @DisplayName("should render volumes in their textual form")
    void shouldRenderVolumes() {
        assertThat(new VolumeLink(null, "/data", false)).hasToString("/data");
        assertThat(new VolumeLink("/srv/res", "/res", true)).hasToString("/srv/res:/res:ro");
        assertThat(new VolumeLink(null, "/data", false).isBind()).isFalse();
    }

    @Test
    @DisplayName("should render links and env entries in their textual form")
    void shouldRenderLinksAndEnv() {
        assertThat(new NetworkLink("db.1a2b3c4d", "db")).hasToString("db.1a2b3c4d:db");
        assertThat(new VolumeFromLink("data.1", VolumeFromLink.Mode.RO)).hasToString("data.1:ro");
        assertThat(new Env("PATH", "/bin:/usr/bin").formatted()).isEqualTo("PATH=/bin:/usr/bin");
    }

    @ParameterizedTest
    @CsvSource({"ro, RO", "RW, RW", " rw , RW"})
    @DisplayName("should parse access modes case-insensitively")
    void shouldParseModes(String text, VolumeFromLink.Mode expected) {
        assertThat(VolumeFromLink.Mode.fromText(text)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "read", "r"})
    @DisplayName("should reject unknown access modes")
    void shouldRejectUnknownModes(String text) {
        assertThat(VolumeFromLink.Mode.fromText(text)).isNull();
    }
}
