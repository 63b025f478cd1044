/* (C)2026 */
package com.ammann.imagebuilder.dto;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("BuildRequestDTO")
class BuildRequestDTOTest {

    @Test
    @DisplayName("should default missing env to an empty list")
    void shouldDefaultEnv() {
        BuildRequestDTO request = new BuildRequestDTO(List.of("web"), null);

        assertThat(request.envOrEmpty()).isEmpty();
    }

    @Test
    @DisplayName("should keep the given env entries in order")
    void shouldKeepEnv() {
        BuildRequestDTO request = new BuildRequestDTO(List.of("web"), List.of("A=1", "B=2"));

        assertThat(request.envOrEmpty()).containsExactly("A=1", "B=2");
    }
}
