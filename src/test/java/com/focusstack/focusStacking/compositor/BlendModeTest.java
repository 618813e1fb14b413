package com.focusstack.focusStacking.compositor;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlendModeTest {

    @Test
    void parsesBlendModes() {
        assertThat(BlendMode.fromValue("hard")).isEqualTo(BlendMode.HARD);
        assertThat(BlendMode.fromValue("FEATHERED")).isEqualTo(BlendMode.FEATHERED);
        assertThat(BlendMode.HARD.value()).isEqualTo("hard");
        assertThatThrownBy(() -> BlendMode.fromValue("average"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
