package app.lexrecall.core.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockAndPriorityPropsTest {

    @Test
    void unsetBlockValues_fallBackToDefaults() {
        BlockProps props = BlockProps.defaults();

        assertThat(props.defaultSize()).isEqualTo(20);
        assertThat(props.maxSize()).isEqualTo(200);
        assertThat(props.maxTopicShare()).isEqualTo(0.4);
        assertThat(props.expectedAccuracy(1)).isEqualTo(0.95);
        assertThat(props.expectedAccuracy(5)).isEqualTo(0.58);
    }

    @Test
    void expectedAccuracyOfWrongLength_isRejected() {
        assertThatThrownBy(() -> new BlockProps(20, 200, 0.4, 0.7, 0.85, List.of(0.9, 0.8, 0.7)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expected-accuracy");
    }

    @Test
    void invertedAccuracyBand_isRejected() {
        assertThatThrownBy(() -> new BlockProps(20, 200, 0.4, 0.9, 0.6, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("accuracy-band-low");
    }

    @Test
    void outOfRangeBlockValues_areRejected() {
        assertThatThrownBy(() -> new BlockProps(-1, 200, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BlockProps(300, 200, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BlockProps(20, 200, 1.5, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BlockProps(20, 200, null, null, null, List.of(0.9, 0.8, 0.7, 0.6, 1.2)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void priorityWeights_mustBeUsable() {
        assertThat(PriorityProps.defaults().overdueCapDays()).isEqualTo(14);

        assertThatThrownBy(() -> new PriorityProps(-0.1, null, null, null, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PriorityProps(0.0, 0.0, 0.0, 0.0, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PriorityProps(null, null, null, null, -3, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
