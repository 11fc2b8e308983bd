package com.questrail.board.manifest.config;

import com.questrail.board.manifest.observability.BoardCodecObservabilitySink;
import com.questrail.board.manifest.observability.NullObservabilitySink;

import java.util.Objects;

/**
 * Aggregated configuration for the board manifest codec.
 */
public record BoardCodecConfig(
    LabelPolicy labelPolicy,
    BoardCodecObservabilitySink observabilitySink
) {
    public BoardCodecConfig {
        Objects.requireNonNull(labelPolicy, "labelPolicy");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public static BoardCodecConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private LabelPolicy labelPolicy = LabelPolicy.defaults();
        private BoardCodecObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;

        public Builder withLabelPolicy(LabelPolicy labelPolicy) {
            this.labelPolicy = labelPolicy;
            return this;
        }

        public Builder withObservabilitySink(BoardCodecObservabilitySink observabilitySink) {
            this.observabilitySink = observabilitySink;
            return this;
        }

        public BoardCodecConfig build() {
            return new BoardCodecConfig(labelPolicy, observabilitySink);
        }
    }
}
