package com.questrail.board.manifest.config;

import com.questrail.board.manifest.model.ViewingDirection;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Pass-through manifest properties chosen by the caller at export time.
 */
public record EncodeOptions(
    List<String> behavior,
    ViewingDirection viewingDirection
) {
    /** Behavior written when the caller does not choose one. */
    public static final List<String> DEFAULT_BEHAVIOR = List.of("individuals");

    private static final EncodeOptions DEFAULTS = new EncodeOptions(DEFAULT_BEHAVIOR, null);

    public EncodeOptions {
        Objects.requireNonNull(behavior, "behavior");
        behavior = behavior.isEmpty() ? DEFAULT_BEHAVIOR : List.copyOf(behavior);
    }

    public static EncodeOptions defaults() {
        return DEFAULTS;
    }

    public Optional<ViewingDirection> viewingDirectionValue() {
        return Optional.ofNullable(viewingDirection);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<String> behavior = new ArrayList<>();
        private ViewingDirection viewingDirection;

        public Builder addBehavior(String value) {
            behavior.add(Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder withViewingDirection(ViewingDirection viewingDirection) {
            this.viewingDirection = viewingDirection;
            return this;
        }

        public EncodeOptions build() {
            return new EncodeOptions(behavior, viewingDirection);
        }
    }
}
