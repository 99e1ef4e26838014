package com.questrail.steward.dispatch;

import java.util.Objects;
import java.util.Optional;

/**
 * Predicate over discriminators, with a readable description for logs and
 * rate-limit keys.
 */
public sealed interface DiscriminatorMatcher
    permits DiscriminatorMatcher.Exact, DiscriminatorMatcher.Prefix, DiscriminatorMatcher.Excluding
{
    boolean matches(String discriminator);

    String describe();

    /**
     * The literal value for exact matchers; empty otherwise.
     */
    default Optional<String> exactValue() {
        return Optional.empty();
    }

    /**
     * This matcher, additionally requiring that {@code fragment} does not
     * occur in the discriminator.
     */
    default DiscriminatorMatcher excluding(String fragment) {
        return new Excluding(this, fragment);
    }

    static DiscriminatorMatcher exact(String value) {
        return new Exact(value);
    }

    static DiscriminatorMatcher prefix(String prefix) {
        return new Prefix(prefix);
    }

    record Exact(String value) implements DiscriminatorMatcher {
        public Exact {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean matches(String discriminator) {
            return value.equals(discriminator);
        }

        @Override
        public String describe() {
            return value;
        }

        @Override
        public Optional<String> exactValue() {
            return Optional.of(value);
        }
    }

    record Prefix(String prefix) implements DiscriminatorMatcher {
        public Prefix {
            Objects.requireNonNull(prefix, "prefix");
            if (prefix.isEmpty()) {
                throw new IllegalArgumentException("prefix must not be empty");
            }
        }

        @Override
        public boolean matches(String discriminator) {
            return discriminator != null && discriminator.startsWith(prefix);
        }

        @Override
        public String describe() {
            return prefix + "*";
        }
    }

    record Excluding(DiscriminatorMatcher base, String fragment) implements DiscriminatorMatcher {
        public Excluding {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(fragment, "fragment");
        }

        @Override
        public boolean matches(String discriminator) {
            return base.matches(discriminator) && !discriminator.contains(fragment);
        }

        @Override
        public String describe() {
            return base.describe() + " !" + fragment;
        }
    }
}
