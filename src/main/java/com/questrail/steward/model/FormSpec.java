package com.questrail.steward.model;

import java.util.List;
import java.util.Objects;

/**
 * A form (modal) presented to the actor. Its submission comes back as a
 * {@link EventType#FORM} event whose discriminator is {@code customId}.
 */
public record FormSpec(String customId, String title, List<Field> fields) {

    public FormSpec {
        Objects.requireNonNull(customId, "customId");
        Objects.requireNonNull(title, "title");
        fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("a form needs at least one field");
        }
    }

    public record Field(String customId, String label, boolean required) {
        public Field {
            Objects.requireNonNull(customId, "customId");
            Objects.requireNonNull(label, "label");
        }
    }
}
