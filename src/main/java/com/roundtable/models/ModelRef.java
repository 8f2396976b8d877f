package com.roundtable.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A (provider, model id) pair. Written as a two-element array, e.g. {@code ["Anthropic", "claude-3-opus-20240229"]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"provider", "model"})
public final class ModelRef {

    private final Provider provider;
    private final String model;

    @JsonCreator
    public ModelRef(@JsonProperty("provider") Provider provider, @JsonProperty("model") String model) {
        if (provider == null) {
            throw new IllegalArgumentException("Provider is required");
        }
        if (model == null || model.isBlank()) {
            throw new IllegalArgumentException("Model is required");
        }
        this.provider = provider;
        this.model = model;
    }

    public static ModelRef of(Provider provider, String model) {
        return new ModelRef(provider, model);
    }

    public Provider getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModelRef)) return false;
        ModelRef other = (ModelRef) o;
        return provider == other.provider && model.equals(other.model);
    }

    @Override
    public int hashCode() {
        return Objects.hash(provider, model);
    }

    @Override
    public String toString() {
        return model + " (" + provider.getLabel() + ")";
    }
}
