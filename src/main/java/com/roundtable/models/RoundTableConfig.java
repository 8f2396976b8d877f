package com.roundtable.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Participant roster and chairman for round table mode.
 * Participants keep insertion order, which is also the order their answers are shown in.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"models", "chairman_model"})
public class RoundTableConfig {

    private final Map<String, ModelRef> models = new LinkedHashMap<>();
    private ModelRef chairmanModel;

    public RoundTableConfig() {}

    public RoundTableConfig(RoundTableConfig other) {
        if (other != null) {
            this.models.putAll(other.models);
            this.chairmanModel = other.chairmanModel;
        }
    }

    public Map<String, ModelRef> getModels() {
        return Collections.unmodifiableMap(models);
    }

    public void setModels(Map<String, ModelRef> models) {
        this.models.clear();
        if (models != null) {
            this.models.putAll(models);
        }
    }

    @JsonProperty("chairman_model")
    public ModelRef getChairmanModel() {
        return chairmanModel;
    }

    @JsonProperty("chairman_model")
    public void setChairmanModel(ModelRef chairmanModel) {
        this.chairmanModel = chairmanModel;
    }

    /**
     * Adds a participant. Returns false, leaving the roster untouched, when the name is already taken.
     */
    public boolean addModel(String name, ModelRef model) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Participant name is required");
        }
        if (model == null) {
            throw new IllegalArgumentException("Participant model is required");
        }
        if (models.containsKey(name)) {
            return false;
        }
        models.put(name, model);
        return true;
    }

    public boolean removeModel(String name) {
        return name != null && models.remove(name) != null;
    }

    public boolean hasModel(String name) {
        return name != null && models.containsKey(name);
    }

    public void setChairman(ModelRef chairman) {
        this.chairmanModel = chairman;
    }

    public boolean hasChairman() {
        return chairmanModel != null;
    }

    /**
     * Drops every participant and the chairman.
     */
    public void clearModels() {
        models.clear();
        chairmanModel = null;
    }

    public int size() {
        return models.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return models.isEmpty();
    }
}
