package com.roundtable.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Shape of a prompt file: {@code {"prompt": "..."}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SystemPrompt {
    private String prompt;

    public SystemPrompt() {}

    public SystemPrompt(String prompt) {
        this.prompt = prompt;
    }

    public String getPrompt() {
        return prompt;
    }

    public void setPrompt(String prompt) {
        this.prompt = prompt;
    }
}
