package com.roundtable.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One entry of a conversation log. Immutable once created.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Message {

    private final Role role;
    private final String content;
    private final String source;

    @JsonCreator
    public Message(@JsonProperty("role") Role role,
                   @JsonProperty("content") String content,
                   @JsonProperty("source") String source) {
        if (role == null) {
            throw new IllegalArgumentException("Message role is required");
        }
        if (content == null || content.isEmpty()) {
            throw new IllegalArgumentException("Message content must not be empty");
        }
        this.role = role;
        this.content = content;
        this.source = source;
    }

    public static Message user(String content) {
        return new Message(Role.USER, content, null);
    }

    public static Message assistant(String content) {
        return new Message(Role.ASSISTANT, content, null);
    }

    public static Message assistant(String content, String source) {
        return new Message(Role.ASSISTANT, content, source);
    }

    public Role getRole() {
        return role;
    }

    public String getContent() {
        return content;
    }

    /**
     * Participant name or chairman label for round table answers, null otherwise.
     */
    public String getSource() {
        return source;
    }

    @JsonIgnore
    public boolean isUser() {
        return role == Role.USER;
    }

    @JsonIgnore
    public boolean isAssistant() {
        return role == Role.ASSISTANT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        Message other = (Message) o;
        return role == other.role
            && content.equals(other.content)
            && Objects.equals(source, other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, content, source);
    }

    @Override
    public String toString() {
        return "Message{role=" + role.getWireName()
            + (source != null ? ", source=" + source : "")
            + ", content=" + content.length() + " chars}";
    }
}
