package com.roundtable.engine;

import com.roundtable.models.Message;
import com.roundtable.models.Provider;
import com.roundtable.providers.ProviderException;
import com.roundtable.providers.chat.ChatProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted provider: each model id answers with a fixed text, fails, or fails a number of times first.
 */
public class FakeChatProvider implements ChatProvider {

    public interface Behavior {
        String answer(Call call) throws ProviderException, InterruptedException;
    }

    public static final class Call {
        public final String model;
        public final List<Message> messages;
        public final String systemPrompt;
        public final double temperature;

        Call(String model, List<Message> messages, String systemPrompt, double temperature) {
            this.model = model;
            this.messages = List.copyOf(messages);
            this.systemPrompt = systemPrompt;
            this.temperature = temperature;
        }
    }

    private final Provider provider;
    private final Map<String, Behavior> behaviors = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();
    private final List<Call> calls = new CopyOnWriteArrayList<>();

    public FakeChatProvider(Provider provider) {
        this.provider = provider;
    }

    public FakeChatProvider answer(String model, String text) {
        behaviors.put(model, call -> text);
        return this;
    }

    public FakeChatProvider fail(String model, String message) {
        behaviors.put(model, call -> {
            throw new ProviderException(message, 503, "{\"error\":\"" + message + "\"}");
        });
        return this;
    }

    public FakeChatProvider failThenAnswer(String model, int failures, String text) {
        AtomicInteger remaining = new AtomicInteger(failures);
        behaviors.put(model, call -> {
            if (remaining.getAndDecrement() > 0) {
                throw new ProviderException("transient failure");
            }
            return text;
        });
        return this;
    }

    public FakeChatProvider behave(String model, Behavior behavior) {
        behaviors.put(model, behavior);
        return this;
    }

    @Override
    public Provider getProvider() {
        return provider;
    }

    @Override
    public String complete(String apiKey, String model, List<Message> messages, String systemPrompt, double temperature)
        throws ProviderException, InterruptedException {
        Call call = new Call(model, messages, systemPrompt, temperature);
        calls.add(call);
        counts.computeIfAbsent(model, m -> new AtomicInteger()).incrementAndGet();
        Behavior behavior = behaviors.get(model);
        if (behavior == null) {
            throw new ProviderException("No script for model " + model);
        }
        return behavior.answer(call);
    }

    public int callCount(String model) {
        AtomicInteger count = counts.get(model);
        return count != null ? count.get() : 0;
    }

    public List<Call> calls() {
        return new ArrayList<>(calls);
    }

    public List<Call> callsFor(String model) {
        List<Call> result = new ArrayList<>();
        for (Call call : calls) {
            if (call.model.equals(model)) {
                result.add(call);
            }
        }
        return result;
    }
}
