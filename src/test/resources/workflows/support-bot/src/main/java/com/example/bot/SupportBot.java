package com.example.bot;

import java.util.Map;

public class SupportBot {

    public record BotState(String message, String intent, String reply) {
    }

    public static Map<String, Object> classify(Map<String, Object> state) {
        return Map.of("intent", "billing");
    }

    @SuppressWarnings("unused")
    public static Map<String, Object> answer(Map<String, Object> state) {
        return Map.of("reply", "done");
    }

    public static Map<String, Object> escalate(Map<String, Object> state) {
        return Map.of("reply", "escalated");
    }

    public static String routeByIntent(Map<String, Object> state) {
        return "billing".equals(state.get("intent")) ? "answer" : "escalate";
    }

    public record BotReply(String reply) {
    }
}
