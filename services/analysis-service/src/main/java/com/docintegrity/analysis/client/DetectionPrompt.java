package com.docintegrity.analysis.client;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

final class DetectionPrompt {

    static final String SYSTEM = "You are an expert at detecting AI-generated text. Respond with only a number.";

    private static final Pattern NUMBER = Pattern.compile("\\d+(?:\\.\\d+)?");

    private DetectionPrompt() {
    }

    static String forExcerpt(String excerpt) {
        return """
            Analyze the following text and determine if it was likely written by AI or a human.
            Consider factors like:
            - Writing style consistency
            - Vocabulary sophistication
            - Natural flow and transitions
            - Presence of AI-typical patterns (overly formal, generic phrases)
            - Human elements (personal anecdotes, unique perspectives, inconsistencies)

            Text to analyze:
            %s

            Respond with ONLY a number from 0-100, where:
            - 0-30 = Definitely human-written
            - 31-50 = Likely human-written
            - 51-70 = Uncertain/Mixed
            - 71-90 = Likely AI-generated
            - 91-100 = Definitely AI-generated

            Your response (number only):""".formatted(excerpt);
    }

    static ClassifierVerdict parseReply(String providerId, String reply) {
        if (reply == null || reply.isBlank()) {
            throw ProviderFailures.malformed(providerId, "empty reply");
        }
        Matcher matcher = NUMBER.matcher(reply);
        if (!matcher.find()) {
            throw ProviderFailures.malformed(providerId, "no score in reply '" + abbreviate(reply) + "'");
        }
        double score = Double.parseDouble(matcher.group());
        if (score > 100) {
            throw ProviderFailures.malformed(providerId, "score out of range: " + score);
        }
        return new ClassifierVerdict(score, score > 50 ? "ai" : "human", null);
    }

    private static String abbreviate(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= 40 ? trimmed : trimmed.substring(0, 40) + "...";
    }
}
