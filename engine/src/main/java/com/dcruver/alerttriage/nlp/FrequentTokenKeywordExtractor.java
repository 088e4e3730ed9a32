package com.dcruver.alerttriage.nlp;

import com.dcruver.alerttriage.domain.Alert;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Picks the tokens that appear in the most alerts of a group.
 *
 * Tokens come from the textual values and field names of each alert's data payload.
 * Counts are per alert (document frequency), so one noisy alert cannot dominate.
 */
@Component
@Slf4j
public class FrequentTokenKeywordExtractor implements KeywordExtractor {

    private static final Pattern TOKEN_SPLIT = Pattern.compile("[^\\p{L}\\p{N}_.-]+");
    private static final Pattern NUMERIC = Pattern.compile("[\\d._-]+");
    private static final int MIN_TOKEN_LENGTH = 3;
    private static final int MAX_TOKEN_LENGTH = 40;

    private static final Set<String> STOPWORDS = Set.of(
        "the", "and", "for", "with", "from", "this", "that", "are", "was", "were",
        "has", "have", "not", "but", "you", "all", "any", "can", "had", "her",
        "his", "its", "our", "out", "via", "into", "true", "false", "null",
        "http", "https", "www", "com", "id", "data", "type", "value", "name"
    );

    @Override
    public List<String> extract(List<Alert> alerts, int limit) {
        if (alerts == null || alerts.isEmpty() || limit <= 0) {
            return List.of();
        }

        Map<String, Integer> documentFrequency = new HashMap<>();
        for (Alert alert : alerts) {
            Set<String> tokens = new HashSet<>();
            collectTokens(alert.getData(), tokens);
            for (String token : tokens) {
                documentFrequency.merge(token, 1, Integer::sum);
            }
        }

        // A single alert has nothing to agree with; otherwise require at least two
        int minFrequency = alerts.size() == 1 ? 1 : 2;

        List<String> keywords = documentFrequency.entrySet().stream()
            .filter(e -> e.getValue() >= minFrequency)
            .sorted(Map.Entry.<String, Integer>comparingByValue().reversed()
                .thenComparing(Map.Entry.<String, Integer>comparingByKey()))
            .limit(limit)
            .map(Map.Entry::getKey)
            .toList();

        log.debug("Extracted keywords {} from {} alerts", keywords, alerts.size());
        return keywords;
    }

    private void collectTokens(JsonNode node, Set<String> tokens) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return;
        }

        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                addTokens(field.getKey(), tokens);
                collectTokens(field.getValue(), tokens);
            }
        } else if (node.isArray()) {
            for (JsonNode element : node) {
                collectTokens(element, tokens);
            }
        } else if (node.isTextual()) {
            addTokens(node.asText(), tokens);
        }
    }

    private void addTokens(String text, Set<String> tokens) {
        for (String raw : TOKEN_SPLIT.split(text.toLowerCase(Locale.ROOT))) {
            String token = trimPunctuation(raw);
            if (token.length() < MIN_TOKEN_LENGTH || token.length() > MAX_TOKEN_LENGTH) {
                continue;
            }
            if (STOPWORDS.contains(token) || NUMERIC.matcher(token).matches()) {
                continue;
            }
            tokens.add(token);
        }
    }

    private String trimPunctuation(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && isEdgePunctuation(token.charAt(start))) {
            start++;
        }
        while (end > start && isEdgePunctuation(token.charAt(end - 1))) {
            end--;
        }
        return token.substring(start, end);
    }

    private boolean isEdgePunctuation(char c) {
        return c == '.' || c == '-' || c == '_';
    }
}
