package de.bsommerfeld.feedsim.db.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.bsommerfeld.feedsim.core.domain.TurnAction;
import de.bsommerfeld.feedsim.db.exception.MalformedRowException;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding for the two structured columns: {@code generated_feeds.post_uris}
 * (array of strings) and {@code turn_metadata.total_actions} (object keyed by
 * the lower-case action name).
 */
final class JsonColumns {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final TypeReference<Map<String, Integer>> COUNT_MAP = new TypeReference<>() {
    };

    private JsonColumns() {
    }

    static String writeUris(List<String> uris) {
        try {
            return MAPPER.writeValueAsString(uris);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("post_uris is not serializable", e);
        }
    }

    static List<String> readUris(String json, String context) {
        try {
            List<String> uris = MAPPER.readValue(json, STRING_LIST);
            if (uris == null || uris.contains(null)) {
                throw new MalformedRowException("post_uris", context, "contains null entries");
            }
            return uris;
        } catch (JsonProcessingException e) {
            throw new MalformedRowException("post_uris", context, "is not a JSON string array", e);
        }
    }

    static String writeActions(Map<TurnAction, Integer> actions) {
        Map<String, Integer> byName = new LinkedHashMap<>();
        for (TurnAction action : TurnAction.values()) {
            byName.put(action.value(), actions.getOrDefault(action, 0));
        }
        try {
            return MAPPER.writeValueAsString(byName);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("total_actions is not serializable", e);
        }
    }

    static Map<TurnAction, Integer> readActions(String json, String context) {
        Map<String, Integer> byName;
        try {
            byName = MAPPER.readValue(json, COUNT_MAP);
        } catch (JsonProcessingException e) {
            throw new MalformedRowException("total_actions", context, "is not a JSON object of counts", e);
        }
        if (byName == null) {
            throw new MalformedRowException("total_actions", context, "is JSON null");
        }
        Map<TurnAction, Integer> actions = new EnumMap<>(TurnAction.class);
        for (Map.Entry<String, Integer> entry : byName.entrySet()) {
            try {
                actions.put(TurnAction.fromValue(entry.getKey()), entry.getValue());
            } catch (IllegalArgumentException e) {
                throw new MalformedRowException("total_actions", context, "has unknown key '" + entry.getKey() + "'", e);
            }
        }
        return actions;
    }
}
