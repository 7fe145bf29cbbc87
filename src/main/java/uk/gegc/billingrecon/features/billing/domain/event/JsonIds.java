package uk.gegc.billingrecon.features.billing.domain.event;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Provider payloads reference related objects either by id or as an expanded object.
 */
final class JsonIds {

    private JsonIds() {
    }

    static String idOf(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            return idOf(node.get("id"));
        }
        String text = node.asText().trim();
        return text.isEmpty() ? null : text;
    }

    static String textAt(JsonNode node, String path) {
        if (node == null) {
            return null;
        }
        return idOf(node.at(path));
    }
}
