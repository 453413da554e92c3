package com.thumbservice.thumbnail_engine.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A raw science frame as described by the archive metadata API.
 * Any field may be null when the archive omits it; eligibility checks decide what is required.
 */
public record Frame(
    String id,
    String requestId,
    String filename,
    String url,
    String configurationType,
    String primaryOpticalElement,
    String proposalId
) {

    public static Frame fromJson(JsonNode node) {
        if (node == null || node.isNull() || !node.isObject()) {
            return new Frame(null, null, null, null, null, null, null);
        }
        return new Frame(
            text(node, "id"),
            text(node, "request_id"),
            text(node, "filename"),
            text(node, "url"),
            text(node, "configuration_type"),
            text(node, "primary_optical_element"),
            text(node, "proposal_id")
        );
    }

    public boolean hasRequest() {
        return requestId != null && !requestId.isBlank() && !"0".equals(requestId);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return value.asText();
    }
}
