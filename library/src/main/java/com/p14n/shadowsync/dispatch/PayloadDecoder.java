package com.p14n.shadowsync.dispatch;

import java.io.IOException;
import java.util.Locale;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.p14n.shadowsync.codec.JsonUtil;
import com.p14n.shadowsync.data.Envelope;

/**
 * Decodes envelope bodies by content type: JSON (the default) into a tree,
 * {@code text/plain} into a string node.
 */
public class PayloadDecoder {

    /**
     * @throws MalformedMessageException if the content type is unsupported or
     *                                   the body does not parse
     */
    public JsonNode decode(Envelope envelope) {
        String contentType = baseType(envelope.effectiveContentType());
        if (Envelope.TEXT_PLAIN.equals(contentType)) {
            return TextNode.valueOf(envelope.bodyAsString());
        }
        if (!Envelope.APPLICATION_JSON.equals(contentType) && !contentType.endsWith("+json")) {
            throw new MalformedMessageException("Unsupported content type " + envelope.contentType());
        }
        try {
            JsonNode node = JsonUtil.parse(envelope.body());
            if (node == null || node.isMissingNode()) {
                throw new MalformedMessageException("Empty JSON body");
            }
            return node;
        } catch (IOException e) {
            throw new MalformedMessageException("Invalid JSON body: " + e.getMessage(), e);
        }
    }

    private static String baseType(String contentType) {
        int semicolon = contentType.indexOf(';');
        String base = semicolon < 0 ? contentType : contentType.substring(0, semicolon);
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
