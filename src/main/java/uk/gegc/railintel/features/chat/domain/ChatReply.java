package uk.gegc.railintel.features.chat.domain;

/**
 * @param aiGenerated false when the rule-based responder produced the text
 */
public record ChatReply(String response, boolean aiGenerated) {
}
