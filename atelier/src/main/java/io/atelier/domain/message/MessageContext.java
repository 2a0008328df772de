package io.atelier.domain.message;

/**
 * Optional pointer from a message back to the canvas element it concerns.
 * Any field may be null.
 */
public record MessageContext(
    String cardId,
    String nodeId,
    String connectionId,
    String templateId,
    String assetId,
    String workflowState
) {
    public static MessageContext forCard(String cardId) {
        return new MessageContext(cardId, null, null, null, null, null);
    }
}
