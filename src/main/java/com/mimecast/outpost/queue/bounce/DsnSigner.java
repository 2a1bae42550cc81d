package com.mimecast.outpost.queue.bounce;

import java.util.List;

/**
 * Signs generated DSN messages.
 */
@FunctionalInterface
public interface DsnSigner {

    /**
     * Signer that adds nothing.
     */
    DsnSigner NONE = (signers, message) -> List.of();

    /**
     * Produces signature headers for a message.
     *
     * @param signers Signer names resolved from configuration.
     * @param message Message bytes.
     * @return List of complete header lines, without line endings, to prepend.
     */
    List<String> sign(List<String> signers, byte[] message);
}
