package uk.gegc.railintel.shared.exception;

public class ChunkingException extends RuntimeException {

    public ChunkingException(String message) {
        super(message);
    }
}
