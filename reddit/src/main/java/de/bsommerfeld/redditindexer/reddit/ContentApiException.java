package de.bsommerfeld.redditindexer.reddit;

/**
 * A listing could not be fetched: network error, non-200 response, or a body
 * that is not a Reddit listing.
 */
public class ContentApiException extends Exception {

    public ContentApiException(String message) {
        super(message);
    }

    public ContentApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
