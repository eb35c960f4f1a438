package org.geofacet.facet;

/**
 * A region whose plot callback threw. The rest of the figure was still rendered.
 *
 * @param region region code from the grid
 * @param cause  the exception thrown by the callback
 */
public record RenderFailure(String region, Exception cause) {

    public String message() {
        return "Error plotting region " + region + ": " + cause;
    }
}
