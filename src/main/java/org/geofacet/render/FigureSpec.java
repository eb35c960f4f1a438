package org.geofacet.render;

/**
 * Layout of a new figure.
 *
 * @param rows        grid rows
 * @param cols        grid columns
 * @param width       pixel width of the grid area
 * @param height      pixel height of the grid area
 * @param legendWidth pixel width added when a legend is placed right of the grid
 * @param titleHeight pixel height added when the figure has a title
 */
public record FigureSpec(int rows, int cols, int width, int height, int legendWidth, int titleHeight) {

    public FigureSpec {
        if (rows < 0 || cols < 0 || width < 1 || height < 1 || legendWidth < 0 || titleHeight < 0) {
            throw new IllegalArgumentException(String.format(
                    "Invalid figure spec rows=%d cols=%d size=%dx%d legendWidth=%d titleHeight=%d",
                    rows, cols, width, height, legendWidth, titleHeight));
        }
    }
}
