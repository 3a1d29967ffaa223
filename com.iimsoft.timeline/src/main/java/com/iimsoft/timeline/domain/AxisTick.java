package com.iimsoft.timeline.domain;

import java.time.LocalDateTime;

/**
 * One column of the time axis: the tick instant, its two label lines and where they go.
 * Empty text means the label is suppressed because it did not change since the previous tick.
 */
public class AxisTick {
    private final LocalDateTime date;
    private final String lowerText;
    private final String upperText;
    private final double lowerX;
    private final double lowerY;
    private final double upperX;
    private final double upperY;
    private final double gridX;
    private final boolean thick;

    public AxisTick(LocalDateTime date,
                    String lowerText, double lowerX, double lowerY,
                    String upperText, double upperX, double upperY,
                    double gridX, boolean thick) {
        this.date = date;
        this.lowerText = lowerText;
        this.lowerX = lowerX;
        this.lowerY = lowerY;
        this.upperText = upperText;
        this.upperX = upperX;
        this.upperY = upperY;
        this.gridX = gridX;
        this.thick = thick;
    }

    public LocalDateTime getDate() { return date; }
    public String getLowerText() { return lowerText; }
    public String getUpperText() { return upperText; }
    public double getLowerX() { return lowerX; }
    public double getLowerY() { return lowerY; }
    public double getUpperX() { return upperX; }
    public double getUpperY() { return upperY; }

    /** x of the vertical grid line drawn at this tick. */
    public double getGridX() { return gridX; }
    public boolean isThick() { return thick; }

    public boolean hasUpperText() { return upperText != null && !upperText.isEmpty(); }

    @Override
    public String toString() {
        return "AxisTick{" + date + ", '" + upperText + "' / '" + lowerText + "'}";
    }
}
