package nl.bytesoflife.heaterrisk.model;

public enum GasLineSize {
    HALF_INCH,
    THREE_QUARTER_INCH,
    ONE_INCH
}
