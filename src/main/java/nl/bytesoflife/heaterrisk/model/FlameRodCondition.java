package nl.bytesoflife.heaterrisk.model;

public enum FlameRodCondition {
    GOOD,
    WORN,
    FAILING
}
