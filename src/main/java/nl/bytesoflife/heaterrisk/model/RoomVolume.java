package nl.bytesoflife.heaterrisk.model;

/**
 * Air volume available to a heat pump unit.
 */
public enum RoomVolume {
    OPEN,
    CLOSET_LOUVERED,
    CLOSET_SEALED
}
