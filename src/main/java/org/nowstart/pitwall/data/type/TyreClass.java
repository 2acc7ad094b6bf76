package org.nowstart.pitwall.data.type;

public enum TyreClass {
    SLICK,
    INTERMEDIATE,
    FULL_WET;

    public boolean isWetTyre() {
        return this != SLICK;
    }
}
