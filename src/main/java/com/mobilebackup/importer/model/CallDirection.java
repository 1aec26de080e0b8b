package com.mobilebackup.importer.model;

/**
 * 通话方向。源库里没有直接存方向，只有“是否本机发起”和“是否接通”两个布尔值。
 */
public enum CallDirection {
    OUTGOING,
    INCOMING,
    MISSED;

    /**
     * 本机发起 → outgoing；非本机发起且未接通 → missed；其余 → incoming。
     */
    public static CallDirection derive(boolean originated, boolean answered) {
        if (originated) {
            return OUTGOING;
        }
        return answered ? INCOMING : MISSED;
    }
}
