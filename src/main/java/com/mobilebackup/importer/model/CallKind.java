package com.mobilebackup.importer.model;

public enum CallKind {
    VOICE,
    FACETIME_VIDEO,
    FACETIME_AUDIO;

    /** ZCALLTYPE：1 普通电话，8 视频，16 语音 */
    public static CallKind fromCallType(Integer callType) {
        if (callType == null) {
            return VOICE;
        }
        return switch (callType) {
            case 8 -> FACETIME_VIDEO;
            case 16 -> FACETIME_AUDIO;
            default -> VOICE;
        };
    }
}
