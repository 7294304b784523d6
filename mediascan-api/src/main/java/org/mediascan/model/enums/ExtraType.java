package org.mediascan.model.enums;

public enum ExtraType {
    UNKNOWN,
    CLIP,
    TRAILER,
    BEHIND_THE_SCENES,
    DELETED_SCENE,
    INTERVIEW,
    SCENE,
    SAMPLE,
    THEME_SONG,
    THEME_VIDEO,
    FEATURETTE,
    SHORT
}
