package org.mediascan.model.enums;

import org.mediascan.exception.ApiError;
import lombok.Getter;
import org.apache.commons.lang3.EnumUtils;
import org.apache.commons.lang3.StringUtils;

@Getter
public enum CollectionType {

    MOVIES(true),
    TVSHOWS(true),
    MUSICVIDEOS(true),
    HOMEVIDEOS(true),
    BOXSETS(true),
    MIXED(true),
    MUSIC(false),
    BOOKS(false),
    PHOTOS(false),
    PLAYLISTS(false),
    LIVETV(false);

    private final boolean video;

    CollectionType(boolean video) {
        this.video = video;
    }

    /**
     * Parses a configured collection type. Blank values mean "unspecified" and map to {@code null}.
     */
    public static CollectionType fromValue(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        CollectionType type = EnumUtils.getEnumIgnoreCase(CollectionType.class, value.trim());
        if (type == null) {
            throw ApiError.INVALID_COLLECTION_TYPE.createException(value);
        }
        return type;
    }
}
