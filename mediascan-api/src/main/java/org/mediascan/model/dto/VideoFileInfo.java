package org.mediascan.model.dto;

import org.mediascan.model.enums.ExtraType;
import lombok.Builder;
import lombok.Value;
import org.apache.commons.io.FilenameUtils;

/**
 * A single video file or folder-based video as identified by the scanner.
 */
@Value
@Builder(toBuilder = true)
public class VideoFileInfo {
    String path;
    boolean directory;
    String container;
    String name;
    Integer year;
    ExtraType extraType;
    /**
     * Version label captured from the file name during episode grouping, e.g. {@code 1080p} for
     * {@code "Show S01E01 - [1080p].mkv"}.
     */
    String versionTag;

    public String getFileNameWithoutExtension() {
        return directory ? FilenameUtils.getName(path) : FilenameUtils.getBaseName(path);
    }

    public String getDisplayName() {
        return versionTag != null ? versionTag : name;
    }

    public boolean isExtra() {
        return extraType != null;
    }

    public VideoFileInfo withVersionTag(String tag) {
        return toBuilder().versionTag(tag).build();
    }
}
