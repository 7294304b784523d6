package org.mediascan.model.dto;

import org.mediascan.model.enums.ExtraType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One logical title: a single file, a multi-part stack, or a primary file with its alternate versions.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class VideoInfo {
    private String name;
    private Integer year;
    @Builder.Default
    private List<VideoFileInfo> files = new ArrayList<>();
    @Builder.Default
    private List<VideoFileInfo> alternateVersions = new ArrayList<>();
    private ExtraType extraType;

    public VideoFileInfo getPrimaryFile() {
        return files.isEmpty() ? null : files.get(0);
    }

    public boolean isStacked() {
        return files.size() > 1;
    }

    public static VideoInfo of(VideoFileInfo file) {
        return VideoInfo.builder()
                .name(file.getName())
                .year(file.getYear())
                .files(new ArrayList<>(List.of(file)))
                .extraType(file.getExtraType())
                .build();
    }
}
