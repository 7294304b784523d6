package org.mediascan.service.naming;

import org.mediascan.model.dto.VideoFileInfo;
import org.mediascan.model.dto.VideoInfo;
import org.mediascan.model.dto.settings.NamingOptions;
import org.mediascan.util.CleanStringParser;
import org.mediascan.util.VersionOrderingUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Collapses the titles of a movie or music video folder into one entry with alternate versions.
 * <p>
 * Grouping is all or nothing: the folder is grouped only if every title looks like a version of the
 * folder's movie, otherwise the titles are returned untouched.
 * <ul>
 *   <li>{@code Movie (2020)/Movie (2020).mkv}</li>
 *   <li>{@code Movie (2020)/Movie (2020) - 1080p.mkv}</li>
 *   <li>{@code Movie (2020)/Movie (2020) - [Director's Cut].mkv}</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MovieVersionGrouper {

    private static final Pattern BRACKETED_VERSION_PATTERN = Pattern.compile("^\\[([^\\]]*)\\]");

    private static final int NO_YEAR = -1;

    private static final Function<VideoInfo, String> BASE_NAME = video -> video.getPrimaryFile().getFileNameWithoutExtension();

    private final NamingOptions namingOptions;

    public List<VideoInfo> group(List<VideoInfo> videos) {
        if (videos.isEmpty()) {
            return videos;
        }

        String folderName = extractFolderName(videos.get(0));
        if (!isEligibleForGrouping(videos, folderName)) {
            return videos;
        }

        VideoInfo merged = merge(videos, folderName);
        log.debug("Grouped {} titles in folder '{}' into one entry with {} alternate versions",
                videos.size(), folderName, merged.getAlternateVersions().size());
        List<VideoInfo> result = new ArrayList<>();
        result.add(merged);
        return result;
    }

    public boolean isEligibleForGrouping(List<VideoInfo> videos, String folderName) {
        if (folderName == null || folderName.length() <= 1) {
            log.debug("Folder name '{}' is too short for version grouping", folderName);
            return false;
        }
        if (!haveSameYear(videos)) {
            log.debug("Titles in folder '{}' have different years, not grouping versions", folderName);
            return false;
        }
        if (videos.size() > 1 && videos.stream().anyMatch(VideoInfo::isStacked)) {
            log.debug("Folder '{}' mixes multi-part titles with other titles, not grouping versions", folderName);
            return false;
        }

        for (VideoInfo video : videos) {
            if (video.getExtraType() != null) {
                continue;
            }
            String baseName = BASE_NAME.apply(video);
            if (!isVersionOfFolder(folderName, baseName)) {
                log.debug("'{}' is not a version of '{}', not grouping versions", baseName, folderName);
                return false;
            }
        }
        return true;
    }

    boolean isVersionOfFolder(String folderName, String fileName) {
        if (!StringUtils.startsWithIgnoreCase(fileName, folderName)) {
            return false;
        }

        String remainder = fileName.substring(folderName.length()).trim();
        remainder = CleanStringParser.tryClean(remainder, namingOptions.getCleanStringPatterns())
                .map(String::trim)
                .orElse(remainder);

        return remainder.isEmpty()
                || remainder.charAt(0) == '-'
                || BRACKETED_VERSION_PATTERN.matcher(remainder).find();
    }

    private VideoInfo merge(List<VideoInfo> videos, String folderName) {
        List<VideoInfo> ordered = videos.size() > 1
                ? VersionOrderingUtils.sortByResolution(videos, BASE_NAME, BASE_NAME)
                : videos;

        VideoInfo primary = null;
        // input order, the last exact match wins
        for (VideoInfo video : videos) {
            if (folderName.equals(BASE_NAME.apply(video))) {
                primary = video;
            }
        }
        if (primary == null) {
            primary = ordered.get(0);
        }

        List<VideoFileInfo> alternates = new ArrayList<>(primary.getAlternateVersions());
        for (VideoInfo video : ordered) {
            if (video == primary) {
                continue;
            }
            alternates.add(video.getPrimaryFile());
            alternates.addAll(video.getAlternateVersions());
        }

        return primary.toBuilder()
                .name(folderName)
                .files(new ArrayList<>(primary.getFiles()))
                .alternateVersions(alternates)
                .build();
    }

    private boolean haveSameYear(List<VideoInfo> videos) {
        int firstYear = Objects.requireNonNullElse(videos.get(0).getYear(), NO_YEAR);
        return videos.stream()
                .allMatch(video -> Objects.requireNonNullElse(video.getYear(), NO_YEAR) == firstYear);
    }

    private String extractFolderName(VideoInfo video) {
        return FilenameUtils.getName(FilenameUtils.getFullPathNoEndSeparator(video.getPrimaryFile().getPath()));
    }
}
