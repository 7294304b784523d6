package org.mediascan.service.naming;

import org.mediascan.model.dto.VideoFileInfo;
import org.mediascan.model.dto.VideoInfo;
import org.mediascan.util.VersionOrderingUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Groups versions of the same TV episode, e.g. {@code Show S01E01.mkv} and {@code Show S01E01 - [1080p].mkv}.
 * Each episode is grouped on its own; a file that does not look like a version simply stays alone.
 */
@Slf4j
@Component
public class EpisodeVersionGrouper {

    // "Name - Version" or "Name - [Version]", but never "Name - S01E01"
    private static final Pattern EPISODE_VERSION_PATTERN = Pattern.compile(
            "^(?<base>.+) - (?:\\[(?<bracketed>.+)\\]|(?<plain>(?!s\\d{2}e\\d{2}$)[^\\[\\]]+))$",
            Pattern.CASE_INSENSITIVE
    );

    private static final int MAX_EXPECTED_VERSIONS = 2;

    // base keys are lowercased file names and never contain a NUL
    private static final String STACK_SLOT_PREFIX = "\0stack:";

    public record EpisodeKey(String baseEpisode, String versionTag) {}

    public List<VideoInfo> group(List<VideoInfo> videos) {
        if (videos.size() < 2) {
            return videos;
        }

        // stacks are kept whole, each in its own slot
        Map<String, EpisodeGroup> groups = new LinkedHashMap<>();
        for (VideoInfo video : videos) {
            if (video.getFiles().isEmpty()) {
                continue;
            }
            if (video.isStacked()) {
                groups.put(STACK_SLOT_PREFIX + groups.size(), EpisodeGroup.ofStack(video));
                continue;
            }

            VideoFileInfo file = video.getPrimaryFile();
            EpisodeKey key = extractEpisodeKey(file.getFileNameWithoutExtension());
            if (key.versionTag() != null) {
                file = file.withVersionTag(key.versionTag());
            }

            EpisodeGroup group = groups.computeIfAbsent(key.baseEpisode().toLowerCase(Locale.ROOT),
                    k -> new EpisodeGroup(key.baseEpisode(), video.getName(), video.getYear()));
            group.files.add(file);
            group.files.addAll(video.getAlternateVersions());
        }

        List<VideoInfo> result = new ArrayList<>(groups.size());
        for (EpisodeGroup group : groups.values()) {
            if (group.stack != null) {
                result.add(group.stack);
                continue;
            }
            if (group.files.size() > MAX_EXPECTED_VERSIONS) {
                log.warn("Found more than {} versions for episode {}. This might indicate an incompatible file naming scheme.",
                        MAX_EXPECTED_VERSIONS, group.baseEpisode);
            }
            result.add(buildEpisode(group));
        }

        log.debug("Grouped {} episode files into {} episodes", videos.size(), result.size());
        return result;
    }

    /**
     * Splits a file name into the part naming the episode and an optional version tag.
     */
    public EpisodeKey extractEpisodeKey(String fileName) {
        Matcher matcher = EPISODE_VERSION_PATTERN.matcher(fileName);
        if (!matcher.matches()) {
            return new EpisodeKey(fileName, null);
        }
        String version = matcher.group("bracketed") != null ? matcher.group("bracketed") : matcher.group("plain");
        return new EpisodeKey(matcher.group("base"), version);
    }

    private VideoInfo buildEpisode(EpisodeGroup group) {
        List<VideoFileInfo> ordered = group.files.size() > 1
                ? VersionOrderingUtils.sortByResolution(group.files, VideoFileInfo::getDisplayName, VideoFileInfo::getFileNameWithoutExtension)
                : group.files;

        VideoFileInfo primary = ordered.stream()
                .filter(file -> file.getFileNameWithoutExtension().equalsIgnoreCase(group.baseEpisode))
                .findFirst()
                .orElse(ordered.get(0));

        List<VideoFileInfo> alternates = new ArrayList<>(ordered.size() - 1);
        for (VideoFileInfo file : ordered) {
            if (file != primary) {
                alternates.add(file);
            }
        }

        List<VideoFileInfo> files = new ArrayList<>();
        files.add(primary);
        return VideoInfo.builder()
                .name(group.name)
                .year(group.year)
                .files(files)
                .alternateVersions(alternates)
                .build();
    }

    private static class EpisodeGroup {
        final String baseEpisode;
        final String name;
        final Integer year;
        final List<VideoFileInfo> files = new ArrayList<>();
        VideoInfo stack;

        EpisodeGroup(String baseEpisode, String name, Integer year) {
            this.baseEpisode = baseEpisode;
            this.name = name;
            this.year = year;
        }

        static EpisodeGroup ofStack(VideoInfo video) {
            EpisodeGroup group = new EpisodeGroup(null, video.getName(), video.getYear());
            group.stack = video;
            return group;
        }
    }
}
