package org.mediascan.service.naming;

import org.mediascan.model.dto.FileStack;
import org.mediascan.model.dto.VideoFileInfo;
import org.mediascan.model.dto.VideoInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Builds one {@link VideoInfo} per stack and per standalone file.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VideoTitleGrouper {

    private final VideoResolver videoResolver;

    public List<VideoInfo> group(List<FileStack> stacks, List<VideoFileInfo> standalone, boolean parseName, String libraryRoot) {
        List<VideoInfo> titles = new ArrayList<>(stacks.size() + standalone.size());

        for (FileStack stack : stacks) {
            List<VideoFileInfo> files = stack.getFiles().stream()
                    .map(path -> videoResolver.resolve(path, stack.isDirectoryStack(), parseName, libraryRoot))
                    .filter(Objects::nonNull)
                    .collect(Collectors.toCollection(ArrayList::new));
            if (files.isEmpty()) {
                log.warn("None of the {} parts of stack '{}' could be resolved, skipping it", stack.getFiles().size(), stack.getName());
                continue;
            }
            titles.add(VideoInfo.builder()
                    .name(stack.getName())
                    .year(files.get(0).getYear())
                    .files(files)
                    .build());
        }

        for (VideoFileInfo file : standalone) {
            titles.add(VideoInfo.of(file));
        }
        return titles;
    }
}
