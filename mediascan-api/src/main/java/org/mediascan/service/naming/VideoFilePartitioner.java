package org.mediascan.service.naming;

import org.mediascan.model.dto.FileStack;
import org.mediascan.model.dto.FileSystemMetadata;
import org.mediascan.model.dto.VideoFileInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the files of one media item into stacks, standalone files and extras.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VideoFilePartitioner {

    private final StackResolver stackResolver;

    public record PartitionResult(
            List<FileStack> stacks,
            List<VideoFileInfo> standalone,
            List<VideoFileInfo> extras
    ) {}

    public PartitionResult partition(List<VideoFileInfo> files) {
        // extras stay out of stack detection, "Movie cd1" + "Movie cd2-trailer" is not a stack
        List<FileSystemMetadata> nonExtras = files.stream()
                .filter(file -> !file.isExtra())
                .map(file -> new FileSystemMetadata(file.getPath(), file.isDirectory()))
                .toList();

        List<FileStack> stacks = stackResolver.resolve(nonExtras);

        List<VideoFileInfo> standalone = new ArrayList<>();
        List<VideoFileInfo> extras = new ArrayList<>();
        for (VideoFileInfo file : files) {
            if (stacks.stream().anyMatch(stack -> stack.containsFile(file.getPath(), file.isDirectory()))) {
                continue;
            }
            if (file.isExtra()) {
                extras.add(file);
            } else {
                standalone.add(file);
            }
        }

        log.debug("Partitioned {} files into {} stacks, {} standalone and {} extras",
                files.size(), stacks.size(), standalone.size(), extras.size());
        return new PartitionResult(stacks, standalone, extras);
    }
}
