package org.mediascan.service.naming;

import org.mediascan.config.NamingProperties;
import org.mediascan.exception.ApiError;
import org.mediascan.model.dto.VideoFileInfo;
import org.mediascan.model.dto.VideoInfo;
import org.mediascan.model.enums.CollectionType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolves the video files of one media item (a movie folder, a season...) into titles: multi-part
 * stacks, standalone titles with their alternate versions, and extras.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VideoListResolver {

    private final NamingProperties namingProperties;
    private final VideoFilePartitioner videoFilePartitioner;
    private final VideoTitleGrouper videoTitleGrouper;
    private final MovieVersionGrouper movieVersionGrouper;
    private final EpisodeVersionGrouper episodeVersionGrouper;

    public List<VideoInfo> resolve(List<VideoFileInfo> videoFiles, CollectionType collectionType) {
        return resolve(videoFiles, namingProperties.isMultiVersion(), namingProperties.isParseName(),
                namingProperties.getLibraryRoot(), collectionType);
    }

    /**
     * @param videoFiles          files of one media item, extras already identified
     * @param supportMultiVersion collapse alternate versions of a title into one entry
     * @param parseName           derive title and year of stack parts from their file names
     * @param libraryRoot         top-level library folder, may be empty
     * @param collectionType      kind of library, {@code null} when unknown
     * @return titles first, extras last
     */
    public List<VideoInfo> resolve(List<VideoFileInfo> videoFiles, boolean supportMultiVersion, boolean parseName,
                                   String libraryRoot, CollectionType collectionType) {
        if (videoFiles == null) {
            throw ApiError.GENERIC_BAD_REQUEST.createException("video file list is required");
        }
        if (supportMultiVersion && collectionType != null && !collectionType.isVideo()) {
            throw ApiError.UNSUPPORTED_COLLECTION_TYPE.createException(collectionType);
        }

        VideoFilePartitioner.PartitionResult partition = videoFilePartitioner.partition(videoFiles);

        List<VideoInfo> titles = videoTitleGrouper.group(partition.stacks(), partition.standalone(), parseName, libraryRoot);

        if (supportMultiVersion) {
            titles = collectionType == CollectionType.TVSHOWS
                    ? episodeVersionGrouper.group(titles)
                    : movieVersionGrouper.group(titles);
        }

        List<VideoInfo> result = new ArrayList<>(titles);
        for (VideoFileInfo extra : partition.extras()) {
            result.add(VideoInfo.of(extra));
        }

        log.debug("Resolved {} files into {} titles and {} extras", videoFiles.size(), titles.size(), partition.extras().size());
        return result;
    }
}
