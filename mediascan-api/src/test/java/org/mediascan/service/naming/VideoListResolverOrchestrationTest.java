package org.mediascan.service.naming;

import org.mediascan.config.NamingProperties;
import org.mediascan.model.dto.FileStack;
import org.mediascan.model.dto.VideoFileInfo;
import org.mediascan.model.dto.VideoInfo;
import org.mediascan.model.enums.CollectionType;
import org.mediascan.model.enums.ExtraType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VideoListResolverOrchestrationTest {

    @Mock private VideoFilePartitioner videoFilePartitioner;
    @Mock private VideoTitleGrouper videoTitleGrouper;
    @Mock private MovieVersionGrouper movieVersionGrouper;
    @Mock private EpisodeVersionGrouper episodeVersionGrouper;

    private VideoListResolver resolver;

    private final VideoFileInfo episode = VideoFileInfo.builder().path("/tv/Show/Show S01E01.mkv").name("Show S01E01").build();
    private final VideoFileInfo trailer = VideoFileInfo.builder().path("/tv/Show/trailers/Teaser.mkv").name("Teaser")
            .extraType(ExtraType.TRAILER).build();
    private final List<VideoInfo> titles = List.of(VideoInfo.of(episode));

    @BeforeEach
    void setUp() {
        resolver = new VideoListResolver(new NamingProperties(), videoFilePartitioner, videoTitleGrouper,
                movieVersionGrouper, episodeVersionGrouper);

        List<FileStack> stacks = List.of();
        when(videoFilePartitioner.partition(anyList()))
                .thenReturn(new VideoFilePartitioner.PartitionResult(stacks, List.of(episode), List.of(trailer)));
        when(videoTitleGrouper.group(any(), any(), anyBoolean(), anyString())).thenReturn(titles);
    }

    @Test
    void resolve_shouldUseEpisodeGrouperForShows() {
        when(episodeVersionGrouper.group(titles)).thenReturn(titles);

        List<VideoInfo> result = resolver.resolve(List.of(episode, trailer), true, true, "/tv", CollectionType.TVSHOWS);

        verify(episodeVersionGrouper).group(titles);
        verify(movieVersionGrouper, never()).group(any());
        assertThat(result).hasSize(2);
        assertThat(result.get(1).getExtraType()).isEqualTo(ExtraType.TRAILER);
    }

    @Test
    void resolve_shouldUseMovieGrouperForOtherVideoCollections() {
        when(movieVersionGrouper.group(titles)).thenReturn(titles);

        resolver.resolve(List.of(episode, trailer), true, true, "/videos", CollectionType.HOMEVIDEOS);

        verify(movieVersionGrouper).group(titles);
        verify(episodeVersionGrouper, never()).group(any());
    }

    @Test
    void resolve_shouldSkipGroupersWhenMultiVersionDisabled() {
        List<VideoInfo> result = resolver.resolve(List.of(episode, trailer), false, false, "/tv", CollectionType.TVSHOWS);

        verify(movieVersionGrouper, never()).group(any());
        verify(episodeVersionGrouper, never()).group(any());
        verify(videoTitleGrouper).group(List.of(), List.of(episode), false, "/tv");
        assertThat(result).extracting(VideoInfo::getPrimaryFile).containsExactly(episode, trailer);
    }
}
