package org.mediascan.service.naming;

import org.mediascan.model.dto.FileStack;
import org.mediascan.model.dto.VideoFileInfo;
import org.mediascan.model.dto.VideoInfo;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VideoTitleGrouperTest {

    @Mock
    private VideoResolver videoResolver;

    @Test
    void group_shouldBuildStacksBeforeStandaloneTitles() {
        VideoFileInfo part1 = VideoFileInfo.builder().path("/movies/Movie (2020)/Movie (2020) cd1.mkv").name("Movie").year(2020).build();
        VideoFileInfo part2 = VideoFileInfo.builder().path("/movies/Movie (2020)/Movie (2020) cd2.mkv").name("Movie").year(2020).build();
        VideoFileInfo standalone = VideoFileInfo.builder().path("/movies/Movie (2020)/Bonus.mkv").name("Bonus").year(2018).build();
        when(videoResolver.resolve(eq(part1.getPath()), eq(false), anyBoolean(), anyString())).thenReturn(part1);
        when(videoResolver.resolve(eq(part2.getPath()), eq(false), anyBoolean(), anyString())).thenReturn(part2);

        FileStack stack = new FileStack("Movie (2020)", false, List.of(part1.getPath(), part2.getPath()));
        List<VideoInfo> titles = new VideoTitleGrouper(videoResolver).group(List.of(stack), List.of(standalone), true, "/movies");

        assertThat(titles).hasSize(2);
        assertThat(titles.get(0).getName()).isEqualTo("Movie (2020)");
        assertThat(titles.get(0).getYear()).isEqualTo(2020);
        assertThat(titles.get(0).getFiles()).containsExactly(part1, part2);
        assertThat(titles.get(1).getName()).isEqualTo("Bonus");
        assertThat(titles.get(1).getYear()).isEqualTo(2018);
        assertThat(titles.get(1).getFiles()).containsExactly(standalone);
    }

    @Test
    void group_shouldDropUnresolvedStackParts() {
        VideoFileInfo part1 = VideoFileInfo.builder().path("/movies/Movie/Movie cd1.mkv").name("Movie").build();
        when(videoResolver.resolve(eq(part1.getPath()), eq(false), anyBoolean(), anyString())).thenReturn(part1);
        when(videoResolver.resolve(eq("/movies/Movie/Movie cd2.mkv"), eq(false), anyBoolean(), anyString())).thenReturn(null);

        FileStack stack = new FileStack("Movie", false, List.of(part1.getPath(), "/movies/Movie/Movie cd2.mkv"));
        List<VideoInfo> titles = new VideoTitleGrouper(videoResolver).group(List.of(stack), List.of(), true, "");

        assertThat(titles).singleElement().extracting(VideoInfo::getFiles).isEqualTo(List.of(part1));
    }

    @Test
    void group_shouldSkipStackWithoutResolvableParts() {
        when(videoResolver.resolve(anyString(), eq(true), anyBoolean(), anyString())).thenReturn(null);

        FileStack stack = new FileStack("Movie", true, List.of("/movies/Movie/Movie disc1", "/movies/Movie/Movie disc2"));

        assertThat(new VideoTitleGrouper(videoResolver).group(List.of(stack), List.of(), true, "")).isEmpty();
    }
}
