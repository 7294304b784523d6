package org.mediascan.config;

import org.mediascan.model.enums.ExtraRuleType;
import org.mediascan.model.enums.ExtraType;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "naming")
@Getter
@Setter
public class NamingProperties {

    /**
     * Collapse alternate versions of the same movie or episode into one entry.
     */
    private boolean multiVersion = true;

    /**
     * Derive title and year from file names. When disabled the file name is used as is.
     */
    private boolean parseName = true;

    /**
     * Top-level library folder. Files directly inside it are never matched by directory-name extra rules.
     */
    private String libraryRoot = "";

    private List<String> videoFileExtensions = new ArrayList<>(List.of(
            "001", "3g2", "3gp", "amv", "asf", "asx", "avi", "bin", "bivx", "divx", "dv", "dvr-ms",
            "f4v", "fli", "flv", "ifo", "img", "iso", "m2t", "m2ts", "m2v", "m4v", "mkv", "mk3d",
            "mov", "mp4", "mpe", "mpeg", "mpg", "mts", "mxf", "nrg", "nsv", "nuv", "ogg", "ogm", "ogv",
            "pva", "qt", "rec", "rm", "rmvb", "strm", "svq3", "tp", "ts", "ty", "viv", "vob", "vp3",
            "webm", "wmv", "wtv", "xvid"
    ));

    private List<String> stubFileExtensions = new ArrayList<>(List.of("disc"));

    /**
     * Release-tag stripping patterns. Each must declare a named group {@code cleaned}.
     */
    private List<String> cleanStrings = new ArrayList<>(List.of(
            "^\\s*(?<cleaned>.+?)[ _\\,\\.\\(\\)\\[\\]\\-](3d|sbs|tab|hsbs|htab|mvc|HDR|HDC|UHD|UltraHD|4k|ac3|dts|custom|dc|divx|divx5|dsr|dsrip|dutch|dvd|dvdrip|dvdscr|dvdscreener|screener|dvdivx|cam|fragment|fs|hdtv|hdrip|hdtvrip|internal|limited|multi|subs|ntsc|ogg|ogm|pal|pdtv|proper|repack|rerip|retail|cd[1-9]|r5|bd5|bd|se|svcd|swedish|german|read.nfo|nfofix|unrated|ws|telesync|ts|telecine|tc|brrip|bdrip|480p|480i|576p|576i|720p|720i|1080p|1080i|2160p|hrhd|hrhdtv|hddvd|bluray|blu-ray|x264|x265|h264|h265|xvid|xvidvd|xxx|www.www|AAC|DTS|\\[.*\\])([ _\\,\\.\\(\\)\\[\\]\\-]|$)",
            "^(?<cleaned>.+?)(\\[.*\\])",
            "^\\s*(?<cleaned>.+?)\\WE[0-9]+(-|~)E?[0-9]+(\\W|$)",
            "^\\s*\\[[^\\]]+\\](?!\\.\\w+$)\\s*(?<cleaned>.+)",
            "^\\s*(?<cleaned>.+?)\\s+-\\s+[0-9]+\\s*$",
            "^\\s*(?<cleaned>.+?)(([-._ ](trailer|sample))|-(scene|clip|behindthescenes|deleted|deletedscene|featurette|short|interview|other|extra))$"
    ));

    /**
     * Title and year patterns: group 1 is the title, group 2 the year.
     */
    private List<String> cleanDateTimes = new ArrayList<>(List.of(
            "(.+[^_\\,\\.\\(\\)\\[\\]\\-])[_\\.\\(\\)\\[\\]\\-](19[0-9]{2}|20[0-9]{2})(?![0-9]+|\\W[0-9]{2}\\W[0-9]{2})([ _\\,\\.\\(\\)\\[\\]\\-][^0-9]|).*(19[0-9]{2}|20[0-9]{2})*",
            "(.+[^_\\,\\.\\(\\)\\[\\]\\-])[ _\\.\\(\\)\\[\\]\\-]+(19[0-9]{2}|20[0-9]{2})(?![0-9]+|\\W[0-9]{2}\\W[0-9]{2})([ _\\,\\.\\(\\)\\[\\]\\-][^0-9]|).*(19[0-9]{2}|20[0-9]{2})*"
    ));

    private List<StackingRule> stackingRules = new ArrayList<>(List.of(
            new StackingRule("^(?<filename>.*?)(?:(?<=[\\]\\)\\}])|[ _.-]+)[\\(\\[]?(?<parttype>cd|dvd|part|pt|dis[ck])[ _.-]*(?<number>[0-9]+)[\\)\\]]?(?:\\.[^.]+)?$", true),
            new StackingRule("^(?<filename>.*?)(?:(?<=[\\]\\)\\}])|[ _.-]+)[\\(\\[]?(?<parttype>cd|dvd|part|pt|dis[ck])[ _.-]*(?<number>[a-d])[\\)\\]]?(?:\\.[^.]+)?$", false)
    ));

    private List<ExtraRuleProperties> extraRules = new ArrayList<>(List.of(
            new ExtraRuleProperties(ExtraType.TRAILER, ExtraRuleType.FILENAME, "trailer"),
            new ExtraRuleProperties(ExtraType.SAMPLE, ExtraRuleType.FILENAME, "sample"),
            new ExtraRuleProperties(ExtraType.TRAILER, ExtraRuleType.SUFFIX, "-trailer"),
            new ExtraRuleProperties(ExtraType.TRAILER, ExtraRuleType.SUFFIX, ".trailer"),
            new ExtraRuleProperties(ExtraType.TRAILER, ExtraRuleType.SUFFIX, "_trailer"),
            new ExtraRuleProperties(ExtraType.TRAILER, ExtraRuleType.SUFFIX, " trailer"),
            new ExtraRuleProperties(ExtraType.SAMPLE, ExtraRuleType.SUFFIX, "-sample"),
            new ExtraRuleProperties(ExtraType.SAMPLE, ExtraRuleType.SUFFIX, ".sample"),
            new ExtraRuleProperties(ExtraType.SAMPLE, ExtraRuleType.SUFFIX, "_sample"),
            new ExtraRuleProperties(ExtraType.SAMPLE, ExtraRuleType.SUFFIX, " sample"),
            new ExtraRuleProperties(ExtraType.SCENE, ExtraRuleType.SUFFIX, "-scene"),
            new ExtraRuleProperties(ExtraType.CLIP, ExtraRuleType.SUFFIX, "-clip"),
            new ExtraRuleProperties(ExtraType.INTERVIEW, ExtraRuleType.SUFFIX, "-interview"),
            new ExtraRuleProperties(ExtraType.BEHIND_THE_SCENES, ExtraRuleType.SUFFIX, "-behindthescenes"),
            new ExtraRuleProperties(ExtraType.DELETED_SCENE, ExtraRuleType.SUFFIX, "-deleted"),
            new ExtraRuleProperties(ExtraType.DELETED_SCENE, ExtraRuleType.SUFFIX, "-deletedscene"),
            new ExtraRuleProperties(ExtraType.FEATURETTE, ExtraRuleType.SUFFIX, "-featurette"),
            new ExtraRuleProperties(ExtraType.SHORT, ExtraRuleType.SUFFIX, "-short"),
            new ExtraRuleProperties(ExtraType.UNKNOWN, ExtraRuleType.SUFFIX, "-other"),
            new ExtraRuleProperties(ExtraType.UNKNOWN, ExtraRuleType.SUFFIX, "-extra"),
            new ExtraRuleProperties(ExtraType.TRAILER, ExtraRuleType.DIRECTORY_NAME, "trailers"),
            new ExtraRuleProperties(ExtraType.THEME_VIDEO, ExtraRuleType.DIRECTORY_NAME, "backdrops"),
            new ExtraRuleProperties(ExtraType.THEME_SONG, ExtraRuleType.DIRECTORY_NAME, "theme-music"),
            new ExtraRuleProperties(ExtraType.BEHIND_THE_SCENES, ExtraRuleType.DIRECTORY_NAME, "behind the scenes"),
            new ExtraRuleProperties(ExtraType.DELETED_SCENE, ExtraRuleType.DIRECTORY_NAME, "deleted scenes"),
            new ExtraRuleProperties(ExtraType.INTERVIEW, ExtraRuleType.DIRECTORY_NAME, "interviews"),
            new ExtraRuleProperties(ExtraType.SCENE, ExtraRuleType.DIRECTORY_NAME, "scenes"),
            new ExtraRuleProperties(ExtraType.SAMPLE, ExtraRuleType.DIRECTORY_NAME, "samples"),
            new ExtraRuleProperties(ExtraType.SHORT, ExtraRuleType.DIRECTORY_NAME, "shorts"),
            new ExtraRuleProperties(ExtraType.FEATURETTE, ExtraRuleType.DIRECTORY_NAME, "featurettes"),
            new ExtraRuleProperties(ExtraType.CLIP, ExtraRuleType.DIRECTORY_NAME, "clips"),
            new ExtraRuleProperties(ExtraType.UNKNOWN, ExtraRuleType.DIRECTORY_NAME, "extras"),
            new ExtraRuleProperties(ExtraType.UNKNOWN, ExtraRuleType.DIRECTORY_NAME, "other")
    ));

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StackingRule {
        /** Must declare the named groups {@code filename}, {@code parttype} and {@code number}. */
        private String pattern;
        private boolean numerical;
    }

    @Getter
    @Setter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExtraRuleProperties {
        private ExtraType type;
        private ExtraRuleType ruleType;
        private String token;
    }
}
