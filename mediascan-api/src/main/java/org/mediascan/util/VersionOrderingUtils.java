package org.mediascan.util;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@UtilityClass
public class VersionOrderingUtils {

    // 480p, 720p, 1080i, 2160p...
    private static final Pattern RESOLUTION_PATTERN = Pattern.compile("[0-9]{2}[0-9]+[ip]", Pattern.CASE_INSENSITIVE);

    public boolean hasResolution(String name) {
        return name != null && RESOLUTION_PATTERN.matcher(name).find();
    }

    public String extractResolution(String name) {
        if (name == null) {
            return "";
        }
        Matcher matcher = RESOLUTION_PATTERN.matcher(name);
        return matcher.find() ? matcher.group() : "";
    }

    /**
     * Orders alternate versions of one title. Items whose {@code markerSource} carries a resolution come
     * first, highest resolution first and then by {@code baseName}; the rest follow ordered by
     * {@code baseName}. All comparisons use natural order.
     */
    public <T> List<T> sortByResolution(List<T> items, Function<T, String> markerSource, Function<T, String> baseName) {
        List<T> withResolution = new ArrayList<>();
        List<T> withoutResolution = new ArrayList<>();
        for (T item : items) {
            if (hasResolution(markerSource.apply(item))) {
                withResolution.add(item);
            } else {
                withoutResolution.add(item);
            }
        }

        Comparator<String> natural = AlphanumericComparator.INSTANCE;
        withResolution.sort(Comparator.<T, String>comparing(item -> extractResolution(baseName.apply(item)), natural.reversed())
                .thenComparing(baseName, natural));
        withoutResolution.sort(Comparator.comparing(baseName, natural));

        List<T> ordered = new ArrayList<>(items.size());
        ordered.addAll(withResolution);
        ordered.addAll(withoutResolution);
        return ordered;
    }
}
