package org.mediascan.model.dto;

import lombok.Value;

import java.util.List;

/**
 * Consecutive parts of one title, e.g. {@code Movie cd1.mkv} and {@code Movie cd2.mkv}.
 */
@Value
public class FileStack {
    String name;
    List<String> files;
    boolean directoryStack;

    public FileStack(String name, boolean directoryStack, List<String> files) {
        this.name = name;
        this.directoryStack = directoryStack;
        this.files = List.copyOf(files);
    }

    public boolean containsFile(String path, boolean directory) {
        if (directoryStack != directory || path == null) {
            return false;
        }
        return files.stream().anyMatch(file -> file.equalsIgnoreCase(path));
    }
}
