package org.mediascan.model.dto;

public record FileSystemMetadata(String fullName, boolean directory) {
}
