package com.skynet.dto.response;

import com.skynet.entity.Document;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Response DTO for document metadata.
 *
 * Example JSON response:
 * <pre>
 * {
 *   "id": "7d9f2c1e-3b4a-4c5d-8e6f-1a2b3c4d5e6f",
 *   "originalFilename": "report.pdf",
 *   "blobUrl": "http://localhost:9000/documents/550e8400-.../7d9f....pdf",
 *   "fileSize": 52431,
 *   "contentType": "application/pdf",
 *   "createdAt": "2024-02-26T10:30:00"
 * }
 * </pre>
 *
 * Bytes are fetched through {@code GET /documents/{id}/download}, not from blobUrl.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentResponse {

    private UUID id;
    private String originalFilename;
    private String blobUrl;
    private Long fileSize;
    private String contentType;
    private LocalDateTime createdAt;

    public static DocumentResponse from(Document document) {
        return DocumentResponse.builder()
                .id(document.getId())
                .originalFilename(document.getOriginalFilename())
                .blobUrl(document.getBlobUrl())
                .fileSize(document.getFileSize())
                .contentType(document.getContentType())
                .createdAt(document.getCreatedAt())
                .build();
    }
}
