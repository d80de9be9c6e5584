package com.skynet.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Document entity for storing uploaded file metadata.
 *
 * The file bytes live in object storage under {@code blobName}; this row links
 * the blob to its owning account. Record and blob are created and removed together
 * by {@link com.skynet.service.DocumentService}.
 *
 * Database Table: documents
 */
@Entity
@Table(name = "documents", indexes = {
    @Index(name = "idx_document_owner_id", columnList = "owner_id"),
    @Index(name = "idx_document_created_at", columnList = "created_at")
})
@Data
@NoArgsConstructor
@ToString(exclude = "owner")
public class Document {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "owner_id", nullable = false, foreignKey = @ForeignKey(name = "fk_document_owner"))
    private User owner;

    @Column(name = "original_filename", nullable = false, length = 255)
    private String originalFilename;

    /**
     * Object storage key, format {@code {ownerId}/{uuid}.{ext}}.
     */
    @Column(name = "blob_name", nullable = false, unique = true, length = 500)
    private String blobName;

    @Column(name = "blob_url", nullable = false, length = 1000)
    private String blobUrl;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "content_type", length = 150)
    private String contentType;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    public Document(User owner, String originalFilename, String blobName, String blobUrl,
                    Long fileSize, String contentType) {
        this.owner = owner;
        this.originalFilename = originalFilename;
        this.blobName = blobName;
        this.blobUrl = blobUrl;
        this.fileSize = fileSize;
        this.contentType = contentType;
    }
}
