package com.skynet.service;

import com.skynet.entity.Document;
import com.skynet.entity.User;
import com.skynet.exception.DocumentNotFoundException;
import com.skynet.exception.InvalidDocumentException;
import com.skynet.exception.StorageException;
import com.skynet.repository.DocumentRepository;
import com.skynet.storage.DocumentStorage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Service for managing an account's documents.
 *
 * Each document is a metadata row in {@code documents} plus a blob in object storage.
 * Every operation is scoped to the owning account: a document id belonging to
 * someone else behaves exactly like an unknown id.
 *
 * Consistency rules:
 * - Upload stores the blob first; if the row cannot be saved the blob is removed again
 * - Delete removes the blob first; if that fails the row is kept and the caller gets a
 *   {@link StorageException}
 *
 * @see com.skynet.storage.DocumentStorage
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Transactional
public class DocumentService {

    static final long MAX_FILE_SIZE = 10L * 1024 * 1024;
    static final int MAX_PAGE_SIZE = 100;
    static final int MAX_FILENAME_LENGTH = 255;

    static final Set<String> ALLOWED_CONTENT_TYPES = Set.of(
            "image/jpeg",
            "image/png",
            "image/gif",
            "application/pdf",
            "application/msword",
            "application/vnd.openxmlformats-officedocument.wordprocessingml.document"
    );

    private static final String DEFAULT_EXTENSION = "bin";

    private final DocumentRepository documentRepository;
    private final DocumentStorage documentStorage;

    /**
     * Upload a file for the given account.
     *
     * This method performs the following steps:
     * 1. Validate content type, emptiness, size and filename length
     * 2. Store the bytes under {@code {ownerId}/{uuid}.{ext}}
     * 3. Persist the metadata row, removing the blob again if that fails
     *
     * @param owner the authenticated, active account
     * @param file the uploaded multipart file
     * @return the saved document
     * @throws InvalidDocumentException if the file is rejected
     * @throws StorageException if the blob store is unavailable
     */
    public Document upload(User owner, MultipartFile file) {
        validate(file);

        String originalFilename = StringUtils.hasText(file.getOriginalFilename())
                ? StringUtils.cleanPath(file.getOriginalFilename())
                : "document";
        if (originalFilename.length() > MAX_FILENAME_LENGTH) {
            throw InvalidDocumentException.filenameTooLong(MAX_FILENAME_LENGTH);
        }
        String blobName = buildBlobName(owner.getId(), originalFilename);

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException ex) {
            throw new UncheckedIOException("Could not read uploaded file", ex);
        }

        String blobUrl = documentStorage.put(content, blobName, file.getContentType());

        try {
            Document document = new Document(owner, originalFilename, blobName, blobUrl,
                    (long) content.length, file.getContentType());
            Document saved = documentRepository.saveAndFlush(document);
            log.info("Stored document {} ({} bytes) for account {}", saved.getId(), content.length, owner.getId());
            return saved;
        } catch (RuntimeException ex) {
            log.error("Saving document record failed, removing blob {}: {}", blobName, ex.getMessage());
            if (!documentStorage.delete(blobName)) {
                log.warn("Orphaned blob left in storage: {}", blobName);
            }
            throw ex;
        }
    }

    /**
     * List the account's documents, newest first.
     *
     * @param page zero-based page index
     * @param size page size, capped at {@value #MAX_PAGE_SIZE}
     */
    @Transactional(readOnly = true)
    public List<Document> list(User owner, int page, int size) {
        int boundedSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        return documentRepository.findByOwnerIdOrderByCreatedAtDesc(
                owner.getId(), PageRequest.of(Math.max(page, 0), boundedSize));
    }

    @Transactional(readOnly = true)
    public Document get(User owner, UUID documentId) {
        return documentRepository.findByIdAndOwnerId(documentId, owner.getId())
                .orElseThrow(() -> new DocumentNotFoundException(documentId));
    }

    @Transactional(readOnly = true)
    public DocumentContent download(User owner, UUID documentId) {
        Document document = get(owner, documentId);
        byte[] content = documentStorage.get(document.getBlobName());
        log.debug("Serving document {} ({} bytes)", documentId, content.length);
        return new DocumentContent(document.getOriginalFilename(), document.getContentType(), content);
    }

    /**
     * Delete a document: blob first, then the metadata row.
     *
     * @throws DocumentNotFoundException if the document is unknown or foreign
     * @throws StorageException if the blob could not be removed; the row is kept
     */
    public void delete(User owner, UUID documentId) {
        Document document = get(owner, documentId);

        if (!documentStorage.delete(document.getBlobName())) {
            log.warn("Blob deletion failed for document {}, keeping record", documentId);
            throw StorageException.deleteFailed(document.getBlobName());
        }

        documentRepository.delete(document);
        log.info("Deleted document {} for account {}", documentId, owner.getId());
    }

    @Transactional(readOnly = true)
    public long countDocuments(User owner) {
        return documentRepository.countByOwnerId(owner.getId());
    }

    private void validate(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType == null || !ALLOWED_CONTENT_TYPES.contains(contentType)) {
            throw InvalidDocumentException.unsupportedType(contentType);
        }
        if (file.isEmpty()) {
            throw InvalidDocumentException.empty();
        }
        if (file.getSize() > MAX_FILE_SIZE) {
            throw InvalidDocumentException.tooLarge(MAX_FILE_SIZE);
        }
    }

    private static String buildBlobName(UUID ownerId, String filename) {
        String extension = StringUtils.getFilenameExtension(filename);
        if (!StringUtils.hasText(extension)) {
            extension = DEFAULT_EXTENSION;
        }
        return ownerId + "/" + UUID.randomUUID() + "." + extension.toLowerCase(Locale.ROOT);
    }
}
