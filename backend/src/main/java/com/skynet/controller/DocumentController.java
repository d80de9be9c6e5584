package com.skynet.controller;

import com.skynet.dto.response.DocumentResponse;
import com.skynet.dto.response.MessageResponse;
import com.skynet.entity.Document;
import com.skynet.entity.User;
import com.skynet.service.DocumentContent;
import com.skynet.service.DocumentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST controller for the caller's documents.
 *
 * Endpoints:
 * - POST /documents/upload - Upload a file (multipart part "file")
 * - GET /documents - List documents, newest first
 * - GET /documents/{id} - Document metadata
 * - GET /documents/{id}/download - Document bytes as an attachment
 * - DELETE /documents/{id} - Delete blob and record
 *
 * Every endpoint requires a bearer token and only ever sees documents owned by the
 * token's account; foreign ids answer 404.
 *
 * @see com.skynet.service.DocumentService
 */
@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
@Slf4j
public class DocumentController {

    static final String DELETED_MESSAGE = "Document deleted successfully";

    private final DocumentService documentService;
    private final CurrentAccountResolver currentAccountResolver;

    /**
     * Upload a document.
     *
     * Accepted types: JPEG, PNG, GIF, PDF, DOC, DOCX. Maximum size 10MB.
     *
     * Responses:
     * - 201 Created: document stored
     * - 400 Bad Request: unsupported type, empty or too large
     * - 503 Service Unavailable: storage unreachable
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DocumentResponse> upload(
            @RequestPart("file") MultipartFile file,
            Authentication authentication) {
        User owner = currentAccountResolver.require(authentication);
        log.info("Upload request from account {}: {} ({} bytes, {})",
                owner.getId(), file.getOriginalFilename(), file.getSize(), file.getContentType());

        Document document = documentService.upload(owner, file);
        return ResponseEntity.status(HttpStatus.CREATED).body(DocumentResponse.from(document));
    }

    @GetMapping
    public ResponseEntity<List<DocumentResponse>> list(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "100") int size,
            Authentication authentication) {
        User owner = currentAccountResolver.require(authentication);

        List<DocumentResponse> documents = documentService.list(owner, page, size).stream()
                .map(DocumentResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(documents);
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentResponse> get(@PathVariable UUID id, Authentication authentication) {
        User owner = currentAccountResolver.require(authentication);
        return ResponseEntity.ok(DocumentResponse.from(documentService.get(owner, id)));
    }

    @GetMapping("/{id}/download")
    public ResponseEntity<byte[]> download(@PathVariable UUID id, Authentication authentication) {
        User owner = currentAccountResolver.require(authentication);
        DocumentContent content = documentService.download(owner, id);

        HttpHeaders headers = new HttpHeaders();
        headers.setContentDisposition(ContentDisposition.attachment()
                .filename(content.getFilename(), StandardCharsets.UTF_8)
                .build());
        headers.setContentType(resolveMediaType(content.getContentType()));
        headers.setContentLength(content.getContent().length);

        return new ResponseEntity<>(content.getContent(), headers, HttpStatus.OK);
    }

    /**
     * Delete a document.
     *
     * Responses:
     * - 200 OK: blob and record removed
     * - 404 Not Found: unknown or foreign document
     * - 503 Service Unavailable: blob could not be removed, record kept
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<MessageResponse> delete(@PathVariable UUID id, Authentication authentication) {
        User owner = currentAccountResolver.require(authentication);
        log.info("Delete request for document {} from account {}", id, owner.getId());

        documentService.delete(owner, id);
        return ResponseEntity.ok(new MessageResponse(DELETED_MESSAGE));
    }

    private static MediaType resolveMediaType(String contentType) {
        if (contentType == null) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
        try {
            return MediaType.parseMediaType(contentType);
        } catch (IllegalArgumentException ex) {
            log.debug("Stored content type {} is not parseable", contentType);
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
