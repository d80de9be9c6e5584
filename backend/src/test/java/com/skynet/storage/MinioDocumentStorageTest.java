package com.skynet.storage;

import com.skynet.config.StorageProperties;
import com.skynet.exception.StorageException;
import io.minio.BucketExistsArgs;
import io.minio.ListObjectsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.Result;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.messages.ErrorResponse;
import io.minio.messages.Item;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("MinioDocumentStorage Unit Tests")
class MinioDocumentStorageTest {

    @Mock
    private MinioClient client;

    private MinioDocumentStorage storage;

    @BeforeEach
    void setUp() {
        storage = new MinioDocumentStorage(client,
                new StorageProperties("http://minio:9000/", "access", "secret", "documents"));
    }

    @Test
    @DisplayName("ensureBucket should create a missing bucket")
    void testEnsureBucket_Creates() throws Exception {
        when(client.bucketExists(any(BucketExistsArgs.class))).thenReturn(false);

        storage.ensureBucket();

        verify(client).makeBucket(any(MakeBucketArgs.class));
    }

    @Test
    @DisplayName("put should upload to the configured bucket and return the blob URL")
    void testPut() throws Exception {
        String url = storage.put(new byte[]{1, 2, 3}, "owner/file.pdf", "application/pdf");

        ArgumentCaptor<PutObjectArgs> args = ArgumentCaptor.forClass(PutObjectArgs.class);
        verify(client).putObject(args.capture());
        assertEquals("documents", args.getValue().bucket());
        assertEquals("owner/file.pdf", args.getValue().object());
        assertEquals("http://minio:9000/documents/owner/file.pdf", url);
    }

    @Test
    @DisplayName("put should wrap client failures in StorageException")
    void testPut_Failure() throws Exception {
        when(client.putObject(any(PutObjectArgs.class))).thenThrow(new IOException("connection refused"));

        StorageException ex = assertThrows(StorageException.class,
                () -> storage.put(new byte[]{1}, "owner/file.pdf", "application/pdf"));
        assertEquals("upload", ex.getOperation());
    }

    @Test
    @DisplayName("list should return the object names under the given prefix")
    void testList_WithPrefix() throws Exception {
        // Arrange
        List<Result<Item>> listing = List.of(result("owner/a.pdf"), result("owner/b.png"));
        when(client.listObjects(any(ListObjectsArgs.class))).thenReturn(listing);

        // Act
        List<String> keys = storage.list("owner/");

        // Assert
        assertEquals(List.of("owner/a.pdf", "owner/b.png"), keys);
        ArgumentCaptor<ListObjectsArgs> args = ArgumentCaptor.forClass(ListObjectsArgs.class);
        verify(client).listObjects(args.capture());
        assertEquals("documents", args.getValue().bucket());
        assertEquals("owner/", args.getValue().prefix());
        assertTrue(args.getValue().recursive());
    }

    @Test
    @DisplayName("list without prefix should cover the whole bucket")
    void testList_NullPrefix() throws Exception {
        // Arrange
        List<Result<Item>> listing = List.of(result("x/y.pdf"));
        when(client.listObjects(any(ListObjectsArgs.class))).thenReturn(listing);

        // Act
        List<String> keys = storage.list(null);

        // Assert
        assertEquals(List.of("x/y.pdf"), keys);
        ArgumentCaptor<ListObjectsArgs> args = ArgumentCaptor.forClass(ListObjectsArgs.class);
        verify(client).listObjects(args.capture());
        assertNull(args.getValue().prefix());
    }

    @Test
    @DisplayName("list should wrap a failing listing in StorageException")
    void testList_Failure() throws Exception {
        // Arrange
        @SuppressWarnings("unchecked")
        Result<Item> broken = mock(Result.class);
        when(broken.get()).thenThrow(new IOException("connection reset"));
        List<Result<Item>> listing = List.of(broken);
        when(client.listObjects(any(ListObjectsArgs.class))).thenReturn(listing);

        // Act & Assert
        StorageException ex = assertThrows(StorageException.class, () -> storage.list("owner/"));
        assertEquals("list", ex.getOperation());
    }

    @Test
    @DisplayName("delete should report failure as false")
    void testDelete_Failure() throws Exception {
        doThrow(new IOException("connection refused")).when(client).removeObject(any(RemoveObjectArgs.class));

        assertFalse(storage.delete("owner/file.pdf"));
    }

    @Test
    @DisplayName("exists should be false for a missing key")
    void testExists_NoSuchKey() throws Exception {
        ErrorResponse errorResponse = mock(ErrorResponse.class);
        when(errorResponse.code()).thenReturn("NoSuchKey");
        ErrorResponseException notFound = mock(ErrorResponseException.class);
        when(notFound.errorResponse()).thenReturn(errorResponse);
        when(client.statObject(any(StatObjectArgs.class))).thenThrow(notFound);

        assertFalse(storage.exists("owner/missing.pdf"));
    }

    @Test
    @DisplayName("isAvailable should be false when the bucket check fails")
    void testIsAvailable_Failure() throws Exception {
        when(client.bucketExists(any(BucketExistsArgs.class))).thenThrow(new IOException("timeout"));

        assertFalse(storage.isAvailable());
    }

    private static Result<Item> result(String objectName) {
        Item item = mock(Item.class);
        when(item.objectName()).thenReturn(objectName);
        return new Result<>(item);
    }
}
