package com.skynet.service;

import lombok.Value;

/**
 * Bytes of a stored document together with the metadata needed to serve it.
 */
@Value
public class DocumentContent {
    String filename;
    String contentType;
    byte[] content;
}
