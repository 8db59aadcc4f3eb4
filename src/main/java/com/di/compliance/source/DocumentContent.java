package com.di.compliance.source;

import java.io.IOException;
import java.io.InputStream;

/**
 * Restartable byte source: every call opens a fresh stream positioned at the first byte.
 */
@FunctionalInterface
public interface DocumentContent {

    InputStream openStream() throws IOException;
}
