package com.imagemonitor.app.archive;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Leitura de um container aberto uma única vez. Implementações devem aceitar
 * {@link #read(ArchiveEntry)} de várias threads.
 */
public interface ArchiveReader extends Closeable {

    Path path();

    /** "ZIP", "RAR". */
    String type();

    List<ArchiveEntry> entries() throws IOException;

    byte[] read(ArchiveEntry entry) throws IOException;
}
