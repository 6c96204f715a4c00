package com.scholary.skynet.upload.upload;

import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * File-backed source.
 *
 * <p>Every range gets its own {@link FileChannel}, positioned at the range start, so parallel
 * sessions never share a read cursor.
 */
final class FileUploadSource implements UploadSource {

  private final Path path;
  private final long size;

  FileUploadSource(Path path) throws IOException {
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException("Not a regular file: " + path);
    }
    this.path = path;
    this.size = Files.size(path);
  }

  @Override
  public long size() {
    return size;
  }

  @Override
  public boolean supportsRangeReads() {
    return true;
  }

  @Override
  public InputStream openRange(long start, long end) throws IOException {
    ByteArrayUploadSource.checkRange(start, end, size);
    FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
    try {
      channel.position(start);
    } catch (IOException e) {
      channel.close();
      throw e;
    }
    return new BoundedInputStream(Channels.newInputStream(channel), end - start);
  }

  /** Stops reading at the end of the range. */
  private static final class BoundedInputStream extends FilterInputStream {

    private long remaining;

    BoundedInputStream(InputStream in, long limit) {
      super(in);
      this.remaining = limit;
    }

    @Override
    public int read() throws IOException {
      if (remaining <= 0) {
        return -1;
      }
      int b = super.read();
      if (b >= 0) {
        remaining--;
      }
      return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
      if (remaining <= 0) {
        return -1;
      }
      int n = super.read(b, off, (int) Math.min(len, remaining));
      if (n > 0) {
        remaining -= n;
      }
      return n;
    }

    @Override
    public int available() throws IOException {
      return (int) Math.min(super.available(), remaining);
    }
  }
}
