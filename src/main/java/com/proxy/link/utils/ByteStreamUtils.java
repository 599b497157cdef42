package com.proxy.link.utils;

import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

@Slf4j
public class ByteStreamUtils {

    private static final int COPY_BUFFER_SIZE = 16 * 1024;

    /**
     * Reads exactly 'length' bytes from the InputStream into the buffer, starting at offset.
     * Throws EOFException if end of stream is reached prematurely.
     */
    public static void readFully(InputStream in, byte[] buffer, int offset, int length) throws IOException {
        int bytesRead = 0;
        while (bytesRead < length) {
            int result = in.read(buffer, offset + bytesRead, length - bytesRead);
            if (result == -1) {
                throw new EOFException("Reached end of stream prematurely. Expected " + length + " bytes, read " + bytesRead);
            }
            bytesRead += result;
        }
    }

    /**
     * Copies until end of stream, flushing after every read so interactive protocols are not held back.
     *
     * @return number of bytes copied
     */
    public static long pipe(InputStream in, OutputStream out) throws IOException {
        byte[] buffer = new byte[COPY_BUFFER_SIZE];
        long total = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            out.write(buffer, 0, read);
            out.flush();
            total += read;
        }
        return total;
    }

    /**
     * Closes a socket or stream during teardown, where a failing close has no one left to report to.
     */
    public static void close(Closeable closeable, String description) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (IOException e) {
            log.debug("Error closing {}: {}", description, e.getMessage());
        }
    }
}
