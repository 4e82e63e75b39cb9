package mail.archiver.app.service;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Reads an mbox file one message at a time. Messages start with a "From " line after a
 * blank line (or at the start of the file); quoted "&gt;From " lines are unescaped.
 * Lines are read as ISO-8859-1 so the message bytes pass through unchanged.
 */
public class MboxReader implements Closeable {
    private static final Pattern QUOTED_FROM = Pattern.compile("^>+From ");
    private static final int RETAINED_BUFFER_BYTES = 1024 * 1024;

    private final BufferedReader reader;
    private ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private String pendingSeparator;
    private boolean started;
    private long bytesRead;

    public MboxReader(InputStream in) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.ISO_8859_1));
    }

    /**
     * @return the raw bytes of the next message, or null at the end of the file
     */
    public byte[] nextMessage() throws IOException {
        if (!started) {
            started = true;
            String line = readLine();
            while (line != null && !isSeparator(line, true)) {
                // junk before the first separator
                line = readLine();
            }
            pendingSeparator = line;
        }
        if (pendingSeparator == null) {
            return null;
        }

        boolean previousBlank = false;
        boolean trailingBlank = false;
        String line;
        while ((line = readLine()) != null) {
            if (isSeparator(line, previousBlank)) {
                break;
            }
            if (trailingBlank) {
                // the blank line before a separator belongs to the mbox framing, emit it late
                buffer.write('\n');
                trailingBlank = false;
            }
            if (line.isEmpty()) {
                trailingBlank = true;
            } else {
                writeLine(QUOTED_FROM.matcher(line).find() ? line.substring(1) : line);
            }
            previousBlank = line.isEmpty();
        }
        pendingSeparator = line;

        byte[] message = buffer.toByteArray();
        if (buffer.size() > RETAINED_BUFFER_BYTES) {
            buffer = new ByteArrayOutputStream();
        } else {
            buffer.reset();
        }
        return message;
    }

    public long getBytesRead() {
        return bytesRead;
    }

    /**
     * Counts the messages of an mbox file without keeping them.
     */
    public static int countMessages(Path file) throws IOException {
        int count = 0;
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
            boolean previousBlank = true;
            String line;
            while ((line = in.readLine()) != null) {
                if (previousBlank && line.startsWith("From ")) {
                    count++;
                }
                previousBlank = line.isEmpty();
            }
        }
        return count;
    }

    private boolean isSeparator(String line, boolean previousBlank) {
        return previousBlank && line.startsWith("From ");
    }

    private String readLine() throws IOException {
        String line = reader.readLine();
        if (line != null) {
            bytesRead += line.length() + 1;
        }
        return line;
    }

    private void writeLine(String line) {
        byte[] bytes = line.getBytes(StandardCharsets.ISO_8859_1);
        buffer.write(bytes, 0, bytes.length);
        buffer.write('\n');
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
