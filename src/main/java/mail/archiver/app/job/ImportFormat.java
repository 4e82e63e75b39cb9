package mail.archiver.app.job;

import java.util.Locale;

public enum ImportFormat {
    EML_ZIP,
    MBOX;

    public static ImportFormat fromFileName(String fileName) {
        String lower = fileName == null ? "" : fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".mbox") || lower.endsWith(".mbx")) {
            return MBOX;
        }
        return EML_ZIP;
    }
}
